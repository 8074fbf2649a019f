package com.purchasingpower.chemflow.analyzer.chemistry;

import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Element symbols indexed by atomic number.
 */
public final class PeriodicTable {

    private static final List<String> SYMBOLS = List.of(
            "H", "He",
            "Li", "Be", "B", "C", "N", "O", "F", "Ne",
            "Na", "Mg", "Al", "Si", "P", "S", "Cl", "Ar",
            "K", "Ca", "Sc", "Ti", "V", "Cr", "Mn", "Fe", "Co", "Ni", "Cu", "Zn",
            "Ga", "Ge", "As", "Se", "Br", "Kr",
            "Rb", "Sr", "Y", "Zr", "Nb", "Mo", "Tc", "Ru", "Rh", "Pd", "Ag", "Cd",
            "In", "Sn", "Sb", "Te", "I", "Xe",
            "Cs", "Ba",
            "La", "Ce", "Pr", "Nd", "Pm", "Sm", "Eu", "Gd", "Tb", "Dy", "Ho", "Er", "Tm", "Yb", "Lu",
            "Hf", "Ta", "W", "Re", "Os", "Ir", "Pt", "Au", "Hg",
            "Tl", "Pb", "Bi", "Po", "At", "Rn",
            "Fr", "Ra",
            "Ac", "Th", "Pa", "U", "Np", "Pu", "Am", "Cm", "Bk", "Cf", "Es", "Fm", "Md", "No", "Lr",
            "Rf", "Db", "Sg", "Bh", "Hs", "Mt", "Ds", "Rg", "Cn",
            "Nh", "Fl", "Mc", "Lv", "Ts", "Og"
    );

    private static final Map<String, Integer> ATOMIC_NUMBERS = buildIndex();

    private PeriodicTable() {
    }

    public static boolean isElement(String symbol) {
        return ATOMIC_NUMBERS.containsKey(symbol);
    }

    public static OptionalInt atomicNumber(String symbol) {
        Integer z = ATOMIC_NUMBERS.get(symbol);
        return z == null ? OptionalInt.empty() : OptionalInt.of(z);
    }

    private static Map<String, Integer> buildIndex() {
        ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
        for (int i = 0; i < SYMBOLS.size(); i++) {
            builder.put(SYMBOLS.get(i), i + 1);
        }
        return builder.build();
    }
}

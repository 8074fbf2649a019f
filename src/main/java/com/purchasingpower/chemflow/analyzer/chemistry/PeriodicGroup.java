package com.purchasingpower.chemflow.analyzer.chemistry;

import java.util.List;
import java.util.OptionalInt;

/**
 * Periodic-table groups whose members show comparable chemistry down the column.
 * Members are listed by increasing atomic number.
 */
public enum PeriodicGroup {

    ALKALI_METALS("alkali_metals", "Li", "Na", "K", "Rb", "Cs"),
    ALKALINE_EARTH("alkaline_earth", "Be", "Mg", "Ca", "Sr", "Ba"),
    TRANSITION_METALS("transition_metals", "Sc", "Ti", "V", "Cr", "Mn", "Fe", "Co", "Ni", "Cu", "Zn"),
    GROUP_13("group_13", "B", "Al", "Ga", "In", "Tl"),
    GROUP_14("group_14", "C", "Si", "Ge", "Sn", "Pb"),
    PNICTOGENS("pnictogens", "N", "P", "As", "Sb", "Bi"),
    CHALCOGENS("chalcogens", "O", "S", "Se", "Te", "Po"),
    HALOGENS("halogens", "F", "Cl", "Br", "I"),
    NOBLE_GASES("noble_gases", "He", "Ne", "Ar", "Kr", "Xe", "Rn");

    private final String label;
    private final List<String> elements;

    PeriodicGroup(String label, String... elements) {
        this.label = label;
        this.elements = List.of(elements);
    }

    public String getLabel() {
        return label;
    }

    public List<String> getElements() {
        return elements;
    }

    /**
     * Lowest atomic number among this group's elements present in the formula.
     */
    public OptionalInt leadingAtomicNumber(ChemicalFormula formula) {
        return elements.stream()
                .filter(formula::contains)
                .mapToInt(e -> PeriodicTable.atomicNumber(e).orElse(Integer.MAX_VALUE))
                .min();
    }
}

package com.purchasingpower.chemflow.analyzer.chemistry;

import java.util.List;
import java.util.Optional;

/**
 * Coarse element families used to chain cluster sizes across related elements.
 * Every element belongs to at most one family.
 */
public enum ElementFamily {

    NOBLE_GASES("noble_gases", "He", "Ne", "Ar", "Kr", "Xe", "Rn"),
    ALKALI_METALS("alkali_metals", "Li", "Na", "K", "Rb", "Cs"),
    ALKALINE_EARTH("alkaline_earth", "Be", "Mg", "Ca", "Sr", "Ba"),
    TRANSITION_METALS("transition_metals",
            "Sc", "Ti", "V", "Cr", "Mn", "Fe", "Co", "Ni", "Cu", "Zn",
            "Y", "Zr", "Nb", "Mo", "Tc", "Ru", "Rh", "Pd", "Ag", "Cd",
            "Hf", "Ta", "W", "Re", "Os", "Ir", "Pt", "Au", "Hg"),
    HALOGENS("halogens", "F", "Cl", "Br", "I"),
    METALLOIDS("metalloids", "B", "Si", "Ge", "As", "Sb", "Te", "Po"),
    P_BLOCK("p_block", "C", "N", "O", "P", "S"),
    POST_TRANSITION("post_transition", "Al", "Ga", "In", "Tl", "Sn", "Pb", "Bi");

    private final String label;
    private final List<String> elements;

    ElementFamily(String label, String... elements) {
        this.label = label;
        this.elements = List.of(elements);
    }

    public String getLabel() {
        return label;
    }

    public List<String> getElements() {
        return elements;
    }

    public static Optional<ElementFamily> of(String element) {
        for (ElementFamily family : values()) {
            if (family.elements.contains(element)) {
                return Optional.of(family);
            }
        }
        return Optional.empty();
    }
}

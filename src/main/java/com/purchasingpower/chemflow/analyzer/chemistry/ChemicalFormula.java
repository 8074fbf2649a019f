package com.purchasingpower.chemflow.analyzer.chemistry;

import java.util.Map;
import java.util.Set;

/**
 * A parsed chemical formula.
 *
 * @param text          formula as written
 * @param elementCounts element symbol to atom count, in order of first appearance
 */
public record ChemicalFormula(String text, Map<String, Integer> elementCounts) {

    public Set<String> elements() {
        return elementCounts.keySet();
    }

    public boolean contains(String element) {
        return elementCounts.containsKey(element);
    }

    public int totalAtoms() {
        return elementCounts.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Element with the highest atom count; ties go to the element written first.
     */
    public String primaryElement() {
        String primary = null;
        int best = -1;
        for (Map.Entry<String, Integer> e : elementCounts.entrySet()) {
            if (e.getValue() > best) {
                primary = e.getKey();
                best = e.getValue();
            }
        }
        return primary;
    }

    public boolean isElemental() {
        return elementCounts.size() == 1;
    }

    /**
     * Total electron count of the neutral species.
     */
    public int electronCount() {
        int electrons = 0;
        for (Map.Entry<String, Integer> e : elementCounts.entrySet()) {
            electrons += PeriodicTable.atomicNumber(e.getKey()).orElse(0) * e.getValue();
        }
        return electrons;
    }
}

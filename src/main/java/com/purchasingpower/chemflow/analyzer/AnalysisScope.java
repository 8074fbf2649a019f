package com.purchasingpower.chemflow.analyzer;

import com.purchasingpower.chemflow.analyzer.chemistry.FormulaParser;
import com.purchasingpower.chemflow.core.CalculationEntry;

import java.util.List;

/**
 * Population filters applied before analyzers run.
 *
 * @param clusterFilter cluster key to keep, or null for every entry
 * @param elementFilter element symbol the parsed formula must contain, or null
 */
public record AnalysisScope(String clusterFilter, String elementFilter) {

    public static AnalysisScope unrestricted() {
        return new AnalysisScope(null, null);
    }

    public boolean includes(CalculationEntry entry) {
        if (clusterFilter != null && !clusterFilter.equals(entry.clusterKey())) {
            return false;
        }
        return elementFilter == null || FormulaParser.containsElement(entry.formula(), elementFilter);
    }

    public List<CalculationEntry> apply(List<CalculationEntry> population) {
        if (clusterFilter == null && elementFilter == null) {
            return population;
        }
        return population.stream().filter(this::includes).toList();
    }
}

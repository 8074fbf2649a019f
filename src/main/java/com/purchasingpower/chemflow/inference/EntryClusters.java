package com.purchasingpower.chemflow.inference;

import com.purchasingpower.chemflow.core.CalculationEntry;

import java.util.List;
import java.util.Map;

/**
 * Result of grouping an entry population into workflow clusters.
 *
 * @param population  validated, de-duplicated entries in input order
 * @param clusters    cluster key to member entries; keys in first-seen order, members in input order
 * @param unclustered entries without a cluster key (never adjacency-classified)
 */
public record EntryClusters(
        List<CalculationEntry> population,
        Map<String, List<CalculationEntry>> clusters,
        List<CalculationEntry> unclustered
) {

    public List<CalculationEntry> cluster(String clusterKey) {
        return clusters.getOrDefault(clusterKey, List.of());
    }

    public boolean containsEntry(String entryId) {
        return population.stream().anyMatch(e -> e.id().equals(entryId));
    }
}

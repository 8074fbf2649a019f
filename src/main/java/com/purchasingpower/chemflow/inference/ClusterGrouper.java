package com.purchasingpower.chemflow.inference;

import com.google.common.base.Preconditions;
import com.purchasingpower.chemflow.core.CalculationEntry;
import com.purchasingpower.chemflow.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates an entry population and partitions it into workflow clusters.
 *
 * <p>The partition is stable: cluster keys appear in first-seen order and each
 * cluster keeps the input order of its members. Entries without a cluster key are
 * set aside; they still take part in cross-cluster analyzers.
 *
 * <p>Integrity rules:
 * <ul>
 *   <li>null or blank id: rejected</li>
 *   <li>same id, different fields: rejected</li>
 *   <li>same id, identical fields: rejected, or collapsed with a warning when
 *       {@code collapseIdenticalDuplicates} is set</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class ClusterGrouper {

    public EntryClusters group(List<CalculationEntry> entries, boolean collapseIdenticalDuplicates) {
        Preconditions.checkNotNull(entries, "Entries cannot be null");

        Map<String, CalculationEntry> byId = new LinkedHashMap<>();
        int collapsed = 0;

        for (CalculationEntry entry : entries) {
            if (entry == null) {
                throw new InvalidInputException("Entry population contains a null entry", List.of());
            }
            String id = entry.id();
            if (id == null || id.isBlank()) {
                throw new InvalidInputException("Entry with missing or blank id (type='" + entry.type() + "')", id);
            }

            CalculationEntry existing = byId.putIfAbsent(id, entry);
            if (existing == null) {
                continue;
            }
            if (!existing.equals(entry)) {
                throw new InvalidInputException(
                        "Duplicate entry id with conflicting fields: " + id, id);
            }
            if (!collapseIdenticalDuplicates) {
                throw new InvalidInputException("Duplicate entry id: " + id, id);
            }
            collapsed++;
            log.warn("Duplicate entry id {} with identical fields, keeping first occurrence", id);
        }

        List<CalculationEntry> population = List.copyOf(byId.values());
        Map<String, List<CalculationEntry>> clusters = new LinkedHashMap<>();
        List<CalculationEntry> unclustered = new ArrayList<>();

        for (CalculationEntry entry : population) {
            if (entry.isClustered()) {
                clusters.computeIfAbsent(entry.clusterKey(), k -> new ArrayList<>()).add(entry);
            } else {
                unclustered.add(entry);
            }
        }

        Map<String, List<CalculationEntry>> frozen = new LinkedHashMap<>();
        clusters.forEach((key, members) -> frozen.put(key, List.copyOf(members)));

        log.info("Grouped {} entries into {} clusters ({} unclustered, {} duplicates collapsed)",
                population.size(), frozen.size(), unclustered.size(), collapsed);

        return new EntryClusters(population, Collections.unmodifiableMap(frozen), List.copyOf(unclustered));
    }
}

package com.purchasingpower.chemflow.graph;

import com.purchasingpower.chemflow.core.CalculationEntry;
import com.purchasingpower.chemflow.core.EdgeKey;
import com.purchasingpower.chemflow.core.EdgeProperties;
import com.purchasingpower.chemflow.core.PersistedEdge;
import com.purchasingpower.chemflow.core.RelationshipCandidate;
import com.purchasingpower.chemflow.core.RelationshipKind;
import com.purchasingpower.chemflow.exception.UpsertException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Interface for the property graph that receives inferred relationships.
 *
 * <p>Abstracts the graph database behind the one mutation the engine needs:
 * an upsert keyed by {@code (fromId, toId, kind)}. Implementations must keep at
 * most one edge per key: an existing edge gets its properties overwritten,
 * never a parallel twin.
 *
 * @since 1.0.0
 */
public interface GraphStore {

    // =========================================================================
    // Mutations
    // =========================================================================

    /**
     * Create the edge if absent, otherwise replace its properties.
     *
     * @param fromId     source entry id
     * @param toId       target entry id
     * @param kind       relationship type
     * @param properties edge properties, replacing any previous ones
     * @throws UpsertException if the store rejects or fails the mutation
     */
    void upsertEdge(String fromId, String toId, RelationshipKind kind, Map<String, Object> properties);

    /**
     * Upsert a batch of edges, reporting each edge separately.
     *
     * <p>A failing edge never prevents the remaining edges of the batch from being written,
     * whatever runtime exception the store raises for it.
     *
     * @param batch candidates with unique keys
     * @return one outcome per candidate, in batch order
     */
    default List<EdgeUpsertOutcome> upsertEdges(List<RelationshipCandidate> batch) {
        List<EdgeUpsertOutcome> outcomes = new ArrayList<>(batch.size());
        for (RelationshipCandidate candidate : batch) {
            try {
                upsertEdge(candidate.fromId(), candidate.toId(), candidate.kind(), EdgeProperties.of(candidate));
                outcomes.add(EdgeUpsertOutcome.ok(candidate));
            } catch (RuntimeException e) {
                outcomes.add(EdgeUpsertOutcome.failed(candidate, e));
            }
        }
        return outcomes;
    }

    /**
     * Create or update entry nodes with their metadata.
     *
     * @param entries entries to store
     * @return number of nodes written
     * @throws UpsertException if the batch could not be written
     */
    int upsertEntries(List<CalculationEntry> entries);

    // =========================================================================
    // Read-back
    // =========================================================================

    /**
     * All relationship edges of a known {@link RelationshipKind}, ordered by key.
     */
    List<PersistedEdge> findEdges();

    /**
     * Number of relationship edges of a known {@link RelationshipKind}.
     */
    long countEdges();

    /**
     * Look up a single edge.
     */
    default Optional<PersistedEdge> findEdge(EdgeKey key) {
        return findEdges().stream().filter(e -> e.key().equals(key)).findFirst();
    }
}

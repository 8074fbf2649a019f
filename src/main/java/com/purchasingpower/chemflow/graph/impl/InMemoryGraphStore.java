package com.purchasingpower.chemflow.graph.impl;

import com.purchasingpower.chemflow.core.CalculationEntry;
import com.purchasingpower.chemflow.core.EdgeKey;
import com.purchasingpower.chemflow.core.PersistedEdge;
import com.purchasingpower.chemflow.core.RelationshipKind;
import com.purchasingpower.chemflow.graph.GraphStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local GraphStore for dry runs and tests. The map is keyed by
 * {@link EdgeKey}, so a second upsert of a key replaces the first.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "app.graph", name = "store", havingValue = "memory")
public class InMemoryGraphStore implements GraphStore {

    private final Map<EdgeKey, Map<String, Object>> edges = new ConcurrentHashMap<>();
    private final Map<String, CalculationEntry> entries = new ConcurrentHashMap<>();

    @Override
    public void upsertEdge(String fromId, String toId, RelationshipKind kind, Map<String, Object> properties) {
        EdgeKey key = new EdgeKey(fromId, toId, kind);
        edges.put(key, Map.copyOf(properties));
        log.trace("Upserted {}", key);
    }

    @Override
    public int upsertEntries(List<CalculationEntry> batch) {
        batch.forEach(entry -> entries.put(entry.id(), entry));
        return batch.size();
    }

    @Override
    public List<PersistedEdge> findEdges() {
        return edges.entrySet().stream()
                .map(e -> new PersistedEdge(e.getKey(), e.getValue()))
                .sorted(Comparator.comparing(PersistedEdge::key))
                .toList();
    }

    @Override
    public long countEdges() {
        return edges.size();
    }

    @Override
    public Optional<PersistedEdge> findEdge(EdgeKey key) {
        return Optional.ofNullable(edges.get(key)).map(props -> new PersistedEdge(key, props));
    }

    public Optional<CalculationEntry> findEntry(String entryId) {
        return Optional.ofNullable(entries.get(entryId));
    }

    public void clear() {
        edges.clear();
        entries.clear();
    }
}

package com.purchasingpower.chemflow.core;

import java.util.Map;

/**
 * An edge as read back from the graph store.
 *
 * @param key        (from, to, kind) identity
 * @param properties every property stored on the relationship, including
 *                   {@code confidence} and {@code cluster_key}
 */
public record PersistedEdge(EdgeKey key, Map<String, Object> properties) {

    public double confidence() {
        Object value = properties.get(EdgeProperties.CONFIDENCE);
        return value instanceof Number number ? number.doubleValue() : 0.0;
    }

    public String clusterKey() {
        Object value = properties.get(EdgeProperties.CLUSTER_KEY);
        return value == null ? "" : value.toString();
    }
}

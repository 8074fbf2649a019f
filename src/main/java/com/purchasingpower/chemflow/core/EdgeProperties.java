package com.purchasingpower.chemflow.core;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Property names written on every relationship and the mapping from a candidate
 * to its property map.
 */
public final class EdgeProperties {

    public static final String CONFIDENCE = "confidence";
    public static final String CLUSTER_KEY = "cluster_key";
    public static final String REASONING = "reasoning";

    private EdgeProperties() {
    }

    /**
     * Build the full property map for a candidate. Producer attributes come first;
     * the reserved keys always win over an attribute of the same name.
     */
    public static Map<String, Object> of(RelationshipCandidate candidate) {
        Map<String, Object> properties = new LinkedHashMap<>(candidate.attributes());
        properties.put(CONFIDENCE, candidate.confidence());
        properties.put(CLUSTER_KEY, candidate.clusterKey());
        properties.put(REASONING, candidate.reasoning());
        return properties;
    }
}

package com.purchasingpower.chemflow.core;

/**
 * Closed set of relationship types written to the graph.
 *
 * <p>The enum constant name is used verbatim as the relationship type in Cypher,
 * so constants must stay valid unquoted identifiers.
 */
public enum RelationshipKind {

    // Adjacency-based workflow relationships (within one cluster)
    PROVIDES_STRUCTURE(true),
    PROVIDES_ELECTRONIC_STRUCTURE(true),
    PROVIDES_INPUT_DATA(true),
    SIMILAR_CALCULATION(true),
    WORKFLOW_STEP(true),

    // Analyzer-owned relationships (full population)
    PERIODIC_TREND(false),
    CLUSTER_SIZE_SERIES(false),
    PARAMETER_STUDY(false),
    ISOELECTRONIC(false),
    SAME_MATERIAL(false);

    private final boolean adjacency;

    RelationshipKind(boolean adjacency) {
        this.adjacency = adjacency;
    }

    /**
     * Whether this kind is produced by the pairwise classifier for stage-adjacent entries.
     */
    public boolean isAdjacency() {
        return adjacency;
    }
}

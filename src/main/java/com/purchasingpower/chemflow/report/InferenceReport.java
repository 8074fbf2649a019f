package com.purchasingpower.chemflow.report;

import java.util.List;

/**
 * Result of one inference run.
 *
 * <p>Store failures never abort a run; they are listed in {@link #getEdgesFailed()}.
 * A run that failed on invalid input throws instead of producing a report.
 *
 * @since 1.0.0
 */
public interface InferenceReport {

    /** Edges written successfully. */
    int getEdgesUpserted();

    List<FailedEdge> getEdgesFailed();

    /** Candidates produced by adjacency classification and analyzers, before de-duplication. */
    int getCandidatesConsidered();

    int getCandidatesAfterDeduplication();

    int getCandidatesBelowThreshold();

    int getEntryNodesUpserted();

    int getEntryNodesFailed();

    long getDurationMs();

    boolean isSuccess();
}

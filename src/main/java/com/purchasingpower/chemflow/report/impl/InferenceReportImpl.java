package com.purchasingpower.chemflow.report.impl;

import com.purchasingpower.chemflow.report.FailedEdge;
import com.purchasingpower.chemflow.report.InferenceReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Default implementation of InferenceReport.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InferenceReportImpl implements InferenceReport {

    private int edgesUpserted;

    @Builder.Default
    private List<FailedEdge> edgesFailed = new ArrayList<>();

    private int candidatesConsidered;
    private int candidatesAfterDeduplication;
    private int candidatesBelowThreshold;
    private int entryNodesUpserted;
    private int entryNodesFailed;
    private long durationMs;

    @Override
    public boolean isSuccess() {
        return edgesFailed.isEmpty() && entryNodesFailed == 0;
    }
}

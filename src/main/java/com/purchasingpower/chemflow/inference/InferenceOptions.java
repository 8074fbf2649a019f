package com.purchasingpower.chemflow.inference;

import com.purchasingpower.chemflow.analyzer.AnalysisScope;
import com.purchasingpower.chemflow.config.InferenceProperties;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Per-run options of the inference engine.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class InferenceOptions {

    @Builder.Default
    double minConfidence = 0.0;

    /** Blank or null processes every cluster. */
    String clusterFilter;

    /** Blank or null applies no element restriction to analyzers. */
    String elementFilter;

    @Builder.Default
    boolean collapseIdenticalDuplicates = false;

    @Builder.Default
    boolean upsertEntryNodes = true;

    @Builder.Default
    Set<String> disabledAnalyzers = Set.of();

    public static InferenceOptions defaults() {
        return InferenceOptions.builder().build();
    }

    public static InferenceOptions fromProperties(InferenceProperties properties) {
        return InferenceOptions.builder()
                .minConfidence(properties.getMinConfidence())
                .clusterFilter(properties.getClusterFilter())
                .elementFilter(properties.getElementFilter())
                .collapseIdenticalDuplicates(properties.isCollapseIdenticalDuplicates())
                .upsertEntryNodes(properties.isUpsertEntryNodes())
                .disabledAnalyzers(Set.copyOf(properties.getDisabledAnalyzers()))
                .build();
    }

    public boolean hasClusterFilter() {
        return clusterFilter != null && !clusterFilter.isBlank();
    }

    public AnalysisScope analysisScope() {
        return new AnalysisScope(
                hasClusterFilter() ? clusterFilter.trim() : null,
                elementFilter == null || elementFilter.isBlank() ? null : elementFilter.trim());
    }
}

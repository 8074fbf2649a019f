package com.purchasingpower.chemflow.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * One computational-chemistry calculation record.
 *
 * <p>Entries are read-only inputs for a single inference run. {@code formula} and
 * {@code clusterKey} are normalized so that absent and empty mean the same thing
 * ("unknown" / "not part of any workflow cluster").
 *
 * @param id             opaque, globally unique identity key
 * @param type           free-text calculation kind, only ever matched lexically
 * @param formula        chemical formula, empty when unknown
 * @param clusterKey     originating upload/dataset, empty when the entry belongs to no cluster
 * @param hasInputFiles  whether input files were found for the calculation
 * @param hasOutputFiles whether output files were found for the calculation
 * @since 1.0.0
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record CalculationEntry(
        @JsonProperty("id") String id,
        @JsonProperty("type") String type,
        @JsonProperty("formula") String formula,
        @JsonProperty("cluster_key") String clusterKey,
        @JsonProperty("has_input_files") boolean hasInputFiles,
        @JsonProperty("has_output_files") boolean hasOutputFiles
) {

    public CalculationEntry {
        type = type == null ? "" : type;
        formula = formula == null ? "" : formula.trim();
        clusterKey = clusterKey == null ? "" : clusterKey.trim();
    }

    public boolean hasFormula() {
        return !formula.isEmpty();
    }

    public boolean isClustered() {
        return !clusterKey.isEmpty();
    }
}

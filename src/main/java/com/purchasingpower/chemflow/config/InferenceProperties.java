package com.purchasingpower.chemflow.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Relationship inference settings.
 *
 * <p>Properties are loaded from the {@code app.inference} namespace in application.yml.
 * Example configuration:
 * <pre>
 * app:
 *   inference:
 *     min-confidence: 0.6
 *     cluster-filter: upload-42
 *     element-filter: Au
 *     upsert-batch-size: 500
 *     disabled-analyzers: [isoelectronic]
 * </pre>
 *
 * @since 1.0.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.inference")
public class InferenceProperties {

    /**
     * Candidates scoring below this are dropped before upsert.
     * Range: 0.0-1.0
     * Default: 0.0
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minConfidence = 0.0;

    /**
     * Restrict processing to a single cluster key. Blank means all clusters.
     */
    private String clusterFilter;

    /**
     * Restrict analyzers to entries whose formula contains this element symbol.
     */
    private String elementFilter;

    /**
     * Tolerate repeated ids whose records are identical, keeping the first one.
     * Repeated ids with differing records always fail the run.
     */
    private boolean collapseIdenticalDuplicates = false;

    /**
     * Number of edges sent to the graph store per batch.
     * Default: 500
     */
    @Min(1)
    private int upsertBatchSize = 500;

    /**
     * MERGE an Entry node with metadata for every entry before writing edges.
     */
    private boolean upsertEntryNodes = true;

    /**
     * Worker threads used to classify clusters concurrently.
     * Default: 4
     */
    @Min(1)
    private int parallelism = 4;

    /**
     * Emit the cross-element cluster-size progression (lowest-confidence tier).
     */
    private boolean globalSizeSeries = false;

    /**
     * Analyzer names to skip, e.g. {@code periodic-trend}.
     */
    private List<String> disabledAnalyzers = new ArrayList<>();

    /**
     * JSON file of entries processed on startup. Blank leaves the runner idle.
     */
    private String inputFile;
}

package com.purchasingpower.chemflow.inference;

import com.google.common.base.Preconditions;
import com.purchasingpower.chemflow.analyzer.AnalyzerRegistry;
import com.purchasingpower.chemflow.core.CalculationEntry;
import com.purchasingpower.chemflow.core.RelationshipCandidate;
import com.purchasingpower.chemflow.exception.InvalidInputException;
import com.purchasingpower.chemflow.graph.GraphEdgeBuilder;
import com.purchasingpower.chemflow.graph.GraphStore;
import com.purchasingpower.chemflow.report.InferenceReport;
import com.purchasingpower.chemflow.report.impl.InferenceReportImpl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Entry point of relationship inference.
 *
 * <p>A run goes through these phases:
 * <ol>
 *   <li>validate and group entries into clusters (fatal on invalid input)</li>
 *   <li>per cluster, stage-sort the members and classify each adjacent pair;
 *       clusters are classified concurrently on the inference executor</li>
 *   <li>run the registered analyzers over the whole population</li>
 *   <li>optionally upsert Entry nodes</li>
 *   <li>de-duplicate, threshold and upsert edges</li>
 * </ol>
 * Phases 1 to 3 touch no shared state; everything mutable happens in 4 and 5,
 * after every input check has passed.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class RelationshipInferenceEngine {

    private final ClusterGrouper clusterGrouper;
    private final StageClassifier stageClassifier;
    private final PairwiseRelationshipClassifier pairwiseClassifier;
    private final AnalyzerRegistry analyzerRegistry;
    private final GraphEdgeBuilder edgeBuilder;
    private final GraphStore graphStore;
    private final Executor executor;

    public RelationshipInferenceEngine(ClusterGrouper clusterGrouper,
                                       StageClassifier stageClassifier,
                                       PairwiseRelationshipClassifier pairwiseClassifier,
                                       AnalyzerRegistry analyzerRegistry,
                                       GraphEdgeBuilder edgeBuilder,
                                       GraphStore graphStore,
                                       @Qualifier("inferenceExecutor") Executor executor) {
        this.clusterGrouper = clusterGrouper;
        this.stageClassifier = stageClassifier;
        this.pairwiseClassifier = pairwiseClassifier;
        this.analyzerRegistry = analyzerRegistry;
        this.edgeBuilder = edgeBuilder;
        this.graphStore = graphStore;
        this.executor = executor;
    }

    // =========================================================================
    // Pure phases
    // =========================================================================

    /**
     * Every candidate the run would consider, before de-duplication and threshold.
     * Adjacency candidates come first (cluster order, then stage order), then analyzer
     * candidates in analyzer-name order.
     *
     * @throws InvalidInputException if the population violates an id rule
     */
    public List<RelationshipCandidate> generateCandidates(List<CalculationEntry> entries, InferenceOptions options) {
        EntryClusters clusters = clusterGrouper.group(entries, options.isCollapseIdenticalDuplicates());
        return generateCandidates(clusters, options);
    }

    /**
     * Dry run: the candidates that would be upserted, de-duplicated and thresholded,
     * without touching the graph store.
     */
    public List<RelationshipCandidate> infer(List<CalculationEntry> entries, InferenceOptions options) {
        List<RelationshipCandidate> unique = edgeBuilder.deduplicate(generateCandidates(entries, options));
        return edgeBuilder.applyThreshold(unique, options.getMinConfidence());
    }

    private List<RelationshipCandidate> generateCandidates(EntryClusters clusters, InferenceOptions options) {
        List<RelationshipCandidate> candidates = new ArrayList<>(classifyClusters(clusters, options));
        candidates.addAll(analyzerRegistry.runAll(
                clusters.population(), options.analysisScope(), options.getDisabledAnalyzers()));
        return candidates;
    }

    private List<RelationshipCandidate> classifyClusters(EntryClusters clusters, InferenceOptions options) {
        Map<String, List<CalculationEntry>> selected = clusters.clusters();
        if (options.hasClusterFilter()) {
            String filter = options.getClusterFilter().trim();
            if (!selected.containsKey(filter)) {
                log.warn("Cluster filter '{}' matches no cluster", filter);
                return List.of();
            }
            selected = Map.of(filter, clusters.cluster(filter));
        }

        List<CompletableFuture<List<RelationshipCandidate>>> futures = new ArrayList<>();
        selected.forEach((clusterKey, members) -> futures.add(
                CompletableFuture.supplyAsync(() -> classifyCluster(clusterKey, members), executor)));

        List<RelationshipCandidate> candidates = new ArrayList<>();
        for (CompletableFuture<List<RelationshipCandidate>> future : futures) {
            candidates.addAll(join(future));
        }
        log.info("Classified {} clusters into {} adjacency candidates", selected.size(), candidates.size());
        return candidates;
    }

    /**
     * Stage-sort one cluster and classify each adjacent pair. Reads only the cluster's own entries.
     */
    List<RelationshipCandidate> classifyCluster(String clusterKey, List<CalculationEntry> members) {
        if (members.size() < 2) {
            return List.of();
        }
        List<CalculationEntry> ordered = stageClassifier.sortByStage(members);
        List<RelationshipCandidate> candidates = new ArrayList<>(ordered.size() - 1);
        for (int i = 0; i + 1 < ordered.size(); i++) {
            candidates.add(pairwiseClassifier.classify(ordered.get(i), ordered.get(i + 1), clusterKey));
        }
        log.debug("Cluster {}: {} entries, {} candidates", clusterKey, members.size(), candidates.size());
        return candidates;
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    // =========================================================================
    // Full run
    // =========================================================================

    public InferenceReport run(List<CalculationEntry> entries, InferenceOptions options) {
        return run(entries, List.of(), options);
    }

    /**
     * Infer relationships and write them to the graph store.
     *
     * @param entries   entry population
     * @param external  candidates produced outside the engine, published through the
     *                  same de-duplication path; their ids must belong to the population
     * @param options   run options
     * @throws InvalidInputException if the population or an external candidate is invalid;
     *                               thrown before any store mutation
     */
    public InferenceReport run(List<CalculationEntry> entries,
                               Collection<RelationshipCandidate> external,
                               InferenceOptions options) {
        Preconditions.checkNotNull(entries, "Entries cannot be null");
        Preconditions.checkNotNull(external, "External candidates cannot be null");
        Preconditions.checkNotNull(options, "Options cannot be null");
        long startTime = System.currentTimeMillis();

        log.info("Starting relationship inference: {} entries, {} external candidates", entries.size(), external.size());

        EntryClusters clusters = clusterGrouper.group(entries, options.isCollapseIdenticalDuplicates());
        validateExternal(clusters, external);

        List<RelationshipCandidate> candidates = generateCandidates(clusters, options);
        candidates.addAll(external);

        int entryNodesUpserted = 0;
        int entryNodesFailed = 0;
        if (options.isUpsertEntryNodes()) {
            List<CalculationEntry> nodes = options.hasClusterFilter()
                    ? clusters.cluster(options.getClusterFilter().trim())
                    : clusters.population();
            try {
                entryNodesUpserted = graphStore.upsertEntries(nodes);
            } catch (RuntimeException e) {
                entryNodesFailed = nodes.size();
                log.error("Entry node upsert failed for {} entries, continuing with edges: {}",
                        nodes.size(), e.getMessage());
            }
        }

        GraphEdgeBuilder.PublishResult published = edgeBuilder.publish(candidates, options.getMinConfidence());
        long durationMs = System.currentTimeMillis() - startTime;

        InferenceReport report = InferenceReportImpl.builder()
                .edgesUpserted(published.upserted())
                .edgesFailed(published.failed())
                .candidatesConsidered(candidates.size())
                .candidatesAfterDeduplication(published.afterDedup())
                .candidatesBelowThreshold(published.belowThreshold())
                .entryNodesUpserted(entryNodesUpserted)
                .entryNodesFailed(entryNodesFailed)
                .durationMs(durationMs)
                .build();

        log.info("✅ Inference complete in {}ms: {} edges upserted, {} failed, {} candidates considered",
                durationMs, report.getEdgesUpserted(), report.getEdgesFailed().size(), report.getCandidatesConsidered());
        return report;
    }

    private static void validateExternal(EntryClusters clusters, Collection<RelationshipCandidate> external) {
        if (external.isEmpty()) {
            return;
        }
        Set<String> known = new HashSet<>();
        clusters.population().forEach(entry -> known.add(entry.id()));

        Set<String> unknown = new LinkedHashSet<>();
        for (RelationshipCandidate candidate : external) {
            if (!known.contains(candidate.fromId())) {
                unknown.add(candidate.fromId());
            }
            if (!known.contains(candidate.toId())) {
                unknown.add(candidate.toId());
            }
        }
        if (!unknown.isEmpty()) {
            throw new InvalidInputException("External candidates reference unknown entries: " + unknown,
                    List.copyOf(unknown));
        }
    }
}

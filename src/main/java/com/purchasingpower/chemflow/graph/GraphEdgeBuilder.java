package com.purchasingpower.chemflow.graph;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.purchasingpower.chemflow.config.InferenceProperties;
import com.purchasingpower.chemflow.core.EdgeKey;
import com.purchasingpower.chemflow.core.RelationshipCandidate;
import com.purchasingpower.chemflow.report.FailedEdge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns relationship candidates into graph edges.
 *
 * <p>Three steps:
 * <ol>
 *   <li>de-duplicate by {@code (fromId, toId, kind)}, keeping the highest confidence;
 *       on a tie the earliest candidate wins</li>
 *   <li>drop candidates below the confidence threshold</li>
 *   <li>upsert the survivors in bounded batches</li>
 * </ol>
 * Store failures are collected per edge and never stop the remaining batches.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class GraphEdgeBuilder {

    private final GraphStore graphStore;
    private final int batchSize;

    @Autowired
    public GraphEdgeBuilder(GraphStore graphStore, InferenceProperties properties) {
        this(graphStore, properties.getUpsertBatchSize());
    }

    public GraphEdgeBuilder(GraphStore graphStore, int batchSize) {
        Preconditions.checkNotNull(graphStore, "GraphStore cannot be null");
        Preconditions.checkArgument(batchSize > 0, "Batch size must be positive, got %s", batchSize);
        this.graphStore = graphStore;
        this.batchSize = batchSize;
    }

    /**
     * Outcome of a publish.
     *
     * @param upserted        edges the store accepted
     * @param failed          edges the store rejected, with reasons
     * @param afterDedup      unique keys left after de-duplication
     * @param belowThreshold  unique candidates dropped by the threshold
     */
    public record PublishResult(int upserted, List<FailedEdge> failed, int afterDedup, int belowThreshold) {
    }

    /**
     * Collapse candidates sharing a key. Output follows the first-seen order of each key.
     */
    public List<RelationshipCandidate> deduplicate(List<RelationshipCandidate> candidates) {
        Map<EdgeKey, RelationshipCandidate> best = new LinkedHashMap<>();
        for (RelationshipCandidate candidate : candidates) {
            best.merge(candidate.key(), candidate,
                    (kept, incoming) -> incoming.confidence() > kept.confidence() ? incoming : kept);
        }
        return new ArrayList<>(best.values());
    }

    public List<RelationshipCandidate> applyThreshold(List<RelationshipCandidate> candidates, double minConfidence) {
        return candidates.stream()
                .filter(c -> c.confidence() >= minConfidence)
                .toList();
    }

    public PublishResult publish(List<RelationshipCandidate> candidates, double minConfidence) {
        List<RelationshipCandidate> unique = deduplicate(candidates);
        List<RelationshipCandidate> accepted = applyThreshold(unique, minConfidence);
        int belowThreshold = unique.size() - accepted.size();

        log.info("Publishing {} edges ({} candidates, {} after de-duplication, {} below threshold {})",
                accepted.size(), candidates.size(), unique.size(), belowThreshold, minConfidence);

        int upserted = 0;
        List<FailedEdge> failed = new ArrayList<>();

        for (List<RelationshipCandidate> batch : Lists.partition(accepted, batchSize)) {
            for (EdgeUpsertOutcome outcome : upsertBatch(batch)) {
                if (outcome.success()) {
                    upserted++;
                } else {
                    failed.add(new FailedEdge(outcome.candidate().key(), outcome.error()));
                    log.warn("Edge {} failed: {}", outcome.candidate().key(), outcome.error());
                }
            }
        }

        if (!failed.isEmpty()) {
            log.warn("⚠️  {} of {} edges failed to upsert", failed.size(), accepted.size());
        }
        return new PublishResult(upserted, List.copyOf(failed), unique.size(), belowThreshold);
    }

    /**
     * A store that fails the whole batch (for example a closed driver) fails every edge in it;
     * later batches are still attempted.
     */
    private List<EdgeUpsertOutcome> upsertBatch(List<RelationshipCandidate> batch) {
        try {
            return graphStore.upsertEdges(batch);
        } catch (RuntimeException e) {
            log.error("Batch of {} edges failed: {}", batch.size(), e.getMessage());
            return batch.stream().map(candidate -> EdgeUpsertOutcome.failed(candidate, e)).toList();
        }
    }
}

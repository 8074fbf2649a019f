package com.purchasingpower.chemflow.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import lombok.Builder;

import java.util.Map;

/**
 * A proposed directed relationship between two entries.
 *
 * <p>Candidates are ephemeral: produced and consumed within one inference run.
 * The confidence is clamped to [0.0, 1.0] on construction, so no candidate can
 * carry an out-of-range score regardless of how its producer summed evidence.
 *
 * @param fromId     source entry id
 * @param toId       target entry id, never equal to {@code fromId}
 * @param kind       relationship type
 * @param confidence heuristic strength score, see {@link Confidence}
 * @param clusterKey provenance cluster, empty for cross-cluster relationships
 * @param reasoning  human-readable explanation persisted with the edge
 * @param attributes extra producer-specific edge properties (values must be graph-storable scalars)
 */
@Builder
public record RelationshipCandidate(
        String fromId,
        String toId,
        RelationshipKind kind,
        double confidence,
        String clusterKey,
        String reasoning,
        Map<String, Object> attributes
) {

    public RelationshipCandidate {
        Preconditions.checkNotNull(fromId, "fromId cannot be null");
        Preconditions.checkNotNull(toId, "toId cannot be null");
        Preconditions.checkNotNull(kind, "kind cannot be null");
        Preconditions.checkArgument(!fromId.equals(toId), "Self-loop relationship on entry %s", fromId);

        confidence = Confidence.clamp(confidence);
        clusterKey = clusterKey == null ? "" : clusterKey;
        reasoning = reasoning == null ? "" : reasoning;
        attributes = attributes == null ? ImmutableMap.of() : ImmutableMap.copyOf(attributes);
    }

    public EdgeKey key() {
        return new EdgeKey(fromId, toId, kind);
    }
}

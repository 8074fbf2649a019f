package com.purchasingpower.chemflow.graph;

import com.purchasingpower.chemflow.core.RelationshipCandidate;

/**
 * Result of writing one edge.
 *
 * @param candidate the edge that was written
 * @param success   whether the store accepted it
 * @param error     failure reason, null on success
 */
public record EdgeUpsertOutcome(RelationshipCandidate candidate, boolean success, String error) {

    public static EdgeUpsertOutcome ok(RelationshipCandidate candidate) {
        return new EdgeUpsertOutcome(candidate, true, null);
    }

    public static EdgeUpsertOutcome failed(RelationshipCandidate candidate, String error) {
        return new EdgeUpsertOutcome(candidate, false, error == null ? "unknown error" : error);
    }

    /**
     * Failure from an exception; falls back to the exception type when it carries no message.
     */
    public static EdgeUpsertOutcome failed(RelationshipCandidate candidate, RuntimeException cause) {
        String message = cause.getMessage();
        return failed(candidate, message == null || message.isBlank() ? cause.getClass().getSimpleName() : message);
    }
}

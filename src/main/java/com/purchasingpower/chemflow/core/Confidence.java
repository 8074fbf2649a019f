package com.purchasingpower.chemflow.core;

/**
 * Helpers for confidence scores.
 *
 * <p>A confidence is a heuristic, uncalibrated strength score for an inferred
 * relationship. It is a proxy for how much lexical and structural evidence
 * supports the relationship and must never be read as a probability.
 */
public final class Confidence {

    public static final double MIN = 0.0;
    public static final double MAX = 1.0;

    private Confidence() {
    }

    /** Scores are kept to three decimals so additive weights compare exactly. */
    private static final double SCALE = 1000.0;

    /**
     * Clamp a raw score into [0.0, 1.0] and round it to three decimals. NaN maps to 0.0.
     */
    public static double clamp(double raw) {
        if (Double.isNaN(raw)) {
            return MIN;
        }
        double clamped = Math.max(MIN, Math.min(MAX, raw));
        return Math.round(clamped * SCALE) / SCALE;
    }
}

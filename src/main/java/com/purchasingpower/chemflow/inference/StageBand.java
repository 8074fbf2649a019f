package com.purchasingpower.chemflow.inference;

import java.util.List;
import java.util.Locale;

/**
 * Execution-stage bands of a computational pipeline, in workflow order.
 *
 * <p>Each band owns its lexical cues. Matching is a case-insensitive substring
 * search over the calculation type; when several bands match, the one declared
 * first (lowest priority number) wins. Adding a cue is a data change here, not a
 * new branch in the classifiers.
 */
public enum StageBand {

    /** Structural relaxation. */
    STRUCTURE(10, "geometry", "optimization"),

    /** Electronic-structure convergence. */
    ELECTRONIC(20, "scf", "dft"),

    /** Derived property calculation. */
    PROPERTY(30, "dos", "band"),

    /** Post-processing. */
    POST_PROCESSING(40, "analysis", "post"),

    /** No lexical cue matched. */
    UNCLASSIFIED(100);

    private static final List<StageBand> MATCH_ORDER =
            List.of(STRUCTURE, ELECTRONIC, PROPERTY, POST_PROCESSING);

    private final int priority;
    private final List<String> keywords;

    StageBand(int priority, String... keywords) {
        this.priority = priority;
        this.keywords = List.of(keywords);
    }

    public int getPriority() {
        return priority;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    /**
     * Whether the calculation type carries any of this band's cues.
     */
    public boolean matches(String type) {
        if (type == null || type.isEmpty()) {
            return false;
        }
        String lower = type.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    /**
     * First matching band in workflow order, {@link #UNCLASSIFIED} otherwise.
     */
    public static StageBand of(String type) {
        for (StageBand band : MATCH_ORDER) {
            if (band.matches(type)) {
                return band;
            }
        }
        return UNCLASSIFIED;
    }

    /**
     * Two bands are compatible when both carry a lexical cue and they are equal
     * or consecutive in the workflow. {@link #UNCLASSIFIED} is never compatible,
     * since the absence of cues is not evidence of a shared workflow.
     */
    public boolean isCompatibleWith(StageBand other) {
        if (this == UNCLASSIFIED || other == null || other == UNCLASSIFIED) {
            return false;
        }
        return Math.abs(MATCH_ORDER.indexOf(this) - MATCH_ORDER.indexOf(other)) <= 1;
    }
}

package com.purchasingpower.chemflow.analyzer;

import com.purchasingpower.chemflow.core.CalculationEntry;
import com.purchasingpower.chemflow.core.RelationshipCandidate;
import com.purchasingpower.chemflow.core.RelationshipKind;

import java.util.List;

/**
 * A pluggable heuristic that proposes relationships over the whole entry population.
 *
 * <p>Implementations are picked up automatically by Spring and run by
 * {@link AnalyzerRegistry}. A new relationship kind is added by writing a new
 * analyzer; the grouping, stage and pairwise classifiers are never touched.
 *
 * <p>Contract:
 * <ul>
 *   <li>Pure: no I/O, no state kept between calls.</li>
 *   <li>Deterministic: the same population yields the same candidates in the same order.</li>
 *   <li>Each analyzer owns its {@link #kind()} and its confidence policy.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public interface RelationshipAnalyzer {

    /**
     * Stable, unique name used in configuration (e.g. {@code periodic-trend}).
     */
    String name();

    /**
     * Relationship kind this analyzer emits.
     */
    RelationshipKind kind();

    /**
     * Propose relationships.
     *
     * @param population entries already restricted to the scope
     * @param scope      the filters that produced {@code population}
     * @return candidates of {@link #kind()}, possibly empty, never null
     */
    List<RelationshipCandidate> analyze(List<CalculationEntry> population, AnalysisScope scope);
}

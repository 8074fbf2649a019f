/**
 * Core domain models for relationship inference.
 *
 * <p>Contains the value types shared by every stage of the engine:
 * <ul>
 *   <li>{@code CalculationEntry} - one calculation record (read-only input)</li>
 *   <li>{@code RelationshipCandidate} - an inferred, scored relationship</li>
 *   <li>{@code RelationshipKind} - closed set of relationship types</li>
 *   <li>{@code EdgeKey} / {@code PersistedEdge} - identity and stored form of an edge</li>
 * </ul>
 *
 * <p>This package has no Spring dependencies.
 *
 * @since 1.0.0
 */
package com.purchasingpower.chemflow.core;

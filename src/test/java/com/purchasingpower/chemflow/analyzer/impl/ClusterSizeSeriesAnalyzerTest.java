package com.purchasingpower.chemflow.analyzer.impl;

import com.purchasingpower.chemflow.analyzer.AnalysisScope;
import com.purchasingpower.chemflow.core.CalculationEntry;
import com.purchasingpower.chemflow.core.RelationshipCandidate;
import com.purchasingpower.chemflow.core.RelationshipKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.purchasingpower.chemflow.EntryFixtures.entry;
import static com.purchasingpower.chemflow.EntryFixtures.material;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Cluster Size Series Analyzer Tests")
class ClusterSizeSeriesAnalyzerTest {

    @Test
    @DisplayName("Same-element sizes are chained smallest to largest")
    void testAnalyze_SameElementChain() {
        // Given: out of order, with a repeated size
        List<CalculationEntry> population = List.of(
                material("au8", "Au8"),
                material("au2", "Au2"),
                material("au4", "Au4"),
                material("au4b", "Au4"));

        // When
        List<RelationshipCandidate> candidates = new ClusterSizeSeriesAnalyzer(false)
                .analyze(population, AnalysisScope.unrestricted());

        // Then: element tier first, then the family tier for the same pairs
        List<RelationshipCandidate> sameElement = candidates.stream()
                .filter(c -> "same_element".equals(c.attributes().get("series_type")))
                .toList();
        assertEquals(2, sameElement.size());
        assertEquals("au2", sameElement.get(0).fromId());
        assertEquals("au4", sameElement.get(0).toId());
        assertEquals("au4", sameElement.get(1).fromId());
        assertEquals("au8", sameElement.get(1).toId());
        assertEquals(ClusterSizeSeriesAnalyzer.SAME_ELEMENT_CONFIDENCE, sameElement.get(0).confidence(), 1e-9);
        assertEquals("Au", sameElement.get(0).attributes().get("element"));
        assertEquals(2, sameElement.get(0).attributes().get("smaller_size"));
        assertEquals(4, sameElement.get(0).attributes().get("larger_size"));

        assertTrue(candidates.stream().allMatch(c -> c.kind() == RelationshipKind.CLUSTER_SIZE_SERIES));
        assertEquals(4, candidates.size());
    }

    @Test
    @DisplayName("Family tier links related elements")
    void testAnalyze_FamilyTier() {
        List<CalculationEntry> population = List.of(material("ag3", "Ag3"), material("au5", "Au5"));

        List<RelationshipCandidate> candidates = new ClusterSizeSeriesAnalyzer(false)
                .analyze(population, AnalysisScope.unrestricted());

        assertEquals(1, candidates.size());
        RelationshipCandidate family = candidates.get(0);
        assertEquals("ag3", family.fromId());
        assertEquals("au5", family.toId());
        assertEquals(ClusterSizeSeriesAnalyzer.FAMILY_CONFIDENCE, family.confidence(), 1e-9);
        assertEquals("transition_metals", family.attributes().get("element_family"));
    }

    @Test
    @DisplayName("Global tier is opt-in")
    void testAnalyze_GlobalTier() {
        List<CalculationEntry> population = List.of(material("h2", "H2"), material("xe3", "Xe3"));

        assertTrue(new ClusterSizeSeriesAnalyzer(false).analyze(population, AnalysisScope.unrestricted()).isEmpty());

        List<RelationshipCandidate> global = new ClusterSizeSeriesAnalyzer(true)
                .analyze(population, AnalysisScope.unrestricted());
        assertEquals(1, global.size());
        assertEquals(ClusterSizeSeriesAnalyzer.GLOBAL_CONFIDENCE, global.get(0).confidence(), 1e-9);
        assertEquals("global_size", global.get(0).attributes().get("series_type"));
    }

    @Test
    @DisplayName("Cluster key is kept only when both ends share it")
    void testAnalyze_ClusterKey() {
        List<CalculationEntry> population = List.of(
                entry("a", "scf", "Pt2", "U1"),
                entry("b", "scf", "Pt3", "U1"),
                entry("c", "scf", "Pt4", "U2"));

        List<RelationshipCandidate> candidates = new ClusterSizeSeriesAnalyzer(false)
                .analyze(population, AnalysisScope.unrestricted());

        assertEquals("U1", candidates.get(0).clusterKey());
        assertEquals("", candidates.get(1).clusterKey());
    }
}

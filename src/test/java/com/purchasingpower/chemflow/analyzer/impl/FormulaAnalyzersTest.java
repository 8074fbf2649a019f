package com.purchasingpower.chemflow.analyzer.impl;

import com.purchasingpower.chemflow.analyzer.AnalysisScope;
import com.purchasingpower.chemflow.core.CalculationEntry;
import com.purchasingpower.chemflow.core.RelationshipCandidate;
import com.purchasingpower.chemflow.core.RelationshipKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.purchasingpower.chemflow.EntryFixtures.material;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Periodic Trend and Isoelectronic Analyzer Tests")
class FormulaAnalyzersTest {

    @Test
    @DisplayName("Periodic trend walks down each group by atomic number")
    void testPeriodicTrend_GroupOrder() {
        // Given
        List<CalculationEntry> population = List.of(
                material("k", "K3"),
                material("li", "Li3"),
                material("na", "Na3"),
                material("na-dup", "Na3"),
                material("junk", "Na(OH)"));

        // When
        List<RelationshipCandidate> candidates = new PeriodicTrendAnalyzer()
                .analyze(population, AnalysisScope.unrestricted());

        // Then: Li3 -> Na3 -> (Na3 skipped, same formula) -> K3
        assertEquals(2, candidates.size());
        assertEquals("li", candidates.get(0).fromId());
        assertEquals("na", candidates.get(0).toId());
        assertEquals("na-dup", candidates.get(1).fromId());
        assertEquals("k", candidates.get(1).toId());
        assertEquals(RelationshipKind.PERIODIC_TREND, candidates.get(0).kind());
        assertEquals(PeriodicTrendAnalyzer.CONFIDENCE, candidates.get(0).confidence(), 1e-9);
        assertEquals("alkali_metals", candidates.get(0).attributes().get("group"));
    }

    @Test
    @DisplayName("Compounds join every group they contain")
    void testPeriodicTrend_Compounds() {
        List<CalculationEntry> population = List.of(material("nacl", "NaCl"), material("kbr", "KBr"));

        List<RelationshipCandidate> candidates = new PeriodicTrendAnalyzer()
                .analyze(population, AnalysisScope.unrestricted());

        assertEquals(List.of("alkali_metals", "halogens"),
                candidates.stream().map(c -> c.attributes().get("group")).toList());
    }

    @Test
    @DisplayName("Isoelectronic species with different formulas are linked")
    void testIsoelectronic() {
        List<CalculationEntry> population = List.of(
                material("n2", "N2"),
                material("co", "CO"),
                material("co-again", "CO"),
                material("ne", "Ne"),
                material("hf", "HF"));

        List<RelationshipCandidate> candidates = new IsoelectronicAnalyzer()
                .analyze(population, AnalysisScope.unrestricted());

        // 10 electrons: HF -> Ne ; 14 electrons: CO, CO (same formula, skipped) -> N2
        assertEquals(2, candidates.size());
        assertEquals("hf", candidates.get(0).fromId());
        assertEquals("ne", candidates.get(0).toId());
        assertEquals(10, candidates.get(0).attributes().get("electron_count"));
        assertEquals("co-again", candidates.get(1).fromId());
        assertEquals("n2", candidates.get(1).toId());
        assertEquals(IsoelectronicAnalyzer.CONFIDENCE, candidates.get(1).confidence(), 1e-9);
    }
}

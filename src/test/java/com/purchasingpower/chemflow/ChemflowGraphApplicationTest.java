package com.purchasingpower.chemflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.chemflow.analyzer.AnalyzerRegistry;
import com.purchasingpower.chemflow.config.InferenceProperties;
import com.purchasingpower.chemflow.core.CalculationEntry;
import com.purchasingpower.chemflow.core.EdgeKey;
import com.purchasingpower.chemflow.core.RelationshipKind;
import com.purchasingpower.chemflow.graph.GraphStore;
import com.purchasingpower.chemflow.graph.impl.InMemoryGraphStore;
import com.purchasingpower.chemflow.inference.InferenceOptions;
import com.purchasingpower.chemflow.inference.RelationshipInferenceEngine;
import com.purchasingpower.chemflow.report.InferenceReport;
import com.purchasingpower.chemflow.runner.InferenceRunner;
import com.purchasingpower.chemflow.source.JsonFileEntrySource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Wiring test against the in-memory graph store.
 */
@SpringBootTest
@DisplayName("Application Context Tests")
class ChemflowGraphApplicationTest {

    private static final Path FIXTURE = Path.of("src/test/resources/fixtures/workflow-entries.json");

    @Autowired
    private RelationshipInferenceEngine engine;

    @Autowired
    private AnalyzerRegistry analyzerRegistry;

    @Autowired
    private GraphStore graphStore;

    @Autowired
    private InferenceRunner runner;

    @Autowired
    private InferenceProperties properties;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        ((InMemoryGraphStore) graphStore).clear();
    }

    @Test
    @DisplayName("All analyzers are registered and the memory store is active")
    void testContext_Wiring() {
        assertThat(analyzerRegistry.names()).containsExactly(
                "cluster-size-series", "isoelectronic", "parameter-study", "periodic-trend", "same-material");
        assertInstanceOf(InMemoryGraphStore.class, graphStore);
        assertEquals(2, properties.getUpsertBatchSize());
    }

    @Test
    @DisplayName("End-to-end run over the JSON fixture")
    void testEngine_EndToEnd() {
        // Given
        List<CalculationEntry> entries = new JsonFileEntrySource(FIXTURE, objectMapper).load();

        // When
        InferenceReport report = engine.run(entries, InferenceOptions.fromProperties(properties));

        // Then
        assertTrue(report.isSuccess());
        assertEquals(5, report.getEntryNodesUpserted());
        assertTrue(graphStore.findEdge(new EdgeKey("g1", "s1", RelationshipKind.PROVIDES_STRUCTURE)).isPresent());
        assertTrue(graphStore.findEdge(new EdgeKey("s1", "d1", RelationshipKind.PROVIDES_ELECTRONIC_STRUCTURE)).isPresent());
        assertTrue(graphStore.findEdge(new EdgeKey("g1", "x1", RelationshipKind.SAME_MATERIAL)).isPresent());
        assertEquals(report.getEdgesUpserted(), graphStore.countEdges());

        System.out.println("✅ " + report.getEdgesUpserted() + " edges from " + entries.size() + " entries");
    }

    @Test
    @DisplayName("Runner stays idle without an input file and processes one when configured")
    void testRunner() {
        runner.run();
        assertEquals(0, graphStore.countEdges());

        properties.setInputFile(FIXTURE.toString());
        try {
            runner.run();
        } finally {
            properties.setInputFile(null);
        }
        assertTrue(graphStore.countEdges() > 0);
    }
}

package com.purchasingpower.chemflow.graph;

import com.purchasingpower.chemflow.core.EdgeKey;
import com.purchasingpower.chemflow.core.RelationshipCandidate;
import com.purchasingpower.chemflow.core.RelationshipKind;
import com.purchasingpower.chemflow.exception.UpsertException;
import com.purchasingpower.chemflow.graph.impl.InMemoryGraphStore;
import com.purchasingpower.chemflow.report.FailedEdge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Graph Edge Builder Tests")
class GraphEdgeBuilderTest {

    private InMemoryGraphStore store;
    private GraphEdgeBuilder builder;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        builder = new GraphEdgeBuilder(store, 2);
    }

    private static RelationshipCandidate candidate(String from, String to, RelationshipKind kind,
                                                   double confidence, String reasoning) {
        return RelationshipCandidate.builder()
                .fromId(from)
                .toId(to)
                .kind(kind)
                .confidence(confidence)
                .clusterKey("C")
                .reasoning(reasoning)
                .build();
    }

    @Test
    @DisplayName("Highest confidence wins, ties keep the earliest candidate")
    void testDeduplicate_TieBreak() {
        // Given
        RelationshipCandidate weak = candidate("a", "b", RelationshipKind.CLUSTER_SIZE_SERIES, 0.75, "global");
        RelationshipCandidate strong = candidate("a", "b", RelationshipKind.CLUSTER_SIZE_SERIES, 0.95, "element");
        RelationshipCandidate tieFirst = candidate("b", "c", RelationshipKind.ISOELECTRONIC, 0.7, "first");
        RelationshipCandidate tieSecond = candidate("b", "c", RelationshipKind.ISOELECTRONIC, 0.7, "second");
        RelationshipCandidate otherKind = candidate("a", "b", RelationshipKind.PERIODIC_TREND, 0.9, "trend");

        // When
        List<RelationshipCandidate> unique = builder.deduplicate(
                List.of(weak, tieFirst, strong, otherKind, tieSecond));

        // Then: first-seen key order, best candidate per key
        assertEquals(List.of(strong, tieFirst, otherKind), unique);
    }

    @Test
    @DisplayName("Threshold drops candidates strictly below the minimum")
    void testPublish_Threshold() {
        List<RelationshipCandidate> candidates = List.of(
                candidate("a", "b", RelationshipKind.WORKFLOW_STEP, 0.5, ""),
                candidate("b", "c", RelationshipKind.WORKFLOW_STEP, 0.6, ""),
                candidate("c", "d", RelationshipKind.WORKFLOW_STEP, 0.9, ""));

        GraphEdgeBuilder.PublishResult result = builder.publish(candidates, 0.6);

        assertEquals(2, result.upserted());
        assertEquals(1, result.belowThreshold());
        assertEquals(3, result.afterDedup());
        assertTrue(result.failed().isEmpty());
        assertEquals(2, store.countEdges());
        assertTrue(store.findEdge(new EdgeKey("a", "b", RelationshipKind.WORKFLOW_STEP)).isEmpty());
    }

    @Test
    @DisplayName("Publishing twice leaves the edge set unchanged")
    void testPublish_Idempotent() {
        List<RelationshipCandidate> candidates = List.of(
                candidate("a", "b", RelationshipKind.PROVIDES_STRUCTURE, 1.0, "r1"),
                candidate("b", "c", RelationshipKind.PROVIDES_ELECTRONIC_STRUCTURE, 0.8, "r2"),
                candidate("c", "d", RelationshipKind.WORKFLOW_STEP, 0.5, "r3"));

        builder.publish(candidates, 0.0);
        var firstSnapshot = store.findEdges();
        builder.publish(candidates, 0.0);

        assertEquals(3, store.countEdges());
        assertEquals(firstSnapshot, store.findEdges());
    }

    @Test
    @DisplayName("Republishing overwrites properties instead of adding an edge")
    void testPublish_OverwritesProperties() {
        builder.publish(List.of(candidate("a", "b", RelationshipKind.WORKFLOW_STEP, 0.5, "old")), 0.0);
        builder.publish(List.of(candidate("a", "b", RelationshipKind.WORKFLOW_STEP, 0.7, "new")), 0.0);

        assertEquals(1, store.countEdges());
        var edge = store.findEdge(new EdgeKey("a", "b", RelationshipKind.WORKFLOW_STEP)).orElseThrow();
        assertEquals(0.7, edge.confidence(), 1e-9);
        assertEquals("new", edge.properties().get("reasoning"));
        assertEquals("C", edge.clusterKey());
    }

    @Test
    @DisplayName("A failing edge is reported and does not stop the batch")
    void testPublish_PerEdgeFailure() {
        // Given: a store that rejects one key
        EdgeKey poisoned = new EdgeKey("b", "c", RelationshipKind.WORKFLOW_STEP);
        List<Integer> batchSizes = new ArrayList<>();
        InMemoryGraphStore failing = new InMemoryGraphStore() {
            @Override
            public void upsertEdge(String fromId, String toId, RelationshipKind kind, Map<String, Object> properties) {
                if (new EdgeKey(fromId, toId, kind).equals(poisoned)) {
                    throw new UpsertException(poisoned, "constraint violated");
                }
                super.upsertEdge(fromId, toId, kind, properties);
            }

            @Override
            public List<EdgeUpsertOutcome> upsertEdges(List<RelationshipCandidate> batch) {
                batchSizes.add(batch.size());
                return super.upsertEdges(batch);
            }
        };
        GraphEdgeBuilder failingBuilder = new GraphEdgeBuilder(failing, 2);

        // When
        GraphEdgeBuilder.PublishResult result = failingBuilder.publish(List.of(
                candidate("a", "b", RelationshipKind.WORKFLOW_STEP, 0.5, ""),
                candidate("b", "c", RelationshipKind.WORKFLOW_STEP, 0.5, ""),
                candidate("c", "d", RelationshipKind.WORKFLOW_STEP, 0.5, "")), 0.0);

        // Then
        assertEquals(2, result.upserted());
        assertThat(result.failed()).hasSize(1);
        assertEquals(poisoned, result.failed().get(0).edge());
        assertEquals("constraint violated", result.failed().get(0).reason());
        assertEquals(List.of(2, 1), batchSizes);
        assertEquals(2, failing.countEdges());
    }

    @Test
    @DisplayName("Unexpected store exceptions are recorded per edge")
    void testPublish_UnexpectedExceptionPerEdge() {
        // Given: a store whose client is closed for one endpoint
        InMemoryGraphStore failing = new InMemoryGraphStore() {
            @Override
            public void upsertEdge(String fromId, String toId, RelationshipKind kind, Map<String, Object> properties) {
                if ("a".equals(fromId)) {
                    throw new IllegalStateException("driver closed");
                }
                super.upsertEdge(fromId, toId, kind, properties);
            }
        };
        GraphEdgeBuilder failingBuilder = new GraphEdgeBuilder(failing, 2);

        // When
        GraphEdgeBuilder.PublishResult result = failingBuilder.publish(List.of(
                candidate("a", "b", RelationshipKind.WORKFLOW_STEP, 0.5, ""),
                candidate("b", "c", RelationshipKind.WORKFLOW_STEP, 0.5, ""),
                candidate("c", "d", RelationshipKind.WORKFLOW_STEP, 0.5, "")), 0.0);

        // Then
        assertEquals(2, result.upserted());
        assertThat(result.failed()).hasSize(1);
        assertEquals(new EdgeKey("a", "b", RelationshipKind.WORKFLOW_STEP), result.failed().get(0).edge());
        assertEquals("driver closed", result.failed().get(0).reason());
        assertEquals(2, failing.countEdges());
    }

    @Test
    @DisplayName("A batch the store cannot open fails its edges and later batches still run")
    void testPublish_WholeBatchFailure() {
        // Given: the first batch call blows up before writing anything
        List<Integer> calls = new ArrayList<>();
        InMemoryGraphStore flaky = new InMemoryGraphStore() {
            @Override
            public List<EdgeUpsertOutcome> upsertEdges(List<RelationshipCandidate> batch) {
                calls.add(batch.size());
                if (calls.size() == 1) {
                    throw new IllegalStateException();
                }
                return super.upsertEdges(batch);
            }
        };
        GraphEdgeBuilder flakyBuilder = new GraphEdgeBuilder(flaky, 2);

        // When
        GraphEdgeBuilder.PublishResult result = flakyBuilder.publish(List.of(
                candidate("a", "b", RelationshipKind.WORKFLOW_STEP, 0.5, ""),
                candidate("b", "c", RelationshipKind.WORKFLOW_STEP, 0.5, ""),
                candidate("c", "d", RelationshipKind.WORKFLOW_STEP, 0.5, "")), 0.0);

        // Then
        assertEquals(List.of(2, 1), calls);
        assertEquals(1, result.upserted());
        assertThat(result.failed()).extracting(FailedEdge::reason)
                .containsExactly("IllegalStateException", "IllegalStateException");
        assertTrue(flaky.findEdge(new EdgeKey("c", "d", RelationshipKind.WORKFLOW_STEP)).isPresent());
    }

    @Test
    @DisplayName("Batch size must be positive")
    void testConstructor_InvalidBatchSize() {
        assertThrows(IllegalArgumentException.class, () -> new GraphEdgeBuilder(store, 0));
    }
}

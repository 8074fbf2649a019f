package com.purchasingpower.chemflow.graph.impl;

import com.purchasingpower.chemflow.core.CalculationEntry;
import com.purchasingpower.chemflow.core.EdgeKey;
import com.purchasingpower.chemflow.core.EdgeProperties;
import com.purchasingpower.chemflow.core.PersistedEdge;
import com.purchasingpower.chemflow.core.RelationshipCandidate;
import com.purchasingpower.chemflow.core.RelationshipKind;
import com.purchasingpower.chemflow.exception.UpsertException;
import com.purchasingpower.chemflow.graph.EdgeUpsertOutcome;
import com.purchasingpower.chemflow.graph.GraphStore;
import com.purchasingpower.chemflow.model.CallContext;
import com.purchasingpower.chemflow.model.ServiceType;
import com.purchasingpower.chemflow.util.ExternalCallLogger;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthToken;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.exceptions.Neo4jException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bolt implementation of GraphStore. Works against Neo4j and Memgraph, which
 * share the protocol and the Cypher subset used here.
 *
 * <p>Edges are written with {@code MERGE} on both endpoint nodes and on the typed
 * relationship, then {@code SET r = $props}, so a rerun overwrites properties
 * instead of appending a second edge. A uniqueness constraint on
 * {@code Entry.entry_id} keeps the endpoints single; MERGE locks both endpoints,
 * which serializes concurrent writers of the same key.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "app.graph", name = "store", havingValue = "neo4j", matchIfMissing = true)
public class Neo4jGraphStoreImpl implements GraphStore {

    private static final int MAX_ERROR_LENGTH = 300;

    private static final String UPSERT_ENTRIES = """
            UNWIND $rows AS row
            MERGE (e:Entry {entry_id: row.entry_id})
            SET e.entry_type = row.entry_type,
                e.formula = row.formula,
                e.cluster_key = row.cluster_key,
                e.has_input_files = row.has_input_files,
                e.has_output_files = row.has_output_files
            """;

    private static final String FIND_EDGES = """
            MATCH (a:Entry)-[r]->(b:Entry)
            WHERE type(r) IN $kinds
            RETURN a.entry_id AS fromId, b.entry_id AS toId, type(r) AS kind, properties(r) AS props
            """;

    private static final String COUNT_EDGES = """
            MATCH (:Entry)-[r]->(:Entry)
            WHERE type(r) IN $kinds
            RETURN count(r) AS total
            """;

    @Value("${neo4j.uri:bolt://localhost:7687}")
    private String neo4jUri;

    @Value("${neo4j.username:neo4j}")
    private String neo4jUsername;

    @Value("${neo4j.password:password}")
    private String neo4jPassword;

    private Driver driver;

    @PostConstruct
    public void init() {
        log.info("Initializing Bolt GraphStore at: {}", neo4jUri);
        driver = GraphDatabase.driver(neo4jUri, authToken());
        createConstraints();
    }

    @PreDestroy
    public void close() {
        if (driver != null) {
            driver.close();
            log.info("Bolt GraphStore connection closed");
        }
    }

    private AuthToken authToken() {
        // Memgraph runs without auth by default
        if (neo4jUsername == null || neo4jUsername.isBlank()) {
            return AuthTokens.none();
        }
        return AuthTokens.basic(neo4jUsername, neo4jPassword);
    }

    private void createConstraints() {
        try (Session session = driver.session()) {
            try {
                session.run("CREATE CONSTRAINT entry_id_unique IF NOT EXISTS FOR (e:Entry) REQUIRE e.entry_id IS UNIQUE").consume();
                log.info("✅ Entry uniqueness constraint ensured (Neo4j syntax)");
            } catch (Neo4jException neo4jSyntaxFailure) {
                log.debug("Neo4j constraint syntax rejected, trying Memgraph syntax: {}", neo4jSyntaxFailure.getMessage());
                session.run("CREATE CONSTRAINT ON (e:Entry) ASSERT e.entry_id IS UNIQUE").consume();
                log.info("✅ Entry uniqueness constraint ensured (Memgraph syntax)");
            }
        } catch (Exception e) {
            log.warn("⚠️  Failed to create Entry constraint (store may be unreachable): {}", e.getMessage());
        }
    }

    // =========================================================================
    // Mutations
    // =========================================================================

    @Override
    public void upsertEdge(String fromId, String toId, RelationshipKind kind, Map<String, Object> properties) {
        try (Session session = driver.session()) {
            writeEdge(session, fromId, toId, kind, properties);
        }
    }

    @Override
    public List<EdgeUpsertOutcome> upsertEdges(List<RelationshipCandidate> batch) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.GRAPH_STORE, "UpsertEdges", log);
        callCtx.logRequest("Upserting edge batch", "Edges", batch.size());

        List<EdgeUpsertOutcome> outcomes = new ArrayList<>(batch.size());
        int failed = 0;

        try (Session session = driver.session()) {
            for (RelationshipCandidate candidate : batch) {
                try {
                    writeEdge(session, candidate.fromId(), candidate.toId(), candidate.kind(), EdgeProperties.of(candidate));
                    outcomes.add(EdgeUpsertOutcome.ok(candidate));
                } catch (RuntimeException e) {
                    // driver or session errors surface as non-Neo4j exceptions
                    failed++;
                    outcomes.add(EdgeUpsertOutcome.failed(candidate, e));
                }
            }
        }

        callCtx.logResponse("Edge batch written", "Succeeded", batch.size() - failed, "Failed", failed);
        return outcomes;
    }

    private void writeEdge(Session session, String fromId, String toId, RelationshipKind kind, Map<String, Object> properties) {
        EdgeKey key = new EdgeKey(fromId, toId, kind);
        Map<String, Object> params = new HashMap<>();
        params.put("fromId", fromId);
        params.put("toId", toId);
        params.put("props", properties);

        try {
            session.executeWrite(tx -> {
                tx.run(edgeMergeCypher(kind), params).consume();
                return null;
            });
        } catch (Neo4jException e) {
            log.debug("Upsert of {} failed", key, e);
            throw new UpsertException(key, ExternalCallLogger.truncate(e.getMessage(), MAX_ERROR_LENGTH), e);
        }
    }

    /**
     * Relationship types cannot be parameters in Cypher; the type comes from the closed
     * {@link RelationshipKind} enum, never from input data.
     */
    static String edgeMergeCypher(RelationshipKind kind) {
        return """
                MERGE (a:Entry {entry_id: $fromId})
                MERGE (b:Entry {entry_id: $toId})
                MERGE (a)-[r:%s]->(b)
                SET r = $props
                """.formatted(kind.name());
    }

    @Override
    public int upsertEntries(List<CalculationEntry> entries) {
        if (entries.isEmpty()) {
            return 0;
        }
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.GRAPH_STORE, "UpsertEntries", log);
        callCtx.logRequest("Upserting entry nodes", "Entries", entries.size());

        List<Map<String, Object>> rows = entries.stream().map(Neo4jGraphStoreImpl::toRow).toList();

        try (Session session = driver.session()) {
            session.executeWrite(tx -> {
                tx.run(UPSERT_ENTRIES, Map.of("rows", rows)).consume();
                return null;
            });
            callCtx.logResponse("Entry nodes written");
            return entries.size();
        } catch (Neo4jException e) {
            callCtx.logError("Failed to upsert entry nodes", e);
            throw new UpsertException(null, "Entry node upsert failed: "
                    + ExternalCallLogger.truncate(e.getMessage(), MAX_ERROR_LENGTH), e);
        }
    }

    static Map<String, Object> toRow(CalculationEntry entry) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("entry_id", entry.id());
        row.put("entry_type", entry.type());
        row.put("formula", entry.formula());
        row.put("cluster_key", entry.clusterKey());
        row.put("has_input_files", entry.hasInputFiles());
        row.put("has_output_files", entry.hasOutputFiles());
        return row;
    }

    // =========================================================================
    // Read-back
    // =========================================================================

    @Override
    public List<PersistedEdge> findEdges() {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.GRAPH_STORE, "FindEdges", log);
        callCtx.logRequest("Reading relationship edges");

        try (Session session = driver.session()) {
            List<PersistedEdge> edges = session.executeRead(tx -> {
                List<PersistedEdge> found = new ArrayList<>();
                for (Record record : tx.run(FIND_EDGES, Map.of("kinds", kindNames())).list()) {
                    EdgeKey key = new EdgeKey(
                            record.get("fromId").asString(),
                            record.get("toId").asString(),
                            RelationshipKind.valueOf(record.get("kind").asString()));
                    found.add(new PersistedEdge(key, record.get("props").asMap()));
                }
                return found;
            });
            edges.sort(Comparator.comparing(PersistedEdge::key));
            callCtx.logResponse("Edges read", "Count", edges.size());
            return edges;
        } catch (Neo4jException e) {
            callCtx.logError("Failed to read edges", e);
            throw e;
        }
    }

    @Override
    public long countEdges() {
        try (Session session = driver.session()) {
            return session.executeRead(tx ->
                    tx.run(COUNT_EDGES, Map.of("kinds", kindNames())).single().get("total").asLong());
        }
    }

    private static List<String> kindNames() {
        return Arrays.stream(RelationshipKind.values()).map(Enum::name).toList();
    }
}

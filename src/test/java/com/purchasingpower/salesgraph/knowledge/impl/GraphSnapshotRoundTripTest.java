package com.purchasingpower.salesgraph.knowledge.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.salesgraph.TestGraphs;
import com.purchasingpower.salesgraph.model.graph.EdgeType;
import com.purchasingpower.salesgraph.model.graph.GraphNode;
import com.purchasingpower.salesgraph.model.graph.GraphSnapshot;
import com.purchasingpower.salesgraph.model.graph.NodeKind;
import com.purchasingpower.salesgraph.model.ingest.TranscriptTurn;
import com.purchasingpower.salesgraph.service.graph.impl.EdgeFeedbackServiceImpl;
import com.purchasingpower.salesgraph.service.graph.impl.GraphBuilderServiceImpl;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Serializing a graph, loading it into a fresh store and serializing again must give the
 * same nodes and edges field for field.
 */
@DisplayName("Graph Snapshot Round-trip Tests")
class GraphSnapshotRoundTripTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Should reproduce every node and edge after serialize/deserialize/serialize")
    void roundTrip_preservesAllFields() throws Exception {
        // Given: a graph with seeded actions, transcript knowledge and feedback counters
        InMemoryGraphStoreImpl store = TestGraphs.seededStore();
        GraphBuilderServiceImpl builder = new GraphBuilderServiceImpl(store, new KeywordTopicClassifier());
        builder.buildFromTranscript(List.of(
                TranscriptTurn.customer("Do you ship to Tacoma?"),
                TranscriptTurn.agent("Yes, same day before noon."),
                TranscriptTurn.customer("Any discount for weddings?"),
                TranscriptTurn.agent("10% off orders above $500.")
        ), TestGraphs.INTENT);
        String edgeId = store.findEdges(EdgeType.ANSWERS).get(0).getId();
        new EdgeFeedbackServiceImpl(store, TestGraphs.appProperties()).applyFeedback(edgeId, 1);

        // When
        String first = objectMapper.writeValueAsString(store.snapshot());
        InMemoryGraphStoreImpl reloaded = TestGraphs.newStore();
        reloaded.restore(objectMapper.readValue(first, GraphSnapshot.class));
        String second = objectMapper.writeValueAsString(reloaded.snapshot());

        // Then
        JsonNode before = objectMapper.readTree(first);
        JsonNode after = objectMapper.readTree(second);
        assertEquals(store.nodeCount(), reloaded.nodeCount());
        assertEquals(store.edgeCount(), reloaded.edgeCount());
        assertEquals(elements(before.get("nodes")), elements(after.get("nodes")));
        assertEquals(elements(before.get("edges")), elements(after.get("edges")));
    }

    @Test
    @DisplayName("Should write the documented field names")
    void snapshot_usesDocumentedFieldNames() throws Exception {
        InMemoryGraphStoreImpl store = TestGraphs.newStore();
        store.findOrCreateQuestion("What are your hours?", TestGraphs.INTENT);

        JsonNode node = objectMapper.readTree(objectMapper.writeValueAsString(store.snapshot())).get("nodes").get(0);

        assertEquals("question", node.get("type").asText());
        assertEquals(TestGraphs.INTENT, node.get("intent_id").asText());
        assertThat(node.get("stats").has("pos")).isTrue();
        assertThat(node.get("stats").has("views")).isTrue();
        assertThat(node.has("kind")).isFalse();
    }

    @Test
    @DisplayName("Should read legacy clue nodes as topics and default missing fields")
    void legacyDocument_isReadable() throws Exception {
        // Given: a document written before topics were renamed, without metadata or stats
        String legacy = """
            {
              "nodes": [
                {"id": "c1", "type": "clue", "label": "Same-Day Delivery", "text": "Same-Day Delivery", "intent_id": null},
                {"id": "q1", "type": "question", "label": "Do you deliver today?", "text": "Do you deliver today?"}
              ],
              "edges": [
                {"id": "e1", "source": "c1", "target": "q1", "type": "describes_context", "weight": 0.5, "confidence": 0.6}
              ]
            }
            """;

        // When
        InMemoryGraphStoreImpl store = TestGraphs.newStore();
        store.restore(objectMapper.readValue(legacy, GraphSnapshot.class));

        // Then
        GraphNode clue = store.getNode("c1").orElseThrow();
        assertEquals(NodeKind.TOPIC, clue.getKind());
        assertThat(clue.getMetadata()).isEmpty();
        assertEquals(0.0, clue.getStats().getPos());
        assertEquals(0.6, store.getEdge("e1").orElseThrow().getConfidence());
        assertThat(store.getEdge("e1").orElseThrow().getMetadata()).isEmpty();
    }

    private static Set<JsonNode> elements(JsonNode array) {
        Set<JsonNode> set = new HashSet<>();
        array.forEach(set::add);
        return set;
    }
}

package com.purchasingpower.salesgraph.service.graph.impl;

import com.purchasingpower.salesgraph.TestGraphs;
import com.purchasingpower.salesgraph.knowledge.impl.InMemoryGraphStoreImpl;
import com.purchasingpower.salesgraph.knowledge.impl.KeywordTopicClassifier;
import com.purchasingpower.salesgraph.model.graph.EdgeType;
import com.purchasingpower.salesgraph.model.graph.GraphEdge;
import com.purchasingpower.salesgraph.model.ingest.TranscriptTurn;
import com.purchasingpower.salesgraph.model.result.ReviewTask;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Review Task Tests")
class ReviewTaskServiceImplTest {

    @Test
    @DisplayName("Should list one confirmation task per answers edge with its topic")
    void listTasks() {
        // Given
        InMemoryGraphStoreImpl store = TestGraphs.seededStore();
        new GraphBuilderServiceImpl(store, new KeywordTopicClassifier()).buildFromTranscript(List.of(
                TranscriptTurn.customer("Do you ship abroad?"),
                TranscriptTurn.agent("Only within the country")), TestGraphs.INTENT);
        store.addEdge(GraphEdge.builder().id("broken").source("x").target("y").type("answers").build());
        GraphEdge answers = store.findEdges(EdgeType.ANSWERS).get(0);

        // When
        List<ReviewTask> tasks = new ReviewTaskServiceImpl(store).listTasks();

        // Then
        assertEquals(1, tasks.size(), "Edges with missing endpoints are skipped");
        ReviewTask task = tasks.get(0);
        assertEquals(ReviewTask.KIND_EDGE_CONFIRMATION, task.getKind());
        assertEquals(answers.getId(), task.getEdgeId());
        assertEquals("Do you ship abroad?", task.getQuestion());
        assertEquals("Only within the country", task.getAnswer());
        assertEquals(0.5, task.getConfidence());
        assertEquals("Delivery & shipping", task.getTopicLabel());
    }

    @Test
    @DisplayName("Should return no tasks for a graph with only actions")
    void emptyGraph() {
        assertThat(new ReviewTaskServiceImpl(TestGraphs.seededStore()).listTasks()).isEmpty();
    }
}

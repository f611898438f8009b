package com.purchasingpower.salesgraph.service.graph.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.salesgraph.TestGraphs;
import com.purchasingpower.salesgraph.knowledge.impl.InMemoryGraphStoreImpl;
import com.purchasingpower.salesgraph.knowledge.impl.KeywordTopicClassifier;
import com.purchasingpower.salesgraph.model.graph.EdgeType;
import com.purchasingpower.salesgraph.model.graph.GraphEdge;
import com.purchasingpower.salesgraph.model.graph.GraphNode;
import com.purchasingpower.salesgraph.model.graph.NodeKind;
import com.purchasingpower.salesgraph.model.ingest.ExtractedKnowledge;
import com.purchasingpower.salesgraph.model.ingest.ExtractedQaRecord;
import com.purchasingpower.salesgraph.model.ingest.TranscriptTurn;
import com.purchasingpower.salesgraph.model.ingest.TurnRole;
import com.purchasingpower.salesgraph.model.result.BuildSummary;
import com.purchasingpower.salesgraph.model.result.IngestSummary;
import com.purchasingpower.salesgraph.service.graph.GraphBuilderService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Graph Builder Service Tests")
class GraphBuilderServiceImplTest {

    private InMemoryGraphStoreImpl store;
    private GraphBuilderServiceImpl builder;

    @BeforeEach
    void setUp() {
        store = TestGraphs.seededStore();
        builder = new GraphBuilderServiceImpl(store, new KeywordTopicClassifier());
    }

    @Nested
    @DisplayName("Transcript mode")
    class TranscriptMode {

        @Test
        @DisplayName("Should link the answered question and drop the trailing unanswered one")
        void hoursScenario() {
            // Given
            List<TranscriptTurn> turns = List.of(
                    TranscriptTurn.customer("What are your hours?"),
                    TranscriptTurn.agent("9 to 5"),
                    TranscriptTurn.customer("Unanswered?"));

            // When
            BuildSummary summary = builder.buildFromTranscript(turns, TestGraphs.INTENT);

            // Then: one answers edge, hours -> "9 to 5"
            List<GraphEdge> answers = store.findEdges(EdgeType.ANSWERS);
            assertEquals(1, answers.size());
            GraphNode hours = store.getNode(answers.get(0).getSource()).orElseThrow();
            assertEquals("What are your hours?", hours.getText());
            assertEquals("9 to 5", store.getNode(answers.get(0).getTarget()).orElseThrow().getText());
            assertEquals(0.5, answers.get(0).getConfidence());
            assertEquals(0.5, answers.get(0).getWeight());

            // And: the unanswered question has no edges at all
            GraphNode unanswered = store.findQuestionByText("Unanswered?").orElseThrow();
            assertThat(store.findOutgoingEdges(unanswered.getId(), EdgeType.ANSWERS)).isEmpty();
            assertThat(store.findIncomingEdges(unanswered.getId(), EdgeType.DESCRIBES_CONTEXT)).isEmpty();

            // And: "General offering" describes the hours question
            List<GraphEdge> context = store.findIncomingEdges(hours.getId(), EdgeType.DESCRIBES_CONTEXT);
            assertEquals(1, context.size());
            GraphNode topic = store.getNode(context.get(0).getSource()).orElseThrow();
            assertEquals(NodeKind.TOPIC, topic.getKind());
            assertEquals("General offering", topic.getLabel());

            assertEquals(1, summary.getAnswersLinked());
            assertEquals(store.edgeCount(), summary.getEdgeCount());
            assertEquals("customer_session", answers.get(0).getMetadata().get("source"));
        }

        @Test
        @DisplayName("Should keep only the last of consecutive customer questions")
        void lastQuestionWins() {
            builder.buildFromTranscript(List.of(
                    TranscriptTurn.customer("Do you ship?"),
                    TranscriptTurn.customer("How much is a bouquet?"),
                    TranscriptTurn.agent("From $45"),
                    TranscriptTurn.agent("Anything else?")), TestGraphs.INTENT);

            List<GraphEdge> answers = store.findEdges(EdgeType.ANSWERS);
            assertEquals(1, answers.size(), "Second agent turn has no pending question");
            assertEquals("How much is a bouquet?", store.getNode(answers.get(0).getSource()).orElseThrow().getText());
            assertTrue(store.findNodesByKind(NodeKind.ANSWER).stream().noneMatch(n -> n.getText().equals("Anything else?")));
        }

        @Test
        @DisplayName("Should infer topics from question keywords and skip blank turns")
        void inferTopicsAndSkipBlanks() {
            builder.buildFromTranscript(List.of(
                    TranscriptTurn.customer("Do you offer a discount?"),
                    TranscriptTurn.agent("   "),
                    TranscriptTurn.agent("10% for members"),
                    TranscriptTurn.customer("Can I return flowers?"),
                    TranscriptTurn.agent("Within 24 hours")), TestGraphs.INTENT);

            assertThat(store.findNodesByKind(NodeKind.TOPIC))
                    .extracting(GraphNode::getLabel)
                    .containsExactly("Pricing & discounts", "Refunds & warranty");
        }

        @Test
        @DisplayName("Should reuse nodes and not duplicate topic links on repeated builds")
        void repeatedBuild_reusesNodes() {
            List<TranscriptTurn> turns = List.of(
                    TranscriptTurn.customer("Do you ship?"),
                    TranscriptTurn.agent("Yes, nationwide"));

            builder.buildFromTranscript(turns, TestGraphs.INTENT);
            builder.buildFromTranscript(turns, TestGraphs.INTENT);

            assertEquals(1, store.findNodesByKind(NodeKind.QUESTION).size());
            assertEquals(1, store.findNodesByKind(NodeKind.ANSWER).size());
            assertEquals(1, store.findEdges(EdgeType.DESCRIBES_CONTEXT).size());
            assertEquals(2, store.findEdges(EdgeType.ANSWERS).size(), "answers edges are only id-idempotent");
        }

        @Test
        @DisplayName("Should treat a user turn read from JSON as a customer question")
        void userRoleIsCustomer() throws Exception {
            // Given
            String json = "[{\"role\": \"user\", \"text\": \"Do you deliver on Sundays?\"},"
                    + " {\"role\": \"agent\", \"text\": \"Yes, until noon\"}]";
            List<TranscriptTurn> turns = new ObjectMapper().findAndRegisterModules()
                    .readValue(json, new TypeReference<List<TranscriptTurn>>() { });

            // When
            BuildSummary summary = builder.buildFromTranscript(turns, TestGraphs.INTENT);

            // Then
            assertEquals(TurnRole.CUSTOMER, turns.get(0).getRole());
            assertEquals(1, summary.getAnswersLinked());
            assertTrue(store.findQuestionByText("Do you deliver on Sundays?").isPresent());
            assertEquals("\"customer\"", new ObjectMapper().writeValueAsString(TurnRole.CUSTOMER));
        }
    }

    @Nested
    @DisplayName("Extraction mode")
    class ExtractionMode {

        @Test
        @DisplayName("Should rebuild the graph with labelled, inferred and fallback topics")
        void ingest_buildsTopicsAndLinks() {
            // Given: leftover state that must disappear
            store.findOrCreateQuestion("Stale question", null);
            ExtractedKnowledge knowledge = ExtractedKnowledge.builder()
                    .topics(List.of("Store  Hours", "Contact"))
                    .records(List.of(
                            ExtractedQaRecord.builder().topicLabel("Store Hours")
                                    .question("When are you open?").answer("9 to 5").actionLabel("Book pickup time").build(),
                            ExtractedQaRecord.builder().topicLabel("Occasions")
                                    .question("Do you do weddings?").answer("Yes").actionLabel("Plan a wedding").build(),
                            ExtractedQaRecord.builder()
                                    .question("Same-day?").answer("We ship before noon").build(),
                            ExtractedQaRecord.builder()
                                    .question("Who arranges them?").answer("Our florists").build(),
                            ExtractedQaRecord.builder()
                                    .question("Where are you?").answer("Main street").build(),
                            ExtractedQaRecord.builder().question("No answer").answer(" ").build()))
                    .build();

            // When
            IngestSummary summary = builder.ingestExtraction(knowledge, TestGraphs.INTENT, "https://florist.example");

            // Then
            assertTrue(store.findQuestionByText("Stale question").isEmpty());
            assertEquals(5, summary.getQaCount());
            assertThat(store.findNodesByKind(NodeKind.TOPIC))
                    .extracting(GraphNode::getLabel)
                    .containsExactly("Store Hours", "Contact", "Occasions", "Delivery & shipping", "General");
            assertEquals(5, summary.getTopicCount());
            assertEquals(3, store.findNodesByKind(NodeKind.ACTION).size(), "No action nodes created from records");

            assertEquals(0.6, topicEdgeOf("When are you open?").getConfidence());
            assertEquals(0.6, topicEdgeOf("Same-day?").getConfidence());
            assertEquals(0.3, topicEdgeOf("Who arranges them?").getConfidence());
            assertEquals(0.3, topicEdgeOf("Where are you?").getConfidence());
            assertEquals(topicEdgeOf("Who arranges them?").getSource(), topicEdgeOf("Where are you?").getSource(),
                    "Fallback topic is shared");

            List<GraphEdge> nextSteps = store.findEdges(EdgeType.NEXT_STEP);
            assertEquals(1, nextSteps.size(), "Unknown action labels are dropped");
            assertEquals("Book pickup time", store.getNode(nextSteps.get(0).getTarget()).orElseThrow().getLabel());
            assertEquals("https://florist.example", nextSteps.get(0).getMetadata().get("website"));
            assertEquals("website_ingest", nextSteps.get(0).getMetadata().get("source"));
        }

        @Test
        @DisplayName("Should give an explicit General label the fallback confidence")
        void explicitGeneral_isLowConfidence() {
            builder.ingestExtraction(ExtractedKnowledge.builder()
                    .records(List.of(ExtractedQaRecord.builder().topicLabel("General")
                            .question("Who are you?").answer("A family florist").build()))
                    .build(), TestGraphs.INTENT, null);

            assertEquals(0.3, topicEdgeOf("Who are you?").getConfidence());
        }

        private GraphEdge topicEdgeOf(String questionText) {
            GraphNode question = store.findQuestionByText(questionText).orElseThrow();
            List<GraphEdge> edges = store.findIncomingEdges(question.getId(), EdgeType.DESCRIBES_CONTEXT);
            assertEquals(1, edges.size());
            return edges.get(0);
        }
    }

    @Nested
    @DisplayName("Orphan repair")
    class Repair {

        @Test
        @DisplayName("Should link every question to one General topic, once")
        void repair_isIdempotent() {
            // Given: questions with answers but no topic links
            GraphNode q1 = store.findOrCreateQuestion("Hours?", null);
            GraphNode q2 = store.findOrCreateQuestion("Parking?", null);
            store.addEdge(GraphEdge.builder().id("a1").source(q1.getId()).target("x").type("answers").build());

            // When
            int first = builder.repairOrphanQuestions(TestGraphs.INTENT);
            int second = builder.repairOrphanQuestions(TestGraphs.INTENT);

            // Then
            assertEquals(2, first);
            assertEquals(0, second);
            assertThat(store.findNodesByKind(NodeKind.TOPIC))
                    .extracting(GraphNode::getLabel)
                    .containsExactly(GraphBuilderService.FALLBACK_TOPIC);
            List<GraphEdge> links = store.findEdges(EdgeType.DESCRIBES_CONTEXT);
            assertEquals(2, links.size());
            assertThat(links).allSatisfy(edge -> {
                assertEquals(0.3, edge.getConfidence());
                assertEquals("auto_repair", edge.getMetadata().get("source"));
            });
            assertThat(links).extracting(GraphEdge::getTarget).containsExactlyInAnyOrder(q1.getId(), q2.getId());
        }

        @Test
        @DisplayName("Should do nothing when topic links exist or there are no questions")
        void repair_noop() {
            assertEquals(0, builder.repairOrphanQuestions(TestGraphs.INTENT));

            builder.buildFromTranscript(List.of(
                    TranscriptTurn.customer("Do you ship?"), TranscriptTurn.agent("Yes")), TestGraphs.INTENT);
            store.findOrCreateQuestion("Orphan?", null);

            assertEquals(0, builder.repairOrphanQuestions(TestGraphs.INTENT));
            assertThat(store.findNodesByKind(NodeKind.TOPIC)).extracting(GraphNode::getLabel)
                    .doesNotContain(GraphBuilderService.FALLBACK_TOPIC);
        }
    }
}

package com.purchasingpower.salesgraph.service.graph.impl;

import com.purchasingpower.salesgraph.knowledge.GraphStore;
import com.purchasingpower.salesgraph.knowledge.TopicClassifier;
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
import com.purchasingpower.salesgraph.util.MetadataMaps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class GraphBuilderServiceImpl implements GraphBuilderService {

    static final double LABELLED_TOPIC_CONFIDENCE = 0.6;
    static final double FALLBACK_TOPIC_CONFIDENCE = 0.3;

    private final GraphStore graphStore;
    private final TopicClassifier topicClassifier;

    // ================================================================
    // TRANSCRIPT MODE
    // ================================================================

    @Override
    public BuildSummary buildFromTranscript(List<TranscriptTurn> turns, String intentId) {
        int linked = 0;
        GraphNode pendingQuestion = null;

        for (TranscriptTurn turn : turns) {
            String text = turn.getText() == null ? "" : turn.getText().strip();
            if (text.isEmpty() || turn.getRole() == null) {
                continue;
            }

            if (turn.getRole() == TurnRole.CUSTOMER) {
                if (pendingQuestion != null) {
                    log.debug("Dropping unanswered question '{}'", pendingQuestion.getLabel());
                }
                pendingQuestion = graphStore.findOrCreateQuestion(text, intentId);

            } else if (turn.getRole() == TurnRole.AGENT && pendingQuestion != null) {
                GraphNode answer = graphStore.findOrCreateAnswer(text, intentId);
                graphStore.addEdge(newEdge(pendingQuestion, answer, EdgeType.ANSWERS,
                        GraphEdge.DEFAULT_CONFIDENCE, MetadataMaps.created(intentId, SOURCE_SESSION)));

                String topicLabel = topicClassifier.classify(pendingQuestion.getText())
                        .orElse(KeywordTopicClassifier.DEFAULT_TOPIC);
                GraphNode topic = graphStore.findOrCreateTopic(topicLabel, intentId);
                linkTopic(topic, pendingQuestion, GraphEdge.DEFAULT_CONFIDENCE,
                        MetadataMaps.created(intentId, SOURCE_SESSION));

                linked++;
                pendingQuestion = null;
            }
        }

        log.info("Transcript build linked {} Q&A pairs ({} turns); graph now {} nodes, {} edges",
                linked, turns.size(), graphStore.nodeCount(), graphStore.edgeCount());

        return BuildSummary.builder()
                .answersLinked(linked)
                .nodeCount(graphStore.nodeCount())
                .edgeCount(graphStore.edgeCount())
                .build();
    }

    // ================================================================
    // EXTRACTION MODE
    // ================================================================

    @Override
    public IngestSummary ingestExtraction(ExtractedKnowledge knowledge, String intentId, String website) {
        graphStore.reset();

        Map<String, GraphNode> topics = new HashMap<>();

        // 1) explicit topic list
        for (String raw : knowledge.getTopics()) {
            String label = normalizeLabel(raw);
            if (!label.isEmpty()) {
                topics.computeIfAbsent(label, key -> graphStore.findOrCreateTopic(key, intentId));
            }
        }

        // 2) topic labels referenced by records
        for (ExtractedQaRecord record : knowledge.getRecords()) {
            String label = normalizeLabel(record.getTopicLabel());
            if (!label.isEmpty()) {
                topics.computeIfAbsent(label, key -> graphStore.findOrCreateTopic(key, intentId));
            }
        }

        GraphNode fallbackTopic = null;
        int qaCount = 0;

        for (ExtractedQaRecord record : knowledge.getRecords()) {
            String questionText = normalizeLabel(record.getQuestion());
            String answerText = normalizeLabel(record.getAnswer());
            if (questionText.isEmpty() || answerText.isEmpty()) {
                continue;
            }

            String topicLabel = normalizeLabel(record.getTopicLabel());
            if (topicLabel.isEmpty()) {
                topicLabel = topicClassifier.classify(questionText + " " + answerText).orElse("");
            }

            GraphNode topic;
            if (!topicLabel.isEmpty()) {
                topic = topics.computeIfAbsent(topicLabel, key -> graphStore.findOrCreateTopic(key, intentId));
            } else {
                if (fallbackTopic == null) {
                    fallbackTopic = graphStore.findOrCreateTopic(FALLBACK_TOPIC, intentId);
                }
                topic = fallbackTopic;
            }

            GraphNode question = graphStore.findOrCreateQuestion(questionText, intentId);
            GraphNode answer = graphStore.findOrCreateAnswer(answerText, intentId);

            double topicConfidence = !topicLabel.isEmpty() && !FALLBACK_TOPIC.equals(topicLabel)
                    ? LABELLED_TOPIC_CONFIDENCE
                    : FALLBACK_TOPIC_CONFIDENCE;
            graphStore.addEdge(newEdge(topic, question, EdgeType.DESCRIBES_CONTEXT, topicConfidence,
                    websiteMetadata(intentId, website)));
            graphStore.addEdge(newEdge(question, answer, EdgeType.ANSWERS, GraphEdge.DEFAULT_CONFIDENCE,
                    websiteMetadata(intentId, website)));

            String actionLabel = normalizeLabel(record.getActionLabel());
            if (!actionLabel.isEmpty()) {
                graphStore.findActionByLabel(actionLabel).ifPresentOrElse(
                        action -> graphStore.addEdge(newEdge(answer, action, EdgeType.NEXT_STEP,
                                GraphEdge.DEFAULT_CONFIDENCE, websiteMetadata(intentId, website))),
                        () -> log.debug("No action node named '{}', next step dropped", actionLabel));
            }

            qaCount++;
        }

        int topicCount = graphStore.findNodesByKind(NodeKind.TOPIC).size();
        log.info("Ingested {} Q&A records into {} topics from {}", qaCount, topicCount,
                website != null ? website : "extractor payload");

        return IngestSummary.builder()
                .topicCount(topicCount)
                .qaCount(qaCount)
                .build();
    }

    // ================================================================
    // REPAIR
    // ================================================================

    @Override
    public int repairOrphanQuestions(String intentId) {
        if (!graphStore.findEdges(EdgeType.DESCRIBES_CONTEXT).isEmpty()) {
            return 0;
        }
        List<GraphNode> questions = graphStore.findNodesByKind(NodeKind.QUESTION);
        if (questions.isEmpty()) {
            return 0;
        }

        GraphNode fallbackTopic = graphStore.findOrCreateTopic(FALLBACK_TOPIC, intentId);
        Set<String> linkedQuestions = graphStore.findOutgoingEdges(fallbackTopic.getId(), EdgeType.DESCRIBES_CONTEXT)
                .stream()
                .map(GraphEdge::getTarget)
                .collect(Collectors.toSet());

        int created = 0;
        for (GraphNode question : questions) {
            if (linkedQuestions.contains(question.getId())) {
                continue;
            }
            graphStore.addEdge(newEdge(fallbackTopic, question, EdgeType.DESCRIBES_CONTEXT,
                    FALLBACK_TOPIC_CONFIDENCE, MetadataMaps.created(intentId, SOURCE_REPAIR)));
            created++;
        }

        log.warn("Repaired graph: linked {} orphan questions to '{}'", created, FALLBACK_TOPIC);
        return created;
    }

    // ================================================================
    // HELPERS
    // ================================================================

    /**
     * Adds a topic link unless the same topic already describes the question.
     */
    private void linkTopic(GraphNode topic, GraphNode question, double confidence, Map<String, Object> metadata) {
        if (graphStore.findEdge(topic.getId(), question.getId(), EdgeType.DESCRIBES_CONTEXT).isPresent()) {
            return;
        }
        graphStore.addEdge(newEdge(topic, question, EdgeType.DESCRIBES_CONTEXT, confidence, metadata));
    }

    private static GraphEdge newEdge(GraphNode source, GraphNode target, EdgeType type,
                                     double confidence, Map<String, Object> metadata) {
        return GraphEdge.builder()
                .id(UUID.randomUUID().toString())
                .source(source.getId())
                .target(target.getId())
                .type(type.getValue())
                .weight(GraphEdge.DEFAULT_WEIGHT)
                .confidence(confidence)
                .metadata(metadata)
                .build();
    }

    private static Map<String, Object> websiteMetadata(String intentId, String website) {
        Map<String, Object> metadata = MetadataMaps.created(intentId, SOURCE_WEBSITE);
        if (website != null && !website.isBlank()) {
            metadata.put(MetadataMaps.WEBSITE, website);
        }
        return metadata;
    }

    /**
     * Trim and collapse internal whitespace runs to single spaces.
     */
    static String normalizeLabel(String value) {
        if (value == null) {
            return "";
        }
        return value.strip().replaceAll("\\s+", " ");
    }
}

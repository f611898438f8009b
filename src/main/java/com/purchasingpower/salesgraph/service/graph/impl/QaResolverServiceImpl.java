package com.purchasingpower.salesgraph.service.graph.impl;

import com.purchasingpower.salesgraph.knowledge.GraphStore;
import com.purchasingpower.salesgraph.model.graph.EdgeType;
import com.purchasingpower.salesgraph.model.graph.GraphEdge;
import com.purchasingpower.salesgraph.model.graph.GraphNode;
import com.purchasingpower.salesgraph.model.graph.NodeKind;
import com.purchasingpower.salesgraph.model.result.QaResult;
import com.purchasingpower.salesgraph.model.result.SuggestedAction;
import com.purchasingpower.salesgraph.service.graph.QaResolverService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class QaResolverServiceImpl implements QaResolverService {

    private final GraphStore graphStore;

    @Override
    public QaResult resolve(String questionId) {
        if (questionId == null || questionId.isBlank()) {
            return QaResult.unanswered(QaResult.REASON_EMPTY_QUESTION);
        }

        Optional<GraphNode> questionNode = graphStore.getNode(questionId).filter(node -> node.is(NodeKind.QUESTION));
        if (questionNode.isEmpty()) {
            log.debug("Question {} not in graph", questionId);
            return QaResult.unanswered(QaResult.REASON_UNKNOWN_QUESTION);
        }
        GraphNode question = questionNode.get();

        Optional<GraphEdge> answerEdge = graphStore.findOutgoingEdges(question.getId(), EdgeType.ANSWERS)
                .stream()
                .findFirst();
        if (answerEdge.isEmpty()) {
            return QaResult.unanswered(question.getId(), question.getText(), QaResult.REASON_NO_ANSWER_EDGE);
        }

        Optional<GraphNode> answerNode = graphStore.getNode(answerEdge.get().getTarget());
        if (answerNode.isEmpty()) {
            log.warn("answers edge {} points at missing node {}", answerEdge.get().getId(), answerEdge.get().getTarget());
            return QaResult.unanswered(question.getId(), question.getText(), QaResult.REASON_ANSWER_MISSING);
        }
        GraphNode answer = answerNode.get();

        List<SuggestedAction> actions = new ArrayList<>();
        for (GraphEdge step : graphStore.findOutgoingEdges(answer.getId(), EdgeType.NEXT_STEP)) {
            graphStore.getNode(step.getTarget()).ifPresent(action -> actions.add(SuggestedAction.builder()
                    .id(action.getId())
                    .label(action.getLabel() != null && !action.getLabel().isEmpty() ? action.getLabel() : action.getText())
                    .description(action.getText())
                    .build()));
        }

        log.debug("Resolved question {} via edge {} (confidence {}, {} actions)",
                question.getId(), answerEdge.get().getId(), answerEdge.get().getConfidence(), actions.size());

        return QaResult.builder()
                .matchedQuestionId(question.getId())
                .matchedQuestion(question.getText())
                .answerEdgeId(answerEdge.get().getId())
                .answer(answer.getText())
                .confidence(answerEdge.get().getConfidence())
                .actions(actions)
                .build();
    }
}

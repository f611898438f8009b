package com.purchasingpower.salesgraph.service.graph.impl;

import com.purchasingpower.salesgraph.knowledge.GraphStore;
import com.purchasingpower.salesgraph.model.graph.EdgeType;
import com.purchasingpower.salesgraph.model.graph.GraphEdge;
import com.purchasingpower.salesgraph.model.graph.GraphNode;
import com.purchasingpower.salesgraph.model.result.ReviewTask;
import com.purchasingpower.salesgraph.service.graph.ReviewTaskService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class ReviewTaskServiceImpl implements ReviewTaskService {

    private final GraphStore graphStore;

    @Override
    public List<ReviewTask> listTasks() {
        List<ReviewTask> tasks = new ArrayList<>();
        for (GraphEdge edge : graphStore.findEdges(EdgeType.ANSWERS)) {
            Optional<GraphNode> question = graphStore.getNode(edge.getSource());
            Optional<GraphNode> answer = graphStore.getNode(edge.getTarget());
            if (question.isEmpty() || answer.isEmpty()) {
                continue;
            }
            tasks.add(ReviewTask.builder()
                    .id(edge.getId())
                    .edgeId(edge.getId())
                    .question(question.get().getText())
                    .answer(answer.get().getText())
                    .confidence(edge.getConfidence())
                    .topicLabel(topicLabel(question.get()).orElse(null))
                    .build());
        }
        return tasks;
    }

    private Optional<String> topicLabel(GraphNode question) {
        return graphStore.findIncomingEdges(question.getId(), EdgeType.DESCRIBES_CONTEXT).stream()
                .findFirst()
                .flatMap(edge -> graphStore.getNode(edge.getSource()))
                .map(topic -> topic.getLabel() != null && !topic.getLabel().isEmpty() ? topic.getLabel() : topic.getText());
    }
}

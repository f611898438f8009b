package com.purchasingpower.salesgraph.knowledge.impl;

import com.purchasingpower.salesgraph.knowledge.GraphStore;
import com.purchasingpower.salesgraph.knowledge.QuestionRouter;
import com.purchasingpower.salesgraph.model.graph.GraphNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Routes only when the text equals a known question after trimming and lowercasing.
 *
 * <p>Semantic routers replace this bean.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExactTextQuestionRouter implements QuestionRouter {

    private final GraphStore graphStore;

    @Override
    public Optional<String> route(String text) {
        Optional<String> questionId = graphStore.findQuestionByText(text).map(GraphNode::getId);
        log.debug("Routed '{}' to {}", text, questionId.orElse("nothing"));
        return questionId;
    }
}

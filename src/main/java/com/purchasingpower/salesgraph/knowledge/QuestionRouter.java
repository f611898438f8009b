package com.purchasingpower.salesgraph.knowledge;

import java.util.Optional;

/**
 * Maps free text from a caller to a question node already in the graph.
 *
 * <p>Semantic matching lives outside this project; implementations are plugged in as beans.
 *
 * @since 1.0.0
 */
public interface QuestionRouter {

    /**
     * @param text User question
     * @return Id of a known question node, or empty when none fits
     */
    Optional<String> route(String text);
}

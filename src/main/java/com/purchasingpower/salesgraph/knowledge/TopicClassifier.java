package com.purchasingpower.salesgraph.knowledge;

import java.util.Optional;

/**
 * Assigns a topic label to question (and answer) text.
 *
 * @since 1.0.0
 */
public interface TopicClassifier {

    /**
     * @param text Text to classify
     * @return Topic label, or empty when no rule matches
     */
    Optional<String> classify(String text);
}

package com.purchasingpower.salesgraph.knowledge.impl;

import com.purchasingpower.salesgraph.knowledge.TopicClassifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Ordered keyword rules; the first rule with a keyword contained in the text wins.
 *
 * @since 1.0.0
 */
@Component
public class KeywordTopicClassifier implements TopicClassifier {

    /**
     * Label used when a dialogue question matches no rule.
     */
    public static final String DEFAULT_TOPIC = "General offering";

    static final List<TopicRule> RULES = List.of(
        new TopicRule(List.of("delivery", "ship", "shipping"), "Delivery & shipping"),
        new TopicRule(List.of("price", "cost", "discount"), "Pricing & discounts"),
        new TopicRule(List.of("refund", "return", "warranty"), "Refunds & warranty"),
        new TopicRule(List.of("custom", "bespoke"), "Custom orders")
    );

    private final List<TopicRule> rules;

    public KeywordTopicClassifier() {
        this(RULES);
    }

    public KeywordTopicClassifier(List<TopicRule> rules) {
        this.rules = List.copyOf(rules);
    }

    @Override
    public Optional<String> classify(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String haystack = text.toLowerCase(Locale.ROOT);
        return rules.stream()
                .filter(rule -> rule.matches(haystack))
                .map(TopicRule::label)
                .findFirst();
    }

    /**
     * @param keywords Lowercase substrings, any of which selects the label
     * @param label Topic label
     */
    public record TopicRule(List<String> keywords, String label) {

        boolean matches(String lowercaseText) {
            return keywords.stream().anyMatch(lowercaseText::contains);
        }
    }
}

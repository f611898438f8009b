package com.purchasingpower.salesgraph.model.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Node kinds in the sales knowledge graph.
 *
 * <p>Serialized in lowercase. Older snapshots call topics {@code clue}; that name is still
 * accepted on read.
 *
 * @since 1.0.0
 */
public enum NodeKind {
    TOPIC,
    QUESTION,
    ANSWER,
    ACTION,
    INTENT;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NodeKind fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Node kind is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("CLUE".equals(normalized)) {
            return TOPIC;
        }
        return NodeKind.valueOf(normalized);
    }
}

package com.purchasingpower.salesgraph.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.purchasingpower.salesgraph.util.MetadataMaps;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A vertex in the sales knowledge graph.
 *
 * <p>{@code id} and {@code kind} are fixed at creation. Only answer nodes have their
 * {@code text} and {@code label} rewritten, through an explicit correction.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "type", "label", "text", "intent_id", "metadata", "stats"})
public class GraphNode {

    public static final int LABEL_MAX_LENGTH = 60;

    private String id;

    @JsonProperty("type")
    private NodeKind kind;

    private String label;

    private String text;

    @JsonProperty("intent_id")
    private String intentId;

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Builder.Default
    @JsonSetter(nulls = Nulls.SKIP)
    private NodeStats stats = new NodeStats();

    public GraphNode copy() {
        return GraphNode.builder()
                .id(id)
                .kind(kind)
                .label(label)
                .text(text)
                .intentId(intentId)
                .metadata(MetadataMaps.deepCopy(metadata))
                .stats(stats != null ? stats.copy() : new NodeStats())
                .build();
    }

    public boolean is(NodeKind expected) {
        return kind == expected;
    }

    /**
     * Display label for a piece of text: its first {@value #LABEL_MAX_LENGTH} code points.
     */
    public static String labelFor(String text) {
        if (text == null) {
            return "";
        }
        if (text.codePointCount(0, text.length()) <= LABEL_MAX_LENGTH) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, LABEL_MAX_LENGTH));
    }
}

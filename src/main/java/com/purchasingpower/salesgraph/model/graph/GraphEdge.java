package com.purchasingpower.salesgraph.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
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
 * Directed, typed relationship between two nodes.
 *
 * <p>Endpoints are plain ids and may dangle; readers treat a missing endpoint as not found.
 * {@code confidence} is only changed by feedback.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "source", "target", "type", "weight", "confidence", "metadata"})
public class GraphEdge {

    public static final double DEFAULT_WEIGHT = 0.5;
    public static final double DEFAULT_CONFIDENCE = 0.5;

    private String id;

    private String source;

    private String target;

    private String type;

    @Builder.Default
    private double weight = DEFAULT_WEIGHT;

    @Builder.Default
    private double confidence = DEFAULT_CONFIDENCE;

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public GraphEdge copy() {
        return GraphEdge.builder()
                .id(id)
                .source(source)
                .target(target)
                .type(type)
                .weight(weight)
                .confidence(confidence)
                .metadata(MetadataMaps.deepCopy(metadata))
                .build();
    }

    public boolean is(EdgeType expected) {
        return expected.matches(type);
    }
}

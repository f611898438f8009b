package com.purchasingpower.salesgraph.service.graph.impl;

import com.purchasingpower.salesgraph.configuration.AppProperties;
import com.purchasingpower.salesgraph.exception.InvalidInputException;
import com.purchasingpower.salesgraph.exception.NotFoundException;
import com.purchasingpower.salesgraph.knowledge.GraphStore;
import com.purchasingpower.salesgraph.model.graph.GraphEdge;
import com.purchasingpower.salesgraph.service.graph.EdgeFeedbackService;
import com.purchasingpower.salesgraph.util.MetadataMaps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class EdgeFeedbackServiceImpl implements EdgeFeedbackService {

    static final String FEEDBACK_KEY = "feedback";
    static final String POSITIVE = "pos";
    static final String NEGATIVE = "neg";
    static final String VIEWS = "views";

    private final GraphStore graphStore;
    private final AppProperties appProperties;

    @Override
    public GraphEdge applyFeedback(String edgeId, int value) {
        if (value != 1 && value != -1) {
            throw new InvalidInputException("Feedback value must be +1 or -1, got " + value);
        }
        GraphEdge edge = graphStore.getEdge(edgeId)
                .orElseThrow(() -> new NotFoundException("Edge not found: " + edgeId));

        Map<String, Object> counters = counters(edge);
        double pos = MetadataMaps.number(counters, POSITIVE);
        double neg = MetadataMaps.number(counters, NEGATIVE);
        double views = MetadataMaps.number(counters, VIEWS) + 1.0;
        if (value > 0) {
            pos += 1.0;
        } else {
            neg += 1.0;
        }
        counters.put(POSITIVE, pos);
        counters.put(NEGATIVE, neg);
        counters.put(VIEWS, views);

        double score = (pos - neg) / Math.max(1.0, views);
        double confidence = squash(score, appProperties.getFeedback().getSensitivity());
        edge.setConfidence(confidence);

        log.info("Feedback {} on edge {}: pos={}, neg={}, views={}, confidence={}",
                value > 0 ? "+1" : "-1", edgeId, pos, neg, views, String.format("%.4f", confidence));
        return edge;
    }

    /**
     * Logistic function of {@code sensitivity * score}, clamped to [0, 1].
     */
    static double squash(double score, double sensitivity) {
        double confidence = 1.0 / (1.0 + Math.exp(-sensitivity * score));
        return Math.min(1.0, Math.max(0.0, confidence));
    }

    /**
     * The edge's live counter map, created on first feedback. Snapshots restored from JSON
     * hold plain maps with numeric values, which is all this needs.
     */
    @SuppressWarnings("unchecked")
    private static Map<String, Object> counters(GraphEdge edge) {
        Object existing = edge.getMetadata().get(FEEDBACK_KEY);
        if (existing instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        Map<String, Object> counters = new LinkedHashMap<>();
        counters.put(POSITIVE, 0.0);
        counters.put(NEGATIVE, 0.0);
        counters.put(VIEWS, 0.0);
        edge.getMetadata().put(FEEDBACK_KEY, counters);
        return counters;
    }
}

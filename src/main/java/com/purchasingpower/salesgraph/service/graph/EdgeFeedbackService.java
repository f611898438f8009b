package com.purchasingpower.salesgraph.service.graph;

import com.purchasingpower.salesgraph.model.graph.GraphEdge;

/**
 * Turns thumbs-up / thumbs-down judgments on an edge into its confidence.
 */
public interface EdgeFeedbackService {

    /**
     * Record one judgment and recompute the edge confidence.
     *
     * <p>Counters accumulate in {@code metadata.feedback} as {@code pos}, {@code neg} and
     * {@code views}. With {@code score = (pos - neg) / max(1, views)} the new confidence is
     * {@code 1 / (1 + e^(-sensitivity * score))}: 0.5 for a balanced history, approaching
     * 0 or 1 as votes agree. Every vote weighs the same regardless of age.
     *
     * @param edgeId Edge being judged
     * @param value +1 for good, -1 for bad
     * @return The updated edge
     * @throws com.purchasingpower.salesgraph.exception.NotFoundException if the edge is unknown
     * @throws com.purchasingpower.salesgraph.exception.InvalidInputException if value is not +1 or -1
     */
    GraphEdge applyFeedback(String edgeId, int value);
}

package com.purchasingpower.salesgraph.service.graph;

import com.purchasingpower.salesgraph.model.result.QaResult;

/**
 * Answers a question node by walking question -> answer -> actions.
 */
public interface QaResolverService {

    /**
     * Resolve the answer and suggested actions for a question already picked by a router.
     *
     * <p>Uses the first {@code answers} edge in insertion order. If a question has several
     * answer edges (repeated builds can create them) which one wins is not defined beyond
     * being stable for the lifetime of the graph.
     *
     * @param questionId Question node id
     * @return Answered result, or an unanswered one carrying a reason; never throws for
     *     unknown or unlinked ids
     */
    QaResult resolve(String questionId);
}

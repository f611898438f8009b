package com.purchasingpower.salesgraph.service.graph;

import com.purchasingpower.salesgraph.model.result.ReviewTask;

import java.util.List;

/**
 * Lists answer links for owner review.
 */
public interface ReviewTaskService {

    /**
     * One task per {@code answers} edge whose question and answer both exist, in edge
     * insertion order. The topic label comes from the first topic describing the question.
     */
    List<ReviewTask> listTasks();
}

package com.purchasingpower.salesgraph.knowledge;

import com.purchasingpower.salesgraph.model.graph.GraphEdge;
import com.purchasingpower.salesgraph.model.graph.GraphNode;
import com.purchasingpower.salesgraph.model.graph.GraphSnapshot;
import com.purchasingpower.salesgraph.model.ingest.ExtractedKnowledge;
import com.purchasingpower.salesgraph.model.ingest.TurnRole;
import com.purchasingpower.salesgraph.model.result.BuildSummary;
import com.purchasingpower.salesgraph.model.result.GraphContext;
import com.purchasingpower.salesgraph.model.result.IngestSummary;
import com.purchasingpower.salesgraph.model.result.QaResult;
import com.purchasingpower.salesgraph.model.result.ReviewTask;

import java.util.List;

/**
 * Entry point for everything outside the graph core.
 *
 * <p>Owns the single store instance of the process: mutations and snapshot writes are
 * exclusive, reads run concurrently with each other. When autosave is on, every mutation is
 * followed by a snapshot write.
 *
 * @since 1.0.0
 */
public interface GraphManager {

    // =========================================================================
    // Question answering
    // =========================================================================

    /**
     * Route free text to a known question and resolve its answer.
     *
     * @param question User question
     * @return Resolved answer, or a result whose reason explains why there is none
     */
    QaResult ask(String question);

    /**
     * Resolve a question node picked by the caller.
     */
    QaResult resolve(String questionId);

    /**
     * Facts and actions a dialogue composer may use to answer in its own words.
     */
    GraphContext graphContext(String question);

    // =========================================================================
    // Feedback and review
    // =========================================================================

    GraphEdge applyFeedback(String edgeId, int value);

    /**
     * Replace the answer at the end of an {@code answers} edge.
     *
     * @param edgeId Id of the {@code answers} edge
     * @param newAnswer Corrected answer text
     * @return The corrected answer node
     */
    GraphNode updateAnswer(String edgeId, String newAnswer);

    List<ReviewTask> listReviewTasks();

    // =========================================================================
    // Building
    // =========================================================================

    int appendSessionTurn(String sessionId, TurnRole role, String text);

    /**
     * Turn a collected session transcript into graph knowledge.
     */
    BuildSummary buildFromSession(String sessionId);

    /**
     * Extract knowledge from a corpus and rebuild the graph from it.
     *
     * @param corpus Extractor input
     * @param website Provenance recorded on the created edges, may be null
     */
    IngestSummary ingestCorpus(String corpus, String website);

    /**
     * Rebuild the graph from already extracted knowledge.
     */
    IngestSummary ingest(ExtractedKnowledge knowledge, String website);

    int repairOrphanQuestions();

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Drop every node, edge and session transcript, then reseed default actions.
     */
    void reset();

    GraphSnapshot snapshot();
}

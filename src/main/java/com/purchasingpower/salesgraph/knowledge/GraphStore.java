package com.purchasingpower.salesgraph.knowledge;

import com.purchasingpower.salesgraph.model.graph.EdgeType;
import com.purchasingpower.salesgraph.model.graph.GraphEdge;
import com.purchasingpower.salesgraph.model.graph.GraphNode;
import com.purchasingpower.salesgraph.model.graph.GraphSnapshot;
import com.purchasingpower.salesgraph.model.graph.NodeKind;

import java.util.List;
import java.util.Optional;

/**
 * Authoritative id-to-node and id-to-edge mapping for one sales knowledge graph.
 *
 * <p>Question and answer nodes are unique per normalized text (trimmed, lowercased); topic and
 * action nodes are unique per normalized label. Raw adds are idempotent by id only.
 *
 * <p>Implementations are not synchronized. Callers serialize mutations against each other
 * and against reads (see {@link GraphManager}).
 *
 * @since 1.0.0
 */
public interface GraphStore {

    // =========================================================================
    // Deduplicating creation
    // =========================================================================

    /**
     * Find the question with the same normalized text, or create one.
     *
     * @param text Question text, must not be blank
     * @param intentId Optional intent scope
     * @return Existing or newly created question node
     */
    GraphNode findOrCreateQuestion(String text, String intentId);

    /**
     * Find the answer with the same normalized text, or create one.
     *
     * @param text Answer text, must not be blank
     * @param intentId Optional intent scope
     * @return Existing or newly created answer node
     */
    GraphNode findOrCreateAnswer(String text, String intentId);

    /**
     * Find the topic with the same normalized label, or create one.
     *
     * @param label Topic label, must not be blank
     * @param intentId Optional intent scope
     * @return Existing or newly created topic node
     */
    GraphNode findOrCreateTopic(String label, String intentId);

    /**
     * Find the action with the same normalized label, or create one whose text is the
     * description (or the label when no description is given).
     *
     * @param label Action label, must not be blank
     * @param description Optional longer description
     * @param intentId Optional intent scope
     * @return Existing or newly created action node
     */
    GraphNode findOrCreateAction(String label, String description, String intentId);

    // =========================================================================
    // Raw operations
    // =========================================================================

    /**
     * Insert a node unless its id is already present.
     *
     * @return The stored node, which is the existing one on an id collision
     */
    GraphNode addNode(GraphNode node);

    /**
     * Insert an edge unless its id is already present.
     *
     * @return The stored edge, which is the existing one on an id collision
     */
    GraphEdge addEdge(GraphEdge edge);

    Optional<GraphNode> getNode(String nodeId);

    Optional<GraphEdge> getEdge(String edgeId);

    /**
     * Rewrite the text and label of an answer node.
     *
     * @param answerId Id of an existing answer node
     * @param newText Replacement text, must not be blank
     * @return The corrected node
     */
    GraphNode correctAnswer(String answerId, String newText);

    // =========================================================================
    // Queries
    // =========================================================================

    List<GraphNode> findNodesByKind(NodeKind kind);

    Optional<GraphNode> findQuestionByText(String text);

    Optional<GraphNode> findActionByLabel(String label);

    /**
     * All edges of a type, in insertion order.
     */
    List<GraphEdge> findEdges(EdgeType type);

    /**
     * Edges of a type leaving a node, in insertion order.
     */
    List<GraphEdge> findOutgoingEdges(String sourceId, EdgeType type);

    /**
     * Edges of a type entering a node, in insertion order.
     */
    List<GraphEdge> findIncomingEdges(String targetId, EdgeType type);

    /**
     * First edge with exactly this source, target and type.
     */
    Optional<GraphEdge> findEdge(String sourceId, String targetId, EdgeType type);

    int nodeCount();

    int edgeCount();

    // =========================================================================
    // Whole-graph operations
    // =========================================================================

    /**
     * Discard every node and edge, then reseed the default action nodes.
     */
    void reset();

    /**
     * Detached copy of the current nodes and edges in insertion order.
     */
    GraphSnapshot snapshot();

    /**
     * Replace all state with the contents of a snapshot. Missing metadata becomes an empty
     * map and missing stats become zeroed counters.
     */
    void restore(GraphSnapshot snapshot);
}

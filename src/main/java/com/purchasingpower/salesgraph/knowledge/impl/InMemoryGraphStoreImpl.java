package com.purchasingpower.salesgraph.knowledge.impl;

import com.purchasingpower.salesgraph.exception.InvalidInputException;
import com.purchasingpower.salesgraph.exception.NotFoundException;
import com.purchasingpower.salesgraph.knowledge.GraphSeeder;
import com.purchasingpower.salesgraph.knowledge.GraphStore;
import com.purchasingpower.salesgraph.model.graph.EdgeType;
import com.purchasingpower.salesgraph.model.graph.GraphEdge;
import com.purchasingpower.salesgraph.model.graph.GraphNode;
import com.purchasingpower.salesgraph.model.graph.GraphSnapshot;
import com.purchasingpower.salesgraph.model.graph.NodeKind;
import com.purchasingpower.salesgraph.model.graph.NodeStats;
import com.purchasingpower.salesgraph.util.MetadataMaps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * In-memory implementation of GraphStore.
 *
 * <p>Nodes and edges are kept in insertion order. Dedup lookups go through a per-kind index
 * from normalized key to node id, filled with first-writer-wins so it always agrees with a
 * front-to-back scan of the nodes.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InMemoryGraphStoreImpl implements GraphStore {

    private final GraphSeeder seeder;

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<String, GraphEdge> edges = new LinkedHashMap<>();
    private final Map<NodeKind, Map<String, String>> dedupIndex = new EnumMap<>(NodeKind.class);

    @Override
    public GraphNode findOrCreateQuestion(String text, String intentId) {
        return findOrCreateByText(NodeKind.QUESTION, text, intentId);
    }

    @Override
    public GraphNode findOrCreateAnswer(String text, String intentId) {
        return findOrCreateByText(NodeKind.ANSWER, text, intentId);
    }

    @Override
    public GraphNode findOrCreateTopic(String label, String intentId) {
        requireText(label, "Topic label");
        Optional<GraphNode> existing = lookup(NodeKind.TOPIC, GraphNode.labelFor(label));
        if (existing.isPresent()) {
            return existing.get();
        }
        return insert(newNode(NodeKind.TOPIC, GraphNode.labelFor(label), label, intentId));
    }

    @Override
    public GraphNode findOrCreateAction(String label, String description, String intentId) {
        requireText(label, "Action label");
        Optional<GraphNode> existing = lookup(NodeKind.ACTION, GraphNode.labelFor(label));
        if (existing.isPresent()) {
            return existing.get();
        }
        String text = description != null && !description.isBlank() ? description : label;
        return insert(newNode(NodeKind.ACTION, GraphNode.labelFor(label), text, intentId));
    }

    @Override
    public GraphNode addNode(GraphNode node) {
        validateNode(node);
        GraphNode existing = nodes.get(node.getId());
        if (existing != null) {
            return existing;
        }
        return insert(node);
    }

    @Override
    public GraphEdge addEdge(GraphEdge edge) {
        validateEdge(edge);
        GraphEdge existing = edges.get(edge.getId());
        if (existing != null) {
            return existing;
        }
        if (edge.getMetadata() == null) {
            edge.setMetadata(new LinkedHashMap<>());
        }
        edges.put(edge.getId(), edge);
        log.debug("Added {} edge {} ({} -> {})", edge.getType(), edge.getId(), edge.getSource(), edge.getTarget());
        return edge;
    }

    @Override
    public Optional<GraphNode> getNode(String nodeId) {
        return nodeId == null ? Optional.empty() : Optional.ofNullable(nodes.get(nodeId));
    }

    @Override
    public Optional<GraphEdge> getEdge(String edgeId) {
        return edgeId == null ? Optional.empty() : Optional.ofNullable(edges.get(edgeId));
    }

    @Override
    public GraphNode correctAnswer(String answerId, String newText) {
        GraphNode node = getNode(answerId)
                .orElseThrow(() -> new NotFoundException("Answer node not found: " + answerId));
        if (!node.is(NodeKind.ANSWER)) {
            throw new InvalidInputException("Node " + answerId + " is a " + node.getKind().getValue() + ", not an answer");
        }
        String text = newText == null ? "" : newText.strip();
        requireText(text, "Answer text");

        node.setText(text);
        node.setLabel(GraphNode.labelFor(text));
        rebuildIndex(NodeKind.ANSWER);

        log.info("Corrected answer {}", answerId);
        return node;
    }

    @Override
    public List<GraphNode> findNodesByKind(NodeKind kind) {
        return nodes.values().stream()
                .filter(node -> node.is(kind))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<GraphNode> findQuestionByText(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        return lookup(NodeKind.QUESTION, text);
    }

    @Override
    public Optional<GraphNode> findActionByLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        return lookup(NodeKind.ACTION, GraphNode.labelFor(label));
    }

    @Override
    public List<GraphEdge> findEdges(EdgeType type) {
        return edges.values().stream()
                .filter(edge -> edge.is(type))
                .collect(Collectors.toList());
    }

    @Override
    public List<GraphEdge> findOutgoingEdges(String sourceId, EdgeType type) {
        return edges.values().stream()
                .filter(edge -> edge.is(type) && Objects.equals(edge.getSource(), sourceId))
                .collect(Collectors.toList());
    }

    @Override
    public List<GraphEdge> findIncomingEdges(String targetId, EdgeType type) {
        return edges.values().stream()
                .filter(edge -> edge.is(type) && Objects.equals(edge.getTarget(), targetId))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<GraphEdge> findEdge(String sourceId, String targetId, EdgeType type) {
        return edges.values().stream()
                .filter(edge -> edge.is(type))
                .filter(edge -> Objects.equals(edge.getSource(), sourceId) && Objects.equals(edge.getTarget(), targetId))
                .findFirst();
    }

    @Override
    public int nodeCount() {
        return nodes.size();
    }

    @Override
    public int edgeCount() {
        return edges.size();
    }

    @Override
    public void reset() {
        log.info("Resetting graph ({} nodes, {} edges discarded)", nodes.size(), edges.size());
        clear();
        seeder.seed(this);
    }

    @Override
    public GraphSnapshot snapshot() {
        List<GraphNode> nodeCopies = new ArrayList<>(nodes.size());
        nodes.values().forEach(node -> nodeCopies.add(node.copy()));
        List<GraphEdge> edgeCopies = new ArrayList<>(edges.size());
        edges.values().forEach(edge -> edgeCopies.add(edge.copy()));
        return GraphSnapshot.builder()
                .nodes(nodeCopies)
                .edges(edgeCopies)
                .build();
    }

    @Override
    public void restore(GraphSnapshot snapshot) {
        if (snapshot == null) {
            clear();
            return;
        }
        // a rejected snapshot leaves the current graph in place
        snapshot.getNodes().forEach(InMemoryGraphStoreImpl::validateNode);
        snapshot.getEdges().forEach(InMemoryGraphStoreImpl::validateEdge);

        clear();
        for (GraphNode node : snapshot.getNodes()) {
            addNode(node.copy());
        }
        for (GraphEdge edge : snapshot.getEdges()) {
            addEdge(edge.copy());
        }
        log.info("Restored graph: {} nodes, {} edges", nodes.size(), edges.size());
    }

    // ================================================================
    // Internals
    // ================================================================

    private GraphNode findOrCreateByText(NodeKind kind, String text, String intentId) {
        requireText(text, kind.getValue() + " text");
        Optional<GraphNode> existing = lookup(kind, text);
        if (existing.isPresent()) {
            return existing.get();
        }
        return insert(newNode(kind, GraphNode.labelFor(text), text, intentId));
    }

    private Optional<GraphNode> lookup(NodeKind kind, String value) {
        String nodeId = dedupIndex.getOrDefault(kind, Map.of()).get(normalize(value));
        return nodeId == null ? Optional.empty() : Optional.ofNullable(nodes.get(nodeId));
    }

    private GraphNode insert(GraphNode node) {
        if (node.getMetadata() == null) {
            node.setMetadata(new LinkedHashMap<>());
        }
        if (node.getStats() == null) {
            node.setStats(new NodeStats());
        }
        nodes.put(node.getId(), node);
        index(node);
        log.debug("Added {} node {} '{}'", node.getKind().getValue(), node.getId(), node.getLabel());
        return node;
    }

    private void index(GraphNode node) {
        String key = dedupKey(node);
        if (key != null) {
            dedupIndex.computeIfAbsent(node.getKind(), kind -> new HashMap<>()).putIfAbsent(key, node.getId());
        }
    }

    private void rebuildIndex(NodeKind kind) {
        dedupIndex.remove(kind);
        nodes.values().stream()
                .filter(node -> node.is(kind))
                .forEach(this::index);
    }

    /**
     * Questions and answers dedup on text, topics and actions on label, intents not at all.
     */
    private static String dedupKey(GraphNode node) {
        if (node.getKind() == null) {
            return null;
        }
        return switch (node.getKind()) {
            case QUESTION, ANSWER -> node.getText() == null ? null : normalize(node.getText());
            case TOPIC, ACTION -> node.getLabel() == null ? null : normalize(node.getLabel());
            case INTENT -> null;
        };
    }

    private static GraphNode newNode(NodeKind kind, String label, String text, String intentId) {
        return GraphNode.builder()
                .id(UUID.randomUUID().toString())
                .kind(kind)
                .label(label)
                .text(text)
                .intentId(intentId)
                .metadata(MetadataMaps.created(null, null))
                .stats(new NodeStats())
                .build();
    }

    static String normalize(String value) {
        return value.strip().toLowerCase(Locale.ROOT);
    }

    private static void validateNode(GraphNode node) {
        if (node == null || node.getId() == null || node.getKind() == null) {
            throw new InvalidInputException("Node id and type are required");
        }
    }

    /**
     * Edges need an id and type, and weight and confidence within [0, 1].
     */
    private static void validateEdge(GraphEdge edge) {
        if (edge == null || edge.getId() == null || edge.getType() == null) {
            throw new InvalidInputException("Edge id and type are required");
        }
        requireUnitInterval(edge.getWeight(), "weight", edge.getId());
        requireUnitInterval(edge.getConfidence(), "confidence", edge.getId());
    }

    private static void requireUnitInterval(double value, String field, String edgeId) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvalidInputException("Edge " + edgeId + " " + field + " must be within [0, 1], got " + value);
        }
    }

    private static void requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new InvalidInputException(what + " is required");
        }
    }

    private void clear() {
        nodes.clear();
        edges.clear();
        dedupIndex.clear();
    }
}

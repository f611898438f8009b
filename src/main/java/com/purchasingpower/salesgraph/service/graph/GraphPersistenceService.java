package com.purchasingpower.salesgraph.service.graph;

import com.purchasingpower.salesgraph.model.graph.GraphSnapshot;

import java.util.Optional;

/**
 * Durable storage for graph snapshots.
 */
public interface GraphPersistenceService {

    /**
     * Write a snapshot, replacing the previous one. A failed write leaves the previous
     * snapshot in place.
     *
     * @throws com.purchasingpower.salesgraph.exception.GraphPersistenceException on I/O failure
     */
    void save(GraphSnapshot snapshot);

    /**
     * @return The stored snapshot, or empty when none has been written yet
     * @throws com.purchasingpower.salesgraph.exception.GraphPersistenceException if it cannot be read
     */
    Optional<GraphSnapshot> load();
}

package com.purchasingpower.salesgraph.knowledge;

/**
 * Populates the default nodes a fresh graph starts with.
 *
 * @since 1.0.0
 */
public interface GraphSeeder {

    /**
     * Create the default nodes. Must be safe to call on a graph that already has them.
     *
     * @param store Store to populate
     */
    void seed(GraphStore store);
}

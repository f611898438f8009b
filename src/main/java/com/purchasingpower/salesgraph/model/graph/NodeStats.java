package com.purchasingpower.salesgraph.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-node counters. Reserved; nothing increments them yet but they travel with every snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeStats {

    private double pos;
    private double neg;
    private double views;

    public NodeStats copy() {
        return new NodeStats(pos, neg, views);
    }
}

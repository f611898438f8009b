package com.purchasingpower.salesgraph.model.result;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of rebuilding the graph from extracted website knowledge.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestSummary {

    private int topicCount;

    private int qaCount;
}

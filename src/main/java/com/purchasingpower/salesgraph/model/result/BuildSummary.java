package com.purchasingpower.salesgraph.model.result;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of building the graph from one dialogue transcript.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildSummary {

    /**
     * Question/answer pairs linked by this build.
     */
    private int answersLinked;

    private int nodeCount;

    private int edgeCount;
}

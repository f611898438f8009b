package com.purchasingpower.salesgraph.model.result;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A question/answer link the business owner is asked to confirm or correct.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewTask {

    public static final String KIND_EDGE_CONFIRMATION = "edge_confirmation";

    private String id;

    @Builder.Default
    private String kind = KIND_EDGE_CONFIRMATION;

    private String edgeId;
    private String question;
    private String answer;
    private double confidence;
    private String topicLabel;
}

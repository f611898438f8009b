package com.purchasingpower.salesgraph.configuration;

import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * Feedback settings, bound from {@code app.feedback}.
 */
@Data
public class FeedbackProperties {

    /**
     * Multiplier applied to the feedback score before the logistic squash. Larger values make
     * confidence saturate after fewer votes.
     */
    @Positive
    private double sensitivity = 3.0;
}

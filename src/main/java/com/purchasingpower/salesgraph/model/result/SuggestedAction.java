package com.purchasingpower.salesgraph.model.result;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Follow-up action reached from an answer through a {@code next_step} edge.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuggestedAction {

    private String id;
    private String label;
    private String description;
}

package com.purchasingpower.salesgraph.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Graph lifecycle settings, bound from {@code app.graph}.
 */
@Data
public class GraphProperties {

    /**
     * Intent (business persona) every node and edge created by this process is scoped to.
     */
    @NotBlank(message = "Graph intent id is required")
    private String intentId = "sales-agent";

    /**
     * JSON snapshot location.
     */
    @NotBlank(message = "Graph snapshot file path is required")
    private String snapshotFile = "data/memory_graph.json";

    /**
     * Write the snapshot after every mutation.
     */
    private boolean autosave = true;

    /**
     * Restore the snapshot when the application starts.
     */
    private boolean loadOnStartup = true;
}

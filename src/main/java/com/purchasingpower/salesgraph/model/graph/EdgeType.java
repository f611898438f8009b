package com.purchasingpower.salesgraph.model.graph;

/**
 * Edge types the QA resolution path depends on.
 *
 * <p>Edges store their type as a plain string so snapshots may carry other relationship
 * types; these three are the ones the builder creates and the resolver walks.
 *
 * @since 1.0.0
 */
public enum EdgeType {

    /**
     * topic -> question
     */
    DESCRIBES_CONTEXT("describes_context"),

    /**
     * question -> answer
     */
    ANSWERS("answers"),

    /**
     * answer -> action
     */
    NEXT_STEP("next_step");

    private final String value;

    EdgeType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean matches(String type) {
        return value.equals(type);
    }
}

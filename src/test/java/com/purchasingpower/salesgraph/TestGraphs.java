package com.purchasingpower.salesgraph;

import com.purchasingpower.salesgraph.configuration.AppProperties;
import com.purchasingpower.salesgraph.knowledge.impl.DefaultActionSeeder;
import com.purchasingpower.salesgraph.knowledge.impl.InMemoryGraphStoreImpl;

/**
 * Builds graph components without a Spring context.
 */
public final class TestGraphs {

    public static final String INTENT = "sales-agent";

    private TestGraphs() {
    }

    public static AppProperties appProperties() {
        AppProperties properties = new AppProperties();
        properties.getGraph().setIntentId(INTENT);
        return properties;
    }

    /**
     * Empty store; call {@code reset()} to get the default actions.
     */
    public static InMemoryGraphStoreImpl newStore() {
        return new InMemoryGraphStoreImpl(new DefaultActionSeeder(appProperties()));
    }

    public static InMemoryGraphStoreImpl seededStore() {
        InMemoryGraphStoreImpl store = newStore();
        store.reset();
        return store;
    }
}

package com.purchasingpower.salesgraph.knowledge.impl;

import com.purchasingpower.salesgraph.configuration.AppProperties;
import com.purchasingpower.salesgraph.knowledge.GraphSeeder;
import com.purchasingpower.salesgraph.knowledge.GraphStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Seeds the business operations an answer can point to as a next step.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultActionSeeder implements GraphSeeder {

    static final List<SeedAction> DEFAULT_ACTIONS = List.of(
        new SeedAction("Take order", "Collect customer details and create a new flower order."),
        new SeedAction("Book pickup time", "Schedule a pickup time for an existing or new order."),
        new SeedAction("Update order ledger", "Record an order or update its status in the order ledger.")
    );

    private final AppProperties appProperties;

    @Override
    public void seed(GraphStore store) {
        String intentId = appProperties.getGraph().getIntentId();
        for (SeedAction action : DEFAULT_ACTIONS) {
            store.findOrCreateAction(action.label(), action.description(), intentId);
        }
        log.debug("Seeded {} default actions for intent {}", DEFAULT_ACTIONS.size(), intentId);
    }

    record SeedAction(String label, String description) {
    }
}

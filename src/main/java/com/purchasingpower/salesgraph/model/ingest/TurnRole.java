package com.purchasingpower.salesgraph.model.ingest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Speaker of a transcript turn. {@code user} is accepted as a synonym for {@code customer}.
 */
public enum TurnRole {
    CUSTOMER,
    AGENT;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TurnRole fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Turn role is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("USER".equals(normalized)) {
            return CUSTOMER;
        }
        return TurnRole.valueOf(normalized);
    }
}

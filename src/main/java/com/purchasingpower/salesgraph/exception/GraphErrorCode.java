package com.purchasingpower.salesgraph.exception;

/**
 * Stable error codes carried by {@link SalesGraphException}.
 */
public enum GraphErrorCode {
    NOT_FOUND,
    INVALID_INPUT,
    PERSISTENCE
}

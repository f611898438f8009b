package com.purchasingpower.salesgraph.exception;

import lombok.Getter;

/**
 * Base runtime exception for graph operations, tagged with a {@link GraphErrorCode}.
 */
@Getter
public class SalesGraphException extends RuntimeException {

    private final GraphErrorCode code;

    public SalesGraphException(GraphErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public SalesGraphException(GraphErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{code=" + code + ", message=" + getMessage() + '}';
    }
}

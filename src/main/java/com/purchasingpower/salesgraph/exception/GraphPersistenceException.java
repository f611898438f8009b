package com.purchasingpower.salesgraph.exception;

import lombok.Getter;

/** Reading or writing a graph snapshot failed. */
@Getter
public class GraphPersistenceException extends SalesGraphException {

    private final String location;

    public GraphPersistenceException(String message, String location, Throwable cause) {
        super(GraphErrorCode.PERSISTENCE, message, cause);
        this.location = location;
    }
}

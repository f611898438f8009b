package com.purchasingpower.salesgraph.exception;

/** A node or edge id supplied by the caller does not exist. */
public class NotFoundException extends SalesGraphException {

    public NotFoundException(String message) {
        super(GraphErrorCode.NOT_FOUND, message);
    }
}

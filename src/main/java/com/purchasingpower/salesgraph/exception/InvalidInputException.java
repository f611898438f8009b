package com.purchasingpower.salesgraph.exception;

/** Required input is missing, blank or out of range. */
public class InvalidInputException extends SalesGraphException {

    public InvalidInputException(String message) {
        super(GraphErrorCode.INVALID_INPUT, message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(GraphErrorCode.INVALID_INPUT, message, cause);
    }
}

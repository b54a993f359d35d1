package com.cbcluster.common.exception;

/**
 * Raised when the declared cluster topology or its settings cannot be used,
 * before any management request is issued.
 */
public class TopologyValidationException extends RuntimeException {

    public TopologyValidationException(String message) {
        super(message);
    }

    public TopologyValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.cbcluster.orchestrator.exception;

public class UnknownResourceException extends RuntimeException {

    public UnknownResourceException(String resourceName) {
        super("Unknown resource '" + resourceName + "'");
    }
}

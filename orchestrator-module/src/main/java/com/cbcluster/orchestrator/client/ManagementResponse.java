package com.cbcluster.orchestrator.client;

/**
 * Raw answer of a management endpoint; the body is empty, never {@code null}, when the node sent none.
 */
public record ManagementResponse(int statusCode, String body) {

    public ManagementResponse {
        body = body == null ? "" : body;
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    /**
     * Statuses worth another attempt: server errors, request timeout and throttling.
     */
    public boolean isTransient() {
        return statusCode >= 500 || statusCode == 408 || statusCode == 429;
    }
}

package com.cbcluster.orchestrator.exception;

import lombok.Getter;

/**
 * A management request failed: the node answered with an unexpected status,
 * or the retry budget was spent on transient failures.
 */
@Getter
public class ManagementApiException extends RuntimeException {

    /** HTTP status of the last response, or {@code 0} if no response was received. */
    private final int statusCode;

    private final String responseBody;

    public ManagementApiException(int statusCode, String responseBody) {
        super(buildMessage(statusCode, responseBody));
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public ManagementApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.responseBody = null;
    }

    private static String buildMessage(int statusCode, String responseBody) {
        if (responseBody != null && !responseBody.isEmpty()) {
            return statusCode + ": " + responseBody;
        }
        return "Request failed with status code " + statusCode + ".";
    }
}

package com.vmreconciler.cloud;

/**
 * Failure reported by a remote API. {@code payload} carries the provider's
 * response body unmodified so it can be surfaced to the operator.
 */
public class CloudApiException extends RuntimeException {

    private final int statusCode;
    private final String payload;

    public CloudApiException(String message, int statusCode, String payload) {
        super(message);
        this.statusCode = statusCode;
        this.payload = payload;
    }

    public CloudApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.payload = null;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getPayload() {
        return payload;
    }
}

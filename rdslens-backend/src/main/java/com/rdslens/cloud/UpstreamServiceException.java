package com.rdslens.cloud;

/**
 * Thrown when a call to the control plane, the metrics API, Performance Insights or the inference
 * gateway fails or returns data that cannot be used.
 */
public class UpstreamServiceException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public UpstreamServiceException(String message) {
        super(message);
    }

    /**
     * Create a new exception.
     *
     * @param message error message
     * @param cause underlying failure
     */
    public UpstreamServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}

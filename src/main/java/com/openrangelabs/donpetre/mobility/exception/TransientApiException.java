package com.openrangelabs.donpetre.mobility.exception;

/**
 * Exception thrown when a vendor API call fails for a reason that may clear up
 * on its own: network errors, timeouts, throttling and 5xx responses.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2026-10
 */
public class TransientApiException extends SyncException {

    private final int statusCode;

    /**
     * Constructs a new transient API exception for a failure without an HTTP status.
     *
     * @param message the detail message
     * @param cause the cause
     */
    public TransientApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * Constructs a new transient API exception for an HTTP error response.
     *
     * @param message the detail message
     * @param statusCode the HTTP status returned by the vendor
     * @param cause the cause
     */
    public TransientApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * Gets the HTTP status code returned by the vendor.
     *
     * @return the status code, or -1 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}

package com.openrangelabs.donpetre.mobility.exception;

/**
 * Exception thrown when the vendor rejects a request outright (4xx other than
 * 408 and 429). Sending the same request again would be rejected again.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2026-10
 */
public class RequestRejectedException extends SyncException {

    private final int statusCode;

    /**
     * Constructs a new request rejected exception.
     *
     * @param message the detail message
     * @param statusCode the HTTP status returned by the vendor
     */
    public RequestRejectedException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * Gets the HTTP status code returned by the vendor.
     *
     * @return the status code
     */
    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}

package com.openrangelabs.donpetre.mobility.exception;

/**
 * Exception thrown when run input or service configuration is unusable.
 *
 * <p>Covers malformed AOIs, empty AOI lists, invalid date ranges, duplicate
 * {@code poi_id}s and missing settings. Never retried; a run that hits one
 * before dispatch does not start.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2026-10
 */
public class ConfigurationException extends SyncException {

    /**
     * Constructs a new configuration exception with the specified detail message.
     *
     * @param message the detail message
     */
    public ConfigurationException(String message) {
        super(message);
    }

    /**
     * Constructs a new configuration exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause
     */
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}

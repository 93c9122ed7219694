package com.openrangelabs.donpetre.mobility.exception;

/**
 * Base exception for failures raised while synchronising a run.
 *
 * <p>Every subtype declares whether the chunk that raised it may be attempted again
 * within its retry budget.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2026-10
 */
public abstract class SyncException extends RuntimeException {

    /**
     * Constructs a new sync exception with the specified detail message.
     *
     * @param message the detail message
     */
    protected SyncException(String message) {
        super(message);
    }

    /**
     * Constructs a new sync exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause
     */
    protected SyncException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether the failing chunk may be attempted again.
     *
     * @return true if a further attempt could succeed
     */
    public abstract boolean isRetryable();
}

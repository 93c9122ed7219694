package com.openrangelabs.donpetre.mobility.exception;

/**
 * Exception thrown when copying a job's output fails or the copied objects do not
 * verify against their sources.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2026-10
 */
public class TransferException extends SyncException {

    private final boolean retryable;

    /**
     * Constructs a new transfer exception with the specified detail message.
     *
     * @param message the detail message
     */
    public TransferException(String message) {
        this(message, true);
    }

    /**
     * @param retryable false when repeating the transfer of the same job output
     *                  cannot succeed
     */
    public TransferException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    /**
     * Constructs a new transfer exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause
     */
    public TransferException(String message, Throwable cause) {
        super(message, cause);
        this.retryable = true;
    }

    @Override
    public boolean isRetryable() {
        return retryable;
    }
}

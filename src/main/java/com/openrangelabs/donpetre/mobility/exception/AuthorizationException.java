package com.openrangelabs.donpetre.mobility.exception;

/**
 * Exception thrown when the object store refuses a request made with the
 * assumed-role credentials (expired token, access denied).
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2026-10
 */
public class AuthorizationException extends SyncException {

    /**
     * Constructs a new authorization exception.
     *
     * @param message the detail message
     * @param cause the cause
     */
    public AuthorizationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}

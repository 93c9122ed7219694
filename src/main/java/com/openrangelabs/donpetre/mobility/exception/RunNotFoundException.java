package com.openrangelabs.donpetre.mobility.exception;

/**
 * Exception thrown when a run id is neither active nor known from progress records.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2026-10
 */
public class RunNotFoundException extends RuntimeException {

    /**
     * Constructs a new run not found exception.
     *
     * @param runId the unknown run id
     */
    public RunNotFoundException(String runId) {
        super("Run not found: " + runId);
    }
}

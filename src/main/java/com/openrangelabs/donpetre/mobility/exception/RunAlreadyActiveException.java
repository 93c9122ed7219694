package com.openrangelabs.donpetre.mobility.exception;

/**
 * Exception thrown when a run is started while another run with the same id is
 * still in progress in this process.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2026-10
 */
public class RunAlreadyActiveException extends IllegalStateException {

    private final String runId;

    /**
     * Constructs a new run already active exception.
     *
     * @param runId the id of the active run
     */
    public RunAlreadyActiveException(String runId) {
        super("Run already active: " + runId);
        this.runId = runId;
    }

    /**
     * Gets the id of the active run.
     *
     * @return the run id
     */
    public String getRunId() {
        return runId;
    }
}

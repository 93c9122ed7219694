package com.openrangelabs.donpetre.mobility.exception;

/**
 * Exception thrown when a vendor job ends without output: the vendor reported it
 * FAILED or CANCELLED, or it did not finish within the polling bound.
 *
 * <p>The chunk is resubmitted as a new job if attempts remain.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2026-10
 */
public class JobFailedException extends SyncException {

    private final String jobId;
    private final FailureReason reason;

    /**
     * Constructs a new job failed exception.
     *
     * @param jobId the vendor job id
     * @param reason why the job is considered failed
     * @param message the detail message
     */
    public JobFailedException(String jobId, FailureReason reason, String message) {
        super(String.format("Job %s %s: %s", jobId, reason, message));
        this.jobId = jobId;
        this.reason = reason;
    }

    /**
     * Gets the vendor job id.
     *
     * @return the job id
     */
    public String getJobId() {
        return jobId;
    }

    /**
     * Gets the failure reason.
     *
     * @return the reason
     */
    public FailureReason getReason() {
        return reason;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }

    public enum FailureReason {
        FAILED,
        CANCELLED,
        POLL_TIMEOUT
    }
}

package com.openrangelabs.donpetre.mobility.model;

/**
 * Snapshot of a vendor job. Instances are immutable; each poll produces a new one.
 */
public record VendorJob(String jobId, JobStatus status, JobOutput output, String errorMessage) {

    public boolean isTerminal() {
        return status.isTerminal();
    }
}

package com.openrangelabs.donpetre.mobility.model;

import java.util.Locale;

/**
 * Lifecycle of a vendor job as observed through polling
 */
public enum JobStatus {
    SUBMITTED,
    RUNNING,
    SUCCESS,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == CANCELLED;
    }

    /**
     * Maps a vendor status string. Anything the vendor reports that is not terminal
     * (QUEUED, SCHEDULED, ...) is treated as still running.
     */
    public static JobStatus fromVendor(String status) {
        if (status == null) {
            return RUNNING;
        }
        return switch (status.trim().toUpperCase(Locale.ROOT)) {
            case "SUCCESS", "SUCCEEDED", "COMPLETED" -> SUCCESS;
            case "FAILED", "ERROR" -> FAILED;
            case "CANCELLED", "CANCELED" -> CANCELLED;
            default -> RUNNING;
        };
    }
}

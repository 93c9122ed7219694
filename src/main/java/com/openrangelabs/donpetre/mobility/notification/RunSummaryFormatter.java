package com.openrangelabs.donpetre.mobility.notification;

import com.openrangelabs.donpetre.mobility.model.RunSummary;
import com.openrangelabs.donpetre.mobility.model.TransferSummary;

import java.util.Map;

/**
 * Plain-text rendering of a run summary for notifications
 */
public final class RunSummaryFormatter {

    private RunSummaryFormatter() {
    }

    public static String subject(RunSummary summary) {
        return "Mobility sync " + summary.getRunId() + ": " + summary.getStatus();
    }

    public static String body(RunSummary summary) {
        TransferSummary transfer = summary.getTransfer();
        StringBuilder text = new StringBuilder()
                .append("Run: ").append(summary.getRunId()).append('\n')
                .append("Status: ").append(summary.getStatus()).append('\n')
                .append("Dates: ").append(summary.getDateRange()).append('\n');
        if (summary.getAbortReason() != null) {
            text.append("Aborted: ").append(summary.getAbortReason()).append('\n');
        }
        text.append("Chunks: ").append(summary.getTotalChunks())
                .append(" (succeeded ").append(summary.getSucceededChunks().size())
                .append(", already done ").append(summary.getSkippedChunks().size())
                .append(", failed ").append(summary.getFailedChunks().size())
                .append(", not started ").append(summary.getNotStartedChunks().size()).append(")\n")
                .append("Objects: copied ").append(transfer.copied())
                .append(", unchanged ").append(transfer.skipped())
                .append(", bytes ").append(transfer.bytesCopied()).append('\n')
                .append("Duration: ").append(summary.getDuration()).append('\n');

        if (!summary.getFailedChunks().isEmpty()) {
            text.append("\nFailed chunks:\n");
            for (Map.Entry<String, String> failure : summary.getFailedChunks().entrySet()) {
                text.append("  ").append(failure.getKey()).append(": ").append(failure.getValue()).append('\n');
            }
        }
        if (!summary.getNotStartedChunks().isEmpty()) {
            text.append("\nNot started: ").append(String.join(", ", summary.getNotStartedChunks())).append('\n');
        }
        return text.toString();
    }
}

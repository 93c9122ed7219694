package com.openrangelabs.donpetre.mobility.model;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a complete run, handed to the notification sink and to API callers
 */
public class RunSummary {

    private final String runId;
    private final RunStatus status;
    private final DateWindow dateRange;
    private final LocalDateTime startTime;
    private final LocalDateTime endTime;
    private final int totalChunks;
    private final List<String> succeededChunks;
    private final List<String> skippedChunks;
    private final List<String> notStartedChunks;
    private final Map<String, String> failedChunks;
    private final TransferSummary transfer;
    private final String abortReason;

    private RunSummary(Builder builder) {
        this.runId = builder.runId;
        this.dateRange = builder.dateRange;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.totalChunks = builder.totalChunks;
        this.succeededChunks = Collections.unmodifiableList(builder.succeededChunks);
        this.skippedChunks = Collections.unmodifiableList(builder.skippedChunks);
        this.notStartedChunks = Collections.unmodifiableList(builder.notStartedChunks);
        this.failedChunks = Collections.unmodifiableMap(builder.failedChunks);
        this.transfer = builder.transfer;
        this.abortReason = builder.abortReason;
        this.status = builder.resolveStatus();
    }

    public static Builder builder(String runId, DateWindow dateRange) {
        return new Builder(runId, dateRange);
    }

    // Getters
    public String getRunId() { return runId; }
    public RunStatus getStatus() { return status; }
    public DateWindow getDateRange() { return dateRange; }
    public LocalDateTime getStartTime() { return startTime; }
    public LocalDateTime getEndTime() { return endTime; }
    public int getTotalChunks() { return totalChunks; }
    public List<String> getSucceededChunks() { return succeededChunks; }
    public List<String> getSkippedChunks() { return skippedChunks; }
    public List<String> getNotStartedChunks() { return notStartedChunks; }
    public Map<String, String> getFailedChunks() { return failedChunks; }
    public TransferSummary getTransfer() { return transfer; }
    public String getAbortReason() { return abortReason; }

    public boolean isSuccess() {
        return status == RunStatus.SUCCESS;
    }

    public Duration getDuration() {
        return Duration.between(startTime, endTime);
    }

    public static class Builder {
        private final String runId;
        private final DateWindow dateRange;
        private LocalDateTime startTime = LocalDateTime.now();
        private LocalDateTime endTime;
        private int totalChunks;
        private boolean aborted;
        private String abortReason;
        private final List<String> succeededChunks = new ArrayList<>();
        private final List<String> skippedChunks = new ArrayList<>();
        private final List<String> notStartedChunks = new ArrayList<>();
        private final Map<String, String> failedChunks = new LinkedHashMap<>();
        private TransferSummary transfer = TransferSummary.empty();

        private Builder(String runId, DateWindow dateRange) {
            this.runId = runId;
            this.dateRange = dateRange;
        }

        public Builder startTime(LocalDateTime startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(LocalDateTime endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder totalChunks(int totalChunks) {
            this.totalChunks = totalChunks;
            return this;
        }

        public Builder aborted(boolean aborted) {
            this.aborted = aborted;
            return this;
        }

        /**
         * Marks a run that ended before its chunks could be processed
         */
        public Builder abortReason(String reason) {
            this.abortReason = reason;
            this.aborted = true;
            return this;
        }

        public Builder addResult(ChunkResult result) {
            String key = result.key().asString();
            switch (result.outcome()) {
                case SUCCEEDED -> succeededChunks.add(key);
                case SKIPPED -> skippedChunks.add(key);
                case NOT_STARTED -> notStartedChunks.add(key);
                case FAILED -> failedChunks.put(key, result.error() != null ? result.error() : "Unknown error");
            }
            if (result.transfer() != null) {
                transfer = transfer.plus(result.transfer());
            }
            if (result.fatal()) {
                aborted = true;
            }
            return this;
        }

        public RunSummary build() {
            if (endTime == null) {
                endTime = LocalDateTime.now();
            }
            return new RunSummary(this);
        }

        private RunStatus resolveStatus() {
            if (aborted || !notStartedChunks.isEmpty()) {
                return RunStatus.ABORTED;
            }
            return failedChunks.isEmpty() ? RunStatus.SUCCESS : RunStatus.PARTIAL_FAILURE;
        }
    }

    @Override
    public String toString() {
        return "RunSummary{" +
                "runId='" + runId + '\'' +
                ", status=" + status +
                ", dateRange=" + dateRange +
                ", totalChunks=" + totalChunks +
                ", succeeded=" + succeededChunks.size() +
                ", skipped=" + skippedChunks.size() +
                ", failed=" + failedChunks.size() +
                ", notStarted=" + notStartedChunks.size() +
                ", objectsCopied=" + transfer.copied() +
                (abortReason != null ? ", abortReason='" + abortReason + '\'' : "") +
                ", duration=" + (endTime != null ? getDuration() : "ongoing") +
                '}';
    }
}

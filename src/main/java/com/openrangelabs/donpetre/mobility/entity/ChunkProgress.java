package com.openrangelabs.donpetre.mobility.entity;

import com.openrangelabs.donpetre.mobility.model.ChunkKey;
import com.openrangelabs.donpetre.mobility.model.TransferSummary;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Entity recording how far a chunk of a run has got.
 * One row per (run id, chunk key); rewritten on every attempt.
 */
@Table("chunk_progress")
public class ChunkProgress {

    private static final int MAX_ERROR_LENGTH = 4000;

    @Id
    private String id;

    @Version
    private Long version;

    @Column("run_id")
    private String runId;

    @Column("chunk_key")
    private String chunkKey;

    private Integer attempts = 0;

    private String outcome = Outcome.PENDING.name();

    @Column("last_error")
    private String lastError;

    @Column("vendor_job_id")
    private String vendorJobId;

    @Column("aoi_fingerprint")
    private String aoiFingerprint;

    @Column("objects_listed")
    private Long objectsListed = 0L;

    @Column("objects_copied")
    private Long objectsCopied = 0L;

    @Column("objects_skipped")
    private Long objectsSkipped = 0L;

    @Column("bytes_copied")
    private Long bytesCopied = 0L;

    @Column("started_at")
    private LocalDateTime startedAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    @Column("completed_at")
    private LocalDateTime completedAt;

    // Constructors
    public ChunkProgress() {}

    public ChunkProgress(String runId, String chunkKey) {
        this.id = idFor(runId, chunkKey);
        this.runId = runId;
        this.chunkKey = chunkKey;
        this.updatedAt = LocalDateTime.now();
    }

    public static ChunkProgress create(String runId, ChunkKey key) {
        return new ChunkProgress(runId, key.asString());
    }

    public static String idFor(String runId, String chunkKey) {
        return runId + "|" + chunkKey;
    }

    // Business methods
    public void startAttempt(int attempt) {
        this.attempts = attempt;
        this.outcome = Outcome.RUNNING.name();
        this.completedAt = null;
        if (this.startedAt == null) {
            this.startedAt = LocalDateTime.now();
        }
        touch();
    }

    public void jobSubmitted(String vendorJobId) {
        this.vendorJobId = vendorJobId;
        touch();
    }

    public void succeed(int attempts, TransferSummary transfer, String aoiFingerprint) {
        this.attempts = attempts;
        this.aoiFingerprint = aoiFingerprint;
        this.outcome = Outcome.SUCCEEDED.name();
        this.lastError = null;
        this.objectsListed = transfer.listed();
        this.objectsCopied = transfer.copied();
        this.objectsSkipped = transfer.skipped();
        this.bytesCopied = transfer.bytesCopied();
        this.completedAt = LocalDateTime.now();
        touch();
    }

    /**
     * Records an attempt's error. The chunk stays RUNNING until {@link #fail} is called
     * for the last attempt.
     */
    public void attemptFailed(int attempt, String error) {
        this.attempts = attempt;
        this.lastError = truncate(error);
        touch();
    }

    public void fail(int attempts, String error) {
        this.attempts = attempts;
        this.outcome = Outcome.FAILED.name();
        this.lastError = truncate(error);
        this.completedAt = LocalDateTime.now();
        touch();
    }

    public boolean isSucceeded() {
        return Outcome.SUCCEEDED.name().equals(outcome);
    }

    public boolean isFailed() {
        return Outcome.FAILED.name().equals(outcome);
    }

    public boolean isRunning() {
        return Outcome.RUNNING.name().equals(outcome);
    }

    public Outcome getOutcomeEnum() {
        try {
            return Outcome.valueOf(outcome);
        } catch (IllegalArgumentException | NullPointerException e) {
            return Outcome.PENDING;
        }
    }

    private void touch() {
        this.updatedAt = LocalDateTime.now();
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }

    // Getters and Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }

    public String getRunId() { return runId; }
    public void setRunId(String runId) { this.runId = runId; }

    public String getChunkKey() { return chunkKey; }
    public void setChunkKey(String chunkKey) { this.chunkKey = chunkKey; }

    public Integer getAttempts() { return attempts; }
    public void setAttempts(Integer attempts) { this.attempts = attempts; }

    public String getOutcome() { return outcome; }
    public void setOutcome(String outcome) { this.outcome = outcome; }

    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }

    public String getVendorJobId() { return vendorJobId; }
    public void setVendorJobId(String vendorJobId) { this.vendorJobId = vendorJobId; }

    public String getAoiFingerprint() { return aoiFingerprint; }
    public void setAoiFingerprint(String aoiFingerprint) { this.aoiFingerprint = aoiFingerprint; }

    public Long getObjectsListed() { return objectsListed; }
    public void setObjectsListed(Long objectsListed) { this.objectsListed = objectsListed; }

    public Long getObjectsCopied() { return objectsCopied; }
    public void setObjectsCopied(Long objectsCopied) { this.objectsCopied = objectsCopied; }

    public Long getObjectsSkipped() { return objectsSkipped; }
    public void setObjectsSkipped(Long objectsSkipped) { this.objectsSkipped = objectsSkipped; }

    public Long getBytesCopied() { return bytesCopied; }
    public void setBytesCopied(Long bytesCopied) { this.bytesCopied = bytesCopied; }

    public LocalDateTime getStartedAt() { return startedAt; }
    public void setStartedAt(LocalDateTime startedAt) { this.startedAt = startedAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

    public LocalDateTime getCompletedAt() { return completedAt; }
    public void setCompletedAt(LocalDateTime completedAt) { this.completedAt = completedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChunkProgress that = (ChunkProgress) o;
        return java.util.Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ChunkProgress{" +
                "runId='" + runId + '\'' +
                ", chunkKey='" + chunkKey + '\'' +
                ", outcome='" + outcome + '\'' +
                ", attempts=" + attempts +
                ", vendorJobId='" + vendorJobId + '\'' +
                ", objectsCopied=" + objectsCopied +
                ", objectsSkipped=" + objectsSkipped +
                '}';
    }

    public enum Outcome {
        PENDING,
        RUNNING,
        SUCCEEDED,
        FAILED
    }
}

package com.openrangelabs.donpetre.mobility.model;

/**
 * What processing a single chunk produced
 */
public record ChunkResult(ChunkKey key, ChunkOutcome outcome, int attempts, String error,
                          TransferSummary transfer, boolean fatal) {

    public static ChunkResult succeeded(ChunkKey key, int attempts, TransferSummary transfer) {
        return new ChunkResult(key, ChunkOutcome.SUCCEEDED, attempts, null, transfer, false);
    }

    public static ChunkResult failed(ChunkKey key, int attempts, String error) {
        return new ChunkResult(key, ChunkOutcome.FAILED, attempts, error, TransferSummary.empty(), false);
    }

    public static ChunkResult fatal(ChunkKey key, int attempts, String error) {
        return new ChunkResult(key, ChunkOutcome.FAILED, attempts, error, TransferSummary.empty(), true);
    }

    public static ChunkResult skipped(ChunkKey key) {
        return new ChunkResult(key, ChunkOutcome.SKIPPED, 0, null, TransferSummary.empty(), false);
    }

    public static ChunkResult notStarted(ChunkKey key) {
        return new ChunkResult(key, ChunkOutcome.NOT_STARTED, 0, null, TransferSummary.empty(), false);
    }

    public boolean isSucceeded() {
        return outcome == ChunkOutcome.SUCCEEDED;
    }

    public boolean isFailed() {
        return outcome == ChunkOutcome.FAILED;
    }
}

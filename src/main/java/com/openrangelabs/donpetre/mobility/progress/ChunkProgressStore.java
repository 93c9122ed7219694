package com.openrangelabs.donpetre.mobility.progress;

import com.openrangelabs.donpetre.mobility.entity.ChunkProgress;
import com.openrangelabs.donpetre.mobility.model.Chunk;
import com.openrangelabs.donpetre.mobility.model.ChunkKey;
import com.openrangelabs.donpetre.mobility.model.TransferSummary;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.function.Consumer;

/**
 * Persistent record of chunk progress, keyed by run id and chunk key.
 *
 * <p>Writers never share a key: each chunk of a run is processed by exactly one worker,
 * so implementations only need to be safe for concurrent writes to distinct keys.
 */
public interface ChunkProgressStore {

    /**
     * All progress rows of a run
     */
    Flux<ChunkProgress> findByRun(String runId);

    /**
     * Applies {@code change} to the row for the chunk, creating it if absent, and saves it.
     */
    Mono<ChunkProgress> update(String runId, ChunkKey key, Consumer<ChunkProgress> change);

    /**
     * Deletes finished rows not updated since {@code threshold}.
     *
     * @return number of rows removed
     */
    Mono<Long> purgeFinishedBefore(LocalDateTime threshold);

    default Mono<ChunkProgress> attemptStarted(String runId, ChunkKey key, int attempt) {
        return update(runId, key, progress -> progress.startAttempt(attempt));
    }

    default Mono<ChunkProgress> jobSubmitted(String runId, ChunkKey key, String vendorJobId) {
        return update(runId, key, progress -> progress.jobSubmitted(vendorJobId));
    }

    default Mono<ChunkProgress> attemptFailed(String runId, ChunkKey key, int attempt, String error) {
        return update(runId, key, progress -> progress.attemptFailed(attempt, error));
    }

    /**
     * Marks the chunk SUCCEEDED and records which AOIs it covered
     */
    default Mono<ChunkProgress> succeeded(String runId, Chunk chunk, int attempts, TransferSummary transfer) {
        return update(runId, chunk.key(), progress -> progress.succeed(attempts, transfer, chunk.aoiFingerprint()));
    }

    default Mono<ChunkProgress> failed(String runId, ChunkKey key, int attempts, String error) {
        return update(runId, key, progress -> progress.fail(attempts, error));
    }
}

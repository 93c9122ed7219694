package com.openrangelabs.donpetre.mobility.progress;

import com.openrangelabs.donpetre.mobility.entity.ChunkProgress;
import com.openrangelabs.donpetre.mobility.model.ChunkKey;
import com.openrangelabs.donpetre.mobility.repository.ChunkProgressRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.function.Consumer;

/**
 * Progress store backed by the {@code chunk_progress} table
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "mobility-sync.progress.store", havingValue = "r2dbc", matchIfMissing = true)
public class R2dbcChunkProgressStore implements ChunkProgressStore {

    private final ChunkProgressRepository repository;

    public R2dbcChunkProgressStore(ChunkProgressRepository repository) {
        this.repository = repository;
    }

    @Override
    public Flux<ChunkProgress> findByRun(String runId) {
        return repository.findByRunIdOrderByChunkKey(runId);
    }

    @Override
    public Mono<ChunkProgress> update(String runId, ChunkKey key, Consumer<ChunkProgress> change) {
        return repository.findById(ChunkProgress.idFor(runId, key.asString()))
                .defaultIfEmpty(ChunkProgress.create(runId, key))
                .map(progress -> {
                    change.accept(progress);
                    return progress;
                })
                .flatMap(repository::save)
                .doOnError(error -> log.error("Failed to save progress of {} in run {}: {}",
                        key, runId, error.getMessage()));
    }

    @Override
    public Mono<Long> purgeFinishedBefore(LocalDateTime threshold) {
        return repository.deleteFinishedBefore(threshold).map(Integer::longValue);
    }
}

package com.openrangelabs.donpetre.mobility.progress;

import com.openrangelabs.donpetre.mobility.entity.ChunkProgress;
import com.openrangelabs.donpetre.mobility.model.ChunkKey;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Progress store that lives only as long as the process. Used for local runs and tests.
 */
@Component
@ConditionalOnProperty(name = "mobility-sync.progress.store", havingValue = "memory")
public class InMemoryChunkProgressStore implements ChunkProgressStore {

    private final Map<String, ChunkProgress> rows = new ConcurrentHashMap<>();

    @Override
    public Flux<ChunkProgress> findByRun(String runId) {
        return Flux.defer(() -> Flux.fromStream(rows.values().stream()
                .filter(progress -> progress.getRunId().equals(runId))
                .sorted(Comparator.comparing(ChunkProgress::getChunkKey))));
    }

    @Override
    public Mono<ChunkProgress> update(String runId, ChunkKey key, Consumer<ChunkProgress> change) {
        return Mono.fromSupplier(() -> rows.compute(ChunkProgress.idFor(runId, key.asString()), (id, existing) -> {
            ChunkProgress progress = existing != null ? existing : ChunkProgress.create(runId, key);
            change.accept(progress);
            progress.setVersion(progress.getVersion() == null ? 0L : progress.getVersion() + 1);
            return progress;
        }));
    }

    @Override
    public Mono<Long> purgeFinishedBefore(LocalDateTime threshold) {
        return Mono.fromSupplier(() -> {
            long before = rows.size();
            rows.values().removeIf(progress -> (progress.isSucceeded() || progress.isFailed())
                    && progress.getUpdatedAt() != null
                    && progress.getUpdatedAt().isBefore(threshold));
            return before - rows.size();
        });
    }

    public int size() {
        return rows.size();
    }
}

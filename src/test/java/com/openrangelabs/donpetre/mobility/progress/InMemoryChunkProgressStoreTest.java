package com.openrangelabs.donpetre.mobility.progress;

import com.openrangelabs.donpetre.mobility.Fixtures;
import com.openrangelabs.donpetre.mobility.entity.ChunkProgress;
import com.openrangelabs.donpetre.mobility.model.ChunkKey;
import com.openrangelabs.donpetre.mobility.model.TransferSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryChunkProgressStoreTest {

    private InMemoryChunkProgressStore store;
    private ChunkKey first;
    private ChunkKey second;

    @BeforeEach
    void setUp() {
        store = new InMemoryChunkProgressStore();
        first = ChunkKey.of(0, 0, Fixtures.spec());
        second = ChunkKey.of(1, 0, Fixtures.spec());
    }

    @Test
    void update_TracksAttemptLifecycle() {
        store.attemptStarted("run-1", first, 1).block();
        store.jobSubmitted("run-1", first, "job-1").block();
        store.attemptFailed("run-1", first, 1, "HTTP 503").block();
        store.attemptStarted("run-1", first, 2).block();

        StepVerifier.create(store.succeeded("run-1", Fixtures.chunk(0, Fixtures.radii(2)), 2, new TransferSummary(2, 0, 2, 0, 20)))
                .expectNextMatches(progress -> {
                    assertThat(progress.getOutcomeEnum()).isEqualTo(ChunkProgress.Outcome.SUCCEEDED);
                    assertThat(progress.getAttempts()).isEqualTo(2);
                    assertThat(progress.getLastError()).isNull();
                    assertThat(progress.getVendorJobId()).isEqualTo("job-1");
                    assertThat(progress.getAoiFingerprint()).isEqualTo(Fixtures.chunk(0, Fixtures.radii(2)).aoiFingerprint());
                    assertThat(progress.getCompletedAt()).isNotNull();
                    assertThat(progress.getVersion()).isEqualTo(4L);
                    return true;
                })
                .verifyComplete();
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void findByRun_OnlyThatRunSortedByKey() {
        store.attemptStarted("run-1", second, 1).block();
        store.attemptStarted("run-1", first, 1).block();
        store.attemptStarted("run-2", first, 1).block();

        StepVerifier.create(store.findByRun("run-1").map(ChunkProgress::getChunkKey))
                .expectNext(first.asString(), second.asString())
                .verifyComplete();
    }

    @Test
    void failed_TruncatesLongErrors() {
        String longError = "x".repeat(5000);

        ChunkProgress progress = store.failed("run-1", first, 3, longError).block();

        assertThat(progress.isFailed()).isTrue();
        assertThat(progress.getLastError()).hasSize(4000);
    }

    @Test
    void purgeFinishedBefore_KeepsRunningRows() {
        store.failed("run-1", first, 3, "boom").block();
        store.attemptStarted("run-1", second, 1).block();

        StepVerifier.create(store.purgeFinishedBefore(LocalDateTime.now().plusMinutes(1)))
                .expectNext(1L)
                .verifyComplete();

        assertThat(store.size()).isEqualTo(1);
        assertThat(store.findByRun("run-1").blockFirst().isRunning()).isTrue();
    }
}

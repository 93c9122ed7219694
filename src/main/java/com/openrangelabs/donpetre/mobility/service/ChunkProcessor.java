package com.openrangelabs.donpetre.mobility.service;

import com.openrangelabs.donpetre.mobility.exception.ConfigurationException;
import com.openrangelabs.donpetre.mobility.exception.JobFailedException;
import com.openrangelabs.donpetre.mobility.exception.SyncException;
import com.openrangelabs.donpetre.mobility.model.Chunk;
import com.openrangelabs.donpetre.mobility.model.ChunkResult;
import com.openrangelabs.donpetre.mobility.model.JobOutput;
import com.openrangelabs.donpetre.mobility.model.RunPlan;
import com.openrangelabs.donpetre.mobility.model.TransferSummary;
import com.openrangelabs.donpetre.mobility.progress.ChunkProgressStore;
import com.openrangelabs.donpetre.mobility.transfer.TransferExecutor;
import com.openrangelabs.donpetre.mobility.vendor.JobPoller;
import com.openrangelabs.donpetre.mobility.vendor.VendorJobClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Takes one chunk from submission to verified transfer, retrying within the run's
 * attempt budget.
 *
 * <p>What an attempt repeats depends on how far the previous one got:
 * <ul>
 *   <li>job failed, cancelled or timed out: a new job is submitted</li>
 *   <li>a status call failed transiently: polling resumes on the same job</li>
 *   <li>the job succeeded but the transfer failed: only the transfer is repeated</li>
 * </ul>
 * Configuration errors are not retried and are reported as fatal so the coordinator
 * stops dispatching. A request the vendor rejects outright is failed without retry.
 */
@Service
public class ChunkProcessor {

    private static final Logger logger = LoggerFactory.getLogger(ChunkProcessor.class);

    private final VendorJobClient jobClient;
    private final JobPoller jobPoller;
    private final TransferExecutor transferExecutor;
    private final ChunkProgressStore progressStore;
    private final Scheduler scheduler;

    public ChunkProcessor(VendorJobClient jobClient,
                          JobPoller jobPoller,
                          TransferExecutor transferExecutor,
                          ChunkProgressStore progressStore,
                          Scheduler timerScheduler) {
        this.jobClient = jobClient;
        this.jobPoller = jobPoller;
        this.transferExecutor = transferExecutor;
        this.progressStore = progressStore;
        this.scheduler = timerScheduler;
    }

    public Mono<ChunkResult> process(RunPlan plan, Chunk chunk) {
        return attempt(plan, chunk, 1, new AttemptState());
    }

    private Mono<ChunkResult> attempt(RunPlan plan, Chunk chunk, int attempt, AttemptState state) {
        Duration backoff = plan.retryPolicy().backoffBefore(attempt);
        Mono<?> wait = backoff.isZero() ? Mono.empty() : Mono.delay(backoff, scheduler);

        return wait
                .then(progressStore.attemptStarted(plan.runId(), chunk.key(), attempt))
                .doOnNext(progress -> logger.info("[{}] {} attempt {}/{} ({} AOIs, {})", plan.runId(), chunk.key(),
                        attempt, plan.retryPolicy().maxAttempts(), chunk.size(), chunk.window()))
                .then(Mono.defer(() -> runAttempt(plan, chunk, state)))
                .flatMap(transfer -> progressStore.succeeded(plan.runId(), chunk, attempt, transfer)
                        .thenReturn(ChunkResult.succeeded(chunk.key(), attempt, transfer)))
                .doOnNext(result -> logger.info("[{}] {} succeeded after {} attempt(s): copied {}, skipped {}",
                        plan.runId(), chunk.key(), attempt, result.transfer().copied(), result.transfer().skipped()))
                .onErrorResume(error -> handleFailure(plan, chunk, attempt, state, error));
    }

    private Mono<TransferSummary> runAttempt(RunPlan plan, Chunk chunk, AttemptState state) {
        Mono<JobOutput> output;
        if (state.output != null) {
            logger.info("[{}] {} reusing output of job {} at {}", plan.runId(), chunk.key(), state.jobId, state.output.uri());
            output = Mono.just(state.output);
        } else if (state.jobId != null) {
            logger.info("[{}] {} resuming polling of job {}", plan.runId(), chunk.key(), state.jobId);
            output = jobPoller.awaitCompletion(state.jobId, plan.pollPolicy(), state.polls);
        } else {
            output = jobClient.submit(chunk)
                    .flatMap(jobId -> {
                        state.jobId = jobId;
                        state.polls.set(0);
                        return progressStore.jobSubmitted(plan.runId(), chunk.key(), jobId)
                                .then(jobPoller.awaitCompletion(jobId, plan.pollPolicy(), state.polls));
                    });
        }
        return output
                .doOnNext(location -> state.output = location)
                .flatMap(location -> transferExecutor.transfer(chunk, location));
    }

    private Mono<ChunkResult> handleFailure(RunPlan plan, Chunk chunk, int attempt, AttemptState state, Throwable error) {
        String message = describe(error);

        if (error instanceof ConfigurationException) {
            logger.error("[{}] {} has a configuration error, aborting the run: {}", plan.runId(), chunk.key(), message);
            return progressStore.failed(plan.runId(), chunk.key(), attempt, message)
                    .thenReturn(ChunkResult.fatal(chunk.key(), attempt, message));
        }

        if (error instanceof JobFailedException) {
            state.jobId = null;
            state.output = null;
        }

        boolean retryable = !(error instanceof SyncException syncError) || syncError.isRetryable();
        if (!retryable || !plan.retryPolicy().hasAttemptsAfter(attempt)) {
            logger.error("[{}] {} failed permanently after {} attempt(s): {}", plan.runId(), chunk.key(), attempt, message);
            return progressStore.failed(plan.runId(), chunk.key(), attempt, message)
                    .thenReturn(ChunkResult.failed(chunk.key(), attempt, message));
        }

        logger.warn("[{}] {} attempt {} failed, retrying in {}: {}", plan.runId(), chunk.key(), attempt,
                plan.retryPolicy().backoffBefore(attempt + 1), message);
        return progressStore.attemptFailed(plan.runId(), chunk.key(), attempt, message)
                .then(Mono.defer(() -> attempt(plan, chunk, attempt + 1, state)));
    }

    private static String describe(Throwable error) {
        String type = error.getClass().getSimpleName();
        return error.getMessage() != null ? type + ": " + error.getMessage() : type;
    }

    /**
     * What the previous attempts of a chunk left behind
     */
    private static final class AttemptState {
        volatile String jobId;
        volatile JobOutput output;
        final AtomicInteger polls = new AtomicInteger();
    }
}

package com.openrangelabs.donpetre.mobility.service;

import com.openrangelabs.donpetre.mobility.config.MobilitySyncProperties;
import com.openrangelabs.donpetre.mobility.entity.ChunkProgress;
import com.openrangelabs.donpetre.mobility.exception.ConfigurationException;
import com.openrangelabs.donpetre.mobility.exception.RunAlreadyActiveException;
import com.openrangelabs.donpetre.mobility.model.Chunk;
import com.openrangelabs.donpetre.mobility.model.ChunkResult;
import com.openrangelabs.donpetre.mobility.model.DateWindow;
import com.openrangelabs.donpetre.mobility.model.PollPolicy;
import com.openrangelabs.donpetre.mobility.model.RetryPolicy;
import com.openrangelabs.donpetre.mobility.model.RunPlan;
import com.openrangelabs.donpetre.mobility.model.RunSummary;
import com.openrangelabs.donpetre.mobility.model.SyncSelection;
import com.openrangelabs.donpetre.mobility.model.SyncSpec;
import com.openrangelabs.donpetre.mobility.notification.NotificationSink;
import com.openrangelabs.donpetre.mobility.partition.RequestPartitioner;
import com.openrangelabs.donpetre.mobility.progress.ChunkProgressStore;
import com.openrangelabs.donpetre.mobility.registry.AoiRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a complete synchronisation: resolves the plan, partitions the registry snapshot,
 * skips chunks a previous run with the same id already finished, processes the rest
 * on a bounded number of workers and publishes the summary.
 *
 * <p>A chunk that fails with a configuration error stops dispatch: chunks not yet
 * started are reported as not started, chunks in flight run to completion.
 */
@Service
public class SyncRunCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(SyncRunCoordinator.class);

    private static final int REMEMBERED_SUMMARIES = 100;

    private final AoiRegistry registry;
    private final RequestPartitioner partitioner;
    private final ChunkProcessor chunkProcessor;
    private final ChunkProgressStore progressStore;
    private final NotificationSink notificationSink;
    private final MobilitySyncProperties properties;

    private final Map<String, RunPlan> activeRuns = new ConcurrentHashMap<>();
    private final Map<String, RunSummary> finishedRuns = new ConcurrentHashMap<>();

    public SyncRunCoordinator(AoiRegistry registry,
                              RequestPartitioner partitioner,
                              ChunkProcessor chunkProcessor,
                              ChunkProgressStore progressStore,
                              NotificationSink notificationSink,
                              MobilitySyncProperties properties) {
        this.registry = registry;
        this.partitioner = partitioner;
        this.chunkProcessor = chunkProcessor;
        this.progressStore = progressStore;
        this.notificationSink = notificationSink;
        this.properties = properties;
    }

    /**
     * Runs to completion.
     *
     * @return the run summary, ABORTED with a reason when the registry snapshot could
     *         not be read or partitioned; errors with {@link ConfigurationException} if
     *         the request itself is invalid and {@link RunAlreadyActiveException} if a
     *         run with the same id is in progress
     */
    public Mono<RunSummary> run(String runId, DateWindow dateRange, List<SyncSelection> selections) {
        return run(runId, dateRange, selections, Set.of());
    }

    /**
     * Runs to completion over the AOIs whose poi_id is in {@code poiIds}, or over the
     * whole registry when the set is empty.
     */
    public Mono<RunSummary> run(String runId, DateWindow dateRange, List<SyncSelection> selections, Set<String> poiIds) {
        return Mono.fromCallable(() -> register(buildPlan(runId, dateRange, selections)))
                .flatMap(plan -> execute(plan, poiIds));
    }

    /**
     * Validates and registers the run, then lets it proceed in the background.
     *
     * @return the run id once the run has been accepted
     */
    public Mono<String> launch(String runId, DateWindow dateRange, List<SyncSelection> selections) {
        return Mono.fromCallable(() -> register(buildPlan(runId, dateRange, selections)))
                .map(plan -> {
                    execute(plan, Set.of()).subscribe(
                            summary -> logger.debug("Background run {} finished", summary.getRunId()),
                            error -> logger.error("Background run {} failed: {}", plan.runId(), error.getMessage()));
                    return plan.runId();
                });
    }

    /**
     * Resolves a request against the configuration. Everything a run needs is checked
     * here so a broken setup fails before any chunk is dispatched.
     */
    public RunPlan buildPlan(String runId, DateWindow dateRange, List<SyncSelection> selections) {
        if (runId == null || runId.isBlank()) {
            throw new ConfigurationException("Run id is required");
        }
        if (dateRange == null) {
            throw new ConfigurationException("Date range is required");
        }
        if (selections == null || selections.isEmpty()) {
            throw new ConfigurationException("At least one endpoint/schema selection is required");
        }
        if (isBlank(properties.getVendor().getApiKey())) {
            throw new ConfigurationException("mobility-sync.vendor.api-key is not set");
        }
        if (isBlank(properties.getCredentials().getRoleArn())) {
            throw new ConfigurationException("mobility-sync.credentials.role-arn is not set");
        }

        List<SyncSpec> specs = new ArrayList<>(selections.size());
        for (SyncSelection selection : selections) {
            String bucket = properties.bucketFor(selection.endpoint(), selection.schemaType())
                    .orElseThrow(() -> new ConfigurationException("No destination bucket configured for " + selection));
            specs.add(new SyncSpec(selection.endpoint(), selection.schemaType(), bucket));
        }

        MobilitySyncProperties.Vendor vendor = properties.getVendor();
        return new RunPlan(runId.trim(), dateRange, specs,
                RetryPolicy.from(properties.getRetry()),
                new PollPolicy(vendor.getPollInterval(), vendor.getMaxPolls(), properties.getRetry().getPollCallRetries()),
                properties.getWorkers().getConcurrency());
    }

    public boolean isActive(String runId) {
        return activeRuns.containsKey(runId);
    }

    public Set<String> getActiveRunIds() {
        return Set.copyOf(activeRuns.keySet());
    }

    public Optional<RunSummary> getSummary(String runId) {
        return Optional.ofNullable(finishedRuns.get(runId));
    }

    private RunPlan register(RunPlan plan) {
        if (activeRuns.putIfAbsent(plan.runId(), plan) != null) {
            throw new RunAlreadyActiveException(plan.runId());
        }
        return plan;
    }

    private Mono<RunSummary> execute(RunPlan plan, Set<String> poiIds) {
        LocalDateTime startTime = LocalDateTime.now();
        logger.info("Starting run {} for {} with {} workers, selections {}{}", plan.runId(), plan.dateRange(),
                plan.workers(), plan.specs().stream().map(SyncSpec::pairLabel).toList(),
                poiIds.isEmpty() ? "" : ", limited to " + poiIds.size() + " AOIs");

        return registry.snapshot()
                .filter(aoi -> poiIds.isEmpty() || poiIds.contains(aoi.getPoiId()))
                .collectList()
                .map(aois -> partitioner.partition(aois, plan.dateRange(), plan.specs()))
                .flatMap(chunks -> finishedChunks(plan.runId())
                        .flatMap(done -> dispatch(plan, chunks, done)
                                .map(results -> summarise(plan, chunks.size(), startTime, results))))
                .onErrorResume(error -> Mono.just(abortedSummary(plan, startTime, error)))
                .flatMap(summary -> notify(summary).thenReturn(summary))
                .doOnNext(this::remember)
                .doFinally(signal -> activeRuns.remove(plan.runId()));
    }

    /**
     * Chunk keys a previous attempt of the run finished, with the AOI fingerprint each
     * was finished for
     */
    private Mono<Map<String, String>> finishedChunks(String runId) {
        return progressStore.findByRun(runId)
                .filter(ChunkProgress::isSucceeded)
                .collectMap(ChunkProgress::getChunkKey, progress -> Objects.toString(progress.getAoiFingerprint(), ""))
                .doOnNext(done -> {
                    if (!done.isEmpty()) {
                        logger.info("Run {} resumes with {} chunks already succeeded", runId, done.size());
                    }
                });
    }

    private Mono<List<ChunkResult>> dispatch(RunPlan plan, List<Chunk> chunks, Map<String, String> done) {
        AtomicBoolean aborted = new AtomicBoolean();
        return Flux.fromIterable(chunks)
                .flatMap(chunk -> {
                    String finishedFor = done.get(chunk.key().asString());
                    if (finishedFor != null) {
                        if (finishedFor.equals(chunk.aoiFingerprint())) {
                            return Mono.just(ChunkResult.skipped(chunk.key()));
                        }
                        logger.warn("[{}] {} succeeded earlier for a different set of AOIs, the registry changed; "
                                + "processing it again", plan.runId(), chunk.key());
                    }
                    return Mono.defer(() -> aborted.get()
                            ? Mono.just(ChunkResult.notStarted(chunk.key()))
                            : processChunk(plan, chunk, aborted));
                }, plan.workers())
                .collectList();
    }

    private Mono<ChunkResult> processChunk(RunPlan plan, Chunk chunk, AtomicBoolean aborted) {
        return chunkProcessor.process(plan, chunk)
                .onErrorResume(error -> {
                    logger.error("[{}] {} failed unexpectedly: {}", plan.runId(), chunk.key(), error.getMessage(), error);
                    return Mono.just(ChunkResult.failed(chunk.key(), 0, "Unexpected error: " + error.getMessage()));
                })
                .doOnNext(result -> {
                    if (result.fatal() && aborted.compareAndSet(false, true)) {
                        logger.error("Run {} stops dispatching after fatal error in {}", plan.runId(), chunk.key());
                    }
                });
    }

    private RunSummary summarise(RunPlan plan, int totalChunks, LocalDateTime startTime, List<ChunkResult> results) {
        RunSummary.Builder builder = RunSummary.builder(plan.runId(), plan.dateRange())
                .startTime(startTime)
                .totalChunks(totalChunks);
        results.forEach(builder::addResult);
        RunSummary summary = builder.build();
        logger.info("Run {} finished: {}", plan.runId(), summary);
        return summary;
    }

    private RunSummary abortedSummary(RunPlan plan, LocalDateTime startTime, Throwable error) {
        String reason = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        if (error instanceof ConfigurationException) {
            logger.error("Run {} aborted: {}", plan.runId(), reason);
        } else {
            logger.error("Run {} aborted: {}", plan.runId(), reason, error);
        }
        return RunSummary.builder(plan.runId(), plan.dateRange())
                .startTime(startTime)
                .abortReason(reason)
                .build();
    }

    private Mono<Void> notify(RunSummary summary) {
        return notificationSink.publish(summary)
                .onErrorResume(error -> {
                    logger.warn("Could not publish summary of run {}: {}", summary.getRunId(), error.getMessage());
                    return Mono.empty();
                });
    }

    private void remember(RunSummary summary) {
        finishedRuns.put(summary.getRunId(), summary);
        if (finishedRuns.size() > REMEMBERED_SUMMARIES) {
            finishedRuns.values().stream()
                    .min((a, b) -> a.getEndTime().compareTo(b.getEndTime()))
                    .ifPresent(oldest -> finishedRuns.remove(oldest.getRunId()));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

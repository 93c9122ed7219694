package com.openrangelabs.donpetre.mobility.controller;

import com.openrangelabs.donpetre.mobility.backfill.BackfillPlan;
import com.openrangelabs.donpetre.mobility.backfill.BackfillService;
import com.openrangelabs.donpetre.mobility.dto.BackfillRequest;
import com.openrangelabs.donpetre.mobility.dto.RunStatusResponse;
import com.openrangelabs.donpetre.mobility.dto.TriggerRunRequest;
import com.openrangelabs.donpetre.mobility.exception.ConfigurationException;
import com.openrangelabs.donpetre.mobility.exception.RunNotFoundException;
import com.openrangelabs.donpetre.mobility.model.DateWindow;
import com.openrangelabs.donpetre.mobility.model.RunSummary;
import com.openrangelabs.donpetre.mobility.model.SchemaType;
import com.openrangelabs.donpetre.mobility.model.SyncSelection;
import com.openrangelabs.donpetre.mobility.progress.ChunkProgressStore;
import com.openrangelabs.donpetre.mobility.report.CoverageReport;
import com.openrangelabs.donpetre.mobility.report.CoverageReportService;
import com.openrangelabs.donpetre.mobility.service.SyncRunCoordinator;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * REST controller for sync runs
 * Starts runs in the background, reports their progress and the coverage of the destination bucket
 */
@RestController
@RequestMapping("/api/sync")
public class SyncRunController {

    private final SyncRunCoordinator coordinator;
    private final ChunkProgressStore progressStore;
    private final CoverageReportService coverageReportService;
    private final BackfillService backfillService;

    @Autowired
    public SyncRunController(SyncRunCoordinator coordinator,
                             ChunkProgressStore progressStore,
                             CoverageReportService coverageReportService,
                             BackfillService backfillService) {
        this.coordinator = coordinator;
        this.progressStore = progressStore;
        this.coverageReportService = coverageReportService;
        this.backfillService = backfillService;
    }

    /**
     * Start a run
     *
     * The run is validated and registered before the response is sent; it then
     * proceeds in the background. Re-using the id of an interrupted run resumes it,
     * skipping chunks that already succeeded.
     *
     * @param request Date range, endpoint/schema pairs and an optional run id
     * @return 202 with the run id
     */
    @PostMapping("/runs")
    @PreAuthorize("hasRole('ADMIN')")
    public Mono<ResponseEntity<Map<String, Object>>> startRun(@Valid @RequestBody TriggerRunRequest request) {
        String runId = request.getRunId() != null && !request.getRunId().isBlank()
                ? request.getRunId()
                : "manual-" + UUID.randomUUID().toString().substring(0, 8);

        return coordinator.launch(runId, request.toDateWindow(), request.toSelections())
                .map(accepted -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("runId", accepted);
                    response.put("status", "ACCEPTED");
                    response.put("statusUrl", "/api/sync/runs/" + accepted);
                    response.put("timestamp", LocalDateTime.now());
                    return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
                });
    }

    /**
     * Ids of runs currently in progress
     */
    @GetMapping("/runs")
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    public Mono<ResponseEntity<Set<String>>> getActiveRuns() {
        return Mono.just(ResponseEntity.ok(coordinator.getActiveRunIds()));
    }

    /**
     * Progress of a run, with its summary once finished
     */
    @GetMapping("/runs/{runId}")
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    public Mono<ResponseEntity<RunStatusResponse>> getRun(@PathVariable String runId) {
        return progressStore.findByRun(runId)
                .collectList()
                .flatMap(chunks -> {
                    boolean active = coordinator.isActive(runId);
                    RunSummary summary = coordinator.getSummary(runId).orElse(null);
                    if (!active && summary == null && chunks.isEmpty()) {
                        return Mono.error(new RunNotFoundException(runId));
                    }
                    return Mono.just(ResponseEntity.ok(RunStatusResponse.of(runId, active, summary, chunks)));
                });
    }

    /**
     * Dates missing from the destination bucket, per location
     */
    @GetMapping("/coverage")
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    public Mono<ResponseEntity<CoverageReport>> getCoverage(
            @RequestParam String endpoint,
            @RequestParam SchemaType schema,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {

        return Mono.fromCallable(() -> DateWindow.of(from, to))
                .onErrorMap(IllegalArgumentException.class,
                        error -> new ConfigurationException(error.getMessage(), error))
                .flatMap(range -> coverageReportService.report(SyncSelection.of(endpoint, schema), range))
                .map(ResponseEntity::ok);
    }

    /**
     * Fill the dates missing from the destination bucket
     *
     * Runs one sync per missing date range, limited to the locations that miss it.
     * With {@code dryRun} the runs are only planned.
     *
     * @param request Endpoint/schema pair and the date range to check
     * @return 202 with the planned runs, or 200 for a dry run
     */
    @PostMapping("/backfill")
    @PreAuthorize("hasRole('ADMIN')")
    public Mono<ResponseEntity<BackfillPlan>> backfill(@Valid @RequestBody BackfillRequest request) {
        if (request.isDryRun()) {
            return backfillService.plan(request.toSelection(), request.toDateWindow())
                    .map(ResponseEntity::ok);
        }
        return backfillService.backfill(request.toSelection(), request.toDateWindow())
                .map(plan -> ResponseEntity.status(HttpStatus.ACCEPTED).body(plan));
    }
}

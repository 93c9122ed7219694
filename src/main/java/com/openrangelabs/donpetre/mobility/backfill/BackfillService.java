package com.openrangelabs.donpetre.mobility.backfill;

import com.openrangelabs.donpetre.mobility.exception.RunAlreadyActiveException;
import com.openrangelabs.donpetre.mobility.model.Aoi;
import com.openrangelabs.donpetre.mobility.model.DateWindow;
import com.openrangelabs.donpetre.mobility.model.SyncSelection;
import com.openrangelabs.donpetre.mobility.model.SyncSpec;
import com.openrangelabs.donpetre.mobility.registry.AoiRegistry;
import com.openrangelabs.donpetre.mobility.report.CoverageReport;
import com.openrangelabs.donpetre.mobility.report.CoverageReportService;
import com.openrangelabs.donpetre.mobility.service.SyncRunCoordinator;
import com.openrangelabs.donpetre.mobility.transfer.DestinationLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Turns the gaps of a coverage report into sync runs.
 *
 * <p>Locations missing the same date range are grouped into one run limited to their
 * AOIs. The runs are started one after another in the background, each with its own
 * id, so their progress is visible through the run status endpoint once they start.
 */
@Service
public class BackfillService {

    private static final Logger logger = LoggerFactory.getLogger(BackfillService.class);

    private static final DateTimeFormatter RUN_ID_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final CoverageReportService coverageReportService;
    private final AoiRegistry registry;
    private final DestinationLayout layout;
    private final SyncRunCoordinator coordinator;

    public BackfillService(CoverageReportService coverageReportService,
                           AoiRegistry registry,
                           DestinationLayout layout,
                           SyncRunCoordinator coordinator) {
        this.coverageReportService = coverageReportService;
        this.registry = registry;
        this.layout = layout;
        this.coordinator = coordinator;
    }

    /**
     * Works out the runs without starting them
     */
    public Mono<BackfillPlan> plan(SyncSelection selection, DateWindow range) {
        return coverageReportService.report(selection, range)
                .zipWith(poiIdsByPrefix())
                .map(reportAndIds -> toPlan(selection, range, reportAndIds.getT1(), reportAndIds.getT2()));
    }

    /**
     * Plans the backfill and starts its runs in the background, one at a time.
     *
     * @return the plan being executed
     */
    public Mono<BackfillPlan> backfill(SyncSelection selection, DateWindow range) {
        return plan(selection, range)
                .doOnNext(plan -> {
                    if (plan.isEmpty()) {
                        logger.info("Nothing to backfill for {} in {}", selection, range);
                        return;
                    }
                    logger.info("Backfilling {} in {} with {} runs", selection, range, plan.runs().size());
                    execute(selection, plan).subscribe(
                            count -> logger.info("Backfill of {} in {} finished {} of {} runs",
                                    selection, range, count, plan.runs().size()),
                            error -> logger.error("Backfill of {} in {} stopped: {}", selection, range,
                                    error.getMessage(), error));
                });
    }

    private Mono<Long> execute(SyncSelection selection, BackfillPlan plan) {
        return Flux.fromIterable(plan.runs())
                .concatMap(run -> coordinator.run(run.runId(), run.window(), List.of(selection), Set.copyOf(run.poiIds()))
                        .doOnNext(summary -> logger.info("Backfill run {} ended {}", run.runId(), summary.getStatus()))
                        .onErrorResume(RunAlreadyActiveException.class, error -> {
                            logger.warn("Backfill run {} is already in progress, leaving it alone", run.runId());
                            return Mono.empty();
                        }))
                .count();
    }

    private Mono<Map<String, Set<String>>> poiIdsByPrefix() {
        return registry.snapshot()
                .collect(Collectors.groupingBy(layout::aoiPrefix, TreeMap::new,
                        Collectors.mapping(Aoi::getPoiId, Collectors.toCollection(TreeSet::new))));
    }

    static BackfillPlan toPlan(SyncSelection selection, DateWindow range, CoverageReport report,
                               Map<String, Set<String>> poiIdsByPrefix) {
        Map<DateWindow, Set<String>> poiIdsByWindow = new TreeMap<>(
                Comparator.comparing(DateWindow::from).thenComparing(DateWindow::to));
        for (CoverageReport.LocationCoverage location : report.locations()) {
            Set<String> poiIds = poiIdsByPrefix.getOrDefault(location.prefix(), Set.of());
            if (poiIds.isEmpty()) {
                continue;
            }
            for (DateWindow window : location.missingRanges()) {
                poiIdsByWindow.computeIfAbsent(window, key -> new TreeSet<>()).addAll(poiIds);
            }
        }

        List<BackfillPlan.BackfillRun> runs = new ArrayList<>(poiIdsByWindow.size());
        poiIdsByWindow.forEach((window, poiIds) ->
                runs.add(new BackfillPlan.BackfillRun(runIdFor(selection, window), window, List.copyOf(poiIds))));
        return new BackfillPlan(selection.endpoint(), selection.schemaType().name(), range, runs);
    }

    static String runIdFor(SyncSelection selection, DateWindow window) {
        return "backfill-" + SyncSpec.slugOf(selection.endpoint())
                + "-" + selection.schemaType().name().toLowerCase()
                + "-" + RUN_ID_DATE.format(window.from())
                + "-" + RUN_ID_DATE.format(window.to());
    }
}

package com.openrangelabs.donpetre.mobility.scheduler;

import com.openrangelabs.donpetre.mobility.config.MobilitySyncProperties;
import com.openrangelabs.donpetre.mobility.model.DateWindow;
import com.openrangelabs.donpetre.mobility.model.SyncSelection;
import com.openrangelabs.donpetre.mobility.progress.ChunkProgressStore;
import com.openrangelabs.donpetre.mobility.service.SyncRunCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Scheduler for the daily sync and progress cleanup
 */
@Component
public class SyncScheduler {

    private static final Logger logger = LoggerFactory.getLogger(SyncScheduler.class);

    private final SyncRunCoordinator coordinator;
    private final ChunkProgressStore progressStore;
    private final MobilitySyncProperties properties;
    private final Clock clock;

    @Autowired
    public SyncScheduler(SyncRunCoordinator coordinator,
                         ChunkProgressStore progressStore,
                         MobilitySyncProperties properties,
                         Clock clock) {
        this.coordinator = coordinator;
        this.progressStore = progressStore;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Daily sync of the date {@code lagDays} before today (UTC), over the whole registry
     * and the configured selections. The run id is derived from the date, so a
     * trigger that fires while the previous one for the same date is still running is
     * rejected, and a restart resumes where the interrupted run stopped.
     */
    @Scheduled(cron = "${mobility-sync.scheduling.daily-cron:0 0 6 * * *}", zone = "UTC")
    public void dailySync() {
        MobilitySyncProperties.Scheduling scheduling = properties.getScheduling();
        if (!scheduling.isEnabled()) {
            logger.debug("Scheduled sync is disabled");
            return;
        }
        if (scheduling.getSelections().isEmpty()) {
            logger.warn("Scheduled sync is enabled but no selections are configured");
            return;
        }

        LocalDate date = LocalDate.now(clock).minusDays(scheduling.getLagDays());
        String runId = dailyRunId(date);
        List<SyncSelection> selections = scheduling.getSelections().stream()
                .map(selection -> SyncSelection.of(selection.getEndpoint(), selection.getSchema()))
                .toList();

        logger.info("Starting daily sync {} for {}", runId, selections);

        coordinator.run(runId, DateWindow.singleDay(date), selections)
                .subscribe(
                        summary -> logger.info("Daily sync {} ended with {}", runId, summary.getStatus()),
                        error -> logger.error("Daily sync {} failed: {}", runId, error.getMessage())
                );
    }

    /**
     * Clean up progress rows of finished chunks
     * Runs daily at 2 AM
     */
    @Scheduled(cron = "${mobility-sync.scheduling.cleanup-cron:0 0 2 * * *}", zone = "UTC")
    public void cleanupOldProgress() {
        int retentionDays = properties.getProgress().getRetentionDays();
        LocalDateTime threshold = LocalDateTime.now().minusDays(retentionDays);

        logger.info("Starting cleanup of chunk progress older than {} days", retentionDays);

        progressStore.purgeFinishedBefore(threshold)
                .subscribe(
                        deleted -> logger.info("Cleaned up {} chunk progress rows", deleted),
                        error -> logger.error("Error during progress cleanup: {}", error.getMessage())
                );
    }

    static String dailyRunId(LocalDate date) {
        return "daily-" + date;
    }
}

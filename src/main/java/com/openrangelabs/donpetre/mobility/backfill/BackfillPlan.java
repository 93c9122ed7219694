package com.openrangelabs.donpetre.mobility.backfill;

import com.openrangelabs.donpetre.mobility.model.DateWindow;

import java.util.List;

/**
 * Runs that fill the gaps a coverage report found, one per missing date range
 */
public record BackfillPlan(String endpoint, String schemaType, DateWindow dateRange, List<BackfillRun> runs) {

    public boolean isEmpty() {
        return runs.isEmpty();
    }

    /**
     * One run over the AOIs that miss the same dates
     */
    public record BackfillRun(String runId, DateWindow window, List<String> poiIds) {
    }
}

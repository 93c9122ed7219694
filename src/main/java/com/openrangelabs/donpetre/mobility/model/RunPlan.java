package com.openrangelabs.donpetre.mobility.model;

import java.util.List;

/**
 * Everything a run needs, resolved and checked once before dispatch and then passed
 * to every component instead of being looked up again.
 */
public record RunPlan(String runId, DateWindow dateRange, List<SyncSpec> specs,
                      RetryPolicy retryPolicy, PollPolicy pollPolicy, int workers) {

    public RunPlan {
        specs = List.copyOf(specs);
    }
}

package com.openrangelabs.donpetre.mobility.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openrangelabs.donpetre.mobility.entity.ChunkProgress;
import com.openrangelabs.donpetre.mobility.model.RunSummary;

import java.util.List;

/**
 * Progress of a run: one entry per chunk, and the summary once the run has finished
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunStatusResponse(
        String runId,
        boolean active,
        long succeededChunks,
        long failedChunks,
        long runningChunks,
        RunSummary summary,
        List<ChunkProgress> chunks) {

    public static RunStatusResponse of(String runId, boolean active, RunSummary summary, List<ChunkProgress> chunks) {
        return new RunStatusResponse(runId, active,
                chunks.stream().filter(ChunkProgress::isSucceeded).count(),
                chunks.stream().filter(ChunkProgress::isFailed).count(),
                chunks.stream().filter(ChunkProgress::isRunning).count(),
                summary, chunks);
    }
}

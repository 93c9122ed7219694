package com.openrangelabs.donpetre.mobility.model;

/**
 * Final state of a chunk within a run
 */
public enum ChunkOutcome {
    SUCCEEDED,
    FAILED,
    SKIPPED,
    NOT_STARTED
}

package com.openrangelabs.donpetre.mobility.model;

/**
 * Overall outcome of a run
 */
public enum RunStatus {
    SUCCESS,
    PARTIAL_FAILURE,
    ABORTED
}

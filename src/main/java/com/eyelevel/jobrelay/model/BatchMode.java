package com.eyelevel.jobrelay.model;

/**
 * How a tool's workers expect chunked batches to be laid out in the store.
 */
public enum BatchMode {
    /**
     * Each chunk is an independent job under the input folder with its own status record.
     */
    JOB,
    /**
     * Chunks are dropped under {@code users/{session}/chunks/} and completion is reported through
     * the shared progress ledger.
     */
    LEDGER
}

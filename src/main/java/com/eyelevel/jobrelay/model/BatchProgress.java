package com.eyelevel.jobrelay.model;

/**
 * A snapshot of ledger-reported progress for one batch session.
 *
 * @param runId           The session whose chunks are counted.
 * @param completedChunks Distinct chunks reported completed.
 * @param totalChunks     Chunks in the batch.
 * @param timedOut        Whether the wait ended at the deadline rather than on completion.
 */
public record BatchProgress(String runId, int completedChunks, int totalChunks, boolean timedOut) {

    public boolean isComplete() {
        return completedChunks >= totalChunks;
    }

    public double fraction() {
        return totalChunks == 0 ? 1.0 : (double) completedChunks / totalChunks;
    }
}

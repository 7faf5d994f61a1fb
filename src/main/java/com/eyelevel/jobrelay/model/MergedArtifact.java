package com.eyelevel.jobrelay.model;

import java.util.List;

/**
 * The outcome of merging a session's chunk results.
 *
 * @param sessionId              The batch session.
 * @param mergedKey              Key of the merged result rows.
 * @param failuresKey            Key of merged worker-reported failure rows, if any were published.
 * @param summaryKey             Key of the stored {@link MergeSummary}.
 * @param successfulChunks       Chunks whose results made it into the artifact.
 * @param totalChunks            Chunks in the batch.
 * @param rowCount               Rows in the merged artifact.
 * @param excludedChunkIndexes   Chunks left out because they failed or had no result object.
 */
public record MergedArtifact(String sessionId, String mergedKey, String failuresKey, String summaryKey,
                             int successfulChunks, int totalChunks, int rowCount,
                             List<Integer> excludedChunkIndexes) {

    public int excludedChunks() {
        return totalChunks - successfulChunks;
    }
}

package com.eyelevel.jobrelay.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Stored beside every merged artifact so that the success ratio survives the merging process.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MergeSummary(String sessionId, int successfulChunks, int totalChunks, int excludedChunks,
                           double successRatio, List<Integer> excludedChunkIndexes, int rowCount,
                           String mergedKey, String mergedAt) {
}

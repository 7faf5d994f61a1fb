package com.eyelevel.jobrelay.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * What the caller of a batch run (or a resumed one) gets back. Merge errors are reported here
 * through {@code state = failed} and {@code error} instead of being thrown.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchResult(String sessionId, String toolId, BatchMode mode, SessionState state, int totalRows,
                          int totalChunks, int successfulChunks, String mergedKey, String failuresKey,
                          String error, List<SessionChunk> chunks) {

    public static BatchResult from(final SessionEntry entry) {
        return new BatchResult(entry.getSessionId(), entry.getTool(), entry.getMode(), entry.getState(),
                               entry.getTotalRows(), entry.getTotalChunks(), entry.getSuccessfulChunks(),
                               entry.getMergedKey(), entry.getFailuresKey(), entry.getError(),
                               List.copyOf(entry.getChunks()));
    }
}

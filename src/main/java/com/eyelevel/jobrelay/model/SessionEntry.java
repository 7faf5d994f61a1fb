package com.eyelevel.jobrelay.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The durable registry record for a batch session, stored at {@code registry/{session_id}.json}.
 * It holds enough to resume monitoring and merging from a process that never saw the submission.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionEntry {

    private String sessionId;
    private String tool;
    private BatchMode mode;
    private String sourceFilename;
    private int totalRows;
    private int chunkSize;
    private int totalChunks;
    private SessionState state;
    private String createdAt;
    private String updatedAt;
    @Builder.Default
    private List<SessionChunk> chunks = new ArrayList<>();
    private String mergedKey;
    private String failuresKey;
    private int successfulChunks;
    private String error;

    /**
     * True when the dataset fit in one chunk and was submitted as a plain job.
     */
    @JsonIgnore
    public boolean isSingleJob() {
        return totalChunks == 1;
    }
}

package com.eyelevel.jobrelay.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Registry view of one chunk: where it sits in the dataset, which job carries it and how it ended.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionChunk {

    private int chunkIndex;
    private int startRow;
    private int endRow;
    /**
     * The most recent job submitted for this chunk. Null in ledger mode and before submission.
     */
    private String jobId;
    private int attempts;
    private JobStatus outcome;
    private String error;
}

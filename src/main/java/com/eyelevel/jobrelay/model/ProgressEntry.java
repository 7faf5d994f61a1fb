package com.eyelevel.jobrelay.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.OptionalInt;

/**
 * One record of the shared progress ledger, appended by a worker when a chunk changes state.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProgressEntry {

    private String runId;
    /**
     * Left untyped: workers are not consistent about writing a number here, and only integral
     * values identify a chunk.
     */
    private Object chunkIndex;
    private String status;
    private String timestamp;

    @JsonIgnore
    public OptionalInt chunkNumber() {
        if (chunkIndex instanceof Integer || chunkIndex instanceof Long || chunkIndex instanceof Short) {
            return OptionalInt.of(((Number) chunkIndex).intValue());
        }
        return OptionalInt.empty();
    }

    @JsonIgnore
    public boolean isCompleted() {
        return JobStatus.convertByValue(status) == JobStatus.COMPLETED;
    }
}

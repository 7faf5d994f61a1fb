package com.eyelevel.jobrelay.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The JSON document stored at {@code status/{job_id}_status.json}. This service writes the
 * initial record; workers overwrite it as the job progresses and may add fields of their own.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatusRecord {

    private String jobId;
    private String tool;
    /**
     * Kept as the raw stored string so that values written by newer workers survive a round trip.
     */
    private String status;
    private String timestamp;
    private String updatedAt;
    private String error;
    private String message;
}

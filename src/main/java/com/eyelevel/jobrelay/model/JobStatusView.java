package com.eyelevel.jobrelay.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * What a caller learns about a job at one point in time.
 *
 * @param jobId        The job identifier that was queried.
 * @param toolId       The tool the job belongs to.
 * @param status       The observed state.
 * @param error        The worker's failure message, or a description of why the state is synthetic.
 * @param resultsReady For {@code completed} jobs, whether the result object is visible yet.
 * @param resultKey    The result object's key; only set once the job is completed.
 * @param timestamp    The submission timestamp from the status record.
 * @param updatedAt    The last update timestamp from the status record.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusView(String jobId, String toolId, JobStatus status, String error, boolean resultsReady,
                            String resultKey, String timestamp, String updatedAt) {

    public static JobStatusView notFound(final String toolId, final String jobId) {
        return new JobStatusView(jobId, toolId, JobStatus.NOT_FOUND, null, false, null, null, null);
    }

    public static JobStatusView timeout(final String toolId, final String jobId, final String error) {
        return new JobStatusView(jobId, toolId, JobStatus.TIMEOUT, error, false, null, null, null);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }
}

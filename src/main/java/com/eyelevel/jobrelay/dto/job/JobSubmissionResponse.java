package com.eyelevel.jobrelay.dto.job;

import com.eyelevel.jobrelay.model.JobStatus;
import com.eyelevel.jobrelay.model.SubmittedJob;

/**
 * Returned when a single job has been accepted into the store.
 */
public record JobSubmissionResponse(String jobId, String toolId, String inputKey, JobStatus status,
                                    String submittedAt) {

    public static JobSubmissionResponse from(SubmittedJob job) {
        return new JobSubmissionResponse(job.jobId(), job.toolId(), job.inputKey(), JobStatus.PENDING,
                                         job.submittedAt());
    }
}

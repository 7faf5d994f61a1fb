package com.eyelevel.jobrelay.model;

/**
 * A job whose input and pending status record are both in the store.
 */
public record SubmittedJob(String jobId, String toolId, String inputKey, String statusKey, String submittedAt) {
}

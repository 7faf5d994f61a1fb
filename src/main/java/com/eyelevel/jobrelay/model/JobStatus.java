package com.eyelevel.jobrelay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The states a job can be observed in. Values are written to and read from status records in
 * their lowercase wire form.
 */
public enum JobStatus {
    /**
     * The status record exists but the input payload is not yet confirmed in the store. A job
     * left here was interrupted mid-submission.
     */
    UPLOADING("uploading"),
    /**
     * The input is in the store and waiting for a worker to pick it up.
     */
    PENDING("pending"),
    /**
     * A worker has picked up the job.
     */
    PROCESSING("processing"),
    /**
     * The worker finished successfully. The result object may still be invisible for a short while.
     */
    COMPLETED("completed"),
    /**
     * The worker reported a failure.
     */
    FAILED("failed"),
    /**
     * Client-side classification only: no terminal state was observed within the maximum wait.
     * Never written to the store.
     */
    TIMEOUT("timeout"),
    /**
     * No status record exists for the identifier.
     */
    NOT_FOUND("not_found"),
    /**
     * The stored value is not one this service recognises, or the record could not be read.
     */
    UNKNOWN("unknown");

    private final String value;

    JobStatus(final String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TIMEOUT;
    }

    /**
     * Converts a stored status string to its enum value. Unrecognised or blank values map to
     * {@link #UNKNOWN} rather than failing, since workers own the records.
     */
    @JsonCreator
    public static JobStatus convertByValue(final String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        final String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (JobStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}

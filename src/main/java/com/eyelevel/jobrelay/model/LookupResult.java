package com.eyelevel.jobrelay.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Resolution of a short identifier typed by a user: either a single job, a batch session, or nothing.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LookupResult(String id, Kind kind, JobStatusView job, BatchResult session) {

    public enum Kind { JOB, SESSION, NOT_FOUND }

    public static LookupResult ofJob(final JobStatusView job) {
        return new LookupResult(job.jobId(), Kind.JOB, job, null);
    }

    public static LookupResult ofSession(final BatchResult session) {
        return new LookupResult(session.sessionId(), Kind.SESSION, null, session);
    }

    public static LookupResult notFound(final String id) {
        return new LookupResult(id, Kind.NOT_FOUND, null, null);
    }
}

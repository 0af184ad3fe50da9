package com.libragraph.relay.core.job;

import com.libragraph.relay.types.JobStatus;

/**
 * Thrown when a state-advance call does not follow
 * {@code QUEUED -> RUNNING -> DONE | ERROR}. The record is left unchanged;
 * callers treat this as a logged no-op since duplicate worker reports are expected.
 */
public class InvalidTransitionException extends RuntimeException {

    private final String jobId;
    private final JobStatus from;
    private final JobStatus to;

    public InvalidTransitionException(String jobId, JobStatus from, JobStatus to) {
        super("Job " + jobId + " cannot move from " + from.label() + " to " + to.label());
        this.jobId = jobId;
        this.from = from;
        this.to = to;
    }

    public String jobId() {
        return jobId;
    }

    public JobStatus from() {
        return from;
    }

    public JobStatus to() {
        return to;
    }
}

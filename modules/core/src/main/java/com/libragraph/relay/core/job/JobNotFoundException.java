package com.libragraph.relay.core.job;

/**
 * Thrown when an operation targets a job id the store does not hold,
 * either because it never existed or because it was deleted or swept.
 */
public class JobNotFoundException extends RuntimeException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job " + jobId + " not found");
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}

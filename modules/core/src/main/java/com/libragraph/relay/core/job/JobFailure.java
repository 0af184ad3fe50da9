package com.libragraph.relay.core.job;

/**
 * Implemented by exceptions that classify why a job failed. The worker reports
 * {@code kind() + ": " + message} back to the broker as the job's error message.
 */
public interface JobFailure {

    /** Short stable classification, e.g. {@code BackendTimeout}. */
    String kind();
}

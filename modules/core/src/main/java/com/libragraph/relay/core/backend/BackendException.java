package com.libragraph.relay.core.backend;

import com.libragraph.relay.core.job.JobFailure;

/**
 * Base class for failures talking to, or reported by, the generative backend.
 */
public abstract class BackendException extends RuntimeException implements JobFailure {

    protected BackendException(String message) {
        super(message);
    }

    protected BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.libragraph.relay.core.backend;

import java.time.Duration;

/**
 * No terminal history record appeared within the time budget. This also covers
 * a backend that stayed unreachable for the whole budget; the last transport
 * error, if any, is the cause. The backend execution is not cancelled.
 */
public class BackendTimeoutException extends BackendException {

    private final String executionId;
    private final Duration timeout;

    public BackendTimeoutException(String executionId, Duration timeout, Throwable lastError) {
        super("Execution " + executionId + " did not complete within " + timeout
                + (lastError != null ? " (last error: " + lastError.getMessage() + ")" : ""), lastError);
        this.executionId = executionId;
        this.timeout = timeout;
    }

    public String executionId() {
        return executionId;
    }

    public Duration timeout() {
        return timeout;
    }

    @Override
    public String kind() {
        return "BackendTimeout";
    }
}

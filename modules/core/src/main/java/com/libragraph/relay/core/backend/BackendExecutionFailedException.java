package com.libragraph.relay.core.backend;

/**
 * The backend reported a terminal error for an execution.
 */
public class BackendExecutionFailedException extends BackendException {

    private final String executionId;
    private final String backendMessage;

    public BackendExecutionFailedException(String executionId, String backendMessage) {
        super("Execution " + executionId + " failed: " + backendMessage);
        this.executionId = executionId;
        this.backendMessage = backendMessage;
    }

    public String executionId() {
        return executionId;
    }

    /** The error text as the backend reported it. */
    public String backendMessage() {
        return backendMessage;
    }

    @Override
    public String kind() {
        return "BackendExecutionFailed";
    }
}

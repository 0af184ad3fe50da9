package com.libragraph.relay.core.workflow;

import com.libragraph.relay.core.job.JobFailure;

/**
 * The workflow template cannot be loaded, or a required field is not bound
 * to a node that exists in it.
 */
public class WorkflowConfigurationException extends RuntimeException implements JobFailure {

    public WorkflowConfigurationException(String message) {
        super(message);
    }

    public WorkflowConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "WorkflowConfiguration";
    }
}

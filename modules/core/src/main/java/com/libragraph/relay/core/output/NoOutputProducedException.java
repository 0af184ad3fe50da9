package com.libragraph.relay.core.output;

import com.libragraph.relay.core.job.JobFailure;

/**
 * The backend reported success but none of the manifest entries resolve to a
 * file on disk.
 */
public class NoOutputProducedException extends RuntimeException implements JobFailure {

    private final String executionId;

    public NoOutputProducedException(String executionId, int entriesChecked) {
        super("Execution " + executionId + " completed but none of its "
                + entriesChecked + " output entries exist on disk");
        this.executionId = executionId;
    }

    public String executionId() {
        return executionId;
    }

    @Override
    public String kind() {
        return "NoOutputProduced";
    }
}

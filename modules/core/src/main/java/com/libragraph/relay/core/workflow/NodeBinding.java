package com.libragraph.relay.core.workflow;

import java.util.Objects;

/** Target of one {@link WorkflowField}: an input of a node in the graph. */
public record NodeBinding(String nodeId, String inputName) {

    public NodeBinding {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(inputName, "inputName");
        if (nodeId.isBlank() || inputName.isBlank()) {
            throw new IllegalArgumentException("nodeId and inputName must not be blank");
        }
    }

    @Override
    public String toString() {
        return nodeId + "." + inputName;
    }
}

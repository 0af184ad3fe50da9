package com.libragraph.relay.core.workflow;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * A parameterizable backend job graph: node id to {@code {class_type, inputs}}.
 * The graph is shared; consumers must copy before modifying it.
 *
 * @param source where the template was loaded from, for log messages
 */
public record WorkflowTemplate(String source, ObjectNode graph) {

    public WorkflowTemplate {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(graph, "graph");
    }

    public boolean hasNode(String nodeId) {
        return graph.path(nodeId).isObject();
    }
}

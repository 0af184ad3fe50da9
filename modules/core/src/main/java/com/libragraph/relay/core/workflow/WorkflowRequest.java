package com.libragraph.relay.core.workflow;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Concrete graph for one backend submission. Exists for a single attempt only.
 *
 * @param outputPrefix filename prefix given to the backend, embeds the job id
 */
public record WorkflowRequest(String jobId, ObjectNode graph, long seed, String outputPrefix) {
}

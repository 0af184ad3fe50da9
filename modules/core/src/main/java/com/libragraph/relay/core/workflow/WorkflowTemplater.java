package com.libragraph.relay.core.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Turns a generic {@link WorkflowTemplate} plus per-job values into a concrete
 * {@link WorkflowRequest}.
 *
 * <p>{@link #render} is pure: the template is deep-copied, never mutated, and the
 * same template, mapping and parameters always serialize to identical bytes.
 * A field bound to a node the template lacks is skipped with a warning.
 */
@ApplicationScoped
public class WorkflowTemplater {

    private static final Logger log = Logger.getLogger(WorkflowTemplater.class);

    @ConfigProperty(name = "relay.workflow.output-subdir", defaultValue = "td_output")
    String outputSubdir;

    public WorkflowTemplater() {
    }

    WorkflowTemplater(String outputSubdir) {
        this.outputSubdir = outputSubdir;
    }

    public WorkflowRequest render(WorkflowTemplate template, FieldMapping mapping, JobParameters params) {
        ObjectNode graph = template.graph().deepCopy();
        String outputPrefix = outputPrefix(params.jobId());

        inject(graph, mapping, WorkflowField.IMAGE_INPUT, params.inputPath());
        if (!params.prompt().isEmpty()) {
            inject(graph, mapping, WorkflowField.POSITIVE_PROMPT, params.prompt());
        }
        if (params.negativePrompt() != null) {
            inject(graph, mapping, WorkflowField.NEGATIVE_PROMPT, params.negativePrompt());
        }
        injectSeed(graph, mapping, params.seed());
        inject(graph, mapping, WorkflowField.OUTPUT_PREFIX, outputPrefix);

        return new WorkflowRequest(params.jobId(), graph, params.seed(), outputPrefix);
    }

    /** The supplied seed, or a uniformly random one in {@code [1, Long.MAX_VALUE)}. */
    public long resolveSeed(Long requested) {
        if (requested != null) {
            return requested;
        }
        return ThreadLocalRandom.current().nextLong(1, Long.MAX_VALUE);
    }

    /** {@code <output-subdir>/<jobId>}, so outputs can be matched to jobs by name alone. */
    public String outputPrefix(String jobId) {
        if (outputSubdir == null || outputSubdir.isBlank()) {
            return jobId;
        }
        return outputSubdir + "/" + jobId;
    }

    private void inject(ObjectNode graph, FieldMapping mapping, WorkflowField field, String value) {
        ObjectNode inputs = inputsFor(graph, mapping, field);
        if (inputs != null) {
            inputs.put(mapping.binding(field).get().inputName(), value);
        }
    }

    private void injectSeed(ObjectNode graph, FieldMapping mapping, long seed) {
        ObjectNode inputs = inputsFor(graph, mapping, WorkflowField.SEED);
        if (inputs != null) {
            inputs.put(mapping.binding(WorkflowField.SEED).get().inputName(), seed);
        }
    }

    private ObjectNode inputsFor(ObjectNode graph, FieldMapping mapping, WorkflowField field) {
        NodeBinding binding = mapping.binding(field).orElse(null);
        if (binding == null) {
            return null;
        }
        JsonNode node = graph.get(binding.nodeId());
        if (node == null || !node.isObject()) {
            log.warnf("Workflow node %s for %s not found, skipping", binding.nodeId(), field);
            return null;
        }
        JsonNode inputs = node.get("inputs");
        if (inputs == null || !inputs.isObject()) {
            log.warnf("Workflow node %s has no inputs object, skipping %s", binding.nodeId(), field);
            return null;
        }
        return (ObjectNode) inputs;
    }
}

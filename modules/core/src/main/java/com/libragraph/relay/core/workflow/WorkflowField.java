package com.libragraph.relay.core.workflow;

/**
 * Per-job values the templater knows how to inject into a workflow graph.
 *
 * <p>Each field is bound to a backend node through configuration:
 * {@code relay.workflow.nodes.<configKey>} names the node id and
 * {@code relay.workflow.inputs.<configKey>} optionally overrides the input name.
 */
public enum WorkflowField {
    IMAGE_INPUT("image-input", "image", true),
    POSITIVE_PROMPT("positive-prompt", "text", false),
    NEGATIVE_PROMPT("negative-prompt", "text", false),
    SEED("seed", "seed", false),
    OUTPUT_PREFIX("output-prefix", "filename_prefix", true);

    private final String configKey;
    private final String defaultInputName;
    private final boolean required;

    WorkflowField(String configKey, String defaultInputName, boolean required) {
        this.configKey = configKey;
        this.defaultInputName = defaultInputName;
        this.required = required;
    }

    public String configKey() {
        return configKey;
    }

    public String defaultInputName() {
        return defaultInputName;
    }

    /** A workflow without this field bound cannot run at all. */
    public boolean required() {
        return required;
    }
}

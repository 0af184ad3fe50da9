package com.libragraph.relay.core.workflow;

import java.util.Objects;

/**
 * Per-job values handed to {@link WorkflowTemplater#render}. The seed is already
 * resolved (see {@link WorkflowTemplater#resolveSeed(Long)}) so rendering stays pure.
 */
public record JobParameters(
        String jobId,
        String inputPath,
        String prompt,
        String negativePrompt,
        long seed
) {
    public JobParameters {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(inputPath, "inputPath");
        prompt = prompt == null ? "" : prompt;
    }
}

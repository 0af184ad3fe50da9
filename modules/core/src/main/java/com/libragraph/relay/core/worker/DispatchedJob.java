package com.libragraph.relay.core.worker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What the broker hands the worker for one queued job ({@code GET /queue/next}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DispatchedJob(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("input_image_path") String inputImagePath,
        @JsonProperty("prompt") String prompt,
        @JsonProperty("negative_prompt") String negativePrompt,
        @JsonProperty("seed") Long seed
) {}

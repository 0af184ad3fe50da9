package com.libragraph.relay.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.relay.core.job.Job;

import java.time.Instant;

/**
 * Job status document returned by {@code GET /jobs/{id}} and {@code GET /jobs}.
 * Paths are not exposed; {@code has_result} says whether a result can be fetched.
 */
public record JobView(
        @JsonProperty("id") String id,
        @JsonProperty("status") String status,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("prompt") String prompt,
        @JsonProperty("negative_prompt") String negativePrompt,
        @JsonProperty("seed") Long seed,
        @JsonProperty("has_result") boolean hasResult,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("completed_at") Instant completedAt,
        @JsonProperty("processing_time") Double processingTime
) {
    public static JobView of(Job job) {
        return new JobView(
                job.id(),
                job.status().label(),
                job.createdAt(),
                job.prompt(),
                job.negativePrompt(),
                job.seed(),
                job.resultPath() != null,
                job.errorMessage(),
                job.startedAt(),
                job.completedAt(),
                job.processingTime().map(d -> d.toMillis() / 1000.0).orElse(null)
        );
    }
}

package com.libragraph.relay.core.job;

import com.libragraph.relay.types.JobStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of one broker job. {@link JobStore} replaces the whole
 * record on every transition, so a reference handed out is never mutated.
 *
 * <p>Invariants checked on construction: {@code resultPath} is set iff the
 * status is DONE, {@code errorMessage} is set iff the status is ERROR, and
 * {@code startedAt <= completedAt} when both are present.
 */
public record Job(
        String id,
        Instant createdAt,
        String inputPath,
        String prompt,
        String negativePrompt,
        Long seed,
        JobStatus status,
        String resultPath,
        String errorMessage,
        Instant startedAt,
        Instant completedAt
) {
    public Job {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(status, "status");
        prompt = prompt == null ? "" : prompt;
        if ((resultPath != null) != (status == JobStatus.DONE)) {
            throw new IllegalArgumentException(
                    "resultPath must be set iff status is DONE (status=" + status + ")");
        }
        if ((errorMessage != null) != (status == JobStatus.ERROR)) {
            throw new IllegalArgumentException(
                    "errorMessage must be set iff status is ERROR (status=" + status + ")");
        }
        if (startedAt != null && completedAt != null && completedAt.isBefore(startedAt)) {
            throw new IllegalArgumentException("completedAt precedes startedAt for job " + id);
        }
    }

    static Job queued(String id, Instant createdAt, String inputPath,
                      String prompt, String negativePrompt, Long seed) {
        return new Job(id, createdAt, inputPath, prompt, negativePrompt, seed,
                JobStatus.QUEUED, null, null, null, null);
    }

    Job running(Instant at) {
        return new Job(id, createdAt, inputPath, prompt, negativePrompt, seed,
                JobStatus.RUNNING, null, null, at, null);
    }

    Job done(String result, Instant at) {
        return new Job(id, createdAt, inputPath, prompt, negativePrompt, seed,
                JobStatus.DONE, result, null, startedAt, notBeforeStart(at));
    }

    Job failed(String message, Instant at) {
        return new Job(id, createdAt, inputPath, prompt, negativePrompt, seed,
                JobStatus.ERROR, null, message, startedAt, notBeforeStart(at));
    }

    /** Wall time between start and completion, when both are known. */
    public Optional<Duration> processingTime() {
        if (startedAt == null || completedAt == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(startedAt, completedAt));
    }

    // wall clock may step backwards between the two calls
    private Instant notBeforeStart(Instant at) {
        return startedAt != null && at.isBefore(startedAt) ? startedAt : at;
    }
}

package com.libragraph.relay.core.job;

import com.libragraph.relay.types.JobStatus;
import com.libragraph.relay.util.JobIds;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Authoritative in-memory map of job id to {@link Job}. Enforces the job state
 * machine and never touches the filesystem; callers release owned files.
 *
 * <p>All reads and read-modify-writes run under one lock, so the HTTP layer
 * may call in from any number of request threads. Records are lost on restart.
 *
 * <p>{@link #nextQueued()} does not reserve the job it returns. That is safe for
 * a single worker; deployments with several workers must use {@link #claimNext()}.
 */
@ApplicationScoped
public class JobStore {

    private static final Logger log = Logger.getLogger(JobStore.class);

    private static final Comparator<Job> OLDEST_FIRST = Comparator.comparing(Job::createdAt);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Job> jobs = new HashMap<>();
    private final Set<String> reserved = new HashSet<>();

    Clock clock = Clock.systemUTC();

    /**
     * Returns an id no live or reserved job uses, and holds it until
     * {@link #create(String, String, String, String, Long)} or {@link #releaseId(String)}.
     * Lets the caller name owned files after the job before the record exists.
     */
    public String reserveId() {
        lock.lock();
        try {
            String id;
            do {
                id = JobIds.newId();
            } while (jobs.containsKey(id) || reserved.contains(id));
            reserved.add(id);
            return id;
        } finally {
            lock.unlock();
        }
    }

    public void releaseId(String id) {
        lock.lock();
        try {
            reserved.remove(id);
        } finally {
            lock.unlock();
        }
    }

    /** Creates a QUEUED job under a fresh id. */
    public Job create(String inputPath, String prompt, String negativePrompt, Long seed) {
        return create(reserveId(), inputPath, prompt, negativePrompt, seed);
    }

    /**
     * Creates a QUEUED job under an id obtained from {@link #reserveId()}.
     *
     * @throws IllegalStateException if {@code id} was not reserved
     */
    public Job create(String id, String inputPath, String prompt, String negativePrompt, Long seed) {
        lock.lock();
        try {
            if (!reserved.remove(id)) {
                throw new IllegalStateException("Job id " + id + " was not reserved");
            }
            Job job = Job.queued(id, clock.instant(), inputPath, prompt, negativePrompt, seed);
            jobs.put(id, job);
            log.debugf("Job created: id=%s, input=%s", id, inputPath);
            return job;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Job> find(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(jobs.get(id));
        } finally {
            lock.unlock();
        }
    }

    /** @throws JobNotFoundException if no job has this id */
    public Job get(String id) {
        return find(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    /**
     * Jobs newest-first by creation time, optionally restricted to one status.
     * Ties on creation time come back in no particular order.
     *
     * @param statusFilter null for every status
     */
    public List<Job> list(JobStatus statusFilter, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got " + limit);
        }
        lock.lock();
        try {
            return jobs.values().stream()
                    .filter(j -> statusFilter == null || j.status() == statusFilter)
                    .sorted(OLDEST_FIRST.reversed())
                    .limit(limit)
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the record and returns it so the caller can release its files.
     *
     * @throws JobNotFoundException if no job has this id
     */
    public Job delete(String id) {
        lock.lock();
        try {
            Job removed = jobs.remove(id);
            if (removed == null) {
                throw new JobNotFoundException(id);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public Job markRunning(String id) {
        return advance(id, JobStatus.RUNNING, job -> job.running(clock.instant()));
    }

    public Job markDone(String id, String resultPath) {
        if (resultPath == null || resultPath.isBlank()) {
            throw new IllegalArgumentException("resultPath is required");
        }
        return advance(id, JobStatus.DONE, job -> job.done(resultPath, clock.instant()));
    }

    public Job markError(String id, String message) {
        String recorded = message == null || message.isBlank() ? "Unknown error" : message;
        return advance(id, JobStatus.ERROR, job -> job.failed(recorded, clock.instant()));
    }

    /** Oldest QUEUED job by creation time, without reserving it. */
    public Optional<Job> nextQueued() {
        lock.lock();
        try {
            return oldestQueued();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Atomically moves the oldest QUEUED job to RUNNING and returns it.
     * The claim primitive for running more than one worker against this store.
     */
    public Optional<Job> claimNext() {
        lock.lock();
        try {
            Optional<Job> next = oldestQueued();
            next.ifPresent(job -> jobs.put(job.id(), job.running(clock.instant())));
            return next.map(job -> jobs.get(job.id()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every job created more than {@code maxAge} ago, whatever its status,
     * and returns the removed records so the caller can delete their files.
     */
    public List<Job> sweep(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        lock.lock();
        try {
            List<Job> expired = new ArrayList<>();
            jobs.values().removeIf(job -> {
                if (job.createdAt().isBefore(cutoff)) {
                    expired.add(job);
                    return true;
                }
                return false;
            });
            return expired;
        } finally {
            lock.unlock();
        }
    }

    /** Count per status; every status is present, possibly with zero. */
    public Map<JobStatus, Long> countByStatus() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus s : JobStatus.values()) {
            counts.put(s, 0L);
        }
        lock.lock();
        try {
            for (Job job : jobs.values()) {
                counts.merge(job.status(), 1L, Long::sum);
            }
        } finally {
            lock.unlock();
        }
        return counts;
    }

    public int size() {
        lock.lock();
        try {
            return jobs.size();
        } finally {
            lock.unlock();
        }
    }

    private Job advance(String id, JobStatus target, UnaryOperator<Job> step) {
        lock.lock();
        try {
            Job current = jobs.get(id);
            if (current == null) {
                throw new JobNotFoundException(id);
            }
            if (!current.status().canTransitionTo(target)) {
                throw new InvalidTransitionException(id, current.status(), target);
            }
            Job next = step.apply(current);
            jobs.put(id, next);
            return next;
        } finally {
            lock.unlock();
        }
    }

    private Optional<Job> oldestQueued() {
        return jobs.values().stream()
                .filter(j -> j.status() == JobStatus.QUEUED)
                .min(OLDEST_FIRST);
    }
}

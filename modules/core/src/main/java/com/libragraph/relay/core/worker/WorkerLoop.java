package com.libragraph.relay.core.worker;

import com.libragraph.relay.core.service.AbstractManagedService;
import com.libragraph.relay.core.service.DependsOn;
import com.libragraph.relay.core.workflow.WorkflowCatalog;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

/**
 * Single worker thread that pulls queued jobs from the broker over HTTP and
 * drives each one through {@link JobProcessor}.
 *
 * <p>Every job-level exception becomes an {@code error} report; only failures to
 * reach the broker escape an iteration. Those are counted, and after
 * {@code relay.worker.max-consecutive-errors} in a row the loop cools down
 * before trying again. Completion and error reports are retried up to
 * {@code relay.worker.report-attempts} times so a brief broker outage does not
 * strand a finished job in {@code running}.
 *
 * <p>A failure cascaded from {@link WorkflowCatalog} halts the thread the same
 * way {@link #stop()} does, leaving queued jobs untouched.
 *
 * <p>Dequeue and start are two broker calls. That is only safe with one worker
 * per broker.
 */
@ApplicationScoped
@Startup
@DependsOn(WorkflowCatalog.class)
public class WorkerLoop extends AbstractManagedService {

    @Inject
    BrokerClient brokerClient;

    @Inject
    JobProcessor jobProcessor;

    @Inject
    WorkflowCatalog workflowCatalog;

    @ConfigProperty(name = "relay.worker.enabled", defaultValue = "false")
    boolean enabled;

    @ConfigProperty(name = "relay.worker.poll-interval", defaultValue = "500ms")
    Duration pollInterval;

    @ConfigProperty(name = "relay.worker.max-consecutive-errors", defaultValue = "5")
    int maxConsecutiveErrors;

    @ConfigProperty(name = "relay.worker.cooldown", defaultValue = "10s")
    Duration cooldown;

    @ConfigProperty(name = "relay.worker.report-attempts", defaultValue = "3")
    int reportAttempts;

    @ConfigProperty(name = "relay.worker.report-retry-delay", defaultValue = "1s")
    Duration reportRetryDelay;

    private final AtomicInteger consecutiveErrors = new AtomicInteger();
    private final AtomicLong jobsProcessed = new AtomicLong();
    private volatile boolean running;
    private volatile Thread thread;

    @Override
    public String serviceId() {
        return "worker-loop";
    }

    @Override
    protected void doStart() {
        running = true;
        thread = new Thread(this::workerLoop, "relay-worker");
        thread.start();
        log.infof("Worker started: poll every %s, cooldown %s after %d consecutive errors",
                pollInterval, cooldown, maxConsecutiveErrors);
    }

    @Override
    protected void doStop() {
        halt();
        log.info("Worker stopped");
    }

    @Override
    public void fail(Throwable cause) {
        halt();
        super.fail(cause);
    }

    private void halt() {
        running = false;
        Thread current = thread;
        thread = null;
        if (current != null) {
            current.interrupt();
        }
    }

    public boolean enabled() {
        return enabled;
    }

    public int consecutiveErrors() {
        return consecutiveErrors.get();
    }

    public long jobsProcessed() {
        return jobsProcessed.get();
    }

    /**
     * One iteration: dequeue, claim, process, report.
     *
     * @return false when the queue was empty
     * @throws BrokerUnavailableException if the broker cannot be reached
     */
    public boolean pollOnce() throws InterruptedException {
        Optional<DispatchedJob> next = brokerClient.nextJob();
        if (next.isEmpty()) {
            return false;
        }
        DispatchedJob job = next.get();
        log.infof("Received job %s", job.jobId());

        if (!brokerClient.markStarted(job.jobId())) {
            log.warnf("Broker did not accept start of job %s, skipping it", job.jobId());
            return true;
        }

        Path result = null;
        String failure = null;
        try {
            result = jobProcessor.process(job);
        } catch (InterruptedException e) {
            reportInterrupted(job);
            throw e;
        } catch (Exception e) {
            failure = JobProcessor.describeFailure(e);
            log.errorf("Job %s failed: %s", job.jobId(), failure);
        }

        if (failure == null) {
            String resultPath = result.toString();
            if (report("complete job " + job.jobId(), () -> brokerClient.markComplete(job.jobId(), resultPath))) {
                log.infof("Job %s completed successfully", job.jobId());
            }
        } else {
            String message = failure;
            report("report error for job " + job.jobId(), () -> brokerClient.markError(job.jobId(), message));
        }
        jobsProcessed.incrementAndGet();
        return true;
    }

    boolean report(String what, BooleanSupplier call) throws InterruptedException {
        int attempts = Math.max(1, reportAttempts);
        for (int attempt = 1; ; attempt++) {
            try {
                return call.getAsBoolean();
            } catch (BrokerUnavailableException e) {
                if (attempt >= attempts) {
                    throw e;
                }
                log.warnf("Could not %s (attempt %d/%d): %s", what, attempt, attempts, e.getMessage());
                Thread.sleep(reportRetryDelay.toMillis());
            }
        }
    }

    /**
     * Records a loop-level error and returns how long to wait before the next
     * iteration: the poll interval, or the cooldown once the limit is reached
     * (which also resets the count).
     */
    Duration onLoopError(Exception e) {
        int errors = consecutiveErrors.incrementAndGet();
        log.errorf("Worker error (%d/%d): %s", errors, maxConsecutiveErrors, e.getMessage());
        if (errors >= maxConsecutiveErrors) {
            log.errorf("Too many consecutive errors, cooling down for %s", cooldown);
            consecutiveErrors.set(0);
            return cooldown;
        }
        return pollInterval;
    }

    private void workerLoop() {
        while (running) {
            try {
                boolean worked = pollOnce();
                consecutiveErrors.set(0);
                if (!worked) {
                    Thread.sleep(pollInterval.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                if (!running) {
                    break;
                }
                try {
                    Thread.sleep(onLoopError(e).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }

    // Clears the interrupt long enough to tell the broker, then restores it.
    private void reportInterrupted(DispatchedJob job) {
        Thread.interrupted();
        try {
            brokerClient.markError(job.jobId(), "WorkerInterrupted: worker shut down while the job was running");
        } catch (BrokerUnavailableException e) {
            log.warnf("Could not report interrupted job %s: %s", job.jobId(), e.getMessage());
        } finally {
            Thread.currentThread().interrupt();
        }
    }

    @PostConstruct
    void init() {
        if (!enabled) {
            log.info("Worker disabled (relay.worker.enabled=false)");
            return;
        }
        try {
            workflowCatalog.start();
            start();
        } catch (Exception e) {
            throw new RuntimeException("WorkerLoop failed to start", e);
        }
    }

    @PreDestroy
    void shutdown() {
        try {
            stop();
        } catch (Exception e) {
            log.warn("Error stopping WorkerLoop", e);
        }
    }
}

package com.libragraph.relay.core.job;

import com.libragraph.relay.core.storage.ArtifactStorage;
import com.libragraph.relay.core.storage.StorageException;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

/**
 * Periodically evicts jobs older than {@code relay.jobs.max-age}, whatever their
 * status, and deletes the files they own.
 *
 * <p>Outputs the backend writes after a job timed out or was deleted are not
 * referenced by any record and are not reclaimed here.
 */
@ApplicationScoped
public class JobSweeper {

    private static final Logger log = Logger.getLogger(JobSweeper.class);

    @Inject
    JobStore jobStore;

    @Inject
    ArtifactStorage artifactStorage;

    @ConfigProperty(name = "relay.jobs.max-age", defaultValue = "1h")
    Duration maxAge;

    @Scheduled(every = "${relay.jobs.sweep-every:5m}", concurrentExecution = SKIP)
    public void sweep() {
        sweep(maxAge);
    }

    /** @return number of jobs removed */
    public int sweep(Duration age) {
        List<Job> expired = jobStore.sweep(age);
        for (Job job : expired) {
            try {
                artifactStorage.deleteOwnedFiles(job);
            } catch (StorageException e) {
                log.warnf("Error cleaning up files of job %s: %s", job.id(), e.getMessage());
            }
        }
        if (!expired.isEmpty()) {
            log.infof("Cleaned up %d old jobs", expired.size());
        }
        return expired.size();
    }
}

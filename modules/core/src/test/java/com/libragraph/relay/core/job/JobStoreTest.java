package com.libragraph.relay.core.job;

import com.libragraph.relay.types.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class JobStoreTest {

    private static final Instant T0 = Instant.parse("2025-03-01T12:00:00Z");

    private MutableClock clock;
    private JobStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new JobStore();
        store.clock = clock;
    }

    private Job queued(String prompt) {
        return store.create("/in/" + prompt + ".png", prompt, null, null);
    }

    // --- Creation ---

    @Test
    void createStartsQueuedWithNothingElseSet() {
        Job job = store.create("/in/a.png", "a cat", "blurry", 42L);

        assertThat(job.id()).hasSize(8).matches("[0-9a-f]{8}");
        assertThat(job.status()).isEqualTo(JobStatus.QUEUED);
        assertThat(job.createdAt()).isEqualTo(T0);
        assertThat(job.prompt()).isEqualTo("a cat");
        assertThat(job.negativePrompt()).isEqualTo("blurry");
        assertThat(job.seed()).isEqualTo(42L);
        assertThat(job.resultPath()).isNull();
        assertThat(job.errorMessage()).isNull();
        assertThat(job.startedAt()).isNull();
        assertThat(job.completedAt()).isNull();
        assertThat(job.processingTime()).isEmpty();
    }

    @Test
    void nullPromptIsStoredAsEmpty() {
        Job job = store.create("/in/a.png", null, null, null);
        assertThat(job.prompt()).isEmpty();
        assertThat(job.negativePrompt()).isNull();
        assertThat(job.seed()).isNull();
    }

    @Test
    void idsAreUniqueAcrossManyJobs() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 2000; i++) {
            ids.add(queued("p" + i).id());
        }
        assertThat(ids).hasSize(2000);
        assertThat(store.size()).isEqualTo(2000);
    }

    @Test
    void createRequiresReservedId() {
        assertThatIllegalStateException()
                .isThrownBy(() -> store.create("deadbeef", "/in/a.png", "", null, null))
                .withMessageContaining("deadbeef");
    }

    @Test
    void reservedIdIsConsumedByCreate() {
        String id = store.reserveId();
        Job job = store.create(id, "/in/a.png", "x", null, null);
        assertThat(job.id()).isEqualTo(id);

        assertThatIllegalStateException()
                .isThrownBy(() -> store.create(id, "/in/b.png", "y", null, null));
    }

    @Test
    void releasedIdCannotBeUsed() {
        String id = store.reserveId();
        store.releaseId(id);
        assertThatIllegalStateException()
                .isThrownBy(() -> store.create(id, "/in/a.png", "x", null, null));
        assertThat(store.size()).isZero();
    }

    // --- Lookup and listing ---

    @Test
    void getUnknownIdThrowsNotFound() {
        assertThatThrownBy(() -> store.get("nope1234"))
                .isInstanceOf(JobNotFoundException.class)
                .hasMessage("Job nope1234 not found");
        assertThat(store.find("nope1234")).isEmpty();
    }

    @Test
    void listIsNewestFirst() {
        Job first = queued("first");
        clock.advance(Duration.ofSeconds(1));
        Job second = queued("second");
        clock.advance(Duration.ofSeconds(1));
        Job third = queued("third");

        assertThat(store.list(null, 50)).extracting(Job::id)
                .containsExactly(third.id(), second.id(), first.id());
    }

    @Test
    void listFiltersByStatusAndHonoursLimit() {
        Job a = queued("a");
        clock.advance(Duration.ofSeconds(1));
        Job b = queued("b");
        clock.advance(Duration.ofSeconds(1));
        Job c = queued("c");
        store.markRunning(b.id());

        assertThat(store.list(JobStatus.QUEUED, 50)).extracting(Job::id)
                .containsExactly(c.id(), a.id());
        assertThat(store.list(JobStatus.RUNNING, 50)).extracting(Job::id)
                .containsExactly(b.id());
        assertThat(store.list(JobStatus.DONE, 50)).isEmpty();
        assertThat(store.list(null, 2)).hasSize(2);
    }

    @Test
    void listRejectsNonPositiveLimit() {
        assertThatIllegalArgumentException().isThrownBy(() -> store.list(null, 0));
    }

    @Test
    void countByStatusHasEveryStatus() {
        Job a = queued("a");
        queued("b");
        store.markRunning(a.id());

        Map<JobStatus, Long> counts = store.countByStatus();
        assertThat(counts).containsOnlyKeys(JobStatus.values());
        assertThat(counts.get(JobStatus.QUEUED)).isEqualTo(1L);
        assertThat(counts.get(JobStatus.RUNNING)).isEqualTo(1L);
        assertThat(counts.get(JobStatus.DONE)).isZero();
        assertThat(counts.get(JobStatus.ERROR)).isZero();
    }

    // --- Transitions ---

    @Test
    void happyPathSetsTimestampsAndResult() {
        Job job = queued("a");
        clock.advance(Duration.ofSeconds(5));
        Job running = store.markRunning(job.id());
        assertThat(running.status()).isEqualTo(JobStatus.RUNNING);
        assertThat(running.startedAt()).isEqualTo(T0.plusSeconds(5));

        clock.advance(Duration.ofSeconds(30));
        Job done = store.markDone(job.id(), "/out/td_output/" + job.id() + "_00001.mp4");
        assertThat(done.status()).isEqualTo(JobStatus.DONE);
        assertThat(done.resultPath()).endsWith("_00001.mp4");
        assertThat(done.errorMessage()).isNull();
        assertThat(done.completedAt()).isEqualTo(T0.plusSeconds(35));
        assertThat(done.processingTime()).contains(Duration.ofSeconds(30));
        assertThat(store.get(job.id())).isEqualTo(done);
    }

    @Test
    void errorRecordsMessage() {
        Job job = queued("a");
        store.markRunning(job.id());
        Job failed = store.markError(job.id(), "BackendTimeout: too slow");

        assertThat(failed.status()).isEqualTo(JobStatus.ERROR);
        assertThat(failed.errorMessage()).isEqualTo("BackendTimeout: too slow");
        assertThat(failed.resultPath()).isNull();
        assertThat(failed.completedAt()).isNotNull();
    }

    @Test
    void blankErrorMessageIsReplaced() {
        Job job = queued("a");
        store.markRunning(job.id());
        assertThat(store.markError(job.id(), " ").errorMessage()).isEqualTo("Unknown error");
    }

    @Test
    void completedAtNeverPrecedesStartedAt() {
        Job job = queued("a");
        clock.advance(Duration.ofSeconds(10));
        store.markRunning(job.id());
        clock.set(T0);
        Job done = store.markDone(job.id(), "/out/x.mp4");

        assertThat(done.completedAt()).isEqualTo(done.startedAt());
        assertThat(done.processingTime()).contains(Duration.ZERO);
    }

    @Test
    void doneRequiresResultPath() {
        Job job = queued("a");
        store.markRunning(job.id());
        assertThatIllegalArgumentException().isThrownBy(() -> store.markDone(job.id(), ""));
        assertThat(store.get(job.id()).status()).isEqualTo(JobStatus.RUNNING);
    }

    @Test
    void completeWithoutStartIsRejected() {
        Job job = queued("a");
        assertThatThrownBy(() -> store.markDone(job.id(), "/out/x.mp4"))
                .isInstanceOf(InvalidTransitionException.class)
                .hasMessageContaining("queued")
                .hasMessageContaining("done");
        assertThat(store.get(job.id())).isEqualTo(job);
    }

    @Test
    void duplicateReportsAreRejectedAndLeaveRecordUnchanged() {
        Job job = queued("a");
        store.markRunning(job.id());
        Job done = store.markDone(job.id(), "/out/x.mp4");

        assertThatThrownBy(() -> store.markRunning(job.id()))
                .isInstanceOf(InvalidTransitionException.class);
        assertThatThrownBy(() -> store.markError(job.id(), "late"))
                .isInstanceOf(InvalidTransitionException.class);
        assertThatThrownBy(() -> store.markDone(job.id(), "/out/y.mp4"))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(store.get(job.id())).isEqualTo(done);
    }

    @Test
    void transitionOnDeletedJobThrowsNotFound() {
        Job job = queued("a");
        store.markRunning(job.id());
        Job removed = store.delete(job.id());

        assertThat(removed.status()).isEqualTo(JobStatus.RUNNING);
        assertThatThrownBy(() -> store.markDone(job.id(), "/out/x.mp4"))
                .isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> store.delete(job.id()))
                .isInstanceOf(JobNotFoundException.class);
    }

    // --- Dispatch ---

    @Test
    void nextQueuedIsOldestAndDoesNotReserve() {
        Job older = queued("older");
        clock.advance(Duration.ofMillis(1));
        queued("newer");

        assertThat(store.nextQueued()).map(Job::id).contains(older.id());
        assertThat(store.nextQueued()).map(Job::id).contains(older.id());
        assertThat(store.get(older.id()).status()).isEqualTo(JobStatus.QUEUED);
    }

    @Test
    void nextQueuedSkipsNonQueuedJobs() {
        Job older = queued("older");
        clock.advance(Duration.ofMillis(1));
        Job newer = queued("newer");
        store.markRunning(older.id());

        assertThat(store.nextQueued()).map(Job::id).contains(newer.id());
        store.markRunning(newer.id());
        assertThat(store.nextQueued()).isEmpty();
    }

    @Test
    void claimNextHandsEachJobOutOnce() throws Exception {
        for (int i = 0; i < 50; i++) {
            queued("p" + i);
            clock.advance(Duration.ofMillis(1));
        }

        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<List<String>>> results = new ArrayList<>();
        for (int w = 0; w < 4; w++) {
            results.add(pool.submit(() -> {
                go.await();
                List<String> claimed = new ArrayList<>();
                while (true) {
                    Optional<Job> next = store.claimNext();
                    if (next.isEmpty()) {
                        return claimed;
                    }
                    assertThat(next.get().status()).isEqualTo(JobStatus.RUNNING);
                    claimed.add(next.get().id());
                }
            }));
        }
        go.countDown();

        List<String> all = new ArrayList<>();
        for (Future<List<String>> f : results) {
            all.addAll(f.get(10, TimeUnit.SECONDS));
        }
        pool.shutdown();

        assertThat(all).hasSize(50).doesNotHaveDuplicates();
        assertThat(store.countByStatus().get(JobStatus.RUNNING)).isEqualTo(50L);
    }

    // --- Sweep ---

    @Test
    void sweepRemovesOldJobsWhateverTheirStatus() {
        Job oldQueued = queued("old-queued");
        Job oldRunning = queued("old-running");
        store.markRunning(oldRunning.id());
        clock.advance(Duration.ofMinutes(90));
        Job fresh = queued("fresh");

        List<Job> removed = store.sweep(Duration.ofHours(1));

        assertThat(removed).extracting(Job::id)
                .containsExactlyInAnyOrder(oldQueued.id(), oldRunning.id());
        assertThat(store.find(fresh.id())).isPresent();
        assertThat(store.size()).isEqualTo(1);
    }
}

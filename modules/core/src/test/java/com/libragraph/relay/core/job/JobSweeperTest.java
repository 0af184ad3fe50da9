package com.libragraph.relay.core.job;

import com.libragraph.relay.core.storage.ArtifactStorage;
import com.libragraph.relay.core.storage.StorageFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class JobSweeperTest {

    @TempDir
    Path root;

    private MutableClock clock;
    private JobStore store;
    private ArtifactStorage storage;
    private JobSweeper sweeper;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T12:00:00Z"));
        store = new JobStore();
        store.clock = clock;

        storage = StorageFixtures.rootedAt(root);

        sweeper = new JobSweeper();
        sweeper.jobStore = store;
        sweeper.artifactStorage = storage;
        sweeper.maxAge = Duration.ofHours(1);
    }

    private Job jobWithUpload() {
        String id = store.reserveId();
        Path input = storage.saveUpload(id, "x.png", new ByteArrayInputStream(new byte[]{1}));
        return store.create(id, input.toString(), "p", null, null);
    }

    @Test
    void expiredJobsLoseRecordAndFiles() throws Exception {
        Job old = jobWithUpload();
        store.markRunning(old.id());
        Path result = Files.writeString(root.resolve(old.id() + "_00001.mp4"), "video");
        store.markDone(old.id(), result.toString());

        clock.advance(Duration.ofMinutes(61));
        Job fresh = jobWithUpload();

        assertThat(sweeper.sweep(Duration.ofHours(1))).isEqualTo(1);

        assertThat(store.find(old.id())).isEmpty();
        assertThat(Path.of(old.inputPath())).doesNotExist();
        assertThat(result).doesNotExist();
        assertThat(store.find(fresh.id())).isPresent();
        assertThat(Path.of(fresh.inputPath())).exists();
    }

    @Test
    void scheduledSweepUsesConfiguredAge() {
        jobWithUpload();
        clock.advance(Duration.ofMinutes(30));
        sweeper.sweep();
        assertThat(store.size()).isEqualTo(1);

        clock.advance(Duration.ofMinutes(31));
        sweeper.sweep();
        assertThat(store.size()).isZero();
    }

    @Test
    void undeletableFileDoesNotStopSweep() throws Exception {
        Path busy = root.resolve("busy");
        Files.createDirectories(busy.resolve("child"));
        String id = store.reserveId();
        store.create(id, busy.toString(), "p", null, null);
        jobWithUpload();

        clock.advance(Duration.ofHours(2));

        assertThat(sweeper.sweep(Duration.ofHours(1))).isEqualTo(2);
        assertThat(store.size()).isZero();
    }
}

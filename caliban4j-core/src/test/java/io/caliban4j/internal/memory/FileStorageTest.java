package io.caliban4j.internal.memory;

import io.caliban4j.Transaction;
import io.caliban4j.core.CollectionKey;
import io.caliban4j.core.Experiment;
import io.caliban4j.core.Job;
import io.caliban4j.core.JobStatus;
import io.caliban4j.core.Platform;
import io.caliban4j.core.QueryOp;
import io.caliban4j.core.Run;
import io.caliban4j.internal.EntityCodec;
import io.caliban4j.internal.TickingClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileStorageTest {

    @TempDir
    Path dir;

    private final EntityCodec codec = new EntityCodec();
    private final TickingClock clock = new TickingClock();

    @Test
    void committedHistoryShouldSurviveReopen() throws IOException {
        Path file = dir.resolve("history/history.json");
        Run run;
        Experiment experiment;
        try (FileStorage storage = new FileStorage(file, codec, clock)) {
            experiment = storage.createExperiment("sweep", "trainer:1", "train.py",
                    List.of(Map.of("lr", 0.1)), List.of("--quiet"), "alice");
            Job job = storage.jobs(experiment).get(0);
            run = storage.addRun(job, Platform.GKE, JobStatus.SUBMITTED, null, Map.of("job", Map.of()));
            storage.updateRun(run.withStatus(JobStatus.SUCCEEDED));
        }
        assertTrue(Files.exists(file));

        try (FileStorage reopened = new FileStorage(file, codec, clock)) {
            assertEquals(experiment, reopened.find(CollectionKey.EXPERIMENTS, experiment.id()).orElseThrow());
            Run loaded = reopened.find(CollectionKey.RUNS, run.id()).orElseThrow();
            assertEquals(JobStatus.SUCCEEDED, loaded.status());
            assertEquals(run.timestamp(), loaded.timestamp());
            assertEquals(1, reopened.collection(CollectionKey.JOBS).orElseThrow()
                    .where("kwargs.lr", QueryOp.LE, 0.1).execute().count());

            Experiment same = reopened.createExperiment("sweep", "trainer:1", "train.py",
                    List.of(Map.of("lr", 0.1)), List.of("--quiet"), "alice");
            assertEquals(experiment.id(), same.id());
            assertEquals(1, reopened.jobs(same).size());
        }
    }

    @Test
    void rolledBackWritesShouldNotReachTheFile() throws IOException {
        Path file = dir.resolve("history.json");
        try (FileStorage storage = new FileStorage(file, codec, clock)) {
            storage.getOrCreateGroup("kept", "alice");
            try (Transaction tx = storage.begin()) {
                storage.getOrCreateGroup("discarded", "alice");
                tx.rollback();
            }
        }

        try (FileStorage reopened = new FileStorage(file, codec, clock)) {
            assertTrue(reopened.findGroup("kept", "alice").isPresent());
            assertFalse(reopened.findGroup("discarded", "alice").isPresent());
        }
    }

    @Test
    void missingFileShouldStartEmpty() throws IOException {
        try (FileStorage storage = new FileStorage(dir.resolve("a/b/history.json"), codec, clock)) {
            assertTrue(storage.recentJobs("alice", 10).isEmpty());
            assertTrue(Files.isDirectory(dir.resolve("a/b")));
        }
    }

    @Test
    void urlShouldResolveHomeDirectory() {
        Path home = Path.of(System.getProperty("user.home"));

        assertEquals(home.resolve(".caliban4j/history.json"),
                FileStorageProvider.toPath(FileStorageProvider.DEFAULT_URL));
        assertEquals(Path.of("/tmp/h.json"), FileStorageProvider.toPath("file:///tmp/h.json"));
        assertEquals(Path.of("/tmp/h.json"), FileStorageProvider.toPath("file:/tmp/h.json"));
    }

    @Test
    void providerShouldReportUnopenableFile() throws IOException {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "{not json");

        FileStorageProvider provider = new FileStorageProvider(codec, clock);
        assertTrue(provider.supports("file:" + file));
        assertFalse(provider.connect("file:" + file).isOk());
    }
}

package io.caliban4j.internal.nulls;

import io.caliban4j.Transaction;
import io.caliban4j.core.CollectionKey;
import io.caliban4j.core.ContainerSpec;
import io.caliban4j.core.Experiment;
import io.caliban4j.core.ExperimentGroup;
import io.caliban4j.core.Job;
import io.caliban4j.core.JobStatus;
import io.caliban4j.core.Platform;
import io.caliban4j.core.Run;
import io.caliban4j.internal.TickingClock;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NullStorageTest {

    private final NullStorage storage = new NullStorage(new TickingClock());

    @Test
    void entitiesShouldHangOffTheirParents() {
        Experiment experiment = storage.createExperiment("sweep", "trainer:1", null,
                List.of(Map.of("a", 1), Map.of("a", 2)), List.of(), "alice");
        ExperimentGroup group = storage.findGroup("sweep", "alice").orElseThrow();

        assertEquals(List.of(experiment), storage.experiments(group));
        List<Job> jobs = storage.jobs(experiment);
        assertEquals(2, jobs.size());

        Run run = storage.addRun(jobs.get(0), Platform.TEST, JobStatus.SUBMITTED, null, Map.of());
        storage.updateRun(run.withStatus(JobStatus.RUNNING));
        assertEquals(JobStatus.RUNNING, storage.latestRun(jobs.get(0)).orElseThrow().status());
        assertEquals(jobs.get(1).id(), storage.recentJobs("alice", 1).get(0).id());
        assertEquals(JobStatus.RUNNING, storage.find(CollectionKey.RUNS, run.id()).orElseThrow().status());
    }

    @Test
    void getOrCreateShouldReuseEntities() {
        ContainerSpec spec = storage.getOrCreateContainerSpec(Map.of("image_id", "trainer:1"), "alice");
        assertSame(spec, storage.getOrCreateContainerSpec(Map.of("image_id", "trainer:1"), "alice"));

        ExperimentGroup group = storage.getOrCreateGroup("g", "alice");
        List<Experiment> first = storage.createExperiments(group, spec, null, List.of(),
                List.of(Map.of("a", List.of(1, 2))), "alice");
        List<Experiment> second = storage.createExperiments(group, spec, null, List.of(),
                List.of(Map.of("a", List.of(1, 2))), "alice");
        assertEquals(first, second);
        assertEquals(2, storage.experiments(group).size());
    }

    @Test
    void collectionsShouldBeUnavailable() {
        assertFalse(storage.collection("jobs").isPresent());
        assertFalse(storage.collection(CollectionKey.RUNS).isPresent());
    }

    @Test
    void transactionsShouldTrackActivity() {
        Transaction tx = storage.begin();
        assertTrue(tx.isActive());
        assertThrows(IllegalStateException.class, storage::begin);
        tx.rollback();
        assertFalse(tx.isActive());
        storage.begin().commit();
    }
}

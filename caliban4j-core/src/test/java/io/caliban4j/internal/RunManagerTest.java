package io.caliban4j.internal;

import io.caliban4j.ComputePlatform;
import io.caliban4j.SubmissionCallback;
import io.caliban4j.core.BatchResult;
import io.caliban4j.core.CollectionKey;
import io.caliban4j.core.ContainerSpec;
import io.caliban4j.core.Experiment;
import io.caliban4j.core.ExperimentGroup;
import io.caliban4j.core.Job;
import io.caliban4j.core.JobSpec;
import io.caliban4j.core.JobStatus;
import io.caliban4j.core.Platform;
import io.caliban4j.core.PlatformRegistry;
import io.caliban4j.core.Run;
import io.caliban4j.core.Submission;
import io.caliban4j.internal.compute.NullCompute;
import io.caliban4j.internal.memory.MemoryStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RunManagerTest {

    private MemoryStorage storage;
    private Experiment experiment;
    private final NullCompute compute = new NullCompute();
    private RunManager runManager;

    @BeforeEach
    void setUp() {
        storage = new MemoryStorage(new EntityCodec(), new TickingClock());
        ExperimentGroup group = storage.getOrCreateGroup("g", "alice");
        ContainerSpec spec = storage.getOrCreateContainerSpec(Map.of("image_id", "trainer:1"), "alice");
        experiment = storage.getOrCreateExperiment(group, spec, null, List.of("--x"), Map.of("a", 1), "alice");
        runManager = new RunManager(storage, new PlatformRegistry(List.of(compute)));
    }

    @Test
    void submitShouldRecordRunAndJobSpec() {
        Job job = storage.createJob(experiment, Map.of());

        Run run = runManager.submit(job, compute);

        assertEquals(JobStatus.SUBMITTED, run.status());
        assertEquals(Platform.TEST, run.platform());
        JobSpec spec = storage.find(CollectionKey.JOB_SPECS, run.jobSpec()).orElseThrow();
        assertEquals(Map.of("args", List.of("--x"), "kwargs", Map.of("a", 1)), spec.spec());
        assertEquals(List.of(run), storage.runs(job));
    }

    @Test
    void failingSubmissionShouldBecomeFailedRunWithoutStoppingBatch() throws Exception {
        Job ok = storage.createJob(experiment, Map.of("i", 0));
        Job broken = storage.createJob(experiment, Map.of("i", 1));
        Job declined = storage.createJob(experiment, Map.of("i", 2));

        ComputePlatform flaky = mock(ComputePlatform.class);
        when(flaky.name()).thenReturn("flaky");
        when(flaky.platform()).thenReturn(Platform.GKE);
        when(flaky.submit(eq(ok))).thenReturn(Optional.of(new Submission(Map.of("image", "trainer:1"),
                Map.of("job", Map.of("metadata", Map.of("name", "j0"))), null)));
        when(flaky.submit(eq(broken))).thenThrow(new IOException("quota exceeded"));
        when(flaky.submit(eq(declined))).thenReturn(Optional.empty());
        SubmissionCallback callback = mock(SubmissionCallback.class);

        BatchResult result = runManager.submitAll(List.of(ok, broken, declined), flaky, callback);

        assertEquals(3, result.total());
        assertEquals(1, result.submitted());
        assertEquals(2, result.failed());
        Run failed = storage.latestRun(broken).orElseThrow();
        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals("quota exceeded", failed.details().get(RunManager.ERROR));
        assertNull(failed.jobSpec());
        assertEquals(JobStatus.FAILED, storage.latestRun(declined).orElseThrow().status());
        verify(callback).submitted(eq(ok), any(Run.class));
        verify(callback).failed(eq(broken), any(Run.class), any(IOException.class));
        verify(callback).failed(eq(declined), any(Run.class), isNull());
    }

    @Test
    void cloneShouldAddRunAndLeaveOriginalUntouched() {
        Job job = storage.createJob(experiment, Map.of());
        Run original = runManager.submit(job, compute);
        storage.updateRun(original.withStatus(JobStatus.FAILED));

        Run clone = runManager.clone(original).orElseThrow();

        assertNotEquals(original.id(), clone.id());
        assertEquals(original.jobSpec(), clone.jobSpec());
        assertEquals(JobStatus.SUBMITTED, clone.status());
        assertEquals(JobStatus.FAILED, storage.find(CollectionKey.RUNS, original.id()).orElseThrow().status());
        assertEquals(2, storage.runs(job).size());
        assertEquals(clone.id(), storage.latestRun(job).orElseThrow().id());
    }

    @Test
    void cloneWithoutRegisteredComputeShouldBeEmpty() throws Exception {
        Job job = storage.createJob(experiment, Map.of());
        Run run = storage.addRun(job, Platform.CAIP, JobStatus.FAILED, null, Map.of());

        assertTrue(runManager.clone(run).isEmpty());
        assertEquals(1, storage.runs(job).size());
    }

    @Test
    void replayedSpecShouldBeSubmittedAsIs() throws Exception {
        Job job = storage.createJob(experiment, Map.of());
        JobSpec spec = storage.getOrCreateJobSpec(experiment, Platform.GKE, Map.of("image", "trainer:2"));
        ComputePlatform gke = mock(ComputePlatform.class);
        when(gke.platform()).thenReturn(Platform.GKE);
        when(gke.submit(any(Job.class), any(JobSpec.class)))
                .thenAnswer(inv -> Optional.of(new Submission(inv.<JobSpec>getArgument(1).spec(), Map.of(), null)));

        BatchResult result = runManager.submitPlanned(List.of(new RunManager.PlannedJob(job, spec)), gke, null);

        assertEquals(spec.id(), result.runs().get(0).jobSpec());
        verify(gke, times(1)).submit(job, spec);
    }
}

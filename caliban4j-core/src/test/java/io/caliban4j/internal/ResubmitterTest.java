package io.caliban4j.internal;

import io.caliban4j.ComputePlatform;
import io.caliban4j.ImageBuilder;
import io.caliban4j.RunStatusProvider;
import io.caliban4j.core.CollectionKey;
import io.caliban4j.core.ContainerSpec;
import io.caliban4j.core.Experiment;
import io.caliban4j.core.ExperimentGroup;
import io.caliban4j.core.Job;
import io.caliban4j.core.JobSpec;
import io.caliban4j.core.JobStatus;
import io.caliban4j.core.Platform;
import io.caliban4j.core.PlatformRegistry;
import io.caliban4j.core.ResubmitRequest;
import io.caliban4j.core.ResubmitResult;
import io.caliban4j.core.Run;
import io.caliban4j.internal.compute.NullCompute;
import io.caliban4j.internal.memory.MemoryStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResubmitterTest {

    private MemoryStorage storage;
    private ExperimentGroup group;
    private ContainerSpec containerSpec;
    private final NullCompute compute = new NullCompute();
    private ImageBuilder imageBuilder;

    @BeforeEach
    void setUp() throws Exception {
        storage = new MemoryStorage(new EntityCodec(), new TickingClock());
        group = storage.getOrCreateGroup("sweep", "alice");
        containerSpec = storage.getOrCreateContainerSpec(Map.of("image_id", "trainer:1"), "alice");
        imageBuilder = mock(ImageBuilder.class);
        when(imageBuilder.build(any())).thenReturn("trainer:2");
    }

    private Resubmitter resubmitter(List<ComputePlatform> computes, ImageBuilder builder) {
        PlatformRegistry registry = new PlatformRegistry(computes);
        StatusReconciler reconciler = new StatusReconciler(storage, List.<RunStatusProvider>of());
        return new Resubmitter(storage, reconciler, new RunManager(storage, registry), registry, builder);
    }

    private Run submitted(Experiment experiment, JobStatus finalStatus) {
        Job job = storage.jobs(experiment).get(0);
        Run run = new RunManager(storage, new PlatformRegistry(List.of(compute))).submit(job, compute);
        return storage.updateRun(run.withStatus(finalStatus));
    }

    @Test
    void failedJobsShouldBeResubmittedWithOneBuildPerContainerSpec() throws Exception {
        List<Experiment> experiments = storage.createExperiments(group, containerSpec, null, List.of(),
                List.of(Map.of("a", List.of(0, 1, 2))), "alice");
        submitted(experiments.get(0), JobStatus.FAILED);
        submitted(experiments.get(1), JobStatus.STOPPED);
        submitted(experiments.get(2), JobStatus.SUCCEEDED);

        ResubmitResult result = resubmitter(List.of(compute), imageBuilder)
                .resubmit(ResubmitRequest.builder("alice").xgroup("sweep").build());

        assertEquals(2, result.candidates());
        assertEquals(2, result.submitted());
        assertEquals(1, result.imagesBuilt());
        verify(imageBuilder, times(1)).build(any());

        Job retried = storage.jobs(experiments.get(0)).get(1);
        assertEquals(experiments.get(0).kwargs(), retried.kwargs());
        Run run = storage.latestRun(retried).orElseThrow();
        JobSpec spec = storage.find(CollectionKey.JOB_SPECS, run.jobSpec()).orElseThrow();
        assertEquals("trainer:2", spec.spec().get("image"));
        assertEquals(1, storage.jobs(experiments.get(2)).size());
    }

    @Test
    void secondResubmitShouldOnlyConsiderNewestJobs() {
        List<Experiment> experiments = storage.createExperiments(group, containerSpec, null, List.of(),
                List.of(Map.of("a", List.of(0))), "alice");
        submitted(experiments.get(0), JobStatus.FAILED);
        Resubmitter resubmitter = resubmitter(List.of(compute), null);

        assertEquals(1, resubmitter.resubmit(ResubmitRequest.builder("alice").xgroup("sweep").build()).submitted());
        // the replacement is SUBMITTED, so nothing qualifies any more
        assertEquals(0, resubmitter.resubmit(ResubmitRequest.builder("alice").xgroup("sweep").build()).candidates());
        assertEquals(2, storage.jobs(experiments.get(0)).size());
    }

    @Test
    void resubmitWithoutGroupShouldSkipSupersededJobs() {
        Experiment experiment = storage.createExperiment("single", "trainer:1", null,
                List.of(Map.of("a", 0)), List.of(), "alice");
        submitted(experiment, JobStatus.FAILED);
        Resubmitter resubmitter = resubmitter(List.of(compute), null);

        assertEquals(1, resubmitter.resubmit(ResubmitRequest.builder("alice").build()).submitted());
        Job replacement = storage.jobs(experiment).get(1);
        storage.updateRun(storage.latestRun(replacement).orElseThrow().withStatus(JobStatus.SUCCEEDED));

        ResubmitResult second = resubmitter.resubmit(ResubmitRequest.builder("alice").build());

        assertEquals(0, second.candidates());
        assertEquals(2, storage.jobs(experiment).size());
    }

    @Test
    void newestJobShouldWinWhenClockStandsStill() {
        storage = new MemoryStorage(new EntityCodec(), Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
        Experiment experiment = storage.createExperiment("frozen", "trainer:1", null,
                List.of(Map.of("a", 0)), List.of(), "alice");
        submitted(experiment, JobStatus.FAILED);
        Resubmitter resubmitter = resubmitter(List.of(compute), null);

        assertEquals(1, resubmitter.resubmit(ResubmitRequest.builder("alice").xgroup("frozen").build()).submitted());

        List<Job> jobs = storage.jobs(experiment);
        assertEquals(2, jobs.size());
        assertTrue(jobs.get(1).timestamp().isAfter(jobs.get(0).timestamp()));
        assertEquals(0, resubmitter.resubmit(ResubmitRequest.builder("alice").build()).candidates());
    }

    @Test
    void dryRunShouldKeepRecordedImage() throws Exception {
        List<Experiment> experiments = storage.createExperiments(group, containerSpec, null, List.of(),
                List.of(Map.of("a", List.of(0))), "alice");
        submitted(experiments.get(0), JobStatus.FAILED);

        ResubmitResult result = resubmitter(List.of(compute), imageBuilder)
                .resubmit(ResubmitRequest.builder("alice").dryRun(true).build());

        assertEquals(1, result.submitted());
        assertEquals(0, result.imagesBuilt());
        verify(imageBuilder, never()).build(any());
        Job retried = storage.recentJobs("alice", 1).get(0);
        JobSpec spec = storage.find(CollectionKey.JOB_SPECS, storage.latestRun(retried).orElseThrow().jobSpec())
                .orElseThrow();
        assertEquals("trainer:1", spec.spec().get("image"));
    }

    @Test
    void failingPlatformShouldNotAbortOthers() {
        List<Experiment> experiments = storage.createExperiments(group, containerSpec, null, List.of(),
                List.of(Map.of("a", List.of(0, 1))), "alice");
        submitted(experiments.get(0), JobStatus.FAILED);
        Job orphan = storage.jobs(experiments.get(1)).get(0);
        storage.addRun(orphan, Platform.GKE, JobStatus.FAILED, null, Map.of());

        ResubmitResult result = resubmitter(List.of(compute), null)
                .resubmit(ResubmitRequest.builder("alice").xgroup("sweep").build());

        assertEquals(2, result.candidates());
        assertEquals(1, result.failedPlatforms());
        assertEquals(1, result.submitted());
        assertTrue(result.byPlatform().containsKey(Platform.TEST));
    }

    @Test
    void allJobsShouldIncludeSucceededJobs() {
        List<Experiment> experiments = storage.createExperiments(group, containerSpec, null, List.of(),
                List.of(Map.of("a", List.of(0, 1))), "alice");
        submitted(experiments.get(0), JobStatus.SUCCEEDED);
        submitted(experiments.get(1), JobStatus.FAILED);

        ResubmitResult result = resubmitter(List.of(compute), null)
                .resubmit(ResubmitRequest.builder("alice").xgroup("sweep").allJobs(true).build());

        assertEquals(2, result.submitted());
    }

    @Test
    void unknownGroupShouldResubmitNothing() {
        ResubmitResult result = resubmitter(List.of(compute), imageBuilder)
                .resubmit(ResubmitRequest.builder("alice").xgroup("missing").build());

        assertEquals(0, result.candidates());
        assertTrue(result.byPlatform().isEmpty());
    }
}

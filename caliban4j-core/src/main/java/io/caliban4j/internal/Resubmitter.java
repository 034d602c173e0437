package io.caliban4j.internal;

import io.caliban4j.ComputePlatform;
import io.caliban4j.ImageBuilder;
import io.caliban4j.Storage;
import io.caliban4j.SubmissionCallback;
import io.caliban4j.Transaction;
import io.caliban4j.core.BatchResult;
import io.caliban4j.core.CollectionKey;
import io.caliban4j.core.ContainerSpec;
import io.caliban4j.core.Experiment;
import io.caliban4j.core.ExperimentGroup;
import io.caliban4j.core.Job;
import io.caliban4j.core.JobSpec;
import io.caliban4j.core.Platform;
import io.caliban4j.core.PlatformRegistry;
import io.caliban4j.core.ResubmitRequest;
import io.caliban4j.core.ResubmitResult;
import io.caliban4j.core.Run;
import io.caliban4j.utils.Fingerprints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Re-runs failed or stopped jobs with freshly built images.
 *
 * <p>Candidates are grouped by platform. Every distinct container spec is rebuilt once no
 * matter how many jobs use it, each job spec is rewritten to the new image, and a new job is
 * appended to the original experiment. A failing platform is logged and skipped; work already
 * done for other platforms is committed.
 */
public class Resubmitter {
    private static final Logger log = LoggerFactory.getLogger(Resubmitter.class);

    private final Storage storage;
    private final StatusReconciler reconciler;
    private final RunManager runManager;
    private final PlatformRegistry platforms;
    private final ImageBuilder imageBuilder;

    /**
     * @param imageBuilder nullable; without one every spec keeps its recorded image
     */
    public Resubmitter(Storage storage,
                       StatusReconciler reconciler,
                       RunManager runManager,
                       PlatformRegistry platforms,
                       ImageBuilder imageBuilder) {
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler must not be null");
        this.runManager = Objects.requireNonNull(runManager, "runManager must not be null");
        this.platforms = Objects.requireNonNull(platforms, "platforms must not be null");
        this.imageBuilder = imageBuilder;
    }

    private record Candidate(Job job, Run run) {
    }

    public ResubmitResult resubmit(ResubmitRequest request) {
        Objects.requireNonNull(request, "request must not be null");

        Map<Platform, List<Candidate>> byPlatform = new EnumMap<>(Platform.class);
        int candidates = 0;
        for (Job job : candidateJobs(request)) {
            Optional<Run> latest = storage.latestRun(job);
            if (latest.isEmpty()) {
                log.debug("skipping job={} with no runs", job.name());
                continue;
            }
            Run run = reconciler.refresh(latest.get()).orElse(latest.get());
            if (!request.allJobs() && !run.status().isResubmittable()) {
                continue;
            }
            byPlatform.computeIfAbsent(run.platform(), p -> new ArrayList<>()).add(new Candidate(job, run));
            candidates++;
        }

        if (candidates == 0) {
            log.info("no jobs to resubmit xgroup={} user={} allJobs={}", request.xgroup(), request.user(), request.allJobs());
            return new ResubmitResult(0, 0, Map.of(), 0);
        }

        Map<String, String> images = new HashMap<>();
        Map<Platform, BatchResult> results = new EnumMap<>(Platform.class);
        int failedPlatforms = 0;

        try (Transaction tx = storage.begin()) {
            for (Map.Entry<Platform, List<Candidate>> entry : byPlatform.entrySet()) {
                Platform platform = entry.getKey();
                try {
                    ComputePlatform compute = platforms.getRequired(platform);
                    List<RunManager.PlannedJob> planned = new ArrayList<>();
                    for (Candidate candidate : entry.getValue()) {
                        planned.add(plan(candidate, platform, images, request.dryRun()));
                    }
                    results.put(platform, runManager.submitPlanned(planned, compute, SubmissionCallback.NONE));
                } catch (Exception e) {
                    failedPlatforms++;
                    log.error("resubmission failed platform={} jobs={} msg={}",
                            platform, entry.getValue().size(), e.getMessage(), e);
                }
            }
            tx.commit();
        }

        ResubmitResult result = new ResubmitResult(candidates, imagesBuilt(images, request.dryRun()), results, failedPlatforms);
        log.info("resubmitted {} of {} jobs failed={} images={} failedPlatforms={}",
                result.submitted(), candidates, result.failed(), result.imagesBuilt(), failedPlatforms);
        return result;
    }

    /**
     * Only the newest job of each parameter point is a candidate. Older jobs have already been
     * superseded by a resubmission.
     */
    private List<Job> candidateJobs(ResubmitRequest request) {
        if (request.xgroup() == null) {
            return latestOnly(storage.recentJobs(request.user(), request.maxJobs()));
        }
        Optional<ExperimentGroup> group = storage.findGroup(request.xgroup(), request.user());
        if (group.isEmpty()) {
            log.warn("experiment group not found xgroup={} user={}", request.xgroup(), request.user());
            return List.of();
        }
        List<Job> jobs = new ArrayList<>();
        for (Experiment experiment : storage.experiments(group.get())) {
            jobs.addAll(newestPerPoint(storage.jobs(experiment)).values());
        }
        return jobs;
    }

    private List<Job> latestOnly(List<Job> recent) {
        Map<String, Set<String>> newestByExperiment = new HashMap<>();
        List<Job> jobs = new ArrayList<>();
        for (Job job : recent) {
            Set<String> newest = newestByExperiment.computeIfAbsent(job.experiment(), id ->
                    storage.find(CollectionKey.EXPERIMENTS, id)
                            .map(experiment -> newestPerPoint(storage.jobs(experiment)).values().stream()
                                    .map(Job::id)
                                    .collect(Collectors.toSet()))
                            .orElse(Set.of()));
            if (newest.contains(job.id())) {
                jobs.add(job);
            } else {
                log.debug("skipping superseded job={}", job.name());
            }
        }
        return jobs;
    }

    // jobs come back oldest first
    private static Map<String, Job> newestPerPoint(List<Job> jobs) {
        Map<String, Job> newest = new LinkedHashMap<>();
        for (Job job : jobs) {
            newest.put(Fingerprints.canonicalJson(job.kwargs()), job);
        }
        return newest;
    }

    private RunManager.PlannedJob plan(Candidate candidate, Platform platform, Map<String, String> images,
                                       boolean dryRun) throws Exception {
        Job job = candidate.job();
        Experiment experiment = storage.find(CollectionKey.EXPERIMENTS, job.experiment())
                .orElseThrow(() -> new IllegalStateException("experiment not found for job " + job.id()));

        JobSpec spec = null;
        Optional<JobSpec> previous = candidate.run().jobSpec() == null
                ? Optional.empty()
                : storage.find(CollectionKey.JOB_SPECS, candidate.run().jobSpec());
        if (previous.isPresent()) {
            String image = imageFor(experiment, images, dryRun);
            spec = storage.getOrCreateJobSpec(experiment, platform,
                    ImageRewriter.replaceImage(platform, previous.get().spec(), image));
        }

        Job replacement = storage.createJob(experiment, job.kwargs());
        return new RunManager.PlannedJob(replacement, spec);
    }

    private String imageFor(Experiment experiment, Map<String, String> images, boolean dryRun) throws Exception {
        String cached = images.get(experiment.containerSpec());
        if (cached != null) {
            return cached;
        }
        ContainerSpec containerSpec = storage.find(CollectionKey.CONTAINER_SPECS, experiment.containerSpec())
                .orElseThrow(() -> new IllegalStateException("container spec not found: " + experiment.containerSpec()));

        String image;
        if (dryRun || imageBuilder == null) {
            image = containerSpec.imageId() != null ? containerSpec.imageId() : experiment.container();
        } else {
            image = imageBuilder.build(containerSpec);
            log.info("rebuilt image containerSpec={} image={}", containerSpec.id(), image);
        }
        if (image == null) {
            throw new IllegalStateException("no image for container spec " + containerSpec.id());
        }
        images.put(experiment.containerSpec(), image);
        return image;
    }

    private int imagesBuilt(Map<String, String> images, boolean dryRun) {
        return dryRun || imageBuilder == null ? 0 : images.size();
    }
}

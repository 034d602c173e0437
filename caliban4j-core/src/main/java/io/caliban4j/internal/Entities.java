package io.caliban4j.internal;

import io.caliban4j.core.ContainerSpec;
import io.caliban4j.core.Experiment;
import io.caliban4j.core.ExperimentGroup;
import io.caliban4j.core.Job;
import io.caliban4j.core.JobSpec;
import io.caliban4j.core.Platform;
import io.caliban4j.core.PlatformJobStatus;
import io.caliban4j.core.Run;
import io.caliban4j.utils.Fingerprints;
import io.caliban4j.utils.Ids;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Construction rules shared by every storage backend: ids, dedup keys, names.
 */
public final class Entities {

    private static final DateTimeFormatter GROUP_NAME_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd-HH-mm-ss").withZone(ZoneOffset.UTC);

    private Entities() {
    }

    public static String defaultGroupName(String user, Instant now) {
        return user + "-xgroup-" + GROUP_NAME_TIME.format(now);
    }

    public static String containerSpecKey(String user, Map<String, Object> spec) {
        return Fingerprints.of(user, spec);
    }

    public static String experimentKey(ExperimentGroup group, ContainerSpec containerSpec,
                                       List<String> args, Map<String, Object> kwargs) {
        return Fingerprints.of(group.id(), containerSpec.id(), args, kwargs);
    }

    public static String jobSpecKey(Experiment experiment, Platform platform, Map<String, Object> spec) {
        return Fingerprints.of(experiment.id(), platform.name(), spec);
    }

    public static ExperimentGroup newGroup(String name, String user, Instant now) {
        return new ExperimentGroup(Ids.newId(), name, user, now);
    }

    public static ContainerSpec newContainerSpec(Map<String, Object> spec, String user, Instant now) {
        return new ContainerSpec(Ids.newId(), containerSpecKey(user, spec), user, spec, now);
    }

    public static Experiment newExperiment(ExperimentGroup group, ContainerSpec containerSpec, String command,
                                           List<String> args, Map<String, Object> kwargs, String user, Instant now) {
        return new Experiment(Ids.newId(), experimentKey(group, containerSpec, args, kwargs), group.name(),
                group.id(), containerSpec.id(), containerSpec.imageId(), command, args, kwargs, user, now);
    }

    public static JobSpec newJobSpec(Experiment experiment, Platform platform, Map<String, Object> spec, Instant now) {
        return new JobSpec(Ids.newId(), jobSpecKey(experiment, platform, spec), experiment.id(), platform, spec, now);
    }

    /**
     * A job named {@code <experiment>-<index>} whose kwargs are the experiment's overlaid with
     * {@code kwargs}.
     */
    public static Job newJob(Experiment experiment, Map<String, Object> kwargs, int index, Instant now) {
        Map<String, Object> merged = new LinkedHashMap<>(experiment.kwargs());
        if (kwargs != null) {
            merged.putAll(kwargs);
        }
        return new Job(Ids.newId(), experiment.name() + "-" + index, experiment.id(), experiment.user(),
                now, experiment.args(), merged);
    }

    public static Run newRun(Job job, Platform platform, PlatformJobStatus status, JobSpec jobSpec,
                             Map<String, Object> details, Instant now) {
        Objects.requireNonNull(status, "status must not be null");
        return new Run(Ids.newId(), job.id(), jobSpec == null ? null : jobSpec.id(), job.user(), platform, now,
                status.canonical(), Run.nativeName(status), details);
    }

    /**
     * Key-order and integer-width insensitive kwargs equality.
     */
    public static boolean sameKwargs(Map<String, Object> a, Map<String, Object> b) {
        return Fingerprints.canonicalJson(a).equals(Fingerprints.canonicalJson(b));
    }
}

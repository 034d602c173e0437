package io.caliban4j.internal.compute;

import io.caliban4j.ComputePlatform;
import io.caliban4j.core.Job;
import io.caliban4j.core.JobSpec;
import io.caliban4j.core.Platform;
import io.caliban4j.core.Submission;
import io.caliban4j.core.TestJobStatus;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Accepts every job without running anything. Backs the TEST platform.
 */
public class NullCompute implements ComputePlatform {

    @Override
    public String name() {
        return "null";
    }

    @Override
    public Platform platform() {
        return Platform.TEST;
    }

    @Override
    public Optional<Submission> submit(Job job) {
        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("args", job.args());
        spec.put("kwargs", job.kwargs());
        return Optional.of(new Submission(spec, Map.of(), TestJobStatus.SUBMITTED));
    }

    @Override
    public Optional<Submission> submit(Job job, JobSpec spec) {
        return Optional.of(new Submission(spec.spec(), Map.of(), TestJobStatus.SUBMITTED));
    }
}

package io.caliban4j.internal.compute;

import io.caliban4j.RunStatusProvider;
import io.caliban4j.core.CaipJobStatus;
import io.caliban4j.core.ConnectError;
import io.caliban4j.core.Platform;
import io.caliban4j.core.PlatformJobStatus;
import io.caliban4j.core.Result;
import io.caliban4j.core.Run;

import java.util.Objects;

/**
 * Polls and cancels Cloud AI Platform training jobs named by the run's
 * {@code project_id} and {@code job_id} details.
 */
public class CaipStatusProvider implements RunStatusProvider {

    public static final String PROJECT_ID = "project_id";
    public static final String JOB_ID = "job_id";

    private final CaipJobApi api;

    public CaipStatusProvider(CaipJobApi api) {
        this.api = Objects.requireNonNull(api, "api must not be null");
    }

    @Override
    public Platform platform() {
        return Platform.CAIP;
    }

    @Override
    public Result<PlatformJobStatus> poll(Run run) {
        return jobRef(run).flatMap(ref -> api.getState(ref[0], ref[1]).<PlatformJobStatus>map(CaipJobStatus::parse));
    }

    @Override
    public Result<Boolean> stop(Run run) {
        return jobRef(run).flatMap(ref -> api.cancel(ref[0], ref[1]));
    }

    private static Result<String[]> jobRef(Run run) {
        Object project = run.details().get(PROJECT_ID);
        Object job = run.details().get(JOB_ID);
        if (project == null || job == null) {
            return Result.err(ConnectError.permanent("run " + run.id() + " has no CAIP job reference"));
        }
        return Result.ok(new String[]{project.toString(), job.toString()});
    }
}

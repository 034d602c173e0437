package io.caliban4j.internal.compute;

import io.caliban4j.RunStatusProvider;
import io.caliban4j.core.ConnectError;
import io.caliban4j.core.GkeJobStatus;
import io.caliban4j.core.Platform;
import io.caliban4j.core.PlatformJobStatus;
import io.caliban4j.core.Result;
import io.caliban4j.core.Run;

import java.util.Map;
import java.util.Objects;

/**
 * Polls and deletes Kubernetes Jobs for GKE runs.
 *
 * <p>Run details carry the cluster ({@code project_id}, {@code cluster_zone},
 * {@code cluster_name}) and the submitted job resource under {@code job}. A job that no
 * longer exists is reported as UNAVAILABLE.
 */
public class GkeStatusProvider implements RunStatusProvider {

    public static final String JOB = "job";

    private final GkeJobApi api;

    public GkeStatusProvider(GkeJobApi api) {
        this.api = Objects.requireNonNull(api, "api must not be null");
    }

    @Override
    public Platform platform() {
        return Platform.GKE;
    }

    @Override
    public Result<PlatformJobStatus> poll(Run run) {
        return jobRef(run).flatMap(ref -> api.getJob(ref.cluster(), ref.namespace(), ref.name())
                .<PlatformJobStatus>map(info -> info.isPresent() ? GkeJobStatus.fromJobInfo(info.get()) : GkeJobStatus.UNAVAILABLE));
    }

    @Override
    public Result<Boolean> stop(Run run) {
        return jobRef(run).flatMap(ref -> api.deleteJob(ref.cluster(), ref.namespace(), ref.name()));
    }

    private static Result<JobRef> jobRef(Run run) {
        GkeClusterRef cluster = GkeClusterRef.fromDetails(run.details()).orElse(null);
        Object job = run.details().get(JOB);
        Object metadata = job instanceof Map<?, ?> m ? m.get("metadata") : null;
        Object name = metadata instanceof Map<?, ?> m ? m.get("name") : null;
        Object namespace = metadata instanceof Map<?, ?> m ? m.get("namespace") : null;
        if (cluster == null || name == null) {
            return Result.err(ConnectError.permanent("run " + run.id() + " has no GKE job reference"));
        }
        return Result.ok(new JobRef(cluster, namespace == null ? null : namespace.toString(), name.toString()));
    }

    private record JobRef(GkeClusterRef cluster, String namespace, String name) {
    }
}

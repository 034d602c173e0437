package io.caliban4j.internal.compute;

import io.caliban4j.core.GkeJobInfo;
import io.caliban4j.core.Result;

import java.util.Optional;

/**
 * Kubernetes batch Job resources on a GKE cluster.
 */
public interface GkeJobApi {

    /**
     * Empty when the job does not exist.
     */
    Result<Optional<GkeJobInfo>> getJob(GkeClusterRef cluster, String namespace, String name);

    Result<Boolean> deleteJob(GkeClusterRef cluster, String namespace, String name);
}

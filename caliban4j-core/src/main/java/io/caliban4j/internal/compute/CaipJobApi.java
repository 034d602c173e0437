package io.caliban4j.internal.compute;

import io.caliban4j.core.Result;

/**
 * Training job endpoints of Cloud AI Platform.
 */
public interface CaipJobApi {

    /**
     * Raw state string of {@code projects/{projectId}/jobs/{jobId}}.
     */
    Result<String> getState(String projectId, String jobId);

    Result<Boolean> cancel(String projectId, String jobId);
}

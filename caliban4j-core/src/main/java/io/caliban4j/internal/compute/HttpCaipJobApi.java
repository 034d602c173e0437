package io.caliban4j.internal.compute;

import com.fasterxml.jackson.databind.JsonNode;
import io.caliban4j.core.ConnectError;
import io.caliban4j.core.Result;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

public class HttpCaipJobApi implements CaipJobApi {

    public static final URI DEFAULT_BASE_URI = URI.create("https://ml.googleapis.com/v1/");

    private final JsonHttpClient client;
    private final URI baseUri;

    public HttpCaipJobApi(JsonHttpClient client) {
        this(client, DEFAULT_BASE_URI);
    }

    public HttpCaipJobApi(JsonHttpClient client, URI baseUri) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        String base = Objects.requireNonNull(baseUri, "baseUri must not be null").toString();
        this.baseUri = URI.create(base.endsWith("/") ? base : base + "/");
    }

    @Override
    public Result<String> getState(String projectId, String jobId) {
        return client.get(jobUri(projectId, jobId, "")).flatMap(node -> {
            if (node.isMissingNode()) {
                return Result.err(ConnectError.permanent("CAIP job not found: " + jobName(projectId, jobId)));
            }
            JsonNode state = node.path("state");
            return Result.ok(state.isTextual() ? state.asText() : null);
        });
    }

    /**
     * Success is an empty response body.
     */
    @Override
    public Result<Boolean> cancel(String projectId, String jobId) {
        return client.post(jobUri(projectId, jobId, ":cancel"), Map.of())
                .map(node -> !node.isMissingNode() && node.isEmpty());
    }

    static String jobName(String projectId, String jobId) {
        return "projects/" + projectId + "/jobs/" + jobId;
    }

    private URI jobUri(String projectId, String jobId, String suffix) {
        Objects.requireNonNull(projectId, "projectId must not be null");
        Objects.requireNonNull(jobId, "jobId must not be null");
        return baseUri.resolve(jobName(projectId, jobId) + suffix);
    }
}

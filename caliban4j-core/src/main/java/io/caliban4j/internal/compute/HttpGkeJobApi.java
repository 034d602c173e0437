package io.caliban4j.internal.compute;

import com.fasterxml.jackson.databind.JsonNode;
import io.caliban4j.core.ConnectError;
import io.caliban4j.core.GkeJobInfo;
import io.caliban4j.core.Result;

import java.net.URI;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Reads batch/v1 Jobs from the cluster's API server. Resolving a cluster to its endpoint is
 * left to the caller.
 */
public class HttpGkeJobApi implements GkeJobApi {

    private final JsonHttpClient client;
    private final Function<GkeClusterRef, URI> endpoints;

    public HttpGkeJobApi(JsonHttpClient client, Function<GkeClusterRef, URI> endpoints) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints must not be null");
    }

    @Override
    public Result<Optional<GkeJobInfo>> getJob(GkeClusterRef cluster, String namespace, String name) {
        return client.get(jobUri(cluster, namespace, name)).flatMap(node -> {
            if (node.isMissingNode()) {
                return Result.ok(Optional.empty());
            }
            JsonNode status = node.path("status");
            try {
                return Result.ok(Optional.of(new GkeJobInfo(
                        intOrZero(status.path("active")),
                        intOrZero(status.path("succeeded")),
                        instantOrNull(status.path("completionTime")))));
            } catch (DateTimeParseException e) {
                return Result.err(ConnectError.permanent("invalid completionTime for job " + name, e));
            }
        });
    }

    /**
     * Deletes the job and its pods. A job that is already gone counts as deleted.
     */
    @Override
    public Result<Boolean> deleteJob(GkeClusterRef cluster, String namespace, String name) {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("kind", "DeleteOptions");
        options.put("apiVersion", "v1");
        options.put("propagationPolicy", "Foreground");
        return client.delete(jobUri(cluster, namespace, name), options).map(node -> true);
    }

    private URI jobUri(GkeClusterRef cluster, String namespace, String name) {
        Objects.requireNonNull(cluster, "cluster must not be null");
        Objects.requireNonNull(name, "name must not be null");
        String base = endpoints.apply(cluster).toString();
        if (!base.endsWith("/")) {
            base = base + "/";
        }
        String ns = namespace == null || namespace.isBlank() ? "default" : namespace;
        return URI.create(base).resolve("apis/batch/v1/namespaces/" + ns + "/jobs/" + name);
    }

    // zero-valued counters are left out of the job status
    private static int intOrZero(JsonNode node) {
        return node.isNumber() ? node.asInt() : 0;
    }

    private static Instant instantOrNull(JsonNode node) {
        return node.isTextual() ? Instant.parse(node.asText()) : null;
    }
}

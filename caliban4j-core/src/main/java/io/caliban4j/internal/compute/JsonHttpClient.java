package io.caliban4j.internal.compute;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.caliban4j.core.ConnectError;
import io.caliban4j.core.Result;
import io.caliban4j.core.RetryPolicy;
import io.caliban4j.utils.Retries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Small JSON-over-HTTP helper for platform REST APIs.
 *
 * <p>A 404 is returned as {@link MissingNode}. Throttling (429), server errors and I/O
 * failures are retryable; other non-2xx responses are permanent errors.
 */
public class JsonHttpClient {
    private static final Logger log = LoggerFactory.getLogger(JsonHttpClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final Supplier<String> accessToken;
    private final RetryPolicy retryPolicy;
    private final Duration requestTimeout;

    public JsonHttpClient(ObjectMapper mapper, Supplier<String> accessToken, RetryPolicy retryPolicy) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                mapper, accessToken, retryPolicy, Duration.ofSeconds(30));
    }

    public JsonHttpClient(HttpClient httpClient,
                          ObjectMapper mapper,
                          Supplier<String> accessToken,
                          RetryPolicy retryPolicy,
                          Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.accessToken = accessToken == null ? () -> null : accessToken;
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
    }

    public Result<JsonNode> get(URI uri) {
        return exchange("GET", uri, null);
    }

    public Result<JsonNode> post(URI uri, Object body) {
        return exchange("POST", uri, body);
    }

    public Result<JsonNode> delete(URI uri, Object body) {
        return exchange("DELETE", uri, body);
    }

    private Result<JsonNode> exchange(String method, URI uri, Object body) {
        return Retries.retry(retryPolicy, method + " " + uri, () -> once(method, uri, body));
    }

    private Result<JsonNode> once(String method, URI uri, Object body) {
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(uri)
                    .timeout(requestTimeout)
                    .header("Accept", "application/json");
            String token = accessToken.get();
            if (token != null && !token.isBlank()) {
                builder.header("Authorization", "Bearer " + token);
            }
            if (body != null) {
                builder.header("Content-Type", "application/json")
                        .method(method, HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)));
            } else {
                builder.method(method, HttpRequest.BodyPublishers.noBody());
            }

            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            int code = response.statusCode();
            log.debug("{} {} -> HTTP {}", method, uri, code);

            if (code == 404) {
                return Result.ok(MissingNode.getInstance());
            }
            if (code >= 200 && code < 300) {
                String text = response.body();
                return Result.ok(text == null || text.isBlank() ? mapper.createObjectNode() : mapper.readTree(text));
            }
            String msg = method + " " + uri + " returned HTTP " + code + ": " + abbreviate(response.body());
            return Result.err(code == 429 || code >= 500
                    ? ConnectError.retryable(msg, null)
                    : ConnectError.permanent(msg));
        } catch (JsonProcessingException e) {
            return Result.err(ConnectError.permanent(method + " " + uri + " returned invalid JSON: " + e.getOriginalMessage(), e));
        } catch (IOException e) {
            return Result.err(ConnectError.retryable(method + " " + uri + " failed: " + e.getMessage(), e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.err(ConnectError.permanent(method + " " + uri + " interrupted", e));
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) : body;
    }
}

package io.caliban4j.internal.compute;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import io.caliban4j.core.GkeJobInfo;
import io.caliban4j.core.Result;
import io.caliban4j.core.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpJobApiTest {

    private HttpServer server;
    private URI baseUri;
    private JsonHttpClient client;

    private final Map<String, Response> responses = new ConcurrentHashMap<>();
    private final List<String> requests = new CopyOnWriteArrayList<>();
    private final List<String> authHeaders = new CopyOnWriteArrayList<>();

    private record Response(int code, String body) {
    }

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            String key = exchange.getRequestMethod() + " " + exchange.getRequestURI().getPath();
            requests.add(key);
            String auth = exchange.getRequestHeaders().getFirst("Authorization");
            authHeaders.add(auth == null ? "" : auth);
            Response response = responses.getOrDefault(key, new Response(404, "{}"));
            byte[] body = response.body().getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(response.code(), body.length == 0 ? -1 : body.length);
            if (body.length > 0) {
                try (OutputStream out = exchange.getResponseBody()) {
                    out.write(body);
                }
            }
            exchange.close();
        });
        server.start();
        baseUri = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/");
        client = new JsonHttpClient(new ObjectMapper(), () -> "token-1",
                new RetryPolicy(3, Duration.ZERO, Duration.ZERO));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void caipStateShouldBeReadWithBearerToken() {
        responses.put("GET /v1/projects/p1/jobs/train_1", new Response(200, "{\"jobId\":\"train_1\",\"state\":\"RUNNING\"}"));
        HttpCaipJobApi api = new HttpCaipJobApi(client, baseUri.resolve("v1"));

        assertEquals("RUNNING", api.getState("p1", "train_1").orElse(null));
        assertEquals(List.of("Bearer token-1"), authHeaders);
    }

    @Test
    void caipCancelShouldSucceedOnEmptyBody() {
        responses.put("POST /v1/projects/p1/jobs/train_1:cancel", new Response(200, "{}"));
        HttpCaipJobApi api = new HttpCaipJobApi(client, baseUri.resolve("v1/"));

        assertEquals(Boolean.TRUE, api.cancel("p1", "train_1").orElse(null));
    }

    @Test
    void missingCaipJobShouldBeAnError() {
        HttpCaipJobApi api = new HttpCaipJobApi(client, baseUri.resolve("v1/"));

        Result<String> state = api.getState("p1", "gone");

        assertFalse(state.isOk());
        assertFalse(state.error().orElseThrow().retryable());
    }

    @Test
    void serverErrorsShouldBeRetried() {
        AtomicInteger calls = new AtomicInteger();
        server.removeContext("/");
        server.createContext("/", exchange -> {
            byte[] body = (calls.incrementAndGet() < 3 ? "{}" : "{\"state\":\"SUCCEEDED\"}").getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(calls.get() < 3 ? 503 : 200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
            exchange.close();
        });
        HttpCaipJobApi api = new HttpCaipJobApi(client, baseUri);

        assertEquals("SUCCEEDED", api.getState("p1", "train_1").orElse(null));
        assertEquals(3, calls.get());
    }

    @Test
    void clientErrorsShouldNotBeRetried() {
        responses.put("GET /projects/p1/jobs/train_1", new Response(403, "{\"error\":\"denied\"}"));
        HttpCaipJobApi api = new HttpCaipJobApi(client, baseUri);

        Result<String> state = api.getState("p1", "train_1");

        assertFalse(state.isOk());
        assertTrue(state.error().orElseThrow().message().contains("403"));
        assertEquals(1, requests.size());
    }

    @Test
    void gkeJobShouldBeParsedFromStatus() {
        responses.put("GET /apis/batch/v1/namespaces/ml/jobs/trainer-0", new Response(200,
                "{\"metadata\":{\"name\":\"trainer-0\"},"
                        + "\"status\":{\"succeeded\":1,\"completionTime\":\"2026-01-01T00:10:00Z\"}}"));
        HttpGkeJobApi api = new HttpGkeJobApi(client, cluster -> baseUri);
        GkeClusterRef cluster = new GkeClusterRef("p1", "us-central1-a", "c1");

        Optional<GkeJobInfo> info = api.getJob(cluster, "ml", "trainer-0").orElse(null);

        assertEquals(new GkeJobInfo(0, 1, Instant.parse("2026-01-01T00:10:00Z")), info.orElseThrow());
        assertTrue(api.getJob(cluster, null, "other").orElse(null).isEmpty());
        assertEquals("GET /apis/batch/v1/namespaces/default/jobs/other", requests.get(1));
    }

    @Test
    void gkeDeleteShouldTreatMissingJobAsDeleted() {
        HttpGkeJobApi api = new HttpGkeJobApi(client, cluster -> baseUri);

        assertEquals(Boolean.TRUE, api.deleteJob(new GkeClusterRef("p1", "z", "c1"), "ml", "gone").orElse(null));
        assertEquals(List.of("DELETE /apis/batch/v1/namespaces/ml/jobs/gone"), requests);
    }
}

package stitcher.taskcenter.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import stitcher.taskcenter.Await;
import stitcher.taskcenter.config.AppConfig;
import stitcher.taskcenter.config.Dependencies;
import stitcher.taskcenter.execution.ControlledExecutionAdapter;
import stitcher.taskcenter.execution.ExecutionAdapterRegistry;
import stitcher.taskcenter.execution.ExecutionException;
import stitcher.taskcenter.model.OutputKind;
import stitcher.taskcenter.model.TaskOutput;
import stitcher.taskcenter.server.TaskCenterHttpServer;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits the HTTP endpoints of a fully wired task center.
 */
class HttpEndpointIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Dependencies deps;
    private TaskCenterHttpServer server;
    private ControlledExecutionAdapter adapter;
    private HttpClient httpClient;
    private String baseUrl;

    @BeforeEach
    void setUp() throws Exception {
        AppConfig config = AppConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-http-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withServerPort(0);
        adapter = new ControlledExecutionAdapter();
        deps = Dependencies.create(config, new ExecutionAdapterRegistry().registerAll(adapter));
        deps.start();

        server = new TaskCenterHttpServer("127.0.0.1", 0, deps.routerHandler());
        server.start();
        baseUrl = "http://127.0.0.1:" + server.port();

        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        server.close();
        deps.close();
    }

    // ==================== Helpers ====================

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(Duration.ofSeconds(10))
                .header("Content-Type", "application/json");
        builder.method(method, body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body));
        return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode json(String method, String path, String body, int expectedStatus) throws Exception {
        HttpResponse<String> response = send(method, path, body);
        assertEquals(expectedStatus, response.statusCode(),
                method + " " + path + " returned " + response.statusCode() + ". Body: " + response.body());
        return MAPPER.readTree(response.body());
    }

    private JsonNode getTask(long id) throws Exception {
        return json("GET", "/api/v1/tasks/" + id, null, 200);
    }

    private String status(long id) throws Exception {
        return getTask(id).get("status").asText();
    }

    private long submit(String type, String name) throws Exception {
        String body = String.format("""
                {
                    "type": "%s",
                    "name": "%s",
                    "outputDir": "/out",
                    "config": {"width": 1080, "codec": "h264"},
                    "files": [
                        {"path": "/in/a.mp4", "category": "A", "categoryLabel": "Clip A"},
                        {"path": "/in/b.mp4", "category": "B"}
                    ]
                }
                """, type, name);
        return json("POST", "/api/v1/tasks", body, 201).get("id").asLong();
    }

    // ==================== Tests ====================

    @Test
    @DisplayName("Submit, run and complete a task over HTTP")
    void submitRunAndComplete() throws Exception {
        long id = submit("video_stitch", "stitch demo");

        JsonNode created = getTask(id);
        assertEquals("video_stitch", created.get("type").asText());
        assertEquals(1080, created.get("config").get("width").asInt());
        assertEquals(2, created.get("files").size());
        assertEquals("A", created.get("files").get(0).get("category").asText());

        Await.until("running", () -> adapter.runsOf(id) == 1);
        adapter.succeed(id, TaskOutput.of("/out/stitched.mp4", OutputKind.VIDEO, 2048L));
        Await.until("completed", () -> {
            try {
                return status(id).equals("completed");
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });

        JsonNode done = getTask(id);
        assertEquals(100, done.get("progress").asInt());
        assertEquals("/out/stitched.mp4", done.get("outputs").get(0).get("path").asText());
        assertEquals("video", done.get("outputs").get(0).get("kind").asText());
        assertFalse(done.has("error"));

        JsonNode list = json("GET", "/api/v1/tasks?status=completed&withOutputs=true", null, 200);
        assertEquals(1, list.get("total").asInt());
        assertEquals(1, list.get("stats").get("completed").asInt());
    }

    @Test
    void failedTaskCanBeRetried() throws Exception {
        long id = submit("video_merge", "merge");
        Await.until("running", () -> adapter.runsOf(id) == 1);
        adapter.fail(id, new ExecutionException(ExecutionException.PROCESS_EXIT, "Worker exited with code 2"));
        Await.until("failed", () -> {
            try {
                return status(id).equals("failed");
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });

        JsonNode failed = getTask(id);
        assertEquals("PROCESS_EXIT", failed.get("error").get("code").asText());

        JsonNode logs = json("GET", "/api/v1/tasks/" + id + "/logs", null, 200);
        assertTrue(logs.get("logs").size() > 0);

        assertTrue(json("POST", "/api/v1/tasks/" + id + "/retry", null, 200).get("ok").asBoolean());
        Await.until("second run", () -> adapter.runsOf(id) == 2);
        assertEquals(1, getTask(id).get("retryCount").asInt());
    }

    @Test
    void pauseResumeAndCancel() throws Exception {
        long id = submit("video_resize", "resize");
        Await.until("running", () -> adapter.runsOf(id) == 1);

        assertTrue(json("POST", "/api/v1/tasks/" + id + "/pause", null, 200).get("ok").asBoolean());
        assertEquals("paused", status(id));
        JsonNode queue = json("GET", "/api/v1/queue", null, 200);
        assertEquals(1, queue.get("paused").asInt());

        assertTrue(json("POST", "/api/v1/tasks/" + id + "/resume", null, 200).get("ok").asBoolean());
        assertTrue(json("POST", "/api/v1/tasks/" + id + "/cancel", null, 200).get("ok").asBoolean());
        assertEquals("cancelled", status(id));
        assertFalse(json("POST", "/api/v1/tasks/" + id + "/cancel", null, 200).get("ok").asBoolean());

        JsonNode cleared = json("POST", "/api/v1/tasks/clear-cancelled", null, 200);
        assertEquals(1, cleared.get("count").asInt());
        json("GET", "/api/v1/tasks/" + id, null, 404);
    }

    @Test
    void batchSubmitReportsPerItemErrors() throws Exception {
        String body = """
                {
                    "tasks": [
                        {"type": "cover_format", "outputDir": "/out", "files": [{"path": "/in/a.png"}]},
                        {"type": "unknown", "outputDir": "/out", "files": [{"path": "/in/b.png"}]}
                    ]
                }
                """;

        JsonNode result = json("POST", "/api/v1/tasks/batch", body, 201);

        assertEquals(1, result.get("tasks").size());
        assertEquals(1, result.get("errors").size());
        assertEquals(1, result.get("errors").get(0).get("index").asInt());
    }

    @Test
    void configCanBeReadUpdatedAndReset() throws Exception {
        JsonNode initial = json("GET", "/api/v1/config", null, 200);
        assertEquals(2, initial.get("maxConcurrentTasks").asInt());

        JsonNode updated = json("PUT", "/api/v1/config", "{\"maxConcurrentTasks\": 6}", 200);
        assertEquals(6, updated.get("maxConcurrentTasks").asInt());
        assertEquals(6, json("GET", "/api/v1/queue", null, 200).get("maxConcurrent").asInt());

        json("PUT", "/api/v1/config", "{\"maxConcurrentTasks\": 0}", 400);
        json("PUT", "/api/v1/config", "{\"bogus\": true}", 400);

        JsonNode reset = json("POST", "/api/v1/config/reset", null, 200);
        assertEquals(2, reset.get("maxConcurrentTasks").asInt());
    }

    @Test
    void errorsMapToStatusCodes() throws Exception {
        json("GET", "/api/v1/tasks/424242", null, 404);
        json("POST", "/api/v1/tasks/424242/start", null, 404);
        json("POST", "/api/v1/tasks", "{\"type\": \"video_merge\"}", 400);
        json("POST", "/api/v1/tasks", "{not json", 400);
        json("POST", "/api/v1/tasks", "", 400);
        json("GET", "/api/v1/tasks?status=sleeping", null, 400);
        json("GET", "/api/v1/tasks?sort=name", null, 400);
        json("GET", "/api/v1/tasks?page=first", null, 400);
        json("GET", "/api/tasks", null, 404);
    }

    @Test
    void healthAndCpu() throws Exception {
        JsonNode health = json("GET", "/api/v1/health", null, 200);
        assertEquals("UP", health.get("status").asText());
        assertEquals(AppConfig.VERSION, health.get("version").asText());

        JsonNode cpu = json("GET", "/api/v1/system/cpu", null, 200);
        assertTrue(cpu.get("cores").asInt() >= 1);
        assertTrue(cpu.get("recommendedConcurrency").asInt() >= 1);
    }

    @Test
    void updateOutputDirAndDelete() throws Exception {
        long id = submit("lossless_grid", "grid");

        json("PUT", "/api/v1/tasks/" + id + "/output-dir", "{\"outputDir\": \"/elsewhere\"}", 200);
        assertEquals("/elsewhere", getTask(id).get("outputDir").asText());

        json("DELETE", "/api/v1/tasks/" + id, null, 200);
        json("GET", "/api/v1/tasks/" + id, null, 404);
        json("DELETE", "/api/v1/tasks/" + id, null, 404);
    }
}

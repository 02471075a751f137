package me.golemcore.agents.tools;

import me.golemcore.agents.domain.model.CancellationToken;
import me.golemcore.agents.domain.model.ExecutionContext;
import me.golemcore.agents.domain.model.ToolResult;
import me.golemcore.agents.domain.tools.ToolExecutionException;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpToolsTest {

    private MockWebServer server;
    private HttpGetTool getTool;
    private HttpPostTool postTool;
    private ExecutionContext context;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        OkHttpClient client = new OkHttpClient();
        ObjectMapper objectMapper = new ObjectMapper();
        getTool = new HttpGetTool(client, objectMapper);
        postTool = new HttpPostTool(client, objectMapper);
        context = ExecutionContext.builder().sessionId("sess-1").build();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    // ==================== GET ====================

    @Test
    @SuppressWarnings("unchecked")
    void shouldDecodeJsonResponse() throws InterruptedException {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"id\": 7, \"name\": \"widget\"}"));

        ToolResult result = getTool.execute(context, Map.of("url", server.url("/items/7").toString(),
                "headers", Map.of("Accept", "application/json")));

        assertTrue(result.isSuccess());
        Map<String, Object> data = (Map<String, Object>) result.getData();
        assertEquals(200, data.get("status_code"));
        assertEquals(Map.of("id", 7, "name", "widget"), data.get("data"));
        assertEquals("application/json", data.get("content_type"));
        assertEquals(server.url("/items/7").toString(), result.getMetadata().get("url"));

        RecordedRequest request = server.takeRequest();
        assertEquals("GET", request.getMethod());
        assertEquals("application/json", request.getHeader("Accept"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldReturnTextForNonJsonAndKeepErrorStatuses() {
        server.enqueue(new MockResponse()
                .setResponseCode(404)
                .setHeader("Content-Type", "text/plain")
                .setBody("missing"));

        ToolResult result = getTool.execute(context, Map.of("url", server.url("/nope").toString()));

        assertTrue(result.isSuccess());
        Map<String, Object> data = (Map<String, Object>) result.getData();
        assertEquals(404, data.get("status_code"));
        assertEquals("missing", data.get("data"));
        assertEquals(7, result.getMetadata().get("response_size"));
    }

    @Test
    void shouldReportConnectionFailure() throws IOException {
        MockWebServer closed = new MockWebServer();
        closed.start();
        String url = closed.url("/").toString();
        closed.shutdown();

        ToolExecutionException e = assertThrows(ToolExecutionException.class,
                () -> getTool.execute(context, Map.of("url", url, "timeout", 2.0)));

        assertEquals("REQUEST_FAILED", e.getCode());
        assertTrue(e.getDetail().startsWith("HTTP request failed"));
    }

    @Test
    void shouldAbortInFlightRequestWhenContextIsCancelled() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
        CancellationToken token = CancellationToken.create();
        ExecutionContext cancellable = ExecutionContext.builder()
                .sessionId("sess-1")
                .cancellationToken(token)
                .build();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(token::cancel, 200, TimeUnit.MILLISECONDS);
            long started = System.nanoTime();

            ToolExecutionException e = assertThrows(ToolExecutionException.class,
                    () -> getTool.execute(cancellable, Map.of("url", server.url("/slow").toString())));

            assertEquals("HTTP request cancelled", e.getDetail());
            assertTrue(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - started) < 10);
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void shouldRejectUnparseableUrl() {
        ToolExecutionException e = assertThrows(ToolExecutionException.class,
                () -> getTool.execute(context, Map.of("url", "http://")));

        assertEquals("INVALID_URL", e.getCode());
    }

    // ==================== POST ====================

    @Test
    void shouldPostJsonEncodedData() throws InterruptedException {
        server.enqueue(new MockResponse()
                .setResponseCode(201)
                .setHeader("Content-Type", "application/json")
                .setBody("{\"id\": 123}"));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", "John Doe");
        payload.put("email", "john@example.com");

        ToolResult result = postTool.execute(context, Map.of("url", server.url("/users").toString(),
                "data", payload, "content_type", "application/json"));

        assertTrue(result.isSuccess());
        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("{\"name\":\"John Doe\",\"email\":\"john@example.com\"}", request.getBody().readUtf8());
        assertTrue(request.getHeader("Content-Type").startsWith("application/json"));
    }

    @Test
    void shouldSendStringFormForOtherContentTypes() throws InterruptedException {
        server.enqueue(new MockResponse().setBody("ok"));

        postTool.execute(context, Map.of("url", server.url("/form").toString(),
                "data", Map.of("a", "1"), "content_type", "text/plain"));

        RecordedRequest request = server.takeRequest();
        assertEquals("{a=1}", request.getBody().readUtf8());
        assertTrue(request.getHeader("Content-Type").startsWith("text/plain"));
    }

    @Test
    void shouldPostEmptyBodyWithoutData() throws InterruptedException {
        server.enqueue(new MockResponse().setBody("ok"));

        postTool.execute(context, Map.of("url", server.url("/ping").toString()));

        assertEquals(0, server.takeRequest().getBodySize());
    }
}

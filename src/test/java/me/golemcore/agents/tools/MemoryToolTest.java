package me.golemcore.agents.tools;

import me.golemcore.agents.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.agents.domain.model.ExecutionContext;
import me.golemcore.agents.domain.model.Memory;
import me.golemcore.agents.domain.model.ToolResult;
import me.golemcore.agents.domain.service.MemoryService;
import me.golemcore.agents.domain.tools.ValidationException;
import me.golemcore.agents.infrastructure.config.AgentsProperties;
import me.golemcore.agents.infrastructure.config.AutoConfiguration;
import me.golemcore.agents.port.outbound.MemoryPort;
import me.golemcore.agents.port.outbound.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MemoryToolTest {

    private static final Instant NOW = Instant.parse("2026-02-14T00:00:00Z");

    @TempDir
    Path tempDir;

    private MemoryService memoryService;
    private MemoryTool tool;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        AgentsProperties properties = new AgentsProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        memoryService = new MemoryService(storage, AutoConfiguration.objectMapper(), clock);
        memoryService.loadMemories();
        tool = new MemoryTool(memoryService, clock);
        context = contextOf("agent-1");
    }

    private static ExecutionContext contextOf(String agentId) {
        return ExecutionContext.builder().sessionId("sess-1").agentId(agentId).build();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> data(ToolResult result) {
        assertTrue(result.isSuccess(), () -> "expected success but got " + result.getError());
        return (Map<String, Object>) result.getData();
    }

    private String store(String topic, String content, int importance) {
        Map<String, Object> input = new HashMap<>();
        input.put("action", "store");
        input.put("topic", topic);
        input.put("content", content);
        input.put("importance", importance);
        return (String) data(tool.execute(context, input)).get("memory_id");
    }

    // ==================== store ====================

    @Test
    void shouldStoreMemoryForCallingAgent() {
        ToolResult result = tool.execute(context, Map.of(
                "action", "store",
                "topic", "user_preferences",
                "content", "Prefers brief answers",
                "memory_type", "preference",
                "importance", 8.0,
                "tags", List.of("style", " communication "),
                "expires_in_days", 30));

        Map<String, Object> data = data(result);
        assertEquals("Memory stored successfully", data.get("message"));
        assertEquals(8, data.get("importance"));

        Memory stored = memoryService.get((String) data.get("memory_id")).orElseThrow();
        assertEquals("agent-1", stored.getAgentId());
        assertEquals("sess-1", stored.getSessionId());
        assertEquals(Memory.TYPE_PREFERENCE, stored.getMemoryType());
        assertEquals(List.of("style", "communication"), stored.getTags());
        assertEquals(NOW.plus(Duration.ofDays(30)), stored.getExpiresAt());
    }

    @Test
    void shouldDefaultTypeAndImportance() {
        ToolResult result = tool.execute(context, Map.of("action", "store", "topic", "facts", "content", "x"));

        Memory stored = memoryService.get((String) data(result).get("memory_id")).orElseThrow();
        assertEquals(Memory.TYPE_FACT, stored.getMemoryType());
        assertEquals(Memory.DEFAULT_IMPORTANCE, stored.getImportance());
    }

    @Test
    void shouldRequireTopicAndContentToStore() {
        ToolResult noTopic = tool.execute(context, Map.of("action", "store", "content", "x"));
        ToolResult noContent = tool.execute(context, Map.of("action", "store", "topic", "facts"));

        assertEquals("MISSING_TOPIC", noTopic.getErrorCode());
        assertEquals("MISSING_CONTENT", noContent.getErrorCode());
    }

    @Test
    void shouldRefuseToRunWithoutAgent() {
        ToolResult result = tool.execute(contextOf(null), Map.of("action", "stats"));

        assertFalse(result.isSuccess());
        assertEquals("MISSING_AGENT", result.getErrorCode());
    }

    @Test
    void shouldRejectImportanceOutsideRange() {
        assertThrows(ValidationException.class,
                () -> tool.validate(Map.of("action", "store", "importance", 11)));
        assertThrows(ValidationException.class, () -> tool.validate(Map.of("action", "forget")));
    }

    // ==================== recall / search ====================

    @Test
    @SuppressWarnings("unchecked")
    void shouldRecallTopicMostImportantFirst() {
        store("user_preferences", "Likes dark mode", 3);
        store("user_preferences", "Prefers brief answers", 9);
        store("weather", "Sunny", 5);

        Map<String, Object> data = data(tool.execute(context, Map.of("action", "recall", "topic", "user_preferences")));

        assertEquals(2, data.get("count"));
        List<Map<String, Object>> memories = (List<Map<String, Object>>) data.get("memories");
        assertEquals("Prefers brief answers", memories.get(0).get("content"));
        assertEquals(NOW.toString(), memories.get(0).get("created_at"));
    }

    @Test
    void shouldSearchByQueryAndMinimumImportance() {
        store("user_preferences", "Likes technical explanations", 8);
        store("notes", "Technical debt in billing", 2);

        Map<String, Object> all = data(tool.execute(context, Map.of("action", "search", "query", "technical")));
        Map<String, Object> important = data(tool.execute(context,
                Map.of("action", "search", "query", "technical", "importance", 5)));

        assertEquals(2, all.get("count"));
        assertEquals(1, important.get("count"));
        assertEquals("technical", important.get("query"));
    }

    @Test
    void shouldNotSeeOtherAgentsMemories() {
        store("facts", "secret", 5);

        Map<String, Object> data = data(tool.execute(contextOf("agent-2"), Map.of("action", "search")));

        assertEquals(0, data.get("count"));
    }

    // ==================== update / delete ====================

    @Test
    void shouldUpdateContentImportanceAndTags() {
        String id = store("facts", "Sky is blue", 5);

        ToolResult result = tool.execute(context, Map.of(
                "action", "update",
                "memory_id", id,
                "content", "Sky is grey",
                "importance", 7,
                "tags", List.of("weather")));

        assertEquals("Memory updated successfully", data(result).get("message"));
        Memory updated = memoryService.get(id).orElseThrow();
        assertEquals("Sky is grey", updated.getContent());
        assertEquals(7, updated.getImportance());
        assertEquals(List.of("weather"), updated.getTags());
        assertEquals("facts", updated.getTopic());
    }

    @Test
    void shouldGuardUpdateAndDeleteByOwnership() {
        String id = store("facts", "Sky is blue", 5);
        ExecutionContext stranger = contextOf("agent-2");

        ToolResult update = tool.execute(stranger, Map.of("action", "update", "memory_id", id, "content", "x"));
        ToolResult delete = tool.execute(stranger, Map.of("action", "delete", "memory_id", id));

        assertEquals("ACCESS_DENIED", update.getErrorCode());
        assertEquals("ACCESS_DENIED", delete.getErrorCode());
        assertEquals("Sky is blue", memoryService.get(id).orElseThrow().getContent());
    }

    @Test
    void shouldDeleteOwnMemory() {
        String id = store("facts", "Sky is blue", 5);

        assertEquals(id, data(tool.execute(context, Map.of("action", "delete", "memory_id", id))).get("memory_id"));

        assertFalse(memoryService.get(id).isPresent());
        assertEquals("MEMORY_NOT_FOUND",
                tool.execute(context, Map.of("action", "delete", "memory_id", id)).getErrorCode());
        assertEquals("MISSING_MEMORY_ID", tool.execute(context, Map.of("action", "update")).getErrorCode());
    }

    @Test
    void shouldReportStorageFailureAsToolError() {
        MemoryPort failing = mock(MemoryPort.class);
        when(failing.create(any())).thenThrow(new CompletionException(new StorageException("disk full", null)));
        MemoryTool broken = new MemoryTool(failing, Clock.fixed(NOW, ZoneOffset.UTC));

        ToolResult result = broken.execute(context, Map.of("action", "store", "topic", "facts", "content", "x"));

        assertFalse(result.isSuccess());
        assertEquals("STORE_FAILED", result.getErrorCode());
        assertEquals("Memory store failed: disk full", result.getError());
    }

    // ==================== stats ====================

    @Test
    @SuppressWarnings("unchecked")
    void shouldReportStats() {
        store("facts", "a", 4);
        store("facts", "b", 8);

        Map<String, Object> data = data(tool.execute(context, Map.of("action", "stats")));

        assertEquals(2, data.get("total_memories"));
        assertEquals(6.0, data.get("average_importance"));
        assertEquals(Map.of("facts", 2), data.get("memories_by_topic"));
        assertEquals(NOW.toString(), data.get("oldest_memory"));
    }
}

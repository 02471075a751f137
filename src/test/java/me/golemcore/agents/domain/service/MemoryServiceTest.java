package me.golemcore.agents.domain.service;

import me.golemcore.agents.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.agents.domain.model.Memory;
import me.golemcore.agents.domain.model.MemoryQuery;
import me.golemcore.agents.domain.model.MemoryStats;
import me.golemcore.agents.infrastructure.config.AgentsProperties;
import me.golemcore.agents.infrastructure.config.AutoConfiguration;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemoryServiceTest {

    private static final Instant START = Instant.parse("2026-02-14T00:00:00Z");
    private static final String AGENT_ID = "agent-1";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storage;
    private ObjectMapper objectMapper;
    private AgentServiceTest.MutableClock clock;
    private MemoryService service;

    @BeforeEach
    void setUp() {
        AgentsProperties properties = new AgentsProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = AutoConfiguration.objectMapper();
        clock = new AgentServiceTest.MutableClock(START);
        service = new MemoryService(storage, objectMapper, clock);
        service.loadMemories();
    }

    private static Memory memory(String topic, String content, int importance) {
        return Memory.builder()
                .agentId(AGENT_ID)
                .topic(topic)
                .content(content)
                .importance(importance)
                .build();
    }

    // ==================== create / update / delete ====================

    @Test
    void shouldCreateWithDefaultsAndPersist() {
        Memory created = service.create(memory("user_preferences", "Prefers brief answers", 5));

        assertNotNull(created.getId());
        assertEquals(Memory.TYPE_FACT, created.getMemoryType());
        assertEquals(START, created.getCreatedAt());
        assertTrue(Files.exists(tempDir.resolve("memories").resolve(created.getId() + ".json")));
    }

    @Test
    void shouldRejectInvalidMemories() {
        assertThrows(IllegalArgumentException.class,
                () -> service.create(memory("topic", "content", 5).toBuilder().agentId(null).build()));
        assertThrows(IllegalArgumentException.class, () -> service.create(memory(" ", "content", 5)));
        assertThrows(IllegalArgumentException.class, () -> service.create(memory("topic", "", 5)));
        assertThrows(IllegalArgumentException.class, () -> service.create(memory("topic", "content", 11)));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> service.create(memory("topic", "content", 5).toBuilder().memoryType("dream").build()));
        assertEquals("memory_type must be one of: preference, fact, conversation, behavior", e.getMessage());
    }

    @Test
    void shouldUpdateKeepingOwnerAndCreationTime() {
        Memory created = service.create(memory("facts", "Sky is blue", 5));
        clock.advance(Duration.ofMinutes(3));

        Memory updated = service.update(created.toBuilder().content("Sky is grey").agentId("other").build());

        assertEquals("Sky is grey", service.get(created.getId()).orElseThrow().getContent());
        assertEquals(AGENT_ID, updated.getAgentId());
        assertEquals(START, updated.getCreatedAt());
        assertEquals(START.plus(Duration.ofMinutes(3)), updated.getUpdatedAt());
    }

    @Test
    void shouldDeleteMemoryAndItsFile() {
        Memory created = service.create(memory("facts", "Sky is blue", 5));

        assertTrue(service.delete(created.getId()));
        assertFalse(service.delete(created.getId()));
        assertFalse(service.get(created.getId()).isPresent());
        assertFalse(Files.exists(tempDir.resolve("memories").resolve(created.getId() + ".json")));
    }

    @Test
    void shouldDeleteOnlyMemoriesOfGivenAgent() {
        service.create(memory("facts", "one", 5));
        service.create(memory("facts", "two", 5));
        Memory foreign = service.create(memory("facts", "three", 5).toBuilder().agentId("agent-2").build());

        assertEquals(2, service.deleteByAgent(AGENT_ID));

        assertTrue(service.get(foreign.getId()).isPresent());
        assertEquals(0, service.stats(AGENT_ID).getTotalMemories());
    }

    @Test
    void shouldReloadMemoriesFromStorage() {
        Memory created = service.create(memory("facts", "Sky is blue", 7).toBuilder()
                .tags(List.of("nature"))
                .build());

        MemoryService reloaded = new MemoryService(storage, objectMapper, clock);
        reloaded.loadMemories();

        Memory loaded = reloaded.get(created.getId()).orElseThrow();
        assertEquals("Sky is blue", loaded.getContent());
        assertEquals(7, loaded.getImportance());
        assertEquals(List.of("nature"), loaded.getTags());
    }

    // ==================== expiry ====================

    @Test
    void shouldHideAndPurgeExpiredMemories() {
        Memory expiring = service.create(memory("facts", "temporary", 5).toBuilder()
                .expiresAt(START.plus(Duration.ofDays(1)))
                .build());
        service.create(memory("facts", "permanent", 5));
        clock.advance(Duration.ofDays(2));

        assertFalse(service.get(expiring.getId()).isPresent());
        assertEquals(1, service.listByTopic(AGENT_ID, "facts", 10, 0).size());

        MemoryService reloaded = new MemoryService(storage, objectMapper, clock);
        reloaded.loadMemories();
        assertFalse(Files.exists(tempDir.resolve("memories").resolve(expiring.getId() + ".json")));
    }

    // ==================== search ====================

    @Test
    void shouldOrderByImportanceThenNewestFirst() {
        service.create(memory("facts", "low", 2));
        clock.advance(Duration.ofMinutes(1));
        service.create(memory("facts", "high-old", 9));
        clock.advance(Duration.ofMinutes(1));
        service.create(memory("facts", "high-new", 9));

        List<String> contents = service.listByTopic(AGENT_ID, "facts", 10, 0).stream()
                .map(Memory::getContent)
                .toList();

        assertEquals(List.of("high-new", "high-old", "low"), contents);
    }

    @Test
    void shouldSearchTextIgnoringCaseInTopicOrContent() {
        service.create(memory("user_preferences", "Likes TECHNICAL explanations", 5));
        service.create(memory("technical_stack", "Java and Spring", 5));
        service.create(memory("weather", "Sunny", 5));

        List<Memory> found = service.search(MemoryQuery.builder().agentId(AGENT_ID).text("technical").build());

        assertEquals(2, found.size());
    }

    @Test
    void shouldFilterByTypeTagsAndMinimumImportance() {
        service.create(memory("prefs", "short answers", 8).toBuilder()
                .memoryType(Memory.TYPE_PREFERENCE)
                .tags(List.of("Style", "communication"))
                .build());
        service.create(memory("prefs", "dark mode", 3).toBuilder()
                .memoryType(Memory.TYPE_PREFERENCE)
                .tags(List.of("ui"))
                .build());
        service.create(memory("facts", "lives in Berlin", 6));

        assertEquals(2, service.search(MemoryQuery.builder().agentId(AGENT_ID)
                .memoryType(Memory.TYPE_PREFERENCE).build()).size());
        assertEquals(List.of("short answers"), service.search(MemoryQuery.builder().agentId(AGENT_ID)
                .tags(List.of("style", "missing")).build()).stream().map(Memory::getContent).toList());
        assertEquals(2, service.search(MemoryQuery.builder().agentId(AGENT_ID).minImportance(6).build()).size());
        assertTrue(service.search(MemoryQuery.builder().agentId("agent-2").build()).isEmpty());
    }

    @Test
    void shouldPageSearchResults() {
        for (int i = 1; i <= 5; i++) {
            service.create(memory("facts", "fact " + i, i));
        }

        List<Memory> page = service.search(MemoryQuery.builder().agentId(AGENT_ID).limit(2).offset(1).build());

        assertEquals(List.of("fact 4", "fact 3"), page.stream().map(Memory::getContent).toList());
    }

    // ==================== stats ====================

    @Test
    void shouldSummarizeAgentMemories() {
        service.create(memory("prefs", "a", 8).toBuilder().memoryType(Memory.TYPE_PREFERENCE).build());
        clock.advance(Duration.ofHours(1));
        service.create(memory("facts", "b", 4));
        service.create(memory("facts", "c", 6));

        MemoryStats stats = service.stats(AGENT_ID);

        assertEquals(3, stats.getTotalMemories());
        assertEquals(2, stats.getMemoriesByType().get(Memory.TYPE_FACT));
        assertEquals(1, stats.getMemoriesByType().get(Memory.TYPE_PREFERENCE));
        assertEquals(List.of("facts", "prefs"), List.copyOf(stats.getMemoriesByTopic().keySet()));
        assertEquals(6.0, stats.getAverageImportance(), 1e-9);
        assertEquals(START, stats.getOldestMemory());
        assertEquals(START.plus(Duration.ofHours(1)), stats.getNewestMemory());
    }

    @Test
    void shouldReturnEmptyStatsForAgentWithoutMemories() {
        MemoryStats stats = service.stats("nobody");

        assertEquals(0, stats.getTotalMemories());
        assertEquals(0.0, stats.getAverageImportance(), 1e-9);
        assertNull(stats.getOldestMemory());
    }
}

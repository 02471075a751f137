package me.golemcore.agents.domain.service;

import me.golemcore.agents.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.agents.domain.context.ContextStrategyRegistry;
import me.golemcore.agents.domain.context.LastNContextStrategy;
import me.golemcore.agents.domain.context.SlidingWindowContextStrategy;
import me.golemcore.agents.domain.context.SummarizeContextStrategy;
import me.golemcore.agents.domain.model.ChatSession;
import me.golemcore.agents.domain.model.Message;
import me.golemcore.agents.infrastructure.config.AgentsProperties;
import me.golemcore.agents.infrastructure.config.AutoConfiguration;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionServiceTest {

    private static final Instant START = Instant.parse("2026-02-14T00:00:00Z");

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storage;
    private MessageService messageService;
    private ContextStrategyRegistry strategies;
    private AgentsProperties properties;
    private ObjectMapper objectMapper;
    private AgentServiceTest.MutableClock clock;
    private SessionService service;

    @BeforeEach
    void setUp() {
        properties = new AgentsProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = AutoConfiguration.objectMapper();
        clock = new AgentServiceTest.MutableClock(START);
        messageService = new MessageService(storage, objectMapper, clock);
        strategies = new ContextStrategyRegistry(List.of(new LastNContextStrategy(),
                new SlidingWindowContextStrategy(), new SummarizeContextStrategy()));
        service = new SessionService(storage, messageService, strategies, properties, objectMapper, clock);
        service.loadSessions();
    }

    private static ChatSession session(String agentId) {
        return ChatSession.builder().agentId(agentId).title("Chat").build();
    }

    // ==================== create ====================

    @Test
    void shouldCreateWithBuilderDefaults() {
        ChatSession created = service.create(session("agent-1"));

        assertNotNull(created.getId());
        assertEquals("last_n", created.getContextStrategy());
        assertEquals(START, created.getCreatedAt());
        assertTrue(service.get(created.getId()).isPresent());
    }

    @Test
    void shouldApplyConfiguredDefaultStrategy() {
        properties.getContext().setDefaultStrategy("summarize");

        ChatSession created = service.create(session("agent-1").toBuilder().contextStrategy(null).build());

        assertEquals("summarize", created.getContextStrategy());
    }

    @Test
    void shouldRejectUnknownStrategyAndMissingAgent() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> service.create(session("agent-1").toBuilder().contextStrategy("fancy").build()));
        assertEquals("context_strategy must be one of: last_n, sliding_window, summarize", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> service.create(session(null)));
    }

    @Test
    void shouldReloadSessionsFromDisk() {
        ChatSession created = service.create(session("agent-1").toBuilder()
                .contextStrategy("sliding_window")
                .contextConfig(Map.of("window_size", 8))
                .build());

        SessionService reloaded = new SessionService(storage, messageService, strategies, properties,
                objectMapper, clock);
        reloaded.loadSessions();

        ChatSession loaded = reloaded.get(created.getId()).orElseThrow();
        assertEquals("sliding_window", loaded.getContextStrategy());
        assertEquals(8, loaded.getContextConfig().get("window_size"));
    }

    // ==================== list / update ====================

    @Test
    void shouldListByAgentMostRecentlyUpdatedFirst() {
        ChatSession older = service.create(session("agent-1"));
        clock.advance(Duration.ofMinutes(1));
        ChatSession newer = service.create(session("agent-1"));
        service.create(session("agent-2"));
        clock.advance(Duration.ofMinutes(1));
        service.update(older);

        List<ChatSession> sessions = service.listByAgent("agent-1", 10, 0);

        assertEquals(List.of(older.getId(), newer.getId()), sessions.stream().map(ChatSession::getId).toList());
        assertEquals(2, service.countByAgent("agent-1"));
    }

    @Test
    void shouldValidateStrategyOnUpdate() {
        ChatSession created = service.create(session("agent-1"));

        assertThrows(IllegalArgumentException.class,
                () -> service.update(created.toBuilder().contextStrategy("fancy").build()));
        assertThrows(IllegalArgumentException.class,
                () -> service.update(created.toBuilder().id("missing").build()));
    }

    // ==================== delete ====================

    @Test
    void shouldDeleteSessionWithMessages() {
        ChatSession created = service.create(session("agent-1"));
        messageService.append(Message.builder().sessionId(created.getId()).role(Message.ROLE_USER)
                .content("hi").build());

        assertTrue(service.delete(created.getId()));

        assertFalse(service.get(created.getId()).isPresent());
        assertEquals(0, messageService.count(created.getId()));
        assertFalse(service.delete(created.getId()));
    }

    @Test
    void shouldDeleteAllSessionsOfAgent() {
        service.create(session("agent-1"));
        service.create(session("agent-1"));
        service.create(session("agent-2"));

        assertEquals(2, service.deleteByAgent("agent-1"));
        assertEquals(0, service.countByAgent("agent-1"));
        assertEquals(1, service.countByAgent("agent-2"));
    }
}

package me.golemcore.agents.domain.service;

import me.golemcore.agents.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.agents.domain.model.Agent;
import me.golemcore.agents.infrastructure.config.AgentsProperties;
import me.golemcore.agents.infrastructure.config.AutoConfiguration;
import me.golemcore.agents.port.outbound.MemoryPort;
import me.golemcore.agents.port.outbound.SessionPort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentServiceTest {

    private static final Instant START = Instant.parse("2026-02-14T00:00:00Z");

    @TempDir
    Path tempDir;

    @Mock
    private SessionPort sessionPort;

    @Mock
    private MemoryPort memoryPort;

    private LocalStorageAdapter storage;
    private ObjectMapper objectMapper;
    private MutableClock clock;
    private AgentService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        AgentsProperties properties = new AgentsProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = AutoConfiguration.objectMapper();
        clock = new MutableClock(START);
        service = new AgentService(storage, sessionPort, memoryPort, objectMapper, clock);
        service.loadAgents();
    }

    private static Agent agent(String name) {
        return Agent.builder()
                .name(name)
                .provider("openai")
                .model("gpt-4o")
                .systemPrompt("You are helpful.")
                .build();
    }

    // ==================== create ====================

    @Test
    void shouldCreateWithDefaultsAndPersist() {
        Agent created = service.create(agent("Helper"));

        assertNotNull(created.getId());
        assertEquals(START, created.getCreatedAt());
        assertEquals(Agent.DEFAULT_TEMPERATURE, created.getTemperature());
        assertEquals(Agent.DEFAULT_MAX_TOKENS, created.getMaxTokens());
        assertTrue(Files.exists(tempDir.resolve("agents").resolve(created.getId() + ".json")));
        assertTrue(service.get(created.getId()).isPresent());
    }

    @Test
    void shouldReloadAgentsFromDisk() {
        Agent created = service.create(agent("Helper").toBuilder().config(Map.of("agent_type", "math")).build());

        AgentService reloaded = new AgentService(storage, sessionPort, memoryPort, objectMapper, clock);
        reloaded.loadAgents();

        Agent loaded = reloaded.get(created.getId()).orElseThrow();
        assertEquals("Helper", loaded.getName());
        assertEquals("math", loaded.getConfig().get("agent_type"));
        assertEquals(1, reloaded.count());
    }

    @Test
    void shouldRejectInvalidAgents() {
        assertEquals("name is required",
                assertThrows(IllegalArgumentException.class, () -> service.create(agent(" "))).getMessage());
        assertThrows(IllegalArgumentException.class, () -> service.create(agent("x".repeat(101))));
        assertThrows(IllegalArgumentException.class,
                () -> service.create(agent("A").toBuilder().provider("acme").build()));
        assertThrows(IllegalArgumentException.class,
                () -> service.create(agent("A").toBuilder().model("").build()));
        assertThrows(IllegalArgumentException.class,
                () -> service.create(agent("A").toBuilder().systemPrompt(null).build()));
        assertThrows(IllegalArgumentException.class,
                () -> service.create(agent("A").toBuilder().temperature(2.5).build()));
        assertThrows(IllegalArgumentException.class,
                () -> service.create(agent("A").toBuilder().maxTokens(0).build()));
        assertEquals(0, service.count());
    }

    // ==================== list ====================

    @Test
    void shouldListNewestFirstWithPaging() {
        service.create(agent("first"));
        clock.advance(Duration.ofMinutes(1));
        service.create(agent("second"));
        clock.advance(Duration.ofMinutes(1));
        service.create(agent("third"));

        List<String> names = service.list(2, 0).stream().map(Agent::getName).toList();
        List<String> rest = service.list(2, 2).stream().map(Agent::getName).toList();

        assertEquals(List.of("third", "second"), names);
        assertEquals(List.of("first"), rest);
    }

    // ==================== update / delete ====================

    @Test
    void shouldUpdateExistingAgent() {
        Agent created = service.create(agent("Helper"));
        clock.advance(Duration.ofMinutes(5));

        Agent updated = service.update(created.toBuilder().name("Renamed").build());

        assertEquals("Renamed", service.get(created.getId()).orElseThrow().getName());
        assertEquals(START.plus(Duration.ofMinutes(5)), updated.getUpdatedAt());
        assertEquals(START, updated.getCreatedAt());
    }

    @Test
    void shouldRejectUpdateOfUnknownAgent() {
        Agent ghost = agent("Ghost").toBuilder().id("missing").build();

        assertThrows(IllegalArgumentException.class, () -> service.update(ghost));
    }

    @Test
    void shouldDeleteAgentWithSessions() {
        Agent created = service.create(agent("Helper"));
        when(sessionPort.deleteByAgent(created.getId())).thenReturn(2);

        assertTrue(service.delete(created.getId()));

        verify(sessionPort).deleteByAgent(created.getId());
        verify(memoryPort).deleteByAgent(created.getId());
        assertFalse(service.get(created.getId()).isPresent());
        assertFalse(Files.exists(tempDir.resolve("agents").resolve(created.getId() + ".json")));
    }

    @Test
    void shouldReturnFalseWhenDeletingUnknownAgent() {
        assertFalse(service.delete("missing"));
        verify(sessionPort, never()).deleteByAgent("missing");
    }

    static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneId.of("UTC");
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}

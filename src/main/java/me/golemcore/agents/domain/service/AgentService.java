package me.golemcore.agents.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.agents.domain.model.Agent;
import me.golemcore.agents.port.outbound.AgentPort;
import me.golemcore.agents.port.outbound.MemoryPort;
import me.golemcore.agents.port.outbound.SessionPort;
import me.golemcore.agents.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Agent definitions persisted as JSON documents under {@code agents/} and
 * cached in memory.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentService implements AgentPort {

    static final String AGENTS_DIR = "agents";
    private static final String JSON_EXTENSION = ".json";
    private static final int MAX_NAME_LENGTH = 100;
    private static final int MAX_TOKENS_LIMIT = 100000;

    private final StoragePort storagePort;
    private final SessionPort sessionPort;
    private final MemoryPort memoryPort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, Agent> agentCache = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadAgents() {
        List<String> files = storagePort.listObjects(AGENTS_DIR, "").join();
        for (String file : files) {
            if (!file.endsWith(JSON_EXTENSION)) {
                continue;
            }
            String json = storagePort.getText(AGENTS_DIR, file).join();
            if (json == null) {
                continue;
            }
            try {
                Agent agent = objectMapper.readValue(json, Agent.class);
                agentCache.put(agent.getId(), agent);
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable agent file {}: {}", file, e.getOriginalMessage());
            }
        }
        log.info("Loaded {} agents", agentCache.size());
    }

    @Override
    public Agent create(Agent agent) {
        validate(agent);
        Instant now = clock.instant();
        if (agent.getId() == null || agent.getId().isBlank()) {
            agent.setId(UUID.randomUUID().toString());
        }
        if (agent.getConfig() == null) {
            agent.setConfig(new HashMap<>());
        }
        agent.setCreatedAt(now);
        agent.setUpdatedAt(now);
        save(agent);
        log.info("Created agent: {} ({})", agent.getId(), agent.getName());
        return agent;
    }

    @Override
    public Optional<Agent> get(String agentId) {
        if (agentId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(agentCache.get(agentId));
    }

    @Override
    public List<Agent> list(int limit, int offset) {
        return agentCache.values().stream()
                .sorted(Comparator.comparing(Agent::getCreatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .skip(Math.max(0, offset))
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public int count() {
        return agentCache.size();
    }

    @Override
    public Agent update(Agent agent) {
        if (!agentCache.containsKey(agent.getId())) {
            throw new IllegalArgumentException("Agent not found: " + agent.getId());
        }
        validate(agent);
        agent.setUpdatedAt(clock.instant());
        save(agent);
        log.info("Updated agent: {}", agent.getId());
        return agent;
    }

    @Override
    public boolean delete(String agentId) {
        if (agentId == null || agentCache.remove(agentId) == null) {
            return false;
        }
        int sessions = sessionPort.deleteByAgent(agentId);
        int memories = memoryPort.deleteByAgent(agentId);
        storagePort.deleteObject(AGENTS_DIR, agentId + JSON_EXTENSION).join();
        log.info("Deleted agent {} with {} sessions and {} memories", agentId, sessions, memories);
        return true;
    }

    /**
     * @throws IllegalArgumentException
     *             if a field is missing or out of range
     */
    static void validate(Agent agent) {
        if (agent.getName() == null || agent.getName().isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (agent.getName().length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        if (agent.getProvider() == null || !Agent.SUPPORTED_PROVIDERS.contains(agent.getProvider())) {
            throw new IllegalArgumentException(
                    "provider must be one of: " + String.join(", ", Agent.SUPPORTED_PROVIDERS));
        }
        if (agent.getModel() == null || agent.getModel().isBlank()) {
            throw new IllegalArgumentException("model is required");
        }
        if (agent.getSystemPrompt() == null || agent.getSystemPrompt().isBlank()) {
            throw new IllegalArgumentException("system_prompt is required");
        }
        if (agent.getTemperature() < 0 || agent.getTemperature() > 2) {
            throw new IllegalArgumentException("temperature must be between 0 and 2");
        }
        if (agent.getMaxTokens() < 1 || agent.getMaxTokens() > MAX_TOKENS_LIMIT) {
            throw new IllegalArgumentException("max_tokens must be between 1 and " + MAX_TOKENS_LIMIT);
        }
    }

    private void save(Agent agent) {
        String json;
        try {
            json = objectMapper.writeValueAsString(agent);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize agent " + agent.getId(), e);
        }
        storagePort.putTextAtomic(AGENTS_DIR, agent.getId() + JSON_EXTENSION, json).join();
        agentCache.put(agent.getId(), agent);
    }
}

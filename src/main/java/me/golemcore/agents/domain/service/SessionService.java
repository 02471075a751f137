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

import me.golemcore.agents.domain.context.ContextStrategyRegistry;
import me.golemcore.agents.domain.model.ChatSession;
import me.golemcore.agents.infrastructure.config.AgentsProperties;
import me.golemcore.agents.port.outbound.MessagePort;
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
 * Chat sessions persisted as JSON documents under {@code sessions/} and cached
 * in memory. Deleting a session also deletes its message history. Sessions
 * created without a context strategy get {@code agents.context.default-strategy}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionService implements SessionPort {

    static final String SESSIONS_DIR = "sessions";
    private static final String JSON_EXTENSION = ".json";

    private final StoragePort storagePort;
    private final MessagePort messagePort;
    private final ContextStrategyRegistry contextStrategies;
    private final AgentsProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, ChatSession> sessionCache = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadSessions() {
        List<String> files = storagePort.listObjects(SESSIONS_DIR, "").join();
        for (String file : files) {
            if (!file.endsWith(JSON_EXTENSION)) {
                continue;
            }
            String json = storagePort.getText(SESSIONS_DIR, file).join();
            if (json == null) {
                continue;
            }
            try {
                ChatSession session = objectMapper.readValue(json, ChatSession.class);
                sessionCache.put(session.getId(), session);
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable session file {}: {}", file, e.getOriginalMessage());
            }
        }
        log.info("Loaded {} sessions", sessionCache.size());
    }

    @Override
    public ChatSession create(ChatSession session) {
        if (session.getAgentId() == null || session.getAgentId().isBlank()) {
            throw new IllegalArgumentException("agent_id is required");
        }
        if (session.getContextStrategy() == null || session.getContextStrategy().isBlank()) {
            session.setContextStrategy(properties.getContext().getDefaultStrategy());
        }
        validateStrategy(session.getContextStrategy());
        if (session.getContextConfig() == null) {
            session.setContextConfig(new HashMap<>());
        }
        if (session.getId() == null || session.getId().isBlank()) {
            session.setId(UUID.randomUUID().toString());
        }
        Instant now = clock.instant();
        session.setCreatedAt(now);
        session.setUpdatedAt(now);
        save(session);
        log.info("Created session {} for agent {}", session.getId(), session.getAgentId());
        return session;
    }

    @Override
    public Optional<ChatSession> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessionCache.get(sessionId));
    }

    @Override
    public List<ChatSession> listByAgent(String agentId, int limit, int offset) {
        return sessionCache.values().stream()
                .filter(session -> session.getAgentId().equals(agentId))
                .sorted(Comparator.comparing(ChatSession::getUpdatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .skip(Math.max(0, offset))
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public int countByAgent(String agentId) {
        return (int) sessionCache.values().stream()
                .filter(session -> session.getAgentId().equals(agentId))
                .count();
    }

    @Override
    public ChatSession update(ChatSession session) {
        if (!sessionCache.containsKey(session.getId())) {
            throw new IllegalArgumentException("Session not found: " + session.getId());
        }
        validateStrategy(session.getContextStrategy());
        session.setUpdatedAt(clock.instant());
        save(session);
        log.debug("Updated session: {}", session.getId());
        return session;
    }

    @Override
    public boolean delete(String sessionId) {
        if (sessionId == null || sessionCache.remove(sessionId) == null) {
            return false;
        }
        int messages = messagePort.deleteBySession(sessionId);
        storagePort.deleteObject(SESSIONS_DIR, sessionId + JSON_EXTENSION).join();
        log.info("Deleted session {} with {} messages", sessionId, messages);
        return true;
    }

    @Override
    public int deleteByAgent(String agentId) {
        List<String> ids = sessionCache.values().stream()
                .filter(session -> session.getAgentId().equals(agentId))
                .map(ChatSession::getId)
                .toList();
        int deleted = 0;
        for (String id : ids) {
            if (delete(id)) {
                deleted++;
            }
        }
        return deleted;
    }

    private void validateStrategy(String strategy) {
        if (contextStrategies.get(strategy).isEmpty()) {
            throw new IllegalArgumentException(
                    "context_strategy must be one of: " + String.join(", ", contextStrategies.list()));
        }
    }

    private void save(ChatSession session) {
        String json;
        try {
            json = objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session " + session.getId(), e);
        }
        storagePort.putTextAtomic(SESSIONS_DIR, session.getId() + JSON_EXTENSION, json).join();
        sessionCache.put(session.getId(), session);
    }
}

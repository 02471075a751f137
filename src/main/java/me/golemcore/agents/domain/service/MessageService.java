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

import me.golemcore.agents.domain.model.Message;
import me.golemcore.agents.port.outbound.MessagePort;
import me.golemcore.agents.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Message history stored as one JSONL file per session under
 * {@code messages/}.
 *
 * <p>
 * Writes to one session are serialized; a batch is encoded up front and
 * appended with a single storage write. Histories are cached after the first
 * read. Lines that cannot be parsed (e.g. a torn last line after a crash) are
 * skipped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageService implements MessagePort {

    static final String MESSAGES_DIR = "messages";
    private static final String JSONL_EXTENSION = ".jsonl";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, List<Message>> historyCache = new ConcurrentHashMap<>();
    private final Map<String, Object> sessionLocks = new ConcurrentHashMap<>();

    @Override
    public Message append(Message message) {
        return appendAll(message.getSessionId(), List.of(message)).get(0);
    }

    @Override
    public List<Message> appendAll(String sessionId, List<Message> messages) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("session id is required");
        }
        if (messages.isEmpty()) {
            return List.of();
        }

        synchronized (lockFor(sessionId)) {
            List<Message> history = loadHistory(sessionId);
            StringBuilder batch = new StringBuilder();
            for (Message message : messages) {
                prepare(sessionId, message);
                batch.append(encode(message)).append('\n');
            }
            storagePort.appendText(MESSAGES_DIR, fileName(sessionId), batch.toString()).join();
            history.addAll(messages);
        }
        log.debug("Appended {} messages to session {}", messages.size(), sessionId);
        return messages;
    }

    @Override
    public List<Message> list(String sessionId, int limit, int offset) {
        synchronized (lockFor(sessionId)) {
            List<Message> history = loadHistory(sessionId);
            int from = Math.min(Math.max(0, offset), history.size());
            int to = Math.min(from + Math.max(0, limit), history.size());
            return new ArrayList<>(history.subList(from, to));
        }
    }

    @Override
    public List<Message> listRecent(String sessionId, int limit) {
        synchronized (lockFor(sessionId)) {
            List<Message> history = loadHistory(sessionId);
            int from = Math.max(0, history.size() - Math.max(0, limit));
            return new ArrayList<>(history.subList(from, history.size()));
        }
    }

    @Override
    public int count(String sessionId) {
        synchronized (lockFor(sessionId)) {
            return loadHistory(sessionId).size();
        }
    }

    @Override
    public int deleteBySession(String sessionId) {
        synchronized (lockFor(sessionId)) {
            int removed = loadHistory(sessionId).size();
            storagePort.deleteObject(MESSAGES_DIR, fileName(sessionId)).join();
            historyCache.remove(sessionId);
            log.debug("Deleted {} messages of session {}", removed, sessionId);
            return removed;
        }
    }

    private void prepare(String sessionId, Message message) {
        if (message.getId() == null || message.getId().isBlank()) {
            message.setId(UUID.randomUUID().toString());
        }
        if (message.getCreatedAt() == null) {
            message.setCreatedAt(clock.instant());
        }
        message.setSessionId(sessionId);
    }

    private String encode(Message message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize message " + message.getId(), e);
        }
    }

    private List<Message> loadHistory(String sessionId) {
        return historyCache.computeIfAbsent(sessionId, id -> {
            String content = storagePort.getText(MESSAGES_DIR, fileName(id)).join();
            if (content == null || content.isEmpty()) {
                return new ArrayList<>();
            }
            List<Message> messages = new ArrayList<>();
            for (String line : content.split("\n")) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    messages.add(objectMapper.readValue(line, Message.class));
                } catch (JsonProcessingException e) {
                    log.warn("Skipping unreadable message line in session {}: {}", id, e.getOriginalMessage());
                }
            }
            return messages;
        });
    }

    private Object lockFor(String sessionId) {
        return sessionLocks.computeIfAbsent(sessionId, id -> new Object());
    }

    private static String fileName(String sessionId) {
        return sessionId + JSONL_EXTENSION;
    }
}

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
 */

import me.golemcore.agents.domain.model.Memory;
import me.golemcore.agents.domain.model.MemoryQuery;
import me.golemcore.agents.domain.model.MemoryStats;
import me.golemcore.agents.port.outbound.MemoryPort;
import me.golemcore.agents.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Agent memories persisted as JSON documents under {@code memories/} and
 * cached in memory. Expired memories are purged on startup and skipped by
 * every read until then.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryService implements MemoryPort {

    static final String MEMORIES_DIR = "memories";
    private static final String JSON_EXTENSION = ".json";
    private static final int TOP_TOPICS = 10;

    private static final Comparator<Memory> RELEVANCE = Comparator.comparingInt(Memory::getImportance)
            .reversed()
            .thenComparing(Memory::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, Memory> memoryCache = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadMemories() {
        List<String> files = storagePort.listObjects(MEMORIES_DIR, "").join();
        for (String file : files) {
            if (!file.endsWith(JSON_EXTENSION)) {
                continue;
            }
            String json = storagePort.getText(MEMORIES_DIR, file).join();
            if (json == null) {
                continue;
            }
            try {
                Memory memory = objectMapper.readValue(json, Memory.class);
                memoryCache.put(memory.getId(), memory);
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable memory file {}: {}", file, e.getOriginalMessage());
            }
        }
        int expired = deleteExpired();
        log.info("Loaded {} memories ({} expired removed)", memoryCache.size(), expired);
    }

    @Override
    public Memory create(Memory memory) {
        if (memory.getAgentId() == null || memory.getAgentId().isBlank()) {
            throw new IllegalArgumentException("agent_id is required");
        }
        if (memory.getTopic() == null || memory.getTopic().isBlank()) {
            throw new IllegalArgumentException("topic is required");
        }
        validate(memory);
        if (memory.getId() == null || memory.getId().isBlank()) {
            memory.setId(UUID.randomUUID().toString());
        }
        Instant now = clock.instant();
        memory.setCreatedAt(now);
        memory.setUpdatedAt(now);
        save(memory);
        log.debug("Stored memory {} for agent {} under '{}'", memory.getId(), memory.getAgentId(),
                memory.getTopic());
        return memory;
    }

    @Override
    public Optional<Memory> get(String memoryId) {
        if (memoryId == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        return Optional.ofNullable(memoryCache.get(memoryId))
                .filter(memory -> !memory.isExpired(now));
    }

    @Override
    public Memory update(Memory memory) {
        Memory existing = memoryCache.get(memory.getId());
        if (existing == null) {
            throw new IllegalArgumentException("Memory not found: " + memory.getId());
        }
        validate(memory);
        memory.setAgentId(existing.getAgentId());
        memory.setCreatedAt(existing.getCreatedAt());
        memory.setUpdatedAt(clock.instant());
        save(memory);
        log.debug("Updated memory: {}", memory.getId());
        return memory;
    }

    @Override
    public boolean delete(String memoryId) {
        if (memoryId == null || memoryCache.remove(memoryId) == null) {
            return false;
        }
        storagePort.deleteObject(MEMORIES_DIR, memoryId + JSON_EXTENSION).join();
        log.debug("Deleted memory: {}", memoryId);
        return true;
    }

    @Override
    public List<Memory> search(MemoryQuery query) {
        String text = query.getText() != null && !query.getText().isBlank()
                ? query.getText().toLowerCase(Locale.ROOT)
                : null;
        Set<String> tags = query.getTags() != null
                ? query.getTags().stream()
                        .filter(Objects::nonNull)
                        .map(tag -> tag.strip().toLowerCase(Locale.ROOT))
                        .filter(tag -> !tag.isEmpty())
                        .collect(Collectors.toSet())
                : Set.of();
        return live(query.getAgentId())
                .filter(memory -> query.getSessionId() == null || query.getSessionId().equals(memory.getSessionId()))
                .filter(memory -> query.getTopic() == null || query.getTopic().equals(memory.getTopic()))
                .filter(memory -> query.getMemoryType() == null
                        || query.getMemoryType().equals(memory.getMemoryType()))
                .filter(memory -> query.getMinImportance() == null
                        || memory.getImportance() >= query.getMinImportance())
                .filter(memory -> text == null || containsIgnoreCase(memory.getTopic(), text)
                        || containsIgnoreCase(memory.getContent(), text))
                .filter(memory -> tags.isEmpty() || hasAnyTag(memory, tags))
                .sorted(RELEVANCE)
                .skip(Math.max(0, query.getOffset()))
                .limit(Math.max(0, query.getLimit()))
                .toList();
    }

    @Override
    public List<Memory> listByTopic(String agentId, String topic, int limit, int offset) {
        return search(MemoryQuery.builder()
                .agentId(agentId)
                .topic(topic)
                .limit(limit)
                .offset(offset)
                .build());
    }

    @Override
    public MemoryStats stats(String agentId) {
        List<Memory> memories = live(agentId).toList();
        Map<String, Integer> byType = new HashMap<>();
        Map<String, Integer> byTopic = new HashMap<>();
        long importanceSum = 0;
        Instant oldest = null;
        Instant newest = null;
        for (Memory memory : memories) {
            byType.merge(memory.getMemoryType(), 1, Integer::sum);
            byTopic.merge(memory.getTopic(), 1, Integer::sum);
            importanceSum += memory.getImportance();
            Instant created = memory.getCreatedAt();
            if (created != null) {
                oldest = oldest == null || created.isBefore(oldest) ? created : oldest;
                newest = newest == null || created.isAfter(newest) ? created : newest;
            }
        }
        Map<String, Integer> topTopics = new LinkedHashMap<>();
        byTopic.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<String, Integer>comparingByKey()))
                .limit(TOP_TOPICS)
                .forEach(entry -> topTopics.put(entry.getKey(), entry.getValue()));
        return MemoryStats.builder()
                .totalMemories(memories.size())
                .memoriesByType(byType)
                .memoriesByTopic(topTopics)
                .averageImportance(memories.isEmpty() ? 0.0 : (double) importanceSum / memories.size())
                .oldestMemory(oldest)
                .newestMemory(newest)
                .build();
    }

    @Override
    public int deleteExpired() {
        Instant now = clock.instant();
        List<String> expired = memoryCache.values().stream()
                .filter(memory -> memory.isExpired(now))
                .map(Memory::getId)
                .toList();
        int deleted = 0;
        for (String id : expired) {
            if (delete(id)) {
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public int deleteByAgent(String agentId) {
        List<String> ids = memoryCache.values().stream()
                .filter(memory -> Objects.equals(agentId, memory.getAgentId()))
                .map(Memory::getId)
                .toList();
        int deleted = 0;
        for (String id : ids) {
            if (delete(id)) {
                deleted++;
            }
        }
        if (deleted > 0) {
            log.info("Deleted {} memories of agent {}", deleted, agentId);
        }
        return deleted;
    }

    private Stream<Memory> live(String agentId) {
        Instant now = clock.instant();
        return memoryCache.values().stream()
                .filter(memory -> Objects.equals(agentId, memory.getAgentId()))
                .filter(memory -> !memory.isExpired(now));
    }

    private static void validate(Memory memory) {
        if (memory.getContent() == null || memory.getContent().isBlank()) {
            throw new IllegalArgumentException("content is required");
        }
        if (!Memory.TYPES.contains(memory.getMemoryType())) {
            throw new IllegalArgumentException("memory_type must be one of: " + String.join(", ", Memory.TYPES));
        }
        if (memory.getImportance() < Memory.MIN_IMPORTANCE || memory.getImportance() > Memory.MAX_IMPORTANCE) {
            throw new IllegalArgumentException("importance must be between " + Memory.MIN_IMPORTANCE + " and "
                    + Memory.MAX_IMPORTANCE);
        }
        if (memory.getTags() == null) {
            memory.setTags(new ArrayList<>());
        }
    }

    private static boolean containsIgnoreCase(String value, String lowerCaseNeedle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(lowerCaseNeedle);
    }

    private static boolean hasAnyTag(Memory memory, Set<String> tags) {
        return memory.getTags() != null && memory.getTags().stream()
                .filter(Objects::nonNull)
                .anyMatch(tag -> tags.contains(tag.toLowerCase(Locale.ROOT)));
    }

    private void save(Memory memory) {
        String json;
        try {
            json = objectMapper.writeValueAsString(memory);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize memory " + memory.getId(), e);
        }
        storagePort.putTextAtomic(MEMORIES_DIR, memory.getId() + JSON_EXTENSION, json).join();
        memoryCache.put(memory.getId(), memory);
    }
}

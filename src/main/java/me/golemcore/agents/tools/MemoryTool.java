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

package me.golemcore.agents.tools;

import me.golemcore.agents.domain.component.ToolComponent;
import me.golemcore.agents.domain.model.ExecutionContext;
import me.golemcore.agents.domain.model.Memory;
import me.golemcore.agents.domain.model.MemoryQuery;
import me.golemcore.agents.domain.model.MemoryStats;
import me.golemcore.agents.domain.model.ToolExample;
import me.golemcore.agents.domain.model.ToolParameter;
import me.golemcore.agents.domain.model.ToolResult;
import me.golemcore.agents.domain.model.ToolSchema;
import me.golemcore.agents.port.outbound.MemoryPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Lets an agent store and recall memories that outlive a single session.
 *
 * <p>
 * Actions: store, recall (by topic), search (by text, topic, type, tags and
 * minimum importance), update, delete and stats. Memories belong to the agent
 * of the calling turn; another agent's memory can be neither changed nor
 * deleted.
 */
@Component
@Slf4j
public class MemoryTool implements ToolComponent {

    static final String NAME = "memory";
    private static final String PARAM_ACTION = "action";
    private static final String PARAM_TOPIC = "topic";
    private static final String PARAM_CONTENT = "content";
    private static final String PARAM_MEMORY_TYPE = "memory_type";
    private static final String PARAM_IMPORTANCE = "importance";
    private static final String PARAM_TAGS = "tags";
    private static final String PARAM_QUERY = "query";
    private static final String PARAM_MEMORY_ID = "memory_id";
    private static final String PARAM_LIMIT = "limit";
    private static final String PARAM_EXPIRES_IN_DAYS = "expires_in_days";
    private static final int DEFAULT_LIMIT = 10;

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .name(NAME)
            .description("Store and recall memories for adaptive behavior and personalized interactions")
            .parameter(ToolParameter.builder()
                    .name(PARAM_ACTION)
                    .type(ToolParameter.Type.STRING)
                    .description("Action to perform: store, recall, search, update, delete, stats")
                    .required(true)
                    .enumValues(List.of("store", "recall", "search", "update", "delete", "stats"))
                    .build())
            .parameter(ToolParameter.builder()
                    .name(PARAM_TOPIC)
                    .type(ToolParameter.Type.STRING)
                    .description("Memory topic or category (required for store and recall)")
                    .build())
            .parameter(ToolParameter.builder()
                    .name(PARAM_CONTENT)
                    .type(ToolParameter.Type.STRING)
                    .description("Memory content (required for store)")
                    .build())
            .parameter(ToolParameter.builder()
                    .name(PARAM_MEMORY_TYPE)
                    .type(ToolParameter.Type.STRING)
                    .description("Type of memory: preference, fact, conversation, behavior")
                    .enumValues(Memory.TYPES)
                    .build())
            .parameter(ToolParameter.builder()
                    .name(PARAM_IMPORTANCE)
                    .type(ToolParameter.Type.NUMBER)
                    .description("Importance from 1 to 10 (default 5); the minimum importance for search")
                    .minimum((double) Memory.MIN_IMPORTANCE)
                    .maximum((double) Memory.MAX_IMPORTANCE)
                    .build())
            .parameter(ToolParameter.builder()
                    .name(PARAM_TAGS)
                    .type(ToolParameter.Type.ARRAY)
                    .description("Searchable tags for the memory")
                    .build())
            .parameter(ToolParameter.builder()
                    .name(PARAM_QUERY)
                    .type(ToolParameter.Type.STRING)
                    .description("Text to look for in topic or content (search)")
                    .build())
            .parameter(ToolParameter.builder()
                    .name(PARAM_MEMORY_ID)
                    .type(ToolParameter.Type.STRING)
                    .description("Memory id (required for update and delete)")
                    .build())
            .parameter(ToolParameter.builder()
                    .name(PARAM_LIMIT)
                    .type(ToolParameter.Type.NUMBER)
                    .description("Maximum number of results (default 10)")
                    .minimum(1.0)
                    .maximum(100.0)
                    .build())
            .parameter(ToolParameter.builder()
                    .name(PARAM_EXPIRES_IN_DAYS)
                    .type(ToolParameter.Type.NUMBER)
                    .description("Days until the memory expires (optional)")
                    .minimum(1.0)
                    .build())
            .example(new ToolExample("Store a user preference",
                    Map.of(PARAM_ACTION, "store", PARAM_TOPIC, "user_preferences",
                            PARAM_CONTENT, "User prefers brief responses and technical explanations",
                            PARAM_MEMORY_TYPE, Memory.TYPE_PREFERENCE, PARAM_IMPORTANCE, 8,
                            PARAM_TAGS, List.of("communication", "style")),
                    Map.of("memory_id", "abc-123", "message", "Memory stored successfully")))
            .example(new ToolExample("Recall memories about a topic",
                    Map.of(PARAM_ACTION, "recall", PARAM_TOPIC, "user_preferences", PARAM_LIMIT, 5),
                    Map.of("memories", List.of(), "count", 0, "topic", "user_preferences")))
            .build();

    private final MemoryPort memoryPort;
    private final Clock clock;

    public MemoryTool(MemoryPort memoryPort, Clock clock) {
        this.memoryPort = memoryPort;
        this.clock = clock;
    }

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public ToolResult execute(ExecutionContext context, Map<String, Object> input) {
        String agentId = context.getAgentId();
        if (agentId == null || agentId.isBlank()) {
            return ToolResult.failure("MISSING_AGENT", "memory is only available inside an agent session");
        }
        String action = (String) input.get(PARAM_ACTION);
        try {
            return switch (action) {
            case "store" -> store(context, input);
            case "recall" -> recall(agentId, input);
            case "search" -> search(agentId, input);
            case "update" -> update(agentId, input);
            case "delete" -> delete(agentId, input);
            case "stats" -> stats(agentId);
            default -> ToolResult.failure("UNKNOWN_ACTION", "Unknown action: " + action);
            };
        } catch (IllegalArgumentException | CompletionException e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.warn("[MemoryTool] action={} failed: {}", action, cause.getMessage());
            return ToolResult.failure(action.toUpperCase(Locale.ROOT) + "_FAILED",
                    "Memory " + action + " failed: " + cause.getMessage());
        }
    }

    private ToolResult store(ExecutionContext context, Map<String, Object> input) {
        String topic = text(input, PARAM_TOPIC);
        if (topic == null) {
            return ToolResult.failure("MISSING_TOPIC", "topic is required for store action");
        }
        String content = text(input, PARAM_CONTENT);
        if (content == null) {
            return ToolResult.failure("MISSING_CONTENT", "content is required for store action");
        }
        String memoryType = text(input, PARAM_MEMORY_TYPE);
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("tool", NAME);
        metadata.put("session_id", context.getSessionId());

        Memory memory = Memory.builder()
                .agentId(context.getAgentId())
                .sessionId(context.getSessionId())
                .topic(topic)
                .content(content)
                .memoryType(memoryType != null ? memoryType : Memory.TYPE_FACT)
                .importance(importance(input))
                .tags(tags(input))
                .metadata(metadata)
                .expiresAt(expiresAt(input))
                .build();
        Memory stored = memoryPort.create(memory);
        log.debug("[MemoryTool] Agent {} stored memory {} under '{}'", context.getAgentId(), stored.getId(), topic);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("memory_id", stored.getId());
        data.put("message", "Memory stored successfully");
        data.put(PARAM_TOPIC, topic);
        data.put(PARAM_IMPORTANCE, stored.getImportance());
        return ToolResult.success(data);
    }

    private ToolResult recall(String agentId, Map<String, Object> input) {
        String topic = text(input, PARAM_TOPIC);
        if (topic == null) {
            return ToolResult.failure("MISSING_TOPIC", "topic is required for recall action");
        }
        List<Memory> memories = memoryPort.listByTopic(agentId, topic, limit(input), 0);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("memories", describe(memories));
        data.put("count", memories.size());
        data.put(PARAM_TOPIC, topic);
        return ToolResult.success(data);
    }

    private ToolResult search(String agentId, Map<String, Object> input) {
        String query = text(input, PARAM_QUERY);
        Object minImportance = input.get(PARAM_IMPORTANCE);
        MemoryQuery memoryQuery = MemoryQuery.builder()
                .agentId(agentId)
                .text(query)
                .topic(text(input, PARAM_TOPIC))
                .memoryType(text(input, PARAM_MEMORY_TYPE))
                .minImportance(minImportance instanceof Number number ? number.intValue() : null)
                .tags(tags(input))
                .limit(limit(input))
                .build();
        List<Memory> memories = memoryPort.search(memoryQuery);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("memories", describe(memories));
        data.put("count", memories.size());
        data.put(PARAM_QUERY, query);
        return ToolResult.success(data);
    }

    private ToolResult update(String agentId, Map<String, Object> input) {
        String memoryId = text(input, PARAM_MEMORY_ID);
        if (memoryId == null) {
            return ToolResult.failure("MISSING_MEMORY_ID", "memory_id is required for update action");
        }
        Memory existing = memoryPort.get(memoryId).orElse(null);
        if (existing == null) {
            return ToolResult.failure("MEMORY_NOT_FOUND", "Memory not found");
        }
        if (!agentId.equals(existing.getAgentId())) {
            return ToolResult.failure("ACCESS_DENIED", "Cannot update memory belonging to another agent");
        }

        Memory.MemoryBuilder changed = existing.toBuilder();
        String content = text(input, PARAM_CONTENT);
        if (content != null) {
            changed.content(content);
        }
        if (input.get(PARAM_IMPORTANCE) != null) {
            changed.importance(importance(input));
        }
        if (input.get(PARAM_TAGS) != null) {
            changed.tags(tags(input));
        }
        if (input.get(PARAM_EXPIRES_IN_DAYS) != null) {
            changed.expiresAt(expiresAt(input));
        }
        Memory updated = memoryPort.update(changed.build());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("memory_id", updated.getId());
        data.put("message", "Memory updated successfully");
        return ToolResult.success(data);
    }

    private ToolResult delete(String agentId, Map<String, Object> input) {
        String memoryId = text(input, PARAM_MEMORY_ID);
        if (memoryId == null) {
            return ToolResult.failure("MISSING_MEMORY_ID", "memory_id is required for delete action");
        }
        Memory existing = memoryPort.get(memoryId).orElse(null);
        if (existing == null) {
            return ToolResult.failure("MEMORY_NOT_FOUND", "Memory not found");
        }
        if (!agentId.equals(existing.getAgentId())) {
            return ToolResult.failure("ACCESS_DENIED", "Cannot delete memory belonging to another agent");
        }
        memoryPort.delete(memoryId);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("memory_id", memoryId);
        data.put("message", "Memory deleted successfully");
        return ToolResult.success(data);
    }

    private ToolResult stats(String agentId) {
        MemoryStats stats = memoryPort.stats(agentId);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("total_memories", stats.getTotalMemories());
        data.put("memories_by_type", stats.getMemoriesByType());
        data.put("memories_by_topic", stats.getMemoriesByTopic());
        data.put("average_importance", stats.getAverageImportance());
        data.put("oldest_memory", timestamp(stats.getOldestMemory()));
        data.put("newest_memory", timestamp(stats.getNewestMemory()));
        return ToolResult.success(data);
    }

    private static List<Map<String, Object>> describe(List<Memory> memories) {
        List<Map<String, Object>> described = new ArrayList<>(memories.size());
        for (Memory memory : memories) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", memory.getId());
            entry.put(PARAM_TOPIC, memory.getTopic());
            entry.put(PARAM_CONTENT, memory.getContent());
            entry.put(PARAM_MEMORY_TYPE, memory.getMemoryType());
            entry.put(PARAM_IMPORTANCE, memory.getImportance());
            entry.put(PARAM_TAGS, memory.getTags());
            entry.put("created_at", timestamp(memory.getCreatedAt()));
            entry.put("updated_at", timestamp(memory.getUpdatedAt()));
            described.add(entry);
        }
        return described;
    }

    private static String text(Map<String, Object> input, String name) {
        Object value = input.get(name);
        if (value == null) {
            return null;
        }
        String text = value.toString().strip();
        return text.isEmpty() ? null : text;
    }

    private static int importance(Map<String, Object> input) {
        Object value = input.get(PARAM_IMPORTANCE);
        if (!(value instanceof Number number)) {
            return Memory.DEFAULT_IMPORTANCE;
        }
        int importance = number.intValue();
        return importance < Memory.MIN_IMPORTANCE || importance > Memory.MAX_IMPORTANCE
                ? Memory.DEFAULT_IMPORTANCE
                : importance;
    }

    private static int limit(Map<String, Object> input) {
        Object value = input.get(PARAM_LIMIT);
        return value instanceof Number number ? number.intValue() : DEFAULT_LIMIT;
    }

    private static List<String> tags(Map<String, Object> input) {
        Object value = input.get(PARAM_TAGS);
        List<String> tags = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object tag : list) {
                if (tag != null && !tag.toString().isBlank()) {
                    tags.add(tag.toString().strip());
                }
            }
        }
        return tags;
    }

    private Instant expiresAt(Map<String, Object> input) {
        Object value = input.get(PARAM_EXPIRES_IN_DAYS);
        if (value instanceof Number days && days.intValue() > 0) {
            return clock.instant().plus(Duration.ofDays(days.intValue()));
        }
        return null;
    }

    private static String timestamp(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}

package me.golemcore.agents.domain.system.toolloop;

import me.golemcore.agents.domain.model.LlmResponse;
import me.golemcore.agents.domain.model.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Extracts tool calls from a provider response.
 *
 * <p>
 * Sources, in order, the first non-empty one wins:
 * <ol>
 * <li>structured {@link LlmResponse#getToolCalls()}</li>
 * <li>the {@code tool_calls} metadata entry, either a list of
 * {@code {id?, function: {name, arguments}}} maps or the same as a JSON
 * string</li>
 * <li>a JSON object embedded in the assistant text, only when content fallback
 * is enabled</li>
 * </ol>
 *
 * <p>
 * Arguments that cannot be parsed do not drop the call: it is returned with
 * {@code argumentsError} set so the loop can answer it with
 * {@code INVALID_ARGUMENTS}. Every returned call has a unique id.
 */
@Slf4j
public class ToolCallParser {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final boolean contentFallback;

    public ToolCallParser(ObjectMapper objectMapper, boolean contentFallback) {
        this.objectMapper = objectMapper;
        this.contentFallback = contentFallback;
    }

    public List<Message.ToolCall> parse(LlmResponse response) {
        if (response == null) {
            return List.of();
        }

        List<Message.ToolCall> calls = new ArrayList<>();
        if (response.hasToolCalls()) {
            for (Message.ToolCall call : response.getToolCalls()) {
                calls.add(normalize(call));
            }
        }
        if (calls.isEmpty() && response.getMetadata() != null) {
            calls.addAll(fromMetadata(response.getMetadata().get(LlmResponse.METADATA_TOOL_CALLS)));
        }
        if (calls.isEmpty() && contentFallback) {
            calls.addAll(fromContent(response.getContent()));
        }
        return ensureUniqueIds(calls);
    }

    private Message.ToolCall normalize(Message.ToolCall call) {
        if (call.getArguments() != null || call.hasArgumentsError()) {
            return call;
        }
        return toolCall(call.getId(), call.getName(), call.getRawArguments());
    }

    private List<Message.ToolCall> fromMetadata(Object value) {
        if (value == null) {
            return List.of();
        }
        List<?> entries;
        if (value instanceof List<?> list) {
            entries = list;
        } else if (value instanceof String json) {
            try {
                entries = objectMapper.readValue(json, LIST_TYPE);
            } catch (JsonProcessingException e) {
                log.warn("[ToolLoop] Ignoring unparseable tool_calls metadata: {}", e.getOriginalMessage());
                return List.of();
            }
        } else {
            log.warn("[ToolLoop] Ignoring tool_calls metadata of type {}", value.getClass().getSimpleName());
            return List.of();
        }
        return fromEntries(entries);
    }

    private List<Message.ToolCall> fromContent(String content) {
        if (content == null) {
            return List.of();
        }
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return List.of();
        }

        Map<String, Object> json;
        try {
            json = objectMapper.readValue(content.substring(start, end + 1), MAP_TYPE);
        } catch (JsonProcessingException e) {
            return List.of();
        }

        Object embedded = json.get(LlmResponse.METADATA_TOOL_CALLS);
        if (embedded instanceof List<?> list) {
            return fromEntries(list);
        }
        if (json.get("name") instanceof String && json.containsKey("arguments")) {
            return fromEntries(List.of(json));
        }
        return List.of();
    }

    @SuppressWarnings("unchecked")
    private List<Message.ToolCall> fromEntries(List<?> entries) {
        List<Message.ToolCall> calls = new ArrayList<>();
        for (Object entry : entries) {
            if (!(entry instanceof Map<?, ?> map)) {
                continue;
            }
            Map<String, Object> function = map.get("function") instanceof Map<?, ?> nested
                    ? (Map<String, Object>) nested
                    : (Map<String, Object>) map;
            Object name = function.get("name");
            if (!(name instanceof String toolName) || toolName.isBlank()) {
                continue;
            }
            Object id = map.get("id");
            calls.add(toolCall(id instanceof String s ? s : null, toolName, function.get("arguments")));
        }
        return calls;
    }

    @SuppressWarnings("unchecked")
    private Message.ToolCall toolCall(String id, String name, Object arguments) {
        Message.ToolCall.ToolCallBuilder builder = Message.ToolCall.builder().id(id).name(name);
        if (arguments == null) {
            return builder.arguments(new LinkedHashMap<>()).build();
        }
        if (arguments instanceof Map<?, ?> map) {
            return builder.arguments(new LinkedHashMap<>((Map<String, Object>) map)).build();
        }
        String raw = String.valueOf(arguments);
        builder.rawArguments(raw);
        if (raw.isBlank()) {
            return builder.arguments(new LinkedHashMap<>()).build();
        }
        try {
            return builder.arguments(objectMapper.readValue(raw, MAP_TYPE)).build();
        } catch (JsonProcessingException e) {
            return builder.argumentsError(e.getOriginalMessage()).build();
        }
    }

    private List<Message.ToolCall> ensureUniqueIds(List<Message.ToolCall> calls) {
        Set<String> seen = new HashSet<>();
        for (Message.ToolCall call : calls) {
            if (call.getId() == null || call.getId().isBlank() || !seen.add(call.getId())) {
                call.setId("call_" + UUID.randomUUID().toString().substring(0, 8));
                seen.add(call.getId());
            }
        }
        return calls;
    }
}

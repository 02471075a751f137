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

package me.golemcore.agents.adapter.outbound.llm;

import me.golemcore.agents.domain.model.LlmChunk;
import me.golemcore.agents.domain.model.LlmRequest;
import me.golemcore.agents.domain.model.LlmResponse;
import me.golemcore.agents.domain.model.LlmUsage;
import me.golemcore.agents.domain.model.Message;
import me.golemcore.agents.domain.model.ToolDefinition;
import me.golemcore.agents.infrastructure.config.AgentsProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LLM adapter backed by the langchain4j library.
 *
 * <p>
 * One instance serves one provider id (openai, anthropic, mistral, grok,
 * ollama); the provider-specific model construction is supplied as a
 * {@link ChatModelFactory} by {@link LlmProvidersConfiguration}. Features:
 * <ul>
 * <li>Function calling with raw argument text passed through unparsed
 * <li>One cached model per model name and sampling setup
 * <li>Retry with exponential backoff for rate limits
 * </ul>
 *
 * @see LlmProviderAdapter
 */
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final String SCHEMA_KEY_DESCRIPTION = "description";
    private static final String TOOL_CHOICE_NONE = "none";
    private static final String TOOL_CHOICE_AUTO = "auto";
    private static final String TOOL_CHOICE_REQUIRED = "required";
    private static final Pattern RESET_SECONDS_PATTERN = Pattern.compile("\"reset_seconds\"\\s*:\\s*(\\d+)");

    private final String providerId;
    private final AgentsProperties.ProviderProperties config;
    private final AgentsProperties.LlmProperties llmProperties;
    private final boolean apiKeyRequired;
    private final ChatModelFactory modelFactory;
    private final ObjectMapper objectMapper;

    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    public Langchain4jAdapter(String providerId, AgentsProperties.ProviderProperties config,
            AgentsProperties.LlmProperties llmProperties, boolean apiKeyRequired, ChatModelFactory modelFactory,
            ObjectMapper objectMapper) {
        this.providerId = providerId;
        this.config = config;
        this.llmProperties = llmProperties;
        this.apiKeyRequired = apiKeyRequired;
        this.modelFactory = modelFactory;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getProviderId() {
        return providerId;
    }

    @Override
    public void initialize() {
        if (isAvailable()) {
            log.info("[LLM] Provider {} configured with models: {}", providerId, getSupportedModels());
        } else {
            log.debug("[LLM] Provider {} is not configured", providerId);
        }
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            if (!isAvailable()) {
                throw new LlmProviderException("Provider not configured: " + providerId
                        + ". Add agents.llm.providers." + providerId + ".api-key");
            }
            String modelName = resolveModel(request);
            ChatModel model = modelFor(modelName, request);
            ChatRequest chatRequest = ChatRequest.builder()
                    .messages(convertMessages(request))
                    .toolSpecifications(convertTools(request))
                    .build();

            int maxRetries = llmProperties.getMaxRetries();
            for (int attempt = 0; attempt <= maxRetries; attempt++) {
                try {
                    return convertResponse(model.chat(chatRequest), modelName);
                } catch (RuntimeException e) {
                    if (!isRateLimitError(e) || attempt >= maxRetries) {
                        log.error("[LLM] {} chat failed", providerId, e);
                        throw new LlmProviderException("LLM chat failed: " + e.getMessage(), e);
                    }
                    sleepBeforeRetry(e, attempt, maxRetries);
                }
            }
            throw new LlmProviderException("LLM chat failed: max retries exhausted");
        });
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return Flux.create(sink -> chat(request).whenComplete((response, error) -> {
            if (error != null) {
                sink.error(error);
                return;
            }
            sink.next(LlmChunk.builder()
                    .text(response.getContent())
                    .done(true)
                    .finishReason(response.getFinishReason())
                    .usage(response.getUsage())
                    .build());
            sink.complete();
        }));
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    @Override
    public List<String> getSupportedModels() {
        return config != null ? List.copyOf(config.getModels()) : List.of();
    }

    @Override
    public boolean isAvailable() {
        if (config == null) {
            return false;
        }
        if (apiKeyRequired) {
            return config.getApiKey() != null && !config.getApiKey().isBlank();
        }
        return config.getBaseUrl() != null && !config.getBaseUrl().isBlank();
    }

    private String resolveModel(LlmRequest request) {
        if (request.getModel() != null && !request.getModel().isBlank()) {
            return request.getModel();
        }
        List<String> configured = getSupportedModels();
        if (configured.isEmpty()) {
            throw new LlmProviderException("No model requested and no default model configured for " + providerId);
        }
        return configured.get(0);
    }

    private ChatModel modelFor(String modelName, LlmRequest request) {
        String key = modelName + "|" + request.getTemperature() + "|" + request.getMaxTokens();
        return models.computeIfAbsent(key, k -> {
            log.debug("[LLM] Creating {} model {}", providerId, modelName);
            return modelFactory.create(modelName, request.getTemperature(), request.getMaxTokens());
        });
    }

    private void sleepBeforeRetry(RuntimeException e, int attempt, int maxRetries) {
        long exponentialBackoffMs = (long) (llmProperties.getRetryBaseDelayMs()
                * Math.pow(BACKOFF_MULTIPLIER, attempt));
        long resetSeconds = extractResetSeconds(e);
        long backoffMs = resetSeconds > 0
                ? Math.max(resetSeconds * 1000 + 1000, exponentialBackoffMs)
                : exponentialBackoffMs;
        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms...", attempt + 1, maxRetries, backoffMs);
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new LlmProviderException("LLM chat interrupted during retry backoff", ie);
        }
    }

    private boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Extract reset_seconds from a rate limit error body. Returns -1 if not found.
     */
    private long extractResetSeconds(Throwable e) {
        Throwable current = e;
        while (current != null) {
            String msg = current.getMessage();
            if (msg != null) {
                Matcher matcher = RESET_SECONDS_PATTERN.matcher(msg);
                if (matcher.find()) {
                    return Long.parseLong(matcher.group(1));
                }
            }
            current = current.getCause();
        }
        return -1;
    }

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        for (Message msg : request.getMessages()) {
            String content = msg.getContent() != null ? msg.getContent() : "";
            switch (msg.getRole()) {
            case Message.ROLE_USER -> messages.add(UserMessage.from(content));
            case Message.ROLE_ASSISTANT -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(argumentsJson(tc))
                                    .build())
                            .toList();
                    messages.add(content.isEmpty()
                            ? AiMessage.from(toolRequests)
                            : AiMessage.from(content, toolRequests));
                } else {
                    messages.add(AiMessage.from(content));
                }
            }
            case Message.ROLE_TOOL -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(), msg.getToolName(), content));
            case Message.ROLE_SYSTEM -> messages.add(SystemMessage.from(content));
            default -> {
                log.warn("Unknown message role: {}, treating as user message", msg.getRole());
                messages.add(UserMessage.from(content));
            }
            }
        }
        return messages;
    }

    List<ToolSpecification> convertTools(LlmRequest request) {
        if (!request.hasTools() || TOOL_CHOICE_NONE.equals(request.getToolChoice())) {
            return Collections.emptyList();
        }
        String choice = request.getToolChoice();
        boolean named = choice != null && !choice.isBlank() && !TOOL_CHOICE_AUTO.equals(choice)
                && !TOOL_CHOICE_REQUIRED.equals(choice);
        return request.getTools().stream()
                .filter(tool -> !named || choice.equals(tool.name()))
                .map(this::convertToolDefinition)
                .toList();
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolDefinition.Function function = tool.getFunction();
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(function.getName())
                .description(function.getDescription());

        Map<String, Object> schema = function.getParameters();
        if (schema != null && schema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> properties) {
            JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
            for (Map.Entry<?, ?> entry : properties.entrySet()) {
                schemaBuilder.addProperty(String.valueOf(entry.getKey()),
                        toJsonSchemaElement((Map<String, Object>) entry.getValue()));
            }
            if (schema.get("required") instanceof List<?> required && !required.isEmpty()) {
                schemaBuilder.required(required.stream().map(String::valueOf).toList());
            }
            builder.parameters(schemaBuilder.build());
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = paramSchema.get("type") instanceof String str ? str : "string";
        String description = paramSchema.get(SCHEMA_KEY_DESCRIPTION) instanceof String str && !str.isBlank()
                ? str
                : null;

        if (paramSchema.get("enum") instanceof List<?> enumValues && !enumValues.isEmpty()) {
            return JsonEnumSchema.builder()
                    .enumValues(enumValues.stream().map(String::valueOf).toList())
                    .description(description)
                    .build();
        }

        return switch (type) {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description);
            if (paramSchema.get("items") instanceof Map<?, ?> items) {
                builder.items(toJsonSchemaElement((Map<String, Object>) items));
            } else {
                builder.items(JsonStringSchema.builder().build());
            }
            yield builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
            if (paramSchema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> nested) {
                for (Map.Entry<?, ?> entry : nested.entrySet()) {
                    builder.addProperty(String.valueOf(entry.getKey()),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            yield builder.build();
        }
        default -> JsonStringSchema.builder().description(description).build();
        };
    }

    LlmResponse convertResponse(ChatResponse response, String modelName) {
        AiMessage aiMessage = response.aiMessage();

        // Arguments stay raw here; ToolCallParser decodes them and records parse
        // failures per call.
        List<Message.ToolCall> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> Message.ToolCall.builder()
                            .id(ter.id())
                            .name(ter.name())
                            .rawArguments(ter.arguments())
                            .build())
                    .toList();
            log.trace("Parsed {} tool calls from response", toolCalls.size());
        }

        return LlmResponse.builder()
                .content(aiMessage.text())
                .toolCalls(toolCalls)
                .usage(convertUsage(response.tokenUsage()))
                .model(modelName)
                .finishReason(convertFinishReason(response.finishReason()))
                .build();
    }

    private static LlmUsage convertUsage(TokenUsage tokenUsage) {
        if (tokenUsage == null) {
            return null;
        }
        int input = tokenUsage.inputTokenCount() != null ? tokenUsage.inputTokenCount() : 0;
        int output = tokenUsage.outputTokenCount() != null ? tokenUsage.outputTokenCount() : 0;
        return LlmUsage.of(input, output);
    }

    private static String convertFinishReason(FinishReason finishReason) {
        if (finishReason == null) {
            return "stop";
        }
        return switch (finishReason) {
        case TOOL_EXECUTION -> "tool_calls";
        default -> finishReason.name().toLowerCase(Locale.ROOT);
        };
    }

    private String argumentsJson(Message.ToolCall call) {
        if (call.getArguments() == null || call.getArguments().isEmpty()) {
            return call.getRawArguments() != null ? call.getRawArguments() : "{}";
        }
        try {
            return objectMapper.writeValueAsString(call.getArguments());
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize tool arguments: {}", e.getOriginalMessage());
            return "{}";
        }
    }
}

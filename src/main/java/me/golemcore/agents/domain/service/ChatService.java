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

import me.golemcore.agents.adapter.outbound.llm.LlmProviderRegistry;
import me.golemcore.agents.domain.context.ContextStrategy;
import me.golemcore.agents.domain.context.ContextStrategyException;
import me.golemcore.agents.domain.context.ContextStrategyRegistry;
import me.golemcore.agents.domain.model.Agent;
import me.golemcore.agents.domain.model.CancellationToken;
import me.golemcore.agents.domain.model.ChatSession;
import me.golemcore.agents.domain.model.LlmChunk;
import me.golemcore.agents.domain.model.LlmRequest;
import me.golemcore.agents.domain.model.LlmResponse;
import me.golemcore.agents.domain.model.Message;
import me.golemcore.agents.domain.system.toolloop.ChatTurnRequest;
import me.golemcore.agents.domain.system.toolloop.ChatTurnResult;
import me.golemcore.agents.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.agents.domain.system.toolloop.ToolPromptBuilder;
import me.golemcore.agents.domain.system.toolloop.TurnAbortedException;
import me.golemcore.agents.domain.system.toolloop.TurnFailureCode;
import me.golemcore.agents.domain.tools.ToolRegistry;
import me.golemcore.agents.infrastructure.config.AgentsProperties;
import me.golemcore.agents.port.outbound.AgentPort;
import me.golemcore.agents.port.outbound.LlmPort;
import me.golemcore.agents.port.outbound.MessagePort;
import me.golemcore.agents.port.outbound.SessionPort;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for conversation turns on a session.
 *
 * <p>
 * Every turn persists the user message first, loads the bounded history and
 * hands the rest to the {@link ToolLoopSystem}. Plain chat runs the same loop
 * with no tools offered; streaming bypasses the loop and persists the
 * assistant answer once the provider stream completes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatService {

    static final String TOOL_CHOICE_AUTO = "auto";

    private final AgentPort agentPort;
    private final SessionPort sessionPort;
    private final MessagePort messagePort;
    private final LlmProviderRegistry providerRegistry;
    private final ToolLoopSystem toolLoopSystem;
    private final ToolRegistry toolRegistry;
    private final ToolPromptBuilder promptBuilder;
    private final ContextStrategyRegistry contextStrategies;
    private final AgentsProperties properties;

    /**
     * Options of a tool-enabled turn. A {@code null} or empty tool list offers
     * every available tool.
     */
    @Value
    @Builder
    public static class ToolChatCommand {
        String message;
        List<String> tools;
        String toolChoice;
        Double temperature;
        Integer maxTokens;
        Map<String, Object> metadata;
    }

    public record ChatOutcome(Message userMessage, ChatTurnResult turn, List<String> suggestedTools) {

        public Message assistantMessage() {
            return turn.getAssistantMessage();
        }
    }

    public ChatOutcome chat(String sessionId, String message, Map<String, Object> metadata,
            CancellationToken token) {
        Conversation conversation = open(sessionId, message, metadata);
        ChatTurnResult turn = runTurn(conversation, List.of(), null, null, null, token);
        return new ChatOutcome(conversation.userMessage(), turn, List.of());
    }

    public ChatOutcome chatWithTools(String sessionId, ToolChatCommand command, CancellationToken token) {
        Conversation conversation = open(sessionId, command.getMessage(), command.getMetadata());
        List<String> tools = command.getTools() == null || command.getTools().isEmpty()
                ? toolRegistry.listAvailable()
                : command.getTools();
        String toolChoice = command.getToolChoice() != null && !command.getToolChoice().isBlank()
                ? command.getToolChoice()
                : TOOL_CHOICE_AUTO;
        log.info("[Chat] Session {} turn with {} tool(s), tool_choice={}", sessionId, tools.size(), toolChoice);
        ChatTurnResult turn = runTurn(conversation, tools, toolChoice, command.getTemperature(),
                command.getMaxTokens(), token);
        return new ChatOutcome(conversation.userMessage(), turn, List.of());
    }

    /**
     * Tool-enabled turn over every available tool with {@code auto} choice.
     * Keyword-matched tool suggestions are returned alongside.
     */
    public ChatOutcome chatWithAutoTools(String sessionId, String message, Map<String, Object> metadata,
            CancellationToken token) {
        List<String> tools = toolRegistry.listAvailable();
        List<String> suggestions = promptBuilder.suggestTools(message, tools);
        ChatOutcome outcome = chatWithTools(sessionId, ToolChatCommand.builder()
                .message(message)
                .tools(tools)
                .toolChoice(TOOL_CHOICE_AUTO)
                .metadata(metadata)
                .build(), token);
        return new ChatOutcome(outcome.userMessage(), outcome.turn(), suggestions);
    }

    /**
     * Streams the provider answer without tools. The assistant message is
     * persisted when the stream completes; a failed or cancelled stream
     * persists nothing beyond the user message. Cancelling the token stops the
     * provider call.
     */
    public Flux<LlmChunk> stream(String sessionId, String message, Map<String, Object> metadata,
            CancellationToken token) {
        CancellationToken turnToken = token != null ? token : CancellationToken.create();
        Conversation conversation = open(sessionId, message, metadata);
        ChatSession session = conversation.session();
        Agent agent = conversation.agent();
        LlmPort provider = conversation.provider();

        ContextStrategy strategy = contextStrategies.get(session.getContextStrategy())
                .orElseThrow(() -> new TurnAbortedException(TurnFailureCode.CONTEXT_ERROR,
                        "unknown context strategy: " + session.getContextStrategy(), 0, List.of()));
        List<Message> context;
        try {
            context = strategy.buildContext(agent.getSystemPrompt(), "", conversation.history(),
                    session.getContextConfig());
        } catch (ContextStrategyException e) {
            throw new TurnAbortedException(TurnFailureCode.CONTEXT_ERROR,
                    "failed to build context: " + e.getMessage(), 0, List.of(), e);
        }

        LlmRequest request = LlmRequest.builder()
                .model(agent.getModel())
                .messages(context)
                .temperature(agent.getTemperature())
                .maxTokens(agent.getMaxTokens())
                .options(agent.getConfig() != null ? new HashMap<>(agent.getConfig()) : new HashMap<>())
                .stream(true)
                .sessionId(sessionId)
                .build();

        if (turnToken.isCancelled()) {
            throw new TurnAbortedException(TurnFailureCode.CANCELLED, "turn cancelled", 0, List.of());
        }

        Flux<LlmChunk> chunks = provider.supportsStreaming()
                ? provider.chatStream(request)
                        .doOnSubscribe(subscription -> turnToken.onCancel(subscription::cancel))
                : Mono.fromFuture(() -> {
                    CompletableFuture<LlmResponse> future = provider.chat(request);
                    turnToken.onCancel(() -> future.cancel(true));
                    return future;
                })
                        .map(response -> LlmChunk.builder()
                                .text(response.getContent())
                                .done(true)
                                .finishReason(response.getFinishReason())
                                .usage(response.getUsage())
                                .build())
                        .flux();

        StringBuilder answer = new StringBuilder();
        return chunks
                .doOnNext(chunk -> {
                    if (chunk.getText() != null) {
                        answer.append(chunk.getText());
                    }
                })
                .doOnComplete(() -> saveStreamedAnswer(conversation, answer.toString(), strategy.name(),
                        context.size()))
                .onErrorMap(e -> !(e instanceof TurnAbortedException),
                        e -> new TurnAbortedException(TurnFailureCode.PROVIDER_ERROR,
                                "LLM request failed: " + e.getMessage(), 1, List.of(), e));
    }

    private ChatTurnResult runTurn(Conversation conversation, List<String> tools, String toolChoice,
            Double temperature, Integer maxTokens, CancellationToken token) {
        ChatTurnRequest.ChatTurnRequestBuilder request = ChatTurnRequest.builder()
                .session(conversation.session())
                .agent(conversation.agent())
                .provider(conversation.provider())
                .history(conversation.history())
                .toolNames(tools)
                .toolChoice(toolChoice)
                .temperature(temperature)
                .maxTokens(maxTokens);
        if (token != null) {
            request.cancellationToken(token);
        }
        ChatTurnResult result = toolLoopSystem.processTurn(request.build());
        touchSession(conversation.session());
        return result;
    }

    private Conversation open(String sessionId, String message, Map<String, Object> metadata) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message is required");
        }
        ChatSession session = sessionPort.get(sessionId)
                .orElseThrow(() -> new NoSuchElementException("session not found: " + sessionId));
        Agent agent = agentPort.get(session.getAgentId())
                .orElseThrow(() -> new NoSuchElementException("agent not found: " + session.getAgentId()));
        if (!Agent.SUPPORTED_PROVIDERS.contains(agent.getProvider())) {
            throw new IllegalArgumentException("unsupported LLM provider: " + agent.getProvider());
        }
        LlmPort provider = providerRegistry.resolve(agent.getProvider());
        if (!provider.isAvailable()) {
            throw new TurnAbortedException(TurnFailureCode.PROVIDER_UNAVAILABLE,
                    "LLM provider " + agent.getProvider() + " is not available", 0, List.of());
        }

        Message userMessage = messagePort.append(Message.builder()
                .sessionId(sessionId)
                .role(Message.ROLE_USER)
                .content(message)
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : null)
                .build());
        List<Message> history = messagePort.listRecent(sessionId, properties.getToolLoop().getHistoryLimit());
        log.debug("[Chat] Session {} loaded {} history message(s)", sessionId, history.size());
        return new Conversation(session, agent, provider, userMessage, history);
    }

    private void saveStreamedAnswer(Conversation conversation, String answer, String strategy, int contextLength) {
        Agent agent = conversation.agent();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("provider", agent.getProvider());
        metadata.put("model", agent.getModel());
        metadata.put("context_length", contextLength);
        metadata.put("strategy", strategy);
        metadata.put("streamed", true);
        messagePort.append(Message.builder()
                .sessionId(conversation.session().getId())
                .role(Message.ROLE_ASSISTANT)
                .content(answer)
                .metadata(metadata)
                .build());
        touchSession(conversation.session());
        log.info("[Chat] Session {} streamed answer of {} chars", conversation.session().getId(), answer.length());
    }

    private void touchSession(ChatSession session) {
        try {
            sessionPort.update(session);
        } catch (IllegalArgumentException e) {
            // Session deleted while the turn was running
            log.debug("[Chat] Could not touch session {}: {}", session.getId(), e.getMessage());
        }
    }

    private record Conversation(ChatSession session, Agent agent, LlmPort provider, Message userMessage,
            List<Message> history) {
    }
}

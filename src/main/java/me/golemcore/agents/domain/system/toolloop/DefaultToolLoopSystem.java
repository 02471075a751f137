package me.golemcore.agents.domain.system.toolloop;

import me.golemcore.agents.domain.context.ContextStrategy;
import me.golemcore.agents.domain.context.ContextStrategyException;
import me.golemcore.agents.domain.context.ContextStrategyRegistry;
import me.golemcore.agents.domain.model.Agent;
import me.golemcore.agents.domain.model.CancellationToken;
import me.golemcore.agents.domain.model.ChatSession;
import me.golemcore.agents.domain.model.LlmRequest;
import me.golemcore.agents.domain.model.LlmResponse;
import me.golemcore.agents.domain.model.LlmUsage;
import me.golemcore.agents.domain.model.Message;
import me.golemcore.agents.domain.model.ToolCallResult;
import me.golemcore.agents.domain.model.ToolDefinition;
import me.golemcore.agents.domain.tools.ToolRegistry;
import me.golemcore.agents.infrastructure.config.AgentsProperties;
import me.golemcore.agents.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Tool loop orchestrator (single-turn internal loop).
 *
 * <p>
 * Each iteration builds the context through the session's strategy, calls the
 * provider and either finalizes the turn (no tool calls) or executes all
 * requested tools concurrently and feeds their results into the next
 * iteration. Tool failures are data; provider failures and the iteration bound
 * abort the turn with {@link TurnAbortedException}.
 */
public class DefaultToolLoopSystem implements ToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolLoopSystem.class);

    static final String TOOL_CHOICE_NONE = "none";
    static final String FINISH_TOOL_CALLS = "tool_calls";
    static final String FINISH_STOP = "stop";
    static final String AGENT_TYPE_KEY = "agent_type";

    private final ToolExecutorPort toolExecutor;
    private final HistoryWriter historyWriter;
    private final ToolCallParser toolCallParser;
    private final ToolPromptBuilder promptBuilder;
    private final ToolRegistry toolRegistry;
    private final ContextStrategyRegistry strategies;
    private final AgentsProperties.ToolLoopProperties settings;

    public DefaultToolLoopSystem(ToolExecutorPort toolExecutor, HistoryWriter historyWriter,
            ToolCallParser toolCallParser, ToolPromptBuilder promptBuilder, ToolRegistry toolRegistry,
            ContextStrategyRegistry strategies, AgentsProperties.ToolLoopProperties settings) {
        this.toolExecutor = toolExecutor;
        this.historyWriter = historyWriter;
        this.toolCallParser = toolCallParser;
        this.promptBuilder = promptBuilder;
        this.toolRegistry = toolRegistry;
        this.strategies = strategies;
        this.settings = settings;
    }

    @Override
    public ChatTurnResult processTurn(ChatTurnRequest request) {
        ChatSession session = request.getSession();
        Agent agent = request.getAgent();
        LlmPort provider = request.getProvider();
        CancellationToken token = request.getCancellationToken() != null
                ? request.getCancellationToken()
                : CancellationToken.create();

        int maxIterations = settings != null ? settings.getMaxIterations() : 5;
        List<String> toolNames = request.getToolNames() != null ? request.getToolNames() : List.of();
        boolean toolsPermitted = !toolNames.isEmpty() && !TOOL_CHOICE_NONE.equals(request.getToolChoice());
        List<ToolDefinition> definitions = toolsPermitted ? toolRegistry.getDefinitions(toolNames) : List.of();
        String systemPrompt = buildSystemPrompt(agent, toolsPermitted ? toolNames : List.of());

        ContextStrategy strategy = strategies.get(session.getContextStrategy())
                .orElseThrow(() -> new TurnAbortedException(TurnFailureCode.CONTEXT_ERROR,
                        "unknown context strategy: " + session.getContextStrategy(), 0, List.of()));

        ConversationWorkingSet workingSet = new ConversationWorkingSet(session.getId(), request.getHistory());
        ToolExecutorPort.TurnScope scope = new ToolExecutorPort.TurnScope(session.getId(), agent.getId(), token);
        List<ToolCallResult> allResults = new ArrayList<>();
        UsageTotals usage = new UsageTotals();

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            log.debug("[ToolLoop] Session {} iteration {}/{}", session.getId(), iteration, maxIterations);
            ensureNotCancelled(token, iteration, allResults);

            enter(session, iteration, TurnState.BUILD_CONTEXT);
            List<Message> context;
            try {
                context = strategy.buildContext(systemPrompt, "", workingSet.messages(),
                        session.getContextConfig());
            } catch (ContextStrategyException e) {
                throw new TurnAbortedException(TurnFailureCode.CONTEXT_ERROR,
                        "failed to build context: " + e.getMessage(), iteration, allResults, e);
            }

            enter(session, iteration, TurnState.CALL_PROVIDER);
            if (!provider.isAvailable()) {
                throw new TurnAbortedException(TurnFailureCode.PROVIDER_UNAVAILABLE,
                        "LLM provider " + provider.getProviderId() + " is not available", iteration, allResults);
            }
            LlmRequest llmRequest = buildRequest(request, agent, context, definitions);
            LlmResponse response = callProvider(provider, llmRequest, token, iteration, allResults);
            usage.add(response.getUsage());

            enter(session, iteration, TurnState.PARSE_RESPONSE);
            List<Message.ToolCall> toolCalls = toolCallParser.parse(response);
            Map<String, Object> metadata = baseMetadata(provider, response, context.size(), strategy.name());

            if (toolCalls.isEmpty()) {
                enter(session, iteration, TurnState.FINALIZE);
                String finishReason = finishReason(response, false);
                metadata.put("tools_available", !definitions.isEmpty());
                metadata.put("finish_reason", finishReason);
                mergeResponseMetadata(metadata, response);

                Message assistant = historyWriter.appendFinalAssistantAnswer(workingSet, response, metadata);
                List<Message> written = historyWriter.flush(workingSet);
                log.info("[ToolLoop] Session {} finished after {} iteration(s), {} tool call(s)",
                        session.getId(), iteration, allResults.size());
                return ChatTurnResult.builder()
                        .assistantMessage(assistant)
                        .toolCalls(List.copyOf(allResults))
                        .finishReason(finishReason)
                        .iterations(iteration)
                        .usage(usage.toUsage())
                        .newMessages(written)
                        .build();
            }

            enter(session, iteration, TurnState.EXECUTE_TOOLS);
            log.info("[ToolLoop] Executing {} tool call(s) for session {}", toolCalls.size(), session.getId());
            List<ToolExecutionOutcome> outcomes = toolExecutor.executeAll(scope, toolCalls);

            enter(session, iteration, TurnState.APPEND_RESULTS);
            List<Map<String, Object>> details = new ArrayList<>(outcomes.size());
            for (ToolExecutionOutcome outcome : outcomes) {
                ToolCallResult callResult = outcome.toCallResult();
                allResults.add(callResult);
                Map<String, Object> detail = new LinkedHashMap<>();
                detail.put("id", callResult.getId());
                detail.put("tool_name", callResult.getToolName());
                detail.put("success", callResult.isSuccess());
                detail.put("duration_ms", callResult.getDurationMs());
                details.add(detail);
            }
            metadata.put("tool_calls", toolCalls.size());
            metadata.put("finish_reason", FINISH_TOOL_CALLS);
            metadata.put("tool_call_details", details);

            historyWriter.appendAssistantToolCalls(workingSet, response, toolCalls, metadata);
            for (ToolExecutionOutcome outcome : outcomes) {
                historyWriter.appendToolResult(workingSet, outcome);
            }
        }

        log.warn("[ToolLoop] Session {} exceeded {} iterations", session.getId(), maxIterations);
        throw new TurnAbortedException(TurnFailureCode.MAX_ITERATIONS_EXCEEDED,
                "exceeded maximum tool call iterations", maxIterations, allResults);
    }

    private String buildSystemPrompt(Agent agent, List<String> toolNames) {
        Object agentType = agent.getConfig() != null ? agent.getConfig().get(AGENT_TYPE_KEY) : null;
        if (agentType instanceof String type && !type.isBlank() && !toolNames.isEmpty()) {
            return promptBuilder.buildAgentTypePrompt(type, toolNames, agent.getSystemPrompt());
        }
        return promptBuilder.buildSystemPrompt(agent.getSystemPrompt(), toolNames);
    }

    private LlmRequest buildRequest(ChatTurnRequest request, Agent agent, List<Message> context,
            List<ToolDefinition> definitions) {
        Map<String, Object> options = agent.getConfig() != null ? new HashMap<>(agent.getConfig()) : new HashMap<>();
        return LlmRequest.builder()
                .model(agent.getModel())
                .messages(context)
                .tools(definitions)
                .toolChoice(definitions.isEmpty() ? null : request.getToolChoice())
                .temperature(request.getTemperature() != null ? request.getTemperature() : agent.getTemperature())
                .maxTokens(request.getMaxTokens() != null ? request.getMaxTokens() : agent.getMaxTokens())
                .options(options)
                .sessionId(request.getSession().getId())
                .build();
    }

    private LlmResponse callProvider(LlmPort provider, LlmRequest request, CancellationToken token, int iteration,
            List<ToolCallResult> results) {
        try {
            CompletableFuture<LlmResponse> future = provider.chat(request);
            token.onCancel(() -> future.cancel(true));
            LlmResponse response = future.get();
            if (response == null) {
                throw new TurnAbortedException(TurnFailureCode.PROVIDER_ERROR,
                        "LLM request failed: empty response", iteration, results);
            }
            return response;
        } catch (CancellationException e) {
            throw new TurnAbortedException(TurnFailureCode.CANCELLED, "turn cancelled", iteration, results, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            throw new TurnAbortedException(TurnFailureCode.CANCELLED, "turn cancelled", iteration, results, e);
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[ToolLoop] Provider {} failed: {}", provider.getProviderId(), cause.getMessage());
            throw new TurnAbortedException(TurnFailureCode.PROVIDER_ERROR,
                    "LLM request failed: " + cause.getMessage(), iteration, results, cause);
        } catch (RuntimeException e) {
            if (e instanceof TurnAbortedException aborted) {
                throw aborted;
            }
            log.warn("[ToolLoop] Provider {} failed: {}", provider.getProviderId(), e.getMessage());
            throw new TurnAbortedException(TurnFailureCode.PROVIDER_ERROR,
                    "LLM request failed: " + e.getMessage(), iteration, results, e);
        }
    }

    private static void enter(ChatSession session, int iteration, TurnState state) {
        log.trace("[ToolLoop] Session {} iteration {} -> {}", session.getId(), iteration, state);
    }

    private void ensureNotCancelled(CancellationToken token, int iteration, List<ToolCallResult> results) {
        if (token.isCancelled()) {
            throw new TurnAbortedException(TurnFailureCode.CANCELLED, "turn cancelled", iteration, results);
        }
    }

    private Map<String, Object> baseMetadata(LlmPort provider, LlmResponse response, int contextLength,
            String strategy) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("provider", provider.getProviderId());
        metadata.put("model", response.getModel());
        metadata.put("context_length", contextLength);
        metadata.put("strategy", strategy);
        if (response.getUsage() != null) {
            Map<String, Object> usage = new LinkedHashMap<>();
            usage.put("prompt_tokens", response.getUsage().getPromptTokens());
            usage.put("completion_tokens", response.getUsage().getCompletionTokens());
            usage.put("total_tokens", response.getUsage().getTotalTokens());
            metadata.put("usage", usage);
        }
        return metadata;
    }

    private void mergeResponseMetadata(Map<String, Object> metadata, LlmResponse response) {
        if (response.getMetadata() == null) {
            return;
        }
        response.getMetadata().forEach((key, value) -> {
            if (!LlmResponse.METADATA_TOOL_CALLS.equals(key)) {
                metadata.putIfAbsent(key, value);
            }
        });
    }

    static String finishReason(LlmResponse response, boolean hasToolCalls) {
        if (hasToolCalls) {
            return FINISH_TOOL_CALLS;
        }
        if (response != null && response.getFinishReason() != null && !response.getFinishReason().isEmpty()) {
            return response.getFinishReason();
        }
        return FINISH_STOP;
    }

    private static final class UsageTotals {
        private int prompt;
        private int completion;
        private boolean seen;

        void add(LlmUsage usage) {
            if (usage != null) {
                prompt += usage.getPromptTokens();
                completion += usage.getCompletionTokens();
                seen = true;
            }
        }

        LlmUsage toUsage() {
            return seen ? LlmUsage.of(prompt, completion) : null;
        }
    }
}

package me.golemcore.agents.domain.system.toolloop;

import me.golemcore.agents.domain.model.CallInfo;
import me.golemcore.agents.domain.model.Message;
import me.golemcore.agents.domain.model.ToolErrorCode;
import me.golemcore.agents.domain.model.ToolResult;
import me.golemcore.agents.domain.tools.ToolExecutor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ToolExecutorPort} backed by {@link ToolExecutor}.
 *
 * <p>
 * Calls whose arguments could not be parsed are answered with
 * {@code INVALID_ARGUMENTS} without reaching the executor; the rest run
 * concurrently as one batch.
 */
@Slf4j
public class DefaultToolExecutor implements ToolExecutorPort {

    private final ToolExecutor toolExecutor;
    private final ObjectMapper objectMapper;

    public DefaultToolExecutor(ToolExecutor toolExecutor, ObjectMapper objectMapper) {
        this.toolExecutor = toolExecutor;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ToolExecutionOutcome> executeAll(TurnScope scope, List<Message.ToolCall> toolCalls) {
        List<CallInfo> runnable = new ArrayList<>();
        for (Message.ToolCall call : toolCalls) {
            if (!call.hasArgumentsError()) {
                runnable.add(new CallInfo(call.getName(), call.getArguments(), call.getId()));
            }
        }

        Map<String, ToolResult> results = runnable.isEmpty()
                ? Map.of()
                : toolExecutor.executeMultiple(scope.sessionId(), scope.agentId(), runnable,
                        scope.cancellationToken());

        List<ToolExecutionOutcome> outcomes = new ArrayList<>(toolCalls.size());
        for (Message.ToolCall call : toolCalls) {
            ToolResult result;
            if (call.hasArgumentsError()) {
                result = ToolResult.failure(ToolErrorCode.INVALID_ARGUMENTS,
                        "Invalid tool arguments: " + call.getArgumentsError());
            } else {
                result = results.get(call.getId());
                if (result == null) {
                    result = ToolResult.failure(ToolErrorCode.EXECUTION_ERROR, "no result for tool call");
                }
            }
            if (!result.isSuccess()) {
                log.debug("[ToolLoop] Tool '{}' ({}) failed [{}]: {}", call.getName(), call.getId(),
                        result.getErrorCode(), result.getError());
            }
            outcomes.add(new ToolExecutionOutcome(call, result, buildMessageContent(result)));
        }
        return outcomes;
    }

    private String buildMessageContent(ToolResult result) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("success", result.isSuccess());
        if (result.isSuccess()) {
            content.put("result", result.getData());
        } else {
            content.put("error", result.getError());
        }
        try {
            return objectMapper.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            log.warn("[ToolLoop] Failed to serialize tool result: {}", e.getMessage());
            return result.isSuccess()
                    ? "{\"success\":true,\"result\":" + quote(String.valueOf(result.getData())) + "}"
                    : "{\"success\":false,\"error\":" + quote(result.getError()) + "}";
        }
    }

    private String quote(String value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return "\"\"";
        }
    }
}

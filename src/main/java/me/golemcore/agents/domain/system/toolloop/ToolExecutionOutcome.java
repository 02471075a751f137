package me.golemcore.agents.domain.system.toolloop;

import me.golemcore.agents.domain.model.Message;
import me.golemcore.agents.domain.model.ToolCallResult;
import me.golemcore.agents.domain.model.ToolResult;

/**
 * Result of one tool call within a turn.
 *
 * @param toolCall
 *            the call as requested by the provider
 * @param toolResult
 *            structured result, including failures
 * @param messageContent
 *            content of the "tool" message fed back to the provider
 */
public record ToolExecutionOutcome(Message.ToolCall toolCall, ToolResult toolResult, String messageContent) {

    public String toolCallId() {
        return toolCall.getId();
    }

    public String toolName() {
        return toolCall.getName();
    }

    public ToolCallResult toCallResult() {
        return ToolCallResult.from(toolCall, toolResult);
    }
}

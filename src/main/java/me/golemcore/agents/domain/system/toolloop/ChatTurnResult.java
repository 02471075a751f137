package me.golemcore.agents.domain.system.toolloop;

import me.golemcore.agents.domain.model.LlmUsage;
import me.golemcore.agents.domain.model.Message;
import me.golemcore.agents.domain.model.ToolCallResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a completed turn.
 */
@Value
@Builder
public class ChatTurnResult {

    Message assistantMessage;
    List<ToolCallResult> toolCalls;
    String finishReason;
    int iterations;
    LlmUsage usage;

    /** Messages written by this turn, in order. */
    List<Message> newMessages;

    public String getContent() {
        return assistantMessage != null ? assistantMessage.getContent() : null;
    }
}

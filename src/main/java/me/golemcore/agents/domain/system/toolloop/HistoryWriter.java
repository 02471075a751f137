package me.golemcore.agents.domain.system.toolloop;

import me.golemcore.agents.domain.model.LlmResponse;
import me.golemcore.agents.domain.model.Message;

import java.util.List;
import java.util.Map;

/**
 * Single point of mutation for conversation history during a turn.
 *
 * <p>
 * ToolLoopSystem should not write messages directly.
 */
public interface HistoryWriter {

    Message appendAssistantToolCalls(ConversationWorkingSet workingSet, LlmResponse response,
            List<Message.ToolCall> toolCalls, Map<String, Object> metadata);

    Message appendToolResult(ConversationWorkingSet workingSet, ToolExecutionOutcome outcome);

    Message appendFinalAssistantAnswer(ConversationWorkingSet workingSet, LlmResponse response,
            Map<String, Object> metadata);

    /**
     * Persists whatever the turn has not written yet and returns it.
     */
    List<Message> flush(ConversationWorkingSet workingSet);
}

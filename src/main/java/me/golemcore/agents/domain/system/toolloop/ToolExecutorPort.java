package me.golemcore.agents.domain.system.toolloop;

import me.golemcore.agents.domain.model.CancellationToken;
import me.golemcore.agents.domain.model.Message;

import java.util.List;

/**
 * Executes the tool calls of one provider response.
 *
 * <p>
 * Returns exactly one outcome per call, in call order. Implementations must not
 * throw for tool-level failures.
 */
public interface ToolExecutorPort {

    List<ToolExecutionOutcome> executeAll(TurnScope scope, List<Message.ToolCall> toolCalls);

    /**
     * Identifies the turn a batch of calls belongs to.
     */
    record TurnScope(String sessionId, String agentId, CancellationToken cancellationToken) {
    }
}

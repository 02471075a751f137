package me.golemcore.agents.domain.system.toolloop;

import me.golemcore.agents.domain.model.Agent;
import me.golemcore.agents.domain.model.CancellationToken;
import me.golemcore.agents.domain.model.ChatSession;
import me.golemcore.agents.domain.model.Message;
import me.golemcore.agents.port.outbound.LlmPort;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Input of one tool-enabled turn. The user message is expected to be the last
 * entry of {@code history} and already persisted.
 */
@Value
@Builder
public class ChatTurnRequest {

    ChatSession session;
    Agent agent;
    LlmPort provider;
    List<Message> history;

    /** Tools offered to the provider; empty disables tool use. */
    List<String> toolNames;

    /** {@code auto}, {@code none}, {@code required} or a tool name. */
    String toolChoice;

    Double temperature;
    Integer maxTokens;

    @Builder.Default
    CancellationToken cancellationToken = CancellationToken.create();
}

package me.golemcore.agents.domain.system.toolloop;

import me.golemcore.agents.domain.model.LlmResponse;
import me.golemcore.agents.domain.model.Message;
import me.golemcore.agents.port.outbound.MessagePort;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Default writer backed by {@link MessagePort}.
 *
 * <p>
 * In atomic mode messages stay in the working set until {@link #flush}, which
 * stores them with a single {@link MessagePort#appendAll} call. Otherwise each
 * message is stored as soon as it is appended.
 */
@Slf4j
public class DefaultHistoryWriter implements HistoryWriter {

    private final MessagePort messagePort;
    private final Clock clock;
    private final boolean atomic;

    public DefaultHistoryWriter(MessagePort messagePort, Clock clock, boolean atomic) {
        this.messagePort = messagePort;
        this.clock = clock;
        this.atomic = atomic;
    }

    @Override
    public Message appendAssistantToolCalls(ConversationWorkingSet workingSet, LlmResponse response,
            List<Message.ToolCall> toolCalls, Map<String, Object> metadata) {
        Message assistant = Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(response != null ? response.getContent() : null)
                .toolCalls(toolCalls)
                .metadata(metadata)
                .build();
        return append(workingSet, assistant);
    }

    @Override
    public Message appendToolResult(ConversationWorkingSet workingSet, ToolExecutionOutcome outcome) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("tool_call_id", outcome.toolCallId());
        metadata.put("tool_result", true);

        Message toolMessage = Message.builder()
                .role(Message.ROLE_TOOL)
                .toolCallId(outcome.toolCallId())
                .toolName(outcome.toolName())
                .content(outcome.messageContent())
                .metadata(metadata)
                .build();
        return append(workingSet, toolMessage);
    }

    @Override
    public Message appendFinalAssistantAnswer(ConversationWorkingSet workingSet, LlmResponse response,
            Map<String, Object> metadata) {
        Message assistant = Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(response != null ? response.getContent() : null)
                .metadata(metadata)
                .build();
        return append(workingSet, assistant);
    }

    @Override
    public List<Message> flush(ConversationWorkingSet workingSet) {
        List<Message> pending = workingSet.drainPending();
        if (atomic && !pending.isEmpty()) {
            messagePort.appendAll(workingSet.getSessionId(), pending);
            log.debug("[ToolLoop] Flushed {} messages for session {}", pending.size(), workingSet.getSessionId());
        }
        return pending;
    }

    private Message append(ConversationWorkingSet workingSet, Message message) {
        message.setId(UUID.randomUUID().toString());
        message.setSessionId(workingSet.getSessionId());
        message.setCreatedAt(clock.instant());
        workingSet.add(message);
        if (!atomic) {
            messagePort.append(message);
        }
        return message;
    }
}

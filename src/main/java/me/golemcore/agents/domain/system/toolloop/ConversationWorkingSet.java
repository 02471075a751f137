package me.golemcore.agents.domain.system.toolloop;

import me.golemcore.agents.domain.model.Message;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-turn view of a session's conversation: persisted history followed by
 * messages produced during the turn. The latter are also kept in a pending
 * buffer until {@link HistoryWriter#flush} writes them out.
 *
 * <p>
 * Owned by one turn; not thread-safe.
 */
public class ConversationWorkingSet {

    private final String sessionId;
    private final List<Message> messages;
    private final List<Message> pending = new ArrayList<>();

    public ConversationWorkingSet(String sessionId, List<Message> history) {
        this.sessionId = sessionId;
        this.messages = new ArrayList<>(history != null ? history : List.of());
    }

    public String getSessionId() {
        return sessionId;
    }

    public List<Message> messages() {
        return Collections.unmodifiableList(messages);
    }

    public List<Message> pending() {
        return Collections.unmodifiableList(pending);
    }

    void add(Message message) {
        messages.add(message);
        pending.add(message);
    }

    List<Message> drainPending() {
        List<Message> drained = new ArrayList<>(pending);
        pending.clear();
        return drained;
    }
}

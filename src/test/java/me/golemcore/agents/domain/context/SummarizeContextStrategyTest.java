package me.golemcore.agents.domain.context;

import me.golemcore.agents.domain.model.Message;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static me.golemcore.agents.domain.context.LastNContextStrategyTest.history;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SummarizeContextStrategyTest {

    private final SummarizeContextStrategy strategy = new SummarizeContextStrategy();

    @Test
    void shouldKeepHistoryBelowThreshold() {
        List<Message> context = strategy.buildContext("S", null, history(20), Map.of());

        assertEquals(21, context.size());
    }

    @Test
    void shouldSummarizeOlderMessages() {
        List<Message> history = history(25);
        history.set(0, Message.builder().role(Message.ROLE_USER).content("I found a BUG in my code").build());
        history.set(3, Message.builder().role(Message.ROLE_ASSISTANT).content("Here is a solution").build());

        List<Message> context = strategy.buildContext("S", null, history, Map.of());

        assertEquals(7, context.size());
        assertTrue(context.get(1).isSystemMessage());
        assertEquals("Previous conversation summary: The conversation included 10 user messages and "
                + "10 assistant responses. Topics discussed: code, bug, solution.", context.get(1).getContent());
        assertEquals("m20", context.get(2).getContent());
        assertEquals("m24", context.get(6).getContent());
    }

    @Test
    void shouldOmitTopicsWhenNoneFound() {
        List<Message> context = strategy.buildContext("S", null, history(6),
                Map.of("max_context_length", 4, "keep_recent", 2));

        assertEquals(4, context.size());
        assertEquals("Previous conversation summary: The conversation included 2 user messages and "
                + "2 assistant responses.", context.get(1).getContent());
    }

    @Test
    void shouldKeepAllWhenKeepRecentCoversHistory() {
        List<Message> context = strategy.buildContext("S", null, history(6),
                Map.of("max_context_length", 4, "keep_recent", 10));

        assertEquals(7, context.size());
    }

    @Test
    void shouldRejectNonPositiveSettings() {
        assertThrows(ContextStrategyException.class,
                () -> strategy.buildContext("S", null, history(3), Map.of("keep_recent", 0)));
    }
}

package me.golemcore.agents.domain.context;

import me.golemcore.agents.domain.model.Message;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Keeps the last {@code window_size} messages plus up to {@code overlap}
 * messages preceding the window. When the window and overlap together reach
 * the start of the history, the whole history is kept.
 */
@Component
public class SlidingWindowContextStrategy implements ContextStrategy {

    public static final String NAME = "sliding_window";
    static final int DEFAULT_WINDOW_SIZE = 5;
    static final int DEFAULT_OVERLAP = 2;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Object> defaultConfig() {
        return Map.of("window_size", DEFAULT_WINDOW_SIZE, "overlap", DEFAULT_OVERLAP);
    }

    @Override
    public List<Message> buildContext(String systemPrompt, String agentPrompt, List<Message> history,
            Map<String, Object> config) {
        int windowSize = ContextSupport.intParam(config, "window_size", DEFAULT_WINDOW_SIZE);
        int overlap = ContextSupport.intParam(config, "overlap", DEFAULT_OVERLAP);
        if (windowSize <= 0) {
            throw new ContextStrategyException("window_size must be positive");
        }
        if (overlap < 0 || overlap >= windowSize) {
            throw new ContextStrategyException("overlap must be between 0 and window_size-1");
        }

        List<Message> safeHistory = history != null ? history : List.of();
        int size = safeHistory.size();

        int start = 0;
        if (size > windowSize) {
            start = size - windowSize;
            start = start > overlap ? start - overlap : 0;
        }

        List<Message> context = new ArrayList<>(size - start + 1);
        context.add(ContextSupport.systemMessage(systemPrompt, agentPrompt));
        context.addAll(safeHistory.subList(start, size));
        return context;
    }
}

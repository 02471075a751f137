package me.golemcore.agents.domain.context;

import me.golemcore.agents.domain.model.Message;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Keeps the most recent {@code count} messages.
 */
@Component
public class LastNContextStrategy implements ContextStrategy {

    public static final String NAME = "last_n";
    static final int DEFAULT_COUNT = 10;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Object> defaultConfig() {
        return Map.of("count", DEFAULT_COUNT);
    }

    @Override
    public List<Message> buildContext(String systemPrompt, String agentPrompt, List<Message> history,
            Map<String, Object> config) {
        int count = ContextSupport.intParam(config, "count", DEFAULT_COUNT);
        if (count <= 0) {
            throw new ContextStrategyException("count must be positive");
        }

        List<Message> safeHistory = history != null ? history : List.of();
        int start = Math.max(0, safeHistory.size() - count);

        List<Message> context = new ArrayList<>(safeHistory.size() - start + 1);
        context.add(ContextSupport.systemMessage(systemPrompt, agentPrompt));
        context.addAll(safeHistory.subList(start, safeHistory.size()));
        return context;
    }
}

package me.golemcore.agents.domain.context;

import me.golemcore.agents.domain.model.Message;

import java.util.Map;

final class ContextSupport {

    static final String DEFAULT_SYSTEM_PROMPT = "You are a helpful AI assistant.";

    private ContextSupport() {
    }

    static Message systemMessage(String systemPrompt, String agentPrompt) {
        return Message.system(joinPrompts(systemPrompt, agentPrompt));
    }

    static String joinPrompts(String systemPrompt, String agentPrompt) {
        boolean hasSystem = systemPrompt != null && !systemPrompt.isEmpty();
        boolean hasAgent = agentPrompt != null && !agentPrompt.isEmpty();
        if (!hasSystem && !hasAgent) {
            return DEFAULT_SYSTEM_PROMPT;
        }
        if (!hasSystem) {
            return agentPrompt;
        }
        if (!hasAgent) {
            return systemPrompt;
        }
        return systemPrompt + "\n\n" + agentPrompt;
    }

    /**
     * Reads an integer setting. Accepts any {@link Number} (truncated) or a
     * numeric string.
     */
    static int intParam(Map<String, Object> config, String key, int defaultValue) {
        if (config == null) {
            return defaultValue;
        }
        Object value = config.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String str) {
            try {
                return (int) Double.parseDouble(str.trim());
            } catch (NumberFormatException e) {
                throw new ContextStrategyException(key + " must be a number", e);
            }
        }
        throw new ContextStrategyException(key + " must be a number");
    }
}

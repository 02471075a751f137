package me.golemcore.agents.domain.context;

import me.golemcore.agents.domain.model.Message;

import java.util.List;
import java.util.Map;

/**
 * Selects which part of a session's history is sent to the provider.
 *
 * <p>
 * Implementations are stateless and never modify the history list. The
 * returned list always starts with one synthesized system message built from
 * the system and agent prompts.
 */
public interface ContextStrategy {

    String name();

    /**
     * Configuration used when a session does not override a key.
     */
    Map<String, Object> defaultConfig();

    /**
     * @throws ContextStrategyException
     *             if the config holds an invalid value
     */
    List<Message> buildContext(String systemPrompt, String agentPrompt, List<Message> history,
            Map<String, Object> config);
}

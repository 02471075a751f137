package me.golemcore.agents.domain.context;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Resolves context strategies by name.
 */
@Component
@Slf4j
public class ContextStrategyRegistry {

    private final Map<String, ContextStrategy> strategies = new TreeMap<>();

    public ContextStrategyRegistry(List<ContextStrategy> strategies) {
        for (ContextStrategy strategy : strategies) {
            this.strategies.put(strategy.name(), strategy);
        }
        log.debug("[Context] Strategies: {}", this.strategies.keySet());
    }

    public Optional<ContextStrategy> get(String name) {
        return Optional.ofNullable(name != null ? strategies.get(name) : null);
    }

    /**
     * @throws ContextStrategyException
     *             if no strategy has the given name
     */
    public ContextStrategy require(String name) {
        return get(name).orElseThrow(() -> new ContextStrategyException("unknown context strategy: " + name));
    }

    public List<String> list() {
        return new ArrayList<>(strategies.keySet());
    }

    /**
     * Default configuration of every strategy, keyed by strategy name.
     */
    public Map<String, Map<String, Object>> defaultConfigs() {
        Map<String, Map<String, Object>> configs = new LinkedHashMap<>();
        strategies.forEach((name, strategy) -> configs.put(name, strategy.defaultConfig()));
        return configs;
    }
}

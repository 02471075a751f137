package me.golemcore.agents.domain.context;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContextStrategyRegistryTest {

    private final ContextStrategyRegistry registry = new ContextStrategyRegistry(List.of(
            new SummarizeContextStrategy(), new LastNContextStrategy(), new SlidingWindowContextStrategy()));

    @Test
    void shouldListStrategiesByName() {
        assertEquals(List.of("last_n", "sliding_window", "summarize"), registry.list());
    }

    @Test
    void shouldResolveKnownAndRejectUnknown() {
        assertTrue(registry.get("last_n").isPresent());
        assertTrue(registry.get(null).isEmpty());
        ContextStrategyException e = assertThrows(ContextStrategyException.class, () -> registry.require("fancy"));
        assertEquals("unknown context strategy: fancy", e.getMessage());
    }

    @Test
    void shouldExposeDefaultConfigs() {
        assertEquals(10, registry.defaultConfigs().get("last_n").get("count"));
        assertEquals(2, registry.defaultConfigs().get("sliding_window").get("overlap"));
    }
}

package me.golemcore.agents.domain.system.toolloop;

import me.golemcore.agents.domain.context.ContextStrategyRegistry;
import me.golemcore.agents.domain.tools.ToolExecutor;
import me.golemcore.agents.domain.tools.ToolRegistry;
import me.golemcore.agents.infrastructure.config.AgentsProperties;
import me.golemcore.agents.port.outbound.MessagePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/** Spring wiring for ToolLoopSystem (domain orchestrator + ports). */
@Configuration
public class ToolLoopConfiguration {

    @Bean
    public ToolExecutorPort toolExecutorPort(ToolExecutor toolExecutor, ObjectMapper objectMapper) {
        return new DefaultToolExecutor(toolExecutor, objectMapper);
    }

    @Bean
    public HistoryWriter toolLoopHistoryWriter(MessagePort messagePort, Clock clock, AgentsProperties properties) {
        return new DefaultHistoryWriter(messagePort, clock, properties.getToolLoop().isAtomicHistory());
    }

    @Bean
    public ToolCallParser toolCallParser(ObjectMapper objectMapper, AgentsProperties properties) {
        return new ToolCallParser(objectMapper, properties.getToolLoop().isContentFallback());
    }

    @Bean
    public ToolPromptBuilder toolPromptBuilder(ToolRegistry toolRegistry) {
        return new ToolPromptBuilder(toolRegistry);
    }

    @Bean
    public ToolLoopSystem toolLoopSystem(ToolExecutorPort toolExecutorPort, HistoryWriter historyWriter,
            ToolCallParser toolCallParser, ToolPromptBuilder toolPromptBuilder, ToolRegistry toolRegistry,
            ContextStrategyRegistry contextStrategyRegistry, AgentsProperties properties) {
        return new DefaultToolLoopSystem(toolExecutorPort, historyWriter, toolCallParser, toolPromptBuilder,
                toolRegistry, contextStrategyRegistry, properties.getToolLoop());
    }
}

package me.golemcore.agents.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.agents.domain.component.ToolComponent;
import me.golemcore.agents.domain.model.ToolDefinition;
import me.golemcore.agents.domain.model.ToolInfo;
import me.golemcore.agents.domain.model.ToolResult;
import me.golemcore.agents.domain.model.ToolTestReport;
import me.golemcore.agents.domain.model.ToolUsageStats;
import me.golemcore.agents.domain.tools.ToolExecutor;
import me.golemcore.agents.domain.tools.ToolRegistry;
import me.golemcore.agents.domain.tools.ValidationException;
import me.golemcore.agents.infrastructure.config.AgentsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read and diagnostic operations over the tool registry: catalogue listing,
 * provider definitions, test runs, direct execution and usage stats.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToolCatalogService {

    static final String TEST_SESSION_ID = "test-session";
    static final String DIRECT_SESSION_ID = "direct-execution";

    private final ToolRegistry toolRegistry;
    private final ToolExecutor toolExecutor;
    private final ToolUsageTracker usageTracker;
    private final AgentsProperties properties;

    public List<ToolInfo> listTools() {
        return toolRegistry.list().stream()
                .map(toolRegistry::get)
                .flatMap(Optional::stream)
                .map(ToolCatalogService::toInfo)
                .toList();
    }

    public Optional<ToolInfo> getTool(String toolName) {
        return toolRegistry.get(toolName).map(ToolCatalogService::toInfo);
    }

    /**
     * Provider definitions for the named tools, or for every tool when none
     * are named. Unknown and unavailable tools are left out.
     */
    public List<ToolDefinition> getDefinitions(List<String> toolNames) {
        List<String> names = toolNames == null || toolNames.isEmpty() ? toolRegistry.list() : toolNames;
        List<String> available = names.stream()
                .filter(name -> toolRegistry.get(name).map(ToolComponent::isAvailable).orElse(false))
                .toList();
        return toolRegistry.getDefinitions(available);
    }

    /**
     * Runs a tool outside any session. Schema violations are reported per
     * parameter without running the tool body.
     */
    public ToolTestReport testTool(String toolName, Map<String, Object> arguments, Integer timeoutSeconds) {
        Map<String, Object> input = arguments != null ? arguments : Map.of();
        Optional<ToolComponent> tool = toolRegistry.get(toolName);
        if (tool.isPresent()) {
            try {
                tool.get().validate(input);
            } catch (ValidationException e) {
                return ToolTestReport.builder()
                        .success(false)
                        .error(e.getMessage())
                        .errorCode("VALIDATION_ERROR")
                        .validationErrors(List.of(new ToolTestReport.ValidationIssue(e.getParameter(),
                                e.getReason(), e.getValue() != null ? String.valueOf(e.getValue()) : null)))
                        .build();
            }
        }

        Duration timeout = timeoutSeconds != null && timeoutSeconds > 0
                ? Duration.ofSeconds(timeoutSeconds)
                : Duration.ofMillis(properties.getTools().getTestTimeoutMs());
        log.debug("[Tools] Test run of '{}' with timeout {}", toolName, timeout);
        ToolResult result = toolExecutor.withTimeout(timeout).execute(toolName, TEST_SESSION_ID, input);
        return ToolTestReport.builder()
                .success(result.isSuccess())
                .result(result.getData())
                .error(result.getError())
                .errorCode(result.getErrorCode())
                .durationMs(result.getDurationMs())
                .build();
    }

    public ToolResult execute(String toolName, Map<String, Object> arguments) {
        return toolExecutor.execute(toolName, DIRECT_SESSION_ID, arguments != null ? arguments : Map.of());
    }

    /**
     * Usage stats for one tool, or for every registered tool when
     * {@code toolName} is blank. Unknown tools yield an empty list.
     */
    public List<ToolUsageStats> stats(String toolName) {
        if (toolName != null && !toolName.isBlank()) {
            return toolRegistry.get(toolName).isPresent()
                    ? List.of(usageTracker.statsFor(toolName))
                    : List.of();
        }
        return toolRegistry.list().stream()
                .map(usageTracker::statsFor)
                .toList();
    }

    private static ToolInfo toInfo(ToolComponent tool) {
        return ToolInfo.from(tool.getSchema(), tool.isAvailable(), inferCategory(tool.getName()));
    }

    static String inferCategory(String toolName) {
        String name = toolName.toLowerCase(Locale.ROOT);
        if (name.contains("http") || name.contains("web") || name.contains("scraper")) {
            return "web";
        }
        if (name.contains("mcp")) {
            return "proxy";
        }
        if (name.contains("calculator") || name.contains("math")) {
            return "math";
        }
        if (name.contains("text") || name.contains("json")) {
            return "text";
        }
        if (name.contains("memory")) {
            return "memory";
        }
        return "utility";
    }
}

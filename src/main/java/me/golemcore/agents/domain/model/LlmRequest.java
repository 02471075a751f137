package me.golemcore.agents.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider-neutral chat request. The message list is already bounded by a
 * context strategy and starts with the system message.
 */
@Data
@Builder
public class LlmRequest {

    private String model;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private List<ToolDefinition> tools = new ArrayList<>();

    /**
     * "auto", "none" or the name of a specific tool.
     */
    private String toolChoice;

    @Builder.Default
    private double temperature = Agent.DEFAULT_TEMPERATURE;

    private Integer maxTokens;

    @Builder.Default
    private boolean stream = false;

    /**
     * Agent-level provider options passed through as-is.
     */
    @Builder.Default
    private Map<String, Object> options = new HashMap<>();

    private String sessionId;

    public boolean hasTools() {
        return tools != null && !tools.isEmpty();
    }
}

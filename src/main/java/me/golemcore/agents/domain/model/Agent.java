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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * An LLM configuration plus a system prompt that sessions converse with.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Agent {

    public static final List<String> SUPPORTED_PROVIDERS = List.of("openai", "anthropic", "mistral", "grok",
            "ollama");
    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final int DEFAULT_MAX_TOKENS = 1000;

    private String id;
    private String name;
    private String description;
    private String provider;
    private String model;
    private String systemPrompt;

    @Builder.Default
    private double temperature = DEFAULT_TEMPERATURE;

    @Builder.Default
    private int maxTokens = DEFAULT_MAX_TOKENS;

    @Builder.Default
    private Map<String, Object> config = new HashMap<>();

    private Instant createdAt;
    private Instant updatedAt;
}

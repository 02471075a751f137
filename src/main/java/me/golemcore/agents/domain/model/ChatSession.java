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
import java.util.Map;

/**
 * Conversation between a caller and one agent. The context strategy and its
 * configuration decide how the session's history is bounded before each
 * provider call.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChatSession {

    public static final String DEFAULT_CONTEXT_STRATEGY = "last_n";

    private String id;
    private String agentId;
    private String title;

    @Builder.Default
    private String contextStrategy = DEFAULT_CONTEXT_STRATEGY;

    @Builder.Default
    private Map<String, Object> contextConfig = new HashMap<>();

    private Instant createdAt;
    private Instant updatedAt;
}

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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Long-lived note an agent keeps across sessions: a user preference, a fact, a
 * conversation summary or an observed behavior. Importance runs from 1 to 10.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Memory {

    public static final String TYPE_PREFERENCE = "preference";
    public static final String TYPE_FACT = "fact";
    public static final String TYPE_CONVERSATION = "conversation";
    public static final String TYPE_BEHAVIOR = "behavior";
    public static final List<String> TYPES = List.of(TYPE_PREFERENCE, TYPE_FACT, TYPE_CONVERSATION, TYPE_BEHAVIOR);

    public static final int MIN_IMPORTANCE = 1;
    public static final int MAX_IMPORTANCE = 10;
    public static final int DEFAULT_IMPORTANCE = 5;

    private String id;
    private String agentId;
    private String sessionId;
    private String topic;
    private String content;

    @Builder.Default
    private String memoryType = TYPE_FACT;

    @Builder.Default
    private int importance = DEFAULT_IMPORTANCE;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    private Instant createdAt;
    private Instant updatedAt;
    private Instant expiresAt;

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}

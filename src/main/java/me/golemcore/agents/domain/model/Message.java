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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A single entry of a session's conversation history. Messages are append-only:
 * once persisted they are never edited, only listed or deleted together with
 * their session.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    private String id;
    private String sessionId;
    private String role; // system, user, assistant, tool
    private String content;

    private List<ToolCall> toolCalls;
    private String toolCallId; // For tool result messages
    private String toolName; // Tool name for tool result messages

    private Map<String, Object> metadata;
    private Instant createdAt;

    public static Message system(String content) {
        return Message.builder().role(ROLE_SYSTEM).content(content).build();
    }

    @JsonIgnore
    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    @JsonIgnore
    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    @JsonIgnore
    public boolean isSystemMessage() {
        return ROLE_SYSTEM.equals(role);
    }

    @JsonIgnore
    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    /**
     * Checks if this message carries tool calls requested by the model.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * Function call requested by the model. Arguments are kept both parsed and
     * raw: when the provider sends malformed JSON, {@code arguments} is empty and
     * {@code argumentsError} describes the parse failure.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;
        private String rawArguments;
        private String argumentsError;

        public boolean hasArgumentsError() {
            return argumentsError != null;
        }
    }
}

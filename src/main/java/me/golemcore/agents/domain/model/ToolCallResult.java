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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-call summary of a tool invocation requested by the model, returned to
 * the caller alongside the final answer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolCallResult {

    private String id;
    private String toolName;
    private boolean success;
    private Object result;
    private String error;
    private String errorCode;
    private long durationMs;

    public static ToolCallResult from(Message.ToolCall call, ToolResult result) {
        return ToolCallResult.builder()
                .id(call.getId())
                .toolName(call.getName())
                .success(result.isSuccess())
                .result(result.getData())
                .error(result.getError())
                .errorCode(result.getErrorCode())
                .durationMs(result.getDurationMs())
                .build();
    }
}

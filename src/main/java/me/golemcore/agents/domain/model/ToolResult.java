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
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Map;

/**
 * Outcome of one tool invocation: success flag, opaque payload, error message
 * and code, metadata and elapsed wall-clock time. Results are immutable; the
 * executor stamps the duration through {@link #withDurationMs(long)}.
 *
 * <p>
 * Serialized as {@code {success, data, error, error_code, metadata,
 * duration_ms}} with absent fields omitted.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "success", "data", "error", "error_code", "metadata", "duration_ms" })
public class ToolResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    @JsonProperty("success")
    boolean success;

    @JsonProperty("data")
    Object data;

    @JsonProperty("error")
    String error;

    @JsonProperty("error_code")
    String errorCode;

    @JsonProperty("metadata")
    Map<String, Object> metadata;

    @With
    @JsonProperty("duration_ms")
    long durationMs;

    public static ToolResult success(Object data) {
        return ToolResult.builder()
                .success(true)
                .data(data)
                .build();
    }

    public static ToolResult success(Object data, Map<String, Object> metadata) {
        return ToolResult.builder()
                .success(true)
                .data(data)
                .metadata(metadata)
                .build();
    }

    public static ToolResult failure(ToolErrorCode code, String error) {
        return failure(code.name(), error);
    }

    public static ToolResult failure(String code, String error) {
        return ToolResult.builder()
                .success(false)
                .errorCode(code)
                .error(error)
                .build();
    }

    public static ToolResult failure(ToolErrorCode code, String error, Map<String, Object> metadata) {
        return ToolResult.builder()
                .success(false)
                .errorCode(code.name())
                .error(error)
                .metadata(metadata)
                .build();
    }

    @JsonIgnore
    public boolean hasErrorCode(ToolErrorCode code) {
        return code.name().equals(errorCode);
    }
}

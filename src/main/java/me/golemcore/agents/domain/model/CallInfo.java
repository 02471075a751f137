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
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * One entry of a batched tool execution. The call id correlates the request
 * with its result.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CallInfo(
        @JsonProperty("tool_name") String toolName,
        @JsonProperty("arguments") Map<String, Object> arguments,
        @JsonProperty("call_id") String callId) {
}

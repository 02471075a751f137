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
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a diagnostic tool run. Schema violations are reported per
 * parameter instead of as a flat error string.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolTestReport {

    boolean success;
    Object result;
    String error;
    String errorCode;
    long durationMs;
    List<ValidationIssue> validationErrors;

    public record ValidationIssue(String parameter, String message, String value) {
    }
}

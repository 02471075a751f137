package me.golemcore.agents.domain.tools;

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

import lombok.Getter;

/**
 * Input rejected by a tool's schema: missing, unknown, or malformed
 * parameter.
 */
@Getter
public class ValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String parameter;
    private final String reason;
    private final transient Object value;

    public ValidationException(String parameter, String reason, Object value) {
        super("validation error for parameter '" + parameter + "': " + reason);
        this.parameter = parameter;
        this.reason = reason;
        this.value = value;
    }
}

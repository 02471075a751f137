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

import me.golemcore.agents.domain.model.ToolErrorCode;
import lombok.Getter;

/**
 * Tool-specific failure raised from a tool body. The executor converts it into
 * a failed result carrying {@link #getCode()}.
 */
@Getter
public class ToolExecutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String toolName;
    private final String code;
    private final String detail;

    public ToolExecutionException(String toolName, String code, String detail) {
        this(toolName, code, detail, null);
    }

    public ToolExecutionException(String toolName, String code, String detail, Throwable cause) {
        super(format(toolName, code, detail, cause), cause);
        this.toolName = toolName;
        this.code = code != null ? code : ToolErrorCode.EXECUTION_ERROR.name();
        this.detail = detail;
    }

    private static String format(String toolName, String code, String detail, Throwable cause) {
        String base = "tool '" + toolName + "' execution failed [" + code + "]: " + detail;
        if (cause != null) {
            return base + " (caused by: " + cause.getMessage() + ")";
        }
        return base;
    }
}

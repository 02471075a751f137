package me.golemcore.agents.domain.component;

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

import me.golemcore.agents.domain.model.ExecutionContext;
import me.golemcore.agents.domain.model.ToolResult;
import me.golemcore.agents.domain.model.ToolSchema;
import me.golemcore.agents.domain.tools.SchemaValidator;
import me.golemcore.agents.domain.tools.ValidationException;

import java.util.Map;

/**
 * Component representing an executable tool that can be invoked by the model.
 * Tools describe their parameter contract through a {@link ToolSchema} and
 * implement the execution logic. Examples include CalculatorTool,
 * HttpGetTool and JsonProcessorTool.
 *
 * <p>
 * The executor validates and sanitizes input before calling
 * {@link #execute}, so tool bodies always receive canonical types: numbers as
 * {@link Double}, booleans as {@link Boolean}, defaults filled in.
 */
public interface ToolComponent {

    /**
     * Returns the unique name of this tool.
     */
    default String getName() {
        return getSchema().getName();
    }

    /**
     * Returns the parameter contract of this tool.
     */
    ToolSchema getSchema();

    /**
     * Checks the input against the schema. Tools with cross-parameter rules
     * override this and call the default first.
     *
     * @throws ValidationException
     *             on the first violation
     */
    default void validate(Map<String, Object> input) {
        SchemaValidator.validate(getSchema(), input);
    }

    /**
     * Executes the tool with sanitized input. Failures are reported through
     * {@link ToolResult#failure}; unexpected exceptions are contained by the
     * executor.
     *
     * @param context
     *            per-call context with deadline and cancellation
     * @param input
     *            sanitized parameters
     * @return the tool result
     */
    ToolResult execute(ExecutionContext context, Map<String, Object> input);

    /**
     * Whether the tool can currently be used (e.g., its backend is configured).
     */
    default boolean isAvailable() {
        return true;
    }
}

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

/**
 * Error codes produced by the tool execution pipeline itself. Tools may report
 * their own domain codes (for example {@code INVALID_JSON}) through
 * {@link ToolResult#failure(String, String)}.
 */
public enum ToolErrorCode {

    /** Input rejected by the schema validator; the tool body never ran. */
    VALIDATION_ERROR,

    /** The tool body reported a failure. */
    EXECUTION_ERROR,

    /** The model sent tool-call arguments that could not be parsed. */
    INVALID_ARGUMENTS,

    TOOL_NOT_FOUND,

    TOOL_UNAVAILABLE,

    /** Deadline elapsed before the tool body completed. */
    TIMEOUT,

    /** The tool body threw an unexpected exception or error. */
    PANIC,

    /** The tool body completed without producing a result. */
    NIL_RESULT,

    /** The turn was cancelled while the tool was running. */
    CANCELLED
}

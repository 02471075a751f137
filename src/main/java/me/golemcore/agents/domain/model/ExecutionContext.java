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

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Per-invocation context handed to a tool body. Created fresh for every call
 * and never persisted.
 *
 * <p>
 * Long-running tools should poll {@link #isCancelled()} (or react to thread
 * interruption): the executor cancels the context when the deadline passes or
 * the owning turn is cancelled.
 */
@Value
@Builder
public class ExecutionContext {

    String sessionId;
    String agentId;
    String requestId;
    Duration timeout;
    Instant deadline;
    Map<String, Object> metadata;

    @Builder.Default
    CancellationToken cancellationToken = CancellationToken.create();

    public boolean isCancelled() {
        return cancellationToken.isCancelled() || Thread.currentThread().isInterrupted();
    }

    /**
     * Time left until the deadline, never negative.
     */
    public Duration remaining(Instant now) {
        if (deadline == null) {
            return timeout;
        }
        Duration left = Duration.between(now, deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }
}

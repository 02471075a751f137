package me.golemcore.agents.domain.service;

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

import me.golemcore.agents.domain.model.ToolResult;
import me.golemcore.agents.domain.model.ToolUsageStats;
import me.golemcore.agents.domain.tools.ToolExecutionListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory per-tool call counters fed by the tool executor. Counters reset on
 * restart.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ToolUsageTracker implements ToolExecutionListener {

    private final Clock clock;

    private final Map<String, Counters> counters = new ConcurrentHashMap<>();

    @Override
    public void onToolExecuted(String toolName, ToolResult result) {
        Counters entry = counters.computeIfAbsent(toolName, name -> new Counters());
        entry.total.incrementAndGet();
        if (result.isSuccess()) {
            entry.successful.incrementAndGet();
        } else {
            entry.failed.incrementAndGet();
        }
        entry.durationMs.addAndGet(result.getDurationMs());
        entry.lastUsed.set(clock.instant());
        log.trace("[Tools] Recorded {} call (success: {})", toolName, result.isSuccess());
    }

    public ToolUsageStats statsFor(String toolName) {
        Counters entry = counters.get(toolName);
        if (entry == null) {
            return ToolUsageStats.builder().toolName(toolName).build();
        }
        long total = entry.total.get();
        return ToolUsageStats.builder()
                .toolName(toolName)
                .totalCalls(total)
                .successfulCalls(entry.successful.get())
                .failedCalls(entry.failed.get())
                .avgDurationMs(total > 0 ? (double) entry.durationMs.get() / total : 0)
                .lastUsed(entry.lastUsed.get())
                .build();
    }

    private static final class Counters {
        private final AtomicLong total = new AtomicLong();
        private final AtomicLong successful = new AtomicLong();
        private final AtomicLong failed = new AtomicLong();
        private final AtomicLong durationMs = new AtomicLong();
        private final AtomicReference<Instant> lastUsed = new AtomicReference<>();
    }
}

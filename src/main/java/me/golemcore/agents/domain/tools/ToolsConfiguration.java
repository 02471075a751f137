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

import me.golemcore.agents.domain.component.ToolComponent;
import me.golemcore.agents.infrastructure.config.AgentsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/** Spring wiring for the tool registry, worker pool and executor. */
@Configuration
@Slf4j
public class ToolsConfiguration {

    private static final long IDLE_KEEP_ALIVE_SECONDS = 60;

    @Bean
    public ToolRegistry toolRegistry(List<ToolComponent> tools) {
        ToolRegistry registry = new ToolRegistry();
        for (ToolComponent tool : tools) {
            registry.register(tool);
        }
        registry.seal();
        return registry;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService toolWorkerPool(AgentsProperties properties) {
        int coreThreads = Math.max(1, properties.getTools().getWorkerThreads());
        log.debug("[Tools] Worker pool keeps {} idle thread(s)", coreThreads);
        return newWorkerPool(coreThreads);
    }

    /**
     * Pool that never queues a tool body. Abandoned bodies that ignore
     * interruption keep their thread, so a queue would make unrelated calls wait
     * behind them; each submission gets an idle or a fresh thread instead.
     */
    static ExecutorService newWorkerPool(int coreThreads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "tool-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new ThreadPoolExecutor(coreThreads, Integer.MAX_VALUE, IDLE_KEEP_ALIVE_SECONDS, TimeUnit.SECONDS,
                new SynchronousQueue<>(), factory);
    }

    @Bean
    public ToolExecutor toolExecutor(ToolRegistry toolRegistry, ExecutorService toolWorkerPool, Clock clock,
            AgentsProperties properties, List<ToolExecutionListener> listeners) {
        return new ToolExecutor(toolRegistry, toolWorkerPool, clock,
                Duration.ofMillis(properties.getTools().getTimeoutMs()), listeners);
    }
}

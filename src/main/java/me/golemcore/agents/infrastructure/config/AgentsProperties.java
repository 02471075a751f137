package me.golemcore.agents.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties bound from {@code agents.*} in
 * application.properties.
 *
 * <p>
 * Groups:
 * <ul>
 * <li>{@link LlmProperties} - provider credentials and request settings</li>
 * <li>{@link StorageProperties} - local persistence root</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * <li>{@link ToolsProperties} - tool timeouts and worker pool</li>
 * <li>{@link ToolLoopProperties} - conversation orchestrator behavior</li>
 * <li>{@link ContextProperties} - default context strategy</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "agents")
@Data
public class AgentsProperties {

    private LlmProperties llm = new LlmProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private ToolsProperties tools = new ToolsProperties();
    private ToolLoopProperties toolLoop = new ToolLoopProperties();
    private ContextProperties context = new ContextProperties();

    @Data
    public static class LlmProperties {
        private long requestTimeoutMs = 300000;
        private int maxRetries = 3;
        private long retryBaseDelayMs = 2000;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;

        /**
         * Models served by this provider. The first one is used when an agent
         * names no model.
         */
        private List<String> models = new ArrayList<>();
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/agents";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private long timeoutMs = 60000;
        private long testTimeoutMs = 30000;
        private int workerThreads = 8;
    }

    @Data
    public static class ToolLoopProperties {
        private int maxIterations = 5;

        /**
         * Buffer messages produced during a turn and persist them in a single
         * write when the turn completes. When false, every message is written as
         * soon as it is produced.
         */
        private boolean atomicHistory = true;

        /**
         * Scan assistant text for JSON tool calls when the provider returned no
         * structured calls. Off by default: it can mistake quoted JSON for a call.
         */
        private boolean contentFallback = false;

        private int historyLimit = 1000;
    }

    @Data
    public static class ContextProperties {
        private String defaultStrategy = "last_n";
    }
}

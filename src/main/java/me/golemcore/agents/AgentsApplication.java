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

package me.golemcore.agents;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the agent server.
 *
 * <p>
 * Hosts LLM-backed agents that converse in persistent sessions and call tools
 * through a bounded tool-call loop.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Multi-LLM Support</b> - OpenAI, Anthropic, Ollama and
 * OpenAI-compatible endpoints via langchain4j</li>
 * <li><b>Tool Orchestration</b> - schema-validated tools with per-call
 * deadlines, cancellation and panic containment</li>
 * <li><b>Context Management</b> - last_n, sliding_window and summarize
 * strategies per session</li>
 * <li><b>Built-in Tools</b> - calculator, text and JSON processing, datetime,
 * HTTP GET/POST</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → REST controllers (WebFlux)
 * Domain Layer       → ToolLoopSystem, ToolExecutor, context strategies, services
 * Infrastructure     → LLM/Storage adapters, OkHttp
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code agents.*}
 * prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AgentsApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentsApplication.class, args);
    }

}

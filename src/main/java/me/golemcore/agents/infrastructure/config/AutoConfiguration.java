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

import me.golemcore.agents.domain.tools.ToolRegistry;
import me.golemcore.agents.port.outbound.LlmPort;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Shared infrastructure beans and startup logging.
 *
 * <p>
 * The {@link ObjectMapper} defined here is used both for persistence and by the
 * WebFlux codecs, so stored documents and API payloads share one snake_case
 * shape.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final AgentsProperties properties;
    private final ToolRegistry toolRegistry;
    private final List<LlmPort> llmPorts;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        log.info("=== golemcore-agents starting ===");
        log.info("Storage: {}", properties.getStorage().getLocal().getBasePath());
        log.info("Tools: {} registered {}", toolRegistry.count(), toolRegistry.list());
        for (LlmPort port : llmPorts) {
            log.info("LLM provider '{}': {}", port.getProviderId(), port.isAvailable() ? "available" : "not configured");
        }
        log.info("Tool loop: max {} iterations, atomic history {}",
                properties.getToolLoop().getMaxIterations(), properties.getToolLoop().isAtomicHistory());
    }
}

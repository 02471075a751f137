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

package me.golemcore.agents.adapter.outbound.llm;

import me.golemcore.agents.infrastructure.config.AgentsProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * One {@link Langchain4jAdapter} per supported provider. Mistral and Grok are
 * served through their OpenAI-compatible endpoints.
 */
@Configuration
public class LlmProvidersConfiguration {

    static final String MISTRAL_BASE_URL = "https://api.mistral.ai/v1";
    static final String GROK_BASE_URL = "https://api.x.ai/v1";
    static final String OLLAMA_BASE_URL = "http://localhost:11434";

    @Bean
    public LlmProviderAdapter openAiLlmAdapter(AgentsProperties properties, ObjectMapper objectMapper) {
        return openAiCompatible("openai", null, properties, objectMapper);
    }

    @Bean
    public LlmProviderAdapter mistralLlmAdapter(AgentsProperties properties, ObjectMapper objectMapper) {
        return openAiCompatible("mistral", MISTRAL_BASE_URL, properties, objectMapper);
    }

    @Bean
    public LlmProviderAdapter grokLlmAdapter(AgentsProperties properties, ObjectMapper objectMapper) {
        return openAiCompatible("grok", GROK_BASE_URL, properties, objectMapper);
    }

    @Bean
    public LlmProviderAdapter anthropicLlmAdapter(AgentsProperties properties, ObjectMapper objectMapper) {
        AgentsProperties.ProviderProperties config = properties.getLlm().getProviders().get("anthropic");
        Duration timeout = Duration.ofMillis(properties.getLlm().getRequestTimeoutMs());
        return new Langchain4jAdapter("anthropic", config, properties.getLlm(), true,
                (modelName, temperature, maxTokens) -> {
                    var builder = AnthropicChatModel.builder()
                            .apiKey(config.getApiKey())
                            .modelName(modelName)
                            .temperature(temperature)
                            .maxTokens(maxTokens != null ? maxTokens : 4096)
                            .maxRetries(0) // Retry handled by the adapter's backoff
                            .timeout(timeout);
                    if (config.getBaseUrl() != null) {
                        builder.baseUrl(config.getBaseUrl());
                    }
                    return builder.build();
                }, objectMapper);
    }

    @Bean
    public LlmProviderAdapter ollamaLlmAdapter(AgentsProperties properties, ObjectMapper objectMapper) {
        AgentsProperties.ProviderProperties config = properties.getLlm().getProviders().get("ollama");
        Duration timeout = Duration.ofMillis(properties.getLlm().getRequestTimeoutMs());
        return new Langchain4jAdapter("ollama", config, properties.getLlm(), false,
                (modelName, temperature, maxTokens) -> OllamaChatModel.builder()
                        .baseUrl(config.getBaseUrl() != null ? config.getBaseUrl() : OLLAMA_BASE_URL)
                        .modelName(modelName)
                        .temperature(temperature)
                        .numPredict(maxTokens)
                        .maxRetries(0)
                        .timeout(timeout)
                        .build(),
                objectMapper);
    }

    private static Langchain4jAdapter openAiCompatible(String providerId, String defaultBaseUrl,
            AgentsProperties properties, ObjectMapper objectMapper) {
        AgentsProperties.ProviderProperties config = properties.getLlm().getProviders().get(providerId);
        Duration timeout = Duration.ofMillis(properties.getLlm().getRequestTimeoutMs());
        ChatModelFactory factory = (modelName, temperature, maxTokens) -> {
            var builder = OpenAiChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(modelName)
                    .temperature(temperature)
                    .maxTokens(maxTokens)
                    .maxRetries(0) // Retry handled by the adapter's backoff
                    .timeout(timeout);
            String baseUrl = config.getBaseUrl() != null ? config.getBaseUrl() : defaultBaseUrl;
            if (baseUrl != null) {
                builder.baseUrl(baseUrl);
            }
            return builder.build();
        };
        return new Langchain4jAdapter(providerId, config, properties.getLlm(), true, factory, objectMapper);
    }
}

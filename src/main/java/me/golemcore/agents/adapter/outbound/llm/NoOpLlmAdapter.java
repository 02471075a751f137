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

import me.golemcore.agents.domain.model.LlmChunk;
import me.golemcore.agents.domain.model.LlmRequest;
import me.golemcore.agents.domain.model.LlmResponse;
import me.golemcore.agents.domain.model.LlmUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * No-op LLM adapter used when an agent names a provider that has no adapter.
 *
 * <p>
 * Never available, so the conversation loop rejects turns routed to it with a
 * provider-unavailable error. Direct calls return a placeholder response.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Component
@Slf4j
public class NoOpLlmAdapter implements LlmProviderAdapter {

    public static final String PROVIDER_ID = "none";

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        log.warn("NoOpLlmAdapter: chat() called - no LLM configured");
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .content("[No LLM configured]")
                .model(PROVIDER_ID)
                .finishReason("stop")
                .usage(LlmUsage.of(0, 0))
                .build());
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return Flux.just(LlmChunk.builder()
                .text("[No LLM configured]")
                .done(true)
                .finishReason("stop")
                .build());
    }

    @Override
    public List<String> getSupportedModels() {
        return Collections.emptyList();
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}

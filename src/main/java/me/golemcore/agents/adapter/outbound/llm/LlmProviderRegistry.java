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

import me.golemcore.agents.port.outbound.LlmPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves the LLM provider an agent names to its adapter.
 *
 * <p>
 * Every {@link LlmProviderAdapter} bean is indexed by provider id at startup.
 * Lookups for a provider without an adapter fall back to
 * {@link NoOpLlmAdapter}, which reports itself unavailable.
 *
 * @see LlmProviderAdapter
 * @see Langchain4jAdapter
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmProviderRegistry {

    private final List<LlmProviderAdapter> adapters;

    private final Map<String, LlmProviderAdapter> adaptersByProvider = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        for (LlmProviderAdapter adapter : adapters) {
            adapter.initialize();
            adaptersByProvider.put(adapter.getProviderId(), adapter);
            log.debug("Registered LLM adapter: {} (available: {})", adapter.getProviderId(), adapter.isAvailable());
        }
        log.info("[LLM] {} provider adapters registered", adaptersByProvider.size());
    }

    /**
     * Get adapter by provider ID.
     */
    public Optional<LlmPort> find(String providerId) {
        if (providerId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(adaptersByProvider.get(providerId));
    }

    /**
     * Get adapter by provider ID, or the no-op adapter when none is registered.
     */
    public LlmPort resolve(String providerId) {
        return find(providerId).orElseGet(() -> {
            log.warn("[LLM] Provider '{}' has no adapter, using: {}", providerId, NoOpLlmAdapter.PROVIDER_ID);
            LlmProviderAdapter noop = adaptersByProvider.get(NoOpLlmAdapter.PROVIDER_ID);
            return noop != null ? noop : new NoOpLlmAdapter();
        });
    }

    /**
     * Check if a provider is available.
     */
    public boolean isProviderAvailable(String providerId) {
        LlmProviderAdapter adapter = adaptersByProvider.get(providerId);
        return adapter != null && adapter.isAvailable();
    }

    /**
     * Availability of every registered provider, ordered by id.
     */
    public Map<String, Boolean> availability() {
        Map<String, Boolean> result = new TreeMap<>();
        adaptersByProvider.forEach((id, adapter) -> result.put(id, adapter.isAvailable()));
        return result;
    }
}

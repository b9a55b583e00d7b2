package me.golemcore.incident.adapter.outbound.llm;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.incident.domain.model.LlmChunk;
import me.golemcore.incident.domain.model.LlmRequest;
import me.golemcore.incident.domain.model.LlmResponse;
import me.golemcore.incident.infrastructure.config.IncidentProperties;
import me.golemcore.incident.port.outbound.LlmPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Selects the active LLM adapter from {@code incident.llm.provider}:
 * <ul>
 * <li>converse - Converse-protocol backend over HTTP
 * <li>none - no-op adapter
 * </ul>
 *
 * <p>
 * An unknown provider falls back to {@code none}. The factory is the primary
 * {@link LlmPort} bean and delegates every call to the active adapter.
 *
 * @see LlmProviderAdapter
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class LlmAdapterFactory implements LlmPort {

    private static final String PROVIDER_NONE = "none";

    private final IncidentProperties properties;
    private final List<LlmProviderAdapter> adapters;

    private final Map<String, LlmProviderAdapter> adaptersByProvider = new ConcurrentHashMap<>();
    private LlmProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        for (LlmProviderAdapter adapter : adapters) {
            adaptersByProvider.put(adapter.getProviderId(), adapter);
            log.debug("Registered LLM adapter: {}", adapter.getProviderId());
        }

        String provider = properties.getLlm().getProvider();
        activeAdapter = provider != null ? adaptersByProvider.get(provider) : null;

        if (activeAdapter == null) {
            activeAdapter = adaptersByProvider.get(PROVIDER_NONE);
            if (activeAdapter == null && !adapters.isEmpty()) {
                activeAdapter = adapters.get(0);
            }
            log.warn("Provider '{}' not found, using: {}",
                    provider, activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE);
        } else {
            log.info("Active LLM provider: {}", provider);
        }

        if (activeAdapter != null) {
            activeAdapter.initialize();
        }
    }

    public LlmPort getActiveAdapter() {
        return activeAdapter;
    }

    public LlmPort getAdapter(String providerId) {
        return adaptersByProvider.get(providerId);
    }

    public boolean isProviderAvailable(String providerId) {
        LlmProviderAdapter adapter = adaptersByProvider.get(providerId);
        return adapter != null && adapter.isAvailable();
    }

    // ==================== LlmPort delegation ====================

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return requireActive().chat(request);
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return requireActive().chatStream(request);
    }

    @Override
    public boolean supportsStreaming() {
        return activeAdapter != null && activeAdapter.supportsStreaming();
    }

    @Override
    public List<String> getSupportedModels() {
        return activeAdapter != null ? activeAdapter.getSupportedModels() : List.of();
    }

    @Override
    public String getCurrentModel() {
        return activeAdapter != null ? activeAdapter.getCurrentModel() : PROVIDER_NONE;
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }

    private LlmProviderAdapter requireActive() {
        if (activeAdapter == null) {
            throw new IllegalStateException("No LLM adapter registered");
        }
        return activeAdapter;
    }
}

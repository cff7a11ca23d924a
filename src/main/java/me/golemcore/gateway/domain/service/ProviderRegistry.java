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
package me.golemcore.gateway.domain.service;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.ProviderType;
import me.golemcore.gateway.port.outbound.ProviderPort;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Indexes the provider adapters by {@link ProviderType}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProviderRegistry {

    private final List<ProviderPort> providers;

    private final Map<ProviderType, ProviderPort> providersByType = new EnumMap<>(ProviderType.class);

    @PostConstruct
    public void init() {
        for (ProviderPort provider : providers) {
            providersByType.put(provider.getProviderType(), provider);
            log.info("[Provider] Registered {} (live: {}, default model: {})", provider.getProviderType(),
                    provider.isConfigured(), provider.getDefaultModel());
        }
    }

    /**
     * @throws IllegalArgumentException
     *             when no adapter serves the provider
     */
    public ProviderPort get(ProviderType type) {
        ProviderPort provider = providersByType.get(type);
        if (provider == null) {
            throw new IllegalArgumentException("No adapter for provider: " + type);
        }
        return provider;
    }

    public Map<ProviderType, ProviderPort> getAll() {
        return Map.copyOf(providersByType);
    }
}

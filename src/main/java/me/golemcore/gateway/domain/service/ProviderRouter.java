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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.ProviderRoute;
import me.golemcore.gateway.domain.model.ProviderType;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Maps a caller's model/provider hint to a concrete upstream route.
 *
 * <p>
 * Routing rules:
 * <ol>
 * <li>An explicit provider is always honored. A model of {@code "auto"} (or
 * blank) is replaced by that provider's default model.</li>
 * <li>With provider {@code auto}, the model name prefix selects the provider
 * ({@code gpt*} to OpenAI, {@code claude*} to Anthropic, configurable).</li>
 * <li>Anything else goes to the configured cost-effective default route.</li>
 * </ol>
 *
 * <p>
 * Pure and synchronous: the same input always yields the same route for a
 * given configuration.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProviderRouter {

    private static final String AUTO = "auto";

    private final GatewayProperties properties;

    public ProviderRoute select(String requestedModel, ProviderType requestedProvider) {
        ProviderType provider = requestedProvider != null ? requestedProvider : ProviderType.AUTO;
        boolean autoModel = requestedModel == null || requestedModel.isBlank()
                || AUTO.equalsIgnoreCase(requestedModel.trim());

        if (provider != ProviderType.AUTO) {
            String model = autoModel ? providerConfig(provider).getDefaultModel() : requestedModel.trim();
            return new ProviderRoute(provider, model);
        }

        if (!autoModel) {
            String model = requestedModel.trim();
            String normalized = model.toLowerCase(Locale.ROOT);
            for (ProviderType candidate : new ProviderType[] { ProviderType.OPENAI, ProviderType.ANTHROPIC }) {
                if (matchesPrefix(normalized, candidate)) {
                    return new ProviderRoute(candidate, model);
                }
            }
            log.debug("[Router] No provider prefix matches model '{}', using default route", model);
        }

        GatewayProperties.RouterProperties router = properties.getRouter();
        return new ProviderRoute(ProviderType.fromId(router.getDefaultProvider()), router.getDefaultModel());
    }

    private boolean matchesPrefix(String normalizedModel, ProviderType provider) {
        for (String prefix : providerConfig(provider).getModelPrefixes()) {
            if (normalizedModel.startsWith(prefix.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private GatewayProperties.ProviderProperties providerConfig(ProviderType provider) {
        return switch (provider) {
        case OPENAI -> properties.getProviders().getOpenai();
        case ANTHROPIC -> properties.getProviders().getAnthropic();
        case AUTO -> throw new IllegalArgumentException("No provider configuration for auto");
        };
    }
}

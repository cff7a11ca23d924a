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
package me.golemcore.gateway.adapter.outbound.llm;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.ProviderType;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds and caches langchain4j chat models per provider and model name.
 *
 * <p>
 * Retries are disabled on the models: a failed upstream call is answered by the
 * fallback responder, not retried.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChatModelFactory {

    private final GatewayProperties properties;

    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    /**
     * Returns the chat model for the given provider and model, or empty when the
     * provider has no API key configured.
     */
    public Optional<ChatModel> getModel(ProviderType provider, String modelName) {
        GatewayProperties.ProviderProperties config = providerConfig(provider);
        if (!hasApiKey(config)) {
            return Optional.empty();
        }
        return Optional.of(models.computeIfAbsent(provider.getId() + "/" + modelName,
                key -> createModel(provider, modelName, config)));
    }

    public boolean isConfigured(ProviderType provider) {
        return hasApiKey(providerConfig(provider));
    }

    private ChatModel createModel(ProviderType provider, String modelName,
            GatewayProperties.ProviderProperties config) {
        log.debug("[Provider] Creating {} chat model: {}", provider, modelName);
        return switch (provider) {
        case ANTHROPIC -> createAnthropicModel(modelName, config);
        case OPENAI -> createOpenAiModel(modelName, config);
        case AUTO -> throw new IllegalArgumentException("Cannot create a model for an unrouted provider");
        };
    }

    private ChatModel createAnthropicModel(String modelName, GatewayProperties.ProviderProperties config) {
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0)
                .maxTokens(properties.getUpstream().getMaxOutputTokens())
                .timeout(Duration.ofMillis(properties.getUpstream().getTimeoutMs()));

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(String modelName, GatewayProperties.ProviderProperties config) {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0)
                .maxTokens(properties.getUpstream().getMaxOutputTokens())
                .timeout(Duration.ofMillis(properties.getUpstream().getTimeoutMs()));

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private GatewayProperties.ProviderProperties providerConfig(ProviderType provider) {
        return switch (provider) {
        case OPENAI -> properties.getProviders().getOpenai();
        case ANTHROPIC -> properties.getProviders().getAnthropic();
        case AUTO -> throw new IllegalArgumentException("No provider configuration for auto");
        };
    }

    private static boolean hasApiKey(GatewayProperties.ProviderProperties config) {
        return config.getApiKey() != null && !config.getApiKey().isBlank();
    }
}

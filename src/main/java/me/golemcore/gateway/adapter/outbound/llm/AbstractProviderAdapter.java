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

import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.ProviderCallResult;
import me.golemcore.gateway.domain.model.ProviderType;
import me.golemcore.gateway.domain.service.CostCalculator;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.ProviderPort;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Shared live-call and fallback logic for langchain4j-backed providers.
 *
 * <p>
 * The live call runs on the upstream executor and is bounded by
 * {@code gateway.upstream.timeout-ms}. Missing credentials, any upstream error
 * and a timeout all resolve to {@link #fallback}, so the returned future only
 * ever fails by cancellation.
 */
@Slf4j
public abstract class AbstractProviderAdapter implements ProviderPort {

    static final String FALLBACK_TEMPLATE = "[MOCK] This is a simulated response from %s to: '%s...'";
    private static final int FALLBACK_PROMPT_PREVIEW = 50;

    private final ProviderType providerType;
    private final GatewayProperties properties;
    private final ChatModelFactory chatModelFactory;
    private final CostCalculator costCalculator;
    private final ExecutorService upstreamExecutor;

    protected AbstractProviderAdapter(ProviderType providerType, GatewayProperties properties,
            ChatModelFactory chatModelFactory, CostCalculator costCalculator, ExecutorService upstreamExecutor) {
        this.providerType = providerType;
        this.properties = properties;
        this.chatModelFactory = chatModelFactory;
        this.costCalculator = costCalculator;
        this.upstreamExecutor = upstreamExecutor;
    }

    protected abstract GatewayProperties.ProviderProperties providerConfig();

    @Override
    public ProviderType getProviderType() {
        return providerType;
    }

    @Override
    public String getDefaultModel() {
        return providerConfig().getDefaultModel();
    }

    @Override
    public boolean isConfigured() {
        return chatModelFactory.isConfigured(providerType);
    }

    @Override
    public CompletableFuture<ProviderCallResult> complete(String model, String prompt) {
        if (!isConfigured()) {
            log.debug("[Provider] {} not configured, using fallback for model {}", providerType, model);
            return CompletableFuture.completedFuture(fallback(model, prompt));
        }

        CompletableFuture<ProviderCallResult> call = CompletableFuture
                .supplyAsync(() -> callUpstream(model, prompt), upstreamExecutor)
                .orTimeout(properties.getUpstream().getTimeoutMs(), TimeUnit.MILLISECONDS);

        CompletableFuture<ProviderCallResult> result = call.exceptionally(error -> {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
            log.warn("[Provider] {} call failed for model {}, using fallback: {}", providerType, model,
                    cause.toString());
            return fallback(model, prompt);
        });
        // Abandoning the request abandons the upstream call
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                call.cancel(true);
            }
        });
        return result;
    }

    @Override
    public ProviderCallResult fallback(String model, String prompt) {
        GatewayProperties.ProviderProperties config = providerConfig();
        int tokens = estimateTokens(prompt, config.getFallbackTokenMultiplier());
        String preview = prompt.length() > FALLBACK_PROMPT_PREVIEW
                ? prompt.substring(0, FALLBACK_PROMPT_PREVIEW)
                : prompt;
        return ProviderCallResult.builder()
                .text(String.format(FALLBACK_TEMPLATE, model, preview))
                .tokens(tokens)
                .cost(costCalculator.cost(providerType, model, tokens))
                .model(model)
                .provider(providerType)
                .latency(Duration.ofMillis(config.getFallbackLatencyMs()))
                .fallback(true)
                .build();
    }

    private ProviderCallResult callUpstream(String model, String prompt) {
        ChatModel chatModel = chatModelFactory.getModel(providerType, model)
                .orElseThrow(() -> new IllegalStateException(providerType + " is not configured"));

        long started = System.nanoTime();
        ChatResponse response = chatModel.chat(ChatRequest.builder()
                .messages(List.of(UserMessage.from(prompt)))
                .build());
        Duration latency = Duration.ofNanos(System.nanoTime() - started);

        String text = response.aiMessage() != null && response.aiMessage().text() != null
                ? response.aiMessage().text()
                : "";
        int tokens = resolveTokens(response.tokenUsage(), prompt);
        log.debug("[Provider] {} answered model {} with {} tokens in {} ms", providerType, model, tokens,
                latency.toMillis());

        return ProviderCallResult.builder()
                .text(text)
                .tokens(tokens)
                .cost(costCalculator.cost(providerType, model, tokens))
                .model(model)
                .provider(providerType)
                .latency(latency)
                .fallback(false)
                .build();
    }

    private int resolveTokens(TokenUsage usage, String prompt) {
        if (usage != null && usage.totalTokenCount() != null) {
            return usage.totalTokenCount();
        }
        if (usage != null && usage.inputTokenCount() != null && usage.outputTokenCount() != null) {
            return usage.inputTokenCount() + usage.outputTokenCount();
        }
        // Provider did not report usage: bill the estimate
        return estimateTokens(prompt, providerConfig().getFallbackTokenMultiplier());
    }

    static int estimateTokens(String prompt, double multiplier) {
        String trimmed = prompt != null ? prompt.trim() : "";
        if (trimmed.isEmpty()) {
            return 0;
        }
        int words = trimmed.split("\\s+").length;
        return Math.max(1, (int) (words * multiplier));
    }
}

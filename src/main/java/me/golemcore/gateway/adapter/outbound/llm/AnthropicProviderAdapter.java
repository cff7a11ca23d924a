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

import me.golemcore.gateway.domain.model.ProviderType;
import me.golemcore.gateway.domain.service.CostCalculator;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;

/**
 * Anthropic messages API via langchain4j.
 */
@Component
public class AnthropicProviderAdapter extends AbstractProviderAdapter {

    private final GatewayProperties properties;

    public AnthropicProviderAdapter(GatewayProperties properties, ChatModelFactory chatModelFactory,
            CostCalculator costCalculator, ExecutorService upstreamExecutor) {
        super(ProviderType.ANTHROPIC, properties, chatModelFactory, costCalculator, upstreamExecutor);
        this.properties = properties;
    }

    @Override
    protected GatewayProperties.ProviderProperties providerConfig() {
        return properties.getProviders().getAnthropic();
    }
}

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
import me.golemcore.gateway.domain.model.ProviderType;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Prices a provider call as {@code tokens * per-token rate}. Models missing
 * from the rate table are priced at the provider's default rate.
 */
@Service
@RequiredArgsConstructor
public class CostCalculator {

    private static final int COST_SCALE = 6;

    private final GatewayProperties properties;

    public double cost(ProviderType provider, String model, long tokens) {
        double rate = rate(provider, model);
        return BigDecimal.valueOf(tokens)
                .multiply(BigDecimal.valueOf(rate))
                .setScale(COST_SCALE, RoundingMode.HALF_UP)
                .doubleValue();
    }

    public double rate(ProviderType provider, String model) {
        GatewayProperties.ProviderProperties config = switch (provider) {
        case OPENAI -> properties.getProviders().getOpenai();
        case ANTHROPIC -> properties.getProviders().getAnthropic();
        case AUTO -> throw new IllegalArgumentException("Cannot price an unrouted request");
        };
        Double rate = model != null ? config.getRates().get(model) : null;
        return rate != null ? rate : config.getDefaultRate();
    }
}

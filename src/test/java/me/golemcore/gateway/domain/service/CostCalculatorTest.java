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

import me.golemcore.gateway.domain.model.ProviderType;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CostCalculatorTest {

    private CostCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new CostCalculator(new GatewayProperties());
    }

    @Test
    void shouldPriceKnownModelsFromRateTable() {
        assertEquals(0.03, calculator.cost(ProviderType.OPENAI, "gpt-4", 1_000), 1e-9);
        assertEquals(0.001, calculator.cost(ProviderType.ANTHROPIC, "claude-3-haiku-20240307", 1_000), 1e-9);
        assertEquals(0.075, calculator.cost(ProviderType.ANTHROPIC, "claude-3-opus-20240229", 1_000), 1e-9);
    }

    @Test
    void shouldUseProviderDefaultRateForUnknownModel() {
        assertEquals(0.002, calculator.cost(ProviderType.OPENAI, "gpt-5-preview", 1_000), 1e-9);
        assertEquals(0.015, calculator.cost(ProviderType.ANTHROPIC, "claude-next", 1_000), 1e-9);
    }

    @Test
    void shouldRoundToSixDecimals() {
        assertEquals(0.000004, calculator.cost(ProviderType.OPENAI, "gpt-3.5-turbo", 2), 1e-12);
        assertEquals(0.0, calculator.cost(ProviderType.OPENAI, "gpt-3.5-turbo", 0), 1e-12);
    }

    @Test
    void shouldRejectUnroutedProvider() {
        assertThrows(IllegalArgumentException.class, () -> calculator.cost(ProviderType.AUTO, "gpt-4", 1));
    }
}

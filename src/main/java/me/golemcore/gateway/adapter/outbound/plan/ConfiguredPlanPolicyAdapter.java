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
package me.golemcore.gateway.adapter.outbound.plan;

import lombok.RequiredArgsConstructor;
import me.golemcore.gateway.domain.model.PlanPolicy;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.PlanPolicyPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Plan policies read from {@code gateway.plans.<tier>.*}. Tier names are
 * matched case-insensitively.
 */
@Component
@RequiredArgsConstructor
public class ConfiguredPlanPolicyAdapter implements PlanPolicyPort {

    private final GatewayProperties properties;

    @Override
    public Optional<PlanPolicy> lookup(String tier) {
        if (tier == null || tier.isBlank()) {
            return Optional.empty();
        }
        String normalized = tier.trim().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, GatewayProperties.PlanProperties> entry : properties.getPlans().entrySet()) {
            if (entry.getKey().toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(toPolicy(entry.getKey(), entry.getValue()));
            }
        }
        return Optional.empty();
    }

    @Override
    public List<PlanPolicy> listPolicies() {
        List<PlanPolicy> policies = new ArrayList<>();
        properties.getPlans().forEach((tier, plan) -> policies.add(toPolicy(tier, plan)));
        return policies;
    }

    private static PlanPolicy toPolicy(String tier, GatewayProperties.PlanProperties plan) {
        return PlanPolicy.builder()
                .tier(tier)
                .tokensPerPeriod(plan.getTokensPerPeriod())
                .requestsPerHour(plan.getRequestsPerHour())
                .price(plan.getPrice())
                .build();
    }
}

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.Account;
import me.golemcore.gateway.domain.model.PlanPolicy;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.AccountStorePort;
import me.golemcore.gateway.port.outbound.PlanPolicyPort;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Creates accounts for the admin API and seeds the demo account.
 */
@Service
@Slf4j
public class AccountProvisioningService {

    private static final String API_KEY_PREFIX = "sk_";
    private static final int API_KEY_BYTES = 24;

    private final AccountStorePort accountStore;
    private final PlanPolicyPort planPolicyPort;
    private final GatewayProperties properties;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public AccountProvisioningService(AccountStorePort accountStore, PlanPolicyPort planPolicyPort,
            GatewayProperties properties, Clock clock) {
        this.accountStore = accountStore;
        this.planPolicyPort = planPolicyPort;
        this.properties = properties;
        this.clock = clock;
    }

    public Account createAccount(String tier) {
        return createAccount(tier, generateApiKey());
    }

    public Account createAccount(String tier, String apiKey) {
        PlanPolicy policy = planPolicyPort.lookup(tier)
                .orElseThrow(() -> new IllegalArgumentException("Unknown plan tier: " + tier));
        Instant now = clock.instant();
        Account account = Account.builder()
                .id(UUID.randomUUID().toString())
                .apiKey(apiKey)
                .tier(policy.getTier())
                .tokensIncluded(policy.getTokensPerPeriod())
                .tokensUsed(0)
                .periodEnd(now.plus(Duration.ofDays(properties.getBillingPeriodDays())))
                .active(true)
                .createdAt(now)
                .updatedAt(now)
                .build();
        Account created = accountStore.create(account);
        log.info("[Accounts] Created account {} on tier {}", created.getId(), created.getTier());
        return created;
    }

    /**
     * Provisions the configured demo account unless an account with its API key
     * already exists.
     */
    public void ensureDemoAccount() {
        GatewayProperties.DemoAccountProperties demo = properties.getDemoAccount();
        if (!demo.isEnabled()) {
            return;
        }
        if (accountStore.findByApiKey(demo.getApiKey()).isPresent()) {
            log.debug("[Accounts] Demo account already present");
            return;
        }
        createAccount(demo.getTier(), demo.getApiKey());
        log.info("[Accounts] Demo account seeded on tier {}", demo.getTier());
    }

    private String generateApiKey() {
        byte[] bytes = new byte[API_KEY_BYTES];
        random.nextBytes(bytes);
        return API_KEY_PREFIX + HexFormat.of().formatHex(bytes);
    }
}

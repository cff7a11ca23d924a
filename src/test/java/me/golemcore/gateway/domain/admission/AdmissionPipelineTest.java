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
package me.golemcore.gateway.domain.admission;

import me.golemcore.gateway.adapter.outbound.plan.ConfiguredPlanPolicyAdapter;
import me.golemcore.gateway.domain.exception.AdmissionDeniedException;
import me.golemcore.gateway.domain.model.Account;
import me.golemcore.gateway.domain.model.DenialReason;
import me.golemcore.gateway.domain.service.QuotaEnforcer;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.ratelimit.PlanRateLimiter;
import me.golemcore.gateway.testsupport.InMemoryAccountStore;
import me.golemcore.gateway.testsupport.MutableClock;
import me.golemcore.gateway.testsupport.TestAccounts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class AdmissionPipelineTest {

    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");

    private GatewayProperties properties;
    private InMemoryAccountStore accountStore;
    private MutableClock clock;
    private AdmissionPipeline pipeline;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        accountStore = new InMemoryAccountStore();
        clock = new MutableClock(NOW);
        PlanRateLimiter rateLimiter = new PlanRateLimiter(new ConfiguredPlanPolicyAdapter(properties), properties,
                clock);
        pipeline = new AdmissionPipeline(
                new AuthenticationCheck(accountStore),
                new RateLimitCheck(rateLimiter),
                new QuotaCheck(new QuotaEnforcer(accountStore, properties, clock)));
    }

    @Test
    void shouldAdmitActiveAccountWithQuota() {
        accountStore.create(TestAccounts.account("acc-1", "free", 10_000, 0, NOW.plus(Duration.ofDays(5))));

        AdmissionContext context = pipeline.admit("key-acc-1");

        assertTrue(context.isAuthenticated());
        assertEquals("acc-1", context.getAccount().getId());
        assertEquals("account:acc-1", context.getCallerKey());
    }

    @Test
    void shouldDenyMissingAndUnknownKeys() {
        AdmissionDeniedException missing = assertThrows(AdmissionDeniedException.class, () -> pipeline.admit(" "));
        AdmissionDeniedException unknown = assertThrows(AdmissionDeniedException.class,
                () -> pipeline.admit("nope"));

        assertEquals(DenialReason.AUTH_DENIED, missing.getReason());
        assertEquals(AuthenticationCheck.MISSING_KEY_MESSAGE, missing.getMessage());
        assertEquals(DenialReason.AUTH_DENIED, unknown.getReason());
        assertEquals(AuthenticationCheck.INVALID_KEY_MESSAGE, unknown.getMessage());
    }

    @Test
    void shouldDenyInactiveAccount() {
        Account account = TestAccounts.account("acc-1", "free", 10_000, 0, NOW.plus(Duration.ofDays(5)));
        account.setActive(false);
        accountStore.create(account);

        AdmissionDeniedException denial = assertThrows(AdmissionDeniedException.class,
                () -> pipeline.admit("key-acc-1"));

        assertEquals(DenialReason.AUTH_DENIED, denial.getReason());
    }

    @Test
    void shouldDenyExhaustedQuotaWithUpgradeUrl() {
        accountStore.create(TestAccounts.account("acc-1", "free", 10_000, 10_000, NOW.plus(Duration.ofDays(5))));

        AdmissionDeniedException denial = assertThrows(AdmissionDeniedException.class,
                () -> pipeline.admit("key-acc-1"));

        assertEquals(DenialReason.QUOTA_EXCEEDED, denial.getReason());
        assertEquals("/billing", denial.getUpgradeUrl());
    }

    @Test
    void shouldRateLimitBeforeCheckingQuota() {
        accountStore.create(TestAccounts.account("acc-1", "free", 10_000, 10_000, NOW.plus(Duration.ofDays(5))));
        for (int i = 0; i < 100; i++) {
            assertThrows(AdmissionDeniedException.class, () -> pipeline.admit("key-acc-1"));
        }

        AdmissionDeniedException denial = assertThrows(AdmissionDeniedException.class,
                () -> pipeline.admit("key-acc-1"));

        assertEquals(DenialReason.RATE_LIMITED, denial.getReason());
        assertTrue(denial.getRetryAfter().compareTo(Duration.ZERO) > 0);
    }

    @Test
    void shouldAdmitExhaustedAccountAfterPeriodRollover() {
        accountStore.create(TestAccounts.account("acc-1", "free", 10_000, 10_000, NOW.plus(Duration.ofDays(1))));
        clock.advance(Duration.ofDays(2));

        AdmissionContext context = pipeline.admit("key-acc-1");

        assertEquals(0, context.getAccount().getTokensUsed());
    }

    @Test
    void shouldAuthenticateWithoutConsumingRateBudget() {
        accountStore.create(TestAccounts.account("acc-1", "free", 10_000, 10_000, NOW.plus(Duration.ofDays(5))));

        for (int i = 0; i < 150; i++) {
            assertEquals("acc-1", pipeline.authenticate("key-acc-1").getId());
        }
    }

    @Test
    void shouldThrottleAnonymousCallersAtDefaultThreshold() {
        for (int i = 0; i < 100; i++) {
            pipeline.throttleAnonymous("10.0.0.1");
        }

        AdmissionDeniedException denial = assertThrows(AdmissionDeniedException.class,
                () -> pipeline.throttleAnonymous("10.0.0.1"));

        assertEquals(DenialReason.RATE_LIMITED, denial.getReason());
        assertDoesNotThrow(() -> pipeline.throttleAnonymous("10.0.0.2"));
    }
}

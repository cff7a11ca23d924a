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
package me.golemcore.gateway.adapter.inbound.web.controller;

import me.golemcore.gateway.adapter.inbound.web.dto.AccountStatusResponse;
import me.golemcore.gateway.adapter.inbound.web.dto.PlanResponse;
import me.golemcore.gateway.adapter.inbound.web.security.ApiKeyResolver;
import me.golemcore.gateway.adapter.outbound.plan.ConfiguredPlanPolicyAdapter;
import me.golemcore.gateway.domain.admission.AdmissionPipeline;
import me.golemcore.gateway.domain.exception.AdmissionDeniedException;
import me.golemcore.gateway.domain.model.Account;
import me.golemcore.gateway.domain.service.QuotaEnforcer;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.testsupport.TestAccounts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import reactor.test.StepVerifier;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AccountControllerTest {

    private AdmissionPipeline admissionPipeline;
    private QuotaEnforcer quotaEnforcer;
    private AccountController controller;

    @BeforeEach
    void setUp() {
        admissionPipeline = mock(AdmissionPipeline.class);
        quotaEnforcer = mock(QuotaEnforcer.class);
        controller = new AccountController(admissionPipeline, quotaEnforcer,
                new ConfiguredPlanPolicyAdapter(new GatewayProperties()), new ApiKeyResolver());
    }

    @Test
    void shouldReturnRefreshedQuotaStatus() {
        Instant periodEnd = Instant.parse("2026-11-01T00:00:00Z");
        Account account = TestAccounts.account("acc-1", "free", 10_000, 2_500, periodEnd);
        when(admissionPipeline.authenticate("key-acc-1")).thenReturn(account);
        when(quotaEnforcer.refresh("acc-1")).thenReturn(Optional.of(account));

        StepVerifier.create(controller.getAccount(exchange("/api/account", "key-acc-1")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    AccountStatusResponse body = response.getBody();
                    assertEquals("acc-1", body.getAccountId());
                    assertEquals(7_500, body.getRemainingQuota());
                    assertEquals(25.0, body.getQuotaPercentage());
                    assertEquals(periodEnd, body.getPeriodEnd());
                })
                .verifyComplete();
    }

    @Test
    void shouldSignalAuthDenialForAccountStatus() {
        when(admissionPipeline.authenticate(null)).thenThrow(AdmissionDeniedException.authDenied("API key required"));

        StepVerifier.create(controller.getAccount(exchange("/api/account", null)))
                .expectError(AdmissionDeniedException.class)
                .verify();
    }

    @Test
    void shouldListPlansForAnonymousCaller() {
        StepVerifier.create(controller.getPlans(exchange("/api/plans", null)))
                .assertNext(response -> {
                    List<PlanResponse> plans = response.getBody();
                    assertEquals(4, plans.size());
                    assertEquals("free", plans.get(0).getTier());
                })
                .verifyComplete();

        verify(admissionPipeline).throttleAnonymous("10.1.2.3");
    }

    @Test
    void shouldThrottlePlanListingOffTheRequestThread() {
        AtomicReference<String> throttleThread = new AtomicReference<>();
        doAnswer(invocation -> {
            throttleThread.set(Thread.currentThread().getName());
            return null;
        }).when(admissionPipeline).throttleAnonymous("10.1.2.3");

        StepVerifier.create(controller.getPlans(exchange("/api/plans", null)))
                .expectNextCount(1)
                .verifyComplete();

        assertTrue(throttleThread.get().startsWith("boundedElastic"), throttleThread.get());
    }

    @Test
    void shouldThrottlePlanListing() {
        doThrow(AdmissionDeniedException.rateLimited(Duration.ofSeconds(30)))
                .when(admissionPipeline).throttleAnonymous("10.1.2.3");

        StepVerifier.create(controller.getPlans(exchange("/api/plans", null)))
                .expectError(AdmissionDeniedException.class)
                .verify();
    }

    private static MockServerWebExchange exchange(String path, String apiKey) {
        MockServerHttpRequest.BaseBuilder<?> builder = MockServerHttpRequest.get(path)
                .remoteAddress(new InetSocketAddress("10.1.2.3", 50_000));
        if (apiKey != null) {
            builder.header("X-API-Key", apiKey);
        }
        return MockServerWebExchange.from(builder);
    }
}

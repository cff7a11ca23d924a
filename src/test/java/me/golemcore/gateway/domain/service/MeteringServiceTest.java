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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gateway.adapter.outbound.llm.AnthropicProviderAdapter;
import me.golemcore.gateway.adapter.outbound.llm.ChatModelFactory;
import me.golemcore.gateway.adapter.outbound.llm.OpenAiProviderAdapter;
import me.golemcore.gateway.adapter.outbound.plan.ConfiguredPlanPolicyAdapter;
import me.golemcore.gateway.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.gateway.adapter.outbound.usage.LocalUsageLedgerAdapter;
import me.golemcore.gateway.domain.admission.AdmissionPipeline;
import me.golemcore.gateway.domain.admission.AuthenticationCheck;
import me.golemcore.gateway.domain.admission.QuotaCheck;
import me.golemcore.gateway.domain.admission.RateLimitCheck;
import me.golemcore.gateway.domain.exception.AccountingFailureException;
import me.golemcore.gateway.domain.exception.AdmissionDeniedException;
import me.golemcore.gateway.domain.model.CompletionRequest;
import me.golemcore.gateway.domain.model.DailyAggregate;
import me.golemcore.gateway.domain.model.DenialReason;
import me.golemcore.gateway.domain.model.MeteredCompletion;
import me.golemcore.gateway.domain.model.ProviderCallResult;
import me.golemcore.gateway.domain.model.ProviderType;
import me.golemcore.gateway.domain.model.UsageRecord;
import me.golemcore.gateway.infrastructure.config.GatewayConfiguration;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.ProviderPort;
import me.golemcore.gateway.port.outbound.UsageLedgerPort;
import me.golemcore.gateway.ratelimit.PlanRateLimiter;
import me.golemcore.gateway.testsupport.InMemoryAccountStore;
import me.golemcore.gateway.testsupport.MutableClock;
import me.golemcore.gateway.testsupport.TestAccounts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class MeteringServiceTest {

    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");
    private static final String API_KEY = "key-acc-1";

    @TempDir
    Path tempDir;

    private GatewayProperties properties;
    private MutableClock clock;
    private InMemoryAccountStore accountStore;
    private UsageLedgerPort usageLedger;
    private ExecutorService executor;
    private AdmissionPipeline admissionPipeline;
    private QuotaEnforcer quotaEnforcer;
    private CostCalculator costCalculator;
    private ChatModelFactory chatModelFactory;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        properties.getAccounting().setFirstBackoffMs(1);
        properties.getAccounting().setMaxRetries(1);
        properties.getAccounting().setRedriveRetries(0);
        clock = new MutableClock(NOW);
        accountStore = new InMemoryAccountStore();
        executor = Executors.newFixedThreadPool(4);

        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        ObjectMapper objectMapper = GatewayConfiguration.objectMapper();
        usageLedger = new LocalUsageLedgerAdapter(storage, objectMapper, properties, clock);

        quotaEnforcer = new QuotaEnforcer(accountStore, properties, clock);
        admissionPipeline = new AdmissionPipeline(
                new AuthenticationCheck(accountStore),
                new RateLimitCheck(new PlanRateLimiter(new ConfiguredPlanPolicyAdapter(properties), properties,
                        clock)),
                new QuotaCheck(quotaEnforcer));
        costCalculator = new CostCalculator(properties);
        chatModelFactory = new ChatModelFactory(properties);

        accountStore.create(TestAccounts.account("acc-1", "free", 10_000, 0, NOW.plus(Duration.ofDays(30))));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldMeterFallbackCompletionEndToEnd() throws Exception {
        MeteringService service = service(usageLedger, new OpenAiProviderAdapter(properties, chatModelFactory,
                costCalculator, executor), new AnthropicProviderAdapter(properties, chatModelFactory,
                        costCalculator, executor));

        MeteredCompletion completion = service
                .complete(API_KEY, CompletionRequest.builder().prompt("hello world").build())
                .get(5, TimeUnit.SECONDS);

        assertEquals(ProviderType.OPENAI, completion.getProvider());
        assertEquals("gpt-3.5-turbo", completion.getModel());
        assertTrue(completion.getText().startsWith("[MOCK]"));
        assertEquals(2, completion.getTokens());
        assertEquals(2, completion.getTotalTokensUsed());
        assertEquals(10_000 - 2, completion.getRemainingQuota());
        assertEquals(2, accountStore.findById("acc-1").orElseThrow().getTokensUsed());

        List<UsageRecord> records = usageLedger.findRecent("acc-1", 10);
        assertEquals(1, records.size());
        UsageRecord usageRecord = records.get(0);
        assertEquals(completion.getRequestId(), usageRecord.getRequestId());
        assertEquals(2, usageRecord.getTokens());
        assertEquals("openai", usageRecord.getProvider());
        assertEquals("/api/chat", usageRecord.getEndpoint());

        DailyAggregate today = usageLedger.findDailyAggregate("acc-1", LocalDate.of(2026, 10, 19)).orElseThrow();
        assertEquals(1, today.getTotalRequests());
        assertEquals(2, today.getTotalTokens());
        assertEquals(completion.getCost(), today.getTotalCost(), 1e-12);
    }

    @Test
    void shouldRouteByModelPrefix() throws Exception {
        MeteringService service = service(usageLedger, new OpenAiProviderAdapter(properties, chatModelFactory,
                costCalculator, executor), new AnthropicProviderAdapter(properties, chatModelFactory,
                        costCalculator, executor));

        MeteredCompletion completion = service
                .complete(API_KEY, CompletionRequest.builder()
                        .prompt("one two three four five")
                        .model("claude-3-haiku-20240307")
                        .build())
                .get(5, TimeUnit.SECONDS);

        assertEquals(ProviderType.ANTHROPIC, completion.getProvider());
        assertEquals(6, completion.getTokens());
        assertEquals(0.000006, completion.getCost(), 1e-12);
    }

    @Test
    void shouldRejectEmptyPromptWithoutCallingProvider() {
        ProviderPort provider = mockProvider(ProviderType.OPENAI);
        MeteringService service = service(usageLedger, provider);

        assertThrows(IllegalArgumentException.class,
                () -> service.complete(API_KEY, CompletionRequest.builder().prompt("  ").build()));

        verify(provider, never()).complete(anyString(), anyString());
        assertEquals(0, accountStore.findById("acc-1").orElseThrow().getTokensUsed());
    }

    @Test
    void shouldDenyBeforeProviderCallWhenQuotaIsExhausted() {
        accountStore.update("acc-1", account -> {
            account.setTokensUsed(10_000);
            return account;
        });
        ProviderPort provider = mockProvider(ProviderType.OPENAI);
        MeteringService service = service(usageLedger, provider);

        AdmissionDeniedException denial = assertThrows(AdmissionDeniedException.class,
                () -> service.complete(API_KEY, CompletionRequest.builder().prompt("hi").build()));

        assertEquals(DenialReason.QUOTA_EXCEEDED, denial.getReason());
        verify(provider, never()).complete(anyString(), anyString());
    }

    @Test
    void shouldNotDebitWhenCallerAbandonsRequest() {
        ProviderPort provider = mockProvider(ProviderType.OPENAI);
        CompletableFuture<ProviderCallResult> pending = new CompletableFuture<>();
        when(provider.complete(anyString(), anyString())).thenReturn(pending);
        MeteringService service = service(usageLedger, provider);

        CompletableFuture<MeteredCompletion> metered = service.complete(API_KEY,
                CompletionRequest.builder().prompt("hello world").build());
        metered.cancel(true);
        pending.complete(callResult(40));

        assertTrue(pending.isDone());
        assertEquals(0, accountStore.findById("acc-1").orElseThrow().getTokensUsed());
        assertTrue(usageLedger.findRecent("acc-1", 10).isEmpty());
    }

    @Test
    void shouldFailWithAccountingErrorWhenUsageCannotBeRecorded() {
        UsageLedgerPort failingLedger = mock(UsageLedgerPort.class);
        when(failingLedger.append(any())).thenThrow(new IllegalStateException("disk full"));
        ProviderPort provider = mockProvider(ProviderType.OPENAI);
        when(provider.complete(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(
                callResult(40)));
        MeteringService service = service(failingLedger, provider);

        CompletableFuture<MeteredCompletion> metered = service.complete(API_KEY,
                CompletionRequest.builder().prompt("hello world").build());

        ExecutionException failure = assertThrows(ExecutionException.class,
                () -> metered.get(5, TimeUnit.SECONDS));
        assertInstanceOf(AccountingFailureException.class, failure.getCause());
        // The debit already happened exactly once despite the retries
        assertEquals(40, accountStore.findById("acc-1").orElseThrow().getTokensUsed());
    }

    @Test
    void shouldRecordUsageWhenRedrivenDebitSucceeds() throws Exception {
        properties.getAccounting().setRedriveRetries(5);
        properties.getAccounting().setRedriveBackoffMs(1);
        QuotaEnforcer flakyEnforcer = spy(quotaEnforcer);
        doThrow(new IllegalStateException("store unavailable"))
                .doThrow(new IllegalStateException("store unavailable"))
                .doThrow(new IllegalStateException("store unavailable"))
                .doCallRealMethod()
                .when(flakyEnforcer).debit(anyString(), anyString(), anyLong());
        ProviderPort provider = mockProvider(ProviderType.OPENAI);
        when(provider.complete(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(
                callResult(40)));
        MeteringService service = service(usageLedger, flakyEnforcer, provider);

        CompletableFuture<MeteredCompletion> metered = service.complete(API_KEY,
                CompletionRequest.builder().prompt("hello world").build());

        ExecutionException failure = assertThrows(ExecutionException.class,
                () -> metered.get(5, TimeUnit.SECONDS));
        assertInstanceOf(AccountingFailureException.class, failure.getCause());

        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (usageLedger.findRecent("acc-1", 10).isEmpty() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        List<UsageRecord> records = usageLedger.findRecent("acc-1", 10);
        assertEquals(1, records.size());
        assertEquals(40, records.get(0).getTokens());
        assertEquals(40, accountStore.findById("acc-1").orElseThrow().getTokensUsed());
        assertEquals(40, usageLedger.findDailyAggregate("acc-1", LocalDate.of(2026, 10, 19)).orElseThrow()
                .getTotalTokens());
    }

    @Test
    void shouldKeepDebitsEqualToRecordedUsage() throws Exception {
        MeteringService service = service(usageLedger, new OpenAiProviderAdapter(properties, chatModelFactory,
                costCalculator, executor), new AnthropicProviderAdapter(properties, chatModelFactory,
                        costCalculator, executor));

        for (int i = 0; i < 20; i++) {
            service.complete(API_KEY, CompletionRequest.builder().prompt("prompt number " + i).build())
                    .get(5, TimeUnit.SECONDS);
        }

        long recorded = usageLedger.findRecent("acc-1", 100).stream().mapToLong(UsageRecord::getTokens).sum();
        assertEquals(recorded, accountStore.findById("acc-1").orElseThrow().getTokensUsed());
        assertEquals(20, usageLedger.findDailyAggregate("acc-1", LocalDate.of(2026, 10, 19)).orElseThrow()
                .getTotalRequests());
    }

    private MeteringService service(UsageLedgerPort ledger, ProviderPort... providers) {
        return service(ledger, quotaEnforcer, providers);
    }

    private MeteringService service(UsageLedgerPort ledger, QuotaEnforcer enforcer, ProviderPort... providers) {
        ProviderRegistry registry = new ProviderRegistry(List.of(providers));
        registry.init();
        return new MeteringService(admissionPipeline, new ProviderRouter(properties), registry, enforcer,
                new UsageRecorder(ledger, clock), new AccountingRetrier(properties), executor, clock);
    }

    private static ProviderPort mockProvider(ProviderType type) {
        ProviderPort provider = mock(ProviderPort.class);
        when(provider.getProviderType()).thenReturn(type);
        when(provider.getDefaultModel()).thenReturn("gpt-3.5-turbo");
        return provider;
    }

    private static ProviderCallResult callResult(int tokens) {
        return ProviderCallResult.builder()
                .text("answer")
                .tokens(tokens)
                .cost(0.0001)
                .model("gpt-3.5-turbo")
                .provider(ProviderType.OPENAI)
                .latency(Duration.ofMillis(120))
                .fallback(false)
                .build();
    }
}

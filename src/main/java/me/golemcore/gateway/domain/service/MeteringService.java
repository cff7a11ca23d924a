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
import me.golemcore.gateway.domain.admission.AdmissionContext;
import me.golemcore.gateway.domain.admission.AdmissionPipeline;
import me.golemcore.gateway.domain.model.Account;
import me.golemcore.gateway.domain.model.CompletionRequest;
import me.golemcore.gateway.domain.model.MeteredCompletion;
import me.golemcore.gateway.domain.model.ProviderCallResult;
import me.golemcore.gateway.domain.model.ProviderRoute;
import me.golemcore.gateway.domain.model.QuotaSnapshot;
import me.golemcore.gateway.domain.model.UsageRecord;
import me.golemcore.gateway.port.outbound.ProviderPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Runs one metered completion: admission, routing, provider call, then debit
 * and usage bookkeeping before the result is handed back.
 *
 * <p>
 * Bookkeeping is chained after the provider call on the returned future. If
 * the caller cancels that future before the provider call completes, the
 * bookkeeping never runs, so an abandoned request is neither debited nor
 * recorded. Once bookkeeping has started it runs to completion regardless of
 * what happens to the response.
 *
 * <p>
 * The debit and the usage write form one settlement: the usage record is built
 * before the debit and both writes are retried as a unit.
 */
@Service
@Slf4j
public class MeteringService {

    private final AdmissionPipeline admissionPipeline;
    private final ProviderRouter providerRouter;
    private final ProviderRegistry providerRegistry;
    private final QuotaEnforcer quotaEnforcer;
    private final UsageRecorder usageRecorder;
    private final AccountingRetrier accountingRetrier;
    private final ExecutorService upstreamExecutor;
    private final Clock clock;

    public MeteringService(AdmissionPipeline admissionPipeline, ProviderRouter providerRouter,
            ProviderRegistry providerRegistry, QuotaEnforcer quotaEnforcer, UsageRecorder usageRecorder,
            AccountingRetrier accountingRetrier, ExecutorService upstreamExecutor, Clock clock) {
        this.admissionPipeline = admissionPipeline;
        this.providerRouter = providerRouter;
        this.providerRegistry = providerRegistry;
        this.quotaEnforcer = quotaEnforcer;
        this.usageRecorder = usageRecorder;
        this.accountingRetrier = accountingRetrier;
        this.upstreamExecutor = upstreamExecutor;
        this.clock = clock;
    }

    /**
     * Admits and executes a completion request.
     *
     * <p>
     * Admission denials and an empty prompt are thrown synchronously, before any
     * provider call. The returned future completes with the metered result, or
     * fails with {@code AccountingFailureException} if bookkeeping could not be
     * completed.
     */
    public CompletableFuture<MeteredCompletion> complete(String credential, CompletionRequest request) {
        AdmissionContext admission = admissionPipeline.admit(credential);

        String prompt = request.getPrompt();
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("Prompt is required");
        }

        ProviderRoute route = providerRouter.select(request.getModel(), request.getProvider());
        ProviderPort provider = providerRegistry.get(route.provider());
        String requestId = UUID.randomUUID().toString();
        Account account = admission.getAccount();
        log.debug("[Metering] Request {} for account {} routed to {}/{}", requestId, account.getId(),
                route.provider(), route.model());

        CompletableFuture<ProviderCallResult> call = provider.complete(route.model(), prompt);
        CompletableFuture<MeteredCompletion> metered = call.thenApplyAsync(
                result -> settle(requestId, account.getId(), request.getEndpoint(), result), upstreamExecutor);
        metered.whenComplete((value, error) -> {
            if (metered.isCancelled()) {
                log.debug("[Metering] Request {} abandoned before bookkeeping", requestId);
                call.cancel(true);
            }
        });
        return metered;
    }

    private MeteredCompletion settle(String requestId, String accountId, String endpoint,
            ProviderCallResult result) {
        UsageRecord usageRecord = UsageRecord.builder()
                .requestId(requestId)
                .accountId(accountId)
                .provider(result.getProvider().getId())
                .model(result.getModel())
                .tokens(result.getTokens())
                .cost(result.getCost())
                .endpoint(endpoint)
                .latency(result.getLatency())
                .timestamp(clock.instant())
                .build();

        // One unit for retry and redrive; both writes are idempotent by request id
        Account debited = accountingRetrier.execute("settlement", requestId, () -> {
            Account account = quotaEnforcer.debit(accountId, requestId, result.getTokens());
            usageRecorder.record(usageRecord);
            return account;
        });

        QuotaSnapshot quota = debited.quotaSnapshot();
        return MeteredCompletion.builder()
                .requestId(requestId)
                .text(result.getText())
                .model(result.getModel())
                .provider(result.getProvider())
                .tokens(result.getTokens())
                .cost(result.getCost())
                .latency(result.getLatency())
                .totalTokensUsed(quota.tokensUsed())
                .remainingQuota(quota.remaining())
                .quotaPercentage(quota.percentage())
                .build();
    }
}

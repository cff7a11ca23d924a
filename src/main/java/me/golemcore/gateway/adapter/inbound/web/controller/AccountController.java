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

import lombok.RequiredArgsConstructor;
import me.golemcore.gateway.adapter.inbound.web.dto.AccountStatusResponse;
import me.golemcore.gateway.adapter.inbound.web.dto.PlanResponse;
import me.golemcore.gateway.adapter.inbound.web.security.ApiKeyResolver;
import me.golemcore.gateway.domain.admission.AdmissionPipeline;
import me.golemcore.gateway.domain.exception.AdmissionDeniedException;
import me.golemcore.gateway.domain.model.Account;
import me.golemcore.gateway.domain.service.QuotaEnforcer;
import me.golemcore.gateway.port.outbound.PlanPolicyPort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.InetSocketAddress;
import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AccountController {

    private static final String UNKNOWN_CLIENT = "unknown";

    private final AdmissionPipeline admissionPipeline;
    private final QuotaEnforcer quotaEnforcer;
    private final PlanPolicyPort planPolicyPort;
    private final ApiKeyResolver apiKeyResolver;

    /**
     * Quota status of the calling account, with any due rollover applied.
     */
    @GetMapping("/account")
    public Mono<ResponseEntity<AccountStatusResponse>> getAccount(ServerWebExchange exchange) {
        String credential = apiKeyResolver.resolve(exchange.getRequest());
        return Mono.fromCallable(() -> {
            Account account = admissionPipeline.authenticate(credential);
            Account refreshed = quotaEnforcer.refresh(account.getId())
                    .orElseThrow(() -> AdmissionDeniedException.authDenied("Invalid or inactive API key"));
            return ResponseEntity.ok(AccountStatusResponse.from(refreshed));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/plans")
    public Mono<ResponseEntity<List<PlanResponse>>> getPlans(ServerWebExchange exchange) {
        return Mono.fromCallable(() -> {
            admissionPipeline.throttleAnonymous(clientAddress(exchange));
            List<PlanResponse> plans = planPolicyPort.listPolicies().stream()
                    .map(PlanResponse::from)
                    .toList();
            return ResponseEntity.ok(plans);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private static String clientAddress(ServerWebExchange exchange) {
        InetSocketAddress remote = exchange.getRequest().getRemoteAddress();
        if (remote == null || remote.getAddress() == null) {
            return UNKNOWN_CLIENT;
        }
        return remote.getAddress().getHostAddress();
    }
}

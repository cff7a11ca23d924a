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
import me.golemcore.gateway.adapter.inbound.web.dto.AdminOverviewResponse;
import me.golemcore.gateway.adapter.inbound.web.dto.CreateAccountResponse;
import me.golemcore.gateway.adapter.inbound.web.dto.PlanChangeRequest;
import me.golemcore.gateway.adapter.inbound.web.security.AdminTokenVerifier;
import me.golemcore.gateway.domain.service.AccountProvisioningService;
import me.golemcore.gateway.domain.service.AdminOverviewService;
import me.golemcore.gateway.domain.service.PlanChangeService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Billing-side hooks (account provisioning, plan changes, deactivation) and
 * the operator overview.
 */
@RestController
@RequestMapping("/api/admin/accounts")
@RequiredArgsConstructor
public class AdminController {

    private final AdminTokenVerifier adminTokenVerifier;
    private final AccountProvisioningService accountProvisioningService;
    private final PlanChangeService planChangeService;
    private final AdminOverviewService adminOverviewService;

    /**
     * Newest accounts with their quota state, plus request count and cost of the
     * last 24 hours.
     */
    @GetMapping
    public Mono<ResponseEntity<AdminOverviewResponse>> getOverview(@RequestHeader HttpHeaders headers) {
        return Mono.fromCallable(() -> {
            adminTokenVerifier.verify(headers);
            return ResponseEntity.ok(AdminOverviewResponse.from(adminOverviewService.overview()));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping
    public Mono<ResponseEntity<CreateAccountResponse>> createAccount(@RequestHeader HttpHeaders headers,
            @RequestBody PlanChangeRequest request) {
        return Mono.fromCallable(() -> {
            adminTokenVerifier.verify(headers);
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(CreateAccountResponse.from(accountProvisioningService.createAccount(request.getTier())));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{accountId}/plan")
    public Mono<ResponseEntity<AccountStatusResponse>> changePlan(@RequestHeader HttpHeaders headers,
            @PathVariable String accountId, @RequestBody PlanChangeRequest request) {
        return Mono.fromCallable(() -> {
            adminTokenVerifier.verify(headers);
            return ResponseEntity.ok(AccountStatusResponse.from(
                    planChangeService.applyPlanChange(accountId, request.getTier())));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{accountId}/deactivate")
    public Mono<ResponseEntity<AccountStatusResponse>> deactivate(@RequestHeader HttpHeaders headers,
            @PathVariable String accountId) {
        return Mono.fromCallable(() -> {
            adminTokenVerifier.verify(headers);
            return ResponseEntity.ok(AccountStatusResponse.from(planChangeService.deactivate(accountId)));
        }).subscribeOn(Schedulers.boundedElastic());
    }
}

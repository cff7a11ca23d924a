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
import me.golemcore.gateway.adapter.inbound.web.dto.DailyUsageResponse;
import me.golemcore.gateway.adapter.inbound.web.dto.UsageRecordResponse;
import me.golemcore.gateway.adapter.inbound.web.security.ApiKeyResolver;
import me.golemcore.gateway.domain.admission.AdmissionPipeline;
import me.golemcore.gateway.domain.model.Account;
import me.golemcore.gateway.domain.model.ModelUsageSummary;
import me.golemcore.gateway.domain.service.UsageRecorder;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Usage analytics of the calling account. Read-only: these endpoints consume
 * neither quota nor rate budget.
 */
@RestController
@RequestMapping("/api/usage")
@RequiredArgsConstructor
public class UsageController {

    private final AdmissionPipeline admissionPipeline;
    private final UsageRecorder usageRecorder;
    private final ApiKeyResolver apiKeyResolver;

    @GetMapping("/daily")
    public Mono<ResponseEntity<List<DailyUsageResponse>>> getDaily(
            @RequestParam(defaultValue = "30") int days, ServerWebExchange exchange) {
        String credential = apiKeyResolver.resolve(exchange.getRequest());
        return Mono.fromCallable(() -> {
            Account account = admissionPipeline.authenticate(credential);
            List<DailyUsageResponse> daily = usageRecorder.dailyUsage(account.getId(), days).stream()
                    .map(DailyUsageResponse::from)
                    .toList();
            return ResponseEntity.ok(daily);
        });
    }

    @GetMapping("/by-model")
    public Mono<ResponseEntity<List<ModelUsageSummary>>> getByModel(
            @RequestParam(defaultValue = "30d") String period, ServerWebExchange exchange) {
        String credential = apiKeyResolver.resolve(exchange.getRequest());
        return Mono.fromCallable(() -> {
            Account account = admissionPipeline.authenticate(credential);
            return ResponseEntity.ok(usageRecorder.usageByModel(account.getId(), parsePeriod(period)));
        });
    }

    @GetMapping("/recent")
    public Mono<ResponseEntity<List<UsageRecordResponse>>> getRecent(
            @RequestParam(defaultValue = "50") int limit, ServerWebExchange exchange) {
        String credential = apiKeyResolver.resolve(exchange.getRequest());
        return Mono.fromCallable(() -> {
            Account account = admissionPipeline.authenticate(credential);
            List<UsageRecordResponse> recent = usageRecorder.recent(account.getId(), limit).stream()
                    .map(UsageRecordResponse::from)
                    .toList();
            return ResponseEntity.ok(recent);
        });
    }

    static Duration parsePeriod(String period) {
        return switch (period) {
        case "24h" -> Duration.ofHours(24);
        case "7d" -> Duration.ofDays(7);
        case "30d" -> Duration.ofDays(30);
        default -> throw new IllegalArgumentException("Unsupported period: " + period + " (use 24h, 7d or 30d)");
        };
    }
}

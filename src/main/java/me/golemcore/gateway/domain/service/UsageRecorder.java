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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.DailyAggregate;
import me.golemcore.gateway.domain.model.ModelUsageSummary;
import me.golemcore.gateway.domain.model.UsageRecord;
import me.golemcore.gateway.port.outbound.UsageLedgerPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records completed provider calls and answers the usage analytics queries.
 *
 * <p>
 * Recording appends the {@link UsageRecord} and then folds it into
 * the daily aggregate of the account. Both steps are idempotent by request id,
 * so the whole operation can be retried after a partial failure.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UsageRecorder {

    private static final int MAX_RECENT_LIMIT = 500;

    private final UsageLedgerPort usageLedger;
    private final Clock clock;

    public DailyAggregate record(UsageRecord usageRecord) {
        boolean appended = usageLedger.append(usageRecord);
        DailyAggregate aggregate = usageLedger.upsertDailyAggregate(usageRecord);
        if (appended) {
            log.debug("[Usage] Recorded request {}: account={}, provider={}, model={}, tokens={}, cost={}",
                    usageRecord.getRequestId(), usageRecord.getAccountId(), usageRecord.getProvider(),
                    usageRecord.getModel(), usageRecord.getTokens(), usageRecord.getCost());
        }
        return aggregate;
    }

    /**
     * Daily aggregates of the last {@code days} UTC days including today, newest
     * first. Days without traffic are omitted.
     */
    public List<DailyAggregate> dailyUsage(String accountId, int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive");
        }
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        List<DailyAggregate> aggregates = new ArrayList<>(
                usageLedger.findDailyAggregates(accountId, today.minusDays(days - 1L), today));
        aggregates.sort(Comparator.comparing(DailyAggregate::getDate).reversed());
        return aggregates;
    }

    /**
     * Per provider/model totals over the given period, busiest model first.
     */
    public List<ModelUsageSummary> usageByModel(String accountId, Duration period) {
        Instant since = clock.instant().minus(period);
        Map<String, ModelUsageSummary> byModel = new LinkedHashMap<>();
        for (UsageRecord usageRecord : usageLedger.findRecords(accountId, since)) {
            String key = usageRecord.getProvider() + "/" + usageRecord.getModel();
            ModelUsageSummary summary = byModel.computeIfAbsent(key, k -> ModelUsageSummary.builder()
                    .provider(usageRecord.getProvider())
                    .model(usageRecord.getModel())
                    .build());
            summary.setRequests(summary.getRequests() + 1);
            summary.setTokens(summary.getTokens() + usageRecord.getTokens());
            summary.setCost(summary.getCost() + usageRecord.getCost());
        }
        List<ModelUsageSummary> summaries = new ArrayList<>(byModel.values());
        summaries.sort(Comparator.comparingLong(ModelUsageSummary::getRequests).reversed());
        return summaries;
    }

    public List<UsageRecord> recent(String accountId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return usageLedger.findRecent(accountId, Math.min(limit, MAX_RECENT_LIMIT));
    }
}

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

import me.golemcore.gateway.domain.model.DailyAggregate;
import me.golemcore.gateway.domain.model.ModelUsageSummary;
import me.golemcore.gateway.domain.model.UsageRecord;
import me.golemcore.gateway.port.outbound.UsageLedgerPort;
import me.golemcore.gateway.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class UsageRecorderTest {

    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");

    private UsageLedgerPort usageLedger;
    private UsageRecorder usageRecorder;

    @BeforeEach
    void setUp() {
        usageLedger = mock(UsageLedgerPort.class);
        usageRecorder = new UsageRecorder(usageLedger, new MutableClock(NOW));
    }

    @Test
    void shouldAppendThenAggregate() {
        UsageRecord usageRecord = usageRecord("req-1", "openai", "gpt-4", 12, NOW);
        DailyAggregate aggregate = DailyAggregate.empty(LocalDate.of(2026, 10, 19), "acc-1").plus(12, 0.1, 500);
        when(usageLedger.append(usageRecord)).thenReturn(true);
        when(usageLedger.upsertDailyAggregate(usageRecord)).thenReturn(aggregate);

        DailyAggregate result = usageRecorder.record(usageRecord);

        assertSame(aggregate, result);
        var order = inOrder(usageLedger);
        order.verify(usageLedger).append(usageRecord);
        order.verify(usageLedger).upsertDailyAggregate(usageRecord);
    }

    @Test
    void shouldStillAggregateWhenRecordWasAlreadyAppended() {
        UsageRecord usageRecord = usageRecord("req-1", "openai", "gpt-4", 12, NOW);
        when(usageLedger.append(usageRecord)).thenReturn(false);

        usageRecorder.record(usageRecord);

        verify(usageLedger).upsertDailyAggregate(usageRecord);
    }

    @Test
    void shouldQueryDailyWindowNewestFirst() {
        LocalDate today = LocalDate.of(2026, 10, 19);
        DailyAggregate older = DailyAggregate.empty(today.minusDays(2), "acc-1").plus(1, 0, 1);
        DailyAggregate newer = DailyAggregate.empty(today, "acc-1").plus(1, 0, 1);
        when(usageLedger.findDailyAggregates("acc-1", today.minusDays(6), today)).thenReturn(List.of(older, newer));

        List<DailyAggregate> daily = usageRecorder.dailyUsage("acc-1", 7);

        assertEquals(List.of(newer, older), daily);
    }

    @Test
    void shouldSummarizeUsageByModel() {
        when(usageLedger.findRecords("acc-1", NOW.minus(Duration.ofDays(7)))).thenReturn(List.of(
                usageRecord("r1", "openai", "gpt-4", 10, NOW),
                usageRecord("r2", "anthropic", "claude-3-haiku-20240307", 5, NOW),
                usageRecord("r3", "anthropic", "claude-3-haiku-20240307", 7, NOW)));

        List<ModelUsageSummary> summaries = usageRecorder.usageByModel("acc-1", Duration.ofDays(7));

        assertEquals(2, summaries.size());
        ModelUsageSummary top = summaries.get(0);
        assertEquals("claude-3-haiku-20240307", top.getModel());
        assertEquals(2, top.getRequests());
        assertEquals(12, top.getTokens());
        assertEquals(0.02, top.getCost(), 1e-9);
    }

    @Test
    void shouldCapRecentLimitAndRejectInvalidArguments() {
        usageRecorder.recent("acc-1", 10_000);

        verify(usageLedger).findRecent("acc-1", 500);
        assertThrows(IllegalArgumentException.class, () -> usageRecorder.recent("acc-1", 0));
        assertThrows(IllegalArgumentException.class, () -> usageRecorder.dailyUsage("acc-1", 0));
        verify(usageLedger, never()).findDailyAggregates(any(), any(), any());
    }

    private static UsageRecord usageRecord(String requestId, String provider, String model, long tokens,
            Instant timestamp) {
        return UsageRecord.builder()
                .requestId(requestId)
                .accountId("acc-1")
                .provider(provider)
                .model(model)
                .tokens(tokens)
                .cost(0.01)
                .endpoint("/api/chat")
                .latency(Duration.ofMillis(300))
                .timestamp(timestamp)
                .build();
    }
}

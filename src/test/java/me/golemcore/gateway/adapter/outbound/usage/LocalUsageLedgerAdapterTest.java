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
package me.golemcore.gateway.adapter.outbound.usage;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gateway.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.gateway.domain.model.DailyAggregate;
import me.golemcore.gateway.domain.model.UsageRecord;
import me.golemcore.gateway.infrastructure.config.GatewayConfiguration;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LocalUsageLedgerAdapterTest {

    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2026, 10, 19);

    @TempDir
    Path tempDir;

    private GatewayProperties properties;
    private MutableClock clock;
    private LocalStorageAdapter storage;
    private ObjectMapper objectMapper;
    private final List<LocalUsageLedgerAdapter> ledgers = new ArrayList<>();

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        clock = new MutableClock(NOW);
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = GatewayConfiguration.objectMapper();
    }

    @AfterEach
    void tearDown() {
        ledgers.forEach(LocalUsageLedgerAdapter::destroy);
    }

    @Test
    void shouldAppendRecordAsJsonLineForItsDay() throws Exception {
        LocalUsageLedgerAdapter ledger = newLedger();

        assertTrue(ledger.append(usageRecord("req-1", 100, NOW)));

        List<String> lines = Files.readAllLines(tempDir.resolve("usage/2026-10-19.jsonl"));
        assertEquals(1, lines.size());
        assertTrue(lines.get(0).contains("\"requestId\":\"req-1\""));
    }

    @Test
    void shouldIgnoreDuplicateRequestIds() {
        LocalUsageLedgerAdapter ledger = newLedger();
        UsageRecord usageRecord = usageRecord("req-1", 100, NOW);

        assertTrue(ledger.append(usageRecord));
        assertFalse(ledger.append(usageRecord));
        ledger.upsertDailyAggregate(usageRecord);
        DailyAggregate aggregate = ledger.upsertDailyAggregate(usageRecord);

        assertEquals(1, ledger.findRecent("acc-1", 10).size());
        assertEquals(1, aggregate.getTotalRequests());
        assertEquals(100, aggregate.getTotalTokens());
    }

    @Test
    void shouldAggregatePerAccountAndDay() throws Exception {
        LocalUsageLedgerAdapter ledger = newLedger();
        record(ledger, usageRecord("req-1", 100, NOW));
        record(ledger, usageRecord("req-2", 50, NOW.plusSeconds(60)));
        record(ledger, usageRecord("req-3", 10, NOW.minus(Duration.ofDays(1))));

        DailyAggregate today = ledger.findDailyAggregate("acc-1", TODAY).orElseThrow();

        assertEquals(2, today.getTotalRequests());
        assertEquals(150, today.getTotalTokens());
        assertEquals(0.003, today.getTotalCost(), 1e-12);
        assertEquals(250.0, today.getAvgLatencyMs(), 1e-9);
        assertEquals(2, ledger.findDailyAggregates("acc-1", TODAY.minusDays(6), TODAY).size());
        assertTrue(Files.exists(tempDir.resolve("analytics/2026-10-19/acc-1.json")));
    }

    @Test
    void shouldReturnRecentRecordsNewestFirst() {
        LocalUsageLedgerAdapter ledger = newLedger();
        record(ledger, usageRecord("req-1", 1, NOW.minusSeconds(120)));
        record(ledger, usageRecord("req-2", 2, NOW));
        record(ledger, usageRecord("req-3", 3, NOW.minusSeconds(60)));

        List<UsageRecord> recent = ledger.findRecent("acc-1", 2);

        assertEquals(List.of("req-2", "req-3"), recent.stream().map(UsageRecord::getRequestId).toList());
        assertEquals(2, ledger.findRecords("acc-1", NOW.minusSeconds(90)).size());
    }

    @Test
    void shouldRecomputeAggregatesFromRecordsOnReload() throws Exception {
        LocalUsageLedgerAdapter ledger = newLedger();
        record(ledger, usageRecord("req-1", 100, NOW));
        // Record appended but the process died before the aggregate was written
        ledger.append(usageRecord("req-2", 40, NOW.plusSeconds(1)));

        LocalUsageLedgerAdapter reloaded = newLedger();

        DailyAggregate today = reloaded.findDailyAggregate("acc-1", TODAY).orElseThrow();
        assertEquals(2, today.getTotalRequests());
        assertEquals(140, today.getTotalTokens());
        assertFalse(reloaded.append(usageRecord("req-1", 100, NOW)));
        assertEquals(2, reloaded.findRecent("acc-1", 10).size());
    }

    @Test
    void shouldSkipMalformedLinesOnReload() throws Exception {
        LocalUsageLedgerAdapter ledger = newLedger();
        record(ledger, usageRecord("req-1", 100, NOW));
        Files.writeString(tempDir.resolve("usage/2026-10-19.jsonl"), "{not json\n",
                StandardOpenOption.APPEND);

        LocalUsageLedgerAdapter reloaded = newLedger();

        assertEquals(1, reloaded.findRecent("acc-1", 10).size());
    }

    @Test
    void shouldEvictRecordsBeyondRetention() {
        properties.getUsage().setRetentionDays(7);
        LocalUsageLedgerAdapter ledger = newLedger();
        record(ledger, usageRecord("old", 10, NOW.minus(Duration.ofDays(8))));
        record(ledger, usageRecord("new", 10, NOW));

        ledger.evictOldRecords();

        assertEquals(List.of("new"), ledger.findRecent("acc-1", 10).stream()
                .map(UsageRecord::getRequestId).toList());
        // Aggregates outlive the raw records
        assertTrue(ledger.findDailyAggregate("acc-1", TODAY.minusDays(8)).isPresent());
    }

    @Test
    void shouldNotLoadFilesBeyondRetention() {
        properties.getUsage().setRetentionDays(7);
        LocalUsageLedgerAdapter ledger = newLedger();
        record(ledger, usageRecord("old", 10, NOW.minus(Duration.ofDays(10))));

        LocalUsageLedgerAdapter reloaded = newLedger();

        assertTrue(reloaded.findRecent("acc-1", 10).isEmpty());
        assertTrue(reloaded.findDailyAggregate("acc-1", TODAY.minusDays(10)).isPresent());
    }

    private LocalUsageLedgerAdapter newLedger() {
        LocalUsageLedgerAdapter ledger = new LocalUsageLedgerAdapter(storage, objectMapper, properties, clock);
        ledger.init();
        ledgers.add(ledger);
        return ledger;
    }

    private static void record(LocalUsageLedgerAdapter ledger, UsageRecord usageRecord) {
        ledger.append(usageRecord);
        ledger.upsertDailyAggregate(usageRecord);
    }

    private static UsageRecord usageRecord(String requestId, long tokens, Instant timestamp) {
        return UsageRecord.builder()
                .requestId(requestId)
                .accountId("acc-1")
                .provider("openai")
                .model("gpt-3.5-turbo")
                .tokens(tokens)
                .cost(0.0015)
                .endpoint("/api/chat")
                .latency(Duration.ofMillis(250))
                .timestamp(timestamp)
                .build();
    }
}

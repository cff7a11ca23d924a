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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.DailyAggregate;
import me.golemcore.gateway.domain.model.UsageRecord;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.StoragePort;
import me.golemcore.gateway.port.outbound.UsageLedgerPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Usage ledger persisted to JSONL with per-day aggregate snapshots.
 *
 * <p>
 * Storage layout:
 * <ul>
 * <li>{@code usage/<yyyy-MM-dd>.jsonl} - one usage record per line, append
 * only</li>
 * <li>{@code analytics/<yyyy-MM-dd>/<accountId>.json} - the daily aggregate of
 * one account</li>
 * </ul>
 *
 * <p>
 * Records within the retention window are indexed in memory for analytics
 * queries and evicted hourly; the JSONL files themselves are kept. On startup
 * the aggregates of every retained day are recomputed from its records, so an
 * aggregate write lost to a crash is repaired.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class LocalUsageLedgerAdapter implements UsageLedgerPort {

    private static final String USAGE_DIR = "usage";
    private static final String ANALYTICS_DIR = "analytics";
    private static final String JSONL_EXTENSION = ".jsonl";
    private static final String JSON_EXTENSION = ".json";
    private static final String NEWLINE = "\n";
    private static final String LOG_PREFIX = "[Usage]";
    private static final int EVICTION_INTERVAL_HOURS = 1;
    private static final int EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 2;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final GatewayProperties properties;
    private final Clock clock;

    private final Map<String, List<UsageRecord>> recordsByAccount = new ConcurrentHashMap<>();
    private final Map<String, Instant> appendedRequestIds = new ConcurrentHashMap<>();
    private final Map<String, Instant> aggregatedRequestIds = new ConcurrentHashMap<>();
    private final Map<String, DailyAggregate> aggregates = new ConcurrentHashMap<>();

    private final ScheduledExecutorService evictionExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "usage-eviction");
        t.setDaemon(true);
        return t;
    });

    public LocalUsageLedgerAdapter(StoragePort storagePort, ObjectMapper objectMapper, GatewayProperties properties,
            Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        loadAggregates();
        loadRecords();
        evictionExecutor.scheduleAtFixedRate(this::evictOldRecords,
                EVICTION_INTERVAL_HOURS, EVICTION_INTERVAL_HOURS, TimeUnit.HOURS);
    }

    @PreDestroy
    void destroy() {
        evictionExecutor.shutdownNow();
        try {
            evictionExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean append(UsageRecord usageRecord) {
        String requestId = usageRecord.getRequestId();
        if (appendedRequestIds.putIfAbsent(requestId, usageRecord.getTimestamp()) != null) {
            log.debug("{} Record {} already appended", LOG_PREFIX, requestId);
            return false;
        }
        try {
            String line = objectMapper.writeValueAsString(usageRecord) + NEWLINE;
            join(storagePort.appendText(USAGE_DIR, dateOf(usageRecord) + JSONL_EXTENSION, line));
        } catch (JsonProcessingException e) {
            appendedRequestIds.remove(requestId);
            throw new IllegalStateException("Failed to serialize usage record " + requestId, e);
        } catch (RuntimeException e) {
            appendedRequestIds.remove(requestId);
            throw e;
        }
        recordsByAccount.computeIfAbsent(usageRecord.getAccountId(), k -> new CopyOnWriteArrayList<>())
                .add(usageRecord);
        return true;
    }

    @Override
    public DailyAggregate upsertDailyAggregate(UsageRecord usageRecord) {
        LocalDate date = dateOf(usageRecord);
        String accountId = usageRecord.getAccountId();
        String requestId = usageRecord.getRequestId();

        return aggregates.compute(aggregateKey(accountId, date), (key, existing) -> {
            DailyAggregate base = existing != null ? existing : DailyAggregate.empty(date, accountId);
            if (aggregatedRequestIds.containsKey(requestId)) {
                return base;
            }
            DailyAggregate next = base.plus(usageRecord.getTokens(), usageRecord.getCost(),
                    latencyMillis(usageRecord));
            persistAggregate(next);
            aggregatedRequestIds.put(requestId, usageRecord.getTimestamp());
            return next;
        });
    }

    @Override
    public Optional<DailyAggregate> findDailyAggregate(String accountId, LocalDate date) {
        return Optional.ofNullable(aggregates.get(aggregateKey(accountId, date)));
    }

    @Override
    public List<DailyAggregate> findDailyAggregates(String accountId, LocalDate from, LocalDate to) {
        List<DailyAggregate> result = new ArrayList<>();
        for (LocalDate date = from; !date.isAfter(to); date = date.plusDays(1)) {
            DailyAggregate aggregate = aggregates.get(aggregateKey(accountId, date));
            if (aggregate != null) {
                result.add(aggregate);
            }
        }
        return result;
    }

    @Override
    public List<UsageRecord> findRecords(String accountId, Instant since) {
        return recordsByAccount.getOrDefault(accountId, List.of()).stream()
                .filter(usageRecord -> !usageRecord.getTimestamp().isBefore(since))
                .toList();
    }

    @Override
    public List<UsageRecord> findRecent(String accountId, int limit) {
        return recordsByAccount.getOrDefault(accountId, List.of()).stream()
                .sorted(Comparator.comparing(UsageRecord::getTimestamp).reversed())
                .limit(limit)
                .toList();
    }

    void evictOldRecords() {
        Instant cutoff = clock.instant().minus(retention());
        int evicted = 0;
        for (List<UsageRecord> records : recordsByAccount.values()) {
            int before = records.size();
            records.removeIf(usageRecord -> usageRecord.getTimestamp().isBefore(cutoff));
            evicted += before - records.size();
        }
        appendedRequestIds.values().removeIf(timestamp -> timestamp.isBefore(cutoff));
        aggregatedRequestIds.values().removeIf(timestamp -> timestamp.isBefore(cutoff));
        if (evicted > 0) {
            log.debug("{} Evicted {} records beyond {}d retention", LOG_PREFIX, evicted, retention().toDays());
        }
    }

    private void loadAggregates() {
        int loaded = 0;
        for (String file : storagePort.listObjects(ANALYTICS_DIR, "").join()) {
            if (!file.endsWith(JSON_EXTENSION)) {
                continue;
            }
            try {
                String content = storagePort.getText(ANALYTICS_DIR, file).join();
                if (content == null || content.isBlank()) {
                    continue;
                }
                DailyAggregate aggregate = objectMapper.readValue(content, DailyAggregate.class);
                aggregates.put(aggregateKey(aggregate.getAccountId(), aggregate.getDate()), aggregate);
                loaded++;
            } catch (JsonProcessingException e) {
                log.warn("{} Skipping unreadable aggregate {}: {}", LOG_PREFIX, file, e.getOriginalMessage());
            }
        }
        log.debug("{} Loaded {} daily aggregates", LOG_PREFIX, loaded);
    }

    private void loadRecords() {
        LocalDate firstRetainedDay = LocalDate.ofInstant(clock.instant().minus(retention()), ZoneOffset.UTC);
        Map<String, DailyAggregate> recomputed = new HashMap<>();
        int loaded = 0;
        int skippedFiles = 0;

        for (String file : storagePort.listObjects(USAGE_DIR, "").join()) {
            LocalDate day = parseDay(file);
            if (day == null) {
                continue;
            }
            if (day.isBefore(firstRetainedDay)) {
                skippedFiles++;
                continue;
            }
            String content = storagePort.getText(USAGE_DIR, file).join();
            if (content == null || content.isBlank()) {
                continue;
            }
            for (String line : content.split(NEWLINE)) {
                if (line.isBlank()) {
                    continue;
                }
                UsageRecord usageRecord;
                try {
                    usageRecord = objectMapper.readValue(line, UsageRecord.class);
                } catch (JsonProcessingException e) {
                    log.debug("{} Skipping malformed line in {}: {}", LOG_PREFIX, file, e.getOriginalMessage());
                    continue;
                }
                if (appendedRequestIds.putIfAbsent(usageRecord.getRequestId(), usageRecord.getTimestamp()) != null) {
                    continue;
                }
                aggregatedRequestIds.put(usageRecord.getRequestId(), usageRecord.getTimestamp());
                recordsByAccount.computeIfAbsent(usageRecord.getAccountId(), k -> new CopyOnWriteArrayList<>())
                        .add(usageRecord);
                LocalDate date = dateOf(usageRecord);
                recomputed.merge(aggregateKey(usageRecord.getAccountId(), date),
                        DailyAggregate.empty(date, usageRecord.getAccountId()).plus(usageRecord.getTokens(),
                                usageRecord.getCost(), latencyMillis(usageRecord)),
                        LocalUsageLedgerAdapter::mergeAggregates);
                loaded++;
            }
        }

        for (Map.Entry<String, DailyAggregate> entry : recomputed.entrySet()) {
            DailyAggregate aggregate = entry.getValue();
            if (!aggregate.equals(aggregates.get(entry.getKey()))) {
                persistAggregate(aggregate);
            }
            aggregates.put(entry.getKey(), aggregate);
        }
        log.info("{} Loaded {} usage records from storage (skipped {} files beyond {}d retention)",
                LOG_PREFIX, loaded, skippedFiles, retention().toDays());
    }

    private static DailyAggregate mergeAggregates(DailyAggregate left, DailyAggregate right) {
        long requests = left.getTotalRequests() + right.getTotalRequests();
        double average = (left.getAvgLatencyMs() * left.getTotalRequests()
                + right.getAvgLatencyMs() * right.getTotalRequests()) / requests;
        return left.toBuilder()
                .totalRequests(requests)
                .totalTokens(left.getTotalTokens() + right.getTotalTokens())
                .totalCost(left.getTotalCost() + right.getTotalCost())
                .avgLatencyMs(average)
                .build();
    }

    private void persistAggregate(DailyAggregate aggregate) {
        String json;
        try {
            json = objectMapper.writeValueAsString(aggregate);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize aggregate for " + aggregate.getAccountId(), e);
        }
        join(storagePort.putTextAtomic(ANALYTICS_DIR,
                aggregate.getDate() + "/" + aggregate.getAccountId() + JSON_EXTENSION, json));
    }

    private Duration retention() {
        return Duration.ofDays(properties.getUsage().getRetentionDays());
    }

    private static LocalDate parseDay(String file) {
        if (!file.endsWith(JSONL_EXTENSION)) {
            return null;
        }
        String name = file.substring(file.lastIndexOf('/') + 1, file.length() - JSONL_EXTENSION.length());
        try {
            return LocalDate.parse(name);
        } catch (DateTimeParseException e) {
            log.debug("{} Ignoring usage file with unexpected name: {}", LOG_PREFIX, file);
            return null;
        }
    }

    private static LocalDate dateOf(UsageRecord usageRecord) {
        return LocalDate.ofInstant(usageRecord.getTimestamp(), ZoneOffset.UTC);
    }

    private static double latencyMillis(UsageRecord usageRecord) {
        return usageRecord.getLatency() != null ? usageRecord.getLatency().toMillis() : 0.0;
    }

    private static String aggregateKey(String accountId, LocalDate date) {
        return accountId + "|" + date;
    }

    private static void join(CompletableFuture<Void> future) {
        try {
            future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }
}

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
package me.golemcore.gateway.port.outbound;

import me.golemcore.gateway.domain.model.DailyAggregate;
import me.golemcore.gateway.domain.model.UsageRecord;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Append-only usage log plus the per-account daily aggregates derived from it.
 * Both writes are idempotent by request id, so a retried write is applied once.
 */
public interface UsageLedgerPort {

    /**
     * Append a usage record. Returns false when a record with the same request id
     * was already appended.
     */
    boolean append(UsageRecord usageRecord);

    /**
     * Fold a usage record into the aggregate of its account and UTC day. Returns
     * the aggregate after the update.
     */
    DailyAggregate upsertDailyAggregate(UsageRecord usageRecord);

    Optional<DailyAggregate> findDailyAggregate(String accountId, LocalDate date);

    List<DailyAggregate> findDailyAggregates(String accountId, LocalDate from, LocalDate to);

    List<UsageRecord> findRecords(String accountId, Instant since);

    /**
     * Most recent records of an account, newest first.
     */
    List<UsageRecord> findRecent(String accountId, int limit);
}

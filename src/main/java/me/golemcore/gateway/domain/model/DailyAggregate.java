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
package me.golemcore.gateway.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Per-account, per-day accumulator of request count, token and cost sums and a
 * simple running average latency.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DailyAggregate {

    private LocalDate date;
    private String accountId;
    private long totalRequests;
    private long totalTokens;
    private double totalCost;
    private double avgLatencyMs;

    public static DailyAggregate empty(LocalDate date, String accountId) {
        return DailyAggregate.builder()
                .date(date)
                .accountId(accountId)
                .build();
    }

    /**
     * Returns a new aggregate with one more request folded in. The average is the
     * arithmetic mean over all requests of the day.
     */
    public DailyAggregate plus(long tokens, double cost, double latencyMs) {
        long requests = totalRequests + 1;
        double average = avgLatencyMs + (latencyMs - avgLatencyMs) / requests;
        return toBuilder()
                .totalRequests(requests)
                .totalTokens(totalTokens + tokens)
                .totalCost(totalCost + cost)
                .avgLatencyMs(average)
                .build();
    }
}

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
package me.golemcore.gateway.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.gateway.domain.model.DailyAggregate;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyUsageResponse {

    private LocalDate date;
    @JsonProperty("total_requests")
    private long totalRequests;
    @JsonProperty("total_tokens")
    private long totalTokens;
    @JsonProperty("total_cost")
    private double totalCost;
    @JsonProperty("avg_response_time")
    private double avgResponseTime;

    public static DailyUsageResponse from(DailyAggregate aggregate) {
        return DailyUsageResponse.builder()
                .date(aggregate.getDate())
                .totalRequests(aggregate.getTotalRequests())
                .totalTokens(aggregate.getTotalTokens())
                .totalCost(aggregate.getTotalCost())
                .avgResponseTime(aggregate.getAvgLatencyMs() / 1000.0)
                .build();
    }
}

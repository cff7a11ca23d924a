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
import me.golemcore.gateway.domain.model.UsageRecord;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageRecordResponse {

    @JsonProperty("request_id")
    private String requestId;
    private String provider;
    private String model;
    @JsonProperty("tokens_used")
    private long tokensUsed;
    private double cost;
    private String endpoint;
    @JsonProperty("response_time")
    private double responseTime;
    private Instant timestamp;

    public static UsageRecordResponse from(UsageRecord usageRecord) {
        return UsageRecordResponse.builder()
                .requestId(usageRecord.getRequestId())
                .provider(usageRecord.getProvider())
                .model(usageRecord.getModel())
                .tokensUsed(usageRecord.getTokens())
                .cost(usageRecord.getCost())
                .endpoint(usageRecord.getEndpoint())
                .responseTime(usageRecord.getLatency() != null ? usageRecord.getLatency().toMillis() / 1000.0 : 0.0)
                .timestamp(usageRecord.getTimestamp())
                .build();
    }
}

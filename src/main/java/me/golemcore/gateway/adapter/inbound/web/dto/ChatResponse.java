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
import me.golemcore.gateway.domain.model.MeteredCompletion;

/**
 * Chat completion with the caller's quota position after this call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

    private String response;
    @JsonProperty("model_used")
    private String modelUsed;
    private String provider;
    @JsonProperty("tokens_used")
    private long tokensUsed;
    private double cost;
    // Seconds
    @JsonProperty("response_time")
    private double responseTime;
    @JsonProperty("total_tokens_used")
    private long totalTokensUsed;
    @JsonProperty("remaining_quota")
    private long remainingQuota;
    @JsonProperty("quota_percentage")
    private double quotaPercentage;
    @JsonProperty("request_id")
    private String requestId;

    public static ChatResponse from(MeteredCompletion completion) {
        return ChatResponse.builder()
                .response(completion.getText())
                .modelUsed(completion.getModel())
                .provider(completion.getProvider().getId())
                .tokensUsed(completion.getTokens())
                .cost(completion.getCost())
                .responseTime(completion.getLatency() != null ? completion.getLatency().toMillis() / 1000.0 : 0.0)
                .totalTokensUsed(completion.getTotalTokensUsed())
                .remainingQuota(completion.getRemainingQuota())
                .quotaPercentage(Math.round(completion.getQuotaPercentage() * 100.0) / 100.0)
                .requestId(completion.getRequestId())
                .build();
    }
}

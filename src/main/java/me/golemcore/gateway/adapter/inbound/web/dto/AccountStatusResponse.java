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
import me.golemcore.gateway.domain.model.Account;
import me.golemcore.gateway.domain.model.QuotaSnapshot;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountStatusResponse {

    @JsonProperty("account_id")
    private String accountId;
    private String tier;
    @JsonProperty("tokens_included")
    private long tokensIncluded;
    @JsonProperty("tokens_used")
    private long tokensUsed;
    @JsonProperty("remaining_quota")
    private long remainingQuota;
    @JsonProperty("quota_percentage")
    private double quotaPercentage;
    @JsonProperty("period_end")
    private Instant periodEnd;
    private boolean active;

    public static AccountStatusResponse from(Account account) {
        QuotaSnapshot quota = account.quotaSnapshot();
        return AccountStatusResponse.builder()
                .accountId(account.getId())
                .tier(account.getTier())
                .tokensIncluded(quota.tokensIncluded())
                .tokensUsed(quota.tokensUsed())
                .remainingQuota(quota.remaining())
                .quotaPercentage(Math.round(quota.percentage() * 100.0) / 100.0)
                .periodEnd(quota.periodEnd())
                .active(account.isActive())
                .build();
    }
}

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
import me.golemcore.gateway.domain.model.AdminOverview;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdminOverviewResponse {

    @JsonProperty("total_accounts")
    private long totalAccounts;
    @JsonProperty("daily_requests")
    private long dailyRequests;
    @JsonProperty("daily_cost")
    private double dailyCost;
    private List<AccountStatusResponse> accounts;

    public static AdminOverviewResponse from(AdminOverview overview) {
        return AdminOverviewResponse.builder()
                .totalAccounts(overview.getTotalAccounts())
                .dailyRequests(overview.getRequestsLast24h())
                .dailyCost(overview.getCostLast24h())
                .accounts(overview.getAccounts().stream()
                        .map(AccountStatusResponse::from)
                        .toList())
                .build();
    }
}

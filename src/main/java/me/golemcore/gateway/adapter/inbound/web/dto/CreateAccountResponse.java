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

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateAccountResponse {

    @JsonProperty("account_id")
    private String accountId;
    @JsonProperty("api_key")
    private String apiKey;
    private String tier;
    @JsonProperty("tokens_included")
    private long tokensIncluded;

    public static CreateAccountResponse from(Account account) {
        return CreateAccountResponse.builder()
                .accountId(account.getId())
                .apiKey(account.getApiKey())
                .tier(account.getTier())
                .tokensIncluded(account.getTokensIncluded())
                .build();
    }
}

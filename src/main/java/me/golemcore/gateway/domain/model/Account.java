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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Billable identity with its current plan, token quota counters and billing
 * period boundary.
 *
 * <p>
 * Usage fields ({@code tokensUsed}, {@code periodEnd}, {@code recentDebitIds})
 * are only mutated by the quota enforcer; {@code tier} and
 * {@code tokensIncluded} only by plan-change events. Accounts are never hard
 * deleted, deactivation flips {@code active} to false.
 *
 * <p>
 * {@code tokensUsed} may exceed {@code tokensIncluded} by up to one call's
 * worth of tokens: the ceiling is checked before a call, not during it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Account {

    private String id;
    private String apiKey;
    private String tier;
    private long tokensIncluded;
    private long tokensUsed;
    private Instant periodEnd;
    @Builder.Default
    private boolean active = true;
    private Instant createdAt;
    private Instant updatedAt;

    /** Request ids of the most recent debits, oldest first. */
    @Builder.Default
    private List<String> recentDebitIds = new ArrayList<>();

    public QuotaSnapshot quotaSnapshot() {
        return new QuotaSnapshot(tokensIncluded, tokensUsed, periodEnd);
    }

    /**
     * Deep copy handed to atomic update functions so the stored instance is never
     * mutated in place.
     */
    public Account copy() {
        return toBuilder()
                .recentDebitIds(new ArrayList<>(recentDebitIds != null ? recentDebitIds : List.of()))
                .build();
    }
}

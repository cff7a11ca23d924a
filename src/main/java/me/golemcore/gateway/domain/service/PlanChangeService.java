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
package me.golemcore.gateway.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.Account;
import me.golemcore.gateway.domain.model.PlanChange;
import me.golemcore.gateway.domain.model.PlanPolicy;
import me.golemcore.gateway.port.outbound.AccountStorePort;
import me.golemcore.gateway.port.outbound.PlanPolicyPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.NoSuchElementException;

/**
 * Applies plan-change and deactivation events delivered by the billing side.
 * Usage counters are left untouched, a changed tier takes effect on the next
 * admission.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlanChangeService {

    private final AccountStorePort accountStore;
    private final PlanPolicyPort planPolicyPort;
    private final Clock clock;

    /**
     * Moves the account to {@code tier} with the tier's token quota.
     *
     * @throws IllegalArgumentException
     *             for an unknown tier
     * @throws NoSuchElementException
     *             for an unknown account
     */
    public Account applyPlanChange(String accountId, String tier) {
        PlanPolicy policy = planPolicyPort.lookup(tier)
                .orElseThrow(() -> new IllegalArgumentException("Unknown plan tier: " + tier));
        return applyPlanChange(accountId, PlanChange.builder()
                .tier(policy.getTier())
                .tokensIncluded(policy.getTokensPerPeriod())
                .build());
    }

    public Account applyPlanChange(String accountId, PlanChange change) {
        Account updated = accountStore.update(accountId, account -> {
            account.setTier(change.getTier());
            account.setTokensIncluded(change.getTokensIncluded());
            account.setUpdatedAt(clock.instant());
            return account;
        }).orElseThrow(() -> new NoSuchElementException("Account not found: " + accountId));
        log.info("[Plan] Account {} moved to tier {} ({} tokens per period)", accountId, change.getTier(),
                change.getTokensIncluded());
        return updated;
    }

    public Account deactivate(String accountId) {
        Account updated = accountStore.update(accountId, account -> {
            account.setActive(false);
            account.setUpdatedAt(clock.instant());
            return account;
        }).orElseThrow(() -> new NoSuchElementException("Account not found: " + accountId));
        log.info("[Plan] Account {} deactivated", accountId);
        return updated;
    }
}

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.exception.AdmissionDeniedException;
import me.golemcore.gateway.domain.model.Account;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.AccountStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Enforces the per-account token quota and billing-period rollover.
 *
 * <p>
 * Every state change goes through {@link AccountStorePort#update}, so the
 * rollover, the admission decision and the debit each happen inside one
 * per-account atomic read-modify-write. The quota is a soft ceiling: admission
 * compares the pre-call counter, so one in-flight call may push
 * {@code tokensUsed} past {@code tokensIncluded} and only the next request is
 * denied.
 *
 * <p>
 * Debits are idempotent by request id. The ids of recent debits are kept on the
 * account, so a retried debit is applied once.
 */
@Service
@Slf4j
public class QuotaEnforcer {

    static final int MAX_REMEMBERED_DEBITS = 64;

    private final AccountStorePort accountStore;
    private final GatewayProperties properties;
    private final Clock clock;

    public QuotaEnforcer(AccountStorePort accountStore, GatewayProperties properties, Clock clock) {
        this.accountStore = accountStore;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Admission gate. Applies a pending rollover first, then rejects inactive
     * accounts and accounts whose period quota is used up.
     *
     * @return the account state the decision was made on
     * @throws AdmissionDeniedException
     *             with {@code AUTH_DENIED} or {@code QUOTA_EXCEEDED}
     */
    public Account admit(String accountId) {
        Account account = refresh(accountId)
                .orElseThrow(() -> AdmissionDeniedException.authDenied("Invalid or inactive API key"));
        if (!account.isActive()) {
            throw AdmissionDeniedException.authDenied("Invalid or inactive API key");
        }
        if (account.quotaSnapshot().exhausted()) {
            log.info("[Quota] Account {} exceeded quota ({}/{} tokens)", accountId,
                    account.getTokensUsed(), account.getTokensIncluded());
            throw AdmissionDeniedException.quotaExceeded(properties.getUpgradeUrl());
        }
        return account;
    }

    /**
     * Returns the account with any due rollover applied and persisted. Inactive
     * accounts are returned untouched.
     */
    public Optional<Account> refresh(String accountId) {
        return accountStore.update(accountId, account -> {
            if (account.isActive()) {
                applyRollover(account, clock.instant());
            }
            return account;
        });
    }

    /**
     * Adds {@code tokens} to the period usage of the account, once per
     * {@code requestId}. A rollover that became due while the call was in flight
     * is applied first.
     *
     * @return the account state after the debit
     * @throws NoSuchElementException
     *             if the account does not exist
     */
    public Account debit(String accountId, String requestId, long tokens) {
        if (tokens < 0) {
            throw new IllegalArgumentException("Token debit must not be negative: " + tokens);
        }
        return accountStore.update(accountId, account -> {
            Instant now = clock.instant();
            applyRollover(account, now);
            List<String> debitIds = account.getRecentDebitIds() != null
                    ? account.getRecentDebitIds()
                    : new ArrayList<>();
            if (debitIds.contains(requestId)) {
                log.debug("[Quota] Debit {} already applied to account {}", requestId, accountId);
                return account;
            }
            account.setTokensUsed(account.getTokensUsed() + tokens);
            account.setUpdatedAt(now);
            debitIds.add(requestId);
            while (debitIds.size() > MAX_REMEMBERED_DEBITS) {
                debitIds.remove(0);
            }
            account.setRecentDebitIds(debitIds);
            return account;
        }).orElseThrow(() -> new NoSuchElementException("Account not found for debit: " + accountId));
    }

    private void applyRollover(Account account, Instant now) {
        Duration period = Duration.ofDays(properties.getBillingPeriodDays());
        if (account.getPeriodEnd() == null) {
            account.setPeriodEnd(now.plus(period));
            account.setUpdatedAt(now);
            return;
        }
        if (now.isAfter(account.getPeriodEnd())) {
            log.info("[Quota] Billing period rollover for account {} ({} tokens used in previous period)",
                    account.getId(), account.getTokensUsed());
            account.setTokensUsed(0);
            account.setPeriodEnd(now.plus(period));
            account.setUpdatedAt(now);
        }
    }
}

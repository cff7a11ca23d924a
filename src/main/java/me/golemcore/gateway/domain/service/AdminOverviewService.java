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
import me.golemcore.gateway.domain.model.Account;
import me.golemcore.gateway.domain.model.AdminOverview;
import me.golemcore.gateway.domain.model.UsageRecord;
import me.golemcore.gateway.port.outbound.AccountStorePort;
import me.golemcore.gateway.port.outbound.UsageLedgerPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the operator overview from the account store and the usage ledger.
 */
@Service
@RequiredArgsConstructor
public class AdminOverviewService {

    static final int MAX_LISTED_ACCOUNTS = 50;
    private static final Duration RECENT_WINDOW = Duration.ofHours(24);

    private final AccountStorePort accountStore;
    private final UsageLedgerPort usageLedger;
    private final Clock clock;

    public AdminOverview overview() {
        List<Account> accounts = accountStore.findAll();
        Instant since = clock.instant().minus(RECENT_WINDOW);

        long requests = 0;
        double cost = 0;
        for (Account account : accounts) {
            List<UsageRecord> records = usageLedger.findRecords(account.getId(), since);
            requests += records.size();
            cost += records.stream().mapToDouble(UsageRecord::getCost).sum();
        }

        List<Account> newest = accounts.stream()
                .sorted(Comparator.comparing(Account::getCreatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(MAX_LISTED_ACCOUNTS)
                .toList();
        return AdminOverview.builder()
                .totalAccounts(accounts.size())
                .requestsLast24h(requests)
                .costLast24h(cost)
                .accounts(newest)
                .build();
    }
}

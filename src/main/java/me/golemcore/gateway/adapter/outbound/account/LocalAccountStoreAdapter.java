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
package me.golemcore.gateway.adapter.outbound.account;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.Account;
import me.golemcore.gateway.port.outbound.AccountStorePort;
import me.golemcore.gateway.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Account store keeping one JSON snapshot per account under {@code accounts/}
 * with an in-memory index by id and API key.
 *
 * <p>
 * {@link #update} holds a per-account lock across read, mutation and the
 * atomic file write, so updates of one account are linearizable while
 * different accounts proceed in parallel. The in-memory state only changes
 * after the snapshot was written.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalAccountStoreAdapter implements AccountStorePort {

    private static final String ACCOUNTS_DIR = "accounts";
    private static final String JSON_EXTENSION = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    private final Map<String, Account> accountsById = new ConcurrentHashMap<>();
    private final Map<String, String> accountIdsByApiKey = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Object createLock = new Object();

    @PostConstruct
    void init() {
        List<String> files = storagePort.listObjects(ACCOUNTS_DIR, "").join();
        int loaded = 0;
        for (String file : files) {
            if (!file.endsWith(JSON_EXTENSION)) {
                continue;
            }
            String json = storagePort.getText(ACCOUNTS_DIR, file).join();
            if (json == null || json.isBlank()) {
                continue;
            }
            try {
                Account account = objectMapper.readValue(json, Account.class);
                index(account);
                loaded++;
            } catch (JsonProcessingException e) {
                log.warn("[Accounts] Skipping unreadable account snapshot {}: {}", file, e.getOriginalMessage());
            }
        }
        log.info("[Accounts] Loaded {} accounts from storage", loaded);
    }

    @Override
    public Optional<Account> findById(String accountId) {
        if (accountId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(accountsById.get(accountId)).map(Account::copy);
    }

    @Override
    public Optional<Account> findByApiKey(String apiKey) {
        if (apiKey == null) {
            return Optional.empty();
        }
        String accountId = accountIdsByApiKey.get(apiKey);
        return accountId != null ? findById(accountId) : Optional.empty();
    }

    @Override
    public List<Account> findAll() {
        List<Account> accounts = new ArrayList<>();
        for (Account account : accountsById.values()) {
            accounts.add(account.copy());
        }
        accounts.sort(Comparator.comparing(Account::getId));
        return accounts;
    }

    @Override
    public Account create(Account account) {
        if (account.getId() == null || account.getApiKey() == null) {
            throw new IllegalArgumentException("Account id and API key are required");
        }
        synchronized (createLock) {
            if (accountsById.containsKey(account.getId())) {
                throw new IllegalArgumentException("Account already exists: " + account.getId());
            }
            if (accountIdsByApiKey.containsKey(account.getApiKey())) {
                throw new IllegalArgumentException("API key already in use");
            }
            Account stored = account.copy();
            persist(stored);
            index(stored);
            return stored.copy();
        }
    }

    @Override
    public Optional<Account> update(String accountId, UnaryOperator<Account> mutation) {
        if (accountId == null) {
            return Optional.empty();
        }
        ReentrantLock lock = locks.computeIfAbsent(accountId, id -> new ReentrantLock());
        lock.lock();
        try {
            Account current = accountsById.get(accountId);
            if (current == null) {
                return Optional.empty();
            }
            Account updated = mutation.apply(current.copy());
            if (updated == null) {
                throw new IllegalStateException("Account mutation returned null for " + accountId);
            }
            if (!accountId.equals(updated.getId())) {
                throw new IllegalStateException("Account mutation must not change the id of " + accountId);
            }
            if (!updated.equals(current)) {
                persist(updated);
                if (!current.getApiKey().equals(updated.getApiKey())) {
                    accountIdsByApiKey.remove(current.getApiKey());
                }
                index(updated);
            }
            return Optional.of(updated.copy());
        } finally {
            lock.unlock();
        }
    }

    private void index(Account account) {
        accountsById.put(account.getId(), account);
        accountIdsByApiKey.put(account.getApiKey(), account.getId());
    }

    private void persist(Account account) {
        String json;
        try {
            json = objectMapper.writeValueAsString(account);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize account " + account.getId(), e);
        }
        try {
            storagePort.putTextAtomic(ACCOUNTS_DIR, account.getId() + JSON_EXTENSION, json).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }
}

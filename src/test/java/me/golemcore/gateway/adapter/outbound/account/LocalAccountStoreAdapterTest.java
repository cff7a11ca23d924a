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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gateway.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.gateway.domain.model.Account;
import me.golemcore.gateway.infrastructure.config.GatewayConfiguration;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class LocalAccountStoreAdapterTest {

    private static final Instant PERIOD_END = Instant.parse("2026-11-18T12:00:00Z");

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storage;
    private ObjectMapper objectMapper;
    private LocalAccountStoreAdapter store;

    @BeforeEach
    void setUp() {
        GatewayProperties properties = new GatewayProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = GatewayConfiguration.objectMapper();
        store = new LocalAccountStoreAdapter(storage, objectMapper);
        store.init();
    }

    @Test
    void shouldCreateAndFindByIdAndApiKey() {
        store.create(account("acc-1", "sk_one"));

        assertEquals("acc-1", store.findByApiKey("sk_one").orElseThrow().getId());
        assertEquals("sk_one", store.findById("acc-1").orElseThrow().getApiKey());
        assertTrue(store.findByApiKey("sk_other").isEmpty());
        assertTrue(store.findByApiKey(null).isEmpty());
    }

    @Test
    void shouldRejectDuplicateIdOrApiKey() {
        store.create(account("acc-1", "sk_one"));

        assertThrows(IllegalArgumentException.class, () -> store.create(account("acc-1", "sk_two")));
        assertThrows(IllegalArgumentException.class, () -> store.create(account("acc-2", "sk_one")));
    }

    @Test
    void shouldReturnDefensiveCopies() {
        store.create(account("acc-1", "sk_one"));

        Account copy = store.findById("acc-1").orElseThrow();
        copy.setTokensUsed(999);
        copy.getRecentDebitIds().add("req-x");

        Account stored = store.findById("acc-1").orElseThrow();
        assertEquals(0, stored.getTokensUsed());
        assertTrue(stored.getRecentDebitIds().isEmpty());
    }

    @Test
    void shouldPersistUpdatesAndReloadThem() {
        store.create(account("acc-1", "sk_one"));
        store.update("acc-1", account -> {
            account.setTokensUsed(1234);
            account.getRecentDebitIds().add("req-1");
            return account;
        });

        LocalAccountStoreAdapter reloaded = new LocalAccountStoreAdapter(storage, objectMapper);
        reloaded.init();

        Account account = reloaded.findByApiKey("sk_one").orElseThrow();
        assertEquals(1234, account.getTokensUsed());
        assertEquals(List.of("req-1"), account.getRecentDebitIds());
        assertEquals(PERIOD_END, account.getPeriodEnd());
    }

    @Test
    void shouldReturnEmptyForUnknownAccountUpdate() {
        assertTrue(store.update("missing", account -> account).isEmpty());
    }

    @Test
    void shouldRejectMutationThatChangesId() {
        store.create(account("acc-1", "sk_one"));

        assertThrows(IllegalStateException.class, () -> store.update("acc-1", account -> {
            account.setId("acc-2");
            return account;
        }));
    }

    @Test
    void shouldSkipWriteWhenNothingChanged() {
        StoragePort storagePort = spy(storage);
        LocalAccountStoreAdapter spiedStore = new LocalAccountStoreAdapter(storagePort, objectMapper);
        spiedStore.create(account("acc-1", "sk_one"));

        spiedStore.update("acc-1", account -> account);

        verify(storagePort, times(1)).putTextAtomic(eq("accounts"), anyString(), anyString());
    }

    @Test
    void shouldPropagateStorageFailure() {
        StoragePort failing = mock(StoragePort.class);
        when(failing.putTextAtomic(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("read-only")));
        LocalAccountStoreAdapter failingStore = new LocalAccountStoreAdapter(failing, objectMapper);

        assertThrows(IllegalStateException.class, () -> failingStore.create(account("acc-1", "sk_one")));
        assertTrue(failingStore.findById("acc-1").isEmpty());
    }

    @Test
    void shouldSerializeConcurrentUpdatesPerAccount() throws Exception {
        store.create(account("acc-1", "sk_one"));
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return store.update("acc-1", account -> {
                    account.setTokensUsed(account.getTokensUsed() + 1);
                    return account;
                });
            }));
        }

        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertEquals(100, store.findById("acc-1").orElseThrow().getTokensUsed());
    }

    private static Account account(String id, String apiKey) {
        return Account.builder()
                .id(id)
                .apiKey(apiKey)
                .tier("free")
                .tokensIncluded(10_000)
                .tokensUsed(0)
                .periodEnd(PERIOD_END)
                .createdAt(PERIOD_END.minusSeconds(86_400))
                .updatedAt(PERIOD_END.minusSeconds(86_400))
                .build();
    }
}

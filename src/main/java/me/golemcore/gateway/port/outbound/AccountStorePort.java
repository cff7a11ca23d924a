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
package me.golemcore.gateway.port.outbound;

import me.golemcore.gateway.domain.model.Account;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Durable account storage with an atomic read-modify-write primitive.
 */
public interface AccountStorePort {

    Optional<Account> findById(String accountId);

    Optional<Account> findByApiKey(String apiKey);

    List<Account> findAll();

    /**
     * Persist a new account.
     *
     * @throws IllegalArgumentException
     *             if the id or api key is already taken
     */
    Account create(Account account);

    /**
     * Atomically apply {@code mutation} to the stored account. Concurrent updates
     * of the same account are serialized so no update is lost. The mutation
     * receives a private copy and returns the new state.
     *
     * @return the stored state after the update, or empty if the account does not
     *         exist
     */
    Optional<Account> update(String accountId, UnaryOperator<Account> mutation);
}

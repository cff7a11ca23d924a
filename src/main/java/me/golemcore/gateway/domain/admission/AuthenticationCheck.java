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
package me.golemcore.gateway.domain.admission;

import lombok.RequiredArgsConstructor;
import me.golemcore.gateway.domain.model.Account;
import me.golemcore.gateway.domain.model.DenialReason;
import me.golemcore.gateway.port.outbound.AccountStorePort;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resolves the caller's account from its opaque API key. Missing, unknown and
 * inactive keys are all denied.
 */
@Component
@RequiredArgsConstructor
public class AuthenticationCheck implements AdmissionCheck {

    static final String MISSING_KEY_MESSAGE = "API key required";
    static final String INVALID_KEY_MESSAGE = "Invalid or inactive API key";

    private final AccountStorePort accountStore;

    @Override
    public String getName() {
        return "authentication";
    }

    @Override
    public AdmissionVerdict evaluate(AdmissionContext context) {
        String credential = context.getCredential();
        if (credential == null || credential.isBlank()) {
            return AdmissionVerdict.deny(DenialReason.AUTH_DENIED, MISSING_KEY_MESSAGE);
        }

        Optional<Account> account = accountStore.findByApiKey(credential.trim());
        if (account.isEmpty() || !account.get().isActive()) {
            return AdmissionVerdict.deny(DenialReason.AUTH_DENIED, INVALID_KEY_MESSAGE);
        }

        context.setAccount(account.get());
        context.setCallerKey("account:" + account.get().getId());
        return AdmissionVerdict.admit();
    }
}

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

import lombok.Data;
import me.golemcore.gateway.domain.model.Account;

/**
 * Mutable state carried through the admission checks of one request.
 */
@Data
public class AdmissionContext {

    private final String credential;

    // Identity used for rate limiting; the account id once authenticated
    private String callerKey;
    private Account account;

    public static AdmissionContext forCredential(String credential) {
        return new AdmissionContext(credential);
    }

    public static AdmissionContext anonymous(String callerKey) {
        AdmissionContext context = new AdmissionContext(null);
        context.setCallerKey(callerKey);
        return context;
    }

    public boolean isAuthenticated() {
        return account != null;
    }
}

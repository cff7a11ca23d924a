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
import me.golemcore.gateway.domain.exception.AdmissionDeniedException;
import me.golemcore.gateway.domain.model.DenialReason;
import me.golemcore.gateway.domain.service.QuotaEnforcer;
import org.springframework.stereotype.Component;

/**
 * Gates the request on the remaining period quota, applying a due billing
 * rollover first. Replaces the context account with the refreshed state.
 */
@Component
@RequiredArgsConstructor
public class QuotaCheck implements AdmissionCheck {

    private final QuotaEnforcer quotaEnforcer;

    @Override
    public String getName() {
        return "quota";
    }

    @Override
    public AdmissionVerdict evaluate(AdmissionContext context) {
        if (!context.isAuthenticated()) {
            return AdmissionVerdict.deny(DenialReason.AUTH_DENIED, AuthenticationCheck.MISSING_KEY_MESSAGE);
        }
        try {
            context.setAccount(quotaEnforcer.admit(context.getAccount().getId()));
            return AdmissionVerdict.admit();
        } catch (AdmissionDeniedException e) {
            return AdmissionVerdict.deny(e);
        }
    }
}

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

import me.golemcore.gateway.domain.exception.AdmissionDeniedException;
import me.golemcore.gateway.domain.model.DenialReason;

import java.time.Duration;

/**
 * Admit or deny decision of a single admission check.
 */
public final class AdmissionVerdict {

    private static final AdmissionVerdict ADMIT = new AdmissionVerdict(null);

    private final AdmissionDeniedException denial;

    private AdmissionVerdict(AdmissionDeniedException denial) {
        this.denial = denial;
    }

    public static AdmissionVerdict admit() {
        return ADMIT;
    }

    public static AdmissionVerdict deny(AdmissionDeniedException denial) {
        return new AdmissionVerdict(denial);
    }

    public static AdmissionVerdict deny(DenialReason reason, String message) {
        return new AdmissionVerdict(new AdmissionDeniedException(reason, message));
    }

    public static AdmissionVerdict rateLimited(Duration retryAfter) {
        return new AdmissionVerdict(AdmissionDeniedException.rateLimited(retryAfter));
    }

    public boolean isAdmitted() {
        return denial == null;
    }

    public AdmissionDeniedException getDenial() {
        return denial;
    }
}

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
package me.golemcore.gateway.domain.exception;

import lombok.Getter;
import me.golemcore.gateway.domain.model.DenialReason;

import java.time.Duration;

/**
 * Thrown when a request is rejected before any provider call. No quota is
 * consumed and no usage is recorded for a denied request.
 */
@Getter
public class AdmissionDeniedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final DenialReason reason;
    private final transient Duration retryAfter;
    private final String upgradeUrl;

    public AdmissionDeniedException(DenialReason reason, String message) {
        this(reason, message, null, null);
    }

    public AdmissionDeniedException(DenialReason reason, String message, Duration retryAfter, String upgradeUrl) {
        super(message);
        this.reason = reason;
        this.retryAfter = retryAfter;
        this.upgradeUrl = upgradeUrl;
    }

    public static AdmissionDeniedException authDenied(String message) {
        return new AdmissionDeniedException(DenialReason.AUTH_DENIED, message);
    }

    public static AdmissionDeniedException quotaExceeded(String upgradeUrl) {
        return new AdmissionDeniedException(DenialReason.QUOTA_EXCEEDED,
                "Token quota exceeded. Please upgrade your plan.", null, upgradeUrl);
    }

    public static AdmissionDeniedException rateLimited(Duration retryAfter) {
        return new AdmissionDeniedException(DenialReason.RATE_LIMITED,
                "Rate limit exceeded. Please slow down.", retryAfter, null);
    }
}

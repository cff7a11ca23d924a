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
package me.golemcore.gateway.domain.model;

/**
 * Machine-checkable reasons for rejecting a request before any provider call.
 */
public enum DenialReason {

    /** Missing, unknown or inactive credential. Terminal. */
    AUTH_DENIED("auth_denied"),

    /** Period quota used up. Recoverable by rollover or upgrade. */
    QUOTA_EXCEEDED("quota_exceeded"),

    /** Hourly request threshold of the plan reached. Transient. */
    RATE_LIMITED("rate_limited");

    private final String code;

    DenialReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}

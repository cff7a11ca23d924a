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

import java.time.Instant;

/**
 * Point-in-time view of an account's quota, used for response metadata.
 */
public record QuotaSnapshot(long tokensIncluded, long tokensUsed, Instant periodEnd) {

    public long remaining() {
        return Math.max(0, tokensIncluded - tokensUsed);
    }

    /**
     * Percentage of the quota consumed, capped at 100. An account without any
     * included tokens is reported as fully consumed.
     */
    public double percentage() {
        if (tokensIncluded <= 0) {
            return 100.0;
        }
        return Math.min(100.0, (double) tokensUsed / tokensIncluded * 100.0);
    }

    public boolean exhausted() {
        return tokensUsed >= tokensIncluded;
    }
}

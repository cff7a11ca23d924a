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
package me.golemcore.gateway.ratelimit;

import me.golemcore.gateway.domain.model.RateLimitResult;

/**
 * Per-caller request-rate limiter. Thresholds come from the caller's plan
 * tier.
 */
public interface RateLimiter {

    /**
     * Check and consume one request slot for the caller.
     *
     * @param callerKey
     *            stable caller identity (account id or the anonymous key)
     * @param tier
     *            plan tier of the caller, or {@code null} when unknown
     */
    RateLimitResult tryAcquire(String callerKey, String tier);

    /**
     * Hourly threshold that applies to the given tier.
     */
    int thresholdFor(String tier);
}

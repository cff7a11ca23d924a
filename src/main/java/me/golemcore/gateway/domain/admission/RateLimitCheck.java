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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.RateLimitResult;
import me.golemcore.gateway.ratelimit.RateLimiter;
import org.springframework.stereotype.Component;

/**
 * Applies the hourly request threshold of the caller's current plan. The tier
 * is read from the account resolved for this request, so a plan change is
 * picked up on the next request.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RateLimitCheck implements AdmissionCheck {

    static final String ANONYMOUS_KEY = "anonymous";

    private final RateLimiter rateLimiter;

    @Override
    public String getName() {
        return "rate-limit";
    }

    @Override
    public AdmissionVerdict evaluate(AdmissionContext context) {
        String tier = context.isAuthenticated() ? context.getAccount().getTier() : null;
        String callerKey = context.getCallerKey() != null ? context.getCallerKey() : ANONYMOUS_KEY;

        RateLimitResult result = rateLimiter.tryAcquire(callerKey, tier);
        if (result.isAllowed()) {
            return AdmissionVerdict.admit();
        }
        log.info("[RateLimit] Caller {} rate limited, retry in {}", callerKey, result.getWaitTime());
        return AdmissionVerdict.rateLimited(result.getWaitTime());
    }
}

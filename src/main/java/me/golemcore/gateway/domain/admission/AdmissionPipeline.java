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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.exception.AdmissionDeniedException;
import me.golemcore.gateway.domain.model.Account;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Ordered admission checks run before any provider call: authentication, then
 * rate limit, then quota. The first deny stops the pipeline.
 */
@Component
@Slf4j
public class AdmissionPipeline {

    private final AuthenticationCheck authenticationCheck;
    private final RateLimitCheck rateLimitCheck;
    private final List<AdmissionCheck> checks;

    public AdmissionPipeline(AuthenticationCheck authenticationCheck, RateLimitCheck rateLimitCheck,
            QuotaCheck quotaCheck) {
        this.authenticationCheck = authenticationCheck;
        this.rateLimitCheck = rateLimitCheck;
        this.checks = List.of(authenticationCheck, rateLimitCheck, quotaCheck);
    }

    /**
     * Runs all checks for a metered request.
     *
     * @return the context with the admitted account
     * @throws AdmissionDeniedException
     *             on the first denying check
     */
    public AdmissionContext admit(String credential) {
        AdmissionContext context = AdmissionContext.forCredential(credential);
        runChecks(checks, context);
        return context;
    }

    /**
     * Authentication only, for read endpoints that consume neither quota nor rate
     * budget.
     */
    public Account authenticate(String credential) {
        AdmissionContext context = AdmissionContext.forCredential(credential);
        runChecks(List.of(authenticationCheck), context);
        return context.getAccount();
    }

    /**
     * Rate limit for unauthenticated callers, with the default threshold.
     */
    public void throttleAnonymous(String callerKey) {
        AdmissionContext context = AdmissionContext.anonymous(RateLimitCheck.ANONYMOUS_KEY + ":" + callerKey);
        runChecks(List.of(rateLimitCheck), context);
    }

    private void runChecks(List<AdmissionCheck> toRun, AdmissionContext context) {
        for (AdmissionCheck check : toRun) {
            AdmissionVerdict verdict = check.evaluate(context);
            if (!verdict.isAdmitted()) {
                AdmissionDeniedException denial = verdict.getDenial();
                log.debug("[Admission] Denied by {}: {}", check.getName(), denial.getReason());
                throw denial;
            }
        }
    }
}

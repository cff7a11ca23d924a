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
package me.golemcore.gateway.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.exception.AccountingFailureException;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.function.Supplier;

/**
 * Retries accounting writes (the quota debit and usage write settling a
 * provider call). The writes it runs must be idempotent by request id.
 *
 * <p>
 * A write first gets a short, bounded retry on the calling thread. If that is
 * exhausted, the write is handed to a background redrive with a longer backoff
 * so the spend is eventually recorded, and {@link AccountingFailureException}
 * is raised to the caller.
 *
 * <p>
 * A {@link NoSuchElementException} (the account is gone) can never clear, so it
 * is neither retried nor redriven.
 */
@Component
@Slf4j
public class AccountingRetrier {

    private final GatewayProperties properties;

    public AccountingRetrier(GatewayProperties properties) {
        this.properties = properties;
    }

    public <T> T execute(String operation, String requestId, Supplier<T> write) {
        GatewayProperties.AccountingProperties accounting = properties.getAccounting();
        try {
            return Mono.fromSupplier(write)
                    .retryWhen(Retry.backoff(accounting.getMaxRetries(),
                            Duration.ofMillis(accounting.getFirstBackoffMs()))
                            .filter(AccountingRetrier::isRetryable)
                            .doBeforeRetry(signal -> log.warn(
                                    "[Accounting] Retrying {} for request {} (attempt {}): {}",
                                    operation, requestId, signal.totalRetries() + 1,
                                    signal.failure().getMessage())))
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.isRetryExhausted(e) ? e.getCause() : e;
            if (isRetryable(cause)) {
                log.error("[Accounting] {} failed for request {}, scheduling redrive", operation, requestId,
                        cause);
                redrive(operation, requestId, write);
            } else {
                log.error("[Accounting] {} failed for request {} and cannot be retried: {}", operation,
                        requestId, cause.getMessage());
            }
            throw new AccountingFailureException(operation + " failed for request " + requestId, cause);
        }
    }

    private void redrive(String operation, String requestId, Supplier<?> write) {
        GatewayProperties.AccountingProperties accounting = properties.getAccounting();
        Mono.fromSupplier(write)
                .retryWhen(Retry.backoff(accounting.getRedriveRetries(),
                        Duration.ofMillis(accounting.getRedriveBackoffMs()))
                        .filter(AccountingRetrier::isRetryable))
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        result -> log.info("[Accounting] Redrive of {} succeeded for request {}", operation,
                                requestId),
                        error -> log.error("[Accounting] Redrive of {} gave up for request {}", operation,
                                requestId, error));
    }

    private static boolean isRetryable(Throwable error) {
        return !(error instanceof NoSuchElementException);
    }
}

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
package me.golemcore.gateway.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.gateway.domain.exception.AccountingFailureException;
import me.golemcore.gateway.domain.exception.AdmissionDeniedException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Locale;
import java.util.NoSuchElementException;

/**
 * Maps gateway failures to structured {@link ApiErrorResponse} bodies. Only
 * admission denials and request errors carry a specific message; anything else
 * is reported as a generic internal error.
 */
@ControllerAdvice(basePackages = "me.golemcore.gateway.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(AdmissionDeniedException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleAdmissionDenied(AdmissionDeniedException ex) {
        ApiErrorResponse.ApiErrorResponseBuilder body = ApiErrorResponse.builder()
                .error(ex.getReason().getCode())
                .message(ex.getMessage());

        switch (ex.getReason()) {
        case AUTH_DENIED -> {
            log.debug("[API] Authentication denied: {}", ex.getMessage());
            return Mono.just(ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(body.status(HttpStatus.UNAUTHORIZED.value()).build()));
        }
        case QUOTA_EXCEEDED -> {
            log.debug("[API] Quota exceeded");
            return Mono.just(ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .body(body.status(HttpStatus.TOO_MANY_REQUESTS.value())
                            .quotaExceeded(true)
                            .upgradeUrl(ex.getUpgradeUrl())
                            .build()));
        }
        case RATE_LIMITED -> {
            long retryAfterSeconds = retryAfterSeconds(ex.getRetryAfter());
            log.debug("[API] Rate limited, retry after {}s", retryAfterSeconds);
            return Mono.just(ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds))
                    .body(body.status(HttpStatus.TOO_MANY_REQUESTS.value())
                            .retryAfterSeconds(retryAfterSeconds)
                            .build()));
        }
        default -> throw new IllegalStateException("Unhandled denial reason: " + ex.getReason());
        }
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .error(errorCode(status))
                .message(ex.getReason())
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    @ExceptionHandler({ IllegalArgumentException.class, ServerWebInputException.class })
    public Mono<ResponseEntity<ApiErrorResponse>> handleBadRequest(Exception ex) {
        String message = ex instanceof ServerWebInputException input ? input.getReason() : ex.getMessage();
        log.warn("[API] Bad request: {}", message);
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .error("bad_request")
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body));
    }

    @ExceptionHandler(NoSuchElementException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleNotFound(NoSuchElementException ex) {
        log.warn("[API] Not found: {}", ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.NOT_FOUND.value())
                .error("not_found")
                .message(ex.getMessage())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.NOT_FOUND).body(body));
    }

    @ExceptionHandler(AccountingFailureException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleAccountingFailure(AccountingFailureException ex) {
        log.error("[API] Accounting failure: {}", ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.SERVICE_UNAVAILABLE.value())
                .error("accounting_unavailable")
                .message("Usage could not be recorded, please retry later")
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .error("internal_error")
                .message("Internal server error")
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body));
    }

    private static long retryAfterSeconds(Duration retryAfter) {
        if (retryAfter == null) {
            return 1;
        }
        long seconds = (retryAfter.toMillis() + 999) / 1000;
        return Math.max(1, seconds);
    }

    private static String errorCode(HttpStatus status) {
        return status.name().toLowerCase(Locale.ROOT);
    }
}

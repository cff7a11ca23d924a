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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.PlanPolicy;
import me.golemcore.gateway.domain.model.RateLimitResult;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.PlanPolicyPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Token-bucket rate limiter keyed by caller, sized by the caller's plan.
 *
 * <p>
 * Each caller gets a bucket holding {@code requestsPerHour} tokens that refills
 * over one hour. Tiers without a configured policy (and unauthenticated callers)
 * use {@code gateway.default-requests-per-hour}. When the threshold of a caller
 * changes, for example after an upgrade, its bucket is replaced by a fresh one.
 *
 * <p>
 * Callers include anonymous client addresses, so buckets that have been full
 * and unused for a whole window are swept periodically.
 */
@Component
@Slf4j
public class PlanRateLimiter implements RateLimiter {

    private static final Duration WINDOW = Duration.ofHours(1);
    private static final long SWEEP_INTERVAL_MINUTES = 10;
    private static final long EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 5;

    private final PlanPolicyPort planPolicyPort;
    private final GatewayProperties properties;
    private final Clock clock;

    private final Map<String, ConfiguredBucket> buckets = new ConcurrentHashMap<>();
    private final ScheduledExecutorService sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "rate-limit-sweep");
        t.setDaemon(true);
        return t;
    });

    public PlanRateLimiter(PlanPolicyPort planPolicyPort, GatewayProperties properties, Clock clock) {
        this.planPolicyPort = planPolicyPort;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        sweepExecutor.scheduleAtFixedRate(this::evictIdleBuckets,
                SWEEP_INTERVAL_MINUTES, SWEEP_INTERVAL_MINUTES, TimeUnit.MINUTES);
    }

    @PreDestroy
    void destroy() {
        sweepExecutor.shutdownNow();
        try {
            sweepExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public RateLimitResult tryAcquire(String callerKey, String tier) {
        if (!properties.getRateLimit().isEnabled()) {
            return RateLimitResult.allowed(Long.MAX_VALUE);
        }

        int threshold = thresholdFor(tier);
        TokenBucket bucket = resolveBucket(callerKey, threshold);

        RateLimitResult result = bucket.tryConsume();
        if (!result.isAllowed()) {
            log.debug("[RateLimit] Denied caller {} (tier: {}, threshold: {}/h)", callerKey, tier, threshold);
        }
        return result;
    }

    @Override
    public int thresholdFor(String tier) {
        if (tier == null) {
            return properties.getDefaultRequestsPerHour();
        }
        return planPolicyPort.lookup(tier)
                .map(PlanPolicy::getRequestsPerHour)
                .filter(limit -> limit > 0)
                .orElse(properties.getDefaultRequestsPerHour());
    }

    private TokenBucket resolveBucket(String key, int capacity) {
        ConfiguredBucket configured = buckets.compute(key, (bucketKey, existing) -> {
            if (existing == null || existing.capacity() != capacity) {
                return new ConfiguredBucket(new TokenBucket(capacity, WINDOW, this::clockNanos), capacity);
            }
            return existing;
        });
        return configured.bucket();
    }

    void evictIdleBuckets() {
        int before = buckets.size();
        buckets.keySet().forEach(key -> buckets.computeIfPresent(key,
                (bucketKey, configured) -> configured.bucket().isIdle(WINDOW) ? null : configured));
        int evicted = before - buckets.size();
        if (evicted > 0) {
            log.debug("[RateLimit] Evicted {} idle buckets", evicted);
        }
    }

    int trackedCallers() {
        return buckets.size();
    }

    private long clockNanos() {
        return TimeUnit.MILLISECONDS.toNanos(clock.millis());
    }

    private record ConfiguredBucket(TokenBucket bucket, int capacity) {
    }
}

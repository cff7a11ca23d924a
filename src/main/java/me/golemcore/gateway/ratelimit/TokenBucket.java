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

import java.math.BigInteger;
import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Classic token bucket: starts full, refills {@code capacity} tokens evenly
 * over {@code refillPeriod}, one token per request.
 */
public class TokenBucket {

    private final long capacity;
    private final long refillPeriodNanos;
    private final LongSupplier nanoTime;
    private long tokens;
    private long lastRefillNanos;
    private long lastConsumeNanos;

    public TokenBucket(long capacity, Duration refillPeriod) {
        this(capacity, refillPeriod, System::nanoTime);
    }

    public TokenBucket(long capacity, Duration refillPeriod, LongSupplier nanoTime) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Bucket capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.refillPeriodNanos = refillPeriod.toNanos();
        this.nanoTime = nanoTime;
        this.tokens = capacity;
        this.lastRefillNanos = nanoTime.getAsLong();
        this.lastConsumeNanos = lastRefillNanos;
    }

    /**
     * Try to consume one token.
     */
    public synchronized RateLimitResult tryConsume() {
        long now = nanoTime.getAsLong();
        refill(now);

        if (tokens > 0) {
            tokens--;
            return RateLimitResult.allowed(tokens);
        }

        return RateLimitResult.denied(calculateWaitTimeMs(now), "Rate limit exceeded");
    }

    public synchronized long availableTokens() {
        refill(nanoTime.getAsLong());
        return tokens;
    }

    /**
     * True when the bucket is full again and nothing was consumed for at least
     * {@code idleFor}. Such a bucket is indistinguishable from a fresh one.
     */
    public synchronized boolean isIdle(Duration idleFor) {
        long now = nanoTime.getAsLong();
        refill(now);
        return tokens == capacity && now - lastConsumeNanos >= idleFor.toNanos();
    }

    public long getCapacity() {
        return capacity;
    }

    private void refill(long now) {
        long elapsedNanos = now - lastRefillNanos;
        if (elapsedNanos <= 0) {
            return;
        }

        if (elapsedNanos >= refillPeriodNanos) {
            tokens = capacity;
            lastRefillNanos = now;
            return;
        }

        long tokensToAdd = scale(elapsedNanos, capacity, refillPeriodNanos);
        if (tokensToAdd > 0) {
            tokens = Math.min(capacity, tokens + tokensToAdd);
            // Keep the fractional remainder so slow trickles still add up
            lastRefillNanos += scale(tokensToAdd, refillPeriodNanos, capacity);
        }
    }

    // value * multiplier / divisor without overflowing on large capacities
    private static long scale(long value, long multiplier, long divisor) {
        long high = Math.multiplyHigh(value, multiplier);
        long low = value * multiplier;
        if (high == 0 && low >= 0) {
            return low / divisor;
        }
        return BigInteger.valueOf(value)
                .multiply(BigInteger.valueOf(multiplier))
                .divide(BigInteger.valueOf(divisor))
                .longValueExact();
    }

    private long calculateWaitTimeMs(long now) {
        long nanosPerToken = refillPeriodNanos / capacity;
        long sinceLastRefill = Math.max(0, now - lastRefillNanos);
        long remainingNanos = Math.max(0, nanosPerToken - sinceLastRefill);
        return (remainingNanos + 999_999) / 1_000_000;
    }
}

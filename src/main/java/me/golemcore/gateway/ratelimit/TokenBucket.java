package me.golemcore.gateway.ratelimit;

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

import me.golemcore.gateway.domain.model.RateLimitResult;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Thread-safe token bucket for per-connection send limits.
 *
 * <p>
 * The bucket:
 * <ul>
 * <li>Starts full with {@code capacity} tokens</li>
 * <li>Refills continuously, {@code capacity} tokens per {@code refillPeriod}</li>
 * <li>Denies acquisition when empty, returning the wait until the next
 * token</li>
 * </ul>
 *
 * <p>
 * Time comes from the injected {@link Clock}, so limits can be verified
 * under a simulated clock. Partial refill progress is carried over between
 * calls, which keeps the long-run rate exact.
 *
 * @since 1.0
 */
public class TokenBucket {

    private final long capacity;
    private final long nanosPerToken;
    private final Clock clock;
    private long tokens;
    private long lastRefillNanos;

    public TokenBucket(long capacity, Duration refillPeriod, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (refillPeriod == null || refillPeriod.isZero() || refillPeriod.isNegative()) {
            throw new IllegalArgumentException("refillPeriod must be positive");
        }
        this.capacity = capacity;
        this.nanosPerToken = Math.max(1, refillPeriod.toNanos() / capacity);
        this.clock = clock;
        this.tokens = capacity;
        this.lastRefillNanos = nowNanos();
    }

    /**
     * Try to consume one token.
     */
    public synchronized RateLimitResult tryConsume() {
        long now = nowNanos();
        refill(now);

        if (tokens > 0) {
            tokens--;
            return RateLimitResult.allowed(tokens);
        }

        long untilNextToken = nanosPerToken - (now - lastRefillNanos);
        return RateLimitResult.denied(Duration.ofNanos(Math.max(1_000_000L, untilNextToken)));
    }

    public synchronized long availableTokens() {
        refill(nowNanos());
        return tokens;
    }

    public long getCapacity() {
        return capacity;
    }

    private void refill(long now) {
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        long tokensToAdd = elapsed / nanosPerToken;
        if (tokensToAdd <= 0) {
            return;
        }
        if (tokens + tokensToAdd >= capacity) {
            tokens = capacity;
            lastRefillNanos = now;
        } else {
            tokens += tokensToAdd;
            lastRefillNanos += tokensToAdd * nanosPerToken;
        }
    }

    private long nowNanos() {
        Instant now = clock.instant();
        return now.getEpochSecond() * 1_000_000_000L + now.getNano();
    }
}

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.BindingKey;
import me.golemcore.gateway.domain.model.RateLimitResult;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One token bucket per connection, sized from the platform's configured
 * limit.
 *
 * <p>
 * A bucket is rebuilt when its configured size changes and dropped with
 * {@link #release(BindingKey)} when the connection stops, so a new connection
 * starts with a full bucket.
 *
 * @see TokenBucket
 */
@Component
@Slf4j
public class ConnectionRateLimiter implements RateLimiter {

    private final GatewayProperties properties;
    private final Clock clock;

    private final Map<BindingKey, ConfiguredBucket> buckets = new ConcurrentHashMap<>();

    public ConnectionRateLimiter(GatewayProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public RateLimitResult tryConsume(BindingKey key) {
        GatewayProperties.RateLimitProperties limit = properties.getPlatforms().rateLimitFor(key.platform());
        TokenBucket bucket = resolveBucket(key, limit.getCapacity(), limit.getPeriod());
        RateLimitResult result = bucket.tryConsume();
        if (!result.isAllowed()) {
            log.debug("[Outbound] Rate limit reached for {}, next token in {}ms", key,
                    result.getWaitTime().toMillis());
        }
        return result;
    }

    @Override
    public void release(BindingKey key) {
        buckets.remove(key);
    }

    private TokenBucket resolveBucket(BindingKey key, int capacity, Duration refillPeriod) {
        ConfiguredBucket configured = buckets.compute(key, (bucketKey, existing) -> {
            if (existing == null || existing.capacity() != capacity
                    || !existing.refillPeriod().equals(refillPeriod)) {
                return new ConfiguredBucket(new TokenBucket(capacity, refillPeriod, clock), capacity, refillPeriod);
            }
            return existing;
        });
        return configured.bucket();
    }

    private record ConfiguredBucket(TokenBucket bucket, int capacity, Duration refillPeriod) {
    }
}

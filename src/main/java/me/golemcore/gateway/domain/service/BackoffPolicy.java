package me.golemcore.gateway.domain.service;

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

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Capped exponential backoff with symmetric jitter:
 * {@code min(max, base * 2^(attempt-1)) * (1 ± jitter)}, never above
 * {@code max}.
 */
public class BackoffPolicy {

    private final Duration base;
    private final Duration max;
    private final double jitter;
    private final DoubleSupplier random;

    public BackoffPolicy(Duration base, Duration max, double jitter) {
        this(base, max, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    BackoffPolicy(Duration base, Duration max, double jitter, DoubleSupplier random) {
        if (jitter < 0 || jitter > 1) {
            throw new IllegalArgumentException("jitter must be within [0, 1]");
        }
        this.base = base;
        this.max = max;
        this.jitter = jitter;
        this.random = random;
    }

    /**
     * Delay before retry number {@code attempt} (1-based).
     */
    public Duration delayFor(int attempt) {
        int exponent = Math.max(0, Math.min(attempt - 1, 30));
        double capped = Math.min(max.toMillis(), base.toMillis() * Math.pow(2, exponent));
        double factor = 1 + jitter * (2 * random.getAsDouble() - 1);
        long delay = Math.round(capped * factor);
        return Duration.ofMillis(Math.max(0, Math.min(delay, max.toMillis())));
    }
}

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

import me.golemcore.gateway.domain.model.BindingKey;
import me.golemcore.gateway.domain.model.RateLimitResult;

/**
 * Rate limiter for outbound sends.
 */
public interface RateLimiter {

    /**
     * Check and consume a token for a connection.
     */
    RateLimitResult tryConsume(BindingKey key);

    /**
     * Drop the bucket of a connection that is no longer running.
     */
    void release(BindingKey key);
}

package me.golemcore.gateway.domain.model;

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

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Identity of one supervised connection: an agent on one platform.
 */
public record BindingKey(String agentId, Platform platform) {

    private static final Pattern AGENT_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_.-]{1,64}$");

    public BindingKey {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(platform, "platform");
    }

    public static BindingKey of(String agentId, Platform platform) {
        return new BindingKey(agentId, platform);
    }

    /**
     * Validates an agent id for use in storage paths and webhook URLs.
     */
    public static String normalizeAgentIdOrThrow(String agentId) {
        String candidate = agentId == null ? null : agentId.trim();
        if (candidate == null || !AGENT_ID_PATTERN.matcher(candidate).matches()) {
            throw new IllegalArgumentException("agentId must match ^[a-zA-Z0-9_.-]{1,64}$");
        }
        return candidate;
    }

    @Override
    public String toString() {
        return agentId + "/" + platform.getId();
    }
}

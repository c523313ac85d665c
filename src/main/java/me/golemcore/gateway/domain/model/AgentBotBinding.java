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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Declared association between an agent, a platform credential and the
 * desired run state.
 *
 * <p>
 * {@code version} is assigned by the registry and grows on every credential or
 * desired state change; consumers compare it to detect superseded updates.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentBotBinding {

    private String agentId;
    private Platform platform;
    private Secret credentials;

    @Builder.Default
    private DesiredState desiredState = DesiredState.ENABLED;

    private long version;
    private Instant updatedAt;

    @JsonIgnore
    public BindingKey getKey() {
        return BindingKey.of(agentId, platform);
    }

    @JsonIgnore
    public boolean isEnabled() {
        return desiredState == DesiredState.ENABLED;
    }

    /**
     * Copy safe to return over the API.
     */
    public AgentBotBinding redacted() {
        return toBuilder().credentials(Secret.redacted(credentials)).build();
    }
}

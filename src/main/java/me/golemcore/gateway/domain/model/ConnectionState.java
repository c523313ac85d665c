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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Point-in-time snapshot of one supervised connection.
 *
 * <p>
 * Snapshots are published by the supervisor after every transition and are
 * never mutated afterwards.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionState {

    private String agentId;
    private Platform platform;

    @Builder.Default
    private ConnectionStatus status = ConnectionStatus.STOPPED;

    private long boundVersion;
    private long desiredVersion;
    private String lastError;
    private FailureKind lastErrorKind;
    private int retryCount;
    private boolean permanentFailure;
    private Instant connectedAt;
    private Instant updatedAt;

    public static ConnectionState stopped(BindingKey key, Instant now) {
        return ConnectionState.builder()
                .agentId(key.agentId())
                .platform(key.platform())
                .status(ConnectionStatus.STOPPED)
                .updatedAt(now)
                .build();
    }
}

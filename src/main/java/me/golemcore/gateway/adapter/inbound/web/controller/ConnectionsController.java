package me.golemcore.gateway.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.AgentBotBinding;
import me.golemcore.gateway.domain.model.BindingKey;
import me.golemcore.gateway.domain.model.ConnectionState;
import me.golemcore.gateway.domain.model.Platform;
import me.golemcore.gateway.domain.service.ConnectionSupervisor;
import me.golemcore.gateway.domain.service.TenantRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Connection status and operator restarts.
 */
@RestController
@RequestMapping("/connections")
@RequiredArgsConstructor
@Slf4j
public class ConnectionsController {

    private final TenantRegistry registry;
    private final ConnectionSupervisor supervisor;

    @GetMapping
    public Mono<ResponseEntity<List<ConnectionState>>> listConnections() {
        return Mono.fromCallable(() -> ResponseEntity.ok(supervisor.listStates()));
    }

    @GetMapping("/{agentId}/{platform}")
    public Mono<ResponseEntity<ConnectionState>> getConnection(@PathVariable String agentId,
            @PathVariable String platform) {
        return Mono.fromCallable(() -> {
            AgentBotBinding binding = resolveBinding(agentId, platform);
            return ResponseEntity.ok(supervisor.getStateOrStopped(binding.getKey()));
        });
    }

    @PostMapping("/{agentId}/{platform}/restart")
    public Mono<ResponseEntity<ConnectionState>> restartConnection(@PathVariable String agentId,
            @PathVariable String platform) {
        return Mono.fromCallable(() -> {
            AgentBotBinding binding = resolveBinding(agentId, platform);
            if (!binding.isEnabled()) {
                throw new IllegalStateException("Binding " + binding.getKey() + " is disabled");
            }
            log.info("[API] Restart requested for {}", binding.getKey());
            return binding;
        })
                .flatMap(binding -> Mono.fromFuture(supervisor.restart(binding)))
                .map(ResponseEntity::ok);
    }

    private AgentBotBinding resolveBinding(String agentId, String platform) {
        return registry.get(BindingKey.normalizeAgentIdOrThrow(agentId), Platform.fromId(platform));
    }
}

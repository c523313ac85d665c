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
import me.golemcore.gateway.adapter.inbound.web.dto.BindingRequest;
import me.golemcore.gateway.domain.exception.BindingNotFoundException;
import me.golemcore.gateway.domain.model.AgentBotBinding;
import me.golemcore.gateway.domain.model.BindingKey;
import me.golemcore.gateway.domain.model.DesiredState;
import me.golemcore.gateway.domain.model.Platform;
import me.golemcore.gateway.domain.model.Secret;
import me.golemcore.gateway.domain.service.TenantRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Tenant administration: create, update and delete agent bot bindings.
 * Credentials are write-only; every response carries a redacted copy.
 */
@RestController
@RequestMapping("/api/bindings")
@RequiredArgsConstructor
public class BindingsController {

    private final TenantRegistry registry;

    @GetMapping
    public Mono<ResponseEntity<List<AgentBotBinding>>> listBindings() {
        return Mono.fromCallable(() -> ResponseEntity.ok(redact(registry.list())));
    }

    @GetMapping("/{agentId}")
    public Mono<ResponseEntity<List<AgentBotBinding>>> listAgentBindings(@PathVariable String agentId) {
        return Mono.fromCallable(() -> {
            String normalized = BindingKey.normalizeAgentIdOrThrow(agentId);
            return ResponseEntity.ok(redact(registry.listForAgent(normalized)));
        });
    }

    @GetMapping("/{agentId}/{platform}")
    public Mono<ResponseEntity<AgentBotBinding>> getBinding(@PathVariable String agentId,
            @PathVariable String platform) {
        return Mono.fromCallable(() -> ResponseEntity.ok(
                registry.get(BindingKey.normalizeAgentIdOrThrow(agentId), Platform.fromId(platform)).redacted()));
    }

    @PutMapping("/{agentId}/{platform}")
    public Mono<ResponseEntity<AgentBotBinding>> putBinding(@PathVariable String agentId,
            @PathVariable String platform, @RequestBody BindingRequest request) {
        return Mono.fromCallable(() -> {
            AgentBotBinding binding = registry.put(agentId, Platform.fromId(platform),
                    Secret.of(request.getCredentials()), DesiredState.fromValue(request.getDesiredState()));
            return ResponseEntity.ok(binding.redacted());
        });
    }

    @DeleteMapping("/{agentId}/{platform}")
    public Mono<ResponseEntity<Void>> deleteBinding(@PathVariable String agentId, @PathVariable String platform) {
        return Mono.fromCallable(() -> {
            String normalized = BindingKey.normalizeAgentIdOrThrow(agentId);
            Platform resolved = Platform.fromId(platform);
            registry.remove(normalized, resolved)
                    .orElseThrow(() -> new BindingNotFoundException(BindingKey.of(normalized, resolved)));
            return ResponseEntity.noContent().<Void>build();
        });
    }

    @DeleteMapping("/{agentId}")
    public Mono<ResponseEntity<Void>> deleteAgent(@PathVariable String agentId) {
        return Mono.fromCallable(() -> {
            registry.removeAgent(BindingKey.normalizeAgentIdOrThrow(agentId));
            return ResponseEntity.noContent().<Void>build();
        });
    }

    private static List<AgentBotBinding> redact(List<AgentBotBinding> bindings) {
        return bindings.stream()
                .map(AgentBotBinding::redacted)
                .toList();
    }
}

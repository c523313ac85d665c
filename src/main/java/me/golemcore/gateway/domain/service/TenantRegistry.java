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

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.exception.BindingNotFoundException;
import me.golemcore.gateway.domain.model.AgentBotBinding;
import me.golemcore.gateway.domain.model.BindingChangeEvent;
import me.golemcore.gateway.domain.model.BindingKey;
import me.golemcore.gateway.domain.model.DesiredState;
import me.golemcore.gateway.domain.model.Platform;
import me.golemcore.gateway.domain.model.Secret;
import me.golemcore.gateway.port.outbound.BindingStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Durable record of which agent has which platform credentials and whether
 * its connection should run.
 *
 * <p>
 * Every mutation takes the next value of one registry-wide version sequence,
 * removals included, so a consumer can always tell a newer change from a
 * replayed one. Mutations are persisted before listeners are notified.
 * Listeners are called in mutation order.
 */
@Service
@Slf4j
public class TenantRegistry {

    private final BindingStorePort bindingStore;
    private final Clock clock;

    private final Map<BindingKey, AgentBotBinding> bindings = new ConcurrentHashMap<>();
    private final List<Consumer<BindingChangeEvent>> listeners = new CopyOnWriteArrayList<>();
    private final Object mutationLock = new Object();
    private long lastVersion;

    public TenantRegistry(BindingStorePort bindingStore, Clock clock) {
        this.bindingStore = bindingStore;
        this.clock = clock;
    }

    @PostConstruct
    public void load() {
        synchronized (mutationLock) {
            for (AgentBotBinding binding : bindingStore.loadAll()) {
                if (binding.getAgentId() == null || binding.getPlatform() == null) {
                    log.warn("[Registry] Skipping stored binding without agent or platform (v{})",
                            binding.getVersion());
                    continue;
                }
                bindings.put(binding.getKey(), binding);
                lastVersion = Math.max(lastVersion, binding.getVersion());
            }
        }
        log.info("[Registry] Loaded {} binding(s), version {}", bindings.size(), lastVersion);
    }

    /**
     * Create or update a binding. An update that changes neither credentials
     * nor desired state keeps the current version and notifies nobody.
     */
    public AgentBotBinding put(String agentId, Platform platform, Secret credentials, DesiredState desiredState) {
        String normalizedAgentId = BindingKey.normalizeAgentIdOrThrow(agentId);
        if (platform == null) {
            throw new IllegalArgumentException("platform is required");
        }
        if (!Secret.hasValue(credentials)) {
            throw new IllegalArgumentException("credentials are required");
        }
        DesiredState state = desiredState != null ? desiredState : DesiredState.ENABLED;
        BindingKey key = BindingKey.of(normalizedAgentId, platform);

        synchronized (mutationLock) {
            AgentBotBinding existing = bindings.get(key);
            if (existing != null && existing.getDesiredState() == state
                    && Secret.sameValue(existing.getCredentials(), credentials)) {
                return existing;
            }

            AgentBotBinding binding = AgentBotBinding.builder()
                    .agentId(normalizedAgentId)
                    .platform(platform)
                    .credentials(Secret.of(credentials.getValue()))
                    .desiredState(state)
                    .version(lastVersion + 1)
                    .updatedAt(clock.instant())
                    .build();
            bindingStore.save(binding);
            lastVersion = binding.getVersion();
            bindings.put(key, binding);

            log.info("[Registry] {} {} v{} ({}, credentials {})", existing == null ? "Created" : "Updated",
                    key, binding.getVersion(), state.toJson(), binding.getCredentials().fingerprint());
            notifyListeners(BindingChangeEvent.upserted(binding));
            return binding;
        }
    }

    public AgentBotBinding put(AgentBotBinding binding) {
        return put(binding.getAgentId(), binding.getPlatform(), binding.getCredentials(), binding.getDesiredState());
    }

    public Optional<AgentBotBinding> remove(String agentId, Platform platform) {
        BindingKey key = BindingKey.of(agentId, platform);
        synchronized (mutationLock) {
            AgentBotBinding existing = bindings.get(key);
            if (existing == null) {
                return Optional.empty();
            }
            bindingStore.delete(key);
            bindings.remove(key);
            lastVersion++;
            log.info("[Registry] Removed {} at v{}", key, lastVersion);
            notifyListeners(BindingChangeEvent.removed(key, lastVersion));
            return Optional.of(existing);
        }
    }

    /**
     * Remove every platform binding of one agent.
     */
    public List<AgentBotBinding> removeAgent(String agentId) {
        List<AgentBotBinding> removed = new ArrayList<>();
        for (Platform platform : Platform.values()) {
            remove(agentId, platform).ifPresent(removed::add);
        }
        if (removed.isEmpty()) {
            throw new BindingNotFoundException(agentId);
        }
        return removed;
    }

    public AgentBotBinding get(String agentId, Platform platform) {
        BindingKey key = BindingKey.of(agentId, platform);
        return find(key).orElseThrow(() -> new BindingNotFoundException(key));
    }

    public Optional<AgentBotBinding> find(BindingKey key) {
        return Optional.ofNullable(bindings.get(key));
    }

    public List<AgentBotBinding> list() {
        return bindings.values().stream()
                .sorted(Comparator.comparing(AgentBotBinding::getAgentId)
                        .thenComparing(AgentBotBinding::getPlatform))
                .toList();
    }

    /**
     * Current bindings together with the registry version they reflect,
     * taken atomically with respect to mutations.
     */
    public Snapshot snapshot() {
        synchronized (mutationLock) {
            return new Snapshot(lastVersion, list());
        }
    }

    public List<AgentBotBinding> listForAgent(String agentId) {
        return list().stream()
                .filter(binding -> binding.getAgentId().equals(agentId))
                .toList();
    }

    /**
     * Subscribe to changes. The listener first receives an {@code UPSERTED}
     * event for every current binding, then every later change. Registration
     * and replay happen atomically with respect to mutations, so no change is
     * missed between the two.
     *
     * @return handle that unsubscribes the listener when closed
     */
    public Subscription watch(Consumer<BindingChangeEvent> listener) {
        synchronized (mutationLock) {
            for (AgentBotBinding binding : list()) {
                deliver(listener, BindingChangeEvent.upserted(binding));
            }
            listeners.add(listener);
        }
        return () -> listeners.remove(listener);
    }

    private void notifyListeners(BindingChangeEvent event) {
        for (Consumer<BindingChangeEvent> listener : listeners) {
            deliver(listener, event);
        }
    }

    private void deliver(Consumer<BindingChangeEvent> listener, BindingChangeEvent event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.error("[Registry] Listener failed on {} v{}: {}", event.key(), event.version(), e.getMessage(), e);
        }
    }

    public record Snapshot(long version, List<AgentBotBinding> bindings) {
    }

    /**
     * Handle returned by {@link #watch(Consumer)}.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}

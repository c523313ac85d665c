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
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.AgentBotBinding;
import me.golemcore.gateway.domain.model.BindingChangeEvent;
import me.golemcore.gateway.domain.model.BindingKey;
import me.golemcore.gateway.domain.model.ConnectionState;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bridges registry changes to the supervisor.
 *
 * <p>
 * Each (key, version) is handed to the supervisor at most once. A periodic
 * resync re-submits every current binding and unregisters supervised keys
 * the registry no longer has, so a lost notification of either kind is
 * healed on the next round; the supervisor ignores versions it already
 * applied. The same round drops tombstones of keys removed earlier.
 */
@Service
@Slf4j
public class CredentialWatcher {

    private final TenantRegistry registry;
    private final ConnectionSupervisor supervisor;
    private final GatewayProperties properties;
    private final Map<BindingKey, Long> deliveredVersions = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;
    private volatile TenantRegistry.Subscription subscription;

    public CredentialWatcher(TenantRegistry registry, ConnectionSupervisor supervisor,
            GatewayProperties properties) {
        this.registry = registry;
        this.supervisor = supervisor;
        this.properties = properties;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "credential-resync");
            thread.setDaemon(true);
            return thread;
        });
    }

    @PostConstruct
    public void start() {
        subscription = registry.watch(this::onChange);
        long intervalMillis = properties.getSupervisor().getResyncInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::runScheduledResync, intervalMillis, intervalMillis,
                TimeUnit.MILLISECONDS);
        log.info("[Watcher] Watching {} binding(s), resync every {}s", registry.list().size(),
                properties.getSupervisor().getResyncInterval().toSeconds());
    }

    @PreDestroy
    public void stop() {
        TenantRegistry.Subscription current = subscription;
        if (current != null) {
            current.close();
            subscription = null;
        }
        scheduler.shutdownNow();
    }

    void onChange(BindingChangeEvent event) {
        AtomicBoolean fresh = new AtomicBoolean();
        deliveredVersions.compute(event.key(), (key, last) -> {
            if (last != null && event.version() <= last) {
                return last;
            }
            fresh.set(true);
            return event.version();
        });
        if (!fresh.get()) {
            log.debug("[Watcher] Skipping already delivered {} v{}", event.key(), event.version());
            return;
        }
        switch (event.type()) {
        case UPSERTED -> {
            log.info("[Watcher] Binding {} changed (v{}, {})", event.key(), event.version(),
                    event.binding().getDesiredState());
            track(event.key(), supervisor.reconcile(event.binding()));
        }
        case REMOVED -> {
            log.info("[Watcher] Binding {} removed (v{})", event.key(), event.version());
            track(event.key(), supervisor.unregister(event.key(), event.version()));
        }
        }
    }

    /**
     * Re-submits every current binding to the supervisor and unregisters
     * keys missing from the registry at the snapshot version.
     *
     * @return number of bindings submitted
     */
    public synchronized int resync() {
        TenantRegistry.Snapshot snapshot = registry.snapshot();
        Set<BindingKey> present = new HashSet<>();
        for (AgentBotBinding binding : snapshot.bindings()) {
            present.add(binding.getKey());
            track(binding.getKey(), supervisor.reconcile(binding));
        }
        for (BindingKey key : supervisor.supervisedKeys()) {
            if (!present.contains(key)) {
                log.warn("[Watcher] {} is supervised but no longer registered, unregistering at v{}",
                        key, snapshot.version());
                onChange(BindingChangeEvent.removed(key, snapshot.version()));
            }
        }
        int evicted = supervisor.evictTombstones(present);
        log.debug("[Watcher] Resynced {} binding(s), evicted {} tombstone(s)", present.size(), evicted);
        return snapshot.bindings().size();
    }

    private void runScheduledResync() {
        try {
            resync();
        } catch (RuntimeException e) {
            log.error("[Watcher] Resync failed", e);
        }
    }

    private void track(BindingKey key, CompletableFuture<ConnectionState> transition) {
        transition.whenComplete((state, error) -> {
            if (error != null) {
                log.warn("[Watcher] Transition of {} failed: {}", key, error.getMessage());
            }
        });
    }
}

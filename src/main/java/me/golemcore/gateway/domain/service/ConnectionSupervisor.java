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
import me.golemcore.gateway.domain.exception.CredentialInvalidException;
import me.golemcore.gateway.domain.exception.PlatformException;
import me.golemcore.gateway.domain.exception.TransientNetworkException;
import me.golemcore.gateway.domain.model.AgentBotBinding;
import me.golemcore.gateway.domain.model.BindingKey;
import me.golemcore.gateway.domain.model.ConnectionState;
import me.golemcore.gateway.domain.model.ConnectionStateChangedEvent;
import me.golemcore.gateway.domain.model.ConnectionStatus;
import me.golemcore.gateway.domain.model.FailureKind;
import me.golemcore.gateway.domain.model.RawPlatformEvent;
import me.golemcore.gateway.domain.model.Secret;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.inbound.ConnectionContext;
import me.golemcore.gateway.port.inbound.PlatformAdapter;
import me.golemcore.gateway.port.outbound.PlatformAdapterProvider;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Owns the lifecycle of every (agent, platform) connection.
 *
 * <p>
 * Each binding key gets a {@link SupervisedConnection} whose transitions run
 * strictly one at a time on a {@link SerialExecutor}, so at most one adapter
 * per key is ever live. Connects, health checks and disconnects are bounded by the
 * configured timeouts; transient failures are retried with capped exponential
 * backoff. Rejected credentials and adapter construction failures are not
 * retried until the binding changes.
 *
 * <p>
 * State machine per key:
 *
 * <pre>
 * STOPPED -> STARTING -> RUNNING -> STOPPING -> STOPPED
 *               |           |
 *               v           v
 *             ERROR <-------+   (transient: retry with backoff)
 * </pre>
 */
@Service
@Slf4j
public class ConnectionSupervisor {

    private static final long PUMP_POLL_MILLIS = 250;

    private final PlatformAdapterProvider adapterProvider;
    private final InboundRouter inboundRouter;
    private final ApplicationEventPublisher eventPublisher;
    private final GatewayProperties.SupervisorProperties settings;
    private final Clock clock;
    private final BackoffPolicy backoffPolicy;
    private final ExecutorService workerPool;
    private final ScheduledExecutorService scheduler;
    private final Map<BindingKey, SupervisedConnection> connections = new ConcurrentHashMap<>();
    private volatile boolean shuttingDown;

    public ConnectionSupervisor(PlatformAdapterProvider adapterProvider, InboundRouter inboundRouter,
            ApplicationEventPublisher eventPublisher, GatewayProperties properties, Clock clock) {
        this.adapterProvider = adapterProvider;
        this.inboundRouter = inboundRouter;
        this.eventPublisher = eventPublisher;
        this.settings = properties.getSupervisor();
        this.clock = clock;
        this.backoffPolicy = new BackoffPolicy(settings.getBackoffBase(), settings.getBackoffMax(),
                settings.getBackoffJitter());
        AtomicInteger workerCounter = new AtomicInteger();
        this.workerPool = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "supervisor-worker-" + workerCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "supervisor-scheduler");
            thread.setDaemon(true);
            return thread;
        });
    }

    @PostConstruct
    public void startHealthChecks() {
        long intervalMillis = settings.getHealthCheckInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::runScheduledHealthCheck, intervalMillis, intervalMillis,
                TimeUnit.MILLISECONDS);
        log.info("[Supervisor] Health checks every {}s", settings.getHealthCheckInterval().toSeconds());
    }

    /**
     * Drives the connection of {@code binding.getKey()} towards the binding.
     * Bindings not newer than the last applied version are ignored.
     */
    public CompletableFuture<ConnectionState> reconcile(AgentBotBinding binding) {
        if (shuttingDown) {
            return CompletableFuture.failedFuture(new IllegalStateException("Supervisor is shutting down"));
        }
        return submitTo(binding.getKey(), connection -> {
            connection.preemptStartIfSuperseded(binding);
            return connection.submit(() -> connection.applyBinding(binding));
        });
    }

    /**
     * Stops the connection of a removed binding. The key keeps a tombstone at
     * {@code version} so late, older upserts stay ignored.
     */
    public CompletableFuture<ConnectionState> unregister(BindingKey key, long version) {
        if (shuttingDown) {
            return CompletableFuture.failedFuture(new IllegalStateException("Supervisor is shutting down"));
        }
        return submitTo(key, connection -> {
            connection.preemptStart(version);
            return connection.submit(() -> connection.applyRemoval(version));
        });
    }

    /**
     * Forces a stop-then-start of an enabled binding, clearing any permanent
     * failure.
     */
    public CompletableFuture<ConnectionState> restart(AgentBotBinding binding) {
        if (shuttingDown) {
            return CompletableFuture.failedFuture(new IllegalStateException("Supervisor is shutting down"));
        }
        return submitTo(binding.getKey(), connection -> connection.submit(() -> connection.restart(binding)));
    }

    /**
     * Checks every running connection. Completes when all checks are done.
     */
    public CompletableFuture<Void> healthCheck() {
        List<CompletableFuture<ConnectionState>> checks = new ArrayList<>();
        for (SupervisedConnection connection : connections.values()) {
            if (connection.snapshot.getStatus() == ConnectionStatus.RUNNING) {
                checks.add(connection.submit(connection::checkHealth));
            }
        }
        return CompletableFuture.allOf(checks.toArray(new CompletableFuture[0]));
    }

    public Optional<ConnectionState> getState(BindingKey key) {
        SupervisedConnection connection = connections.get(key);
        return connection != null ? Optional.of(connection.snapshot) : Optional.empty();
    }

    public ConnectionState getStateOrStopped(BindingKey key) {
        return getState(key).orElseGet(() -> ConnectionState.stopped(key, clock.instant()));
    }

    /**
     * Keys that still have a binding applied, enabled or not.
     */
    public List<BindingKey> supervisedKeys() {
        return connections.entrySet().stream()
                .filter(entry -> entry.getValue().desired != null)
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * Drops the tombstones of removed keys that are not in {@code keep}, once
     * they are stopped and have no transition queued. Late upserts for an
     * evicted key are no longer recognised as stale, so callers pass the keys
     * of a registry snapshot whose upserts have all been submitted already.
     *
     * @return number of evicted keys
     */
    public int evictTombstones(Set<BindingKey> keep) {
        int evicted = 0;
        for (BindingKey key : List.copyOf(connections.keySet())) {
            if (keep.contains(key)) {
                continue;
            }
            AtomicBoolean dropped = new AtomicBoolean();
            connections.computeIfPresent(key, (k, connection) -> {
                if (connection.isIdleTombstone()) {
                    dropped.set(true);
                    return null;
                }
                return connection;
            });
            if (dropped.get()) {
                inboundRouter.forget(key);
                evicted++;
                log.debug("[Supervisor] Evicted tombstone of {}", key);
            }
        }
        return evicted;
    }

    public List<ConnectionState> listStates() {
        return connections.values().stream()
                .filter(connection -> connection.desired != null)
                .map(connection -> connection.snapshot)
                .sorted(Comparator.comparing(ConnectionState::getAgentId)
                        .thenComparing(ConnectionState::getPlatform))
                .toList();
    }

    /**
     * Live handle for sending, if the key is currently running.
     */
    public Optional<ConnectionHandle> findLiveHandle(BindingKey key) {
        SupervisedConnection connection = connections.get(key);
        if (connection == null) {
            return Optional.empty();
        }
        ConnectionHandle handle = connection.liveHandle;
        if (handle == null || !handle.isActive()) {
            return Optional.empty();
        }
        return Optional.of(handle);
    }

    /**
     * Whether the key has an enabled binding the supervisor is working on,
     * i.e. a connection may appear shortly even if none is live now.
     */
    public boolean isManaged(BindingKey key) {
        SupervisedConnection connection = connections.get(key);
        if (connection == null || connection.desired == null || !connection.desired.isEnabled()) {
            return false;
        }
        ConnectionState state = connection.snapshot;
        return !state.isPermanentFailure();
    }

    @PreDestroy
    public void shutdownAll() {
        if (shuttingDown) {
            return;
        }
        shuttingDown = true;
        Duration grace = settings.getShutdownGrace();
        log.info("[Supervisor] Stopping {} connection(s), grace {}s", connections.size(), grace.toSeconds());
        scheduler.shutdownNow();

        List<CompletableFuture<ConnectionState>> stops = new ArrayList<>();
        for (SupervisedConnection connection : connections.values()) {
            connection.preemptStart(Long.MAX_VALUE);
            stops.add(connection.submit(connection::shutdown));
        }
        try {
            CompletableFuture.allOf(stops.toArray(new CompletableFuture[0]))
                    .get(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("[Supervisor] Grace period elapsed, force-releasing remaining connections");
            connections.values().forEach(SupervisedConnection::forceRelease);
        } catch (ExecutionException e) {
            log.warn("[Supervisor] Shutdown of some connections failed: {}", e.getMessage());
            connections.values().forEach(SupervisedConnection::forceRelease);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            connections.values().forEach(SupervisedConnection::forceRelease);
        }
        workerPool.shutdownNow();
        log.info("[Supervisor] Stopped");
    }

    /**
     * Get-or-create and submit happen under the map's per-key lock, so an
     * entry is never evicted between being looked up and receiving work.
     */
    private CompletableFuture<ConnectionState> submitTo(BindingKey key,
            Function<SupervisedConnection, CompletableFuture<ConnectionState>> action) {
        AtomicReference<CompletableFuture<ConnectionState>> result = new AtomicReference<>();
        connections.compute(key, (k, existing) -> {
            SupervisedConnection connection = existing != null ? existing : new SupervisedConnection(k);
            result.set(action.apply(connection));
            return connection;
        });
        return result.get();
    }

    private void runScheduledHealthCheck() {
        try {
            healthCheck();
        } catch (RuntimeException e) {
            log.error("[Supervisor] Health check round failed", e);
        }
    }

    private void publishStateChange(BindingKey key, ConnectionStatus previous, ConnectionState current) {
        try {
            eventPublisher.publishEvent(new ConnectionStateChangedEvent(key, previous, current));
        } catch (RuntimeException e) {
            log.warn("[Supervisor] State change listener failed for {}: {}", key, e.getMessage());
        }
    }

    private void pump(ConnectionHandle handle) {
        BlockingQueue<RawPlatformEvent> events = handle.getAdapter().events();
        ConnectionContext context = handle.getContext();
        try {
            while (!context.isCancelled()) {
                RawPlatformEvent event = events.poll(PUMP_POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (event != null) {
                    routeSafely(event);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        List<RawPlatformEvent> leftovers = new ArrayList<>();
        events.drainTo(leftovers);
        if (!leftovers.isEmpty()) {
            log.debug("[Supervisor] Draining {} leftover event(s) of {}", leftovers.size(), handle.getKey());
        }
        leftovers.forEach(this::routeSafely);
    }

    private void routeSafely(RawPlatformEvent event) {
        try {
            inboundRouter.onEvent(event);
        } catch (RuntimeException e) {
            log.error("[Supervisor] Inbound routing failed for {} message {}: {}",
                    event.getKey(), event.getExternalMessageId(), e.getMessage(), e);
        }
    }

    private record StartAttempt(ConnectionContext context, long version, Secret credentials) {
    }

    /**
     * Per-key actor. Fields without {@code volatile} are only touched from
     * tasks running on {@link #actor}.
     */
    private final class SupervisedConnection {

        private final BindingKey key;
        private final SerialExecutor actor;

        private volatile AgentBotBinding desired;
        private volatile ConnectionHandle liveHandle;
        private volatile StartAttempt pendingStart;
        private volatile ConnectionState snapshot;

        private long appliedVersion;
        private ConnectionStatus status = ConnectionStatus.STOPPED;
        private ConnectionHandle handle;
        private Secret boundCredentials;
        private long boundVersion;
        private Instant connectedAt;
        private String lastError;
        private FailureKind lastErrorKind;
        private boolean permanentFailure;
        private int retryCount;
        private long attemptEpoch;
        private ScheduledFuture<?> retryTask;

        SupervisedConnection(BindingKey key) {
            this.key = key;
            this.actor = new SerialExecutor(workerPool);
            this.snapshot = ConnectionState.stopped(key, clock.instant());
        }

        CompletableFuture<ConnectionState> submit(Supplier<ConnectionState> transition) {
            CompletableFuture<ConnectionState> result = new CompletableFuture<>();
            try {
                actor.execute(() -> {
                    try {
                        result.complete(transition.get());
                    } catch (IllegalStateException e) {
                        result.completeExceptionally(e);
                    } catch (RuntimeException e) {
                        log.error("[Supervisor] Transition failed for {}", key, e);
                        result.completeExceptionally(e);
                    }
                });
            } catch (RejectedExecutionException e) {
                result.completeExceptionally(new IllegalStateException("Supervisor is shutting down", e));
            }
            return result;
        }

        boolean isIdleTombstone() {
            return desired == null && snapshot.getStatus() == ConnectionStatus.STOPPED && actor.pending() == 0;
        }

        void preemptStartIfSuperseded(AgentBotBinding binding) {
            StartAttempt attempt = pendingStart;
            if (attempt == null || binding.getVersion() <= attempt.version()) {
                return;
            }
            if (!binding.isEnabled() || !Secret.sameValue(binding.getCredentials(), attempt.credentials())) {
                log.info("[Supervisor] Preempting start of {} v{} in favour of v{}",
                        key, attempt.version(), binding.getVersion());
                attempt.context().cancel();
            }
        }

        void preemptStart(long version) {
            StartAttempt attempt = pendingStart;
            if (attempt != null && version > attempt.version()) {
                attempt.context().cancel();
            }
        }

        ConnectionState applyBinding(AgentBotBinding binding) {
            if (binding.getVersion() <= appliedVersion) {
                log.debug("[Supervisor] Ignoring stale v{} for {} (applied v{})",
                        binding.getVersion(), key, appliedVersion);
                return snapshot;
            }
            appliedVersion = binding.getVersion();
            desired = binding;

            if (!binding.isEnabled()) {
                cancelRetry();
                retryCount = 0;
                permanentFailure = false;
                stop("binding disabled");
                return publish();
            }
            if (status == ConnectionStatus.RUNNING
                    && Secret.sameValue(boundCredentials, binding.getCredentials())) {
                boundVersion = binding.getVersion();
                return publish();
            }

            cancelRetry();
            if (handle != null) {
                log.info("[Supervisor] Credentials of {} changed, reconnecting", key);
            }
            stop("binding updated");
            retryCount = 0;
            permanentFailure = false;
            return start();
        }

        ConnectionState applyRemoval(long version) {
            if (version <= appliedVersion) {
                return snapshot;
            }
            appliedVersion = version;
            desired = null;
            cancelRetry();
            retryCount = 0;
            permanentFailure = false;
            stop("binding removed");
            return publish();
        }

        ConnectionState restart(AgentBotBinding binding) {
            if (binding.getVersion() > appliedVersion) {
                appliedVersion = binding.getVersion();
                desired = binding;
            }
            AgentBotBinding target = desired;
            if (target == null || !target.isEnabled()) {
                throw new IllegalStateException("Binding " + key + " is not enabled");
            }
            log.info("[Supervisor] Restart requested for {}", key);
            cancelRetry();
            stop("restart requested");
            retryCount = 0;
            permanentFailure = false;
            lastError = null;
            lastErrorKind = null;
            return start();
        }

        ConnectionState checkHealth() {
            ConnectionHandle current = handle;
            if (status != ConnectionStatus.RUNNING || current == null) {
                return snapshot;
            }
            String reason = "adapter reported unhealthy";
            boolean healthy;
            Duration timeout = settings.getHealthCheckTimeout();
            try {
                healthy = CompletableFuture
                        .supplyAsync(() -> current.getAdapter().isHealthy(timeout), workerPool)
                        .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                healthy = false;
                reason = "timed out after " + timeout.toMillis() + "ms";
            } catch (ExecutionException e) {
                healthy = false;
                reason = "adapter error: " + e.getCause().getMessage();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return snapshot;
            }
            if (healthy) {
                return snapshot;
            }
            log.warn("[Supervisor] Health check failed for {}: {}", key, reason);
            tearDown();
            connectedAt = null;
            lastError = "Health check failed: " + reason;
            lastErrorKind = FailureKind.TRANSIENT_NETWORK;
            return scheduleRetry();
        }

        ConnectionState shutdown() {
            cancelRetry();
            stop("shutdown");
            return publish();
        }

        void forceRelease() {
            StartAttempt attempt = pendingStart;
            if (attempt != null) {
                attempt.context().cancel();
            }
            ConnectionHandle current = liveHandle;
            if (current != null) {
                log.warn("[Supervisor] Force-releasing {}", key);
                current.getContext().cancel();
                liveHandle = null;
            }
        }

        private ConnectionState start() {
            AgentBotBinding target = desired;
            long epoch = ++attemptEpoch;
            ConnectionContext context = new ConnectionContext(key, target.getVersion());
            status = ConnectionStatus.STARTING;
            publish();
            log.info("[Supervisor] Starting {} (v{}, attempt {})", key, target.getVersion(), retryCount + 1);

            PlatformAdapter adapter;
            try {
                adapter = adapterProvider.create(key);
            } catch (RuntimeException e) {
                log.error("[Supervisor] Could not create adapter for {}", key, e);
                return failPermanently("Adapter construction failed: " + e.getMessage(), FailureKind.ADAPTER_CRASH);
            }

            pendingStart = new StartAttempt(context, target.getVersion(), target.getCredentials());
            try {
                connectWithTimeout(adapter, context, target.getCredentials());
            } catch (CredentialInvalidException e) {
                release(adapter, context);
                return failPermanently(e.getMessage(), FailureKind.CREDENTIAL_INVALID);
            } catch (CancellationException e) {
                release(adapter, context);
                return abandonStart(target);
            } catch (PlatformException e) {
                release(adapter, context);
                lastError = e.getMessage();
                lastErrorKind = e.getFailureKind();
                return scheduleRetry();
            } catch (RuntimeException e) {
                release(adapter, context);
                log.error("[Supervisor] Adapter for {} crashed during connect", key, e);
                lastError = e.getMessage();
                lastErrorKind = FailureKind.ADAPTER_CRASH;
                return scheduleRetry();
            } finally {
                pendingStart = null;
            }
            if (context.isCancelled() || epoch != attemptEpoch) {
                release(adapter, context);
                return abandonStart(target);
            }

            Instant now = clock.instant();
            ConnectionHandle started = new ConnectionHandle(key, adapter, context, target.getVersion(), now);
            handle = started;
            boundCredentials = target.getCredentials();
            boundVersion = target.getVersion();
            connectedAt = now;
            retryCount = 0;
            status = ConnectionStatus.RUNNING;
            liveHandle = started;
            workerPool.execute(() -> pump(started));
            log.info("[Supervisor] {} running (v{})", key, boundVersion);
            return publish();
        }

        private void connectWithTimeout(PlatformAdapter adapter, ConnectionContext context, Secret credentials) {
            Duration timeout = settings.getConnectTimeout();
            CompletableFuture<Void> connect = CompletableFuture.runAsync(
                    () -> adapter.connect(context, credentials), workerPool);
            context.onCancel(() -> connect.completeExceptionally(
                    new CancellationException("Connect of " + key + " cancelled")));
            try {
                connect.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                context.cancel();
                throw new TransientNetworkException("Connect timed out after " + timeout.toMillis() + "ms", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException runtimeException) {
                    throw runtimeException;
                }
                throw new IllegalStateException("Adapter crashed during connect: " + cause, cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                context.cancel();
                throw new CancellationException("Interrupted while connecting " + key);
            }
        }

        private ConnectionState abandonStart(AgentBotBinding target) {
            log.info("[Supervisor] Start of {} v{} was superseded", key, target.getVersion());
            status = ConnectionStatus.STOPPED;
            return publish();
        }

        /**
         * Rejected credentials and adapters that cannot be built stay in ERROR
         * until the binding changes or a restart is requested.
         */
        private ConnectionState failPermanently(String error, FailureKind kind) {
            status = ConnectionStatus.ERROR;
            lastError = error;
            lastErrorKind = kind;
            permanentFailure = true;
            log.error("[Supervisor] {} failed ({}), not retrying until the binding changes: {}",
                    key, kind, error);
            return publish();
        }

        private ConnectionState scheduleRetry() {
            retryCount++;
            if (retryCount > settings.getMaxRetries()) {
                status = ConnectionStatus.STOPPED;
                permanentFailure = true;
                log.error("[Supervisor] Giving up on {} after {} retries: {}",
                        key, settings.getMaxRetries(), lastError);
                return publish();
            }
            Duration delay = backoffPolicy.delayFor(retryCount);
            status = ConnectionStatus.ERROR;
            long epoch = attemptEpoch;
            try {
                retryTask = scheduler.schedule(() -> submit(() -> retry(epoch)),
                        delay.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("[Supervisor] Retry of {} not scheduled, scheduler stopped", key);
            }
            log.warn("[Supervisor] {} failed ({}), retry {}/{} in {}ms: {}",
                    key, lastErrorKind, retryCount, settings.getMaxRetries(), delay.toMillis(), lastError);
            return publish();
        }

        private ConnectionState retry(long epoch) {
            AgentBotBinding target = desired;
            if (epoch != attemptEpoch || status != ConnectionStatus.ERROR || permanentFailure
                    || target == null || !target.isEnabled() || shuttingDown) {
                return snapshot;
            }
            retryTask = null;
            return start();
        }

        private void cancelRetry() {
            if (retryTask != null) {
                retryTask.cancel(false);
                retryTask = null;
            }
            attemptEpoch++;
        }

        private void stop(String reason) {
            if (handle == null) {
                status = ConnectionStatus.STOPPED;
                connectedAt = null;
                return;
            }
            status = ConnectionStatus.STOPPING;
            publish();
            log.info("[Supervisor] Stopping {}: {}", key, reason);
            tearDown();
            status = ConnectionStatus.STOPPED;
            connectedAt = null;
        }

        private void tearDown() {
            ConnectionHandle current = handle;
            handle = null;
            liveHandle = null;
            boundCredentials = null;
            if (current != null) {
                release(current.getAdapter(), current.getContext());
            }
        }

        private void release(PlatformAdapter adapter, ConnectionContext context) {
            Duration timeout = settings.getDisconnectTimeout();
            CompletableFuture<Void> disconnect = CompletableFuture.runAsync(
                    () -> adapter.disconnectGracefully(timeout), workerPool);
            try {
                disconnect.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.warn("[Supervisor] Disconnect of {} exceeded {}ms, force-releasing", key, timeout.toMillis());
            } catch (ExecutionException e) {
                log.warn("[Supervisor] Disconnect of {} failed: {}", key, e.getCause().getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                context.cancel();
            }
        }

        private ConnectionState publish() {
            ConnectionStatus previous = snapshot.getStatus();
            AgentBotBinding target = desired;
            ConnectionState state = ConnectionState.builder()
                    .agentId(key.agentId())
                    .platform(key.platform())
                    .status(status)
                    .boundVersion(handle != null ? boundVersion : 0)
                    .desiredVersion(target != null ? target.getVersion() : appliedVersion)
                    .lastError(lastError)
                    .lastErrorKind(lastErrorKind)
                    .retryCount(retryCount)
                    .permanentFailure(permanentFailure)
                    .connectedAt(connectedAt)
                    .updatedAt(clock.instant())
                    .build();
            snapshot = state;
            if (previous != status) {
                publishStateChange(key, previous, state);
            }
            return state;
        }
    }
}

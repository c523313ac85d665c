package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.model.AgentBotBinding;
import me.golemcore.gateway.domain.model.BindingChangeEvent;
import me.golemcore.gateway.domain.model.BindingKey;
import me.golemcore.gateway.domain.model.ConnectionState;
import me.golemcore.gateway.domain.model.Platform;
import me.golemcore.gateway.domain.model.Secret;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.BindingStorePort;
import me.golemcore.gateway.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CredentialWatcherTest {

    private static final BindingKey KEY = BindingKey.of("agent-1", Platform.TELEGRAM);

    private TenantRegistry registry;
    private ConnectionSupervisor supervisor;
    private CredentialWatcher watcher;

    @BeforeEach
    void setUp() {
        BindingStorePort bindingStore = mock(BindingStorePort.class);
        when(bindingStore.loadAll()).thenReturn(List.of());
        registry = new TenantRegistry(bindingStore, new MutableClock(Instant.parse("2026-03-01T10:00:00Z")));
        registry.load();
        supervisor = mock(ConnectionSupervisor.class);
        when(supervisor.reconcile(any())).thenReturn(CompletableFuture.completedFuture(new ConnectionState()));
        when(supervisor.unregister(any(), anyLong()))
                .thenReturn(CompletableFuture.completedFuture(new ConnectionState()));
        watcher = new CredentialWatcher(registry, supervisor, new GatewayProperties());
    }

    @AfterEach
    void tearDown() {
        watcher.stop();
    }

    @Test
    void shouldReconcileExistingBindingsOnStart() {
        registry.put("agent-1", Platform.TELEGRAM, Secret.of("token-a"), null);
        registry.put("agent-2", Platform.DISCORD, Secret.of("token-b"), null);

        watcher.start();

        verify(supervisor, times(2)).reconcile(any());
    }

    @Test
    void shouldForwardLaterChanges() {
        watcher.start();

        AgentBotBinding binding = registry.put("agent-1", Platform.TELEGRAM, Secret.of("token-a"), null);
        registry.remove("agent-1", Platform.TELEGRAM);

        verify(supervisor).reconcile(binding);
        verify(supervisor).unregister(KEY, 2);
    }

    @Test
    void shouldDeliverEachVersionAtMostOnce() {
        AgentBotBinding binding = registry.put("agent-1", Platform.TELEGRAM, Secret.of("token-a"), null);
        BindingChangeEvent event = BindingChangeEvent.upserted(binding);

        watcher.onChange(event);
        watcher.onChange(event);

        verify(supervisor, times(1)).reconcile(binding);
    }

    @Test
    void shouldIgnoreOlderVersionArrivingLate() {
        AgentBotBinding older = registry.put("agent-1", Platform.TELEGRAM, Secret.of("token-a"), null);
        AgentBotBinding newer = registry.put("agent-1", Platform.TELEGRAM, Secret.of("token-b"), null);

        watcher.onChange(BindingChangeEvent.upserted(newer));
        watcher.onChange(BindingChangeEvent.upserted(older));

        verify(supervisor).reconcile(newer);
        verify(supervisor, never()).reconcile(older);
    }

    @Test
    void shouldResubmitEveryBindingOnResync() {
        registry.put("agent-1", Platform.TELEGRAM, Secret.of("token-a"), null);
        registry.put("agent-2", Platform.DISCORD, Secret.of("token-b"), null);
        watcher.start();

        int submitted = watcher.resync();

        assertEquals(2, submitted);
        verify(supervisor, times(4)).reconcile(any());
    }

    @Test
    void shouldUnregisterKeysRemovedWhileNotListening() {
        registry.put("agent-1", Platform.TELEGRAM, Secret.of("token-a"), null);
        registry.put("agent-2", Platform.DISCORD, Secret.of("token-b"), null);
        registry.remove("agent-1", Platform.TELEGRAM);
        when(supervisor.supervisedKeys())
                .thenReturn(List.of(KEY, BindingKey.of("agent-2", Platform.DISCORD)));

        int submitted = watcher.resync();

        assertEquals(1, submitted);
        verify(supervisor).unregister(KEY, 3);
        verify(supervisor, never()).unregister(BindingKey.of("agent-2", Platform.DISCORD), 3);
    }

    @Test
    void shouldNotUnregisterTwiceForSameSnapshot() {
        registry.put("agent-1", Platform.TELEGRAM, Secret.of("token-a"), null);
        registry.remove("agent-1", Platform.TELEGRAM);
        when(supervisor.supervisedKeys()).thenReturn(List.of(KEY));

        watcher.resync();
        watcher.resync();

        verify(supervisor, times(1)).unregister(KEY, 2);
    }

    @Test
    void shouldEvictTombstonesOfKeysOutsideSnapshot() {
        registry.put("agent-2", Platform.DISCORD, Secret.of("token-b"), null);

        watcher.resync();

        verify(supervisor).evictTombstones(Set.of(BindingKey.of("agent-2", Platform.DISCORD)));
    }

    @Test
    void shouldStopListeningAfterStop() {
        watcher.start();
        watcher.stop();

        registry.put("agent-1", Platform.TELEGRAM, Secret.of("token-a"), null);

        verify(supervisor, never()).reconcile(any());
    }

    @Test
    void shouldSurviveFailedTransition() {
        when(supervisor.reconcile(any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("shutting down")));
        watcher.start();

        assertDoesNotThrow(() -> registry.put("agent-1", Platform.TELEGRAM, Secret.of("token-a"), null));
    }
}

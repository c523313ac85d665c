package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.exception.PlatformRequestRejectedException;
import me.golemcore.gateway.domain.exception.RateLimitedException;
import me.golemcore.gateway.domain.exception.RoutingException;
import me.golemcore.gateway.domain.exception.TransientNetworkException;
import me.golemcore.gateway.domain.model.BindingKey;
import me.golemcore.gateway.domain.model.ConnectionState;
import me.golemcore.gateway.domain.model.ConnectionStateChangedEvent;
import me.golemcore.gateway.domain.model.ConnectionStatus;
import me.golemcore.gateway.domain.model.Platform;
import me.golemcore.gateway.domain.model.SendAck;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.inbound.ConnectionContext;
import me.golemcore.gateway.port.inbound.PlatformAdapter;
import me.golemcore.gateway.ratelimit.ConnectionRateLimiter;
import me.golemcore.gateway.ratelimit.RateLimiter;
import me.golemcore.gateway.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OutboundDispatcherTest {

    private static final BindingKey KEY = BindingKey.of("agent-1", Platform.DISCORD);
    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    private MutableClock clock;
    private GatewayProperties properties;
    private ConnectionSupervisor supervisor;
    private PlatformAdapter adapter;
    private ConnectionHandle handle;
    private List<Duration> sleeps;
    private OutboundDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        properties = new GatewayProperties();
        properties.getPlatforms().getDiscord().setRateLimit(
                new GatewayProperties.RateLimitProperties(5, Duration.ofSeconds(5)));
        properties.getOutbound().setRoutingRetryDelay(Duration.ofSeconds(2));
        properties.getOutbound().setMaxRateLimitWait(Duration.ofSeconds(30));
        supervisor = mock(ConnectionSupervisor.class);
        adapter = mock(PlatformAdapter.class);
        when(adapter.send(anyString(), anyString()))
                .thenAnswer(invocation -> CompletableFuture.completedFuture(new SendAck("m-1", 1)));
        handle = new ConnectionHandle(KEY, adapter, new ConnectionContext(KEY, 1), 1, START);
        sleeps = new ArrayList<>();
        dispatcher = newDispatcher(new ConnectionRateLimiter(properties, clock));
    }

    // ===== Routing =====

    @Test
    void shouldSendThroughLiveHandle() {
        when(supervisor.findLiveHandle(KEY)).thenReturn(Optional.of(handle));

        SendAck ack = dispatcher.dispatch("agent-1", Platform.DISCORD, "123456789012345678", "hello");

        assertEquals("m-1", ack.externalMessageId());
        verify(adapter).send("123456789012345678", "hello");
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldFailImmediatelyWhenAgentHasNoConnection() {
        when(supervisor.findLiveHandle(KEY)).thenReturn(Optional.empty());
        when(supervisor.isManaged(KEY)).thenReturn(false);

        RoutingException error = assertThrows(RoutingException.class,
                () -> dispatcher.dispatch("agent-1", Platform.DISCORD, "123", "hello"));

        assertEquals(KEY, error.getKey());
        assertTrue(sleeps.isEmpty());
        verify(adapter, never()).send(anyString(), anyString());
    }

    @Test
    void shouldRetryLookupOnceWhileConnectionStarts() {
        when(supervisor.findLiveHandle(KEY)).thenReturn(Optional.empty(), Optional.of(handle));
        when(supervisor.isManaged(KEY)).thenReturn(true);

        SendAck ack = dispatcher.dispatch("agent-1", Platform.DISCORD, "123", "hello");

        assertEquals(1, ack.chunks());
        assertEquals(List.of(Duration.ofSeconds(2)), sleeps);
    }

    @Test
    void shouldFailWhenConnectionStillNotRunningAfterRetry() {
        when(supervisor.findLiveHandle(KEY)).thenReturn(Optional.empty());
        when(supervisor.isManaged(KEY)).thenReturn(true);

        assertThrows(RoutingException.class, () -> dispatcher.dispatch("agent-1", Platform.DISCORD, "123", "hello"));

        assertEquals(1, sleeps.size());
        verify(supervisor, times(2)).findLiveHandle(KEY);
    }

    @Test
    void shouldRejectInvalidInput() {
        assertThrows(IllegalArgumentException.class,
                () -> dispatcher.dispatch("agent-1", Platform.DISCORD, "123", " "));
        assertThrows(IllegalArgumentException.class,
                () -> dispatcher.dispatch("agent-1", Platform.DISCORD, "", "hello"));
        assertThrows(IllegalArgumentException.class,
                () -> dispatcher.dispatch("../etc", Platform.DISCORD, "123", "hello"));
        assertThrows(IllegalArgumentException.class,
                () -> dispatcher.dispatch("agent-1", null, "123", "hello"));
    }

    // ===== Rate limiting =====

    @Test
    void shouldNeverExceedBucketCapacityPlusRefill() {
        when(supervisor.findLiveHandle(KEY)).thenReturn(Optional.of(handle));
        double ratePerSecond = 1.0;
        int capacity = 5;

        for (int sent = 1; sent <= 20; sent++) {
            dispatcher.dispatch("agent-1", Platform.DISCORD, "123", "message " + sent);
            double elapsedSeconds = Duration.between(START, clock.instant()).toNanos() / 1e9;
            assertTrue(sent <= capacity + ratePerSecond * elapsedSeconds,
                    "sent " + sent + " within " + elapsedSeconds + "s");
        }

        verify(adapter, times(20)).send(anyString(), anyString());
        assertFalse(sleeps.isEmpty());
    }

    @Test
    void shouldTakeOneTokenPerPlatformMessageForLongReplies() {
        when(supervisor.findLiveHandle(KEY)).thenReturn(Optional.of(handle));
        List<Instant> sendTimes = new ArrayList<>();
        List<Integer> chunkLengths = new ArrayList<>();
        when(adapter.send(anyString(), anyString())).thenAnswer(invocation -> {
            sendTimes.add(clock.instant());
            chunkLengths.add(invocation.getArgument(1, String.class).length());
            return CompletableFuture.completedFuture(new SendAck("m-" + sendTimes.size(), 1));
        });
        double ratePerSecond = 1.0;
        int capacity = 5;

        for (int reply = 0; reply < 5; reply++) {
            SendAck ack = dispatcher.dispatch("agent-1", Platform.DISCORD, "123", "x".repeat(6000));
            assertEquals(3, ack.chunks());
        }

        assertEquals(15, sendTimes.size());
        assertTrue(chunkLengths.stream().allMatch(length -> length <= Platform.DISCORD.getMaxMessageLength()));
        for (int i = 0; i < sendTimes.size(); i++) {
            double elapsedSeconds = Duration.between(START, sendTimes.get(i)).toNanos() / 1e9;
            assertTrue(i + 1 <= capacity + ratePerSecond * elapsedSeconds,
                    "message " + (i + 1) + " sent after " + elapsedSeconds + "s");
        }
        assertTrue(Duration.between(START, clock.instant()).compareTo(Duration.ofSeconds(10)) >= 0);
    }

    @Test
    void shouldReportLastMessageIdAndChunkCount() {
        when(supervisor.findLiveHandle(KEY)).thenReturn(Optional.of(handle));
        List<String> sent = new ArrayList<>();
        when(adapter.send(anyString(), anyString())).thenAnswer(invocation -> {
            sent.add(invocation.getArgument(1, String.class));
            return CompletableFuture.completedFuture(new SendAck("m-" + sent.size(), 1));
        });

        SendAck ack = dispatcher.dispatch("agent-1", Platform.DISCORD, "123", "y".repeat(4500));

        assertEquals("m-3", ack.externalMessageId());
        assertEquals(3, ack.chunks());
        assertEquals(List.of(2000, 2000, 500), sent.stream().map(String::length).toList());
    }

    @Test
    void shouldStopSendingChunksWhenRateLimitWaitWouldExceedMaximum() {
        properties.getOutbound().setMaxRateLimitWait(Duration.ofMillis(500));
        when(supervisor.findLiveHandle(KEY)).thenReturn(Optional.of(handle));

        assertThrows(RateLimitedException.class,
                () -> dispatcher.dispatch("agent-1", Platform.DISCORD, "123", "z".repeat(12000)));

        verify(adapter, times(5)).send(anyString(), anyString());
    }

    @Test
    void shouldFailWhenRateLimitWaitWouldExceedMaximum() {
        properties.getOutbound().setMaxRateLimitWait(Duration.ofMillis(500));
        when(supervisor.findLiveHandle(KEY)).thenReturn(Optional.of(handle));
        for (int i = 0; i < 5; i++) {
            dispatcher.dispatch("agent-1", Platform.DISCORD, "123", "burst " + i);
        }

        RateLimitedException error = assertThrows(RateLimitedException.class,
                () -> dispatcher.dispatch("agent-1", Platform.DISCORD, "123", "one too many"));

        assertTrue(error.getRetryAfter().compareTo(Duration.ofMillis(500)) > 0);
        verify(adapter, times(5)).send(anyString(), anyString());
    }

    @Test
    void shouldReleaseBucketOnlyWhenConnectionStops() {
        RateLimiter rateLimiter = mock(RateLimiter.class);
        OutboundDispatcher withMockLimiter = newDispatcher(rateLimiter);

        withMockLimiter.onConnectionStateChanged(stateChange(ConnectionStatus.RUNNING));
        verify(rateLimiter, never()).release(KEY);

        withMockLimiter.onConnectionStateChanged(stateChange(ConnectionStatus.STOPPED));
        verify(rateLimiter).release(KEY);
    }

    // ===== Send failures =====

    @Test
    void shouldSurfacePlatformRejection() {
        when(supervisor.findLiveHandle(KEY)).thenReturn(Optional.of(handle));
        when(adapter.send(anyString(), anyString())).thenReturn(
                CompletableFuture.failedFuture(new PlatformRequestRejectedException("Unknown Channel", 404)));

        PlatformRequestRejectedException error = assertThrows(PlatformRequestRejectedException.class,
                () -> dispatcher.dispatch("agent-1", Platform.DISCORD, "123", "hello"));

        assertEquals(404, error.getStatusCode());
    }

    @Test
    void shouldMapSendTimeoutToTransientFailure() {
        when(supervisor.findLiveHandle(KEY)).thenReturn(Optional.of(handle));
        when(adapter.send(anyString(), anyString())).thenReturn(CompletableFuture.failedFuture(new TimeoutException()));

        assertThrows(TransientNetworkException.class,
                () -> dispatcher.dispatch("agent-1", Platform.DISCORD, "123", "hello"));
    }

    private OutboundDispatcher newDispatcher(RateLimiter rateLimiter) {
        return new OutboundDispatcher(supervisor, rateLimiter, properties) {
            @Override
            protected void sleep(Duration duration) {
                sleeps.add(duration);
                clock.advance(duration);
            }
        };
    }

    private static ConnectionStateChangedEvent stateChange(ConnectionStatus status) {
        ConnectionState state = ConnectionState.builder()
                .agentId(KEY.agentId())
                .platform(KEY.platform())
                .status(status)
                .build();
        return new ConnectionStateChangedEvent(KEY, ConnectionStatus.RUNNING, state);
    }
}

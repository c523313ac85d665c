package me.golemcore.gateway.adapter.outbound.platform;

import me.golemcore.gateway.domain.exception.RateLimitedException;
import me.golemcore.gateway.domain.exception.RoutingException;
import me.golemcore.gateway.domain.model.BindingKey;
import me.golemcore.gateway.domain.model.Platform;
import me.golemcore.gateway.domain.model.Secret;
import me.golemcore.gateway.domain.model.SendAck;
import me.golemcore.gateway.port.inbound.ConnectionContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AbstractPlatformAdapterTest {

    private static final BindingKey KEY = BindingKey.of("agent-1", Platform.DISCORD);

    private ExecutorService ioExecutor;
    private ScheduledExecutorService scheduler;
    private StubAdapter adapter;
    private ConnectionContext context;

    @BeforeEach
    void setUp() {
        ioExecutor = Executors.newCachedThreadPool();
        scheduler = Executors.newSingleThreadScheduledExecutor();
        adapter = new StubAdapter(new AdapterRuntime(ioExecutor, scheduler, Duration.ofSeconds(5), 10));
        context = new ConnectionContext(KEY, 1);
    }

    @AfterEach
    void tearDown() {
        adapter.gate.countDown();
        ioExecutor.shutdownNow();
        scheduler.shutdownNow();
    }

    // ===== Sends =====

    @Test
    void shouldRejectSendBeforeConnect() {
        CompletableFuture<SendAck> future = adapter.send("chat", "hello");

        ExecutionException error = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(RoutingException.class, error.getCause());
    }

    @Test
    void shouldRejectBlankArguments() {
        adapter.connect(context, Secret.of("token"));

        assertInstanceOf(IllegalArgumentException.class,
                assertThrows(ExecutionException.class, () -> adapter.send(" ", "hello").get()).getCause());
        assertInstanceOf(IllegalArgumentException.class,
                assertThrows(ExecutionException.class, () -> adapter.send("chat", "").get()).getCause());
    }

    @Test
    void shouldSendOnIoPool() throws Exception {
        adapter.gate.countDown();
        adapter.connect(context, Secret.of("token"));

        SendAck ack = adapter.send("chat", "hello").get(1, TimeUnit.SECONDS);

        assertEquals("chat:hello", ack.externalMessageId());
    }

    @Test
    void shouldAbortInFlightSendsWhenContextCancelled() throws Exception {
        adapter.connect(context, Secret.of("token"));
        CompletableFuture<SendAck> future = adapter.send("chat", "hello");
        assertTrue(adapter.sendStarted.await(1, TimeUnit.SECONDS));

        context.cancel();

        ExecutionException error = assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
        assertInstanceOf(RoutingException.class, error.getCause());
    }

    // ===== Disconnect =====

    @Test
    void shouldFlushInFlightSendsOnGracefulDisconnect() throws Exception {
        adapter.connect(context, Secret.of("token"));
        CompletableFuture<SendAck> future = adapter.send("chat", "hello");
        assertTrue(adapter.sendStarted.await(1, TimeUnit.SECONDS));
        scheduler.schedule(adapter.gate::countDown, 100, TimeUnit.MILLISECONDS);

        adapter.disconnectGracefully(Duration.ofSeconds(2));

        assertEquals("chat:hello", future.get(1, TimeUnit.SECONDS).externalMessageId());
        assertEquals(1, adapter.disconnects.get());
    }

    @Test
    void shouldAbortSendsThatOutliveFlushWindow() throws Exception {
        adapter.connect(context, Secret.of("token"));
        CompletableFuture<SendAck> future = adapter.send("chat", "hello");
        assertTrue(adapter.sendStarted.await(1, TimeUnit.SECONDS));

        long started = System.nanoTime();
        adapter.disconnectGracefully(Duration.ofMillis(400));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertTrue(elapsedMillis < 1000, "disconnect took " + elapsedMillis + "ms");
        ExecutionException error = assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
        assertInstanceOf(RoutingException.class, error.getCause());
    }

    @Test
    void shouldDisconnectOnceAndRefuseLaterSends() {
        adapter.connect(context, Secret.of("token"));

        adapter.disconnectGracefully(Duration.ofSeconds(1));
        adapter.disconnectGracefully(Duration.ofSeconds(1));

        assertEquals(1, adapter.disconnects.get());
        assertEquals(1, adapter.released.get());
        assertFalse(adapter.isHealthy(Duration.ofSeconds(1)));
        assertTrue(adapter.send("chat", "late").isCompletedExceptionally());
    }

    @Test
    void shouldReleaseResourcesWhenDisconnectFails() {
        adapter.connect(context, Secret.of("token"));
        adapter.failDisconnect = true;

        assertDoesNotThrow(() -> adapter.disconnectGracefully(Duration.ofSeconds(1)));
        assertEquals(1, adapter.released.get());
    }

    // ===== Platform 429 =====

    @Test
    void shouldRetryRateLimitedCallWithRetryAfter() {
        adapter.connect(context, Secret.of("token"));
        AtomicInteger calls = new AtomicInteger();

        String result = adapter.executeWithRetry("send", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new RateLimitedException("slow down", Duration.ofMillis(250));
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(List.of(Duration.ofMillis(250), Duration.ofMillis(250)), adapter.sleeps);
    }

    @Test
    void shouldGiveUpAfterThreeRateLimitedAttempts() {
        adapter.connect(context, Secret.of("token"));
        AtomicInteger calls = new AtomicInteger();

        assertThrows(RateLimitedException.class, () -> adapter.executeWithRetry("send", () -> {
            calls.incrementAndGet();
            throw new RateLimitedException("slow down", Duration.ZERO);
        }));
        assertEquals(3, calls.get());
    }

    @Test
    void shouldCapRetryAfter() {
        assertEquals(Duration.ofSeconds(30), AbstractPlatformAdapter.capRetryAfter(Duration.ofMinutes(5)));
        assertEquals(Duration.ofSeconds(1), AbstractPlatformAdapter.capRetryAfter(null));
        assertEquals(Duration.ZERO, AbstractPlatformAdapter.capRetryAfter(Duration.ZERO));
    }

    private static final class StubAdapter extends AbstractPlatformAdapter {

        private final CountDownLatch gate = new CountDownLatch(1);
        private final CountDownLatch sendStarted = new CountDownLatch(1);
        private final AtomicInteger disconnects = new AtomicInteger();
        private final AtomicInteger released = new AtomicInteger();
        private final List<Duration> sleeps = new ArrayList<>();
        private volatile boolean failDisconnect;

        StubAdapter(AdapterRuntime runtime) {
            super(KEY, runtime);
        }

        @Override
        protected void doConnect(ConnectionContext context, Secret credentials) {
            // nothing to open
        }

        @Override
        protected SendAck doSend(String externalChatId, String content) {
            sendStarted.countDown();
            try {
                gate.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return new SendAck(externalChatId + ":" + content, 1);
        }

        @Override
        protected boolean doHealthCheck(Duration timeout) {
            return true;
        }

        @Override
        protected void doDisconnect(Duration timeout) {
            disconnects.incrementAndGet();
            if (failDisconnect) {
                throw new IllegalStateException("socket already gone");
            }
        }

        @Override
        protected void releaseResources() {
            released.incrementAndGet();
        }

        @Override
        protected void sleepForRetry(Duration wait) {
            sleeps.add(wait);
        }
    }
}

package me.golemcore.gateway.adapter.outbound.platform;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.exception.RateLimitedException;
import me.golemcore.gateway.domain.exception.RoutingException;
import me.golemcore.gateway.domain.exception.TransientNetworkException;
import me.golemcore.gateway.domain.model.BindingKey;
import me.golemcore.gateway.domain.model.Platform;
import me.golemcore.gateway.domain.model.RawPlatformEvent;
import me.golemcore.gateway.domain.model.Secret;
import me.golemcore.gateway.domain.model.SendAck;
import me.golemcore.gateway.port.inbound.ConnectionContext;
import me.golemcore.gateway.port.inbound.PlatformAdapter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lifecycle plumbing shared by both adapter variants.
 *
 * <p>
 * Handles the parts every transport needs the same way:
 * <ul>
 * <li>binding the {@link ConnectionContext} and aborting sends when it is
 * cancelled</li>
 * <li>running sends off the caller thread with a hard timeout</li>
 * <li>flush-then-abort on graceful disconnect</li>
 * <li>bounded retries on platform 429 answers</li>
 * </ul>
 */
@Slf4j
public abstract class AbstractPlatformAdapter implements PlatformAdapter {

    private static final int MAX_RATE_LIMIT_ATTEMPTS = 3;
    private static final Duration RETRY_AFTER_CAP = Duration.ofSeconds(30);

    protected final BindingKey key;
    protected final AdapterRuntime runtime;

    private final BlockingQueue<RawPlatformEvent> events;
    private final Set<CompletableFuture<SendAck>> inFlight = new HashSet<>();
    private final AtomicBoolean released = new AtomicBoolean();
    private volatile ConnectionContext context;
    private boolean closing;

    protected AbstractPlatformAdapter(BindingKey key, AdapterRuntime runtime) {
        this.key = key;
        this.runtime = runtime;
        this.events = new LinkedBlockingQueue<>(runtime.eventQueueCapacity());
    }

    @Override
    public BindingKey getKey() {
        return key;
    }

    @Override
    public Platform getPlatform() {
        return key.platform();
    }

    @Override
    public BlockingQueue<RawPlatformEvent> events() {
        return events;
    }

    @Override
    public final void connect(ConnectionContext context, Secret credentials) {
        this.context = context;
        context.onCancel(() -> abortInFlight("connection context cancelled"));
        context.throwIfCancelled();
        doConnect(context, credentials);
        context.throwIfCancelled();
    }

    @Override
    public final CompletableFuture<SendAck> send(String externalChatId, String content) {
        if (externalChatId == null || externalChatId.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("externalChatId is required"));
        }
        if (content == null || content.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("content is required"));
        }
        synchronized (inFlight) {
            ConnectionContext current = context;
            if (closing || current == null || current.isCancelled()) {
                return CompletableFuture.failedFuture(
                        new RoutingException(key, "Connection " + key + " is not accepting sends"));
            }
            CompletableFuture<SendAck> future = CompletableFuture
                    .supplyAsync(() -> doSend(externalChatId, content), runtime.ioExecutor())
                    .orTimeout(runtime.sendTimeout().toMillis(), TimeUnit.MILLISECONDS);
            inFlight.add(future);
            future.whenComplete((ack, error) -> {
                synchronized (inFlight) {
                    inFlight.remove(future);
                }
            });
            return future;
        }
    }

    @Override
    public final void disconnectGracefully(Duration timeout) {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        List<CompletableFuture<SendAck>> pending;
        synchronized (inFlight) {
            closing = true;
            pending = new ArrayList<>(inFlight);
        }

        if (!pending.isEmpty()) {
            flush(pending, timeout.dividedBy(2));
            abortInFlight("connection stopping");
        }

        try {
            doDisconnect(remaining(deadline));
        } catch (RuntimeException e) {
            log.warn("[{}] Disconnect of {} failed, releasing anyway: {}", getPlatform(), key, e.getMessage());
        } finally {
            releaseResources();
        }
    }

    @Override
    public final boolean isHealthy(Duration timeout) {
        ConnectionContext current = context;
        if (released.get() || current == null || current.isCancelled()) {
            return false;
        }
        return doHealthCheck(timeout);
    }

    protected abstract void doConnect(ConnectionContext context, Secret credentials);

    protected abstract SendAck doSend(String externalChatId, String content);

    protected abstract boolean doHealthCheck(Duration timeout);

    /**
     * Platform-specific teardown (close socket, delete webhook).
     */
    protected abstract void doDisconnect(Duration timeout);

    /**
     * Release local resources. Always called once, even if
     * {@link #doDisconnect(Duration)} failed.
     */
    protected void releaseResources() {
    }

    protected boolean isReleased() {
        return released.get();
    }

    protected ConnectionContext getContext() {
        return context;
    }

    /**
     * Queue an inbound event. Returns false when the queue is full.
     */
    protected boolean publishEvent(RawPlatformEvent event) {
        boolean accepted = events.offer(event);
        if (!accepted) {
            log.error("[{}] Event queue full for {}, rejecting message {}", getPlatform(), key,
                    event.getExternalMessageId());
        }
        return accepted;
    }

    protected <T> T executeWithRetry(String operation, PlatformCall<T> call) {
        for (int attempt = 1;; attempt++) {
            try {
                return call.execute();
            } catch (RateLimitedException e) {
                ConnectionContext current = context;
                if (attempt >= MAX_RATE_LIMIT_ATTEMPTS || (current != null && current.isCancelled())) {
                    throw e;
                }
                Duration wait = capRetryAfter(e.getRetryAfter());
                log.warn("[{}] Rate limited on {} for {}, waiting {}ms before retry (attempt {}/{})",
                        getPlatform(), operation, key, wait.toMillis(), attempt, MAX_RATE_LIMIT_ATTEMPTS);
                sleepForRetry(wait);
            }
        }
    }

    /**
     * Run a blocking platform call on the I/O pool, giving up after
     * {@code timeout}.
     */
    protected <T> T callWithTimeout(String operation, Duration timeout, PlatformCall<T> call) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(call::execute, runtime.ioExecutor());
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientNetworkException(getPlatform() + " " + operation + " timed out for " + key, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new TransientNetworkException(getPlatform() + " " + operation + " failed for " + key, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientNetworkException("Interrupted during " + operation + " for " + key, e);
        }
    }

    protected void sleepForRetry(Duration wait) {
        try {
            Thread.sleep(wait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientNetworkException("Interrupted while waiting for rate limit", e);
        }
    }

    static Duration capRetryAfter(Duration retryAfter) {
        if (retryAfter == null || retryAfter.isNegative()) {
            return Duration.ofSeconds(1);
        }
        return retryAfter.compareTo(RETRY_AFTER_CAP) > 0 ? RETRY_AFTER_CAP : retryAfter;
    }

    static Duration remaining(long deadlineNanos) {
        long left = deadlineNanos - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    private void flush(List<CompletableFuture<SendAck>> pending, Duration wait) {
        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                    .get(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("[{}] {} in-flight sends did not finish in {}ms for {}, aborting", getPlatform(),
                    pending.size(), wait.toMillis(), key);
        } catch (ExecutionException e) {
            log.debug("[{}] In-flight send failed during flush for {}: {}", getPlatform(), key,
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void abortInFlight(String reason) {
        List<CompletableFuture<SendAck>> toAbort;
        synchronized (inFlight) {
            toAbort = new ArrayList<>(inFlight);
        }
        for (CompletableFuture<SendAck> future : toAbort) {
            future.completeExceptionally(new RoutingException(key, "Send aborted: " + reason));
        }
    }

    @FunctionalInterface
    protected interface PlatformCall<T> {
        T execute();
    }
}

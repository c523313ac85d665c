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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.exception.PlatformException;
import me.golemcore.gateway.domain.exception.RateLimitedException;
import me.golemcore.gateway.domain.exception.RoutingException;
import me.golemcore.gateway.domain.exception.TransientNetworkException;
import me.golemcore.gateway.domain.model.BindingKey;
import me.golemcore.gateway.domain.model.ConnectionStateChangedEvent;
import me.golemcore.gateway.domain.model.ConnectionStatus;
import me.golemcore.gateway.domain.model.Platform;
import me.golemcore.gateway.domain.model.RateLimitResult;
import me.golemcore.gateway.domain.model.SendAck;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.ratelimit.RateLimiter;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends reasoning-service replies through the live connection of their
 * (agent, platform) key.
 *
 * <p>
 * Each send first resolves a live handle (one short wait if the key is
 * known but not yet running), then splits the content to the platform's
 * message limit. Every chunk takes its own token from the per-connection
 * bucket before it is handed to the adapter, so the bucket bounds platform
 * messages rather than calls. The rate-limit wait bound applies per chunk. Failures surface as
 * {@link PlatformException}s; nothing is queued for later.
 */
@Service
@Slf4j
public class OutboundDispatcher {

    private static final Duration ACK_GRACE = Duration.ofSeconds(1);

    private final ConnectionSupervisor supervisor;
    private final RateLimiter rateLimiter;
    private final GatewayProperties properties;

    public OutboundDispatcher(ConnectionSupervisor supervisor, RateLimiter rateLimiter,
            GatewayProperties properties) {
        this.supervisor = supervisor;
        this.rateLimiter = rateLimiter;
        this.properties = properties;
    }

    public SendAck dispatch(String agentId, Platform platform, String externalChatId, String content) {
        if (platform == null) {
            throw new IllegalArgumentException("platform is required");
        }
        if (externalChatId == null || externalChatId.isBlank()) {
            throw new IllegalArgumentException("external_chat_id is required");
        }
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("content is required");
        }
        BindingKey key = BindingKey.of(BindingKey.normalizeAgentIdOrThrow(agentId), platform);

        ConnectionHandle handle = resolveHandle(key);
        List<String> chunks = MessageChunker.split(content, platform.getMaxMessageLength());
        String lastMessageId = null;
        int sent = 0;
        for (String chunk : chunks) {
            if (chunk.isBlank()) {
                continue;
            }
            awaitRateLimit(key);
            SendAck chunkAck = awaitAck(handle, key, externalChatId, chunk);
            if (chunkAck.externalMessageId() != null) {
                lastMessageId = chunkAck.externalMessageId();
            }
            sent++;
        }
        log.debug("[Outbound] Sent reply to {} chat {} ({} chunk(s))", key, externalChatId, sent);
        return new SendAck(lastMessageId, sent);
    }

    @EventListener
    public void onConnectionStateChanged(ConnectionStateChangedEvent event) {
        if (event.state().getStatus() == ConnectionStatus.STOPPED) {
            rateLimiter.release(event.key());
        }
    }

    private ConnectionHandle resolveHandle(BindingKey key) {
        Optional<ConnectionHandle> handle = supervisor.findLiveHandle(key);
        if (handle.isPresent()) {
            return handle.get();
        }
        if (!supervisor.isManaged(key)) {
            log.warn("[Outbound] No connection for {}", key);
            throw new RoutingException(key, "No live connection for " + key);
        }
        Duration delay = properties.getOutbound().getRoutingRetryDelay();
        log.debug("[Outbound] {} not running yet, retrying lookup in {}ms", key, delay.toMillis());
        pause(key, delay);
        return supervisor.findLiveHandle(key)
                .orElseThrow(() -> new RoutingException(key,
                        "No live connection for " + key + " after waiting " + delay.toMillis() + "ms"));
    }

    private void awaitRateLimit(BindingKey key) {
        Duration maxWait = properties.getOutbound().getMaxRateLimitWait();
        Duration waited = Duration.ZERO;
        while (true) {
            RateLimitResult result = rateLimiter.tryConsume(key);
            if (result.isAllowed()) {
                return;
            }
            Duration wait = result.getWaitTime();
            if (waited.plus(wait).compareTo(maxWait) > 0) {
                log.warn("[Outbound] Rate limit wait for {} would exceed {}ms", key, maxWait.toMillis());
                throw new RateLimitedException("Outbound rate limit exceeded for " + key, wait);
            }
            pause(key, wait);
            waited = waited.plus(wait);
        }
    }

    private SendAck awaitAck(ConnectionHandle handle, BindingKey key, String externalChatId, String content) {
        Duration timeout = properties.getSupervisor().getSendTimeout().plus(ACK_GRACE);
        try {
            return handle.send(externalChatId, content).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PlatformException platformException) {
                throw platformException;
            }
            if (cause instanceof IllegalArgumentException illegalArgument) {
                throw illegalArgument;
            }
            if (cause instanceof TimeoutException) {
                throw new TransientNetworkException("Send to " + key + " timed out", cause);
            }
            throw new TransientNetworkException("Send to " + key + " failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new TransientNetworkException("Send to " + key + " timed out after " + timeout.toMillis() + "ms",
                    e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RoutingException(key, "Interrupted while sending to " + key, e);
        }
    }

    private void pause(BindingKey key, Duration duration) {
        try {
            sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RoutingException(key, "Interrupted while waiting to send to " + key, e);
        }
    }

    /**
     * Overridable for tests that drive time themselves.
     */
    protected void sleep(Duration duration) throws InterruptedException {
        Thread.sleep(duration.toMillis());
    }
}

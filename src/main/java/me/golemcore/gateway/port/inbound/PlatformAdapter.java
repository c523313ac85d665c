package me.golemcore.gateway.port.inbound;

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

import me.golemcore.gateway.domain.model.BindingKey;
import me.golemcore.gateway.domain.model.Platform;
import me.golemcore.gateway.domain.model.RawPlatformEvent;
import me.golemcore.gateway.domain.model.Secret;
import me.golemcore.gateway.domain.model.SendAck;
import me.golemcore.gateway.domain.model.TransportStyle;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;

/**
 * Uniform transport to one bot on one platform.
 *
 * <p>
 * One instance serves exactly one connection attempt: the supervisor creates
 * a fresh adapter for every start and discards it after
 * {@link #disconnectGracefully(Duration)}. Two transport styles exist:
 * <ul>
 * <li>{@link TransportStyle#ACTIVE} - keeps a socket open and feeds
 * {@link #events()} from its read loop</li>
 * <li>{@link TransportStyle#PASSIVE} - registers a webhook; events are pushed
 * in through {@link WebhookReceiver}</li>
 * </ul>
 *
 * <p>
 * Implementations classify failures with the
 * {@link me.golemcore.gateway.domain.exception.PlatformException} hierarchy.
 */
public interface PlatformAdapter {

    Platform getPlatform();

    BindingKey getKey();

    default TransportStyle getTransportStyle() {
        return getPlatform().getTransportStyle();
    }

    /**
     * Authenticate and open the session. Returns once the session can send and
     * receive.
     *
     * @throws me.golemcore.gateway.domain.exception.CredentialInvalidException
     *             when the platform rejects the credentials
     * @throws me.golemcore.gateway.domain.exception.TransientNetworkException
     *             on network failures
     * @throws java.util.concurrent.CancellationException
     *             when the context is cancelled first
     */
    void connect(ConnectionContext context, Secret credentials);

    /**
     * Stop accepting sends, flush or abort in-flight ones and release every
     * resource, all within {@code timeout}. Idempotent.
     */
    void disconnectGracefully(Duration timeout);

    /**
     * Send a message, split into platform-sized chunks where needed. The
     * returned future always completes within the configured send timeout.
     */
    CompletableFuture<SendAck> send(String externalChatId, String content);

    /**
     * Raw inbound events, in receipt order.
     */
    BlockingQueue<RawPlatformEvent> events();

    /**
     * Liveness check bounded by {@code timeout}.
     */
    boolean isHealthy(Duration timeout);
}

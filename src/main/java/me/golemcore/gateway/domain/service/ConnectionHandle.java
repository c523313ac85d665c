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

import me.golemcore.gateway.domain.model.BindingKey;
import me.golemcore.gateway.domain.model.SendAck;
import me.golemcore.gateway.port.inbound.ConnectionContext;
import me.golemcore.gateway.port.inbound.PlatformAdapter;
import me.golemcore.gateway.port.inbound.WebhookReceiver;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A live adapter together with its cancellation context. Runtime only; owned
 * by the supervisor entry of its key and invalid once the context is
 * cancelled.
 */
public final class ConnectionHandle {

    private final BindingKey key;
    private final PlatformAdapter adapter;
    private final ConnectionContext context;
    private final long boundVersion;
    private final Instant connectedAt;

    ConnectionHandle(BindingKey key, PlatformAdapter adapter, ConnectionContext context, long boundVersion,
            Instant connectedAt) {
        this.key = key;
        this.adapter = adapter;
        this.context = context;
        this.boundVersion = boundVersion;
        this.connectedAt = connectedAt;
    }

    public BindingKey getKey() {
        return key;
    }

    public PlatformAdapter getAdapter() {
        return adapter;
    }

    public ConnectionContext getContext() {
        return context;
    }

    public long getBoundVersion() {
        return boundVersion;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public boolean isActive() {
        return !context.isCancelled();
    }

    public CompletableFuture<SendAck> send(String externalChatId, String content) {
        return adapter.send(externalChatId, content);
    }

    public Optional<WebhookReceiver> webhookReceiver() {
        if (adapter instanceof WebhookReceiver receiver) {
            return Optional.of(receiver);
        }
        return Optional.empty();
    }
}

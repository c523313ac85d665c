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

import me.golemcore.gateway.domain.exception.RateLimitedException;
import me.golemcore.gateway.domain.exception.WebhookRejectedException;
import me.golemcore.gateway.domain.model.BindingKey;
import me.golemcore.gateway.domain.model.RawPlatformEvent;
import me.golemcore.gateway.port.inbound.ConnectionContext;
import me.golemcore.gateway.port.inbound.WebhookReceiver;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Adapter variant for platforms that push events to a registered webhook.
 *
 * <p>
 * {@code connect} registers the webhook together with a per-connection secret;
 * deliveries must echo that secret. Liveness means the platform still points
 * at our webhook URL.
 */
public abstract class PassivePlatformAdapter extends AbstractPlatformAdapter implements WebhookReceiver {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final int SECRET_BYTES = 32;

    private volatile String webhookSecret;

    protected PassivePlatformAdapter(BindingKey key, AdapterRuntime runtime) {
        super(key, runtime);
    }

    @Override
    public final boolean acceptWebhook(String secretToken, byte[] body) {
        ConnectionContext current = getContext();
        if (isReleased() || current == null || current.isCancelled()) {
            throw new WebhookRejectedException("Connection " + key + " is not running");
        }
        if (!secretMatches(secretToken)) {
            throw new WebhookRejectedException("Invalid webhook secret for " + key);
        }
        Optional<RawPlatformEvent> event = parseWebhook(body);
        if (event.isEmpty()) {
            return false;
        }
        if (!publishEvent(event.get())) {
            throw new RateLimitedException("Event queue full for " + key, Duration.ofSeconds(1));
        }
        return true;
    }

    @Override
    protected boolean doHealthCheck(Duration timeout) {
        return webhookSecret != null && isWebhookCurrent(timeout);
    }

    /**
     * Parse a delivery into an event; empty when nothing routable is inside.
     */
    protected abstract Optional<RawPlatformEvent> parseWebhook(byte[] body);

    /**
     * Whether the platform still delivers to this adapter's webhook.
     */
    protected abstract boolean isWebhookCurrent(Duration timeout);

    protected String rotateWebhookSecret() {
        byte[] bytes = new byte[SECRET_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        String secret = HexFormat.of().formatHex(bytes);
        webhookSecret = secret;
        return secret;
    }

    protected String getWebhookSecret() {
        return webhookSecret;
    }

    private boolean secretMatches(String provided) {
        String expected = webhookSecret;
        if (expected == null || provided == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8));
    }
}

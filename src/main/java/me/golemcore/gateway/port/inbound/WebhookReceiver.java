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

import me.golemcore.gateway.domain.exception.WebhookRejectedException;

/**
 * Passive adapters implement this to take webhook deliveries from the HTTP
 * ingress.
 */
public interface WebhookReceiver {

    /**
     * Verify and enqueue one webhook delivery.
     *
     * @param secretToken
     *            secret header sent by the platform, may be {@code null}
     * @param body
     *            raw request body
     * @return {@code true} if an event was queued, {@code false} if the update
     *         carries nothing routable
     * @throws WebhookRejectedException
     *             when the secret does not match
     */
    boolean acceptWebhook(String secretToken, byte[] body);
}

package me.golemcore.gateway.adapter.inbound.webhook;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.adapter.inbound.webhook.dto.WebhookResponse;
import me.golemcore.gateway.domain.exception.RateLimitedException;
import me.golemcore.gateway.domain.exception.WebhookRejectedException;
import me.golemcore.gateway.domain.model.BindingKey;
import me.golemcore.gateway.domain.model.Platform;
import me.golemcore.gateway.domain.model.TransportStyle;
import me.golemcore.gateway.domain.service.ConnectionHandle;
import me.golemcore.gateway.domain.service.ConnectionSupervisor;
import me.golemcore.gateway.port.inbound.WebhookReceiver;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Delivery endpoint for passive platforms.
 *
 * <p>
 * {@code POST /webhook/{platform}/{agentId}} is routed to the running
 * passive adapter of that key, which checks the secret header and queues the
 * update. Without a running adapter the call is refused with 401 so the
 * platform retries later.
 */
@RestController
@RequestMapping("/webhook")
@RequiredArgsConstructor
@Slf4j
public class PlatformWebhookController {

    static final String TELEGRAM_SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";

    private final ConnectionSupervisor supervisor;

    @PostMapping("/{platform}/{agentId}")
    public Mono<ResponseEntity<WebhookResponse>> receive(
            @PathVariable String platform,
            @PathVariable String agentId,
            @RequestHeader(value = TELEGRAM_SECRET_HEADER, required = false) String secretToken,
            @RequestBody byte[] body) {

        return Mono.fromCallable(() -> {
            BindingKey key;
            try {
                key = BindingKey.of(BindingKey.normalizeAgentIdOrThrow(agentId), Platform.fromId(platform));
            } catch (IllegalArgumentException e) {
                return badRequest(e.getMessage());
            }
            if (key.platform().getTransportStyle() != TransportStyle.PASSIVE) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(WebhookResponse.error("Platform " + key.platform() + " does not use webhooks"));
            }

            Optional<WebhookReceiver> receiver = supervisor.findLiveHandle(key)
                    .flatMap(ConnectionHandle::webhookReceiver);
            if (receiver.isEmpty()) {
                log.warn("[Webhook] No running webhook for {}", key);
                return unauthorized("No running webhook for " + key);
            }

            try {
                boolean accepted = receiver.get().acceptWebhook(secretToken, body);
                return ResponseEntity.ok(accepted ? WebhookResponse.accepted() : WebhookResponse.ignored());
            } catch (WebhookRejectedException e) {
                log.warn("[Webhook] Rejected delivery for {}: {}", key, e.getMessage());
                return unauthorized(e.getMessage());
            } catch (IllegalArgumentException e) {
                log.warn("[Webhook] Malformed update for {}: {}", key, e.getMessage());
                return badRequest("Malformed update");
            } catch (RateLimitedException e) {
                log.warn("[Webhook] Event queue full for {}", key);
                return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                        .header(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(1, e.getRetryAfter().toSeconds())))
                        .body(WebhookResponse.error(e.getMessage()));
            }
        });
    }

    private ResponseEntity<WebhookResponse> unauthorized(String message) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(WebhookResponse.error(message));
    }

    private ResponseEntity<WebhookResponse> badRequest(String message) {
        return ResponseEntity.badRequest()
                .body(WebhookResponse.error(message));
    }
}

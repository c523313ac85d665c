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
import me.golemcore.gateway.domain.model.DeadLetter;
import me.golemcore.gateway.domain.model.Direction;
import me.golemcore.gateway.domain.model.FailureKind;
import me.golemcore.gateway.domain.model.MessageEnvelope;
import me.golemcore.gateway.domain.model.ReasoningReplyEvent;
import me.golemcore.gateway.port.outbound.DeadLetterPort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * Sends replies the reasoning service returned inline back to the chat the
 * inbound message came from.
 */
@Component
@Slf4j
public class InlineReplyRelay {

    private final OutboundDispatcher dispatcher;
    private final DeadLetterPort deadLetterPort;
    private final Clock clock;

    public InlineReplyRelay(OutboundDispatcher dispatcher, DeadLetterPort deadLetterPort, Clock clock) {
        this.dispatcher = dispatcher;
        this.deadLetterPort = deadLetterPort;
        this.clock = clock;
    }

    @EventListener
    public void onReply(ReasoningReplyEvent event) {
        MessageEnvelope inbound = event.inbound();
        try {
            dispatcher.dispatch(inbound.getAgentId(), inbound.getPlatform(), inbound.getExternalChatId(),
                    event.content());
        } catch (PlatformException e) {
            log.warn("[Outbound] Inline reply to {} chat {} failed: {}", inbound.bindingKey(),
                    inbound.getExternalChatId(), e.getMessage());
            deadLetter(inbound, event.content(), e.getMessage(), e.getFailureKind());
        } catch (RuntimeException e) {
            log.error("[Outbound] Inline reply to {} chat {} failed", inbound.bindingKey(),
                    inbound.getExternalChatId(), e);
            deadLetter(inbound, event.content(), e.getMessage(), FailureKind.ADAPTER_CRASH);
        }
    }

    private void deadLetter(MessageEnvelope inbound, String content, String reason, FailureKind kind) {
        MessageEnvelope outbound = MessageEnvelope.builder()
                .platform(inbound.getPlatform())
                .agentId(inbound.getAgentId())
                .externalChatId(inbound.getExternalChatId())
                .content(content)
                .direction(Direction.OUTBOUND)
                .timestamp(clock.instant())
                .metadata(Map.of("in_reply_to", String.valueOf(inbound.getExternalMessageId())))
                .build();
        try {
            deadLetterPort.write(DeadLetter.builder()
                    .envelope(outbound)
                    .reason(reason)
                    .failureKind(kind)
                    .attempts(1)
                    .failedAt(clock.instant())
                    .build());
        } catch (RuntimeException e) {
            log.error("[Outbound] Could not dead-letter inline reply for {}", inbound.bindingKey(), e);
        }
    }
}

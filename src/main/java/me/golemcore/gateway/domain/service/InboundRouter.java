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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.exception.ReasoningUnavailableException;
import me.golemcore.gateway.domain.model.BindingKey;
import me.golemcore.gateway.domain.model.DeadLetter;
import me.golemcore.gateway.domain.model.Direction;
import me.golemcore.gateway.domain.model.FailureKind;
import me.golemcore.gateway.domain.model.MessageEnvelope;
import me.golemcore.gateway.domain.model.RawPlatformEvent;
import me.golemcore.gateway.domain.model.ReasoningReplyEvent;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.DeadLetterPort;
import me.golemcore.gateway.port.outbound.ReasoningPort;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Turns raw platform events into envelopes and forwards them to the
 * reasoning service.
 *
 * <p>
 * Bot-authored and empty events are dropped, redelivered message ids are
 * dropped per binding, and delivery is strictly ordered per
 * (agent, platform, chat). Chats are independent lanes drained on a shared
 * pool. Messages that cannot be delivered end up in the dead-letter sink.
 */
@Service
@Slf4j
public class InboundRouter {

    private final ReasoningPort reasoningPort;
    private final DeadLetterPort deadLetterPort;
    private final ApplicationEventPublisher eventPublisher;
    private final GatewayProperties.InboundProperties settings;
    private final Clock clock;
    private final ExecutorService laneExecutor;
    private final Map<LaneKey, Lane> lanes = new ConcurrentHashMap<>();
    private final Map<BindingKey, Set<String>> recentMessageIds = new ConcurrentHashMap<>();

    public InboundRouter(ReasoningPort reasoningPort, DeadLetterPort deadLetterPort,
            ApplicationEventPublisher eventPublisher, GatewayProperties properties, Clock clock) {
        this.reasoningPort = reasoningPort;
        this.deadLetterPort = deadLetterPort;
        this.eventPublisher = eventPublisher;
        this.settings = properties.getInbound();
        this.clock = clock;
        AtomicInteger counter = new AtomicInteger();
        this.laneExecutor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "inbound-lane-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Accepts one raw event.
     *
     * @return the envelope queued for delivery, or empty when the event was
     *         filtered, a duplicate, or rejected by a full chat queue
     */
    public Optional<MessageEnvelope> onEvent(RawPlatformEvent event) {
        if (event.isFromBot()) {
            log.debug("[Inbound] Dropping bot-authored message {} on {}", event.getExternalMessageId(),
                    event.getKey());
            return Optional.empty();
        }
        boolean noText = event.getContent() == null || event.getContent().isBlank();
        boolean noAttachments = event.getAttachments() == null || event.getAttachments().isEmpty();
        if (noText && noAttachments) {
            log.debug("[Inbound] Dropping empty message {} on {}", event.getExternalMessageId(), event.getKey());
            return Optional.empty();
        }
        if (!markFirstSeen(event.getKey(), event.getExternalMessageId())) {
            log.debug("[Inbound] Duplicate message {} on {}", event.getExternalMessageId(), event.getKey());
            return Optional.empty();
        }

        MessageEnvelope envelope = normalize(event);
        LaneKey laneKey = new LaneKey(event.getKey(), event.getExternalChatId());
        AtomicReference<EnqueueOutcome> outcome = new AtomicReference<>();
        lanes.compute(laneKey, (k, lane) -> {
            Lane target = lane != null ? lane : new Lane();
            if (target.queue.size() >= settings.getChatQueueCapacity()) {
                outcome.set(EnqueueOutcome.REJECTED);
                return target;
            }
            target.queue.add(envelope);
            if (target.draining) {
                outcome.set(EnqueueOutcome.QUEUED);
            } else {
                target.draining = true;
                outcome.set(EnqueueOutcome.START_DRAIN);
            }
            return target;
        });

        switch (outcome.get()) {
        case REJECTED -> {
            log.warn("[Inbound] Chat queue full for {} chat {}, dead-lettering message {}",
                    event.getKey(), event.getExternalChatId(), event.getExternalMessageId());
            deadLetter(envelope, "Chat queue full", FailureKind.RATE_LIMITED, 0);
            return Optional.empty();
        }
        case START_DRAIN -> laneExecutor.execute(() -> drain(laneKey));
        case QUEUED -> log.trace("[Inbound] Queued {} behind busy lane of chat {}",
                event.getExternalMessageId(), event.getExternalChatId());
        }
        return Optional.of(envelope);
    }

    /**
     * Drops the dedup history of a key whose binding is gone. Queued
     * messages of the key still drain.
     */
    public void forget(BindingKey key) {
        if (recentMessageIds.remove(key) != null) {
            log.debug("[Inbound] Dropped dedup history of {}", key);
        }
    }

    int trackedKeys() {
        return recentMessageIds.size();
    }

    public int pendingMessages() {
        return lanes.values().stream().mapToInt(lane -> lane.queue.size()).sum();
    }

    @PreDestroy
    public void shutdown() {
        laneExecutor.shutdown();
        try {
            if (!laneExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Inbound] {} message(s) still queued at shutdown", pendingMessages());
                laneExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            laneExecutor.shutdownNow();
        }
    }

    private void drain(LaneKey laneKey) {
        MessageEnvelope next = pollOrRelease(laneKey);
        while (next != null) {
            deliver(next);
            next = pollOrRelease(laneKey);
        }
    }

    private MessageEnvelope pollOrRelease(LaneKey laneKey) {
        AtomicReference<MessageEnvelope> polled = new AtomicReference<>();
        lanes.computeIfPresent(laneKey, (k, lane) -> {
            MessageEnvelope head = lane.queue.poll();
            if (head == null) {
                return null;
            }
            polled.set(head);
            return lane;
        });
        return polled.get();
    }

    private void deliver(MessageEnvelope envelope) {
        try {
            Optional<String> reply = reasoningPort.forward(envelope);
            log.debug("[Inbound] Delivered {} from {} chat {}", envelope.getExternalMessageId(),
                    envelope.bindingKey(), envelope.getExternalChatId());
            if (settings.isInlineReplies()) {
                reply.filter(text -> !text.isBlank())
                        .ifPresent(text -> eventPublisher.publishEvent(new ReasoningReplyEvent(envelope, text)));
            }
        } catch (ReasoningUnavailableException e) {
            log.error("[Inbound] Reasoning service unavailable for {} message {} after {} attempt(s): {}",
                    envelope.bindingKey(), envelope.getExternalMessageId(), e.getAttempts(), e.getMessage());
            FailureKind kind = e.isRetryable() ? FailureKind.TRANSIENT_NETWORK : FailureKind.REQUEST_REJECTED;
            deadLetter(envelope, "Reasoning service unavailable: " + e.getMessage(), kind, e.getAttempts());
        } catch (RuntimeException e) {
            log.error("[Inbound] Unexpected failure delivering {} message {}", envelope.bindingKey(),
                    envelope.getExternalMessageId(), e);
            deadLetter(envelope, "Delivery failed: " + e.getMessage(), FailureKind.ADAPTER_CRASH, 1);
        }
    }

    private void deadLetter(MessageEnvelope envelope, String reason, FailureKind kind, int attempts) {
        try {
            deadLetterPort.write(DeadLetter.builder()
                    .envelope(envelope)
                    .reason(reason)
                    .failureKind(kind)
                    .attempts(attempts)
                    .failedAt(clock.instant())
                    .build());
        } catch (RuntimeException e) {
            log.error("[Inbound] Could not dead-letter message {} of {}", envelope.getExternalMessageId(),
                    envelope.bindingKey(), e);
        }
    }

    private boolean markFirstSeen(BindingKey key, String externalMessageId) {
        if (externalMessageId == null || externalMessageId.isBlank()) {
            return true;
        }
        Set<String> seen = recentMessageIds.computeIfAbsent(key, k -> newRecentIdSet());
        return seen.add(externalMessageId);
    }

    private Set<String> newRecentIdSet() {
        int maxSize = settings.getDedupCacheSize();
        Map<String, Boolean> lru = new LinkedHashMap<>(16, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > maxSize;
            }
        };
        return Collections.synchronizedSet(Collections.newSetFromMap(lru));
    }

    private MessageEnvelope normalize(RawPlatformEvent event) {
        BindingKey key = event.getKey();
        return MessageEnvelope.builder()
                .platform(key.platform())
                .agentId(key.agentId())
                .externalChatId(event.getExternalChatId())
                .externalMessageId(event.getExternalMessageId())
                .senderId(event.getSenderId())
                .senderName(event.getSenderName())
                .content(event.getContent() != null ? event.getContent() : "")
                .attachments(event.getAttachments() != null ? event.getAttachments() : List.of())
                .direction(Direction.INBOUND)
                .timestamp(event.getTimestamp() != null ? event.getTimestamp() : clock.instant())
                .metadata(event.getMetadata() != null ? event.getMetadata() : Map.of())
                .build();
    }

    private enum EnqueueOutcome {
        QUEUED, START_DRAIN, REJECTED
    }

    private record LaneKey(BindingKey key, String externalChatId) {
    }

    private static final class Lane {
        private final Queue<MessageEnvelope> queue = new ArrayDeque<>();
        private boolean draining;
    }
}

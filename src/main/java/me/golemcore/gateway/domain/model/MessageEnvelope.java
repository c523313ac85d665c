package me.golemcore.gateway.domain.model;

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

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Canonical, routable representation of one chat message.
 *
 * <p>
 * {@code agentId}, {@code platform} and {@code externalChatId} together route
 * a reply back to the exact bot and conversation the message came from.
 * Instances are immutable.
 */
@Getter
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
public class MessageEnvelope {

    private final Platform platform;
    private final String agentId;
    private final String externalChatId;
    private final String externalMessageId;
    private final String senderId;
    private final String senderName;
    private final String content;

    @Builder.Default
    private final List<Attachment> attachments = List.of();

    private final Direction direction;
    private final Instant timestamp;

    @Builder.Default
    private final Map<String, String> metadata = Map.of();

    public BindingKey bindingKey() {
        return BindingKey.of(agentId, platform);
    }
}

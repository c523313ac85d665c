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
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Platform message as produced by an adapter, before normalization.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class RawPlatformEvent {

    private final BindingKey key;
    private final String externalChatId;
    private final String externalMessageId;
    private final String senderId;
    private final String senderName;
    private final boolean fromBot;
    private final String content;

    @Builder.Default
    private final List<Attachment> attachments = List.of();

    private final Instant timestamp;

    @Builder.Default
    private final Map<String, String> metadata = Map.of();
}

package me.golemcore.gateway.adapter.outbound.reasoning;

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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.gateway.domain.model.Attachment;
import me.golemcore.gateway.domain.model.MessageEnvelope;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /receive_message}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReceiveMessageRequest {

    private String platform;

    @JsonProperty("agent_id")
    private String agentId;

    @JsonProperty("external_chat_id")
    private String externalChatId;

    @JsonProperty("external_message_id")
    private String externalMessageId;

    @JsonProperty("sender_id")
    private String senderId;

    @JsonProperty("sender_name")
    private String senderName;

    private String content;
    private List<Attachment> attachments;
    private String timestamp;
    private Map<String, String> metadata;

    public static ReceiveMessageRequest from(MessageEnvelope envelope) {
        return ReceiveMessageRequest.builder()
                .platform(envelope.getPlatform().getId())
                .agentId(envelope.getAgentId())
                .externalChatId(envelope.getExternalChatId())
                .externalMessageId(envelope.getExternalMessageId())
                .senderId(envelope.getSenderId())
                .senderName(envelope.getSenderName())
                .content(envelope.getContent())
                .attachments(envelope.getAttachments())
                .timestamp(envelope.getTimestamp() != null ? envelope.getTimestamp().toString() : null)
                .metadata(envelope.getMetadata())
                .build();
    }
}

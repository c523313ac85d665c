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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Chat platforms a bot binding can target.
 *
 * <p>
 * Each platform fixes its transport style and the maximum length of one
 * outgoing message.
 */
public enum Platform {

    DISCORD("discord", TransportStyle.ACTIVE, 2000), TELEGRAM("telegram", TransportStyle.PASSIVE, 4096);

    private final String id;
    private final TransportStyle transportStyle;
    private final int maxMessageLength;

    Platform(String id, TransportStyle transportStyle, int maxMessageLength) {
        this.id = id;
        this.transportStyle = transportStyle;
        this.maxMessageLength = maxMessageLength;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public TransportStyle getTransportStyle() {
        return transportStyle;
    }

    public int getMaxMessageLength() {
        return maxMessageLength;
    }

    @JsonCreator
    public static Platform fromId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("platform is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Platform platform : values()) {
            if (platform.id.equals(normalized)) {
                return platform;
            }
        }
        throw new IllegalArgumentException("Unknown platform: " + value);
    }

    @Override
    public String toString() {
        return id;
    }
}

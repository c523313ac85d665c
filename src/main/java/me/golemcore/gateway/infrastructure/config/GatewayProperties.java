package me.golemcore.gateway.infrastructure.config;

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

import lombok.Data;
import me.golemcore.gateway.domain.model.Platform;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties for the gateway, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code gateway.*} prefix:
 * <ul>
 * <li>{@link SupervisorProperties} - connection lifecycle timeouts and
 * backoff</li>
 * <li>{@link InboundProperties} - dedupe and per-chat queueing</li>
 * <li>{@link OutboundProperties} - reply routing</li>
 * <li>{@link ReasoningProperties} - reasoning service endpoint</li>
 * <li>{@link PlatformsProperties} - Discord and Telegram settings</li>
 * <li>{@link StorageProperties} - local persistence</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "gateway")
@Data
public class GatewayProperties {

    private StorageProperties storage = new StorageProperties();
    private SupervisorProperties supervisor = new SupervisorProperties();
    private InboundProperties inbound = new InboundProperties();
    private OutboundProperties outbound = new OutboundProperties();
    private ReasoningProperties reasoning = new ReasoningProperties();
    private PlatformsProperties platforms = new PlatformsProperties();
    private HttpProperties http = new HttpProperties();

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/gateway";
    }

    // ==================== SUPERVISOR ====================

    @Data
    public static class SupervisorProperties {
        private Duration connectTimeout = Duration.ofSeconds(15);
        private Duration disconnectTimeout = Duration.ofSeconds(5);
        private Duration sendTimeout = Duration.ofSeconds(10);
        private Duration healthCheckInterval = Duration.ofSeconds(30);
        private Duration healthCheckTimeout = Duration.ofSeconds(5);
        private Duration backoffBase = Duration.ofSeconds(1);
        private Duration backoffMax = Duration.ofSeconds(60);
        private double backoffJitter = 0.2;
        private int maxRetries = 5;
        private Duration shutdownGrace = Duration.ofSeconds(10);
        private int eventQueueCapacity = 1000;
        private Duration resyncInterval = Duration.ofMinutes(5);
    }

    // ==================== INBOUND / OUTBOUND ====================

    @Data
    public static class InboundProperties {
        private int dedupCacheSize = 1000;
        private int chatQueueCapacity = 500;
        private boolean inlineReplies = true;
    }

    @Data
    public static class OutboundProperties {
        private Duration routingRetryDelay = Duration.ofSeconds(2);
        private Duration maxRateLimitWait = Duration.ofSeconds(30);
    }

    // ==================== REASONING ====================

    @Data
    public static class ReasoningProperties {
        private String baseUrl = "http://localhost:8000";
        private String path = "/receive_message";
        private Duration timeout = Duration.ofSeconds(30);
        private int maxRetries = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
    }

    // ==================== PLATFORMS ====================

    @Data
    public static class PlatformsProperties {
        private DiscordProperties discord = new DiscordProperties();
        private TelegramProperties telegram = new TelegramProperties();

        public RateLimitProperties rateLimitFor(Platform platform) {
            return switch (platform) {
            case DISCORD -> discord.getRateLimit();
            case TELEGRAM -> telegram.getRateLimit();
            };
        }
    }

    @Data
    public static class DiscordProperties {
        private String apiUrl = "https://discord.com/api/v10";
        private String gatewayUrl = "wss://gateway.discord.gg/?v=10&encoding=json";
        // GUILDS | GUILD_MESSAGES | DIRECT_MESSAGES | MESSAGE_CONTENT
        private int intents = 37377;
        private RateLimitProperties rateLimit = new RateLimitProperties(5, Duration.ofSeconds(5));
    }

    @Data
    public static class TelegramProperties {
        private String webhookBaseUrl = "http://localhost:8080";
        private RateLimitProperties rateLimit = new RateLimitProperties(30, Duration.ofSeconds(1));
    }

    @Data
    public static class RateLimitProperties {
        private int capacity;
        private Duration period;

        public RateLimitProperties() {
            this(1, Duration.ofSeconds(1));
        }

        public RateLimitProperties(int capacity, Duration period) {
            this.capacity = capacity;
            this.period = period;
        }
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}

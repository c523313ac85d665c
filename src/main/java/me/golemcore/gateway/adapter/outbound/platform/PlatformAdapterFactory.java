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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.adapter.outbound.discord.DiscordGatewayAdapter;
import me.golemcore.gateway.adapter.outbound.telegram.TelegramWebhookAdapter;
import me.golemcore.gateway.domain.model.BindingKey;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.inbound.PlatformAdapter;
import me.golemcore.gateway.port.outbound.PlatformAdapterProvider;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Creates a fresh adapter for each connection attempt, picking the variant by
 * the binding's platform.
 *
 * <p>
 * Owns the thread pools shared by all adapters: an elastic I/O pool for sends
 * and health checks, and a small scheduler for gateway heartbeats.
 */
@Component
@Slf4j
public class PlatformAdapterFactory implements PlatformAdapterProvider {

    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final GatewayProperties properties;
    private final AdapterRuntime runtime;
    private Function<String, TelegramClient> telegramClientFactory;

    public PlatformAdapterFactory(OkHttpClient okHttpClient, ObjectMapper objectMapper, GatewayProperties properties) {
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.telegramClientFactory = token -> new OkHttpTelegramClient(okHttpClient, token);

        AtomicInteger ioThreads = new AtomicInteger();
        ExecutorService ioExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "platform-io-" + ioThreads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "platform-heartbeat");
            t.setDaemon(true);
            return t;
        });
        GatewayProperties.SupervisorProperties supervisor = properties.getSupervisor();
        this.runtime = new AdapterRuntime(ioExecutor, scheduler, supervisor.getSendTimeout(),
                supervisor.getEventQueueCapacity());
    }

    @Override
    public PlatformAdapter create(BindingKey key) {
        GatewayProperties.PlatformsProperties platforms = properties.getPlatforms();
        return switch (key.platform()) {
        case DISCORD -> new DiscordGatewayAdapter(key, runtime, okHttpClient, objectMapper, platforms.getDiscord());
        case TELEGRAM -> new TelegramWebhookAdapter(key, runtime, telegramClientFactory, objectMapper,
                platforms.getTelegram());
        };
    }

    AdapterRuntime getRuntime() {
        return runtime;
    }

    void setTelegramClientFactory(Function<String, TelegramClient> telegramClientFactory) {
        this.telegramClientFactory = telegramClientFactory;
    }

    @PreDestroy
    public void shutdown() {
        log.info("[Platform] Shutting down adapter thread pools");
        runtime.scheduler().shutdownNow();
        runtime.ioExecutor().shutdownNow();
        try {
            runtime.ioExecutor().awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

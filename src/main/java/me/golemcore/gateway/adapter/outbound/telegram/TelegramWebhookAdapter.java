package me.golemcore.gateway.adapter.outbound.telegram;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.adapter.outbound.platform.AdapterRuntime;
import me.golemcore.gateway.adapter.outbound.platform.PassivePlatformAdapter;
import me.golemcore.gateway.domain.exception.CredentialInvalidException;
import me.golemcore.gateway.domain.exception.PlatformException;
import me.golemcore.gateway.domain.exception.PlatformRequestRejectedException;
import me.golemcore.gateway.domain.exception.RateLimitedException;
import me.golemcore.gateway.domain.exception.TransientNetworkException;
import me.golemcore.gateway.domain.model.Attachment;
import me.golemcore.gateway.domain.model.BindingKey;
import me.golemcore.gateway.domain.model.Platform;
import me.golemcore.gateway.domain.model.RawPlatformEvent;
import me.golemcore.gateway.domain.model.Secret;
import me.golemcore.gateway.domain.model.SendAck;
import me.golemcore.gateway.domain.service.MessageChunker;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.inbound.ConnectionContext;
import org.telegram.telegrambots.meta.api.methods.GetMe;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updates.DeleteWebhook;
import org.telegram.telegrambots.meta.api.methods.updates.GetWebhookInfo;
import org.telegram.telegrambots.meta.api.methods.updates.SetWebhook;
import org.telegram.telegrambots.meta.api.objects.Document;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.WebhookInfo;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.api.objects.PhotoSize;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Telegram bot connection through a registered webhook.
 *
 * <p>
 * The token format is checked before any network call, then {@code getMe}
 * confirms the token with Telegram. {@code setWebhook} points the bot at
 * {@code {webhook-base-url}/webhook/telegram/{agentId}} with a fresh secret
 * token. Deliveries arrive through the webhook controller and are parsed here.
 * Teardown removes the webhook.
 */
@Slf4j
public class TelegramWebhookAdapter extends PassivePlatformAdapter {

    static final Pattern TOKEN_PATTERN = Pattern.compile("^\\d{5,20}:[A-Za-z0-9_-]{30,64}$");
    private static final Pattern RETRY_AFTER_PATTERN = Pattern.compile("retry after (\\d+)");
    private static final int RETRY_AFTER_DEFAULT_SECONDS = 1;
    private static final int HTTP_UNAUTHORIZED = 401;
    private static final int HTTP_NOT_FOUND = 404;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final List<String> ALLOWED_UPDATES = List.of("message");

    private final Function<String, TelegramClient> clientFactory;
    private final ObjectMapper objectMapper;
    private final GatewayProperties.TelegramProperties settings;

    private volatile TelegramClient telegramClient;
    private volatile String webhookUrl;
    private volatile String botId;

    public TelegramWebhookAdapter(BindingKey key, AdapterRuntime runtime,
            Function<String, TelegramClient> clientFactory, ObjectMapper objectMapper,
            GatewayProperties.TelegramProperties settings) {
        super(key, runtime);
        this.clientFactory = clientFactory;
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    public String getWebhookUrl() {
        return webhookUrl;
    }

    public String getBotId() {
        return botId;
    }

    @Override
    protected void doConnect(ConnectionContext context, Secret credentials) {
        String token = Secret.valueOrEmpty(credentials).trim();
        if (!TOKEN_PATTERN.matcher(token).matches()) {
            throw new CredentialInvalidException("Telegram bot token is malformed");
        }

        TelegramClient client = clientFactory.apply(token);
        User me = call("getMe", () -> client.execute(new GetMe()));
        botId = me != null && me.getId() != null ? String.valueOf(me.getId()) : null;
        context.throwIfCancelled();

        String url = stripTrailingSlash(settings.getWebhookBaseUrl()) + "/webhook/telegram/" + key.agentId();
        String secret = rotateWebhookSecret();
        SetWebhook setWebhook = SetWebhook.builder()
                .url(url)
                .secretToken(secret)
                .allowedUpdates(ALLOWED_UPDATES)
                .build();
        Boolean accepted = call("setWebhook", () -> client.execute(setWebhook));
        if (!Boolean.TRUE.equals(accepted)) {
            throw new TransientNetworkException("Telegram did not accept the webhook for " + key);
        }

        this.telegramClient = client;
        this.webhookUrl = url;
        log.info("[Telegram] Webhook registered for {} (bot {}) at {}", key, botId, url);
    }

    @Override
    protected SendAck doSend(String externalChatId, String content) {
        TelegramClient client = telegramClient;
        List<String> chunks = MessageChunker.split(content, Platform.TELEGRAM.getMaxMessageLength());
        String lastMessageId = null;
        for (String chunk : chunks) {
            SendMessage sendMessage = SendMessage.builder()
                    .chatId(externalChatId)
                    .text(chunk)
                    .build();
            Message sent = executeWithRetry("send", () -> call("sendMessage", () -> client.execute(sendMessage)));
            if (sent != null && sent.getMessageId() != null) {
                lastMessageId = externalChatId + ":" + sent.getMessageId();
            }
        }
        log.debug("[Telegram] Sent {} chunk(s) to chat {} for {}", chunks.size(), externalChatId, key);
        return new SendAck(lastMessageId, chunks.size());
    }

    @Override
    protected boolean isWebhookCurrent(Duration timeout) {
        TelegramClient client = telegramClient;
        String expected = webhookUrl;
        if (client == null || expected == null) {
            return false;
        }
        try {
            WebhookInfo info = callWithTimeout("getWebhookInfo", timeout,
                    () -> call("getWebhookInfo", () -> client.execute(new GetWebhookInfo())));
            boolean current = info != null && expected.equals(info.getUrl());
            if (!current) {
                log.warn("[Telegram] Webhook for {} superseded, platform reports {}", key,
                        info != null ? info.getUrl() : null);
            }
            return current;
        } catch (PlatformException e) {
            log.warn("[Telegram] Webhook health check failed for {}: {}", key, e.getMessage());
            return false;
        }
    }

    @Override
    protected Optional<RawPlatformEvent> parseWebhook(byte[] body) {
        Update update;
        try {
            update = objectMapper.readValue(body, Update.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed Telegram update: " + e.getMessage(), e);
        }
        return toEvent(update);
    }

    Optional<RawPlatformEvent> toEvent(Update update) {
        Message message = update != null ? update.getMessage() : null;
        if (message == null || message.getChatId() == null) {
            return Optional.empty();
        }
        String text = message.getText() != null ? message.getText() : message.getCaption();
        List<Attachment> attachments = attachmentsOf(message);
        if ((text == null || text.isBlank()) && attachments.isEmpty()) {
            log.debug("[Telegram] Ignoring update {} without text for {}", update.getUpdateId(), key);
            return Optional.empty();
        }

        String chatId = String.valueOf(message.getChatId());
        User from = message.getFrom();

        Map<String, String> metadata = new LinkedHashMap<>();
        if (update.getUpdateId() != null) {
            metadata.put("update_id", String.valueOf(update.getUpdateId()));
        }
        if (message.getChat() != null && message.getChat().getType() != null) {
            metadata.put("chat_type", message.getChat().getType());
        }
        if (botId != null) {
            metadata.put("bot_id", botId);
        }

        return Optional.of(RawPlatformEvent.builder()
                .key(key)
                .externalChatId(chatId)
                .externalMessageId(chatId + ":" + message.getMessageId())
                .senderId(from != null ? String.valueOf(from.getId()) : null)
                .senderName(from != null ? displayName(from) : null)
                .fromBot(from != null && Boolean.TRUE.equals(from.getIsBot()))
                .content(text != null ? text : "")
                .attachments(attachments)
                .timestamp(message.getDate() != null ? Instant.ofEpochSecond(message.getDate()) : Instant.now())
                .metadata(Map.copyOf(metadata))
                .build());
    }

    /**
     * Documents keep their name and type. Photos arrive in several sizes; only
     * the largest is referenced.
     */
    static List<Attachment> attachmentsOf(Message message) {
        List<Attachment> attachments = new ArrayList<>();
        Document document = message.getDocument();
        if (document != null) {
            attachments.add(new Attachment("tg-file:" + document.getFileId(), document.getFileName(),
                    document.getMimeType(), document.getFileSize()));
        }
        List<PhotoSize> photos = message.getPhoto();
        if (photos != null && !photos.isEmpty()) {
            PhotoSize largest = photos.stream()
                    .max(Comparator.comparingLong(TelegramWebhookAdapter::pixelCount))
                    .orElseThrow();
            attachments.add(new Attachment("tg-file:" + largest.getFileId(), null, "image/jpeg",
                    largest.getFileSize() != null ? largest.getFileSize().longValue() : null));
        }
        return attachments;
    }

    private static long pixelCount(PhotoSize photo) {
        long width = photo.getWidth() != null ? photo.getWidth() : 0;
        long height = photo.getHeight() != null ? photo.getHeight() : 0;
        return width * height;
    }

    @Override
    protected void doDisconnect(Duration timeout) {
        TelegramClient client = telegramClient;
        if (client == null) {
            return;
        }
        DeleteWebhook deleteWebhook = DeleteWebhook.builder()
                .dropPendingUpdates(false)
                .build();
        callWithTimeout("deleteWebhook", timeout, () -> call("deleteWebhook", () -> client.execute(deleteWebhook)));
        log.info("[Telegram] Webhook removed for {}", key);
    }

    @Override
    protected void releaseResources() {
        telegramClient = null;
    }

    private <T> T call(String operation, TelegramCall<T> call) {
        try {
            return call.execute();
        } catch (TelegramApiException e) {
            throw classify(operation, e);
        }
    }

    private PlatformException classify(String operation, TelegramApiException e) {
        if (e instanceof TelegramApiRequestException requestException && requestException.getErrorCode() != null) {
            int code = requestException.getErrorCode();
            if (code == HTTP_UNAUTHORIZED || code == HTTP_NOT_FOUND) {
                return new CredentialInvalidException("Telegram rejected bot token on " + operation);
            }
            if (code == HTTP_TOO_MANY_REQUESTS) {
                return new RateLimitedException("Telegram rate limit on " + operation,
                        Duration.ofSeconds(extractRetryAfterSeconds(requestException)));
            }
            if (code >= 500) {
                return new TransientNetworkException("Telegram " + operation + " failed: HTTP " + code, e);
            }
            return new PlatformRequestRejectedException("Telegram " + operation + " failed: "
                    + requestException.getApiResponse(), code);
        }
        return new TransientNetworkException("Telegram " + operation + " failed: " + e.getMessage(), e);
    }

    int extractRetryAfterSeconds(TelegramApiRequestException e) {
        if (e.getParameters() != null && e.getParameters().getRetryAfter() != null) {
            return e.getParameters().getRetryAfter();
        }
        String message = e.getMessage();
        if (message != null) {
            Matcher matcher = RETRY_AFTER_PATTERN.matcher(message);
            if (matcher.find()) {
                return Integer.parseInt(matcher.group(1));
            }
        }
        return RETRY_AFTER_DEFAULT_SECONDS;
    }

    private static String displayName(User user) {
        if (user.getUserName() != null && !user.getUserName().isBlank()) {
            return user.getUserName();
        }
        return user.getFirstName();
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @FunctionalInterface
    private interface TelegramCall<T> {
        T execute() throws TelegramApiException;
    }
}

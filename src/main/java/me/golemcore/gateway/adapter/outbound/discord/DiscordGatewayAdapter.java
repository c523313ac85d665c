package me.golemcore.gateway.adapter.outbound.discord;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.adapter.outbound.platform.ActivePlatformAdapter;
import me.golemcore.gateway.adapter.outbound.platform.AdapterRuntime;
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
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Discord bot connection over the Gateway WebSocket.
 *
 * <p>
 * Connect sequence:
 * <ol>
 * <li>{@code GET /users/@me} validates the token (401 means invalid)</li>
 * <li>open the gateway socket, answer HELLO with IDENTIFY and start the
 * heartbeat</li>
 * <li>READY dispatch completes the connect</li>
 * </ol>
 *
 * <p>
 * {@code MESSAGE_CREATE} dispatches become raw events. Replies go through the
 * REST API, split at 2000 characters. The session is considered dead when the
 * socket closes or two heartbeat intervals pass without an ACK.
 */
@Slf4j
public class DiscordGatewayAdapter extends ActivePlatformAdapter {

    static final int OP_DISPATCH = 0;
    static final int OP_HEARTBEAT = 1;
    static final int OP_IDENTIFY = 2;
    static final int OP_RECONNECT = 7;
    static final int OP_INVALID_SESSION = 9;
    static final int OP_HELLO = 10;
    static final int OP_HEARTBEAT_ACK = 11;

    static final int CLOSE_AUTHENTICATION_FAILED = 4004;
    // authentication failed, invalid shard, sharding required, invalid API
    // version, invalid intents, disallowed intents
    private static final Set<Integer> FATAL_CLOSE_CODES = Set.of(
            CLOSE_AUTHENTICATION_FAILED, 4010, 4011, 4012, 4013, 4014);

    private static final int NORMAL_CLOSURE = 1000;
    private static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 41_250;
    private static final int MISSED_ACK_INTERVALS = 2;
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final Pattern SNOWFLAKE = Pattern.compile("^\\d{1,20}$");
    private static final String CLIENT_NAME = "golemcore-gateway";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final GatewayProperties.DiscordProperties settings;

    private final CompletableFuture<Void> ready = new CompletableFuture<>();
    private final CountDownLatch closed = new CountDownLatch(1);
    private final AtomicLong sequence = new AtomicLong(-1);

    private volatile String token;
    private volatile String botUserId;
    private volatile WebSocket webSocket;
    private volatile ScheduledFuture<?> heartbeatTask;
    private volatile long heartbeatIntervalMillis;
    private volatile long lastHeartbeatAckNanos;
    private volatile boolean awaitingAck;

    public DiscordGatewayAdapter(BindingKey key, AdapterRuntime runtime, OkHttpClient httpClient,
            ObjectMapper objectMapper, GatewayProperties.DiscordProperties settings) {
        super(key, runtime);
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    public String getBotUserId() {
        return botUserId;
    }

    @Override
    protected void doConnect(ConnectionContext context, Secret credentials) {
        String candidate = Secret.valueOrEmpty(credentials).trim();
        if (candidate.isEmpty() || candidate.chars().anyMatch(Character::isWhitespace)) {
            throw new CredentialInvalidException("Discord bot token is empty or malformed");
        }
        this.token = candidate;
        this.botUserId = fetchBotUserId();
        context.throwIfCancelled();
        if (isReleased()) {
            throw new CancellationException("Adapter for " + key + " released during connect");
        }

        context.onCancel(() -> ready.cancel(false));
        markReadLoopStarted();
        this.webSocket = openSocket(new GatewayListener());
        try {
            awaitReady();
        } catch (RuntimeException e) {
            webSocket.cancel();
            throw e;
        }
        log.info("[Discord] Gateway session ready for {} (bot {})", key, botUserId);
    }

    /**
     * Opens the gateway socket. Package-private for tests that drive the
     * listener directly.
     */
    WebSocket openSocket(WebSocketListener listener) {
        Request request = new Request.Builder()
                .url(settings.getGatewayUrl())
                .build();
        return httpClient.newWebSocket(request, listener);
    }

    @Override
    protected SendAck doSend(String externalChatId, String content) {
        if (!SNOWFLAKE.matcher(externalChatId).matches()) {
            throw new PlatformRequestRejectedException("Invalid Discord channel id: " + externalChatId, 400);
        }
        List<String> chunks = MessageChunker.split(content, Platform.DISCORD.getMaxMessageLength());
        String lastMessageId = null;
        for (String chunk : chunks) {
            lastMessageId = executeWithRetry("send", () -> postMessage(externalChatId, chunk));
        }
        log.debug("[Discord] Sent {} chunk(s) to channel {} for {}", chunks.size(), externalChatId, key);
        return new SendAck(lastMessageId, chunks.size());
    }

    @Override
    protected boolean isSessionHealthy() {
        long interval = heartbeatIntervalMillis;
        if (interval <= 0) {
            return ready.isDone() && !ready.isCompletedExceptionally();
        }
        long sinceAck = System.nanoTime() - lastHeartbeatAckNanos;
        return sinceAck <= TimeUnit.MILLISECONDS.toNanos(interval * MISSED_ACK_INTERVALS);
    }

    @Override
    protected void doDisconnect(Duration timeout) {
        stopHeartbeat();
        ready.cancel(false);
        WebSocket socket = webSocket;
        if (socket == null) {
            return;
        }
        socket.close(NORMAL_CLOSURE, "shutdown");
        try {
            if (!closed.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.debug("[Discord] Close handshake timed out for {}, cancelling socket", key);
                socket.cancel();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            socket.cancel();
        }
    }

    @Override
    protected void releaseResources() {
        stopHeartbeat();
    }

    private void awaitReady() {
        try {
            ready.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PlatformException platformException) {
                throw platformException;
            }
            throw new TransientNetworkException("Discord gateway handshake failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for Discord READY");
        }
    }

    private String fetchBotUserId() {
        Request request = new Request.Builder()
                .url(settings.getApiUrl() + "/users/@me")
                .header("Authorization", "Bot " + token)
                .get()
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            String body = readBody(response);
            if (!response.isSuccessful()) {
                throw classifyFailure(response, body, "GET /users/@me");
            }
            return objectMapper.readTree(body).path("id").asText(null);
        } catch (IOException e) {
            throw new TransientNetworkException("Discord API unreachable: " + e.getMessage(), e);
        }
    }

    private String postMessage(String channelId, String chunk) {
        ObjectNode payload = objectMapper.createObjectNode().put("content", chunk);
        Request request = new Request.Builder()
                .url(settings.getApiUrl() + "/channels/" + channelId + "/messages")
                .header("Authorization", "Bot " + token)
                .post(RequestBody.create(payload.toString(), JSON))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            String body = readBody(response);
            if (!response.isSuccessful()) {
                throw classifyFailure(response, body, "POST /channels/{id}/messages");
            }
            return objectMapper.readTree(body).path("id").asText(null);
        } catch (IOException e) {
            throw new TransientNetworkException("Discord send failed: " + e.getMessage(), e);
        }
    }

    private PlatformException classifyFailure(Response response, String body, String operation) {
        int code = response.code();
        if (code == 401) {
            return new CredentialInvalidException("Discord rejected bot token on " + operation);
        }
        if (code == 429) {
            return new RateLimitedException("Discord rate limit on " + operation, parseRetryAfter(response, body));
        }
        if (code >= 500) {
            return new TransientNetworkException("Discord " + operation + " failed: HTTP " + code);
        }
        return new PlatformRequestRejectedException("Discord " + operation + " failed: HTTP " + code, code);
    }

    private Duration parseRetryAfter(Response response, String body) {
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node.has("retry_after")) {
                return Duration.ofMillis((long) (node.path("retry_after").asDouble() * 1000));
            }
        } catch (IOException e) {
            log.debug("[Discord] Unparseable 429 body for {}: {}", key, e.getMessage());
        }
        String header = response.header("Retry-After");
        if (header != null) {
            try {
                return Duration.ofMillis((long) (Double.parseDouble(header) * 1000));
            } catch (NumberFormatException e) {
                log.debug("[Discord] Unparseable Retry-After header for {}: {}", key, header);
            }
        }
        return Duration.ofSeconds(1);
    }

    private static String readBody(Response response) throws IOException {
        ResponseBody body = response.body();
        return body != null ? body.string() : "";
    }

    // ==================== GATEWAY PROTOCOL ====================

    void handleFrame(WebSocket socket, String text) throws IOException {
        JsonNode frame = objectMapper.readTree(text);
        JsonNode seq = frame.get("s");
        if (seq != null && seq.isNumber()) {
            sequence.set(seq.asLong());
        }

        int op = frame.path("op").asInt(-1);
        switch (op) {
        case OP_HELLO -> {
            startHeartbeat(socket, frame.path("d").path("heartbeat_interval").asLong(DEFAULT_HEARTBEAT_INTERVAL_MS));
            identify(socket);
        }
        case OP_HEARTBEAT -> sendHeartbeat(socket);
        case OP_HEARTBEAT_ACK -> {
            awaitingAck = false;
            lastHeartbeatAckNanos = System.nanoTime();
        }
        case OP_RECONNECT, OP_INVALID_SESSION -> {
            log.info("[Discord] Gateway asked {} to reconnect (op {})", key, op);
            socket.close(NORMAL_CLOSURE, "reconnect requested");
        }
        case OP_DISPATCH -> handleDispatch(frame.path("t").asText(""), frame.path("d"));
        default -> log.debug("[Discord] Ignoring gateway op {} for {}", op, key);
        }
    }

    private void handleDispatch(String type, JsonNode data) {
        if ("READY".equals(type)) {
            String readyUserId = data.path("user").path("id").asText(null);
            if (readyUserId != null) {
                botUserId = readyUserId;
            }
            lastHeartbeatAckNanos = System.nanoTime();
            ready.complete(null);
            return;
        }
        if ("MESSAGE_CREATE".equals(type)) {
            toEvent(data).ifPresent(this::publishEvent);
        }
    }

    Optional<RawPlatformEvent> toEvent(JsonNode data) {
        String channelId = data.path("channel_id").asText(null);
        String messageId = data.path("id").asText(null);
        if (channelId == null || messageId == null) {
            return Optional.empty();
        }

        JsonNode author = data.path("author");
        String authorId = author.path("id").asText(null);
        boolean fromBot = author.path("bot").asBoolean(false)
                || (authorId != null && authorId.equals(botUserId));

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("author_name", author.path("username").asText(""));
        if (data.hasNonNull("guild_id")) {
            metadata.put("guild_id", data.path("guild_id").asText());
        }
        if (botUserId != null) {
            metadata.put("bot_id", botUserId);
        }

        List<Attachment> attachments = new ArrayList<>();
        for (JsonNode node : data.path("attachments")) {
            attachments.add(new Attachment(
                    node.path("url").asText(null),
                    node.path("filename").asText(null),
                    node.path("content_type").asText(null),
                    node.hasNonNull("size") ? node.path("size").asLong() : null));
        }

        return Optional.of(RawPlatformEvent.builder()
                .key(key)
                .externalChatId(channelId)
                .externalMessageId(messageId)
                .senderId(authorId)
                .senderName(author.path("global_name").asText(author.path("username").asText(null)))
                .fromBot(fromBot)
                .content(data.path("content").asText(""))
                .attachments(List.copyOf(attachments))
                .timestamp(parseTimestamp(data.path("timestamp").asText(null)))
                .metadata(Map.copyOf(metadata))
                .build());
    }

    private void identify(WebSocket socket) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("op", OP_IDENTIFY);
        ObjectNode data = frame.putObject("d");
        data.put("token", token);
        data.put("intents", settings.getIntents());
        ObjectNode properties = data.putObject("properties");
        properties.put("os", System.getProperty("os.name", "linux"));
        properties.put("browser", CLIENT_NAME);
        properties.put("device", CLIENT_NAME);
        socket.send(frame.toString());
    }

    private void startHeartbeat(WebSocket socket, long intervalMillis) {
        stopHeartbeat();
        heartbeatIntervalMillis = intervalMillis;
        lastHeartbeatAckNanos = System.nanoTime();
        awaitingAck = false;
        heartbeatTask = runtime.scheduler().scheduleAtFixedRate(
                () -> heartbeatTick(socket), intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
    }

    private void heartbeatTick(WebSocket socket) {
        try {
            if (awaitingAck) {
                log.warn("[Discord] Heartbeat ACK missed for {}, closing zombied connection", key);
                socket.cancel();
                terminate(-1, "heartbeat ack missed");
                return;
            }
            sendHeartbeat(socket);
        } catch (RuntimeException e) {
            log.warn("[Discord] Heartbeat failed for {}: {}", key, e.getMessage(), e);
        }
    }

    private void sendHeartbeat(WebSocket socket) {
        long seq = sequence.get();
        awaitingAck = true;
        socket.send("{\"op\":" + OP_HEARTBEAT + ",\"d\":" + (seq < 0 ? "null" : Long.toString(seq)) + "}");
    }

    private void stopHeartbeat() {
        ScheduledFuture<?> task = heartbeatTask;
        if (task != null) {
            task.cancel(false);
            heartbeatTask = null;
        }
    }

    private void terminate(int code, String reason) {
        stopHeartbeat();
        if (FATAL_CLOSE_CODES.contains(code)) {
            ready.completeExceptionally(new CredentialInvalidException(
                    "Discord closed the gateway with code " + code + ": " + reason));
        } else {
            ready.completeExceptionally(new TransientNetworkException(
                    "Discord gateway closed (" + code + "): " + reason));
        }
        closed.countDown();
        markReadLoopTerminated("code " + code + ": " + reason);
    }

    private static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return Instant.now();
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return Instant.now();
        }
    }

    private final class GatewayListener extends WebSocketListener {

        @Override
        public void onMessage(WebSocket socket, String text) {
            try {
                handleFrame(socket, text);
            } catch (IOException | RuntimeException e) {
                log.warn("[Discord] Failed to handle gateway frame for {}: {}", key, e.getMessage(), e);
            }
        }

        @Override
        public void onClosing(WebSocket socket, int code, String reason) {
            socket.close(NORMAL_CLOSURE, null);
        }

        @Override
        public void onClosed(WebSocket socket, int code, String reason) {
            terminate(code, reason);
        }

        @Override
        public void onFailure(WebSocket socket, Throwable t, Response response) {
            terminate(-1, t.getMessage());
        }
    }
}

package me.golemcore.gateway.adapter.outbound.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gateway.adapter.outbound.platform.AdapterRuntime;
import me.golemcore.gateway.domain.exception.CredentialInvalidException;
import me.golemcore.gateway.domain.exception.PlatformRequestRejectedException;
import me.golemcore.gateway.domain.exception.TransientNetworkException;
import me.golemcore.gateway.domain.model.BindingKey;
import me.golemcore.gateway.domain.model.Platform;
import me.golemcore.gateway.domain.model.RawPlatformEvent;
import me.golemcore.gateway.domain.model.Secret;
import me.golemcore.gateway.domain.model.SendAck;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.inbound.ConnectionContext;
import me.golemcore.gateway.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class DiscordGatewayAdapterTest {

    private static final BindingKey KEY = BindingKey.of("agent-1", Platform.DISCORD);
    private static final String TOKEN = "discord-bot-token";
    private static final String HELLO = "{\"op\":10,\"d\":{\"heartbeat_interval\":45000}}";
    private static final String READY = "{\"op\":0,\"s\":1,\"t\":\"READY\",\"d\":{\"user\":{\"id\":\"999\"}}}";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private OkHttpMockEngine engine;
    private ExecutorService ioExecutor;
    private ScheduledExecutorService scheduler;
    private WebSocket socket;
    private ScriptedDiscordAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        ioExecutor = Executors.newCachedThreadPool();
        scheduler = Executors.newSingleThreadScheduledExecutor();
        socket = mock(WebSocket.class);

        GatewayProperties.DiscordProperties settings = new GatewayProperties.DiscordProperties();
        settings.setApiUrl("https://discord.test/api/v10");
        OkHttpClient httpClient = new OkHttpClient.Builder().addInterceptor(engine).build();
        adapter = new ScriptedDiscordAdapter(new AdapterRuntime(ioExecutor, scheduler, Duration.ofSeconds(5), 10),
                httpClient, objectMapper, settings, socket);
    }

    @AfterEach
    void tearDown() {
        ioExecutor.shutdownNow();
        scheduler.shutdownNow();
    }

    // ===== Connect =====

    @Test
    void shouldConnectAfterHelloAndReady() throws Exception {
        engine.enqueueJson(200, "{\"id\":\"999\",\"username\":\"helper\"}");
        adapter.script = (listener, ws) -> {
            listener.onMessage(ws, HELLO);
            listener.onMessage(ws, READY);
        };

        adapter.connect(new ConnectionContext(KEY, 1), Secret.of(TOKEN));

        assertEquals("999", adapter.getBotUserId());
        assertTrue(adapter.isReadLoopAlive());
        assertTrue(adapter.isHealthy(Duration.ofSeconds(1)));

        OkHttpMockEngine.CapturedRequest me = engine.takeRequest();
        assertEquals("GET", me.method());
        assertTrue(me.target().endsWith("/users/@me"));
        assertEquals("Bot " + TOKEN, me.headers().get("Authorization"));

        ArgumentCaptor<String> sent = ArgumentCaptor.forClass(String.class);
        verify(socket, atLeastOnce()).send(sent.capture());
        JsonNode identify = objectMapper.readTree(sent.getAllValues().get(0));
        assertEquals(2, identify.path("op").asInt());
        assertEquals(TOKEN, identify.path("d").path("token").asText());
        assertEquals(37377, identify.path("d").path("intents").asInt());
    }

    @Test
    void shouldRejectMalformedTokenWithoutNetwork() {
        assertThrows(CredentialInvalidException.class,
                () -> adapter.connect(new ConnectionContext(KEY, 1), Secret.of("bad token")));
        assertEquals(0, engine.getRequestCount());
        assertEquals(0, adapter.socketsOpened);
    }

    @Test
    void shouldClassifyUnauthorizedAsCredentialInvalid() {
        engine.enqueueJson(401, "{\"message\":\"401: Unauthorized\",\"code\":0}");

        assertThrows(CredentialInvalidException.class,
                () -> adapter.connect(new ConnectionContext(KEY, 1), Secret.of(TOKEN)));
        assertEquals(0, adapter.socketsOpened);
    }

    @Test
    void shouldClassifyServerErrorAsTransient() {
        engine.enqueueJson(502, "");

        assertThrows(TransientNetworkException.class,
                () -> adapter.connect(new ConnectionContext(KEY, 1), Secret.of(TOKEN)));
    }

    @Test
    void shouldClassifyNetworkFailureAsTransient() {
        engine.enqueueFailure(new IOException("connection reset"));

        assertThrows(TransientNetworkException.class,
                () -> adapter.connect(new ConnectionContext(KEY, 1), Secret.of(TOKEN)));
    }

    @Test
    void shouldFailConnectWhenGatewayClosesWithAuthenticationFailure() {
        engine.enqueueJson(200, "{\"id\":\"999\"}");
        adapter.script = (listener, ws) -> {
            listener.onMessage(ws, HELLO);
            listener.onClosed(ws, DiscordGatewayAdapter.CLOSE_AUTHENTICATION_FAILED, "Authentication failed.");
        };

        assertThrows(CredentialInvalidException.class,
                () -> adapter.connect(new ConnectionContext(KEY, 1), Secret.of(TOKEN)));
        verify(socket).cancel();
    }

    @Test
    void shouldFailConnectWhenGatewayDropsDuringHandshake() {
        engine.enqueueJson(200, "{\"id\":\"999\"}");
        adapter.script = (listener, ws) -> listener.onClosed(ws, 1006, "abnormal");

        assertThrows(TransientNetworkException.class,
                () -> adapter.connect(new ConnectionContext(KEY, 1), Secret.of(TOKEN)));
    }

    // ===== Inbound =====

    @Test
    void shouldPublishMessageCreateAsRawEvent() throws Exception {
        connect();

        adapter.handleFrame(socket, "{\"op\":0,\"s\":2,\"t\":\"MESSAGE_CREATE\",\"d\":{"
                + "\"id\":\"555\",\"channel_id\":\"123\",\"guild_id\":\"77\",\"content\":\"hello\","
                + "\"timestamp\":\"2026-03-01T10:00:00.000000+00:00\","
                + "\"author\":{\"id\":\"42\",\"username\":\"ann\",\"global_name\":\"Ann\"},"
                + "\"attachments\":[{\"url\":\"https://cdn.test/a.png\",\"filename\":\"a.png\","
                + "\"content_type\":\"image/png\",\"size\":10}]}}");

        RawPlatformEvent event = adapter.events().poll(1, TimeUnit.SECONDS);
        assertNotNull(event);
        assertEquals(KEY, event.getKey());
        assertEquals("123", event.getExternalChatId());
        assertEquals("555", event.getExternalMessageId());
        assertEquals("42", event.getSenderId());
        assertEquals("Ann", event.getSenderName());
        assertEquals("hello", event.getContent());
        assertFalse(event.isFromBot());
        assertEquals("77", event.getMetadata().get("guild_id"));
        assertEquals(1, event.getAttachments().size());
        assertEquals("a.png", event.getAttachments().get(0).fileName());
    }

    @Test
    void shouldFlagOwnMessagesAsBotAuthored() throws Exception {
        connect();

        JsonNode data = objectMapper.readTree("{\"id\":\"556\",\"channel_id\":\"123\",\"content\":\"echo\","
                + "\"author\":{\"id\":\"999\",\"username\":\"helper\"}}");

        assertTrue(adapter.toEvent(data).orElseThrow().isFromBot());
    }

    @Test
    void shouldSkipDispatchWithoutChannel() throws Exception {
        connect();

        JsonNode data = objectMapper.readTree("{\"id\":\"557\",\"content\":\"orphan\"}");

        assertTrue(adapter.toEvent(data).isEmpty());
    }

    @Test
    void shouldAnswerHeartbeatRequest() throws Exception {
        connect();

        adapter.handleFrame(socket, "{\"op\":1,\"d\":null}");

        verify(socket).send("{\"op\":1,\"d\":1}");
    }

    @Test
    void shouldBecomeUnhealthyWhenSocketCloses() throws Exception {
        connect();

        adapter.listener.onClosed(socket, 1006, "gone");

        assertFalse(adapter.isReadLoopAlive());
        assertFalse(adapter.isHealthy(Duration.ofSeconds(1)));
    }

    // ===== Outbound =====

    @Test
    void shouldSplitLongRepliesIntoChunks() throws Exception {
        connect();
        engine.enqueueJson(200, "{\"id\":\"m1\"}");
        engine.enqueueJson(200, "{\"id\":\"m2\"}");

        SendAck ack = adapter.send("123", "x".repeat(2500)).get(2, TimeUnit.SECONDS);

        assertEquals("m2", ack.externalMessageId());
        assertEquals(2, ack.chunks());
        OkHttpMockEngine.CapturedRequest first = engine.takeRequest();
        assertEquals("POST", first.method());
        assertTrue(first.target().endsWith("/channels/123/messages"));
        assertEquals(2000, objectMapper.readTree(first.body()).path("content").asText().length());
        assertEquals(500, objectMapper.readTree(engine.takeRequest().body()).path("content").asText().length());
    }

    @Test
    void shouldRetryAfterPlatformRateLimit() throws Exception {
        connect();
        engine.enqueueJson(429, "{\"message\":\"You are being rate limited.\",\"retry_after\":0.0,\"global\":false}");
        engine.enqueueJson(200, "{\"id\":\"m1\"}");

        SendAck ack = adapter.send("123", "hello").get(2, TimeUnit.SECONDS);

        assertEquals("m1", ack.externalMessageId());
        assertEquals(2, engine.getRequestCount());
    }

    @Test
    void shouldRejectInvalidChannelId() throws Exception {
        connect();

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.send("not-a-channel", "hello").get(2, TimeUnit.SECONDS));

        assertInstanceOf(PlatformRequestRejectedException.class, error.getCause());
        assertEquals(0, engine.getRequestCount());
    }

    @Test
    void shouldMapMissingChannelToRequestRejected() throws Exception {
        connect();
        engine.enqueueJson(404, "{\"message\":\"Unknown Channel\",\"code\":10003}");

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.send("123", "hello").get(2, TimeUnit.SECONDS));

        PlatformRequestRejectedException rejected = assertInstanceOf(PlatformRequestRejectedException.class,
                error.getCause());
        assertEquals(404, rejected.getStatusCode());
    }

    // ===== Disconnect =====

    @Test
    void shouldCloseSocketOnDisconnect() throws Exception {
        connect();

        adapter.disconnectGracefully(Duration.ofMillis(200));

        verify(socket).close(1000, "shutdown");
        assertFalse(adapter.isHealthy(Duration.ofSeconds(1)));
    }

    private void connect() {
        engine.enqueueJson(200, "{\"id\":\"999\"}");
        adapter.script = (listener, ws) -> {
            listener.onMessage(ws, HELLO);
            listener.onMessage(ws, READY);
        };
        adapter.connect(new ConnectionContext(KEY, 1), Secret.of(TOKEN));
        engine.takeRequest();
    }

    private static final class ScriptedDiscordAdapter extends DiscordGatewayAdapter {

        private final WebSocket socket;
        private BiConsumer<WebSocketListener, WebSocket> script = (listener, ws) -> {
        };
        private WebSocketListener listener;
        private int socketsOpened;

        ScriptedDiscordAdapter(AdapterRuntime runtime, OkHttpClient httpClient, ObjectMapper objectMapper,
                GatewayProperties.DiscordProperties settings, WebSocket socket) {
            super(KEY, runtime, httpClient, objectMapper, settings);
            this.socket = socket;
        }

        @Override
        WebSocket openSocket(WebSocketListener listener) {
            this.listener = listener;
            socketsOpened++;
            script.accept(listener, socket);
            return socket;
        }
    }
}

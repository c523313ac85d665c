package me.golemcore.gateway.adapter.inbound.webhook;

import me.golemcore.gateway.domain.exception.RateLimitedException;
import me.golemcore.gateway.domain.exception.WebhookRejectedException;
import me.golemcore.gateway.domain.model.BindingKey;
import me.golemcore.gateway.domain.model.Platform;
import me.golemcore.gateway.domain.service.ConnectionHandle;
import me.golemcore.gateway.domain.service.ConnectionSupervisor;
import me.golemcore.gateway.port.inbound.WebhookReceiver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PlatformWebhookControllerTest {

    private static final BindingKey KEY = BindingKey.of("agent-1", Platform.TELEGRAM);
    private static final String UPDATE = "{\"update_id\":1,\"message\":{\"message_id\":7,\"text\":\"hi\"}}";

    private ConnectionSupervisor supervisor;
    private WebhookReceiver receiver;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        supervisor = mock(ConnectionSupervisor.class);
        receiver = mock(WebhookReceiver.class);
        ConnectionHandle handle = mock(ConnectionHandle.class);
        when(handle.webhookReceiver()).thenReturn(Optional.of(receiver));
        when(supervisor.findLiveHandle(KEY)).thenReturn(Optional.of(handle));
        when(supervisor.findLiveHandle(BindingKey.of("agent-2", Platform.TELEGRAM))).thenReturn(Optional.empty());

        webTestClient = WebTestClient.bindToController(new PlatformWebhookController(supervisor)).build();
    }

    @Test
    void shouldAcceptDeliveryWithValidSecret() {
        when(receiver.acceptWebhook(eq("s3cret"), any())).thenReturn(true);

        post("/webhook/telegram/agent-1", "s3cret")
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("accepted")
                .jsonPath("$.message").doesNotExist();

        verify(receiver).acceptWebhook("s3cret", UPDATE.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void shouldAnswerIgnoredForNonRoutableUpdate() {
        when(receiver.acceptWebhook(eq("s3cret"), any())).thenReturn(false);

        post("/webhook/telegram/agent-1", "s3cret")
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("ignored");
    }

    @Test
    void shouldRejectWrongSecret() {
        when(receiver.acceptWebhook(eq("forged"), any()))
                .thenThrow(new WebhookRejectedException("Invalid webhook secret for agent-1/telegram"));

        post("/webhook/telegram/agent-1", "forged")
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.status").isEqualTo("error");
    }

    @Test
    void shouldRejectDeliveryWithoutRunningConnection() {
        post("/webhook/telegram/agent-2", "s3cret")
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.message").isEqualTo("No running webhook for agent-2/telegram");
    }

    @Test
    void shouldAnswerNotFoundForActivePlatform() {
        post("/webhook/discord/agent-1", null)
                .expectStatus().isNotFound();
    }

    @Test
    void shouldRejectInvalidPathValues() {
        post("/webhook/slack/agent-1", null)
                .expectStatus().isBadRequest();
        post("/webhook/telegram/bad$agent", null)
                .expectStatus().isBadRequest();
    }

    @Test
    void shouldRejectMalformedUpdate() {
        when(receiver.acceptWebhook(eq("s3cret"), any()))
                .thenThrow(new IllegalArgumentException("Malformed Telegram update: Unexpected character"));

        post("/webhook/telegram/agent-1", "s3cret")
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Malformed update");
    }

    @Test
    void shouldAnswerTooManyRequestsWhenQueueFull() {
        when(receiver.acceptWebhook(eq("s3cret"), any()))
                .thenThrow(new RateLimitedException("Event queue full for agent-1/telegram", Duration.ofSeconds(1)));

        post("/webhook/telegram/agent-1", "s3cret")
                .expectStatus().isEqualTo(429)
                .expectHeader().valueEquals("Retry-After", "1");
    }

    private WebTestClient.ResponseSpec post(String uri, String secret) {
        WebTestClient.RequestBodySpec request = webTestClient.post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_JSON);
        if (secret != null) {
            request = request.header(PlatformWebhookController.TELEGRAM_SECRET_HEADER, secret);
        }
        return request.bodyValue(UPDATE.getBytes(StandardCharsets.UTF_8)).exchange();
    }
}

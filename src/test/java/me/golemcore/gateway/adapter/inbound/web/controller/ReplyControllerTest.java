package me.golemcore.gateway.adapter.inbound.web.controller;

import me.golemcore.gateway.adapter.inbound.web.GlobalExceptionHandler;
import me.golemcore.gateway.adapter.inbound.web.dto.ReplyRequest;
import me.golemcore.gateway.domain.exception.PlatformRequestRejectedException;
import me.golemcore.gateway.domain.exception.RateLimitedException;
import me.golemcore.gateway.domain.exception.RoutingException;
import me.golemcore.gateway.domain.model.BindingKey;
import me.golemcore.gateway.domain.model.Platform;
import me.golemcore.gateway.domain.model.SendAck;
import me.golemcore.gateway.domain.service.OutboundDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ReplyControllerTest {

    private OutboundDispatcher dispatcher;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        dispatcher = mock(OutboundDispatcher.class);
        webTestClient = WebTestClient.bindToController(new ReplyController(dispatcher))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void shouldDispatchReply() {
        when(dispatcher.dispatch("agent-1", Platform.TELEGRAM, "42", "hi")).thenReturn(new SendAck("42:9", 1));

        webTestClient.post()
                .uri("/api/replies")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"agent_id\":\"agent-1\",\"platform\":\"telegram\",\"external_chat_id\":\"42\","
                        + "\"content\":\"hi\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.message_id").isEqualTo("42:9")
                .jsonPath("$.chunks").isEqualTo(1);
    }

    @Test
    void shouldMapRoutingFailureToServiceUnavailable() {
        when(dispatcher.dispatch("agent-1", Platform.DISCORD, "123", "hi"))
                .thenThrow(new RoutingException(BindingKey.of("agent-1", Platform.DISCORD),
                        "No live connection for agent-1/discord"));

        webTestClient.post()
                .uri("/api/replies")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new ReplyRequest("agent-1", "discord", "123", "hi"))
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.status").isEqualTo(503)
                .jsonPath("$.message").isEqualTo("No live connection for agent-1/discord");
    }

    @Test
    void shouldMapRateLimitToTooManyRequests() {
        when(dispatcher.dispatch("agent-1", Platform.DISCORD, "123", "hi"))
                .thenThrow(new RateLimitedException("Send rate exceeded", Duration.ofMillis(1500)));

        webTestClient.post()
                .uri("/api/replies")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new ReplyRequest("agent-1", "discord", "123", "hi"))
                .exchange()
                .expectStatus().isEqualTo(429)
                .expectHeader().valueEquals("Retry-After", "2");
    }

    @Test
    void shouldMapPlatformRejectionToBadGateway() {
        when(dispatcher.dispatch("agent-1", Platform.DISCORD, "123", "hi"))
                .thenThrow(new PlatformRequestRejectedException("Unknown Channel", 404));

        webTestClient.post()
                .uri("/api/replies")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new ReplyRequest("agent-1", "discord", "123", "hi"))
                .exchange()
                .expectStatus().isEqualTo(502);
    }

    @Test
    void shouldRejectUnknownPlatform() {
        webTestClient.post()
                .uri("/api/replies")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new ReplyRequest("agent-1", "matrix", "123", "hi"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Unknown platform: matrix");
    }
}

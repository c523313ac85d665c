package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.exception.RoutingException;
import me.golemcore.gateway.domain.model.BindingKey;
import me.golemcore.gateway.domain.model.DeadLetter;
import me.golemcore.gateway.domain.model.Direction;
import me.golemcore.gateway.domain.model.FailureKind;
import me.golemcore.gateway.domain.model.MessageEnvelope;
import me.golemcore.gateway.domain.model.Platform;
import me.golemcore.gateway.domain.model.ReasoningReplyEvent;
import me.golemcore.gateway.domain.model.SendAck;
import me.golemcore.gateway.port.outbound.DeadLetterPort;
import me.golemcore.gateway.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InlineReplyRelayTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private OutboundDispatcher dispatcher;
    private DeadLetterPort deadLetterPort;
    private InlineReplyRelay relay;
    private MessageEnvelope inbound;

    @BeforeEach
    void setUp() {
        dispatcher = mock(OutboundDispatcher.class);
        deadLetterPort = mock(DeadLetterPort.class);
        relay = new InlineReplyRelay(dispatcher, deadLetterPort, new MutableClock(NOW));
        inbound = MessageEnvelope.builder()
                .platform(Platform.TELEGRAM)
                .agentId("agent-1")
                .externalChatId("42")
                .externalMessageId("42:7")
                .content("hello")
                .direction(Direction.INBOUND)
                .timestamp(NOW)
                .build();
    }

    @Test
    void shouldSendReplyToOriginatingChat() {
        when(dispatcher.dispatch("agent-1", Platform.TELEGRAM, "42", "hi back")).thenReturn(new SendAck("42:8", 1));

        relay.onReply(new ReasoningReplyEvent(inbound, "hi back"));

        verify(dispatcher).dispatch("agent-1", Platform.TELEGRAM, "42", "hi back");
        verify(deadLetterPort, never()).write(any());
    }

    @Test
    void shouldDeadLetterOutboundEnvelopeWhenRoutingFails() {
        when(dispatcher.dispatch("agent-1", Platform.TELEGRAM, "42", "hi back"))
                .thenThrow(new RoutingException(BindingKey.of("agent-1", Platform.TELEGRAM), "No live connection"));

        relay.onReply(new ReasoningReplyEvent(inbound, "hi back"));

        ArgumentCaptor<DeadLetter> captor = ArgumentCaptor.forClass(DeadLetter.class);
        verify(deadLetterPort).write(captor.capture());
        DeadLetter deadLetter = captor.getValue();
        assertEquals(FailureKind.ROUTING, deadLetter.getFailureKind());
        assertEquals(Direction.OUTBOUND, deadLetter.getEnvelope().getDirection());
        assertEquals("hi back", deadLetter.getEnvelope().getContent());
        assertEquals("42:7", deadLetter.getEnvelope().getMetadata().get("in_reply_to"));
    }
}

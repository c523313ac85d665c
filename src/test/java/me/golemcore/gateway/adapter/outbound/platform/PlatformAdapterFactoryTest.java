package me.golemcore.gateway.adapter.outbound.platform;

import me.golemcore.gateway.adapter.outbound.discord.DiscordGatewayAdapter;
import me.golemcore.gateway.adapter.outbound.telegram.TelegramWebhookAdapter;
import me.golemcore.gateway.domain.exception.CredentialInvalidException;
import me.golemcore.gateway.domain.model.BindingKey;
import me.golemcore.gateway.domain.model.Platform;
import me.golemcore.gateway.domain.model.Secret;
import me.golemcore.gateway.domain.model.TransportStyle;
import me.golemcore.gateway.infrastructure.config.AutoConfiguration;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.inbound.ConnectionContext;
import me.golemcore.gateway.port.inbound.PlatformAdapter;
import me.golemcore.gateway.port.inbound.WebhookReceiver;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.telegram.telegrambots.meta.api.methods.GetMe;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PlatformAdapterFactoryTest {

    private static final String TOKEN = "123456789:AAHdqTcvCH1vGWJxfSeofSAs0K5PALDsawQ";

    private PlatformAdapterFactory factory;

    @BeforeEach
    void setUp() {
        GatewayProperties properties = new GatewayProperties();
        properties.getSupervisor().setSendTimeout(Duration.ofSeconds(7));
        properties.getSupervisor().setEventQueueCapacity(42);
        factory = new PlatformAdapterFactory(new OkHttpClient(), AutoConfiguration.objectMapper(), properties);
    }

    @AfterEach
    void tearDown() {
        factory.shutdown();
    }

    @Test
    void shouldCreateActiveAdapterForDiscord() {
        PlatformAdapter adapter = factory.create(BindingKey.of("agent-1", Platform.DISCORD));

        assertInstanceOf(DiscordGatewayAdapter.class, adapter);
        assertEquals(TransportStyle.ACTIVE, adapter.getTransportStyle());
        assertFalse(adapter instanceof WebhookReceiver);
    }

    @Test
    void shouldCreatePassiveAdapterForTelegram() {
        PlatformAdapter adapter = factory.create(BindingKey.of("agent-1", Platform.TELEGRAM));

        assertInstanceOf(TelegramWebhookAdapter.class, adapter);
        assertEquals(TransportStyle.PASSIVE, adapter.getTransportStyle());
        assertInstanceOf(WebhookReceiver.class, adapter);
    }

    @Test
    void shouldBuildTelegramClientWithBindingToken() throws Exception {
        TelegramClient telegramClient = mock(TelegramClient.class);
        TelegramApiRequestException unauthorized = mock(TelegramApiRequestException.class);
        when(unauthorized.getErrorCode()).thenReturn(401);
        when(telegramClient.execute(any(GetMe.class))).thenThrow(unauthorized);
        List<String> tokens = new ArrayList<>();
        factory.setTelegramClientFactory(token -> {
            tokens.add(token);
            return telegramClient;
        });
        BindingKey key = BindingKey.of("agent-1", Platform.TELEGRAM);
        PlatformAdapter adapter = factory.create(key);

        assertThrows(CredentialInvalidException.class,
                () -> adapter.connect(new ConnectionContext(key, 1), Secret.of(TOKEN)));
        assertEquals(List.of(TOKEN), tokens);
    }

    @Test
    void shouldCreateFreshInstanceForEveryAttempt() {
        BindingKey key = BindingKey.of("agent-1", Platform.DISCORD);

        assertNotSame(factory.create(key), factory.create(key));
    }

    @Test
    void shouldShareRuntimeSettings() {
        AdapterRuntime runtime = factory.getRuntime();

        assertEquals(Duration.ofSeconds(7), runtime.sendTimeout());
        assertEquals(42, runtime.eventQueueCapacity());
        assertEquals(42, factory.create(BindingKey.of("agent-1", Platform.TELEGRAM)).events().remainingCapacity());
    }
}

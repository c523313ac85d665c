package me.golemcore.gateway.adapter.outbound.reasoning;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.exception.ReasoningUnavailableException;
import me.golemcore.gateway.domain.model.MessageEnvelope;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.ReasoningPort;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Forwards inbound envelopes to the reasoning service with {@link WebClient}.
 *
 * <p>
 * 5xx answers, timeouts and connection failures are retried with exponential
 * backoff; 4xx answers are final. The call blocks its caller, which is the
 * per-chat lane of the inbound router, so receipt order within a chat holds.
 */
@Component
@Slf4j
public class ReasoningServiceClient implements ReasoningPort {

    private final WebClient webClient;
    private final GatewayProperties.ReasoningProperties settings;

    public ReasoningServiceClient(GatewayProperties properties) {
        this.settings = properties.getReasoning();
        this.webClient = WebClient.builder()
                .baseUrl(settings.getBaseUrl())
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(1024 * 1024))
                .build();
    }

    @Override
    public Optional<String> forward(MessageEnvelope envelope) {
        AtomicInteger attempts = new AtomicInteger();
        ReceiveMessageResponse response;
        try {
            response = buildForwardMono(envelope, attempts).block();
        } catch (RuntimeException e) {
            Throwable failure = Exceptions.isRetryExhausted(e) ? e.getCause() : Exceptions.unwrap(e);
            throw new ReasoningUnavailableException(
                    "Reasoning service failed for message " + envelope.getExternalMessageId() + ": "
                            + failure.getMessage(),
                    isRetryable(failure), attempts.get(), failure);
        }

        log.debug("[Reasoning] Forwarded message {} for {} after {} attempt(s)",
                envelope.getExternalMessageId(), envelope.bindingKey(), attempts.get());
        if (response == null || response.getResponse() == null || response.getResponse().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(response.getResponse());
    }

    protected Mono<ReceiveMessageResponse> buildForwardMono(MessageEnvelope envelope, AtomicInteger attempts) {
        ReceiveMessageRequest request = ReceiveMessageRequest.from(envelope);
        return Mono.defer(() -> {
            attempts.incrementAndGet();
            return webClient.post()
                    .uri(settings.getPath())
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(ReceiveMessageResponse.class)
                    .timeout(getRequestTimeout());
        })
                .retryWhen(buildRetry()
                        .filter(ReasoningServiceClient::isRetryable)
                        .doBeforeRetry(signal -> log.warn(
                                "[Reasoning] Retrying message {} for {} (attempt {}): {}",
                                envelope.getExternalMessageId(), envelope.bindingKey(),
                                signal.totalRetries() + 2, signal.failure().getMessage())));
    }

    protected Duration getRequestTimeout() {
        return settings.getTimeout();
    }

    protected RetryBackoffSpec buildRetry() {
        return Retry.backoff(settings.getMaxRetries(), settings.getInitialBackoff());
    }

    static boolean isRetryable(Throwable failure) {
        if (failure instanceof WebClientResponseException responseException) {
            return responseException.getStatusCode().is5xxServerError();
        }
        return failure instanceof TimeoutException || failure instanceof WebClientRequestException;
    }
}

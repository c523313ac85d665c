package me.golemcore.gateway.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.gateway.adapter.inbound.web.dto.ReplyRequest;
import me.golemcore.gateway.adapter.inbound.web.dto.ReplyResponse;
import me.golemcore.gateway.domain.model.Platform;
import me.golemcore.gateway.domain.model.SendAck;
import me.golemcore.gateway.domain.service.OutboundDispatcher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Asynchronous reply ingress for the reasoning service. Sending blocks on the
 * platform acknowledgement, so the work runs on the bounded elastic pool.
 */
@RestController
@RequestMapping("/api/replies")
@RequiredArgsConstructor
public class ReplyController {

    private final OutboundDispatcher dispatcher;

    @PostMapping
    public Mono<ResponseEntity<ReplyResponse>> sendReply(@RequestBody ReplyRequest request) {
        return Mono.fromCallable(() -> {
            SendAck ack = dispatcher.dispatch(request.getAgentId(), Platform.fromId(request.getPlatform()),
                    request.getExternalChatId(), request.getContent());
            return ResponseEntity.ok(ReplyResponse.builder()
                    .messageId(ack.externalMessageId())
                    .chunks(ack.chunks())
                    .build());
        }).subscribeOn(Schedulers.boundedElastic());
    }
}

package me.golemcore.gateway.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.DeadLetter;
import me.golemcore.gateway.port.outbound.DeadLetterPort;
import me.golemcore.gateway.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Appends dead letters to {@code dead-letter/{yyyy-MM-dd}.jsonl} (UTC days).
 */
@Component
@Slf4j
public class LocalDeadLetterAdapter implements DeadLetterPort {

    private static final String DIRECTORY = "dead-letter";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AtomicLong written = new AtomicLong();

    public LocalDeadLetterAdapter(StoragePort storagePort, ObjectMapper objectMapper, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public synchronized void write(DeadLetter deadLetter) {
        String line;
        try {
            line = objectMapper.writeValueAsString(deadLetter) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize dead letter", e);
        }
        String file = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC) + ".jsonl";
        storagePort.appendText(DIRECTORY, file, line).join();
        written.incrementAndGet();
        log.error("[DeadLetter] {} message {} for {}/{}: {}", deadLetter.getEnvelope().getDirection(),
                deadLetter.getEnvelope().getExternalMessageId(), deadLetter.getEnvelope().getAgentId(),
                deadLetter.getEnvelope().getPlatform(), deadLetter.getReason());
    }

    @Override
    public long count() {
        return written.get();
    }
}

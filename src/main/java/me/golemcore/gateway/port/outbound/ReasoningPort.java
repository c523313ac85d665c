package me.golemcore.gateway.port.outbound;

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

import me.golemcore.gateway.domain.exception.ReasoningUnavailableException;
import me.golemcore.gateway.domain.model.MessageEnvelope;

import java.util.Optional;

/**
 * Port for the external reasoning service that answers chat messages.
 */
public interface ReasoningPort {

    /**
     * Forward an inbound envelope, retrying transient failures.
     *
     * @return reply text when the service answered inline, empty when the reply
     *         will arrive asynchronously
     * @throws ReasoningUnavailableException
     *             once retries are exhausted or the request was refused
     */
    Optional<String> forward(MessageEnvelope envelope);
}

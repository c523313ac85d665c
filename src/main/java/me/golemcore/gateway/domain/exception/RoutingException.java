package me.golemcore.gateway.domain.exception;

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

import me.golemcore.gateway.domain.model.BindingKey;
import me.golemcore.gateway.domain.model.FailureKind;

/**
 * No live connection exists for a reply's routing key. The caller owns retry
 * and persistence of the reply.
 */
public class RoutingException extends PlatformException {

    private static final long serialVersionUID = 1L;

    private final transient BindingKey key;

    public RoutingException(BindingKey key, String message) {
        super(message);
        this.key = key;
    }

    public RoutingException(BindingKey key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public BindingKey getKey() {
        return key;
    }

    @Override
    public FailureKind getFailureKind() {
        return FailureKind.ROUTING;
    }
}

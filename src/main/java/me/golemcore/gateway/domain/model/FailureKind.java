package me.golemcore.gateway.domain.model;

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

/**
 * Classification of connection and delivery failures.
 */
public enum FailureKind {

    /** Platform rejected the credentials. Never retried automatically. */
    CREDENTIAL_INVALID(true),

    /** Disconnects and timeouts. Retried with backoff. */
    TRANSIENT_NETWORK(false),

    /** Platform asked us to slow down. */
    RATE_LIMITED(false),

    /** Platform refused one request, e.g. unknown chat or missing permission. */
    REQUEST_REJECTED(false),

    /** No live connection for the routing key. */
    ROUTING(false),

    /** Unexpected crash inside an adapter, contained to its connection. */
    ADAPTER_CRASH(false);

    private final boolean permanent;

    FailureKind(boolean permanent) {
        this.permanent = permanent;
    }

    public boolean isPermanent() {
        return permanent;
    }
}

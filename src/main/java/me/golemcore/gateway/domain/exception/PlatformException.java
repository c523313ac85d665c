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

import me.golemcore.gateway.domain.model.FailureKind;

/**
 * Base class of connection and delivery failures. Each subclass fixes its
 * {@link FailureKind}, which drives retry decisions in the supervisor and the
 * HTTP status in the REST layer.
 */
public abstract class PlatformException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected PlatformException(String message) {
        super(message);
    }

    protected PlatformException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract FailureKind getFailureKind();

    public boolean isPermanent() {
        return getFailureKind().isPermanent();
    }
}

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
 * Platform refused a single request (unknown chat, missing permission, bad
 * payload). The connection itself stays healthy.
 */
public class PlatformRequestRejectedException extends PlatformException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;

    public PlatformRequestRejectedException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public FailureKind getFailureKind() {
        return FailureKind.REQUEST_REJECTED;
    }
}

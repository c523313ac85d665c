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

/**
 * Forwarding to the reasoning service failed.
 *
 * <p>
 * {@code retryable} is false for 4xx answers, which are dead-lettered without
 * further attempts.
 */
public class ReasoningUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final boolean retryable;
    private final int attempts;

    public ReasoningUnavailableException(String message, boolean retryable, int attempts, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
        this.attempts = attempts;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public int getAttempts() {
        return attempts;
    }
}

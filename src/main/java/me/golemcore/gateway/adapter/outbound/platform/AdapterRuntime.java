package me.golemcore.gateway.adapter.outbound.platform;

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

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Shared threads and limits handed to every adapter instance.
 *
 * @param ioExecutor
 *            runs blocking platform calls (sends, health checks)
 * @param scheduler
 *            runs timers such as gateway heartbeats
 * @param sendTimeout
 *            upper bound for one {@code send}
 * @param eventQueueCapacity
 *            bound of each adapter's inbound queue
 */
public record AdapterRuntime(ExecutorService ioExecutor, ScheduledExecutorService scheduler,
        Duration sendTimeout, int eventQueueCapacity) {
}

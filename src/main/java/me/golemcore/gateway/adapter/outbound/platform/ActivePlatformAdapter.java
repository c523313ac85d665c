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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.BindingKey;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Adapter variant for platforms reached over a persistent socket.
 *
 * <p>
 * Subclasses report the state of their read loop. Once the loop terminates
 * the adapter is unhealthy for good; the supervisor replaces it with a fresh
 * instance.
 */
@Slf4j
public abstract class ActivePlatformAdapter extends AbstractPlatformAdapter {

    private final AtomicBoolean readLoopAlive = new AtomicBoolean();
    private volatile String terminationReason;

    protected ActivePlatformAdapter(BindingKey key, AdapterRuntime runtime) {
        super(key, runtime);
    }

    public boolean isReadLoopAlive() {
        return readLoopAlive.get();
    }

    public String getTerminationReason() {
        return terminationReason;
    }

    protected void markReadLoopStarted() {
        terminationReason = null;
        readLoopAlive.set(true);
    }

    protected void markReadLoopTerminated(String reason) {
        terminationReason = reason;
        if (readLoopAlive.getAndSet(false) && !isReleased()) {
            log.warn("[{}] Read loop for {} terminated: {}", getPlatform(), key, reason);
        }
    }

    @Override
    protected boolean doHealthCheck(Duration timeout) {
        return readLoopAlive.get() && isSessionHealthy();
    }

    /**
     * Extra liveness signal beyond a running read loop, e.g. recent heartbeat
     * acknowledgements.
     */
    protected abstract boolean isSessionHealthy();
}

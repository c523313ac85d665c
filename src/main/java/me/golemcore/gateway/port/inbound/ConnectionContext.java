package me.golemcore.gateway.port.inbound;

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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Cancellation scope of one connection attempt and the live session that
 * follows it.
 *
 * <p>
 * Adapters register hooks with {@link #onCancel(Runnable)} to unblock pending
 * connects and abort in-flight sends. A hook registered after cancellation
 * runs immediately. Each hook runs at most once.
 */
@Slf4j
public final class ConnectionContext {

    private final BindingKey key;
    private final long version;
    private final Object lock = new Object();
    private final List<Runnable> hooks = new ArrayList<>();
    private volatile boolean cancelled;

    public ConnectionContext(BindingKey key, long version) {
        this.key = key;
        this.version = version;
    }

    public BindingKey getKey() {
        return key;
    }

    public long getVersion() {
        return version;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException("Connection context cancelled for " + key);
        }
    }

    public void onCancel(Runnable hook) {
        synchronized (lock) {
            if (!cancelled) {
                hooks.add(hook);
                return;
            }
        }
        runHook(hook);
    }

    public void cancel() {
        List<Runnable> toRun;
        synchronized (lock) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(hooks);
            hooks.clear();
        }
        for (Runnable hook : toRun) {
            runHook(hook);
        }
    }

    private void runHook(Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            log.warn("[Supervisor] Cancel hook failed for {}: {}", key, e.getMessage(), e);
        }
    }
}

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
 * One mutation of the tenant registry.
 *
 * <p>
 * Delivered at-least-once; {@code (key, version)} identifies the change.
 * {@code binding} is {@code null} for removals.
 */
public record BindingChangeEvent(Type type, BindingKey key, AgentBotBinding binding, long version) {

    public enum Type {
        UPSERTED, REMOVED
    }

    public static BindingChangeEvent upserted(AgentBotBinding binding) {
        return new BindingChangeEvent(Type.UPSERTED, binding.getKey(), binding, binding.getVersion());
    }

    public static BindingChangeEvent removed(BindingKey key, long version) {
        return new BindingChangeEvent(Type.REMOVED, key, null, version);
    }
}

package me.golemcore.gateway.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.AgentBotBinding;
import me.golemcore.gateway.domain.model.BindingKey;
import me.golemcore.gateway.port.outbound.BindingStorePort;
import me.golemcore.gateway.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps each binding in {@code bindings/{agentId}/{platform}.json}.
 *
 * <p>
 * Writes are atomic; a corrupt file is logged and skipped on load so one bad
 * record cannot keep every other tenant offline.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalBindingStoreAdapter implements BindingStorePort {

    private static final String DIRECTORY = "bindings";
    private static final String EXTENSION = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    @Override
    public List<AgentBotBinding> loadAll() {
        List<String> files = storagePort.listObjects(DIRECTORY, "").join();
        List<AgentBotBinding> bindings = new ArrayList<>();
        for (String file : files) {
            if (!file.endsWith(EXTENSION)) {
                continue;
            }
            String json = storagePort.getText(DIRECTORY, file).join();
            if (json == null) {
                continue;
            }
            try {
                bindings.add(objectMapper.readValue(json, AgentBotBinding.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.error("[Registry] Skipping unreadable binding file {}: {}", file, e.getMessage());
            }
        }
        return bindings;
    }

    @Override
    public void save(AgentBotBinding binding) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(binding);
            storagePort.putTextAtomic(DIRECTORY, pathOf(binding.getKey()), json).join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize binding " + binding.getKey(), e);
        }
    }

    @Override
    public void delete(BindingKey key) {
        storagePort.deleteObject(DIRECTORY, pathOf(key)).join();
    }

    private static String pathOf(BindingKey key) {
        return key.agentId() + "/" + key.platform().getId() + EXTENSION;
    }
}

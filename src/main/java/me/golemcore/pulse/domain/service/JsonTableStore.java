package me.golemcore.pulse.domain.service;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.pulse.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hands out {@link JsonTable} views over {@link StoragePort}. All views of the
 * same document share one writer lock, so two services mutating
 * {@code agent_actions/acme.json} never interleave.
 */
@Component
public class JsonTableStore {

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Map<String, ReentrantLock> documentLocks = new ConcurrentHashMap<>();

    public JsonTableStore(StoragePort storagePort, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
    }

    public <T> JsonTable<T> table(String name, Class<T> rowType) {
        return new JsonTable<>(name, rowType, storagePort, objectMapper, this);
    }

    ReentrantLock lockFor(String table, String document) {
        return documentLocks.computeIfAbsent(table + "/" + document, key -> new ReentrantLock());
    }
}

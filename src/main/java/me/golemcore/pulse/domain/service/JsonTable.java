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

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.port.outbound.StoragePort;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A table of rows of one type, stored as one JSON array per tenant under
 * {@code <table>/<tenantId>.json}. Global rows use the {@link #GLOBAL}
 * document.
 *
 * <p>
 * Nothing is cached: every read and every mutation starts from the stored
 * document, which stays the source of truth. Mutations of one document are
 * serialized and written atomically.
 *
 * @param <T>
 *            row type
 */
@Slf4j
public class JsonTable<T> {

    public static final String GLOBAL = "_global";
    private static final String SUFFIX = ".json";

    private final String name;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final JsonTableStore store;
    private final JavaType listType;

    JsonTable(String name, Class<T> rowType, StoragePort storagePort, ObjectMapper objectMapper,
            JsonTableStore store) {
        this.name = name;
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.store = store;
        this.listType = objectMapper.getTypeFactory().constructCollectionType(List.class, rowType);
    }

    public String getName() {
        return name;
    }

    /**
     * All rows of one document. A missing or unreadable document yields an empty
     * list.
     */
    public List<T> read(String tenantId) {
        try {
            return readStrict(tenantId);
        } catch (RuntimeException e) { // NOSONAR - intentionally catch all for read fallback
            log.warn("[Storage] Failed to read {}/{}: {}", name, tenantId, e.getMessage());
            return new ArrayList<>();
        }
    }

    /**
     * Re-read the document, apply {@code mutation} to the mutable row list and
     * write the result back. Returns whatever the mutation returns.
     */
    public <R> R mutate(String tenantId, Function<List<T>, R> mutation) {
        ReentrantLock lock = store.lockFor(name, tenantId);
        lock.lock();
        try {
            List<T> rows = readStrict(tenantId);
            R result = mutation.apply(rows);
            write(tenantId, rows);
            return result;
        } finally {
            lock.unlock();
        }
    }

    public T append(String tenantId, T row) {
        return mutate(tenantId, rows -> {
            rows.add(row);
            return row;
        });
    }

    /**
     * Tenants that currently own a document in this table.
     */
    public List<String> tenants() {
        try {
            List<String> files = storagePort.listObjects(name, "").join();
            return files.stream()
                    .filter(file -> file.endsWith(SUFFIX))
                    .map(file -> file.substring(0, file.length() - SUFFIX.length()))
                    .filter(tenant -> !GLOBAL.equals(tenant))
                    .toList();
        } catch (RuntimeException e) { // NOSONAR - intentionally catch all for listing fallback
            log.warn("[Storage] Failed to list {}: {}", name, e.getMessage());
            return List.of();
        }
    }

    /**
     * Tenant owning the first row that matches, searching every document.
     */
    public Optional<String> findTenant(Predicate<T> predicate) {
        for (String tenant : tenants()) {
            if (read(tenant).stream().anyMatch(predicate)) {
                return Optional.of(tenant);
            }
        }
        return Optional.empty();
    }

    public Optional<T> findAny(Predicate<T> predicate) {
        for (String tenant : tenants()) {
            Optional<T> row = read(tenant).stream().filter(predicate).findFirst();
            if (row.isPresent()) {
                return row;
            }
        }
        return Optional.empty();
    }

    public void delete(String tenantId) {
        ReentrantLock lock = store.lockFor(name, tenantId);
        lock.lock();
        try {
            storagePort.deleteObject(name, tenantId + SUFFIX).join();
        } finally {
            lock.unlock();
        }
    }

    private List<T> readStrict(String tenantId) {
        String json = storagePort.getText(name, tenantId + SUFFIX).join();
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            List<T> rows = objectMapper.readValue(json, listType);
            return rows != null ? new ArrayList<>(rows) : new ArrayList<>();
        } catch (IOException e) {
            throw new IllegalStateException("Corrupted document " + name + "/" + tenantId + ": " + e.getMessage(), e);
        }
    }

    private void write(String tenantId, List<T> rows) {
        try {
            String json = objectMapper.writeValueAsString(rows);
            storagePort.putTextAtomic(name, tenantId + SUFFIX, json, false).join();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize " + name + "/" + tenantId, e);
        }
    }
}

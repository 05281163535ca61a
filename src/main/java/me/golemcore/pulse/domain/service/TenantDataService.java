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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Cascade delete of everything stored for a tenant. Rule-sets are global and
 * are left alone.
 */
@Service
@Slf4j
public class TenantDataService {

    private final JsonTableStore tableStore;

    public TenantDataService(JsonTableStore tableStore) {
        this.tableStore = tableStore;
    }

    public void purge(String tenantId) {
        if (tenantId == null || tenantId.isBlank() || JsonTable.GLOBAL.equals(tenantId)) {
            throw new IllegalArgumentException("Invalid tenant id: " + tenantId);
        }
        for (String table : PulseTables.TENANT_SCOPED) {
            tableStore.table(table, Object.class).delete(tenantId);
        }
        log.info("[Storage] Purged all data of tenant {}", tenantId);
    }
}

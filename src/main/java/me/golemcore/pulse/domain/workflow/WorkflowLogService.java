package me.golemcore.pulse.domain.workflow;

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

import me.golemcore.pulse.domain.model.WorkflowLog;
import me.golemcore.pulse.domain.model.WorkflowLog.Level;
import me.golemcore.pulse.domain.model.WorkflowRun;
import me.golemcore.pulse.domain.service.JsonTable;
import me.golemcore.pulse.domain.service.JsonTableStore;
import me.golemcore.pulse.domain.service.PulseTables;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only replay log of workflow runs, ordered per run by sequence.
 */
@Service
public class WorkflowLogService {

    private final JsonTable<WorkflowLog> logs;
    private final Clock clock;

    public WorkflowLogService(JsonTableStore tableStore, Clock clock) {
        this.logs = tableStore.table(PulseTables.WORKFLOW_LOGS, WorkflowLog.class);
        this.clock = clock;
    }

    public WorkflowLog append(WorkflowRun run, String nodeId, Level level, String message) {
        return append(run, nodeId, level, message, Map.of());
    }

    public WorkflowLog append(WorkflowRun run, String nodeId, Level level, String message,
            Map<String, Object> metadata) {
        return logs.mutate(run.getTenantId(), rows -> {
            long sequence = rows.stream()
                    .filter(entry -> run.getId().equals(entry.getRunId()))
                    .mapToLong(WorkflowLog::getSequence)
                    .max()
                    .orElse(0L) + 1;
            WorkflowLog entry = WorkflowLog.builder()
                    .id(UUID.randomUUID().toString())
                    .runId(run.getId())
                    .tenantId(run.getTenantId())
                    .nodeId(nodeId)
                    .level(level)
                    .message(message)
                    .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
                    .timestamp(clock.instant())
                    .sequence(sequence)
                    .build();
            rows.add(entry);
            return entry;
        });
    }

    public List<WorkflowLog> list(String tenantId, String runId) {
        return logs.read(tenantId).stream()
                .filter(entry -> runId.equals(entry.getRunId()))
                .sorted(Comparator.comparingLong(WorkflowLog::getSequence))
                .toList();
    }
}

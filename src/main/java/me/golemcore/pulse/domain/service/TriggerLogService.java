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
import me.golemcore.pulse.domain.model.AgentAction;
import me.golemcore.pulse.domain.model.TriggerLog;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Append-mostly store for {@code trigger_logs}. A log row follows the action
 * it created through approval and execution.
 */
@Service
@Slf4j
public class TriggerLogService {

    private final JsonTable<TriggerLog> logs;
    private final Clock clock;

    public TriggerLogService(JsonTableStore tableStore, Clock clock) {
        this.logs = tableStore.table(PulseTables.TRIGGER_LOGS, TriggerLog.class);
        this.clock = clock;
    }

    public TriggerLog record(TriggerLog entry) {
        if (entry.getId() == null) {
            entry.setId(UUID.randomUUID().toString());
        }
        if (entry.getTriggeredAt() == null) {
            entry.setTriggeredAt(clock.instant());
        }
        return logs.append(entry.getTenantId(), entry);
    }

    public List<TriggerLog> list(String tenantId, String ruleId, int limit) {
        return logs.read(tenantId).stream()
                .filter(entry -> ruleId == null || ruleId.equals(entry.getRuleId()))
                .sorted(Comparator.comparing(TriggerLog::getTriggeredAt,
                        Comparator.nullsLast(Comparator.naturalOrder())).reversed())
                .limit(Math.max(1, limit))
                .toList();
    }

    /**
     * Fire times of a rule that count against its daily cap (everything but
     * SKIPPED).
     */
    public List<Instant> firedAt(String tenantId, String ruleId) {
        return logs.read(tenantId).stream()
                .filter(entry -> ruleId.equals(entry.getRuleId()))
                .filter(entry -> entry.getStatus() != TriggerLog.Status.SKIPPED)
                .map(TriggerLog::getTriggeredAt)
                .toList();
    }

    /**
     * Mirror an action's status onto the log row that created it.
     */
    public void syncWithAction(AgentAction action) {
        if (action.getSource() != AgentAction.Source.TRIGGER) {
            return;
        }
        TriggerLog.Status status = switch (action.getStatus()) {
            case PENDING_APPROVAL -> TriggerLog.Status.AWAITING_APPROVAL;
            case APPROVED -> TriggerLog.Status.APPROVED;
            case REJECTED, EXPIRED -> TriggerLog.Status.REJECTED;
            case PENDING, EXECUTING -> TriggerLog.Status.EXECUTING;
            case COMPLETED -> TriggerLog.Status.COMPLETED;
            case FAILED -> TriggerLog.Status.FAILED;
        };
        Instant now = clock.instant();
        logs.mutate(action.getTenantId(), rows -> {
            rows.stream()
                    .filter(entry -> action.getId().equals(entry.getActionId()))
                    .forEach(entry -> {
                        entry.setStatus(status);
                        entry.setError(action.getError());
                        if (action.getStatus().isTerminal()) {
                            entry.setCompletedAt(now);
                        }
                    });
            return null;
        });
        log.debug("[Triggers] Log for action {} now {}", action.getId(), status);
    }
}

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

import me.golemcore.pulse.domain.exception.NotFoundException;
import me.golemcore.pulse.domain.model.EvaluationResult;
import me.golemcore.pulse.domain.model.EvaluationResult.ResultType;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only heartbeat ledger. The only change a row ever sees is the
 * founder acknowledging an escalation. Suppression limits and the pulse
 * dashboard are computed from these rows.
 */
@Service
public class HeartbeatLedgerService {

    private static final Comparator<EvaluationResult> NEWEST_FIRST = Comparator
            .comparing(EvaluationResult::getTimestamp, Comparator.nullsLast(Comparator.naturalOrder()))
            .reversed();

    private final JsonTable<EvaluationResult> ledger;

    private final Clock clock;

    public HeartbeatLedgerService(JsonTableStore tableStore, Clock clock) {
        this.ledger = tableStore.table(PulseTables.HEARTBEAT_LEDGER, EvaluationResult.class);
        this.clock = clock;
    }

    public EvaluationResult append(EvaluationResult result) {
        if (result.getId() == null) {
            result.setId(UUID.randomUUID().toString());
        }
        return ledger.append(result.getTenantId(), result);
    }

    /**
     * All rows of a tenant, newest first.
     */
    public List<EvaluationResult> list(String tenantId) {
        return ledger.read(tenantId).stream().sorted(NEWEST_FIRST).toList();
    }

    public List<EvaluationResult> timeline(String tenantId, ResultType resultType, int limit) {
        return ledger.read(tenantId).stream()
                .filter(row -> resultType == null || row.getResultType() == resultType)
                .sorted(NEWEST_FIRST)
                .limit(Math.max(1, limit))
                .toList();
    }

    /**
     * Short "TYPE: summary" lines of the latest rows for one rule-set, newest
     * first. Fed back to the decision function as memory.
     */
    public List<String> recentSummaries(String tenantId, String ruleSetId, int count) {
        if (count <= 0) {
            return List.of();
        }
        return ledger.read(tenantId).stream()
                .filter(row -> ruleSetId.equals(row.getRuleSetId()))
                .filter(row -> row.getResultType() != ResultType.SKIPPED)
                .sorted(NEWEST_FIRST)
                .limit(count)
                .map(row -> row.getTimestamp() + " " + row.getResultType() + ": " + row.getSummary())
                .toList();
    }

    /**
     * Times a check fired (INSIGHT, ACTION or ESCALATION) for a tenant and
     * rule-set.
     */
    public List<Instant> firedAt(String tenantId, String ruleSetId, String check) {
        return ledger.read(tenantId).stream()
                .filter(row -> ruleSetId.equals(row.getRuleSetId()))
                .filter(row -> check != null && check.equals(row.getTriggeredCheck()))
                .filter(row -> isFired(row.getResultType()))
                .map(EvaluationResult::getTimestamp)
                .toList();
    }

    public Optional<Instant> lastFiredAt(String tenantId, String ruleSetId, String check) {
        return firedAt(tenantId, ruleSetId, check).stream().max(Comparator.naturalOrder());
    }

    /**
     * Record the founder's acknowledgment of an escalation. Idempotent: the
     * first acknowledgment is kept.
     */
    public EvaluationResult acknowledge(String tenantId, String resultId, String actor) {
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("Acknowledging actor is required");
        }
        Instant now = clock.instant();
        return ledger.mutate(tenantId, rows -> {
            EvaluationResult row = rows.stream()
                    .filter(candidate -> resultId.equals(candidate.getId()))
                    .findFirst()
                    .orElseThrow(() -> new NotFoundException("Ledger row", resultId));
            if (row.getResultType() != ResultType.ESCALATION) {
                throw new IllegalArgumentException("Only escalations can be acknowledged");
            }
            if (row.getAcknowledgedAt() == null) {
                row.setAcknowledgedAt(now);
                row.setAcknowledgedBy(actor);
            }
            return row;
        });
    }

    private static boolean isFired(ResultType type) {
        return type == ResultType.INSIGHT || type == ResultType.ACTION || type == ResultType.ESCALATION;
    }
}

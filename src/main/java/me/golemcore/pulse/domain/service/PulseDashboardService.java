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

import me.golemcore.pulse.domain.model.EvaluationResult;
import me.golemcore.pulse.domain.model.EvaluationResult.ResultType;
import me.golemcore.pulse.domain.model.PulseOverview;
import me.golemcore.pulse.domain.model.PulseOverview.AgentSummary;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read model over the heartbeat ledger for the founder dashboard.
 */
@Service
public class PulseDashboardService {

    private static final Duration WINDOW = Duration.ofHours(24);

    private final HeartbeatLedgerService ledgerService;
    private final Clock clock;

    public PulseDashboardService(HeartbeatLedgerService ledgerService, Clock clock) {
        this.ledgerService = ledgerService;
        this.clock = clock;
    }

    public PulseOverview pulse(String tenantId) {
        Instant cutoff = clock.instant().minus(WINDOW);
        List<EvaluationResult> rows = ledgerService.list(tenantId);

        Map<String, AgentSummary> byAgent = new TreeMap<>();
        for (EvaluationResult row : rows) {
            if (row.getTimestamp() == null || row.getTimestamp().isBefore(cutoff)) {
                continue;
            }
            String agentId = row.getAgentId() != null ? row.getAgentId() : "unknown";
            AgentSummary summary = byAgent.computeIfAbsent(agentId,
                    id -> AgentSummary.builder().agentId(id).build());
            summary.setTotalHeartbeats(summary.getTotalHeartbeats() + 1);
            count(summary, row.getResultType());
            if (summary.getLastHeartbeat() == null || row.getTimestamp().isAfter(summary.getLastHeartbeat())) {
                summary.setLastHeartbeat(row.getTimestamp());
            }
        }

        // pending escalations are not limited to the window
        int pendingEscalations = (int) rows.stream()
                .filter(row -> row.getResultType() == ResultType.ESCALATION)
                .filter(EvaluationResult::isFounderNotified)
                .filter(row -> row.getAcknowledgedAt() == null)
                .count();

        List<AgentSummary> agents = new ArrayList<>(byAgent.values());
        return PulseOverview.builder()
                .tenantId(tenantId)
                .totalHeartbeats24h(agents.stream().mapToInt(AgentSummary::getTotalHeartbeats).sum())
                .activeAgents(agents.size())
                .pendingEscalations(pendingEscalations)
                .totalInsights(agents.stream().mapToInt(AgentSummary::getInsightCount).sum())
                .agents(agents)
                .build();
    }

    /**
     * Ledger rows newest first. An unknown result type filter is ignored.
     */
    public List<EvaluationResult> timeline(String tenantId, String resultType, int limit) {
        ResultType filter = null;
        if (resultType != null && !resultType.isBlank()) {
            try {
                filter = ResultType.valueOf(resultType.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                filter = null;
            }
        }
        return ledgerService.timeline(tenantId, filter, limit);
    }

    private static void count(AgentSummary summary, ResultType type) {
        if (type == null) {
            return;
        }
        switch (type) {
            case OK -> summary.setOkCount(summary.getOkCount() + 1);
            case INSIGHT -> summary.setInsightCount(summary.getInsightCount() + 1);
            case ACTION -> summary.setActionCount(summary.getActionCount() + 1);
            case ESCALATION -> summary.setEscalationCount(summary.getEscalationCount() + 1);
            case SKIPPED -> summary.setSkippedCount(summary.getSkippedCount() + 1);
        }
    }
}

package me.golemcore.pulse.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Business pulse of one tenant over the last 24 hours.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PulseOverview {

    private String tenantId;
    private int totalHeartbeats24h;
    private int activeAgents;
    private int pendingEscalations;
    private int totalInsights;

    @Builder.Default
    private List<AgentSummary> agents = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AgentSummary {
        private String agentId;
        private int totalHeartbeats;
        private int okCount;
        private int insightCount;
        private int actionCount;
        private int escalationCount;
        private int skippedCount;
        private Instant lastHeartbeat;
    }
}

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An action proposed by a heartbeat, trigger or operator. Moves through the
 * approval state machine owned by
 * {@link me.golemcore.pulse.domain.service.ActionService}.
 *
 * <p>
 * {@code approved} stays {@code null} until a decision lands.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentAction {

    private String id;
    private String tenantId;
    private Source source;
    private String sourceId;
    private String agentId;
    private String actionType;
    private String category;
    private String title;

    @Builder.Default
    private Map<String, Object> payload = new LinkedHashMap<>();

    @Builder.Default
    private Status status = Status.PENDING;

    private boolean requiresApproval;
    private Boolean approved;
    private String approvedBy;
    private Instant approvedAt;
    private String decisionNote;
    private Instant expiresAt;
    private String result;
    private String error;
    private Instant createdAt;
    private Instant executedAt;
    private Instant completedAt;

    public enum Source {
        HEARTBEAT, TRIGGER, MANUAL
    }

    public enum Status {
        PENDING, PENDING_APPROVAL, APPROVED, REJECTED, EXPIRED, EXECUTING, COMPLETED, FAILED;

        public boolean isTerminal() {
            return this == REJECTED || this == EXPIRED || this == COMPLETED || this == FAILED;
        }
    }

    @JsonIgnore
    public boolean isApprovalSatisfied() {
        return !requiresApproval || Boolean.TRUE.equals(approved);
    }
}

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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Review request created when a run reaches a {@code human} node. The run
 * stays WAITING_APPROVAL until this approval is decided or expires.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowApproval {

    private String id;
    private String runId;
    private String workflowId;
    private String tenantId;
    private String nodeId;
    private String nodeLabel;
    private String description;

    @Builder.Default
    private Map<String, Object> content = new LinkedHashMap<>();

    @Builder.Default
    private String priority = "medium";

    @Builder.Default
    private Status status = Status.PENDING;

    private String decisionBy;
    private String decisionFeedback;
    private Instant decidedAt;
    private Instant expiresAt;
    private Instant createdAt;

    public enum Status {
        PENDING, APPROVED, REJECTED, EXPIRED
    }
}

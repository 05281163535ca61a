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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One execution of a workflow. Carries its own copy of the graph and the
 * context accumulated by executed nodes. Exactly one node is current at a
 * time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowRun {

    private String id;
    private String workflowId;
    private String tenantId;

    @Builder.Default
    private Status status = Status.PENDING;

    private String currentNodeId;
    private String triggeredBy;

    @Builder.Default
    private List<WorkflowNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<WorkflowEdge> edges = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> inputs = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> context = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> outputs = new LinkedHashMap<>();

    private String errorMessage;
    private String errorNodeId;
    private int nodeExecutions;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;

    public enum Status {
        PENDING, RUNNING, WAITING_APPROVAL, COMPLETED, FAILED, CANCELLED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED || this == CANCELLED;
        }
    }

    @JsonIgnore
    public Optional<WorkflowNode> findNode(String nodeId) {
        return nodes.stream().filter(node -> node.getId().equals(nodeId)).findFirst();
    }

    @JsonIgnore
    public List<WorkflowEdge> outgoingEdges(String nodeId) {
        return edges.stream().filter(edge -> nodeId.equals(edge.getSource())).toList();
    }
}

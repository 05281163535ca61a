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
 * A workflow definition: typed nodes connected by optionally conditional
 * edges. Runs copy {@code nodes} and {@code edges} at start, so editing a
 * definition never affects a run in flight.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Workflow {

    private String id;
    private String tenantId;
    private String name;
    private String description;

    @Builder.Default
    private List<WorkflowNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<WorkflowEdge> edges = new ArrayList<>();

    @Builder.Default
    private TriggerType triggerType = TriggerType.MANUAL;

    @Builder.Default
    private Map<String, Object> triggerConfig = new LinkedHashMap<>();

    private String webhookKey;

    @Builder.Default
    private Status status = Status.DRAFT;

    private int runCount;
    private int successCount;
    private Instant lastRunAt;
    private Instant nextScheduledAt;
    private Instant createdAt;
    private Instant updatedAt;

    public enum Status {
        DRAFT, ACTIVE, PAUSED, ARCHIVED
    }

    public enum TriggerType {
        MANUAL, WEBHOOK, SCHEDULE
    }

    @JsonIgnore
    public Optional<WorkflowNode> findNode(String nodeId) {
        return nodes.stream().filter(node -> node.getId().equals(nodeId)).findFirst();
    }
}

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.exception.InvalidTransitionException;
import me.golemcore.pulse.domain.exception.NotFoundException;
import me.golemcore.pulse.domain.model.Workflow;
import me.golemcore.pulse.domain.model.Workflow.Status;
import me.golemcore.pulse.domain.model.Workflow.TriggerType;
import me.golemcore.pulse.domain.model.WorkflowEdge;
import me.golemcore.pulse.domain.model.WorkflowNode;
import me.golemcore.pulse.domain.model.WorkflowNode.NodeType;
import me.golemcore.pulse.domain.service.AutonomyService;
import me.golemcore.pulse.domain.service.CronSchedules;
import me.golemcore.pulse.domain.service.JsonTable;
import me.golemcore.pulse.domain.service.JsonTableStore;
import me.golemcore.pulse.domain.service.PulseTables;
import me.golemcore.pulse.domain.workflow.node.NodeExecutorRegistry;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Workflow definitions: validation, lifecycle (DRAFT, ACTIVE, PAUSED,
 * ARCHIVED) and run counters.
 */
@Service
@Slf4j
public class WorkflowService {

    private static final int WEBHOOK_KEY_BYTES = 8;
    static final String CRON_KEY = "cron";

    private final JsonTable<Workflow> workflows;
    private final NodeExecutorRegistry executorRegistry;
    private final AutonomyService autonomyService;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public WorkflowService(JsonTableStore tableStore, NodeExecutorRegistry executorRegistry,
            AutonomyService autonomyService, Clock clock) {
        this.workflows = tableStore.table(PulseTables.WORKFLOWS, Workflow.class);
        this.executorRegistry = executorRegistry;
        this.autonomyService = autonomyService;
        this.clock = clock;
    }

    public Workflow create(String tenantId, Workflow workflow) {
        validate(workflow);
        Instant now = clock.instant();
        workflow.setId(UUID.randomUUID().toString());
        workflow.setTenantId(tenantId);
        workflow.setStatus(Status.DRAFT);
        workflow.setRunCount(0);
        workflow.setSuccessCount(0);
        workflow.setNextScheduledAt(null);
        workflow.setWebhookKey(workflow.getTriggerType() == TriggerType.WEBHOOK ? newWebhookKey() : null);
        workflow.setCreatedAt(now);
        workflow.setUpdatedAt(now);
        workflows.append(tenantId, workflow);
        log.info("[Workflow] Created workflow '{}' ({}) for {} with {} node(s)", workflow.getName(),
                workflow.getId(), tenantId, workflow.getNodes().size());
        return workflow;
    }

    /**
     * Replace the definition of a DRAFT or PAUSED workflow.
     */
    public Workflow update(String workflowId, Workflow changes) {
        validate(changes);
        return mutate(workflowId, workflow -> {
            if (workflow.getStatus() != Status.DRAFT && workflow.getStatus() != Status.PAUSED) {
                throw new InvalidTransitionException("Workflow " + workflowId + " is " + workflow.getStatus()
                        + "; only DRAFT or PAUSED workflows can be edited");
            }
            workflow.setName(changes.getName());
            workflow.setDescription(changes.getDescription());
            workflow.setNodes(changes.getNodes());
            workflow.setEdges(changes.getEdges());
            workflow.setTriggerType(changes.getTriggerType());
            workflow.setTriggerConfig(changes.getTriggerConfig());
            if (changes.getTriggerType() == TriggerType.WEBHOOK && workflow.getWebhookKey() == null) {
                workflow.setWebhookKey(newWebhookKey());
            }
        });
    }

    public Workflow activate(String workflowId) {
        Workflow activated = mutate(workflowId, workflow -> {
            if (workflow.getStatus() == Status.ARCHIVED) {
                throw new InvalidTransitionException("workflow", workflowId, workflow.getStatus(), Status.ACTIVE);
            }
            validate(workflow);
            workflow.setStatus(Status.ACTIVE);
            workflow.setNextScheduledAt(workflow.getTriggerType() == TriggerType.SCHEDULE
                    ? CronSchedules.next(cronOf(workflow), clock.instant(),
                            autonomyService.zoneFor(workflow.getTenantId()))
                    : null);
        });
        log.info("[Workflow] Workflow {} activated", workflowId);
        return activated;
    }

    public Workflow pause(String workflowId) {
        Workflow paused = mutate(workflowId, workflow -> {
            if (workflow.getStatus() != Status.ACTIVE) {
                throw new InvalidTransitionException("workflow", workflowId, workflow.getStatus(), Status.PAUSED);
            }
            workflow.setStatus(Status.PAUSED);
            workflow.setNextScheduledAt(null);
        });
        log.info("[Workflow] Workflow {} paused", workflowId);
        return paused;
    }

    public Workflow archive(String workflowId) {
        Workflow archived = mutate(workflowId, workflow -> {
            workflow.setStatus(Status.ARCHIVED);
            workflow.setNextScheduledAt(null);
        });
        log.info("[Workflow] Workflow {} archived", workflowId);
        return archived;
    }

    public Workflow get(String workflowId) {
        return workflows.findAny(workflow -> workflow.getId().equals(workflowId))
                .orElseThrow(() -> new NotFoundException("Workflow", workflowId));
    }

    public List<Workflow> list(String tenantId, String status) {
        Status filter = parseStatus(status);
        return workflows.read(tenantId).stream()
                .filter(workflow -> filter == null || workflow.getStatus() == filter)
                .sorted(Comparator.comparing(Workflow::getCreatedAt,
                        Comparator.nullsLast(Comparator.naturalOrder())).reversed())
                .toList();
    }

    public Optional<Workflow> findByWebhookKey(String webhookKey) {
        if (webhookKey == null || webhookKey.isBlank()) {
            return Optional.empty();
        }
        return workflows.findAny(workflow -> webhookKey.equals(workflow.getWebhookKey()));
    }

    /**
     * ACTIVE schedule-triggered workflows whose next fire time has passed.
     */
    public List<Workflow> listDueSchedules(Instant now) {
        List<Workflow> due = new ArrayList<>();
        for (String tenantId : workflows.tenants()) {
            workflows.read(tenantId).stream()
                    .filter(workflow -> workflow.getStatus() == Status.ACTIVE)
                    .filter(workflow -> workflow.getTriggerType() == TriggerType.SCHEDULE)
                    .filter(workflow -> workflow.getNextScheduledAt() != null
                            && !workflow.getNextScheduledAt().isAfter(now))
                    .forEach(due::add);
        }
        return due;
    }

    public void advanceSchedule(String workflowId, Instant after) {
        mutate(workflowId, workflow -> workflow.setNextScheduledAt(
                CronSchedules.next(cronOf(workflow), after, autonomyService.zoneFor(workflow.getTenantId()))));
    }

    public void recordRunStarted(String workflowId) {
        Instant now = clock.instant();
        mutate(workflowId, workflow -> {
            workflow.setRunCount(workflow.getRunCount() + 1);
            workflow.setLastRunAt(now);
        });
    }

    public void recordRunSucceeded(String workflowId) {
        mutate(workflowId, workflow -> workflow.setSuccessCount(workflow.getSuccessCount() + 1));
    }

    /**
     * Entry node: the {@code trigger} node if there is one, otherwise the first
     * node.
     */
    public static WorkflowNode entryNode(List<WorkflowNode> nodes) {
        return nodes.stream()
                .filter(node -> node.getType() == NodeType.TRIGGER)
                .findFirst()
                .orElse(nodes.get(0));
    }

    void validate(Workflow workflow) {
        if (workflow.getName() == null || workflow.getName().trim().length() < 2) {
            throw new IllegalArgumentException("Workflow name must have at least 2 characters");
        }
        if (workflow.getNodes() == null || workflow.getNodes().isEmpty()) {
            throw new IllegalArgumentException("Workflow needs at least one node");
        }
        if (workflow.getEdges() == null) {
            workflow.setEdges(new ArrayList<>());
        }
        if (workflow.getTriggerType() == null) {
            workflow.setTriggerType(TriggerType.MANUAL);
        }
        if (workflow.getTriggerConfig() == null) {
            workflow.setTriggerConfig(new LinkedHashMap<>());
        }

        Set<String> nodeIds = new HashSet<>();
        int triggerNodes = 0;
        for (WorkflowNode node : workflow.getNodes()) {
            if (node.getId() == null || node.getId().isBlank()) {
                throw new IllegalArgumentException("Every node needs an id");
            }
            if (!nodeIds.add(node.getId())) {
                throw new IllegalArgumentException("Duplicate node id: " + node.getId());
            }
            if (node.getType() == null) {
                throw new IllegalArgumentException("Node " + node.getId() + " has no type");
            }
            if (node.getConfig() == null) {
                node.setConfig(new LinkedHashMap<>());
            }
            if (node.getType() == NodeType.TRIGGER) {
                triggerNodes++;
            }
            executorRegistry.validate(node);
        }
        if (triggerNodes > 1) {
            throw new IllegalArgumentException("A workflow can have at most one trigger node");
        }

        String entryId = entryNode(workflow.getNodes()).getId();
        for (WorkflowEdge edge : workflow.getEdges()) {
            if (!nodeIds.contains(edge.getSource()) || !nodeIds.contains(edge.getTarget())) {
                throw new IllegalArgumentException("Edge " + edge.getSource() + " -> " + edge.getTarget()
                        + " references an unknown node");
            }
            if (triggerNodes == 1 && entryId.equals(edge.getTarget())) {
                throw new IllegalArgumentException("The trigger node cannot have incoming edges");
            }
            if (edge.getCondition() != null
                    && !EdgeConditionEvaluator.isKnownOperator(edge.getCondition().getOperator())) {
                throw new IllegalArgumentException("Unknown edge operator: " + edge.getCondition().getOperator());
            }
        }

        if (workflow.getTriggerType() == TriggerType.SCHEDULE) {
            CronSchedules.normalize(cronOf(workflow));
        }
    }

    private Workflow mutate(String workflowId, Consumer<Workflow> change) {
        String tenantId = workflows.findTenant(workflow -> workflow.getId().equals(workflowId))
                .orElseThrow(() -> new NotFoundException("Workflow", workflowId));
        Instant now = clock.instant();
        return workflows.mutate(tenantId, rows -> {
            Workflow workflow = rows.stream()
                    .filter(row -> row.getId().equals(workflowId))
                    .findFirst()
                    .orElseThrow(() -> new NotFoundException("Workflow", workflowId));
            change.accept(workflow);
            workflow.setUpdatedAt(now);
            return workflow;
        });
    }

    private static String cronOf(Workflow workflow) {
        Object cron = workflow.getTriggerConfig() != null ? workflow.getTriggerConfig().get(CRON_KEY) : null;
        if (cron == null) {
            throw new IllegalArgumentException("Schedule workflows need trigger_config.cron");
        }
        return cron.toString();
    }

    private String newWebhookKey() {
        byte[] bytes = new byte[WEBHOOK_KEY_BYTES];
        random.nextBytes(bytes);
        return "wh_" + HexFormat.of().formatHex(bytes);
    }

    private static Status parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return Status.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}

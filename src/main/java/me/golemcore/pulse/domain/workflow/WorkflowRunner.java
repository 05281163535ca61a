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
import me.golemcore.pulse.domain.exception.NodeExecutionException;
import me.golemcore.pulse.domain.exception.NotFoundException;
import me.golemcore.pulse.domain.model.Notification;
import me.golemcore.pulse.domain.model.Workflow;
import me.golemcore.pulse.domain.model.WorkflowApproval;
import me.golemcore.pulse.domain.model.WorkflowEdge;
import me.golemcore.pulse.domain.model.WorkflowLog.Level;
import me.golemcore.pulse.domain.model.WorkflowNode;
import me.golemcore.pulse.domain.model.WorkflowNode.NodeType;
import me.golemcore.pulse.domain.model.WorkflowRun;
import me.golemcore.pulse.domain.model.WorkflowRun.Status;
import me.golemcore.pulse.domain.service.AutonomyService;
import me.golemcore.pulse.domain.service.JsonTable;
import me.golemcore.pulse.domain.service.JsonTableStore;
import me.golemcore.pulse.domain.service.NotificationService;
import me.golemcore.pulse.domain.service.PulseTables;
import me.golemcore.pulse.domain.workflow.node.NodeExecutorRegistry;
import me.golemcore.pulse.domain.workflow.node.NodeInput;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.UnaryOperator;

/**
 * Executes workflow runs over their copied node graph.
 *
 * <p>
 * A run starts at the entry node and repeatedly executes the current node,
 * stores its output in the context under {@code <nodeId>} and
 * {@code <nodeId>_output}, then follows the first outgoing edge whose
 * condition holds. No matching edge completes the run. A {@code human} node
 * suspends the run in WAITING_APPROVAL until its {@link WorkflowApproval} is
 * decided or expires.
 *
 * <p>
 * Every step is persisted before the next one starts; a run cancelled in the
 * meantime stops at the next step.
 */
@Service
@Slf4j
public class WorkflowRunner {

    private static final int LOG_OUTPUT_CHARS = 500;

    private final JsonTable<WorkflowRun> runs;
    private final JsonTable<WorkflowApproval> approvals;
    private final WorkflowService workflowService;
    private final WorkflowLogService logService;
    private final NodeExecutorRegistry executorRegistry;
    private final NotificationService notificationService;
    private final AutonomyService autonomyService;
    private final PulseProperties properties;
    private final Clock clock;
    private final ExecutorService workflowExecutor;

    public WorkflowRunner(JsonTableStore tableStore, WorkflowService workflowService,
            WorkflowLogService logService, NodeExecutorRegistry executorRegistry,
            NotificationService notificationService, AutonomyService autonomyService, PulseProperties properties,
            Clock clock, @Qualifier("pulseWorkflowExecutor") ExecutorService workflowExecutor) {
        this.runs = tableStore.table(PulseTables.WORKFLOW_RUNS, WorkflowRun.class);
        this.approvals = tableStore.table(PulseTables.WORKFLOW_APPROVALS, WorkflowApproval.class);
        this.workflowService = workflowService;
        this.logService = logService;
        this.executorRegistry = executorRegistry;
        this.notificationService = notificationService;
        this.autonomyService = autonomyService;
        this.properties = properties;
        this.clock = clock;
        this.workflowExecutor = workflowExecutor;
    }

    /**
     * Start a run of an ACTIVE workflow. Synchronous runs return after the run
     * suspended or ended; asynchronous runs return the PENDING run right away.
     */
    public WorkflowRun start(String workflowId, Map<String, Object> inputs, boolean async, String triggeredBy) {
        Workflow workflow = workflowService.get(workflowId);
        if (workflow.getStatus() != Workflow.Status.ACTIVE) {
            throw new InvalidTransitionException("Workflow " + workflowId + " is " + workflow.getStatus()
                    + "; only ACTIVE workflows can run");
        }

        Map<String, Object> runInputs = inputs != null ? new LinkedHashMap<>(inputs) : new LinkedHashMap<>();
        WorkflowRun run = WorkflowRun.builder()
                .id(UUID.randomUUID().toString())
                .workflowId(workflowId)
                .tenantId(workflow.getTenantId())
                .status(Status.PENDING)
                .currentNodeId(WorkflowService.entryNode(workflow.getNodes()).getId())
                .triggeredBy(triggeredBy != null ? triggeredBy : "manual")
                .nodes(new ArrayList<>(workflow.getNodes()))
                .edges(new ArrayList<>(workflow.getEdges()))
                .inputs(runInputs)
                .context(new LinkedHashMap<>(runInputs))
                .createdAt(clock.instant())
                .build();
        runs.append(run.getTenantId(), run);
        workflowService.recordRunStarted(workflowId);
        logService.append(run, null, Level.INFO, "Run created (" + run.getTriggeredBy() + ")");
        log.info("[Workflow] Run {} of workflow {} created ({})", run.getId(), workflowId, run.getTriggeredBy());

        if (!async) {
            return advance(run.getTenantId(), run.getId());
        }
        try {
            workflowExecutor.execute(() -> advanceSafely(run.getTenantId(), run.getId()));
        } catch (RejectedExecutionException e) {
            log.warn("[Workflow] Executor rejected run {}, failing it", run.getId());
            return finish(run.getTenantId(), run.getId(), Status.FAILED, "Workflow executor is saturated", null);
        }
        return run;
    }

    public WorkflowRun getRun(String runId) {
        return runs.findAny(run -> run.getId().equals(runId))
                .orElseThrow(() -> new NotFoundException("Workflow run", runId));
    }

    public List<WorkflowRun> listRuns(String workflowId, int limit) {
        Workflow workflow = workflowService.get(workflowId);
        return runs.read(workflow.getTenantId()).stream()
                .filter(run -> workflowId.equals(run.getWorkflowId()))
                .sorted(Comparator.comparing(WorkflowRun::getCreatedAt,
                        Comparator.nullsLast(Comparator.naturalOrder())).reversed())
                .limit(Math.max(1, limit))
                .toList();
    }

    public List<WorkflowApproval> listPendingApprovals(String tenantId) {
        return approvals.read(tenantId).stream()
                .filter(approval -> approval.getStatus() == WorkflowApproval.Status.PENDING)
                .sorted(Comparator.comparing(WorkflowApproval::getCreatedAt,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    /**
     * Record a human decision. An approval resumes the run along the human
     * node's outgoing edges; a rejection fails the run at that node.
     */
    public WorkflowRun decide(String approvalId, String decision, String actor, String feedback) {
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("Deciding actor is required");
        }
        WorkflowApproval.Status outcome = parseDecision(decision);
        WorkflowApproval pending = approvals.findAny(approval -> approval.getId().equals(approvalId))
                .orElseThrow(() -> new NotFoundException("Approval", approvalId));
        String tenantId = pending.getTenantId();

        Instant now = clock.instant();
        WorkflowApproval decided = approvals.mutate(tenantId, rows -> {
            WorkflowApproval approval = rows.stream()
                    .filter(row -> row.getId().equals(approvalId))
                    .findFirst()
                    .orElseThrow(() -> new NotFoundException("Approval", approvalId));
            if (approval.getStatus() != WorkflowApproval.Status.PENDING) {
                throw new InvalidTransitionException("approval", approvalId, approval.getStatus(), outcome);
            }
            approval.setStatus(outcome);
            approval.setDecisionBy(actor);
            approval.setDecisionFeedback(feedback);
            approval.setDecidedAt(now);
            return approval;
        });
        log.info("[Workflow] Approval {} {} by {}", approvalId, outcome, actor);

        WorkflowRun run = updateRun(tenantId, decided.getRunId(), current -> {
            if (current.getStatus() != Status.WAITING_APPROVAL
                    || !decided.getNodeId().equals(current.getCurrentNodeId())) {
                return null;
            }
            Map<String, Object> output = new LinkedHashMap<>();
            output.put("decision", outcome.name().toLowerCase(Locale.ROOT));
            output.put("approved", outcome == WorkflowApproval.Status.APPROVED);
            output.put("decided_by", actor);
            output.put("feedback", feedback);
            current.getContext().put(decided.getNodeId(), output);
            current.getContext().put(decided.getNodeId() + "_output", output);
            current.setNodeExecutions(current.getNodeExecutions() + 1);
            current.setStatus(Status.RUNNING);
            return current;
        });
        if (run == null) {
            log.warn("[Workflow] Run {} no longer waits on approval {}", decided.getRunId(), approvalId);
            return getRun(decided.getRunId());
        }

        logService.append(run, decided.getNodeId(),
                outcome == WorkflowApproval.Status.APPROVED ? Level.SUCCESS : Level.WARNING,
                "Approval " + outcome.name().toLowerCase(Locale.ROOT) + " by " + actor,
                feedback != null ? Map.of("feedback", feedback) : Map.of());

        if (outcome == WorkflowApproval.Status.REJECTED) {
            String reason = "Rejected by " + actor + (feedback != null && !feedback.isBlank()
                    ? ": " + feedback
                    : "");
            return finish(tenantId, run.getId(), Status.FAILED, reason, decided.getNodeId());
        }
        Optional<WorkflowEdge> next = chooseEdge(run, decided.getNodeId());
        if (next.isEmpty()) {
            return complete(run);
        }
        moveTo(run, next.get().getTarget());
        return advance(tenantId, run.getId());
    }

    public WorkflowRun cancel(String runId) {
        WorkflowRun existing = getRun(runId);
        WorkflowRun cancelled = updateRun(existing.getTenantId(), runId, run -> {
            if (run.getStatus().isTerminal()) {
                throw new InvalidTransitionException("run", runId, run.getStatus(), Status.CANCELLED);
            }
            run.setStatus(Status.CANCELLED);
            run.setCompletedAt(clock.instant());
            return run;
        });
        expirePendingApprovals(cancelled);
        logService.append(cancelled, cancelled.getCurrentNodeId(), Level.WARNING, "Run cancelled");
        log.info("[Workflow] Run {} cancelled", runId);
        return cancelled;
    }

    /**
     * Expire overdue approvals and fail their runs. Returns the number of
     * approvals expired.
     */
    public int expireApprovals() {
        Instant now = clock.instant();
        int expired = 0;
        for (String tenantId : approvals.tenants()) {
            List<WorkflowApproval> overdue = approvals.mutate(tenantId, rows -> {
                List<WorkflowApproval> changed = new ArrayList<>();
                for (WorkflowApproval approval : rows) {
                    if (approval.getStatus() == WorkflowApproval.Status.PENDING
                            && approval.getExpiresAt() != null && !now.isBefore(approval.getExpiresAt())) {
                        approval.setStatus(WorkflowApproval.Status.EXPIRED);
                        approval.setDecidedAt(now);
                        changed.add(approval);
                    }
                }
                return changed;
            });
            for (WorkflowApproval approval : overdue) {
                try {
                    finish(tenantId, approval.getRunId(), Status.FAILED, "Approval expired", approval.getNodeId());
                } catch (RuntimeException e) { // NOSONAR - intentionally catch all, continue sweeping
                    log.error("[Workflow] Failed to expire run {}", approval.getRunId(), e);
                }
            }
            expired += overdue.size();
        }
        if (expired > 0) {
            log.info("[Workflow] Expired {} approval(s)", expired);
        }
        return expired;
    }

    private void advanceSafely(String tenantId, String runId) {
        try {
            advance(tenantId, runId);
        } catch (RuntimeException e) { // NOSONAR - intentionally catch all, background runs must end in a state
            log.error("[Workflow] Run {} crashed", runId, e);
            finish(tenantId, runId, Status.FAILED, "Internal error: " + e.getMessage(), null);
        }
    }

    WorkflowRun advance(String tenantId, String runId) {
        int maxSteps = properties.getWorkflow().getMaxNodeExecutions();
        while (true) {
            WorkflowRun run = runs.read(tenantId).stream()
                    .filter(row -> row.getId().equals(runId))
                    .findFirst()
                    .orElseThrow(() -> new NotFoundException("Workflow run", runId));
            if (run.getStatus().isTerminal() || run.getStatus() == Status.WAITING_APPROVAL) {
                return run;
            }
            if (run.getStatus() == Status.PENDING) {
                run = updateRun(tenantId, runId, current -> {
                    if (current.getStatus() != Status.PENDING) {
                        return null;
                    }
                    current.setStatus(Status.RUNNING);
                    current.setStartedAt(clock.instant());
                    return current;
                });
                if (run == null) {
                    continue;
                }
                logService.append(run, null, Level.INFO, "Run started");
            }

            String nodeId = run.getCurrentNodeId();
            Optional<WorkflowNode> node = run.findNode(nodeId);
            if (node.isEmpty()) {
                return finish(tenantId, runId, Status.FAILED, "Unknown node: " + nodeId, nodeId);
            }
            if (run.getNodeExecutions() >= maxSteps) {
                return finish(tenantId, runId, Status.FAILED,
                        "Step limit of " + maxSteps + " node executions exceeded", nodeId);
            }
            if (node.get().getType() == NodeType.HUMAN) {
                return suspend(run, node.get());
            }

            Object output;
            logService.append(run, nodeId, Level.INFO, "Starting node: " + labelOf(node.get()));
            try {
                output = executorRegistry.get(node.get().getType()).execute(node.get(), new NodeInput(
                        run.getTenantId(), run.getWorkflowId(), run.getId(), run.getInputs(), run.getContext()));
            } catch (NodeExecutionException e) {
                return finish(tenantId, runId, Status.FAILED, e.getMessage(), nodeId);
            } catch (RuntimeException e) { // NOSONAR - intentionally catch all, any node error fails the run
                return finish(tenantId, runId, Status.FAILED, e.getClass().getSimpleName() + ": " + e.getMessage(),
                        nodeId);
            }

            WorkflowRun stepped = updateRun(tenantId, runId, current -> {
                if (current.getStatus() != Status.RUNNING) {
                    return null;
                }
                current.getContext().put(nodeId, output);
                current.getContext().put(nodeId + "_output", output);
                current.setNodeExecutions(current.getNodeExecutions() + 1);
                return current;
            });
            if (stepped == null) {
                log.info("[Workflow] Run {} left RUNNING during node {}, stopping", runId, nodeId);
                return getRun(runId);
            }
            logService.append(stepped, nodeId, Level.SUCCESS, "Completed node: " + labelOf(node.get()),
                    Map.of("output", abbreviate(String.valueOf(output))));

            Optional<WorkflowEdge> next = chooseEdge(stepped, nodeId);
            if (next.isEmpty()) {
                return complete(stepped);
            }
            moveTo(stepped, next.get().getTarget());
        }
    }

    private WorkflowRun suspend(WorkflowRun run, WorkflowNode node) {
        Instant now = clock.instant();
        int timeoutHours = NodeExecutorRegistry.humanTimeoutHours(node);
        Map<String, Object> content = new LinkedHashMap<>();
        Object configured = node.getConfig().get("content");
        if (configured instanceof Map<?, ?> map) {
            map.forEach((key, value) -> content.put(String.valueOf(key),
                    value instanceof String text ? ContextPaths.render(text, run.getContext()) : value));
        } else if (configured != null) {
            content.put("text", ContextPaths.render(configured.toString(), run.getContext()));
        }

        WorkflowApproval approval = WorkflowApproval.builder()
                .id(UUID.randomUUID().toString())
                .runId(run.getId())
                .workflowId(run.getWorkflowId())
                .tenantId(run.getTenantId())
                .nodeId(node.getId())
                .nodeLabel(labelOf(node))
                .description(ContextPaths.render(node.configString("description"), run.getContext()))
                .content(content)
                .priority(node.configString("priority") != null ? node.configString("priority") : "medium")
                .status(WorkflowApproval.Status.PENDING)
                .expiresAt(now.plus(Duration.ofHours(timeoutHours)))
                .createdAt(now)
                .build();

        WorkflowRun waiting = updateRun(run.getTenantId(), run.getId(), current -> {
            if (current.getStatus() != Status.RUNNING) {
                return null;
            }
            current.setStatus(Status.WAITING_APPROVAL);
            return current;
        });
        if (waiting == null) {
            return getRun(run.getId());
        }
        approvals.append(run.getTenantId(), approval);
        logService.append(waiting, node.getId(), Level.INFO, "Waiting for approval: " + labelOf(node),
                Map.of("approval_id", approval.getId()));
        log.info("[Workflow] Run {} waiting for approval {} at node {}", run.getId(), approval.getId(),
                node.getId());

        notificationService.notify(Notification.builder()
                .tenantId(run.getTenantId())
                .title("Workflow approval needed: " + labelOf(node))
                .body(approval.getDescription() != null ? approval.getDescription()
                        : "A workflow run is waiting for your decision")
                .channels(autonomyService.get(run.getTenantId()).getNotifyChannels())
                .build());
        return waiting;
    }

    private WorkflowRun complete(WorkflowRun run) {
        WorkflowRun completed = updateRun(run.getTenantId(), run.getId(), current -> {
            if (current.getStatus() != Status.RUNNING) {
                return null;
            }
            current.setStatus(Status.COMPLETED);
            current.setOutputs(new LinkedHashMap<>(current.getContext()));
            current.setCompletedAt(clock.instant());
            return current;
        });
        if (completed == null) {
            return getRun(run.getId());
        }
        workflowService.recordRunSucceeded(run.getWorkflowId());
        logService.append(completed, completed.getCurrentNodeId(), Level.SUCCESS, "Run completed");
        log.info("[Workflow] Run {} completed after {} node execution(s)", run.getId(),
                completed.getNodeExecutions());
        return completed;
    }

    private WorkflowRun finish(String tenantId, String runId, Status status, String message, String nodeId) {
        WorkflowRun finished = updateRun(tenantId, runId, current -> {
            if (current.getStatus().isTerminal()) {
                return null;
            }
            current.setStatus(status);
            current.setErrorMessage(message);
            current.setErrorNodeId(nodeId);
            current.setCompletedAt(clock.instant());
            return current;
        });
        if (finished == null) {
            return getRun(runId);
        }
        expirePendingApprovals(finished);
        logService.append(finished, nodeId, Level.ERROR, message);
        log.warn("[Workflow] Run {} {} at node {}: {}", runId, status, nodeId, message);
        return finished;
    }

    private void moveTo(WorkflowRun run, String targetNodeId) {
        updateRun(run.getTenantId(), run.getId(), current -> {
            if (current.getStatus() != Status.RUNNING) {
                return null;
            }
            current.setCurrentNodeId(targetNodeId);
            return current;
        });
    }

    private void expirePendingApprovals(WorkflowRun run) {
        Instant now = clock.instant();
        approvals.mutate(run.getTenantId(), rows -> {
            rows.stream()
                    .filter(approval -> run.getId().equals(approval.getRunId()))
                    .filter(approval -> approval.getStatus() == WorkflowApproval.Status.PENDING)
                    .forEach(approval -> {
                        approval.setStatus(WorkflowApproval.Status.EXPIRED);
                        approval.setDecidedAt(now);
                    });
            return null;
        });
    }

    /**
     * Apply {@code change} to the stored run. The change returns {@code null}
     * to leave the run untouched; this method then returns {@code null} too.
     */
    private WorkflowRun updateRun(String tenantId, String runId, UnaryOperator<WorkflowRun> change) {
        return runs.mutate(tenantId, rows -> {
            WorkflowRun run = rows.stream()
                    .filter(row -> row.getId().equals(runId))
                    .findFirst()
                    .orElseThrow(() -> new NotFoundException("Workflow run", runId));
            return change.apply(run);
        });
    }

    static Optional<WorkflowEdge> chooseEdge(WorkflowRun run, String nodeId) {
        return run.outgoingEdges(nodeId).stream()
                .filter(edge -> EdgeConditionEvaluator.matches(edge.getCondition(), run.getContext()))
                .findFirst();
    }

    private static WorkflowApproval.Status parseDecision(String decision) {
        if (decision != null) {
            String normalized = decision.trim().toUpperCase(Locale.ROOT);
            if ("APPROVED".equals(normalized) || "APPROVE".equals(normalized)) {
                return WorkflowApproval.Status.APPROVED;
            }
            if ("REJECTED".equals(normalized) || "REJECT".equals(normalized)) {
                return WorkflowApproval.Status.REJECTED;
            }
        }
        throw new IllegalArgumentException("decision must be 'approved' or 'rejected'");
    }

    private static String labelOf(WorkflowNode node) {
        return node.getLabel() != null && !node.getLabel().isBlank() ? node.getLabel() : node.getId();
    }

    private static String abbreviate(String text) {
        return text.length() <= LOG_OUTPUT_CHARS ? text : text.substring(0, LOG_OUTPUT_CHARS) + "...";
    }
}

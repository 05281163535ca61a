package me.golemcore.pulse.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.pulse.domain.model.Workflow;
import me.golemcore.pulse.domain.model.WorkflowApproval;
import me.golemcore.pulse.domain.model.WorkflowLog;
import me.golemcore.pulse.domain.model.WorkflowRun;
import me.golemcore.pulse.domain.workflow.WorkflowLogService;
import me.golemcore.pulse.domain.workflow.WorkflowRunner;
import me.golemcore.pulse.domain.workflow.WorkflowService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/**
 * Workflow definitions, runs and human approvals.
 *
 * <p>
 * A synchronous run blocks until the run completes, fails or reaches a human
 * node, so it is executed on the bounded elastic scheduler. Asynchronous runs
 * answer {@code 202} with the PENDING run.
 */
@RestController
@RequestMapping("/forge")
@RequiredArgsConstructor
public class WorkflowsController {

    private final WorkflowService workflowService;
    private final WorkflowRunner workflowRunner;
    private final WorkflowLogService logService;

    @PostMapping("/{startupId}/workflows")
    public Mono<ResponseEntity<Workflow>> create(
            @PathVariable String startupId,
            @RequestBody Workflow request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(workflowService.create(startupId, request)));
    }

    @GetMapping("/{startupId}/workflows")
    public Mono<ResponseEntity<List<Workflow>>> list(
            @PathVariable String startupId,
            @RequestParam(required = false) String status) {
        return Mono.just(ResponseEntity.ok(workflowService.list(startupId, status)));
    }

    @GetMapping("/workflows/{workflowId}")
    public Mono<ResponseEntity<Workflow>> get(@PathVariable String workflowId) {
        return Mono.just(ResponseEntity.ok(workflowService.get(workflowId)));
    }

    @PutMapping("/workflows/{workflowId}")
    public Mono<ResponseEntity<Workflow>> update(
            @PathVariable String workflowId,
            @RequestBody Workflow request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        return Mono.just(ResponseEntity.ok(workflowService.update(workflowId, request)));
    }

    @PostMapping("/workflows/{workflowId}/activate")
    public Mono<ResponseEntity<Workflow>> activate(@PathVariable String workflowId) {
        return Mono.just(ResponseEntity.ok(workflowService.activate(workflowId)));
    }

    @PostMapping("/workflows/{workflowId}/pause")
    public Mono<ResponseEntity<Workflow>> pause(@PathVariable String workflowId) {
        return Mono.just(ResponseEntity.ok(workflowService.pause(workflowId)));
    }

    @PostMapping("/workflows/{workflowId}/archive")
    public Mono<ResponseEntity<Workflow>> archive(@PathVariable String workflowId) {
        return Mono.just(ResponseEntity.ok(workflowService.archive(workflowId)));
    }

    @PostMapping("/workflows/{workflowId}/run")
    public Mono<ResponseEntity<WorkflowRun>> run(
            @PathVariable String workflowId,
            @RequestBody(required = false) RunRequest request) {
        Map<String, Object> inputs = request != null && request.inputs() != null ? request.inputs() : Map.of();
        boolean async = request == null || request.asyncExecution() == null || request.asyncExecution();
        if (async) {
            WorkflowRun run = workflowRunner.start(workflowId, inputs, true, "manual");
            return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).body(run));
        }
        return Mono.fromCallable(() -> ResponseEntity.ok(workflowRunner.start(workflowId, inputs, false, "manual")))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/workflows/{workflowId}/runs")
    public Mono<ResponseEntity<List<WorkflowRun>>> runs(
            @PathVariable String workflowId,
            @RequestParam(required = false) Integer limit) {
        return Mono.just(ResponseEntity.ok(workflowRunner.listRuns(workflowId, A2aController.clampLimit(limit))));
    }

    @GetMapping("/runs/{runId}")
    public Mono<ResponseEntity<RunDetails>> getRun(@PathVariable String runId) {
        WorkflowRun run = workflowRunner.getRun(runId);
        List<WorkflowLog> logs = logService.list(run.getTenantId(), runId);
        return Mono.just(ResponseEntity.ok(new RunDetails(run, logs)));
    }

    @PostMapping("/runs/{runId}/cancel")
    public Mono<ResponseEntity<WorkflowRun>> cancel(@PathVariable String runId) {
        return Mono.just(ResponseEntity.ok(workflowRunner.cancel(runId)));
    }

    @GetMapping("/{startupId}/approvals/pending")
    public Mono<ResponseEntity<List<WorkflowApproval>>> pendingApprovals(@PathVariable String startupId) {
        return Mono.just(ResponseEntity.ok(workflowRunner.listPendingApprovals(startupId)));
    }

    @PostMapping("/approvals/{approvalId}/decide")
    public Mono<ResponseEntity<WorkflowRun>> decide(
            @PathVariable String approvalId,
            @RequestHeader(value = "X-Actor-Id", required = false) String actor,
            @RequestBody DecideRequest request) {
        if (request == null || request.decision() == null || request.decision().isBlank()) {
            throw badRequest("decision is required");
        }
        String decidedBy = AutonomyController.requireActor(actor);
        return Mono.fromCallable(() -> ResponseEntity.ok(
                workflowRunner.decide(approvalId, request.decision(), decidedBy, request.feedback())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private static ResponseStatusException badRequest(String reason) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, reason);
    }

    public record RunRequest(Map<String, Object> inputs, Boolean asyncExecution) {
    }

    public record RunDetails(WorkflowRun run, List<WorkflowLog> logs) {
    }

    public record DecideRequest(String decision, String feedback) {
    }
}

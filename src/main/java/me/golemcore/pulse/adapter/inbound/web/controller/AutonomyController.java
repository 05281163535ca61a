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
import me.golemcore.pulse.domain.model.AgentAction;
import me.golemcore.pulse.domain.model.AutonomySettings;
import me.golemcore.pulse.domain.model.AutonomySettingsPatch;
import me.golemcore.pulse.domain.model.ProactiveActionLogEntry;
import me.golemcore.pulse.domain.service.ActionExecutionService;
import me.golemcore.pulse.domain.service.ActionService;
import me.golemcore.pulse.domain.service.AutonomyService;
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

/**
 * Per-tenant autonomy settings, the kill switch and the action approval
 * queue. Approving an action executes it, so those calls run off the event
 * loop.
 */
@RestController
@RequestMapping("/{startupId}/autonomy")
@RequiredArgsConstructor
public class AutonomyController {

    private static final String ACTOR_HEADER = "X-Actor-Id";

    private final AutonomyService autonomyService;
    private final ActionService actionService;
    private final ActionExecutionService actionExecutionService;

    @GetMapping
    public Mono<ResponseEntity<AutonomySettings>> getSettings(@PathVariable String startupId) {
        return Mono.just(ResponseEntity.ok(autonomyService.get(startupId)));
    }

    @PutMapping
    public Mono<ResponseEntity<AutonomySettings>> updateSettings(
            @PathVariable String startupId,
            @RequestBody AutonomySettingsPatch patch) {
        if (patch == null) {
            throw badRequest("Request body is required");
        }
        return Mono.just(ResponseEntity.ok(autonomyService.update(startupId, patch)));
    }

    @PostMapping("/pause")
    public Mono<ResponseEntity<AutonomySettings>> pause(
            @PathVariable String startupId,
            @RequestBody(required = false) PauseRequest request) {
        String reason = request != null ? request.reason() : null;
        return Mono.just(ResponseEntity.ok(autonomyService.pause(startupId, reason)));
    }

    @PostMapping("/resume")
    public Mono<ResponseEntity<AutonomySettings>> resume(@PathVariable String startupId) {
        return Mono.just(ResponseEntity.ok(autonomyService.resume(startupId)));
    }

    @GetMapping("/actions")
    public Mono<ResponseEntity<List<AgentAction>>> listActions(
            @PathVariable String startupId,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) Integer limit) {
        return Mono.just(ResponseEntity.ok(actionService.list(startupId, status, A2aController.clampLimit(limit))));
    }

    @GetMapping("/actions/{actionId}")
    public Mono<ResponseEntity<AgentAction>> getAction(
            @PathVariable String startupId,
            @PathVariable String actionId) {
        return Mono.just(ResponseEntity.ok(actionService.get(startupId, actionId)));
    }

    @GetMapping("/audit")
    public Mono<ResponseEntity<List<ProactiveActionLogEntry>>> auditLog(
            @PathVariable String startupId,
            @RequestParam(required = false) Integer limit) {
        return Mono.just(ResponseEntity.ok(actionService.getAuditLog(startupId, A2aController.clampLimit(limit))));
    }

    @PostMapping("/actions/{actionId}/approve")
    public Mono<ResponseEntity<AgentAction>> approve(
            @PathVariable String startupId,
            @PathVariable String actionId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actor,
            @RequestBody(required = false) DecisionRequest request) {
        String decidedBy = requireActor(actor);
        String note = request != null ? request.note() : null;
        return Mono.fromCallable(() -> ResponseEntity.ok(
                actionExecutionService.approve(startupId, actionId, decidedBy, note)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/actions/{actionId}/reject")
    public Mono<ResponseEntity<AgentAction>> reject(
            @PathVariable String startupId,
            @PathVariable String actionId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actor,
            @RequestBody(required = false) DecisionRequest request) {
        String decidedBy = requireActor(actor);
        String note = request != null ? request.note() : null;
        return Mono.just(ResponseEntity.ok(actionExecutionService.reject(startupId, actionId, decidedBy, note)));
    }

    static String requireActor(String actor) {
        if (actor == null || actor.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ACTOR_HEADER + " header is required");
        }
        return actor.trim();
    }

    private static ResponseStatusException badRequest(String reason) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, reason);
    }

    public record PauseRequest(String reason) {
    }

    public record DecisionRequest(String note) {
    }
}

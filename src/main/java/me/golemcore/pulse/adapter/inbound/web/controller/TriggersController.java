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
import me.golemcore.pulse.domain.model.TriggerLog;
import me.golemcore.pulse.domain.model.TriggerRule;
import me.golemcore.pulse.domain.service.TriggerEngine;
import me.golemcore.pulse.domain.service.TriggerLogService;
import me.golemcore.pulse.domain.service.TriggerRuleService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/**
 * Trigger rule management plus the event and metric ingestion endpoints that
 * drive rule evaluation.
 */
@RestController
@RequestMapping("/{startupId}")
@RequiredArgsConstructor
public class TriggersController {

    private final TriggerRuleService ruleService;
    private final TriggerLogService logService;
    private final TriggerEngine triggerEngine;

    @GetMapping("/triggers")
    public Mono<ResponseEntity<List<TriggerRule>>> listRules(
            @PathVariable String startupId,
            @RequestParam(value = "include_inactive", defaultValue = "false") boolean includeInactive) {
        return Mono.just(ResponseEntity.ok(ruleService.list(startupId, includeInactive)));
    }

    @PostMapping("/triggers")
    public Mono<ResponseEntity<TriggerRule>> createRule(
            @PathVariable String startupId,
            @RequestBody TriggerRule request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(ruleService.create(startupId, request)));
    }

    @GetMapping("/triggers/logs")
    public Mono<ResponseEntity<List<TriggerLog>>> listLogs(
            @PathVariable String startupId,
            @RequestParam(value = "rule_id", required = false) String ruleId,
            @RequestParam(required = false) Integer limit) {
        return Mono.just(ResponseEntity.ok(logService.list(startupId, ruleId, A2aController.clampLimit(limit))));
    }

    @GetMapping("/triggers/{ruleId}")
    public Mono<ResponseEntity<TriggerRule>> getRule(
            @PathVariable String startupId,
            @PathVariable String ruleId) {
        return Mono.just(ResponseEntity.ok(ruleService.get(startupId, ruleId)));
    }

    @PutMapping("/triggers/{ruleId}")
    public Mono<ResponseEntity<TriggerRule>> updateRule(
            @PathVariable String startupId,
            @PathVariable String ruleId,
            @RequestBody TriggerRule request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        return Mono.just(ResponseEntity.ok(ruleService.update(startupId, ruleId, request)));
    }

    @DeleteMapping("/triggers/{ruleId}")
    public Mono<ResponseEntity<Void>> deleteRule(
            @PathVariable String startupId,
            @PathVariable String ruleId) {
        ruleService.delete(startupId, ruleId);
        return Mono.just(ResponseEntity.noContent().build());
    }

    @PostMapping("/triggers/{ruleId}/pause")
    public Mono<ResponseEntity<TriggerRule>> pauseRule(
            @PathVariable String startupId,
            @PathVariable String ruleId) {
        return Mono.just(ResponseEntity.ok(ruleService.pause(startupId, ruleId)));
    }

    @PostMapping("/triggers/{ruleId}/resume")
    public Mono<ResponseEntity<TriggerRule>> resumeRule(
            @PathVariable String startupId,
            @PathVariable String ruleId) {
        return Mono.just(ResponseEntity.ok(ruleService.resume(startupId, ruleId)));
    }

    @PostMapping("/triggers/{ruleId}/deactivate")
    public Mono<ResponseEntity<TriggerRule>> deactivateRule(
            @PathVariable String startupId,
            @PathVariable String ruleId) {
        return Mono.just(ResponseEntity.ok(ruleService.deactivate(startupId, ruleId)));
    }

    @PostMapping("/triggers/events")
    public Mono<ResponseEntity<EvaluationResponse>> ingestEvent(
            @PathVariable String startupId,
            @RequestBody EventRequest request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        return Mono.fromCallable(() -> ResponseEntity.ok(new EvaluationResponse(
                triggerEngine.evaluateEvent(startupId, request.event(), request.data()))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/metrics")
    public Mono<ResponseEntity<EvaluationResponse>> ingestMetrics(
            @PathVariable String startupId,
            @RequestBody MetricsRequest request) {
        if (request == null || request.metrics() == null || request.metrics().isEmpty()) {
            throw badRequest("metrics are required");
        }
        return Mono.fromCallable(() -> ResponseEntity.ok(new EvaluationResponse(
                triggerEngine.ingestMetrics(startupId, request.metrics()))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private static ResponseStatusException badRequest(String reason) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, reason);
    }

    public record EventRequest(String event, Map<String, Object> data) {
    }

    public record MetricsRequest(Map<String, Double> metrics) {
    }

    public record EvaluationResponse(List<TriggerLog> fired) {
    }
}

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
import me.golemcore.pulse.domain.model.EvaluationResult;
import me.golemcore.pulse.domain.model.HeartbeatRuleSet;
import me.golemcore.pulse.domain.service.HeartbeatEngine;
import me.golemcore.pulse.domain.service.HeartbeatRuleSetService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Heartbeat rule-set endpoints. {@code run} evaluates one rule-set for one
 * tenant immediately and waits for the decision.
 */
@RestController
@RequestMapping("/heartbeat/rulesets")
@RequiredArgsConstructor
public class RuleSetsController {

    private final HeartbeatRuleSetService ruleSetService;
    private final HeartbeatEngine heartbeatEngine;

    @GetMapping
    public Mono<ResponseEntity<List<HeartbeatRuleSet>>> list() {
        return Mono.just(ResponseEntity.ok(ruleSetService.list()));
    }

    @GetMapping("/{ruleSetId}")
    public Mono<ResponseEntity<HeartbeatRuleSet>> get(@PathVariable String ruleSetId) {
        return Mono.just(ResponseEntity.ok(ruleSetService.get(ruleSetId)));
    }

    @PostMapping
    public Mono<ResponseEntity<HeartbeatRuleSet>> create(@RequestBody HeartbeatRuleSet request) {
        if (request == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request body is required");
        }
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(ruleSetService.create(request)));
    }

    @PostMapping("/{ruleSetId}/pause")
    public Mono<ResponseEntity<HeartbeatRuleSet>> pause(@PathVariable String ruleSetId) {
        return Mono.just(ResponseEntity.ok(ruleSetService.pause(ruleSetId)));
    }

    @PostMapping("/{ruleSetId}/resume")
    public Mono<ResponseEntity<HeartbeatRuleSet>> resume(@PathVariable String ruleSetId) {
        return Mono.just(ResponseEntity.ok(ruleSetService.resume(ruleSetId)));
    }

    @PostMapping("/{ruleSetId}/run")
    public Mono<ResponseEntity<EvaluationResult>> runNow(
            @PathVariable String ruleSetId,
            @RequestParam("startup_id") String startupId) {
        return Mono.fromCallable(() -> ResponseEntity.ok(heartbeatEngine.runNow(ruleSetId, startupId)))
                .subscribeOn(Schedulers.boundedElastic());
    }
}

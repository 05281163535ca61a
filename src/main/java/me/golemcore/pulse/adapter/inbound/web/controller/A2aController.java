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
import me.golemcore.pulse.domain.model.AgentMessage;
import me.golemcore.pulse.domain.model.EvaluationResult;
import me.golemcore.pulse.domain.model.PublishRequest;
import me.golemcore.pulse.domain.model.PulseOverview;
import me.golemcore.pulse.domain.service.HeartbeatLedgerService;
import me.golemcore.pulse.domain.service.MessageBusService;
import me.golemcore.pulse.domain.service.PulseDashboardService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Agent-to-agent message bus and the read-only pulse dashboards.
 */
@RestController
@RequestMapping("/a2a")
@RequiredArgsConstructor
public class A2aController {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 200;

    private final MessageBusService messageBus;
    private final PulseDashboardService dashboardService;
    private final HeartbeatLedgerService ledgerService;

    @PostMapping("/messages")
    public Mono<ResponseEntity<PublishResponse>> publish(@RequestBody PublishMessageRequest request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        PublishRequest publish = PublishRequest.builder()
                .tenantId(request.startupId())
                .fromAgent(request.fromAgent())
                .topic(request.topic())
                .messageType(MessageBusService.resolveType(request.messageType()))
                .payload(request.payload() != null ? request.payload() : Map.of())
                .toAgent(request.toAgent())
                .priority(MessageBusService.resolvePriority(request.priority()))
                .requiresResponse(Boolean.TRUE.equals(request.requiresResponse()))
                .responseDeadlineMinutes(request.responseDeadlineMinutes())
                .threadId(request.threadId())
                .build();
        List<AgentMessage> published = messageBus.publish(publish);
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED)
                .body(new PublishResponse(published.size(), published)));
    }

    @GetMapping("/messages/inbox/{agentId}")
    public Mono<ResponseEntity<List<AgentMessage>>> inbox(
            @PathVariable String agentId,
            @RequestParam("startup_id") String startupId,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) Integer limit) {
        return Mono.just(ResponseEntity.ok(messageBus.getInbox(startupId, agentId, status, clampLimit(limit))));
    }

    @GetMapping("/messages/thread/{threadId}")
    public Mono<ResponseEntity<List<AgentMessage>>> thread(
            @PathVariable String threadId,
            @RequestParam(required = false) Integer limit) {
        return Mono.just(ResponseEntity.ok(messageBus.getThread(threadId, clampLimit(limit))));
    }

    @GetMapping("/messages/{messageId}")
    public Mono<ResponseEntity<AgentMessage>> message(@PathVariable String messageId) {
        return Mono.just(ResponseEntity.ok(messageBus.getMessage(messageId)));
    }

    @PostMapping("/messages/{messageId}/respond")
    public Mono<ResponseEntity<AgentMessage>> respond(
            @PathVariable String messageId,
            @RequestBody RespondRequest request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        AgentMessage response = messageBus.respondTo(messageId, request.fromAgent(),
                request.payload() != null ? request.payload() : Map.of());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(response));
    }

    @PostMapping("/messages/{messageId}/processed")
    public Mono<ResponseEntity<AgentMessage>> markProcessed(@PathVariable String messageId) {
        return Mono.just(ResponseEntity.ok(messageBus.markProcessed(messageId)));
    }

    @GetMapping("/messages/overdue")
    public Mono<ResponseEntity<List<AgentMessage>>> overdue(@RequestParam("startup_id") String startupId) {
        return Mono.just(ResponseEntity.ok(messageBus.getOverdueResponses(startupId)));
    }

    @GetMapping("/pulse/{startupId}")
    public Mono<ResponseEntity<PulseOverview>> pulse(@PathVariable String startupId) {
        return Mono.just(ResponseEntity.ok(dashboardService.pulse(startupId)));
    }

    @GetMapping("/pulse/{startupId}/timeline")
    public Mono<ResponseEntity<List<EvaluationResult>>> timeline(
            @PathVariable String startupId,
            @RequestParam(value = "result_type", required = false) String resultType,
            @RequestParam(required = false) Integer limit) {
        return Mono.just(ResponseEntity.ok(dashboardService.timeline(startupId, resultType, clampLimit(limit))));
    }

    @PostMapping("/pulse/{startupId}/escalations/{resultId}/acknowledge")
    public Mono<ResponseEntity<EvaluationResult>> acknowledge(
            @PathVariable String startupId,
            @PathVariable String resultId,
            @RequestHeader(value = "X-Actor-Id", required = false) String actor) {
        String acknowledgedBy = AutonomyController.requireActor(actor);
        return Mono.just(ResponseEntity.ok(ledgerService.acknowledge(startupId, resultId, acknowledgedBy)));
    }

    static int clampLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        if (limit < 1) {
            throw badRequest("limit must be positive");
        }
        return Math.min(limit, MAX_LIMIT);
    }

    private static ResponseStatusException badRequest(String reason) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, reason);
    }

    public record PublishMessageRequest(
            String startupId,
            String fromAgent,
            String topic,
            String messageType,
            Map<String, Object> payload,
            String toAgent,
            String priority,
            Boolean requiresResponse,
            Integer responseDeadlineMinutes,
            String threadId) {
    }

    public record PublishResponse(int delivered, List<AgentMessage> messages) {
    }

    public record RespondRequest(String fromAgent, Map<String, Object> payload) {
    }
}

package me.golemcore.pulse.adapter.inbound.webhook;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.adapter.inbound.webhook.dto.WebhookResponse;
import me.golemcore.pulse.domain.exception.NotFoundException;
import me.golemcore.pulse.domain.model.TriggerLog;
import me.golemcore.pulse.domain.model.Workflow;
import me.golemcore.pulse.domain.model.WorkflowRun;
import me.golemcore.pulse.domain.service.TriggerEngine;
import me.golemcore.pulse.domain.workflow.WorkflowRunner;
import me.golemcore.pulse.domain.workflow.WorkflowService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Unauthenticated inbound webhooks. The unguessable path segment is the only
 * credential.
 *
 * <ul>
 * <li>{@code POST /triggers/webhook/{secret}} fires a WEBHOOK trigger rule</li>
 * <li>{@code POST /forge/webhook/{webhookKey}} starts an asynchronous run of an
 * ACTIVE webhook workflow</li>
 * </ul>
 *
 * Unknown secrets and keys answer 404 without telling which part was wrong.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    private final TriggerEngine triggerEngine;
    private final WorkflowService workflowService;
    private final WorkflowRunner workflowRunner;

    @PostMapping("/triggers/webhook/{secret}")
    public Mono<ResponseEntity<WebhookResponse>> fireTrigger(
            @PathVariable String secret,
            @RequestBody(required = false) Map<String, Object> payload) {

        return Mono.fromCallable(() -> {
            try {
                TriggerLog entry = triggerEngine.fireWebhook(secret, payload);
                log.info("[Webhook] Trigger {} fired: {}", entry.getRuleId(), entry.getStatus());
                return ResponseEntity.ok(WebhookResponse.accepted(entry.getId(), entry.getStatus().name()));
            } catch (NotFoundException e) {
                return notFound();
            }
        });
    }

    @PostMapping("/forge/webhook/{webhookKey}")
    public Mono<ResponseEntity<WebhookResponse>> runWorkflow(
            @PathVariable String webhookKey,
            @RequestBody(required = false) Map<String, Object> payload) {

        return Mono.fromCallable(() -> {
            Optional<Workflow> workflow = workflowService.findByWebhookKey(webhookKey)
                    .filter(candidate -> candidate.getTriggerType() == Workflow.TriggerType.WEBHOOK)
                    .filter(candidate -> candidate.getStatus() == Workflow.Status.ACTIVE);
            if (workflow.isEmpty()) {
                return notFound();
            }

            Map<String, Object> inputs = new LinkedHashMap<>();
            inputs.put("webhook_payload", payload != null ? payload : Map.of());
            if (payload != null) {
                payload.forEach(inputs::putIfAbsent);
            }
            WorkflowRun run = workflowRunner.start(workflow.get().getId(), inputs, true, "webhook");
            log.info("[Webhook] Workflow {} run {} accepted", workflow.get().getId(), run.getId());
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(WebhookResponse.accepted(run.getId(), run.getStatus().name()));
        });
    }

    private ResponseEntity<WebhookResponse> notFound() {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(WebhookResponse.error("Unknown webhook"));
    }
}

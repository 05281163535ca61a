package me.golemcore.pulse.domain.service;

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
import me.golemcore.pulse.domain.model.Advice;
import me.golemcore.pulse.domain.model.AdvisorRequest;
import me.golemcore.pulse.domain.model.AgentAction;
import me.golemcore.pulse.domain.model.AutonomySettings;
import me.golemcore.pulse.domain.model.Notification;
import me.golemcore.pulse.port.outbound.AdvisorPort;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Carries actions through execution: EXECUTING, the advisor call, then
 * COMPLETED or FAILED. Also the entry point for human approve/reject
 * decisions, which execute the action right after approval.
 */
@Service
@Slf4j
public class ActionExecutionService {

    private final ActionService actionService;
    private final AdvisorPort advisorPort;
    private final AutonomyService autonomyService;
    private final NotificationService notificationService;
    private final TriggerLogService triggerLogService;

    public ActionExecutionService(ActionService actionService, AdvisorPort advisorPort,
            AutonomyService autonomyService, NotificationService notificationService,
            TriggerLogService triggerLogService) {
        this.actionService = actionService;
        this.advisorPort = advisorPort;
        this.autonomyService = autonomyService;
        this.notificationService = notificationService;
        this.triggerLogService = triggerLogService;
    }

    /**
     * Execute an action that is PENDING or APPROVED. Advisor failures end in
     * FAILED; the approval check inside
     * {@link ActionService#markExecuting(String, String)} still throws.
     */
    public AgentAction execute(String tenantId, String actionId) {
        AgentAction executing = actionService.markExecuting(tenantId, actionId);
        triggerLogService.syncWithAction(executing);

        AgentAction finished;
        try {
            Advice advice = advisorPort.respond(AdvisorRequest.builder()
                    .tenantId(tenantId)
                    .agentId(executing.getAgentId())
                    .prompt(buildPrompt(executing))
                    .context(executing.getPayload() != null ? executing.getPayload() : Map.of())
                    .build());
            finished = actionService.complete(tenantId, actionId, advice.getContent());
        } catch (RuntimeException e) { // NOSONAR - intentionally catch all, advisor errors end the action
            finished = actionService.fail(tenantId, actionId, e.getMessage());
        }

        triggerLogService.syncWithAction(finished);
        notifyOutcome(finished);
        return finished;
    }

    public AgentAction approve(String tenantId, String actionId, String actor, String note) {
        AgentAction approved = actionService.approve(tenantId, actionId, actor, note);
        triggerLogService.syncWithAction(approved);
        return execute(tenantId, actionId);
    }

    public AgentAction reject(String tenantId, String actionId, String actor, String note) {
        AgentAction rejected = actionService.reject(tenantId, actionId, actor, note);
        triggerLogService.syncWithAction(rejected);
        return rejected;
    }

    /**
     * Ask the founder to review an action waiting for approval.
     */
    public void requestApproval(AgentAction action) {
        AutonomySettings settings = autonomyService.get(action.getTenantId());
        if (!settings.isNotifyOnAction()) {
            return;
        }
        notificationService.notify(Notification.builder()
                .tenantId(action.getTenantId())
                .title("Approval needed: " + action.getTitle())
                .body("Agent " + action.getAgentId() + " proposes: " + action.getTitle()
                        + " (expires " + action.getExpiresAt() + ")")
                .channels(settings.getNotifyChannels())
                .build());
    }

    private void notifyOutcome(AgentAction action) {
        AutonomySettings settings = autonomyService.get(action.getTenantId());
        if (!settings.isNotifyOnAction()) {
            return;
        }
        String outcome = action.getStatus() == AgentAction.Status.COMPLETED ? "completed" : "failed";
        notificationService.notify(Notification.builder()
                .tenantId(action.getTenantId())
                .title("Action " + outcome + ": " + action.getTitle())
                .body(action.getStatus() == AgentAction.Status.COMPLETED
                        ? abbreviate(action.getResult())
                        : action.getError())
                .channels(settings.getNotifyChannels())
                .build());
    }

    private static String buildPrompt(AgentAction action) {
        Map<String, Object> payload = action.getPayload() != null ? action.getPayload() : new LinkedHashMap<>();
        Object task = payload.getOrDefault("task", action.getTitle());
        return "Carry out the following " + (action.getCategory() != null ? action.getCategory() + " " : "")
                + "task and report the result: " + task;
    }

    private static String abbreviate(String text) {
        if (text == null || text.length() <= 280) {
            return text;
        }
        return text.substring(0, 277) + "...";
    }
}

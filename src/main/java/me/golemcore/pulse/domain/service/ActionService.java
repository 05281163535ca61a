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
import me.golemcore.pulse.domain.exception.ApprovalRequiredException;
import me.golemcore.pulse.domain.exception.InvalidTransitionException;
import me.golemcore.pulse.domain.exception.NotFoundException;
import me.golemcore.pulse.domain.model.ActionProposal;
import me.golemcore.pulse.domain.model.AgentAction;
import me.golemcore.pulse.domain.model.AgentAction.Status;
import me.golemcore.pulse.domain.model.ProactiveActionLogEntry;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Approval state machine for agent actions.
 *
 * <pre>
 * PENDING ──────────────────────────► EXECUTING ──► COMPLETED | FAILED
 * PENDING_APPROVAL ──► APPROVED ────► EXECUTING ──► COMPLETED | FAILED
 * PENDING_APPROVAL ──► REJECTED | EXPIRED
 * </pre>
 *
 * <p>
 * Transitions only move forward. A rejected transition throws before anything
 * is written. Every status change is appended to {@code proactive_action_log}.
 */
@Service
@Slf4j
public class ActionService {

    private static final Map<Status, Set<Status>> TRANSITIONS = new EnumMap<>(Status.class);

    static {
        TRANSITIONS.put(Status.PENDING, EnumSet.of(Status.EXECUTING));
        TRANSITIONS.put(Status.PENDING_APPROVAL, EnumSet.of(Status.APPROVED, Status.REJECTED, Status.EXPIRED));
        TRANSITIONS.put(Status.APPROVED, EnumSet.of(Status.EXECUTING));
        TRANSITIONS.put(Status.EXECUTING, EnumSet.of(Status.COMPLETED, Status.FAILED));
    }

    private static final Comparator<AgentAction> NEWEST_FIRST = Comparator
            .comparing(AgentAction::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .reversed();

    private final JsonTable<AgentAction> actions;
    private final JsonTable<ProactiveActionLogEntry> auditLog;
    private final AutonomyService autonomyService;
    private final PulseProperties properties;
    private final Clock clock;

    public ActionService(JsonTableStore tableStore, AutonomyService autonomyService, PulseProperties properties,
            Clock clock) {
        this.actions = tableStore.table(PulseTables.AGENT_ACTIONS, AgentAction.class);
        this.auditLog = tableStore.table(PulseTables.PROACTIVE_ACTION_LOG, ProactiveActionLogEntry.class);
        this.autonomyService = autonomyService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Create an action unless the tenant already reached its daily action
     * limit. Approval is required when the proposal asks for it or the
     * tenant's autonomy level for the category is below AUTOPILOT.
     */
    public Optional<AgentAction> tryCreate(ActionProposal proposal) {
        String tenantId = proposal.getTenantId();
        int limit = autonomyService.dailyActionLimit(tenantId);
        ZoneId zone = autonomyService.zoneFor(tenantId);
        boolean requiresApproval = autonomyService.requiresApproval(tenantId, proposal.getCategory(),
                proposal.isRequiresApproval());
        Instant now = clock.instant();

        Optional<AgentAction> created = actions.mutate(tenantId, rows -> {
            LocalDate today = now.atZone(zone).toLocalDate();
            long createdToday = rows.stream()
                    .filter(action -> action.getCreatedAt() != null
                            && action.getCreatedAt().atZone(zone).toLocalDate().equals(today))
                    .count();
            if (limit > 0 && createdToday >= limit) {
                return Optional.empty();
            }

            AgentAction action = AgentAction.builder()
                    .id(UUID.randomUUID().toString())
                    .tenantId(tenantId)
                    .source(proposal.getSource())
                    .sourceId(proposal.getSourceId())
                    .agentId(proposal.getAgentId())
                    .actionType(proposal.getActionType())
                    .category(proposal.getCategory() != null
                            ? proposal.getCategory().toLowerCase(Locale.ROOT)
                            : null)
                    .title(proposal.getTitle())
                    .payload(proposal.getPayload() != null
                            ? new LinkedHashMap<>(proposal.getPayload())
                            : new LinkedHashMap<>())
                    .requiresApproval(requiresApproval)
                    .status(requiresApproval ? Status.PENDING_APPROVAL : Status.PENDING)
                    .expiresAt(requiresApproval ? now.plus(approvalExpiry()) : null)
                    .createdAt(now)
                    .build();
            rows.add(action);
            return Optional.of(action);
        });

        if (created.isEmpty()) {
            log.info("[Approval] Daily action limit {} reached for {}", limit, tenantId);
            return created;
        }
        AgentAction action = created.get();
        audit(action, null, action.getStatus(), "system", "created from " + action.getSource());
        log.info("[Approval] Created action {} ({}) for {} in {}", action.getId(), action.getTitle(), tenantId,
                action.getStatus());
        return created;
    }

    public boolean isDailyLimitReached(String tenantId) {
        int limit = autonomyService.dailyActionLimit(tenantId);
        if (limit <= 0) {
            return false;
        }
        ZoneId zone = autonomyService.zoneFor(tenantId);
        LocalDate today = clock.instant().atZone(zone).toLocalDate();
        long createdToday = actions.read(tenantId).stream()
                .filter(action -> action.getCreatedAt() != null
                        && action.getCreatedAt().atZone(zone).toLocalDate().equals(today))
                .count();
        return createdToday >= limit;
    }

    public AgentAction approve(String tenantId, String actionId, String actor, String note) {
        requireActor(actor);
        Instant now = clock.instant();
        AgentAction approved = transition(tenantId, actionId, Status.APPROVED, action -> {
            action.setApproved(true);
            action.setApprovedBy(actor);
            action.setApprovedAt(now);
            action.setDecisionNote(note);
        });
        audit(approved, Status.PENDING_APPROVAL, Status.APPROVED, actor, note);
        log.info("[Approval] Action {} approved by {}", actionId, actor);
        return approved;
    }

    public AgentAction reject(String tenantId, String actionId, String actor, String note) {
        requireActor(actor);
        Instant now = clock.instant();
        AgentAction rejected = transition(tenantId, actionId, Status.REJECTED, action -> {
            action.setApproved(false);
            action.setApprovedBy(actor);
            action.setApprovedAt(now);
            action.setDecisionNote(note);
        });
        audit(rejected, Status.PENDING_APPROVAL, Status.REJECTED, actor, note);
        log.info("[Approval] Action {} rejected by {}", actionId, actor);
        return rejected;
    }

    /**
     * Move to EXECUTING. An action that requires approval must have been
     * approved first.
     */
    public AgentAction markExecuting(String tenantId, String actionId) {
        Instant now = clock.instant();
        Status[] previous = new Status[1];
        AgentAction executing = actions.mutate(tenantId, rows -> {
            AgentAction action = findIn(rows, actionId);
            if (!action.isApprovalSatisfied()) {
                throw new ApprovalRequiredException(actionId);
            }
            requireTransition(action, Status.EXECUTING);
            previous[0] = action.getStatus();
            action.setStatus(Status.EXECUTING);
            action.setExecutedAt(now);
            return action;
        });
        audit(executing, previous[0], Status.EXECUTING, "system", null);
        return executing;
    }

    public AgentAction complete(String tenantId, String actionId, String result) {
        Instant now = clock.instant();
        AgentAction completed = transition(tenantId, actionId, Status.COMPLETED, action -> {
            action.setResult(result);
            action.setCompletedAt(now);
        });
        audit(completed, Status.EXECUTING, Status.COMPLETED, "system", null);
        log.info("[Approval] Action {} completed", actionId);
        return completed;
    }

    public AgentAction fail(String tenantId, String actionId, String error) {
        Instant now = clock.instant();
        AgentAction failed = transition(tenantId, actionId, Status.FAILED, action -> {
            action.setError(error);
            action.setCompletedAt(now);
        });
        audit(failed, Status.EXECUTING, Status.FAILED, "system", error);
        log.warn("[Approval] Action {} failed: {}", actionId, error);
        return failed;
    }

    /**
     * Sweep PENDING_APPROVAL actions whose {@code expiresAt} lapsed into
     * EXPIRED. Expired actions are never retried.
     *
     * @return number of expired actions
     */
    public int expireOverdue() {
        Instant now = clock.instant();
        int expired = 0;
        for (String tenantId : actions.tenants()) {
            List<AgentAction> swept = actions.mutate(tenantId, rows -> {
                List<AgentAction> lapsed = new ArrayList<>();
                for (AgentAction action : rows) {
                    if (action.getStatus() == Status.PENDING_APPROVAL && action.getExpiresAt() != null
                            && !now.isBefore(action.getExpiresAt())) {
                        action.setStatus(Status.EXPIRED);
                        lapsed.add(action);
                    }
                }
                return lapsed;
            });
            for (AgentAction action : swept) {
                audit(action, Status.PENDING_APPROVAL, Status.EXPIRED, "system", "approval window lapsed");
                log.info("[Approval] Action {} expired for {}", action.getId(), tenantId);
            }
            expired += swept.size();
        }
        return expired;
    }

    public AgentAction get(String tenantId, String actionId) {
        return findIn(actions.read(tenantId), actionId);
    }

    public List<AgentAction> list(String tenantId, String status, int limit) {
        Optional<Status> filter = parseStatus(status);
        return actions.read(tenantId).stream()
                .filter(action -> filter.map(s -> s == action.getStatus()).orElse(true))
                .sorted(NEWEST_FIRST)
                .limit(Math.max(1, limit))
                .toList();
    }

    public List<AgentAction> listAll(String tenantId) {
        return actions.read(tenantId);
    }

    public List<ProactiveActionLogEntry> getAuditLog(String tenantId, int limit) {
        return auditLog.read(tenantId).stream()
                .sorted(Comparator.comparing(ProactiveActionLogEntry::getTimestamp,
                        Comparator.nullsLast(Comparator.naturalOrder())).reversed())
                .limit(Math.max(1, limit))
                .toList();
    }

    private AgentAction transition(String tenantId, String actionId, Status target,
            Consumer<AgentAction> changes) {
        return actions.mutate(tenantId, rows -> {
            AgentAction action = findIn(rows, actionId);
            requireTransition(action, target);
            action.setStatus(target);
            changes.accept(action);
            return action;
        });
    }

    private static void requireTransition(AgentAction action, Status target) {
        Set<Status> allowed = TRANSITIONS.getOrDefault(action.getStatus(), Set.of());
        if (!allowed.contains(target)) {
            throw new InvalidTransitionException("action", action.getId(), action.getStatus(), target);
        }
    }

    private static AgentAction findIn(List<AgentAction> rows, String actionId) {
        return rows.stream()
                .filter(action -> action.getId().equals(actionId))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("Action", actionId));
    }

    private void audit(AgentAction action, Status from, Status to, String actor, String note) {
        try {
            auditLog.append(action.getTenantId(), ProactiveActionLogEntry.builder()
                    .id(UUID.randomUUID().toString())
                    .tenantId(action.getTenantId())
                    .actionId(action.getId())
                    .fromStatus(from)
                    .toStatus(to)
                    .actor(actor)
                    .note(note)
                    .timestamp(clock.instant())
                    .build());
        } catch (RuntimeException e) { // NOSONAR - intentionally catch all, audit is best effort
            log.error("[Approval] Failed to audit action {} {} -> {}", action.getId(), from, to, e);
        }
    }

    private Duration approvalExpiry() {
        return Duration.ofHours(Math.max(1, properties.getApproval().getDefaultExpiryHours()));
    }

    private static Optional<Status> parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Status.valueOf(status.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static void requireActor(String actor) {
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("Approver identity is required");
        }
    }
}

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
import me.golemcore.pulse.domain.exception.NotFoundException;
import me.golemcore.pulse.domain.model.ActionProposal;
import me.golemcore.pulse.domain.model.AgentAction;
import me.golemcore.pulse.domain.model.Notification;
import me.golemcore.pulse.domain.model.RateLimitResult;
import me.golemcore.pulse.domain.model.TriggerLog;
import me.golemcore.pulse.domain.model.TriggerRule;
import me.golemcore.pulse.domain.model.TriggerRule.TriggerType;
import me.golemcore.pulse.port.outbound.MetricsPort;
import me.golemcore.pulse.ratelimit.TriggerRateLimiter;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates trigger rules against metric snapshots, events, cron schedules
 * and webhook calls.
 *
 * <p>
 * A matching rule passes through the same suppression as heartbeat checks
 * (cooldown since the last fire, daily cap per tenant-local day). Suppressed
 * matches are logged SKIPPED; fired rules create an {@link AgentAction} that
 * is executed right away or left for approval.
 */
@Service
@Slf4j
public class TriggerEngine {

    private final TriggerRuleService ruleService;
    private final TriggerLogService logService;
    private final TriggerRateLimiter rateLimiter;
    private final AutonomyService autonomyService;
    private final ActionService actionService;
    private final ActionExecutionService actionExecutionService;
    private final NotificationService notificationService;
    private final MetricsPort metricsPort;
    private final Clock clock;

    public TriggerEngine(TriggerRuleService ruleService, TriggerLogService logService,
            TriggerRateLimiter rateLimiter, AutonomyService autonomyService, ActionService actionService,
            ActionExecutionService actionExecutionService, NotificationService notificationService,
            MetricsPort metricsPort, Clock clock) {
        this.ruleService = ruleService;
        this.logService = logService;
        this.rateLimiter = rateLimiter;
        this.autonomyService = autonomyService;
        this.actionService = actionService;
        this.actionExecutionService = actionExecutionService;
        this.notificationService = notificationService;
        this.metricsPort = metricsPort;
        this.clock = clock;
    }

    /**
     * Store a metric snapshot and evaluate the tenant's METRIC rules against
     * it.
     */
    public List<TriggerLog> ingestMetrics(String tenantId, Map<String, Double> metrics) {
        metricsPort.record(tenantId, metrics);
        return evaluateMetrics(tenantId);
    }

    public List<TriggerLog> evaluateMetrics(String tenantId) {
        Map<String, Double> latest = metricsPort.latest(tenantId);
        Map<String, Double> previous = metricsPort.previous(tenantId);
        List<TriggerLog> logs = new ArrayList<>();

        for (TriggerRule rule : ruleService.listRunnable(tenantId, TriggerType.METRIC)) {
            TriggerRule.Condition condition = rule.getCondition();
            Double current = latest.get(condition.getMetric());
            Double before = previous.get(condition.getMetric());
            boolean matched = current != null && condition.getValue() != null
                    && MetricConditions.matches(condition.getOperator(), current, before, condition.getValue(),
                            condition.isPercent());
            if (!matched) {
                continue;
            }
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("metric", condition.getMetric());
            context.put("current", current);
            context.put("previous", before);
            context.put("threshold", condition.getValue());
            fireIsolated(tenantId, rule, context).ifPresent(logs::add);
        }
        return logs;
    }

    public List<TriggerLog> evaluateEvent(String tenantId, String event, Map<String, Object> data) {
        if (event == null || event.isBlank()) {
            throw new IllegalArgumentException("event is required");
        }
        Map<String, Object> eventData = data != null ? data : Map.of();
        List<TriggerLog> logs = new ArrayList<>();

        for (TriggerRule rule : ruleService.listRunnable(tenantId, TriggerType.EVENT)) {
            TriggerRule.Condition condition = rule.getCondition();
            if (!event.equals(condition.getEvent()) || !filtersMatch(condition.getFilters(), eventData)) {
                continue;
            }
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("event", event);
            context.put("data", eventData);
            fireIsolated(tenantId, rule, context).ifPresent(logs::add);
        }
        return logs;
    }

    private Optional<TriggerLog> fireIsolated(String tenantId, TriggerRule rule, Map<String, Object> context) {
        try {
            return handleMatch(rule, context);
        } catch (RuntimeException e) { // NOSONAR - intentionally catch all, one rule must not stop the others
            log.error("[Triggers] {} rule {} failed for {}", rule.getTriggerType(), rule.getId(), tenantId, e);
            return Optional.empty();
        }
    }

    /**
     * Fire TIME rules whose cron has an occurrence since they were last
     * evaluated. Called once per scheduler tick for all tenants.
     */
    public List<TriggerLog> evaluateTimeTriggers() {
        Instant now = clock.instant();
        List<TriggerLog> logs = new ArrayList<>();
        for (String tenantId : ruleService.tenants()) {
            ZoneId zone = autonomyService.zoneFor(tenantId);
            for (TriggerRule rule : ruleService.listRunnable(tenantId, TriggerType.TIME)) {
                try {
                    Instant since = rule.getLastEvaluatedAt() != null ? rule.getLastEvaluatedAt()
                            : rule.getCreatedAt();
                    if (since == null || !CronSchedules.isDue(rule.getCondition().getCron(), since, now, zone)) {
                        continue;
                    }
                    Map<String, Object> context = new LinkedHashMap<>();
                    context.put("cron", rule.getCondition().getCron());
                    context.put("scheduled_after", since.toString());
                    Optional<TriggerLog> result = handleMatch(rule, context);
                    if (result.map(entry -> entry.getStatus() == TriggerLog.Status.SKIPPED).orElse(true)) {
                        ruleService.markEvaluated(tenantId, rule.getId(), now);
                    }
                    result.ifPresent(logs::add);
                } catch (RuntimeException e) { // NOSONAR - intentionally catch all, one rule must not stop the tick
                    log.error("[Triggers] TIME rule {} failed for {}", rule.getId(), tenantId, e);
                }
            }
        }
        return logs;
    }

    /**
     * Fire the WEBHOOK rule owning {@code secret}.
     *
     * @throws NotFoundException
     *             if no active rule has this secret
     */
    public TriggerLog fireWebhook(String secret, Map<String, Object> payload) {
        TriggerRule rule = ruleService.findByWebhookSecret(secret)
                .filter(candidate -> candidate.getTriggerType() == TriggerType.WEBHOOK)
                .filter(candidate -> candidate.isActive() && !candidate.isPaused())
                .orElseThrow(() -> new NotFoundException("Webhook trigger", "<secret>"));
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("payload", payload != null ? payload : Map.of());
        return handleMatch(rule, context)
                .orElseThrow(() -> new IllegalStateException("Webhook trigger produced no log"));
    }

    private Optional<TriggerLog> handleMatch(TriggerRule rule, Map<String, Object> context) {
        String tenantId = rule.getTenantId();
        Instant now = clock.instant();

        if (autonomyService.isPaused(tenantId)) {
            return Optional.of(skip(rule, context, "autonomy paused"));
        }

        RateLimitResult limit = rateLimiter.check(rule.getCooldownMinutes(), rule.getMaxTriggersPerDay(),
                rule.getLastTriggeredAt(), logService.firedAt(tenantId, rule.getId()),
                autonomyService.zoneFor(tenantId), now);
        if (!limit.isAllowed()) {
            return Optional.of(skip(rule, context, limit.skipSummary()));
        }

        TriggerRule.Action ruleAction = rule.getAction();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task", ruleAction.getTask());
        payload.put("trigger", context);
        Optional<AgentAction> created = actionService.tryCreate(ActionProposal.builder()
                .tenantId(tenantId)
                .source(AgentAction.Source.TRIGGER)
                .sourceId(rule.getId())
                .agentId(ruleAction.getAgent())
                .actionType(rule.getTriggerType().name().toLowerCase(Locale.ROOT) + "_trigger")
                .category(ruleAction.getCategory())
                .title(rule.getName() + ": " + ruleAction.getTask())
                .requiresApproval(ruleAction.isRequiresApproval())
                .payload(payload)
                .build());
        if (created.isEmpty()) {
            return Optional.of(skip(rule, context, "daily action limit reached"));
        }

        AgentAction action = created.get();
        ruleService.markTriggered(tenantId, rule.getId(), now);
        boolean awaitingApproval = action.getStatus() == AgentAction.Status.PENDING_APPROVAL;
        TriggerLog entry = logService.record(TriggerLog.builder()
                .ruleId(rule.getId())
                .tenantId(tenantId)
                .status(awaitingApproval ? TriggerLog.Status.AWAITING_APPROVAL : TriggerLog.Status.TRIGGERED)
                .triggerContext(context)
                .actionId(action.getId())
                .triggeredAt(now)
                .build());
        log.info("[Triggers] Rule '{}' fired for {} (action {}, {})", rule.getName(), tenantId, action.getId(),
                action.getStatus());

        notifyFired(rule, action);
        if (awaitingApproval) {
            actionExecutionService.requestApproval(action);
        } else {
            AgentAction finished = actionExecutionService.execute(tenantId, action.getId());
            entry.setStatus(finished.getStatus() == AgentAction.Status.COMPLETED
                    ? TriggerLog.Status.COMPLETED
                    : TriggerLog.Status.FAILED);
            entry.setError(finished.getError());
        }
        return Optional.of(entry);
    }

    private void notifyFired(TriggerRule rule, AgentAction action) {
        List<String> channels = rule.getAction().getNotify();
        if (channels == null || channels.isEmpty()) {
            return;
        }
        notificationService.notify(Notification.builder()
                .tenantId(rule.getTenantId())
                .title("Trigger fired: " + rule.getName())
                .body(action.getTitle() + " (" + action.getStatus() + ")")
                .channels(channels)
                .build());
    }

    private TriggerLog skip(TriggerRule rule, Map<String, Object> context, String reason) {
        log.debug("[Triggers] Rule {} for {} skipped: {}", rule.getId(), rule.getTenantId(), reason);
        return logService.record(TriggerLog.builder()
                .ruleId(rule.getId())
                .tenantId(rule.getTenantId())
                .status(TriggerLog.Status.SKIPPED)
                .triggerContext(context)
                .skipReason(reason)
                .triggeredAt(clock.instant())
                .build());
    }

    /**
     * Every filter must hold. A filter value that is an object compares
     * numerically ({@code gt}, {@code gte}, {@code lt}, {@code lte}); anything
     * else is equality.
     */
    static boolean filtersMatch(Map<String, Object> filters, Map<String, Object> data) {
        if (filters == null || filters.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, Object> filter : filters.entrySet()) {
            Object actual = data.get(filter.getKey());
            if (filter.getValue() instanceof Map<?, ?> bounds) {
                Double number = toDouble(actual);
                if (number == null || !withinBounds(number, bounds)) {
                    return false;
                }
            } else if (!valuesEqual(filter.getValue(), actual)) {
                return false;
            }
        }
        return true;
    }

    private static boolean withinBounds(double number, Map<?, ?> bounds) {
        for (Map.Entry<?, ?> bound : bounds.entrySet()) {
            Double limit = toDouble(bound.getValue());
            if (limit == null) {
                return false;
            }
            boolean holds = switch (String.valueOf(bound.getKey())) {
                case "gt" -> number > limit;
                case "gte" -> number >= limit;
                case "lt" -> number < limit;
                case "lte" -> number <= limit;
                case "eq" -> Double.compare(number, limit) == 0;
                default -> false;
            };
            if (!holds) {
                return false;
            }
        }
        return true;
    }

    private static boolean valuesEqual(Object expected, Object actual) {
        Double expectedNumber = toDouble(expected);
        Double actualNumber = toDouble(actual);
        if (expectedNumber != null && actualNumber != null) {
            return Double.compare(expectedNumber, actualNumber) == 0;
        }
        return Objects.equals(expected != null ? expected.toString() : null,
                actual != null ? actual.toString() : null);
    }

    private static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}

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
import me.golemcore.pulse.domain.model.ActionProposal;
import me.golemcore.pulse.domain.model.AgentAction;
import me.golemcore.pulse.domain.model.AgentMessage;
import me.golemcore.pulse.domain.model.AutonomySettings;
import me.golemcore.pulse.domain.model.ChecklistItem;
import me.golemcore.pulse.domain.model.Decision;
import me.golemcore.pulse.domain.model.EvaluationContext;
import me.golemcore.pulse.domain.model.EvaluationResult;
import me.golemcore.pulse.domain.model.EvaluationResult.ResultType;
import me.golemcore.pulse.domain.model.HeartbeatRuleSet;
import me.golemcore.pulse.domain.model.Notification;
import me.golemcore.pulse.domain.model.PublishRequest;
import me.golemcore.pulse.domain.model.RateLimitResult;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.DecisionPort;
import me.golemcore.pulse.port.outbound.MetricsPort;
import me.golemcore.pulse.port.outbound.TenantDirectoryPort;
import me.golemcore.pulse.ratelimit.DecisionRateLimiter;
import me.golemcore.pulse.ratelimit.QuietHoursGate;
import me.golemcore.pulse.ratelimit.TriggerRateLimiter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs due heartbeat rule-sets against every bound tenant and records one
 * ledger row per (rule-set, tenant) evaluation.
 *
 * <p>
 * Per tenant the engine:
 * <ol>
 * <li>skips paused tenants and evaluations over the decision budget</li>
 * <li>assembles metrics, previous metrics and recent ledger memory</li>
 * <li>asks the {@link DecisionPort} on the evaluation pool, bounded by a
 * timeout</li>
 * <li>suppresses fired checks that are in cooldown or over their daily
 * cap</li>
 * <li>publishes insights and escalations, proposes actions, notifies</li>
 * </ol>
 *
 * <p>
 * A failed or timed-out decision is recorded as OK with an error summary and
 * never blocks the other tenants of the tick. The timeout runs from the moment
 * a worker starts the decision call, and a timed-out call is interrupted so
 * its worker is freed for the next tenant. An evaluation that finds the queue
 * full, or waits longer than the timeout for a worker, is recorded SKIPPED. Rule-sets inside their quiet
 * window produce no rows and keep their last run time, so they run once the
 * window closes.
 */
@Service
@Slf4j
public class HeartbeatEngine {

    private static final String ERROR_SUMMARY_PREFIX = "Evaluation error: ";

    private final HeartbeatRuleSetService ruleSetService;
    private final TenantDirectoryPort tenantDirectory;
    private final AutonomyService autonomyService;
    private final MetricsPort metricsPort;
    private final HeartbeatLedgerService ledgerService;
    private final DecisionPort decisionPort;
    private final DecisionRateLimiter decisionRateLimiter;
    private final QuietHoursGate quietHoursGate;
    private final TriggerRateLimiter triggerRateLimiter;
    private final MessageBusService messageBus;
    private final ActionService actionService;
    private final ActionExecutionService actionExecutionService;
    private final NotificationService notificationService;
    private final PulseProperties properties;
    private final Clock clock;
    private final ExecutorService evaluationExecutor;

    public HeartbeatEngine(HeartbeatRuleSetService ruleSetService, TenantDirectoryPort tenantDirectory,
            AutonomyService autonomyService, MetricsPort metricsPort, HeartbeatLedgerService ledgerService,
            DecisionPort decisionPort, DecisionRateLimiter decisionRateLimiter, QuietHoursGate quietHoursGate,
            TriggerRateLimiter triggerRateLimiter, MessageBusService messageBus, ActionService actionService,
            ActionExecutionService actionExecutionService, NotificationService notificationService,
            PulseProperties properties, Clock clock,
            @Qualifier("pulseEvaluationExecutor") ExecutorService evaluationExecutor) {
        this.ruleSetService = ruleSetService;
        this.tenantDirectory = tenantDirectory;
        this.autonomyService = autonomyService;
        this.metricsPort = metricsPort;
        this.ledgerService = ledgerService;
        this.decisionPort = decisionPort;
        this.decisionRateLimiter = decisionRateLimiter;
        this.quietHoursGate = quietHoursGate;
        this.triggerRateLimiter = triggerRateLimiter;
        this.messageBus = messageBus;
        this.actionService = actionService;
        this.actionExecutionService = actionExecutionService;
        this.notificationService = notificationService;
        this.properties = properties;
        this.clock = clock;
        this.evaluationExecutor = evaluationExecutor;
    }

    /**
     * Evaluate every due rule-set. Returns the ledger rows written this tick.
     */
    public List<EvaluationResult> runDueRuleSets() {
        Instant now = clock.instant();
        List<HeartbeatRuleSet> due = ruleSetService.getDue(now);
        if (due.isEmpty()) {
            return List.of();
        }

        List<PendingEvaluation> pending = new ArrayList<>();
        List<EvaluationResult> results = new ArrayList<>();
        for (HeartbeatRuleSet ruleSet : due) {
            if (quietHoursGate.isQuiet(ruleSet.getQuietHours(), now)) {
                log.debug("[Heartbeat] Rule-set {} in quiet hours, deferring", ruleSet.getId());
                continue;
            }
            ruleSetService.markRun(ruleSet.getId(), now);
            for (String tenantId : boundTenants(ruleSet)) {
                Optional<PendingEvaluation> submitted = submit(ruleSet, tenantId, now, results);
                submitted.ifPresent(pending::add);
            }
        }

        for (PendingEvaluation evaluation : pending) {
            try {
                results.add(complete(evaluation));
            } catch (RuntimeException e) { // NOSONAR - intentionally catch all, one tenant must not stop the tick
                log.error("[Heartbeat] Post-processing failed for {}/{}", evaluation.ruleSet().getId(),
                        evaluation.context().getTenantId(), e);
                results.add(ledgerService.append(baseResult(evaluation.ruleSet(), evaluation.context().getTenantId())
                        .resultType(ResultType.OK)
                        .summary(ERROR_SUMMARY_PREFIX + e.getMessage())
                        .model(decisionPort.getName())
                        .timestamp(clock.instant())
                        .build()));
            }
        }

        log.info("[Heartbeat] Tick evaluated {} rule-set(s), wrote {} ledger row(s)", due.size(), results.size());
        return results;
    }

    /**
     * Evaluate one rule-set for one tenant right away, ignoring its schedule
     * and quiet hours. Used by the manual run endpoint.
     */
    public EvaluationResult runNow(String ruleSetId, String tenantId) {
        HeartbeatRuleSet ruleSet = ruleSetService.get(ruleSetId);
        Instant now = clock.instant();
        List<EvaluationResult> skipped = new ArrayList<>();
        Optional<PendingEvaluation> pending = submit(ruleSet, tenantId, now, skipped);
        if (pending.isEmpty()) {
            return skipped.get(0);
        }
        return complete(pending.get());
    }

    private Optional<PendingEvaluation> submit(HeartbeatRuleSet ruleSet, String tenantId, Instant now,
            List<EvaluationResult> results) {
        if (autonomyService.isPaused(tenantId)) {
            results.add(skip(ruleSet, tenantId, "autonomy paused"));
            return Optional.empty();
        }
        RateLimitResult budget = decisionRateLimiter.tryConsume(decisionPort.getName());
        if (!budget.isAllowed()) {
            results.add(skip(ruleSet, tenantId, budget.skipSummary()));
            return Optional.empty();
        }

        EvaluationContext context = EvaluationContext.builder()
                .tenantId(tenantId)
                .agentId(ruleSet.getAgentId())
                .ruleSetId(ruleSet.getId())
                .metrics(new LinkedHashMap<>(metricsPort.latest(tenantId)))
                .previousMetrics(new LinkedHashMap<>(metricsPort.previous(tenantId)))
                .memory(new ArrayList<>(ledgerService.recentSummaries(tenantId, ruleSet.getId(),
                        properties.getHeartbeat().getMemoryEntries())))
                .evaluationTime(now)
                .build();

        CountDownLatch started = new CountDownLatch(1);
        AtomicLong callStartedNanos = new AtomicLong();
        Future<Decision> future;
        try {
            future = evaluationExecutor.submit(() -> {
                callStartedNanos.set(System.nanoTime());
                started.countDown();
                return decisionPort.decide(context, ruleSet.getChecklist());
            });
        } catch (RejectedExecutionException e) {
            log.warn("[Heartbeat] Evaluation queue full, skipping {}/{}", ruleSet.getId(), tenantId);
            results.add(skip(ruleSet, tenantId, "evaluation queue full"));
            return Optional.empty();
        }
        return Optional.of(new PendingEvaluation(ruleSet, context, future, started, callStartedNanos));
    }

    private EvaluationResult complete(PendingEvaluation evaluation) {
        HeartbeatRuleSet ruleSet = evaluation.ruleSet();
        EvaluationContext context = evaluation.context();
        String tenantId = context.getTenantId();

        Decision decision;
        try {
            decision = awaitDecision(evaluation);
        } catch (WorkerUnavailableException e) {
            log.warn("[Heartbeat] No free worker for {}/{}", ruleSet.getId(), tenantId);
            return skip(ruleSet, tenantId, e.getMessage());
        } catch (DecisionFailedException e) {
            log.warn("[Heartbeat] Decision failed for {}/{}: {}", ruleSet.getId(), tenantId, e.getMessage());
            return ledgerService.append(baseResult(ruleSet, tenantId)
                    .resultType(ResultType.OK)
                    .summary(ERROR_SUMMARY_PREFIX + e.getMessage())
                    .contextSnapshot(snapshot(context))
                    .model(decisionPort.getName())
                    .latencyMs(elapsedMillis(evaluation))
                    .timestamp(clock.instant())
                    .build());
        }

        EvaluationResult.EvaluationResultBuilder row = baseResult(ruleSet, tenantId)
                .resultType(decision.getResultType())
                .triggeredCheck(decision.getTriggeredCheck())
                .summary(decision.getSummary())
                .recommendedAction(decision.getRecommendedAction())
                .contextSnapshot(snapshot(context))
                .model(decision.getModel() != null ? decision.getModel() : decisionPort.getName())
                .latencyMs(elapsedMillis(evaluation));

        ResultType type = decision.getResultType() != null ? decision.getResultType() : ResultType.OK;
        if (type == ResultType.OK || type == ResultType.SKIPPED) {
            return ledgerService.append(row.resultType(ResultType.OK).timestamp(clock.instant()).build());
        }

        ChecklistItem item = findItem(ruleSet, decision.getTriggeredCheck());
        Instant now = clock.instant();
        RateLimitResult suppression = checkSuppression(ruleSet, tenantId, decision.getTriggeredCheck(), item, now);
        if (!suppression.isAllowed()) {
            log.debug("[Heartbeat] {}/{} check {} suppressed: {}", ruleSet.getId(), tenantId,
                    decision.getTriggeredCheck(), suppression.getReason());
            return ledgerService.append(row.resultType(ResultType.SKIPPED)
                    .summary(suppression.skipSummary() + " (" + decision.getSummary() + ")")
                    .timestamp(now)
                    .build());
        }

        if (type == ResultType.ACTION) {
            Optional<AgentAction> action = proposeAction(ruleSet, tenantId, decision, item);
            if (action.isEmpty()) {
                return ledgerService.append(row.resultType(ResultType.SKIPPED)
                        .summary("daily action limit reached (" + decision.getSummary() + ")")
                        .timestamp(now)
                        .build());
            }
            row.actionId(action.get().getId());
        } else {
            row.messageId(publish(ruleSet, tenantId, type, decision));
        }

        if (decision.isShouldNotify() || type == ResultType.ESCALATION) {
            row.founderNotified(notifyFounder(ruleSet, tenantId, type, decision));
        }

        EvaluationResult result = ledgerService.append(row.timestamp(clock.instant()).build());
        log.info("[Heartbeat] {}/{} -> {} ({})", ruleSet.getId(), tenantId, type, decision.getTriggeredCheck());
        return result;
    }

    private Decision awaitDecision(PendingEvaluation evaluation) throws DecisionFailedException {
        long timeoutSeconds = properties.getScheduler().getEvaluationTimeoutSeconds();
        long timeoutNanos = TimeUnit.SECONDS.toNanos(timeoutSeconds);
        try {
            if (!evaluation.started().await(timeoutNanos, TimeUnit.NANOSECONDS)) {
                evaluation.future().cancel(true);
                throw new WorkerUnavailableException("no free worker within " + timeoutSeconds + "s");
            }
            long remaining = evaluation.callStartedNanos().get() + timeoutNanos - System.nanoTime();
            Decision decision = evaluation.future().get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
            if (decision == null) {
                throw new DecisionFailedException("no decision returned");
            }
            return decision;
        } catch (TimeoutException e) {
            evaluation.future().cancel(true);
            throw new DecisionFailedException("timed out after " + timeoutSeconds + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new DecisionFailedException(cause.getMessage() != null ? cause.getMessage()
                    : cause.getClass().getSimpleName());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DecisionFailedException("interrupted");
        }
    }

    private RateLimitResult checkSuppression(HeartbeatRuleSet ruleSet, String tenantId, String check,
            ChecklistItem item, Instant now) {
        if (item == null) {
            return RateLimitResult.unlimited();
        }
        List<Instant> fired = ledgerService.firedAt(tenantId, ruleSet.getId(), check);
        Instant lastFired = fired.stream().max(Instant::compareTo).orElse(null);
        return triggerRateLimiter.check(item.getCooldownMinutes(), item.getMaxTriggersPerDay(), lastFired, fired,
                autonomyService.zoneFor(tenantId), now);
    }

    private Optional<AgentAction> proposeAction(HeartbeatRuleSet ruleSet, String tenantId, Decision decision,
            ChecklistItem item) {
        String title = decision.getRecommendedAction() != null && !decision.getRecommendedAction().isBlank()
                ? decision.getRecommendedAction()
                : decision.getSummary();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task", title);
        payload.put("summary", decision.getSummary());
        payload.put("check", decision.getTriggeredCheck());

        Optional<AgentAction> created = actionService.tryCreate(ActionProposal.builder()
                .tenantId(tenantId)
                .source(AgentAction.Source.HEARTBEAT)
                .sourceId(ruleSet.getId())
                .agentId(ruleSet.getAgentId())
                .actionType(item != null && item.getAction() != null ? item.getAction() : "heartbeat_action")
                .category(item != null ? item.getCategory() : null)
                .title(title)
                .requiresApproval(item != null && item.isRequiresApproval())
                .payload(payload)
                .build());

        created.ifPresent(action -> {
            if (action.getStatus() == AgentAction.Status.PENDING_APPROVAL) {
                actionExecutionService.requestApproval(action);
            } else {
                actionExecutionService.execute(tenantId, action.getId());
            }
        });
        return created;
    }

    private String publish(HeartbeatRuleSet ruleSet, String tenantId, ResultType type, Decision decision) {
        boolean escalation = type == ResultType.ESCALATION;
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("summary", decision.getSummary());
        payload.put("check", decision.getTriggeredCheck());
        payload.put("rule_set_id", ruleSet.getId());
        if (decision.getRecommendedAction() != null) {
            payload.put("recommended_action", decision.getRecommendedAction());
        }

        List<AgentMessage> published = messageBus.publish(PublishRequest.builder()
                .tenantId(tenantId)
                .fromAgent(ruleSet.getAgentId())
                .topic(ruleSet.resolveTopicPrefix() + (escalation ? ".escalation" : ".insight"))
                .messageType(escalation ? AgentMessage.MessageType.ALERT : AgentMessage.MessageType.INSIGHT)
                .priority(escalation ? AgentMessage.Priority.HIGH : AgentMessage.Priority.MEDIUM)
                .payload(payload)
                .build());
        return published.isEmpty() ? null : published.get(0).getId();
    }

    private boolean notifyFounder(HeartbeatRuleSet ruleSet, String tenantId, ResultType type, Decision decision) {
        AutonomySettings settings = autonomyService.get(tenantId);
        return notificationService.notify(Notification.builder()
                .tenantId(tenantId)
                .title("[" + type + "] " + ruleSet.getAgentId() + ": "
                        + (decision.getTriggeredCheck() != null ? decision.getTriggeredCheck() : ruleSet.getId()))
                .body(decision.getSummary())
                .channels(settings.getNotifyChannels())
                .build());
    }

    private List<String> boundTenants(HeartbeatRuleSet ruleSet) {
        List<String> configured = ruleSet.getTenants();
        if (configured == null || configured.isEmpty() || configured.contains(HeartbeatRuleSet.ALL_TENANTS)) {
            return tenantDirectory.listTenants();
        }
        return configured;
    }

    private EvaluationResult skip(HeartbeatRuleSet ruleSet, String tenantId, String reason) {
        log.debug("[Heartbeat] Skipping {}/{}: {}", ruleSet.getId(), tenantId, reason);
        return ledgerService.append(baseResult(ruleSet, tenantId)
                .resultType(ResultType.SKIPPED)
                .summary(reason)
                .model(decisionPort.getName())
                .timestamp(clock.instant())
                .build());
    }

    private static EvaluationResult.EvaluationResultBuilder baseResult(HeartbeatRuleSet ruleSet, String tenantId) {
        return EvaluationResult.builder()
                .tenantId(tenantId)
                .ruleSetId(ruleSet.getId())
                .agentId(ruleSet.getAgentId());
    }

    private static ChecklistItem findItem(HeartbeatRuleSet ruleSet, String check) {
        if (check == null) {
            return null;
        }
        return ruleSet.getChecklist().stream()
                .filter(item -> check.equals(item.getCheck()))
                .findFirst()
                .orElse(null);
    }

    private static Map<String, Object> snapshot(EvaluationContext context) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("metrics", context.getMetrics());
        snapshot.put("previous_metrics", context.getPreviousMetrics());
        snapshot.put("memory_entries", context.getMemory().size());
        return snapshot;
    }

    private static long elapsedMillis(PendingEvaluation evaluation) {
        long callStarted = evaluation.callStartedNanos().get();
        return callStarted == 0 ? 0 : Duration.ofNanos(System.nanoTime() - callStarted).toMillis();
    }

    private record PendingEvaluation(HeartbeatRuleSet ruleSet, EvaluationContext context,
            Future<Decision> future, CountDownLatch started, AtomicLong callStartedNanos) {
    }

    private static class DecisionFailedException extends Exception {
        private static final long serialVersionUID = 1L;

        DecisionFailedException(String message) {
            super(message);
        }
    }

    private static final class WorkerUnavailableException extends DecisionFailedException {
        private static final long serialVersionUID = 1L;

        WorkerUnavailableException(String message) {
            super(message);
        }
    }
}

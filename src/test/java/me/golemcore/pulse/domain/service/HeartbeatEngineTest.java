package me.golemcore.pulse.domain.service;

import me.golemcore.pulse.domain.model.AgentAction;
import me.golemcore.pulse.domain.model.AgentMessage;
import me.golemcore.pulse.domain.model.ChecklistItem;
import me.golemcore.pulse.domain.model.Decision;
import me.golemcore.pulse.domain.model.EvaluationContext;
import me.golemcore.pulse.domain.model.EvaluationResult;
import me.golemcore.pulse.domain.model.EvaluationResult.ResultType;
import me.golemcore.pulse.domain.model.HeartbeatRuleSet;
import me.golemcore.pulse.domain.model.SubscriptionRegistry;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.AdvisorPort;
import me.golemcore.pulse.port.outbound.DecisionPort;
import me.golemcore.pulse.port.outbound.MetricsPort;
import me.golemcore.pulse.ratelimit.DecisionRateLimiter;
import me.golemcore.pulse.ratelimit.QuietHoursGate;
import me.golemcore.pulse.ratelimit.TriggerRateLimiter;
import me.golemcore.pulse.testsupport.MutableClock;
import me.golemcore.pulse.testsupport.PulseTestSupport;
import me.golemcore.pulse.testsupport.RecordingNotificationPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HeartbeatEngineTest {

    private static final String TENANT = "acme";
    private static final String OTHER_TENANT = "globex";
    private static final String RULE_SET = "revenue-watch";
    private static final Instant MORNING = Instant.parse("2026-03-02T08:00:00Z");

    private MutableClock clock;
    private List<String> tenants;
    private DecisionPort decisionPort;
    private RecordingNotificationPort notifications;
    private AutonomyService autonomyService;
    private ActionService actionService;
    private HeartbeatLedgerService ledgerService;
    private HeartbeatRuleSetService ruleSetService;
    private MessageBusService messageBus;
    private PulseProperties properties;
    private MetricsPort metricsPort;
    private NotificationService notificationService;
    private ActionExecutionService actionExecutionService;
    private ExecutorService executor;
    private HeartbeatEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(MORNING);
        tenants = new ArrayList<>(List.of(TENANT));
        JsonTableStore tableStore = PulseTestSupport.tableStore();
        properties = new PulseProperties();
        properties.getScheduler().setEvaluationTimeoutSeconds(5);

        decisionPort = mock(DecisionPort.class);
        when(decisionPort.getName()).thenReturn("stub");
        metricsPort = mock(MetricsPort.class);
        when(metricsPort.latest(anyString())).thenReturn(Map.of("mrr", 9000.0));
        when(metricsPort.previous(anyString())).thenReturn(Map.of("mrr", 10000.0));
        AdvisorPort advisorPort = mock(AdvisorPort.class);

        notifications = new RecordingNotificationPort();
        notificationService = new NotificationService(List.of(notifications));
        autonomyService = new AutonomyService(tableStore, clock);
        actionService = new ActionService(tableStore, autonomyService, properties, clock);
        ledgerService = new HeartbeatLedgerService(tableStore, clock);
        ruleSetService = new HeartbeatRuleSetService(tableStore, properties,
                new AutonomyPolicyLinter(autonomyService), () -> tenants, clock);
        messageBus = new MessageBusService(tableStore,
                new SubscriptionRegistry("1", Map.of("business_copilot", List.of("revenue.*"))), clock);
        actionExecutionService = new ActionExecutionService(actionService, advisorPort,
                autonomyService, notificationService, new TriggerLogService(tableStore, clock));
        executor = Executors.newFixedThreadPool(2);

        engine = newEngine(executor);
    }

    private HeartbeatEngine newEngine(ExecutorService evaluationExecutor) {
        return new HeartbeatEngine(ruleSetService, () -> tenants, autonomyService, metricsPort, ledgerService,
                decisionPort, new DecisionRateLimiter(properties), new QuietHoursGate(), new TriggerRateLimiter(),
                messageBus, actionService, actionExecutionService, notificationService, properties, clock,
                evaluationExecutor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    // ===== Quiet hours =====

    @Test
    void shouldDeferRuleSetDuringQuietHoursAndRunAfterwards() {
        ruleSetService.create(ruleSet(check(0, 0)));
        decide(Decision.builder().resultType(ResultType.OK).summary("all good").build());

        clock.set(Instant.parse("2026-03-01T23:30:00Z"));
        assertTrue(engine.runDueRuleSets().isEmpty());
        assertNull(ruleSetService.get(RULE_SET).getLastRunAt());
        verify(decisionPort, never()).decide(any(), any());

        clock.set(MORNING);
        List<EvaluationResult> results = engine.runDueRuleSets();

        assertEquals(1, results.size());
        assertEquals(ResultType.OK, results.get(0).getResultType());
        assertEquals(MORNING, ruleSetService.get(RULE_SET).getLastRunAt());
    }

    @Test
    void shouldNotRunAgainBeforeInterval() {
        ruleSetService.create(ruleSet(check(0, 0)));
        decide(Decision.builder().resultType(ResultType.OK).summary("fine").build());

        assertEquals(1, engine.runDueRuleSets().size());
        clock.advance(Duration.ofMinutes(30));
        assertTrue(engine.runDueRuleSets().isEmpty());
    }

    // ===== Suppression =====

    @Test
    void shouldSuppressCheckInsideCooldown() {
        ruleSetService.create(ruleSet(check(120, 0)));
        decide(insight());

        EvaluationResult first = engine.runDueRuleSets().get(0);
        clock.advance(Duration.ofMinutes(60));
        EvaluationResult second = engine.runDueRuleSets().get(0);
        clock.advance(Duration.ofMinutes(60));
        EvaluationResult third = engine.runDueRuleSets().get(0);

        assertEquals(ResultType.INSIGHT, first.getResultType());
        assertEquals(ResultType.SKIPPED, second.getResultType());
        assertTrue(second.getSummary().startsWith("cooldown active (120 min), retry in 1h ("));
        assertEquals(ResultType.INSIGHT, third.getResultType());
    }

    @Test
    void shouldSuppressCheckOverDailyCap() {
        ruleSetService.create(ruleSet(check(0, 2)));
        decide(insight());

        List<ResultType> types = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            types.add(engine.runDueRuleSets().get(0).getResultType());
            clock.advance(Duration.ofMinutes(60));
        }

        assertEquals(List.of(ResultType.INSIGHT, ResultType.INSIGHT, ResultType.SKIPPED), types);
    }

    // ===== Outcomes =====

    @Test
    void shouldPublishInsightToSubscribers() {
        ruleSetService.create(ruleSet(check(0, 0)));
        decide(insight());

        EvaluationResult result = engine.runDueRuleSets().get(0);

        assertNotNull(result.getMessageId());
        List<AgentMessage> inbox = messageBus.getInbox(TENANT, "business_copilot", null, 10);
        assertEquals(1, inbox.size());
        assertEquals("revenue.insight", inbox.get(0).getTopic());
        assertFalse(result.isFounderNotified());
    }

    @Test
    void shouldPublishAndNotifyEscalation() {
        ruleSetService.create(ruleSet(check(0, 0)));
        decide(Decision.builder()
                .resultType(ResultType.ESCALATION)
                .triggeredCheck("mrr_drop")
                .summary("MRR fell 30%")
                .build());

        EvaluationResult result = engine.runDueRuleSets().get(0);

        assertEquals(ResultType.ESCALATION, result.getResultType());
        assertTrue(result.isFounderNotified());
        assertEquals(1, notifications.getSent().size());
        AgentMessage alert = messageBus.getInbox(TENANT, "business_copilot", null, 10).get(0);
        assertEquals("revenue.escalation", alert.getTopic());
        assertEquals(AgentMessage.MessageType.ALERT, alert.getMessageType());
        assertEquals(AgentMessage.Priority.HIGH, alert.getPriority());
    }

    @Test
    void shouldProposeActionAwaitingApproval() {
        ruleSetService.create(ruleSet(check(0, 0)));
        decide(Decision.builder()
                .resultType(ResultType.ACTION)
                .triggeredCheck("mrr_drop")
                .summary("MRR fell 10%")
                .recommendedAction("Email churned accounts")
                .build());

        EvaluationResult result = engine.runDueRuleSets().get(0);

        assertNotNull(result.getActionId());
        AgentAction action = actionService.get(TENANT, result.getActionId());
        assertEquals(AgentAction.Status.PENDING_APPROVAL, action.getStatus());
        assertEquals("Email churned accounts", action.getTitle());
        assertEquals(AgentAction.Source.HEARTBEAT, action.getSource());
        assertTrue(notifications.getSent().get(0).getTitle().startsWith("Approval needed"));
    }

    // ===== Isolation =====

    @Test
    void shouldIsolateFailingTenant() {
        tenants.add(OTHER_TENANT);
        ruleSetService.create(ruleSet(check(0, 0)));
        when(decisionPort.decide(any(), any())).thenAnswer(invocation -> {
            EvaluationContext context = invocation.getArgument(0);
            if (TENANT.equals(context.getTenantId())) {
                throw new IllegalStateException("boom");
            }
            return insight();
        });

        List<EvaluationResult> results = engine.runDueRuleSets();

        assertEquals(2, results.size());
        EvaluationResult failed = byTenant(results, TENANT);
        EvaluationResult ok = byTenant(results, OTHER_TENANT);
        assertEquals(ResultType.OK, failed.getResultType());
        assertEquals("Evaluation error: boom", failed.getSummary());
        assertEquals(ResultType.INSIGHT, ok.getResultType());
    }

    @Test
    void shouldNotChargeQueuedTenantForSlowTenantsTimeout() {
        tenants.add(OTHER_TENANT);
        ruleSetService.create(ruleSet(check(0, 0)));
        properties.getScheduler().setEvaluationTimeoutSeconds(1);
        when(decisionPort.decide(any(), any())).thenAnswer(invocation -> {
            EvaluationContext context = invocation.getArgument(0);
            if (TENANT.equals(context.getTenantId())) {
                Thread.sleep(4000);
            }
            return insight();
        });
        ExecutorService singleWorker = Executors.newFixedThreadPool(1);
        try {
            long startedAt = System.nanoTime();
            List<EvaluationResult> results = newEngine(singleWorker).runDueRuleSets();
            long elapsedMillis = Duration.ofNanos(System.nanoTime() - startedAt).toMillis();

            assertEquals(2, results.size());
            EvaluationResult slow = byTenant(results, TENANT);
            EvaluationResult fast = byTenant(results, OTHER_TENANT);
            assertEquals(ResultType.OK, slow.getResultType());
            assertEquals("Evaluation error: timed out after 1s", slow.getSummary());
            assertEquals(ResultType.INSIGHT, fast.getResultType());
            assertTrue(elapsedMillis < 3500, "slow call should be interrupted, took " + elapsedMillis + "ms");
        } finally {
            singleWorker.shutdownNow();
        }
    }

    @Test
    void shouldSkipEvaluationWhenQueueIsFull() {
        ruleSetService.create(ruleSet(check(0, 0)));
        ExecutorService rejecting = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(1), new ThreadPoolExecutor.AbortPolicy());
        rejecting.shutdown();

        List<EvaluationResult> results = newEngine(rejecting).runDueRuleSets();

        assertEquals(1, results.size());
        assertEquals(ResultType.SKIPPED, results.get(0).getResultType());
        assertEquals("evaluation queue full", results.get(0).getSummary());
        verify(decisionPort, never()).decide(any(), any());
    }

    @Test
    void shouldSkipPausedTenantWithoutCallingDecision() {
        tenants.add(OTHER_TENANT);
        ruleSetService.create(ruleSet(check(0, 0)));
        autonomyService.pause(TENANT, "vacation");
        decide(insight());

        List<EvaluationResult> results = engine.runDueRuleSets();

        EvaluationResult skipped = byTenant(results, TENANT);
        assertEquals(ResultType.SKIPPED, skipped.getResultType());
        assertEquals("autonomy paused", skipped.getSummary());
        assertEquals(ResultType.INSIGHT, byTenant(results, OTHER_TENANT).getResultType());
    }

    @Test
    void shouldRunNowIgnoringSchedule() {
        ruleSetService.create(ruleSet(check(0, 0)));
        decide(insight());
        engine.runDueRuleSets();

        EvaluationResult manual = engine.runNow(RULE_SET, TENANT);

        assertEquals(ResultType.INSIGHT, manual.getResultType());
        assertEquals(2, ledgerService.list(TENANT).size());
    }

    private void decide(Decision decision) {
        when(decisionPort.decide(any(), any())).thenReturn(decision);
    }

    private static Decision insight() {
        return Decision.builder()
                .resultType(ResultType.INSIGHT)
                .triggeredCheck("mrr_drop")
                .summary("MRR fell 10%")
                .build();
    }

    private static EvaluationResult byTenant(List<EvaluationResult> results, String tenantId) {
        return results.stream()
                .filter(result -> tenantId.equals(result.getTenantId()))
                .findFirst()
                .orElseThrow();
    }

    private static ChecklistItem check(int cooldownMinutes, int maxPerDay) {
        return ChecklistItem.builder()
                .check("mrr_drop")
                .description("MRR dropped")
                .metric("mrr")
                .operator("decreases_by")
                .threshold(5.0)
                .percent(true)
                .category("outreach")
                .cooldownMinutes(cooldownMinutes)
                .maxTriggersPerDay(maxPerDay)
                .build();
    }

    private static HeartbeatRuleSet ruleSet(ChecklistItem item) {
        HeartbeatRuleSet.QuietHours quietHours = new HeartbeatRuleSet.QuietHours();
        quietHours.setEnabled(true);
        quietHours.setTimezone("UTC");
        quietHours.setStart("22:00");
        quietHours.setEnd("07:00");
        return HeartbeatRuleSet.builder()
                .id(RULE_SET)
                .agentId("revenue_agent")
                .topicPrefix("revenue")
                .intervalMinutes(60)
                .tenants(new ArrayList<>(List.of(HeartbeatRuleSet.ALL_TENANTS)))
                .quietHours(quietHours)
                .checklist(new ArrayList<>(List.of(item)))
                .build();
    }
}

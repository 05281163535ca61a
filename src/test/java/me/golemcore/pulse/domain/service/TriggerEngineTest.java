package me.golemcore.pulse.domain.service;

import me.golemcore.pulse.adapter.outbound.metrics.StoredMetricsAdapter;
import me.golemcore.pulse.domain.exception.NotFoundException;
import me.golemcore.pulse.domain.model.Advice;
import me.golemcore.pulse.domain.model.AgentAction;
import me.golemcore.pulse.domain.model.AutonomySettingsPatch;
import me.golemcore.pulse.domain.model.TriggerLog;
import me.golemcore.pulse.domain.model.TriggerRule;
import me.golemcore.pulse.domain.model.TriggerRule.TriggerType;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.AdvisorPort;
import me.golemcore.pulse.ratelimit.TriggerRateLimiter;
import me.golemcore.pulse.testsupport.MutableClock;
import me.golemcore.pulse.testsupport.PulseTestSupport;
import me.golemcore.pulse.testsupport.RecordingNotificationPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TriggerEngineTest {

    private static final String TENANT = "acme";

    private MutableClock clock;
    private AdvisorPort advisorPort;
    private RecordingNotificationPort notifications;
    private AutonomyService autonomyService;
    private ActionService actionService;
    private TriggerRuleService ruleService;
    private TriggerLogService logService;
    private ActionExecutionService actionExecutionService;
    private StoredMetricsAdapter metrics;
    private TriggerEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T08:00:00Z"));
        JsonTableStore tableStore = PulseTestSupport.tableStore();
        advisorPort = mock(AdvisorPort.class);
        when(advisorPort.respond(any())).thenReturn(Advice.builder().content("handled").build());
        notifications = new RecordingNotificationPort();
        NotificationService notificationService = new NotificationService(List.of(notifications));
        autonomyService = new AutonomyService(tableStore, clock);
        actionService = new ActionService(tableStore, autonomyService, new PulseProperties(), clock);
        ruleService = new TriggerRuleService(tableStore, clock);
        logService = new TriggerLogService(tableStore, clock);
        actionExecutionService = new ActionExecutionService(actionService, advisorPort,
                autonomyService, notificationService, logService);
        metrics = new StoredMetricsAdapter(tableStore, clock);
        engine = newEngine(notificationService);
    }

    private TriggerEngine newEngine(NotificationService notificationService) {
        return new TriggerEngine(ruleService, logService, new TriggerRateLimiter(), autonomyService,
                actionService, actionExecutionService, notificationService, metrics, clock);
    }

    private TriggerEngine engineWithFailingFiredNotice() {
        NotificationService failing = mock(NotificationService.class);
        when(failing.notify(argThat(notification -> notification != null
                && notification.getTitle().startsWith("Trigger fired"))))
                .thenThrow(new IllegalStateException("channel down"));
        return newEngine(failing);
    }

    // ===== Metric triggers =====

    @Test
    void shouldFireMetricRuleOnThresholdCrossing() {
        ruleService.create(TENANT, metricRule("churn_rate", "gt", 5.0));

        assertTrue(engine.ingestMetrics(TENANT, Map.of("churn_rate", 4.0)).isEmpty());
        clock.advance(Duration.ofMinutes(1));
        List<TriggerLog> fired = engine.ingestMetrics(TENANT, Map.of("churn_rate", 6.5));

        assertEquals(1, fired.size());
        TriggerLog entry = fired.get(0);
        assertEquals(TriggerLog.Status.AWAITING_APPROVAL, entry.getStatus());
        assertEquals(6.5, entry.getTriggerContext().get("current"));
        AgentAction action = actionService.get(TENANT, entry.getActionId());
        assertEquals(AgentAction.Source.TRIGGER, action.getSource());
        assertEquals(1, ruleService.list(TENANT, false).get(0).getTriggerCount());
    }

    @Test
    void shouldCompareAgainstPreviousSnapshotForChangeOperators() {
        TriggerRule rule = metricRule("mrr", "decreases_by", 10.0);
        rule.getCondition().setPercent(true);
        ruleService.create(TENANT, rule);

        engine.ingestMetrics(TENANT, Map.of("mrr", 10000.0));
        clock.advance(Duration.ofMinutes(1));
        assertTrue(engine.ingestMetrics(TENANT, Map.of("mrr", 9500.0)).isEmpty());
        clock.advance(Duration.ofMinutes(1));
        assertEquals(1, engine.ingestMetrics(TENANT, Map.of("mrr", 8000.0)).size());
    }

    @Test
    void shouldExecuteImmediatelyOnAutopilot() {
        autonomyService.update(TENANT, AutonomySettingsPatch.builder().globalLevel("AUTOPILOT").build());
        ruleService.create(TENANT, metricRule("churn_rate", "gt", 5.0));

        TriggerLog entry = engine.ingestMetrics(TENANT, Map.of("churn_rate", 9.0)).get(0);

        assertEquals(TriggerLog.Status.COMPLETED, entry.getStatus());
        assertEquals(AgentAction.Status.COMPLETED, actionService.get(TENANT, entry.getActionId()).getStatus());
    }

    @Test
    void shouldKeepFiringMetricRulesWhenOneRuleFails() {
        TriggerRule broken = metricRule("churn_rate", "gt", 5.0);
        broken.getAction().setNotify(List.of("in_app"));
        ruleService.create(TENANT, broken);
        TriggerRule created = ruleService.create(TENANT, metricRule("churn_rate", "gt", 3.0));

        List<TriggerLog> fired = engineWithFailingFiredNotice().ingestMetrics(TENANT, Map.of("churn_rate", 6.0));

        assertEquals(1, fired.size());
        assertEquals(created.getId(), fired.get(0).getRuleId());
        assertEquals(1, actionService.listAll(TENANT).stream()
                .filter(action -> created.getId().equals(action.getSourceId()))
                .count());
    }

    @Test
    void shouldSkipInsideCooldown() {
        TriggerRule rule = metricRule("churn_rate", "gt", 5.0);
        rule.setCooldownMinutes(60);
        ruleService.create(TENANT, rule);

        engine.ingestMetrics(TENANT, Map.of("churn_rate", 6.0));
        clock.advance(Duration.ofMinutes(10));
        TriggerLog second = engine.ingestMetrics(TENANT, Map.of("churn_rate", 7.0)).get(0);

        assertEquals(TriggerLog.Status.SKIPPED, second.getStatus());
        assertEquals("cooldown active (60 min), retry in 50m", second.getSkipReason());
        assertNull(second.getActionId());
    }

    @Test
    void shouldSkipWhenTenantPaused() {
        ruleService.create(TENANT, metricRule("churn_rate", "gt", 5.0));
        autonomyService.pause(TENANT, "review");

        TriggerLog entry = engine.ingestMetrics(TENANT, Map.of("churn_rate", 6.0)).get(0);

        assertEquals(TriggerLog.Status.SKIPPED, entry.getStatus());
        assertEquals("autonomy paused", entry.getSkipReason());
        assertTrue(actionService.listAll(TENANT).isEmpty());
    }

    @Test
    void shouldSkipWhenDailyActionLimitReached() {
        autonomyService.update(TENANT, AutonomySettingsPatch.builder().dailyActionLimit(1).build());
        TriggerRule rule = metricRule("churn_rate", "gt", 5.0);
        rule.setCooldownMinutes(0);
        ruleService.create(TENANT, rule);

        engine.ingestMetrics(TENANT, Map.of("churn_rate", 6.0));
        TriggerLog second = engine.ingestMetrics(TENANT, Map.of("churn_rate", 7.0)).get(0);

        assertEquals("daily action limit reached", second.getSkipReason());
    }

    // ===== Event triggers =====

    @Test
    void shouldMatchEventWithFilters() {
        TriggerRule rule = baseRule("Big deal", TriggerType.EVENT);
        rule.getCondition().setEvent("deal_closed");
        rule.getCondition().setFilters(Map.of("amount", Map.of("gte", 10000), "region", "EU"));
        ruleService.create(TENANT, rule);

        assertTrue(engine.evaluateEvent(TENANT, "deal_closed", Map.of("amount", 500, "region", "EU")).isEmpty());
        assertTrue(engine.evaluateEvent(TENANT, "deal_lost", Map.of("amount", 50000, "region", "EU")).isEmpty());
        assertEquals(1, engine.evaluateEvent(TENANT, "deal_closed",
                Map.of("amount", 25000, "region", "EU")).size());
    }

    @Test
    void shouldKeepFiringEventRulesWhenOneRuleFails() {
        TriggerRule broken = baseRule("Broken", TriggerType.EVENT);
        broken.getCondition().setEvent("deal_closed");
        broken.getAction().setNotify(List.of("in_app"));
        ruleService.create(TENANT, broken);
        TriggerRule healthy = baseRule("Healthy", TriggerType.EVENT);
        healthy.getCondition().setEvent("deal_closed");
        TriggerRule created = ruleService.create(TENANT, healthy);

        List<TriggerLog> fired = engineWithFailingFiredNotice().evaluateEvent(TENANT, "deal_closed", Map.of());

        assertEquals(1, fired.size());
        assertEquals(created.getId(), fired.get(0).getRuleId());
        assertEquals(TriggerLog.Status.AWAITING_APPROVAL, fired.get(0).getStatus());
    }

    @Test
    void shouldRejectBlankEvent() {
        assertThrows(IllegalArgumentException.class, () -> engine.evaluateEvent(TENANT, " ", Map.of()));
    }

    @Test
    void shouldNotifyConfiguredChannelsWhenFired() {
        TriggerRule rule = baseRule("Deal", TriggerType.EVENT);
        rule.getCondition().setEvent("deal_closed");
        rule.getAction().setNotify(List.of("in_app"));
        ruleService.create(TENANT, rule);

        engine.evaluateEvent(TENANT, "deal_closed", Map.of());

        assertTrue(notifications.getSent().stream()
                .anyMatch(notification -> notification.getTitle().equals("Trigger fired: Deal")));
    }

    // ===== Time and webhook triggers =====

    @Test
    void shouldFireTimeRuleOncePerOccurrence() {
        TriggerRule rule = baseRule("Morning digest", TriggerType.TIME);
        rule.getCondition().setCron("0 9 * * *");
        ruleService.create(TENANT, rule);

        assertTrue(engine.evaluateTimeTriggers().isEmpty());
        clock.set(Instant.parse("2026-03-02T09:01:00Z"));
        assertEquals(1, engine.evaluateTimeTriggers().size());
        clock.set(Instant.parse("2026-03-02T09:02:00Z"));
        assertTrue(engine.evaluateTimeTriggers().isEmpty());
    }

    @Test
    void shouldFireWebhookRuleBySecret() {
        TriggerRule created = ruleService.create(TENANT, baseRule("Stripe hook", TriggerType.WEBHOOK));

        assertNotNull(created.getWebhookSecret());
        TriggerLog entry = engine.fireWebhook(created.getWebhookSecret(), Map.of("type", "invoice.paid"));

        assertEquals(created.getId(), entry.getRuleId());
        assertEquals(Map.of("type", "invoice.paid"), entry.getTriggerContext().get("payload"));
        assertThrows(NotFoundException.class, () -> engine.fireWebhook("nope", Map.of()));
    }

    @Test
    void shouldIgnorePausedRules() {
        TriggerRule rule = ruleService.create(TENANT, metricRule("churn_rate", "gt", 5.0));
        ruleService.pause(TENANT, rule.getId());

        assertTrue(engine.ingestMetrics(TENANT, Map.of("churn_rate", 9.0)).isEmpty());
    }

    // ===== Filters =====

    @Test
    void shouldRequireEveryFilter() {
        assertTrue(TriggerEngine.filtersMatch(Map.of(), Map.of("a", 1)));
        assertTrue(TriggerEngine.filtersMatch(Map.of("plan", "pro"), Map.of("plan", "pro")));
        assertFalse(TriggerEngine.filtersMatch(Map.of("plan", "pro"), Map.of()));
        assertTrue(TriggerEngine.filtersMatch(Map.of("seats", Map.of("gt", 5, "lte", 10)), Map.of("seats", 10)));
        assertFalse(TriggerEngine.filtersMatch(Map.of("seats", Map.of("gt", 5)), Map.of("seats", "many")));
    }

    private static TriggerRule metricRule(String metric, String operator, double value) {
        TriggerRule rule = baseRule("Metric " + metric, TriggerType.METRIC);
        rule.getCondition().setMetric(metric);
        rule.getCondition().setOperator(operator);
        rule.getCondition().setValue(value);
        rule.setCooldownMinutes(0);
        return rule;
    }

    private static TriggerRule baseRule(String name, TriggerType type) {
        return TriggerRule.builder()
                .name(name)
                .triggerType(type)
                .condition(TriggerRule.Condition.builder().build())
                .action(TriggerRule.Action.builder()
                        .agent("sales_agent")
                        .task("Follow up")
                        .category("outreach")
                        .build())
                .build();
    }
}

package me.golemcore.pulse.adapter.outbound.decision;

import me.golemcore.pulse.domain.model.ChecklistItem;
import me.golemcore.pulse.domain.model.Decision;
import me.golemcore.pulse.domain.model.EvaluationContext;
import me.golemcore.pulse.domain.model.EvaluationResult.ResultType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RuleBasedDecisionAdapterTest {

    private final RuleBasedDecisionAdapter adapter = new RuleBasedDecisionAdapter();

    private static final ChecklistItem MRR_DROP = ChecklistItem.builder()
            .check("mrr_drop").metric("mrr").operator("decreases_by").threshold(10.0).percent(true)
            .escalateThreshold(25.0).action("Review pricing").build();
    private static final ChecklistItem CHURN_SPIKE = ChecklistItem.builder()
            .check("churn_spike").metric("churn_rate").operator("gt").threshold(5.0)
            .onBreach(ResultType.ACTION).build();

    @Test
    void shouldReturnOkWhenNothingBreached() {
        Decision decision = adapter.decide(context(Map.of("mrr", 9500.0, "churn_rate", 2.0), Map.of("mrr", 10000.0)),
                List.of(MRR_DROP, CHURN_SPIKE));

        assertEquals(ResultType.OK, decision.getResultType());
        assertEquals("All 2 checks passed", decision.getSummary());
        assertEquals(RuleBasedDecisionAdapter.NAME, decision.getModel());
    }

    @Test
    void shouldUseOnBreachResult() {
        Decision decision = adapter.decide(context(Map.of("churn_rate", 6.5), Map.of()), List.of(CHURN_SPIKE));

        assertEquals(ResultType.ACTION, decision.getResultType());
        assertEquals("churn_spike", decision.getTriggeredCheck());
        assertEquals("churn_spike: churn_rate=6.5 gt 5", decision.getSummary());
        assertFalse(decision.isShouldNotify());
    }

    @Test
    void shouldEscalateBeyondEscalationThresholdAndNotify() {
        Decision decision = adapter.decide(context(Map.of("mrr", 7000.0), Map.of("mrr", 10000.0)),
                List.of(MRR_DROP));

        assertEquals(ResultType.ESCALATION, decision.getResultType());
        assertEquals("Review pricing", decision.getRecommendedAction());
        assertTrue(decision.isShouldNotify());
    }

    @Test
    void shouldPickMostSevereBreach() {
        Decision decision = adapter.decide(
                context(Map.of("mrr", 8500.0, "churn_rate", 9.0), Map.of("mrr", 10000.0)),
                List.of(MRR_DROP, CHURN_SPIKE));

        assertEquals(ResultType.ACTION, decision.getResultType());
        assertEquals("churn_spike", decision.getTriggeredCheck());
    }

    @Test
    void shouldIgnoreDescriptionOnlyItemsAndMissingMetrics() {
        ChecklistItem freeform = ChecklistItem.builder().check("morale").description("Is the team ok?").build();

        Decision decision = adapter.decide(context(Map.of(), Map.of()), List.of(freeform, CHURN_SPIKE));

        assertEquals(ResultType.OK, decision.getResultType());
    }

    private static EvaluationContext context(Map<String, Double> metrics, Map<String, Double> previous) {
        return EvaluationContext.builder()
                .tenantId("acme")
                .agentId("business_copilot")
                .metrics(metrics)
                .previousMetrics(previous)
                .build();
    }
}

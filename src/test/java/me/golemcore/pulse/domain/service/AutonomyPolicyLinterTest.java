package me.golemcore.pulse.domain.service;

import me.golemcore.pulse.domain.model.AutonomySettingsPatch;
import me.golemcore.pulse.domain.model.ChecklistItem;
import me.golemcore.pulse.domain.model.EvaluationResult.ResultType;
import me.golemcore.pulse.domain.model.HeartbeatRuleSet;
import me.golemcore.pulse.testsupport.MutableClock;
import me.golemcore.pulse.testsupport.PulseTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AutonomyPolicyLinterTest {

    private AutonomyService autonomyService;
    private AutonomyPolicyLinter linter;

    @BeforeEach
    void setUp() {
        autonomyService = new AutonomyService(PulseTestSupport.tableStore(),
                new MutableClock(Instant.parse("2026-03-02T12:00:00Z")));
        linter = new AutonomyPolicyLinter(autonomyService);
    }

    @Test
    void shouldAcceptWellFormedChecklist() {
        HeartbeatRuleSet ruleSet = ruleSet(List.of(
                ChecklistItem.builder().check("mrr_drop").metric("mrr").operator("decreases_by").threshold(10.0)
                        .build(),
                ChecklistItem.builder().check("outreach").metric("churn").operator("gt").threshold(5.0)
                        .onBreach(ResultType.ACTION).requiresApproval(true).cooldownMinutes(60)
                        .maxTriggersPerDay(3).build()));

        assertTrue(linter.lint(ruleSet, List.of("acme")).isEmpty());
    }

    @Test
    void shouldFlagStructuralProblems() {
        HeartbeatRuleSet ruleSet = ruleSet(List.of(
                ChecklistItem.builder().check("a").metric("mrr").operator("drops_by").threshold(1.0).build(),
                ChecklistItem.builder().check("a").description("Is the team blocked?").build(),
                ChecklistItem.builder().check("b").build()));

        List<String> warnings = linter.lint(ruleSet, List.of());

        assertEquals(3, warnings.size());
        assertTrue(warnings.get(0).contains("unknown operator 'drops_by'"));
        assertTrue(warnings.get(1).contains("duplicate check name"));
        assertTrue(warnings.get(2).contains("can never fire"));
    }

    @Test
    void shouldFlagUnboundedActionChecks() {
        HeartbeatRuleSet ruleSet = ruleSet(List.of(ChecklistItem.builder().check("outreach").metric("churn")
                .operator("gt").threshold(5.0).onBreach(ResultType.ACTION).requiresApproval(true).build()));

        assertEquals(List.of("revenue-watch/outreach: action check without cooldown or daily cap"),
                linter.lint(ruleSet, List.of()));
    }

    @Test
    void shouldFlagAutopilotExecutionForBoundTenantsOnly() {
        autonomyService.update("acme", AutonomySettingsPatch.builder()
                .categoryLevels(Map.of("outreach", "AUTOPILOT")).build());
        autonomyService.update("globex", AutonomySettingsPatch.builder()
                .categoryLevels(Map.of("outreach", "AUTOPILOT")).build());
        HeartbeatRuleSet ruleSet = ruleSet(List.of(ChecklistItem.builder().check("outreach").metric("churn")
                .operator("gt").threshold(5.0).onBreach(ResultType.ACTION).category("outreach")
                .cooldownMinutes(60).maxTriggersPerDay(3).build()));
        ruleSet.setTenants(List.of("acme"));

        List<String> warnings = linter.lint(ruleSet, List.of("acme", "globex", "initech"));

        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).contains("executes without approval for acme"));
    }

    private static HeartbeatRuleSet ruleSet(List<ChecklistItem> checklist) {
        return HeartbeatRuleSet.builder().id("revenue-watch").agentId("business_copilot").checklist(checklist)
                .build();
    }
}

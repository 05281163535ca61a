package me.golemcore.pulse.domain.service;

import me.golemcore.pulse.domain.exception.NotFoundException;
import me.golemcore.pulse.domain.model.ChecklistItem;
import me.golemcore.pulse.domain.model.HeartbeatRuleSet;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.testsupport.MutableClock;
import me.golemcore.pulse.testsupport.PulseTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class HeartbeatRuleSetServiceTest {

    private MutableClock clock;
    private PulseProperties properties;
    private AutonomyPolicyLinter linter;
    private HeartbeatRuleSetService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T12:00:00Z"));
        properties = new PulseProperties();
        linter = mock(AutonomyPolicyLinter.class);
        service = new HeartbeatRuleSetService(PulseTestSupport.tableStore(), properties, linter,
                () -> List.of("acme"), clock);
    }

    @Test
    void shouldLoadConfiguredRuleSetsAndSkipInvalidOnes() {
        properties.getHeartbeat().setRulesets(new ArrayList<>(List.of(
                ruleSet("revenue-watch"),
                HeartbeatRuleSet.builder().id("broken").build())));

        service.loadConfigured();

        assertEquals(List.of("revenue-watch"), service.list().stream().map(HeartbeatRuleSet::getId).toList());
        verify(linter, times(1)).lint(any(), anyList());
    }

    @Test
    void shouldKeepPauseAndLastRunAcrossReload() {
        properties.getHeartbeat().setRulesets(new ArrayList<>(List.of(ruleSet("revenue-watch"))));
        service.loadConfigured();
        service.pause("revenue-watch");
        service.markRun("revenue-watch", clock.instant());

        properties.getHeartbeat().setRulesets(new ArrayList<>(List.of(ruleSet("revenue-watch"))));
        service.loadConfigured();

        HeartbeatRuleSet reloaded = service.get("revenue-watch");
        assertTrue(reloaded.isPaused());
        assertEquals(clock.instant(), reloaded.getLastRunAt());
    }

    @Test
    void shouldRejectDuplicateOrInvalidCreate() {
        service.create(ruleSet("sprint-health"));

        assertThrows(IllegalArgumentException.class, () -> service.create(ruleSet("sprint-health")));
        HeartbeatRuleSet unnamedCheck = ruleSet("other");
        unnamedCheck.getChecklist().add(ChecklistItem.builder().build());
        assertThrows(IllegalArgumentException.class, () -> service.create(unnamedCheck));
        HeartbeatRuleSet zeroInterval = ruleSet("zero");
        zeroInterval.setIntervalMinutes(0);
        assertThrows(IllegalArgumentException.class, () -> service.create(zeroInterval));
    }

    @Test
    void shouldReportDueRuleSetsByInterval() {
        service.create(ruleSet("sprint-health"));
        assertEquals(1, service.getDue(clock.instant()).size());

        service.markRun("sprint-health", clock.instant());
        clock.advance(Duration.ofMinutes(59));
        assertTrue(service.getDue(clock.instant()).isEmpty());
        clock.advance(Duration.ofMinutes(1));
        assertEquals(1, service.getDue(clock.instant()).size());

        service.pause("sprint-health");
        assertTrue(service.getDue(clock.instant()).isEmpty());
        service.resume("sprint-health");
        assertEquals(1, service.getDue(clock.instant()).size());
    }

    @Test
    void shouldThrowNotFoundForUnknownRuleSet() {
        assertThrows(NotFoundException.class, () -> service.get("missing"));
        assertThrows(NotFoundException.class, () -> service.pause("missing"));
    }

    private static HeartbeatRuleSet ruleSet(String id) {
        return HeartbeatRuleSet.builder()
                .id(id)
                .agentId("business_copilot")
                .checklist(new ArrayList<>(List.of(ChecklistItem.builder().check("mrr_drop").metric("mrr")
                        .operator("gt").threshold(1.0).build())))
                .build();
    }
}

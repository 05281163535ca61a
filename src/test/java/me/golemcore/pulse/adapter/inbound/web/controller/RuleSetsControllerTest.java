package me.golemcore.pulse.adapter.inbound.web.controller;

import me.golemcore.pulse.domain.model.EvaluationResult;
import me.golemcore.pulse.domain.model.HeartbeatRuleSet;
import me.golemcore.pulse.domain.service.HeartbeatEngine;
import me.golemcore.pulse.domain.service.HeartbeatRuleSetService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RuleSetsControllerTest {

    private HeartbeatRuleSetService ruleSetService;
    private HeartbeatEngine heartbeatEngine;
    private RuleSetsController controller;

    @BeforeEach
    void setUp() {
        ruleSetService = mock(HeartbeatRuleSetService.class);
        heartbeatEngine = mock(HeartbeatEngine.class);
        controller = new RuleSetsController(ruleSetService, heartbeatEngine);
    }

    @Test
    void shouldCreateRuleSet() {
        HeartbeatRuleSet request = HeartbeatRuleSet.builder().id("cfo-daily").agentId("cfo").build();
        when(ruleSetService.create(request)).thenReturn(request);

        StepVerifier.create(controller.create(request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CREATED, response.getStatusCode());
                    assertEquals("cfo-daily", response.getBody().getId());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectMissingBody() {
        assertThrows(ResponseStatusException.class, () -> controller.create(null));
    }

    @Test
    void shouldRunRuleSetForTenant() {
        EvaluationResult result = EvaluationResult.builder()
                .ruleSetId("cfo-daily")
                .tenantId("acme")
                .resultType(EvaluationResult.ResultType.INSIGHT)
                .build();
        when(heartbeatEngine.runNow("cfo-daily", "acme")).thenReturn(result);

        StepVerifier.create(controller.runNow("cfo-daily", "acme"))
                .assertNext(response -> assertEquals(EvaluationResult.ResultType.INSIGHT,
                        response.getBody().getResultType()))
                .verifyComplete();
    }
}

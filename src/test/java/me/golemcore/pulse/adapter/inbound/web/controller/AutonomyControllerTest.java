package me.golemcore.pulse.adapter.inbound.web.controller;

import me.golemcore.pulse.domain.model.AgentAction;
import me.golemcore.pulse.domain.model.AutonomySettings;
import me.golemcore.pulse.domain.service.ActionExecutionService;
import me.golemcore.pulse.domain.service.ActionService;
import me.golemcore.pulse.domain.service.AutonomyService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AutonomyControllerTest {

    private AutonomyService autonomyService;
    private ActionService actionService;
    private ActionExecutionService actionExecutionService;
    private AutonomyController controller;

    @BeforeEach
    void setUp() {
        autonomyService = mock(AutonomyService.class);
        actionService = mock(ActionService.class);
        actionExecutionService = mock(ActionExecutionService.class);
        controller = new AutonomyController(autonomyService, actionService, actionExecutionService);
    }

    // ===== Settings =====

    @Test
    void shouldPauseWithReason() {
        AutonomySettings paused = AutonomySettings.builder().tenantId("acme").paused(true)
                .pausedReason("board meeting").build();
        when(autonomyService.pause("acme", "board meeting")).thenReturn(paused);

        StepVerifier.create(controller.pause("acme", new AutonomyController.PauseRequest("board meeting")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertTrue(response.getBody().isPaused());
                })
                .verifyComplete();
    }

    @Test
    void shouldPauseWithoutBody() {
        when(autonomyService.pause("acme", null)).thenReturn(AutonomySettings.builder().paused(true).build());

        StepVerifier.create(controller.pause("acme", null))
                .assertNext(response -> assertTrue(response.getBody().isPaused()))
                .verifyComplete();
    }

    @Test
    void shouldRejectMissingSettingsBody() {
        assertThrows(ResponseStatusException.class, () -> controller.updateSettings("acme", null));
    }

    // ===== Actions =====

    @Test
    void shouldApplyDefaultLimitWhenListingActions() {
        when(actionService.list("acme", "pending_approval", A2aController.DEFAULT_LIMIT))
                .thenReturn(List.of(AgentAction.builder().id("act-1").build()));

        StepVerifier.create(controller.listActions("acme", "pending_approval", null))
                .assertNext(response -> assertEquals("act-1", response.getBody().get(0).getId()))
                .verifyComplete();
    }

    @Test
    void shouldApproveWithActorHeader() {
        AgentAction completed = AgentAction.builder().id("act-1").status(AgentAction.Status.COMPLETED).build();
        when(actionExecutionService.approve("acme", "act-1", "alice", "go")).thenReturn(completed);

        StepVerifier.create(controller.approve("acme", "act-1", " alice ",
                new AutonomyController.DecisionRequest("go")))
                .assertNext(response -> assertEquals(AgentAction.Status.COMPLETED, response.getBody().getStatus()))
                .verifyComplete();
    }

    @Test
    void shouldRequireActorToDecide() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.reject("acme", "act-1", " ", null));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        verify(actionExecutionService, never()).reject(anyString(), anyString(), anyString(), any());
    }
}

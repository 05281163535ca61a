package me.golemcore.pulse.adapter.inbound.web.controller;

import me.golemcore.pulse.domain.model.WorkflowLog;
import me.golemcore.pulse.domain.model.WorkflowRun;
import me.golemcore.pulse.domain.workflow.WorkflowLogService;
import me.golemcore.pulse.domain.workflow.WorkflowRunner;
import me.golemcore.pulse.domain.workflow.WorkflowService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WorkflowsControllerTest {

    private WorkflowRunner workflowRunner;
    private WorkflowLogService logService;
    private WorkflowsController controller;

    @BeforeEach
    void setUp() {
        workflowRunner = mock(WorkflowRunner.class);
        logService = mock(WorkflowLogService.class);
        controller = new WorkflowsController(mock(WorkflowService.class), workflowRunner, logService);
    }

    // ===== Runs =====

    @Test
    void shouldStartAsyncByDefault() {
        WorkflowRun pending = WorkflowRun.builder().id("run-1").status(WorkflowRun.Status.PENDING).build();
        when(workflowRunner.start("wf-1", Map.of(), true, "manual")).thenReturn(pending);

        StepVerifier.create(controller.run("wf-1", null))
                .assertNext(response -> {
                    assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
                    assertEquals("run-1", response.getBody().getId());
                })
                .verifyComplete();
    }

    @Test
    void shouldRunSynchronouslyWhenRequested() {
        Map<String, Object> inputs = Map.of("deal", "acme");
        WorkflowRun completed = WorkflowRun.builder().id("run-2").status(WorkflowRun.Status.COMPLETED).build();
        when(workflowRunner.start("wf-1", inputs, false, "manual")).thenReturn(completed);

        StepVerifier.create(controller.run("wf-1", new WorkflowsController.RunRequest(inputs, false)))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(WorkflowRun.Status.COMPLETED, response.getBody().getStatus());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnRunWithLogs() {
        when(workflowRunner.getRun("run-1"))
                .thenReturn(WorkflowRun.builder().id("run-1").tenantId("acme").build());
        when(logService.list("acme", "run-1")).thenReturn(List.of(WorkflowLog.builder().nodeId("start").build()));

        StepVerifier.create(controller.getRun("run-1"))
                .assertNext(response -> {
                    assertEquals("run-1", response.getBody().run().getId());
                    assertEquals(1, response.getBody().logs().size());
                })
                .verifyComplete();
    }

    // ===== Approvals =====

    @Test
    void shouldDecideWithActor() {
        WorkflowRun resumed = WorkflowRun.builder().id("run-1").status(WorkflowRun.Status.COMPLETED).build();
        when(workflowRunner.decide("appr-1", "approve", "alice", "ok")).thenReturn(resumed);

        StepVerifier.create(controller.decide("appr-1", "alice",
                new WorkflowsController.DecideRequest("approve", "ok")))
                .assertNext(response -> assertEquals(WorkflowRun.Status.COMPLETED, response.getBody().getStatus()))
                .verifyComplete();
    }

    @Test
    void shouldRejectDecisionWithoutDecisionOrActor() {
        assertThrows(ResponseStatusException.class, () -> controller.decide("appr-1", "alice",
                new WorkflowsController.DecideRequest(" ", null)));
        assertThrows(ResponseStatusException.class, () -> controller.decide("appr-1", null,
                new WorkflowsController.DecideRequest("approve", null)));

        verify(workflowRunner, never()).decide(anyString(), anyString(), anyString(), any());
        verify(workflowRunner, never()).start(anyString(), any(), anyBoolean(), anyString());
    }
}

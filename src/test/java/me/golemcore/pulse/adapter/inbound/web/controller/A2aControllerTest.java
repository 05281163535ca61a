package me.golemcore.pulse.adapter.inbound.web.controller;

import me.golemcore.pulse.domain.model.AgentMessage;
import me.golemcore.pulse.domain.model.PublishRequest;
import me.golemcore.pulse.domain.service.HeartbeatLedgerService;
import me.golemcore.pulse.domain.service.MessageBusService;
import me.golemcore.pulse.domain.service.PulseDashboardService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class A2aControllerTest {

    private MessageBusService messageBus;
    private A2aController controller;

    @BeforeEach
    void setUp() {
        messageBus = mock(MessageBusService.class);
        controller = new A2aController(messageBus, mock(PulseDashboardService.class),
                mock(HeartbeatLedgerService.class));
    }

    // ===== Publish =====

    @Test
    void shouldPublishAndReportDeliveredCount() {
        when(messageBus.publish(any())).thenReturn(List.of(
                AgentMessage.builder().id("m1").build(),
                AgentMessage.builder().id("m2").build()));

        A2aController.PublishMessageRequest request = new A2aController.PublishMessageRequest(
                "acme", "cfo", "revenue.drop", "alert", Map.of("mrr", 9000), null, "critical", true, 30, null);

        StepVerifier.create(controller.publish(request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CREATED, response.getStatusCode());
                    assertNotNull(response.getBody());
                    assertEquals(2, response.getBody().delivered());
                })
                .verifyComplete();

        ArgumentCaptor<PublishRequest> captor = ArgumentCaptor.forClass(PublishRequest.class);
        verify(messageBus).publish(captor.capture());
        PublishRequest publish = captor.getValue();
        assertEquals("acme", publish.getTenantId());
        assertEquals(AgentMessage.MessageType.ALERT, publish.getMessageType());
        assertEquals(AgentMessage.Priority.CRITICAL, publish.getPriority());
        assertTrue(publish.isRequiresResponse());
        assertEquals(30, publish.getResponseDeadlineMinutes());
    }

    @Test
    void shouldDefaultMissingPayloadAndFlags() {
        when(messageBus.publish(any())).thenReturn(List.of());

        StepVerifier.create(controller.publish(new A2aController.PublishMessageRequest(
                "acme", "cfo", "hello", null, null, "ceo", null, null, null, null)))
                .assertNext(response -> assertEquals(0, response.getBody().delivered()))
                .verifyComplete();

        ArgumentCaptor<PublishRequest> captor = ArgumentCaptor.forClass(PublishRequest.class);
        verify(messageBus).publish(captor.capture());
        assertTrue(captor.getValue().getPayload().isEmpty());
        assertFalse(captor.getValue().isRequiresResponse());
    }

    // ===== Limits =====

    @Test
    void shouldClampLimits() {
        assertEquals(A2aController.DEFAULT_LIMIT, A2aController.clampLimit(null));
        assertEquals(10, A2aController.clampLimit(10));
        assertEquals(A2aController.MAX_LIMIT, A2aController.clampLimit(10_000));
        assertThrows(ResponseStatusException.class, () -> A2aController.clampLimit(0));
    }

    @Test
    void shouldReadInboxWithClampedLimit() {
        when(messageBus.getInbox("acme", "ceo", null, A2aController.MAX_LIMIT))
                .thenReturn(List.of(AgentMessage.builder().id("m1").build()));

        StepVerifier.create(controller.inbox("ceo", "acme", null, 500))
                .assertNext(response -> assertEquals(1, response.getBody().size()))
                .verifyComplete();
    }
}

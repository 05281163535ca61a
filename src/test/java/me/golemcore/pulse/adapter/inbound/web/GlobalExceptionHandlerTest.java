package me.golemcore.pulse.adapter.inbound.web;

import me.golemcore.pulse.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.pulse.domain.exception.InvalidTransitionException;
import me.golemcore.pulse.domain.exception.NotFoundException;
import me.golemcore.pulse.domain.model.AgentAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldHandleResponseStatusException() {
        ResponseStatusException ex = new ResponseStatusException(HttpStatus.BAD_REQUEST, "limit must be positive");

        StepVerifier.create(handler.handleResponseStatus(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(400, body.getStatus());
                    assertEquals("limit must be positive", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapNotFoundTo404() {
        NotFoundException ex = new NotFoundException("Message", "msg-1");

        StepVerifier.create(handler.handleNotFound(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    assertEquals("Message not found: msg-1", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapIllegalArgumentTo400() {
        StepVerifier.create(handler.handleIllegalArgument(new IllegalArgumentException("topic is required")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals(400, response.getBody().getStatus());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapInvalidTransitionTo409() {
        InvalidTransitionException ex = new InvalidTransitionException("Action", "act-1",
                AgentAction.Status.COMPLETED, AgentAction.Status.APPROVED);

        StepVerifier.create(handler.handleIllegalState(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
                    assertEquals("Cannot move Action act-1 from COMPLETED to APPROVED",
                            response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideInternalErrorDetails() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("disk on fire")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }
}

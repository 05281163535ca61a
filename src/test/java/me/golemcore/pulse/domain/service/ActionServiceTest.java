package me.golemcore.pulse.domain.service;

import me.golemcore.pulse.domain.exception.ApprovalRequiredException;
import me.golemcore.pulse.domain.exception.InvalidTransitionException;
import me.golemcore.pulse.domain.exception.NotFoundException;
import me.golemcore.pulse.domain.model.ActionProposal;
import me.golemcore.pulse.domain.model.AgentAction;
import me.golemcore.pulse.domain.model.AgentAction.Status;
import me.golemcore.pulse.domain.model.AutonomySettingsPatch;
import me.golemcore.pulse.domain.model.ProactiveActionLogEntry;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.testsupport.MutableClock;
import me.golemcore.pulse.testsupport.PulseTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ActionServiceTest {

    private static final String TENANT = "acme";
    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    private MutableClock clock;
    private AutonomyService autonomyService;
    private ActionService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        JsonTableStore tableStore = PulseTestSupport.tableStore();
        autonomyService = new AutonomyService(tableStore, clock);
        PulseProperties properties = new PulseProperties();
        properties.getApproval().setDefaultExpiryHours(24);
        service = new ActionService(tableStore, autonomyService, properties, clock);
    }

    // ===== Creation =====

    @Test
    void shouldRequireApprovalAtDefaultAdvisorLevel() {
        AgentAction action = service.tryCreate(proposal(false)).orElseThrow();

        assertTrue(action.isRequiresApproval());
        assertEquals(Status.PENDING_APPROVAL, action.getStatus());
        assertEquals(NOW.plus(Duration.ofHours(24)), action.getExpiresAt());
        assertEquals("outreach", action.getCategory());
    }

    @Test
    void shouldSkipApprovalOnAutopilotUnlessProposalAsks() {
        autonomyService.update(TENANT, AutonomySettingsPatch.builder().globalLevel("AUTOPILOT").build());

        AgentAction direct = service.tryCreate(proposal(false)).orElseThrow();
        AgentAction guarded = service.tryCreate(proposal(true)).orElseThrow();

        assertEquals(Status.PENDING, direct.getStatus());
        assertNull(direct.getExpiresAt());
        assertEquals(Status.PENDING_APPROVAL, guarded.getStatus());
    }

    @Test
    void shouldStopCreatingAtDailyLimit() {
        autonomyService.update(TENANT, AutonomySettingsPatch.builder().dailyActionLimit(2).build());

        assertTrue(service.tryCreate(proposal(false)).isPresent());
        assertTrue(service.tryCreate(proposal(false)).isPresent());
        Optional<AgentAction> third = service.tryCreate(proposal(false));

        assertTrue(third.isEmpty());
        assertTrue(service.isDailyLimitReached(TENANT));
        assertEquals(2, service.listAll(TENANT).size());

        clock.advance(Duration.ofDays(1));
        assertFalse(service.isDailyLimitReached(TENANT));
        assertTrue(service.tryCreate(proposal(false)).isPresent());
    }

    // ===== Transitions =====

    @Test
    void shouldRefuseToExecuteUnapprovedAction() {
        AgentAction action = service.tryCreate(proposal(true)).orElseThrow();

        ApprovalRequiredException error = assertThrows(ApprovalRequiredException.class,
                () -> service.markExecuting(TENANT, action.getId()));

        assertTrue(error.getMessage().contains(action.getId()));
        assertEquals(Status.PENDING_APPROVAL, service.get(TENANT, action.getId()).getStatus());
    }

    @Test
    void shouldRunApprovedActionToCompletion() {
        AgentAction action = service.tryCreate(proposal(true)).orElseThrow();

        AgentAction approved = service.approve(TENANT, action.getId(), "founder", "go");
        assertEquals(Status.APPROVED, approved.getStatus());
        assertEquals("founder", approved.getApprovedBy());
        assertEquals(Boolean.TRUE, approved.getApproved());

        service.markExecuting(TENANT, action.getId());
        AgentAction completed = service.complete(TENANT, action.getId(), "done");

        assertEquals(Status.COMPLETED, completed.getStatus());
        assertEquals("done", completed.getResult());
        assertNotNull(completed.getCompletedAt());

        List<ProactiveActionLogEntry> audit = service.getAuditLog(TENANT, 10);
        assertEquals(4, audit.size());
    }

    @Test
    void shouldNeverMoveBackwards() {
        AgentAction action = service.tryCreate(proposal(true)).orElseThrow();
        service.reject(TENANT, action.getId(), "founder", "not now");

        assertThrows(InvalidTransitionException.class,
                () -> service.approve(TENANT, action.getId(), "founder", null));
        assertThrows(InvalidTransitionException.class,
                () -> service.reject(TENANT, action.getId(), "founder", null));
        assertEquals(Status.REJECTED, service.get(TENANT, action.getId()).getStatus());
    }

    @Test
    void shouldRequireActorForDecisions() {
        AgentAction action = service.tryCreate(proposal(true)).orElseThrow();

        assertThrows(IllegalArgumentException.class, () -> service.approve(TENANT, action.getId(), " ", null));
    }

    @Test
    void shouldThrowNotFoundForUnknownAction() {
        assertThrows(NotFoundException.class, () -> service.get(TENANT, "missing"));
    }

    // ===== Expiry =====

    @Test
    void shouldExpireLapsedApprovals() {
        AgentAction waiting = service.tryCreate(proposal(true)).orElseThrow();
        autonomyService.update(TENANT, AutonomySettingsPatch.builder().globalLevel("AUTOPILOT").build());
        AgentAction direct = service.tryCreate(proposal(false)).orElseThrow();

        assertEquals(0, service.expireOverdue());
        clock.advance(Duration.ofHours(24));

        assertEquals(1, service.expireOverdue());
        assertEquals(Status.EXPIRED, service.get(TENANT, waiting.getId()).getStatus());
        assertEquals(Status.PENDING, service.get(TENANT, direct.getId()).getStatus());
        assertThrows(InvalidTransitionException.class,
                () -> service.approve(TENANT, waiting.getId(), "founder", null));
    }

    @Test
    void shouldListNewestFirstWithStatusFilter() {
        AgentAction first = service.tryCreate(proposal(true)).orElseThrow();
        clock.advance(Duration.ofMinutes(1));
        AgentAction second = service.tryCreate(proposal(true)).orElseThrow();
        service.reject(TENANT, first.getId(), "founder", null);

        List<AgentAction> all = service.list(TENANT, null, 10);
        List<AgentAction> pending = service.list(TENANT, "pending_approval", 10);

        assertEquals(List.of(second.getId(), first.getId()), all.stream().map(AgentAction::getId).toList());
        assertEquals(List.of(second.getId()), pending.stream().map(AgentAction::getId).toList());
    }

    private static ActionProposal proposal(boolean requiresApproval) {
        return ActionProposal.builder()
                .tenantId(TENANT)
                .source(AgentAction.Source.HEARTBEAT)
                .sourceId("revenue-watch")
                .agentId("revenue_agent")
                .actionType("heartbeat_action")
                .category("Outreach")
                .title("Send retention emails")
                .requiresApproval(requiresApproval)
                .build();
    }
}

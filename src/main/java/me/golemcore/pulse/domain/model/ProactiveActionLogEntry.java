package me.golemcore.pulse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only audit row written on every action status change.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProactiveActionLogEntry {

    private String id;
    private String tenantId;
    private String actionId;
    private AgentAction.Status fromStatus;
    private AgentAction.Status toStatus;
    private String actor;
    private String note;
    private Instant timestamp;
}

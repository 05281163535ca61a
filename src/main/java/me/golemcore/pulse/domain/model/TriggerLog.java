package me.golemcore.pulse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One trigger firing or suppression, stored in {@code trigger_logs}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerLog {

    private String id;
    private String ruleId;
    private String tenantId;
    private Status status;

    @Builder.Default
    private Map<String, Object> triggerContext = new LinkedHashMap<>();

    private String actionId;
    private String skipReason;
    private String error;
    private Instant triggeredAt;
    private Instant completedAt;

    public enum Status {
        TRIGGERED, SKIPPED, EXECUTING, COMPLETED, FAILED, AWAITING_APPROVAL, APPROVED, REJECTED
    }
}

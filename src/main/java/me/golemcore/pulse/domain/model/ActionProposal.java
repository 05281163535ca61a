package me.golemcore.pulse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request to create an {@link AgentAction}. {@code requiresApproval} is the
 * source's own demand; the tenant's autonomy level may still require approval
 * when this is false.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionProposal {

    private String tenantId;
    private AgentAction.Source source;
    private String sourceId;
    private String agentId;
    private String actionType;
    private String category;
    private String title;
    private boolean requiresApproval;

    @Builder.Default
    private Map<String, Object> payload = new LinkedHashMap<>();
}

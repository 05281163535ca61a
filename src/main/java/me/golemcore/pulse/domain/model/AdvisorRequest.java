package me.golemcore.pulse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request for the advisor capability: an agent, a prompt and supporting
 * context.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdvisorRequest {

    private String tenantId;
    private String agentId;
    private String prompt;

    @Builder.Default
    private Map<String, Object> context = new LinkedHashMap<>();
}

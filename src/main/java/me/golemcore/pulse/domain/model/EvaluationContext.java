package me.golemcore.pulse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the decision function sees for one tenant and rule-set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationContext {

    private String tenantId;
    private String agentId;
    private String ruleSetId;

    @Builder.Default
    private Map<String, Double> metrics = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Double> previousMetrics = new LinkedHashMap<>();

    @Builder.Default
    private List<String> memory = new ArrayList<>();

    private Instant evaluationTime;
}

package me.golemcore.pulse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time KPI values for one tenant.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricSnapshot {

    private String tenantId;

    @Builder.Default
    private Map<String, Double> metrics = new LinkedHashMap<>();

    private Instant recordedAt;
}

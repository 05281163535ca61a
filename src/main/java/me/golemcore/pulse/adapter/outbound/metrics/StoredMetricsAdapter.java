package me.golemcore.pulse.adapter.outbound.metrics;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.MetricSnapshot;
import me.golemcore.pulse.domain.service.JsonTable;
import me.golemcore.pulse.domain.service.JsonTableStore;
import me.golemcore.pulse.domain.service.PulseTables;
import me.golemcore.pulse.port.outbound.MetricsPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metrics provider backed by the {@code metric_snapshots} table. Snapshots are
 * pushed through {@code POST /{startup_id}/metrics} by the analytics
 * integrations; only the most recent ones are kept.
 */
@Component
@Slf4j
public class StoredMetricsAdapter implements MetricsPort {

    static final int MAX_SNAPSHOTS = 100;

    private static final Comparator<MetricSnapshot> OLDEST_FIRST = Comparator
            .comparing(MetricSnapshot::getRecordedAt, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final JsonTable<MetricSnapshot> snapshots;
    private final Clock clock;

    public StoredMetricsAdapter(JsonTableStore tableStore, Clock clock) {
        this.snapshots = tableStore.table(PulseTables.METRIC_SNAPSHOTS, MetricSnapshot.class);
        this.clock = clock;
    }

    @Override
    public Map<String, Double> latest(String tenantId) {
        List<MetricSnapshot> history = ordered(tenantId);
        return history.isEmpty() ? Map.of() : history.get(history.size() - 1).getMetrics();
    }

    @Override
    public Map<String, Double> previous(String tenantId) {
        List<MetricSnapshot> history = ordered(tenantId);
        return history.size() < 2 ? Map.of() : history.get(history.size() - 2).getMetrics();
    }

    @Override
    public MetricSnapshot record(String tenantId, Map<String, Double> metrics) {
        MetricSnapshot snapshot = MetricSnapshot.builder()
                .tenantId(tenantId)
                .metrics(new LinkedHashMap<>(metrics))
                .recordedAt(clock.instant())
                .build();
        snapshots.mutate(tenantId, rows -> {
            rows.add(snapshot);
            rows.sort(OLDEST_FIRST);
            while (rows.size() > MAX_SNAPSHOTS) {
                rows.remove(0);
            }
            return snapshot;
        });
        log.debug("[Metrics] Recorded {} metrics for {}", metrics.size(), tenantId);
        return snapshot;
    }

    private List<MetricSnapshot> ordered(String tenantId) {
        return snapshots.read(tenantId).stream().sorted(OLDEST_FIRST).toList();
    }
}

package me.golemcore.pulse.port.outbound;

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

import me.golemcore.pulse.domain.model.MetricSnapshot;

import java.util.Map;

/**
 * Port for tenant KPI snapshots.
 */
public interface MetricsPort {

    /**
     * Most recent metric values, empty when none were recorded.
     */
    Map<String, Double> latest(String tenantId);

    /**
     * Values of the snapshot before the most recent one, empty when fewer than
     * two exist.
     */
    Map<String, Double> previous(String tenantId);

    MetricSnapshot record(String tenantId, Map<String, Double> metrics);
}

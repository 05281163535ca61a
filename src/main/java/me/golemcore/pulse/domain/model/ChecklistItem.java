package me.golemcore.pulse.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One check within a heartbeat rule-set.
 *
 * <p>
 * {@code metric}, {@code operator} and {@code threshold} drive the rule-based
 * decision function; an LLM decision function reads {@code description}
 * instead. {@code cooldownMinutes} and {@code maxTriggersPerDay} of zero mean
 * unlimited.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChecklistItem {

    private String check;
    private String description;
    private String metric;
    private String operator;
    private Double threshold;
    private boolean percent;
    private Double escalateThreshold;

    @Builder.Default
    private EvaluationResult.ResultType onBreach = EvaluationResult.ResultType.INSIGHT;

    private String action;
    private String category;
    private boolean requiresApproval;
    private boolean notify;
    private int cooldownMinutes;
    private int maxTriggersPerDay;
}

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

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Append-only heartbeat ledger row. One row is written for every evaluation
 * outcome, OK and SKIPPED included.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationResult {

    private String id;
    private String tenantId;
    private String ruleSetId;
    private String agentId;
    private ResultType resultType;
    private String triggeredCheck;
    private String summary;

    @Builder.Default
    private Map<String, Object> contextSnapshot = new LinkedHashMap<>();

    private String recommendedAction;
    private String actionId;
    private String messageId;
    private boolean founderNotified;
    private String model;
    private long latencyMs;
    private String acknowledgedBy;
    private Instant acknowledgedAt;
    private Instant timestamp;

    public enum ResultType {
        OK, INSIGHT, ACTION, ESCALATION, SKIPPED;

        /**
         * Lenient parse; unknown or blank values resolve to {@link #OK}.
         */
        public static ResultType parse(String value) {
            if (value == null || value.isBlank()) {
                return OK;
            }
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return OK;
            }
        }
    }
}

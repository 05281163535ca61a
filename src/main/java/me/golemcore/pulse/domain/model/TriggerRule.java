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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted condition/action pair evaluated by the trigger engine, with
 * cooldown and daily-cap limiting.
 *
 * <p>
 * Which {@link Condition} fields apply depends on {@link TriggerType}:
 * <ul>
 * <li>METRIC - {@code metric}, {@code operator}, {@code value},
 * {@code percent}</li>
 * <li>TIME - {@code cron}</li>
 * <li>EVENT - {@code event}, {@code filters}</li>
 * <li>WEBHOOK - none, fired through {@code webhookSecret}</li>
 * </ul>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerRule {

    public static final int DEFAULT_COOLDOWN_MINUTES = 60;
    public static final int DEFAULT_MAX_TRIGGERS_PER_DAY = 10;

    private String id;
    private String tenantId;
    private String name;
    private String description;
    private TriggerType triggerType;

    @Builder.Default
    private Condition condition = new Condition();

    @Builder.Default
    private Action action = new Action();

    @Builder.Default
    private boolean active = true;

    private boolean paused;

    @Builder.Default
    private int cooldownMinutes = DEFAULT_COOLDOWN_MINUTES;

    @Builder.Default
    private int maxTriggersPerDay = DEFAULT_MAX_TRIGGERS_PER_DAY;

    private String webhookSecret;
    private Instant lastEvaluatedAt;
    private Instant lastTriggeredAt;
    private int triggerCount;
    private Instant createdAt;
    private Instant updatedAt;

    public enum TriggerType {
        METRIC, TIME, EVENT, WEBHOOK
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Condition {
        private String metric;
        private String operator;
        private Double value;
        private boolean percent;
        private String cron;
        private String event;

        @Builder.Default
        private Map<String, Object> filters = new LinkedHashMap<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Action {
        private String agent;
        private String task;
        private String category;
        private boolean requiresApproval;

        @Builder.Default
        private List<String> notify = new ArrayList<>();
    }
}

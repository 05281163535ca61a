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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A heartbeat checklist owned by one agent and evaluated for every bound
 * tenant on each due tick. Loaded from {@code pulse.heartbeat.rulesets} at
 * start or created over the API; paused and resumed, never silently deleted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HeartbeatRuleSet {

    public static final String ALL_TENANTS = "*";

    private String id;
    private String agentId;
    private String topicPrefix;

    @Builder.Default
    private boolean enabled = true;

    private boolean paused;

    @Builder.Default
    private int intervalMinutes = 60;

    @Builder.Default
    private List<String> tenants = new ArrayList<>(List.of(ALL_TENANTS));

    @Builder.Default
    private QuietHours quietHours = new QuietHours();

    @Builder.Default
    private List<ChecklistItem> checklist = new ArrayList<>();

    private Instant lastRunAt;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Topic prefix for published results, falling back to the rule-set id.
     */
    @JsonIgnore
    public String resolveTopicPrefix() {
        return topicPrefix != null && !topicPrefix.isBlank() ? topicPrefix : id;
    }

    @JsonIgnore
    public boolean isBoundTo(String tenantId) {
        return tenants == null || tenants.isEmpty() || tenants.contains(ALL_TENANTS) || tenants.contains(tenantId);
    }

    @JsonIgnore
    public boolean isDue(Instant now) {
        if (!enabled || paused) {
            return false;
        }
        if (lastRunAt == null) {
            return true;
        }
        Duration interval = Duration.ofMinutes(Math.max(1, intervalMinutes));
        return !now.isBefore(lastRunAt.plus(interval));
    }

    /**
     * Timezone-aware quiet window. Times are {@code HH:mm}; a window whose start
     * is after its end wraps midnight.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class QuietHours {
        private boolean enabled;
        private String timezone = "UTC";
        private String start = "22:00";
        private String end = "07:00";
    }
}

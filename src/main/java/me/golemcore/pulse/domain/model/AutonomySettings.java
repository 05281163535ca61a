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

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Per-tenant autonomy policy and kill switch, stored in
 * {@code startup_autonomy_settings}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutonomySettings {

    public static final int DEFAULT_DAILY_ACTION_LIMIT = 50;

    private String tenantId;

    @Builder.Default
    private AutonomyLevel globalLevel = AutonomyLevel.ADVISOR;

    @Builder.Default
    private Map<String, AutonomyLevel> categoryLevels = new LinkedHashMap<>();

    @Builder.Default
    private int dailyActionLimit = DEFAULT_DAILY_ACTION_LIMIT;

    private boolean paused;
    private Instant pausedAt;
    private String pausedReason;

    @Builder.Default
    private boolean notifyOnAction = true;

    @Builder.Default
    private List<String> notifyChannels = new ArrayList<>(List.of("in_app"));

    @Builder.Default
    private String timezone = "UTC";

    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Effective level for a category: the category override when present,
     * otherwise the global level.
     */
    @JsonIgnore
    public AutonomyLevel levelFor(String category) {
        if (category != null && categoryLevels != null) {
            AutonomyLevel override = categoryLevels.get(category.toLowerCase(Locale.ROOT));
            if (override != null) {
                return override;
            }
        }
        return globalLevel != null ? globalLevel : AutonomyLevel.ADVISOR;
    }
}

package me.golemcore.pulse.domain.service;

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
import me.golemcore.pulse.domain.model.AutonomyLevel;
import me.golemcore.pulse.domain.model.AutonomySettings;
import me.golemcore.pulse.domain.model.AutonomySettingsPatch;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Per-tenant autonomy policy and kill switch. Settings are created with
 * defaults (ADVISOR, 50 actions a day, UTC) on first access.
 *
 * <p>
 * The scheduler consults {@link #isPaused(String)} before every tenant
 * evaluation.
 */
@Service
@Slf4j
public class AutonomyService {

    private final JsonTable<AutonomySettings> settings;
    private final Clock clock;

    public AutonomyService(JsonTableStore tableStore, Clock clock) {
        this.settings = tableStore.table(PulseTables.AUTONOMY_SETTINGS, AutonomySettings.class);
        this.clock = clock;
    }

    public AutonomySettings get(String tenantId) {
        requireTenant(tenantId);
        List<AutonomySettings> stored = settings.read(tenantId);
        if (!stored.isEmpty()) {
            return stored.get(0);
        }
        return settings.mutate(tenantId, rows -> currentOrDefault(tenantId, rows));
    }

    public AutonomySettings update(String tenantId, AutonomySettingsPatch patch) {
        requireTenant(tenantId);
        AutonomySettings updated = settings.mutate(tenantId, rows -> {
            AutonomySettings current = currentOrDefault(tenantId, rows);
            if (patch.getGlobalLevel() != null) {
                current.setGlobalLevel(parseLevel(patch.getGlobalLevel()));
            }
            if (patch.getCategoryLevels() != null) {
                Map<String, AutonomyLevel> levels = new LinkedHashMap<>();
                patch.getCategoryLevels().forEach((category, level) -> levels.put(
                        category.toLowerCase(Locale.ROOT), parseLevel(level)));
                current.setCategoryLevels(levels);
            }
            if (patch.getDailyActionLimit() != null) {
                if (patch.getDailyActionLimit() < 0) {
                    throw new IllegalArgumentException("daily_action_limit must not be negative");
                }
                current.setDailyActionLimit(patch.getDailyActionLimit());
            }
            if (patch.getNotifyOnAction() != null) {
                current.setNotifyOnAction(patch.getNotifyOnAction());
            }
            if (patch.getNotifyChannels() != null) {
                current.setNotifyChannels(new ArrayList<>(patch.getNotifyChannels()));
            }
            if (patch.getTimezone() != null) {
                current.setTimezone(validateTimezone(patch.getTimezone()));
            }
            current.setUpdatedAt(clock.instant());
            return current;
        });
        log.info("[Autonomy] Updated settings for {}: level={}, limit={}",
                tenantId, updated.getGlobalLevel(), updated.getDailyActionLimit());
        return updated;
    }

    /**
     * Kill switch: stops every heartbeat and trigger evaluation for the tenant.
     */
    public AutonomySettings pause(String tenantId, String reason) {
        requireTenant(tenantId);
        AutonomySettings paused = settings.mutate(tenantId, rows -> {
            AutonomySettings current = currentOrDefault(tenantId, rows);
            Instant now = clock.instant();
            current.setPaused(true);
            current.setPausedAt(now);
            current.setPausedReason(reason != null && !reason.isBlank() ? reason : "Paused by user");
            current.setUpdatedAt(now);
            return current;
        });
        log.warn("[Autonomy] Autonomy paused for {}: {}", tenantId, paused.getPausedReason());
        return paused;
    }

    public AutonomySettings resume(String tenantId) {
        requireTenant(tenantId);
        AutonomySettings resumed = settings.mutate(tenantId, rows -> {
            AutonomySettings current = currentOrDefault(tenantId, rows);
            current.setPaused(false);
            current.setPausedAt(null);
            current.setPausedReason(null);
            current.setUpdatedAt(clock.instant());
            return current;
        });
        log.info("[Autonomy] Autonomy resumed for {}", tenantId);
        return resumed;
    }

    /**
     * Reads the stored flag without creating settings.
     */
    public boolean isPaused(String tenantId) {
        List<AutonomySettings> stored = settings.read(tenantId);
        return !stored.isEmpty() && stored.get(0).isPaused();
    }

    /**
     * An action needs approval when its source says so or the tenant's level
     * for the category is below AUTOPILOT.
     */
    public boolean requiresApproval(String tenantId, String category, boolean requestedBySource) {
        if (requestedBySource) {
            return true;
        }
        return !levelFor(tenantId, category).isAtLeast(AutonomyLevel.AUTOPILOT);
    }

    public AutonomyLevel levelFor(String tenantId, String category) {
        List<AutonomySettings> stored = settings.read(tenantId);
        AutonomySettings current = stored.isEmpty() ? AutonomySettings.builder().build() : stored.get(0);
        return current.levelFor(category);
    }

    public ZoneId zoneFor(String tenantId) {
        List<AutonomySettings> stored = settings.read(tenantId);
        String timezone = stored.isEmpty() ? null : stored.get(0).getTimezone();
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            log.warn("[Autonomy] Invalid timezone '{}' for {}, using UTC", timezone, tenantId);
            return ZoneOffset.UTC;
        }
    }

    public int dailyActionLimit(String tenantId) {
        List<AutonomySettings> stored = settings.read(tenantId);
        return stored.isEmpty() ? AutonomySettings.DEFAULT_DAILY_ACTION_LIMIT : stored.get(0).getDailyActionLimit();
    }

    /**
     * Tenants that have stored settings.
     */
    public List<String> knownTenants() {
        return settings.tenants();
    }

    private AutonomySettings currentOrDefault(String tenantId, List<AutonomySettings> rows) {
        if (!rows.isEmpty()) {
            return rows.get(0);
        }
        Instant now = clock.instant();
        AutonomySettings defaults = AutonomySettings.builder()
                .tenantId(tenantId)
                .createdAt(now)
                .updatedAt(now)
                .build();
        rows.add(defaults);
        log.debug("[Autonomy] Created default settings for {}", tenantId);
        return defaults;
    }

    private static AutonomyLevel parseLevel(String value) {
        AutonomyLevel level = AutonomyLevel.parse(value, null);
        if (level == null) {
            throw new IllegalArgumentException("Unknown autonomy level: " + value);
        }
        return level;
    }

    private static String validateTimezone(String timezone) {
        try {
            return ZoneId.of(timezone.trim()).getId();
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unknown timezone: " + timezone);
        }
    }

    private static void requireTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("startup_id is required");
        }
    }
}

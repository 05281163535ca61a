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

import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Cron helpers shared by TIME triggers and schedule-triggered workflows.
 */
public final class CronSchedules {

    private static final int CRON_FIVE_FIELDS = 5;
    private static final int CRON_SIX_FIELDS = 6;

    private CronSchedules() {
    }

    /**
     * Normalize a cron expression: converts 5-field (minute-level) to 6-field
     * (Spring format with seconds). Validates the result.
     *
     * @throws IllegalArgumentException
     *             if the cron expression is invalid
     */
    public static String normalize(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Cron expression cannot be empty");
        }

        String trimmed = input.trim();
        String[] parts = trimmed.split("\\s+");

        String sixFieldCron;
        if (parts.length == CRON_FIVE_FIELDS) {
            sixFieldCron = "0 " + trimmed;
        } else if (parts.length == CRON_SIX_FIELDS) {
            sixFieldCron = trimmed;
        } else {
            throw new IllegalArgumentException("Invalid cron expression: expected 5 or 6 fields, got " + parts.length);
        }

        try {
            CronExpression.parse(sixFieldCron);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cron expression '" + trimmed + "': " + e.getMessage());
        }

        return sixFieldCron;
    }

    /**
     * Next fire time strictly after {@code after}, evaluated in {@code zone}.
     *
     * @return next execution instant, or null if no future execution exists
     */
    public static Instant next(String cronExpression, Instant after, ZoneId zone) {
        CronExpression cron = CronExpression.parse(normalize(cronExpression));
        ZonedDateTime next = cron.next(after.atZone(zone));
        return next != null ? next.toInstant() : null;
    }

    /**
     * Whether the schedule has a fire time in {@code (since, now]}.
     */
    public static boolean isDue(String cronExpression, Instant since, Instant now, ZoneId zone) {
        Instant next = next(cronExpression, since, zone);
        return next != null && !next.isAfter(now);
    }
}

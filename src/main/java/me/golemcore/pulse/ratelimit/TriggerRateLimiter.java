package me.golemcore.pulse.ratelimit;

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

import me.golemcore.pulse.domain.model.RateLimitResult;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collection;

/**
 * Cooldown and daily-cap suppression shared by heartbeat checks and trigger
 * rules.
 *
 * <p>
 * Both limits are computed from stored history rather than in-memory counters,
 * so several scheduler instances see the same answer. A limit of zero or less
 * is unlimited.
 */
@Component
public class TriggerRateLimiter {

    /**
     * @param cooldownMinutes
     *            minimum spacing between two fires
     * @param maxPerDay
     *            fires allowed per tenant-local calendar day
     * @param lastFiredAt
     *            most recent fire, {@code null} if never
     * @param firedAt
     *            previous non-skipped fires
     * @param zone
     *            tenant timezone that defines the calendar day
     */
    public RateLimitResult check(int cooldownMinutes, int maxPerDay, Instant lastFiredAt,
            Collection<Instant> firedAt, ZoneId zone, Instant now) {
        if (cooldownMinutes > 0 && lastFiredAt != null) {
            Instant cooldownEnd = lastFiredAt.plus(Duration.ofMinutes(cooldownMinutes));
            if (now.isBefore(cooldownEnd)) {
                return RateLimitResult.deny(Duration.between(now, cooldownEnd),
                        "cooldown active (" + cooldownMinutes + " min)");
            }
        }

        if (maxPerDay > 0) {
            LocalDate today = now.atZone(zone).toLocalDate();
            long firedToday = firedAt.stream()
                    .filter(instant -> instant != null && instant.atZone(zone).toLocalDate().equals(today))
                    .count();
            if (firedToday >= maxPerDay) {
                Instant nextDay = today.plusDays(1).atStartOfDay(zone).toInstant();
                return RateLimitResult.deny(Duration.between(now, nextDay),
                        "daily cap reached (" + maxPerDay + " per day)");
            }
            return RateLimitResult.allow(maxPerDay - firedToday - 1);
        }

        return RateLimitResult.unlimited();
    }
}

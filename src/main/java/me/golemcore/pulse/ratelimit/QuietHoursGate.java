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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.HeartbeatRuleSet;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Decides whether an instant falls inside a rule-set's quiet-hours window.
 *
 * <p>
 * The window is evaluated in its own timezone. The start is inclusive and the
 * end exclusive; a start later than the end wraps midnight (22:00-07:00).
 * Malformed windows are logged and treated as never quiet.
 */
@Component
@Slf4j
public class QuietHoursGate {

    public boolean isQuiet(HeartbeatRuleSet.QuietHours quietHours, Instant now) {
        if (quietHours == null || !quietHours.isEnabled()) {
            return false;
        }

        LocalTime start;
        LocalTime end;
        try {
            start = LocalTime.parse(quietHours.getStart());
            end = LocalTime.parse(quietHours.getEnd());
        } catch (DateTimeParseException | NullPointerException e) {
            log.warn("[Heartbeat] Ignoring malformed quiet hours {}-{}", quietHours.getStart(), quietHours.getEnd());
            return false;
        }
        if (start.equals(end)) {
            return false;
        }

        LocalTime local = now.atZone(resolveZone(quietHours.getTimezone())).toLocalTime();
        if (start.isBefore(end)) {
            return !local.isBefore(start) && local.isBefore(end);
        }
        return !local.isBefore(start) || local.isBefore(end);
    }

    static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            log.warn("[Heartbeat] Unknown timezone '{}', using UTC", timezone);
            return ZoneOffset.UTC;
        }
    }
}

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

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Outcome of a decision budget, cooldown or daily cap check. A denied result
 * carries how long until the same check would pass; {@link #skipSummary()}
 * folds that into the text written on SKIPPED ledger and trigger-log rows.
 *
 * @since 1.0
 */
@Data
@Builder
public class RateLimitResult {

    private boolean allowed;
    private long remaining;
    private Duration retryAfter;
    private String reason;

    public static RateLimitResult allow(long remaining) {
        return RateLimitResult.builder()
                .allowed(true)
                .remaining(remaining)
                .build();
    }

    public static RateLimitResult unlimited() {
        return allow(Long.MAX_VALUE);
    }

    public static RateLimitResult deny(Duration retryAfter, String reason) {
        return RateLimitResult.builder()
                .allowed(false)
                .retryAfter(retryAfter)
                .reason(reason)
                .build();
    }

    public String skipSummary() {
        if (allowed || retryAfter == null || retryAfter.isZero() || retryAfter.isNegative()) {
            return reason;
        }
        return reason + ", retry in " + formatDelay(retryAfter);
    }

    private static String formatDelay(Duration delay) {
        if (delay.toMinutes() >= 60) {
            long minutes = delay.toMinutesPart();
            return delay.toHours() + "h" + (minutes > 0 ? " " + minutes + "m" : "");
        }
        if (delay.toMinutes() >= 1) {
            return delay.toMinutes() + "m";
        }
        return Math.max(1, delay.toSeconds()) + "s";
    }
}

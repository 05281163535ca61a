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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.RateLimitResult;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-decision-function call budget. Each decision function (rule-based, LLM)
 * gets its own {@link TokenBucket} sized from
 * {@code pulse.heartbeat.decision-calls-per-minute}; zero or less disables the
 * budget.
 *
 * @since 1.0
 * @see TokenBucket
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DecisionRateLimiter {

    private final PulseProperties properties;

    private final Map<String, ConfiguredBucket> buckets = new ConcurrentHashMap<>();

    public RateLimitResult tryConsume(String decisionName) {
        int callsPerMinute = properties.getHeartbeat().getDecisionCallsPerMinute();
        if (callsPerMinute <= 0) {
            return RateLimitResult.unlimited();
        }

        TokenBucket bucket = resolveBucket("decision:" + decisionName, callsPerMinute, Duration.ofMinutes(1));
        RateLimitResult result = bucket.tryConsume();
        if (!result.isAllowed()) {
            log.debug("[Heartbeat] Decision budget exhausted for {}", decisionName);
        }
        return result;
    }

    private TokenBucket resolveBucket(String key, int capacity, Duration refillPeriod) {
        ConfiguredBucket configured = buckets.compute(key, (bucketKey, existing) -> {
            if (existing == null || existing.capacity() != capacity
                    || !existing.refillPeriod().equals(refillPeriod)) {
                return new ConfiguredBucket(new TokenBucket(capacity, refillPeriod), capacity, refillPeriod);
            }
            return existing;
        });
        return configured.bucket();
    }

    private record ConfiguredBucket(TokenBucket bucket, int capacity, Duration refillPeriod) {
    }
}

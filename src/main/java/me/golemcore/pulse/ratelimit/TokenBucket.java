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

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe token bucket guarding the decision-function budget.
 *
 * <p>
 * The bucket starts full with {@code capacity} tokens and refills
 * continuously over {@code refillPeriod}. Refill is computed lazily on each
 * {@code tryConsume()} call from the time elapsed since the last refill.
 *
 * @since 1.0
 */
public class TokenBucket {

    private final long capacity;
    private final Duration refillPeriod;
    private final AtomicLong tokens;
    private final AtomicLong lastRefillNanos;

    public TokenBucket(long capacity, Duration refillPeriod) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Bucket capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.refillPeriod = refillPeriod;
        this.tokens = new AtomicLong(capacity);
        this.lastRefillNanos = new AtomicLong(System.nanoTime());
    }

    public long getCapacity() {
        return capacity;
    }

    public Duration getRefillPeriod() {
        return refillPeriod;
    }

    /**
     * Try to consume one token.
     */
    public synchronized RateLimitResult tryConsume() {
        refill();

        if (tokens.get() > 0) {
            long remaining = tokens.decrementAndGet();
            return RateLimitResult.allow(remaining);
        }

        return RateLimitResult.deny(timePerToken(), "decision budget exhausted");
    }

    private void refill() {
        long now = System.nanoTime();
        long elapsedNanos = now - lastRefillNanos.get();
        if (elapsedNanos <= 0) {
            return;
        }

        long tokensToAdd = (elapsedNanos * capacity) / refillPeriod.toNanos();
        if (tokensToAdd > 0) {
            tokens.set(Math.min(capacity, tokens.get() + tokensToAdd));
            lastRefillNanos.set(now);
        }
    }

    private Duration timePerToken() {
        return refillPeriod.dividedBy(capacity);
    }
}

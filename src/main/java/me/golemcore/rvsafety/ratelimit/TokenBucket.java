package me.golemcore.rvsafety.ratelimit;

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

import me.golemcore.rvsafety.domain.model.RateLimitResult;

import java.time.Clock;
import java.time.Duration;

/**
 * Thread-safe token bucket implementation for rate limiting.
 *
 * <p>
 * The token bucket algorithm maintains a fixed-capacity bucket that:
 * <ul>
 * <li>Starts full with {@code capacity} tokens</li>
 * <li>Refills continuously over the {@code refillPeriod}</li>
 * <li>Consumes tokens on each request</li>
 * <li>Denies requests when empty, returning wait time until next token</li>
 * </ul>
 *
 * <p>
 * Refill is calculated lazily on each {@code tryConsume()} call based on time
 * elapsed on the injected {@link Clock}. Partial progress toward the next token
 * is kept, so slow steady traffic is not starved by rounding.
 *
 * @since 1.0
 */
public class TokenBucket {

    private final long capacity;
    private final long refillPeriodMillis;
    private final Clock clock;

    private long tokens;
    private long lastRefillMillis;

    public TokenBucket(long capacity, Duration refillPeriod, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.refillPeriodMillis = Math.max(1, refillPeriod.toMillis());
        this.clock = clock;
        this.tokens = capacity;
        this.lastRefillMillis = clock.millis();
    }

    /**
     * Try to consume one token.
     */
    public synchronized RateLimitResult tryConsume() {
        refill();

        if (tokens > 0) {
            tokens--;
            return RateLimitResult.allowed(tokens);
        }

        return RateLimitResult.denied(Duration.ofMillis(calculateWaitTimeMs()));
    }

    public synchronized long getAvailableTokens() {
        refill();
        return tokens;
    }

    public long getCapacity() {
        return capacity;
    }

    private void refill() {
        long now = clock.millis();
        long elapsedMillis = now - lastRefillMillis;

        if (elapsedMillis <= 0) {
            return;
        }

        long tokensToAdd = (elapsedMillis * capacity) / refillPeriodMillis;
        if (tokensToAdd <= 0) {
            return;
        }

        if (tokens + tokensToAdd >= capacity) {
            tokens = capacity;
            lastRefillMillis = now;
        } else {
            tokens += tokensToAdd;
            lastRefillMillis += (tokensToAdd * refillPeriodMillis) / capacity;
        }
    }

    private long calculateWaitTimeMs() {
        long millisPerToken = Math.max(1, refillPeriodMillis / capacity);
        long sinceLastRefill = Math.max(0, clock.millis() - lastRefillMillis);
        return Math.max(1, millisPerToken - sinceLastRefill);
    }
}

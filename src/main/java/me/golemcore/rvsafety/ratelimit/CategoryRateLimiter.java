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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.rvsafety.domain.model.RateLimitCategory;
import me.golemcore.rvsafety.domain.model.RateLimitResult;
import me.golemcore.rvsafety.infrastructure.config.RvSafetyProperties;
import me.golemcore.rvsafety.port.outbound.RateLimitPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token bucket based rate limiter with one bucket family per
 * {@link RateLimitCategory}.
 *
 * <p>
 * Default limits:
 * <ul>
 * <li><b>GENERAL</b> - 60 requests per minute</li>
 * <li><b>SAFETY</b> - 5 safety operations per minute</li>
 * <li><b>EMERGENCY</b> - 3 emergency operations per hour</li>
 * <li><b>PIN_AUTH</b> - 3 PIN attempts per minute</li>
 * </ul>
 * Admin callers get the configured multiplier applied to capacity.
 *
 * <p>
 * Can be disabled via {@code rvsafety.rate-limit.enabled=false}.
 *
 * @since 1.0
 * @see TokenBucket
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CategoryRateLimiter implements RateLimitPort {

    private final RvSafetyProperties properties;
    private final Clock clock;

    private final Map<String, ConfiguredBucket> buckets = new ConcurrentHashMap<>();

    @Override
    public RateLimitResult tryConsume(String identifier, RateLimitCategory category, boolean isAdmin) {
        RvSafetyProperties.RateLimitProperties config = properties.getRateLimit();
        if (!config.isEnabled()) {
            return RateLimitResult.allowed(Long.MAX_VALUE);
        }

        int baseCapacity = switch (category) {
        case GENERAL -> config.getGeneralRequestsPerMinute();
        case SAFETY -> config.getSafetyOperationsPerMinute();
        case EMERGENCY -> config.getEmergencyOperationsPerHour();
        case PIN_AUTH -> config.getPinAttemptsPerMinute();
        };
        Duration refillPeriod = category == RateLimitCategory.EMERGENCY ? Duration.ofHours(1) : Duration.ofMinutes(1);
        int capacity = isAdmin
                ? (int) Math.max(1, Math.round(baseCapacity * config.getAdminMultiplier()))
                : Math.max(1, baseCapacity);

        String key = category.name().toLowerCase(Locale.ROOT) + ":" + (isAdmin ? "admin:" : "") + identifier;
        RateLimitResult result = resolveBucket(key, capacity, refillPeriod).tryConsume();
        if (!result.isAllowed()) {
            log.debug("[RateLimit] Limit exceeded for {} ({})", identifier, category);
        }
        return result;
    }

    private TokenBucket resolveBucket(String key, int capacity, Duration refillPeriod) {
        ConfiguredBucket configured = buckets.compute(key, (bucketKey, existing) -> {
            if (existing == null || existing.capacity() != capacity
                    || !existing.refillPeriod().equals(refillPeriod)) {
                return new ConfiguredBucket(new TokenBucket(capacity, refillPeriod, clock), capacity, refillPeriod);
            }
            return existing;
        });
        return configured.bucket();
    }

    private record ConfiguredBucket(TokenBucket bucket, int capacity, Duration refillPeriod) {
    }
}

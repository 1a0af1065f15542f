package me.golemcore.rvsafety.domain.service;

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
import me.golemcore.rvsafety.domain.model.SecurityEvent;
import me.golemcore.rvsafety.domain.model.SecurityEventSeverity;
import me.golemcore.rvsafety.domain.model.SecurityEventType;
import me.golemcore.rvsafety.port.outbound.SecurityAuditPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;

/**
 * Best-effort front for {@link SecurityAuditPort}. A failing audit sink never
 * blocks a safety or PIN path: events are dropped with a warning and rate-limit
 * checks fail open.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SecurityAuditRecorder {

    private final SecurityAuditPort securityAuditPort;
    private final Clock clock;

    public void record(SecurityEventType type, SecurityEventSeverity severity, String userId, String sourceIp,
            Map<String, Object> details) {
        record(type, severity, userId, sourceIp, details, false);
    }

    public void record(SecurityEventType type, SecurityEventSeverity severity, String userId, String sourceIp,
            Map<String, Object> details, boolean emergencyContext) {
        SecurityEvent.SecurityEventBuilder builder = SecurityEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(type)
                .severity(severity)
                .timestamp(clock.instant())
                .userId(userId)
                .sourceIp(sourceIp)
                .emergencyContext(emergencyContext);
        if (details != null) {
            details.forEach((key, value) -> builder.detail(key, value));
        }
        try {
            securityAuditPort.logSecurityEvent(builder.build());
        } catch (RuntimeException e) { // NOSONAR - audit is best-effort
            log.warn("[SecurityAudit] Failed to record {} event: {}", type, e.getMessage());
        }
    }

    /**
     * Rate-limit check that treats an unavailable audit service as allowed.
     */
    public RateLimitResult checkRateLimit(String identifier, RateLimitCategory category, boolean isAdmin,
            String sourceIp) {
        try {
            RateLimitResult result = securityAuditPort.checkRateLimit(identifier, category, isAdmin, sourceIp);
            return result != null ? result : RateLimitResult.allowed(Long.MAX_VALUE);
        } catch (RuntimeException e) { // NOSONAR - rate limiting fails open
            log.warn("[SecurityAudit] Rate limit check unavailable, allowing {}: {}", identifier, e.getMessage());
            return RateLimitResult.allowed(Long.MAX_VALUE);
        }
    }
}

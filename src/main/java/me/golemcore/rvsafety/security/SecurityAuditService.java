package me.golemcore.rvsafety.security;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.rvsafety.domain.model.RateLimitCategory;
import me.golemcore.rvsafety.domain.model.RateLimitResult;
import me.golemcore.rvsafety.domain.model.SecurityEvent;
import me.golemcore.rvsafety.domain.model.SecurityEventSeverity;
import me.golemcore.rvsafety.domain.model.SecurityEventType;
import me.golemcore.rvsafety.infrastructure.config.RvSafetyProperties;
import me.golemcore.rvsafety.port.outbound.RateLimitPort;
import me.golemcore.rvsafety.port.outbound.SecurityAuditPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Default {@link SecurityAuditPort}: writes every security event as one JSON
 * line to the dedicated {@code AUDIT} logger and answers rate-limit checks
 * through the {@link RateLimitPort}.
 *
 * <p>
 * Severity maps to log level (LOW → INFO, MEDIUM → WARN, HIGH and CRITICAL →
 * ERROR). The most recent events are kept in memory for
 * {@link #getRecentEvents(int)} and {@link #getSecuritySummary(Duration)}.
 *
 * <p>
 * Addresses in {@code rvsafety.rate-limit.trusted-networks} bypass rate
 * limiting.
 */
@Service
@Slf4j
public class SecurityAuditService implements SecurityAuditPort {

    private static final Logger AUDIT = LoggerFactory.getLogger("AUDIT");
    private static final int MAX_RECENT_EVENTS = 500;

    private final RateLimitPort rateLimitPort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final TrustedNetworks trustedNetworks;

    private final Object lock = new Object();
    private final Deque<SecurityEvent> recentEvents = new ArrayDeque<>(MAX_RECENT_EVENTS);

    public SecurityAuditService(RateLimitPort rateLimitPort, ObjectMapper objectMapper, Clock clock,
            RvSafetyProperties properties) {
        this.rateLimitPort = rateLimitPort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.trustedNetworks = TrustedNetworks.parse(properties.getRateLimit().getTrustedNetworks());
    }

    @Override
    public void logSecurityEvent(SecurityEvent event) {
        if (event == null) {
            return;
        }
        SecurityEvent stamped = stamp(event);

        synchronized (lock) {
            if (recentEvents.size() >= MAX_RECENT_EVENTS) {
                recentEvents.removeFirst();
            }
            recentEvents.addLast(stamped);
        }

        String line = toJson(stamped);
        switch (stamped.getSeverity()) {
        case LOW -> AUDIT.info(line);
        case MEDIUM -> AUDIT.warn(line);
        case HIGH, CRITICAL -> AUDIT.error(line);
        }
    }

    @Override
    public RateLimitResult checkRateLimit(String identifier, RateLimitCategory category, boolean isAdmin,
            String sourceIp) {
        if (sourceIp != null && trustedNetworks.contains(sourceIp)) {
            return RateLimitResult.allowed(Long.MAX_VALUE);
        }
        String key = identifier != null && !identifier.isBlank() ? identifier : "anonymous";
        RateLimitResult result = rateLimitPort.tryConsume(key, category, isAdmin);
        if (!result.isAllowed()) {
            SecurityEventSeverity severity = category == RateLimitCategory.GENERAL
                    ? SecurityEventSeverity.MEDIUM
                    : SecurityEventSeverity.HIGH;
            logSecurityEvent(SecurityEvent.builder()
                    .eventType(SecurityEventType.RATE_LIMIT_EXCEEDED)
                    .severity(severity)
                    .sourceIp(sourceIp)
                    .detail("identifier", key)
                    .detail("category", category.name())
                    .detail("admin", isAdmin)
                    .detail("retryAfterMs", result.getWaitTime() != null ? result.getWaitTime().toMillis() : 0L)
                    .emergencyContext(category == RateLimitCategory.EMERGENCY)
                    .build());
        }
        return result;
    }

    /**
     * Most recent events, newest last.
     */
    public List<SecurityEvent> getRecentEvents(int maxEvents) {
        List<SecurityEvent> snapshot;
        synchronized (lock) {
            snapshot = new ArrayList<>(recentEvents);
        }
        if (maxEvents <= 0 || snapshot.size() <= maxEvents) {
            return snapshot;
        }
        return snapshot.subList(snapshot.size() - maxEvents, snapshot.size());
    }

    /**
     * Event counts by type and severity over the given period.
     */
    public Map<String, Object> getSecuritySummary(Duration period) {
        Instant since = clock.instant().minus(period);
        Map<SecurityEventType, Integer> byType = new EnumMap<>(SecurityEventType.class);
        Map<SecurityEventSeverity, Integer> bySeverity = new EnumMap<>(SecurityEventSeverity.class);
        int total = 0;
        for (SecurityEvent event : getRecentEvents(0)) {
            if (event.getTimestamp().isBefore(since)) {
                continue;
            }
            total++;
            byType.merge(event.getEventType(), 1, Integer::sum);
            bySeverity.merge(event.getSeverity(), 1, Integer::sum);
        }
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("periodMinutes", period.toMinutes());
        summary.put("totalEvents", total);
        summary.put("eventsByType", byType);
        summary.put("eventsBySeverity", bySeverity);
        return summary;
    }

    private SecurityEvent stamp(SecurityEvent event) {
        if (event.getEventId() != null && event.getTimestamp() != null && event.getSeverity() != null) {
            return event;
        }
        return SecurityEvent.builder()
                .eventId(event.getEventId() != null ? event.getEventId() : UUID.randomUUID().toString())
                .eventType(event.getEventType())
                .severity(event.getSeverity() != null ? event.getSeverity() : SecurityEventSeverity.MEDIUM)
                .timestamp(event.getTimestamp() != null ? event.getTimestamp() : clock.instant())
                .userId(event.getUserId())
                .sourceIp(event.getSourceIp())
                .details(event.getDetails())
                .emergencyContext(event.isEmergencyContext())
                .build();
    }

    private String toJson(SecurityEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.warn("[Security] Failed to serialize security event {}: {}", event.getEventType(), e.getMessage());
            return event.getEventType() + " " + event.getDetails();
        }
    }
}

package me.golemcore.rvsafety.infrastructure.config;

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

import lombok.Data;
import me.golemcore.rvsafety.domain.model.PinType;
import me.golemcore.rvsafety.domain.model.SafetyClassification;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the safety core, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code rvsafety.*} prefix:
 * <ul>
 * <li>{@link PinProperties} - PIN format, lockout and per-type session
 * policy</li>
 * <li>{@link SafetyProperties} - watchdog, health loop and audit log
 * settings</li>
 * <li>{@link RateLimitProperties} - per-category limits for safety
 * operations</li>
 * <li>{@link StorageProperties} - local workspace for the PIN store</li>
 * <li>{@code features} - features known to the in-process feature
 * registry</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "rvsafety")
@Data
public class RvSafetyProperties {

    private PinProperties pin = new PinProperties();
    private SafetyProperties safety = new SafetyProperties();
    private RateLimitProperties rateLimit = new RateLimitProperties();
    private StorageProperties storage = new StorageProperties();
    private Map<String, FeatureProperties> features = defaultFeatures();

    @Data
    public static class PinProperties {
        private int minLength = 4;
        private int maxLength = 8;
        private boolean requireNumericOnly = true;
        private int maxFailedAttempts = 3;
        private int lockoutDurationMinutes = 15;
        private int maxConcurrentSessions = 2;
        private int rotationDays = 30;
        private int sessionRetentionHours = 24;
        private long cleanupIntervalMs = 300_000;
        private SessionPolicyProperties emergency = new SessionPolicyProperties(5, 1);
        private SessionPolicyProperties override = new SessionPolicyProperties(15, 3);
        private SessionPolicyProperties maintenance = new SessionPolicyProperties(30, 0);

        public SessionPolicyProperties policyFor(PinType pinType) {
            return switch (pinType) {
            case EMERGENCY -> emergency;
            case OVERRIDE -> override;
            case MAINTENANCE -> maintenance;
            };
        }
    }

    /**
     * Session lifetime and operation budget for one PIN type. A
     * {@code maxOperations} of zero means unlimited.
     */
    @Data
    public static class SessionPolicyProperties {
        private int sessionTimeoutMinutes;
        private int maxOperations;

        public SessionPolicyProperties() {
        }

        public SessionPolicyProperties(int sessionTimeoutMinutes, int maxOperations) {
            this.sessionTimeoutMinutes = sessionTimeoutMinutes;
            this.maxOperations = maxOperations;
        }
    }

    @Data
    public static class SafetyProperties {
        private boolean monitoringEnabled = true;
        private long healthCheckIntervalMs = 5000;
        private long watchdogTimeoutMs = 15000;
        private long watchdogPollIntervalMs = 1000;
        private int auditLogCapacity = 1000;
        private int multipleViolationThreshold = 3;
        private String legacyResetCode = "SAFETY_OVERRIDE_ADMIN";
    }

    @Data
    public static class RateLimitProperties {
        private boolean enabled = true;
        private int generalRequestsPerMinute = 60;
        private int safetyOperationsPerMinute = 5;
        private int emergencyOperationsPerHour = 3;
        private int pinAttemptsPerMinute = 3;
        private double adminMultiplier = 2.0;
        private List<String> trustedNetworks = new ArrayList<>();
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/rv-safety";
    }

    @Data
    public static class FeatureProperties {
        private boolean enabled = true;
        private SafetyClassification classification = SafetyClassification.OPERATIONAL;
    }

    private static Map<String, FeatureProperties> defaultFeatures() {
        Map<String, FeatureProperties> features = new LinkedHashMap<>();
        FeatureProperties firefly = new FeatureProperties();
        firefly.setClassification(SafetyClassification.POSITION_CRITICAL);
        features.put("firefly", firefly);
        FeatureProperties spartanK2 = new FeatureProperties();
        spartanK2.setClassification(SafetyClassification.POSITION_CRITICAL);
        features.put("spartan_k2", spartanK2);
        return features;
    }
}

package me.golemcore.rvsafety.domain.safety;

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

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.rvsafety.domain.model.InterlockCheckResult;
import me.golemcore.rvsafety.domain.model.InterlockOverride;
import me.golemcore.rvsafety.domain.model.InterlockStatus;
import me.golemcore.rvsafety.domain.model.SafeStateAction;
import me.golemcore.rvsafety.domain.model.VehicleState;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Guard over one position-critical feature.
 *
 * <p>
 * States: disengaged, engaged, and overridden until a deadline. An override
 * makes {@link #checkConditions} report satisfied but does not disengage; the
 * owning service disengages on its next check. Not thread-safe: instances are
 * confined to the safety actor.
 */
@Slf4j
@Getter
public class SafetyInterlock {

    private final String name;
    private final String featureName;
    private final List<String> conditions;
    private final SafeStateAction safeStateAction;

    private boolean engaged;
    private Instant engagedAt;
    private String engagementReason;
    private InterlockOverride override;

    public SafetyInterlock(String name, String featureName, List<String> conditions,
            SafeStateAction safeStateAction) {
        this.name = name;
        this.featureName = featureName;
        this.conditions = List.copyOf(conditions);
        this.safeStateAction = safeStateAction != null ? safeStateAction : SafeStateAction.MAINTAIN_POSITION;
    }

    /**
     * Evaluates the conditions in order and reports the first unmet one. An
     * override still in force short-circuits to satisfied; an expired one is
     * cleared first.
     */
    public InterlockCheckResult checkConditions(VehicleState state, Instant now) {
        if (override != null) {
            if (override.isExpired(now)) {
                log.warn("[Interlock] '{}' override expired, reverting to normal operation", name);
                override = null;
            } else {
                return InterlockCheckResult.ok("Overridden by " + override.getOverriddenBy() + ": "
                        + override.getReason());
            }
        }

        for (String conditionName : conditions) {
            Optional<InterlockCondition> condition = InterlockCondition.fromName(conditionName);
            if (condition.isEmpty()) {
                log.warn("[Interlock] Unknown interlock condition: {}", conditionName);
                return InterlockCheckResult.failed(conditionName, "Unknown interlock condition: " + conditionName);
            }
            if (!condition.get().isMet(state)) {
                return InterlockCheckResult.failed(conditionName, "Interlock condition not met: " + conditionName);
            }
        }
        return InterlockCheckResult.ok("All conditions satisfied");
    }

    /**
     * @return {@code true} if this call changed the state
     */
    public boolean engage(String reason, Instant now) {
        if (engaged) {
            return false;
        }
        engaged = true;
        engagedAt = now;
        engagementReason = reason;
        log.warn("[Interlock] '{}' ENGAGED for feature '{}': {}", name, featureName, reason);
        return true;
    }

    /**
     * @return {@code true} if this call changed the state
     */
    public boolean disengage(String reason, Instant now) {
        if (!engaged) {
            return false;
        }
        long seconds = engagedAt != null ? Duration.between(engagedAt, now).getSeconds() : 0;
        engaged = false;
        engagedAt = null;
        engagementReason = null;
        log.info("[Interlock] '{}' DISENGAGED for feature '{}' after {}s: {}", name, featureName, seconds, reason);
        return true;
    }

    public void override(String sessionId, String reason, Instant expiresAt, String overriddenBy, Instant now) {
        this.override = InterlockOverride.builder()
                .interlockName(name)
                .sessionId(sessionId)
                .reason(reason)
                .overriddenBy(overriddenBy)
                .overriddenAt(now)
                .expiresAt(expiresAt)
                .build();
        log.warn("[Interlock] '{}' OVERRIDDEN for feature '{}' by {}: {} (expires {})", name, featureName,
                overriddenBy, reason, expiresAt);
    }

    /**
     * @return {@code true} if an override was removed
     */
    public boolean clearOverride() {
        if (override == null) {
            return false;
        }
        override = null;
        log.info("[Interlock] '{}' override CLEARED for feature '{}'", name, featureName);
        return true;
    }

    public Optional<InterlockOverride> getOverride() {
        return Optional.ofNullable(override);
    }

    public boolean isOverridden() {
        return override != null;
    }

    public InterlockStatus toStatus() {
        return InterlockStatus.builder()
                .name(name)
                .featureName(featureName)
                .conditions(conditions)
                .engaged(engaged)
                .engagedAt(engagedAt)
                .engagementReason(engagementReason)
                .override(override)
                .build();
    }
}

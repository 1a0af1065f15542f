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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.rvsafety.domain.model.AuditLogEntry;
import me.golemcore.rvsafety.domain.model.AuthorizationResult;
import me.golemcore.rvsafety.domain.model.FeatureHealthReport;
import me.golemcore.rvsafety.domain.model.FeatureInfo;
import me.golemcore.rvsafety.domain.model.FeatureState;
import me.golemcore.rvsafety.domain.model.InterlockCheckResult;
import me.golemcore.rvsafety.domain.model.InterlockOverride;
import me.golemcore.rvsafety.domain.model.InterlockStatus;
import me.golemcore.rvsafety.domain.model.ModeSession;
import me.golemcore.rvsafety.domain.model.RateLimitCategory;
import me.golemcore.rvsafety.domain.model.RateLimitResult;
import me.golemcore.rvsafety.domain.model.SafeStateAction;
import me.golemcore.rvsafety.domain.model.SafetyClassification;
import me.golemcore.rvsafety.domain.model.SafetyStatus;
import me.golemcore.rvsafety.domain.model.SecurityEventSeverity;
import me.golemcore.rvsafety.domain.model.SecurityEventType;
import me.golemcore.rvsafety.domain.model.SystemOperationalMode;
import me.golemcore.rvsafety.domain.model.VehicleState;
import me.golemcore.rvsafety.domain.safety.InterlockCondition;
import me.golemcore.rvsafety.domain.safety.SafetyAuditLog;
import me.golemcore.rvsafety.domain.safety.SafetyInterlock;
import me.golemcore.rvsafety.infrastructure.config.RvSafetyProperties;
import me.golemcore.rvsafety.port.outbound.FeatureManagerPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;
import java.util.function.UnaryOperator;

/**
 * Safety supervisor for position-critical coach features.
 *
 * <p>
 * Owns the fixed interlock set, the emergency-stop flag, the operational mode,
 * the vehicle state snapshot and the audit trail. All of that state is confined
 * to a single "safety actor" thread: public operations are submitted to it and
 * wait for the result. PIN authorization runs on the caller's thread before the
 * transition is submitted, so the actor never waits on PIN persistence; state
 * preconditions are re-checked on the actor.
 *
 * <p>
 * The watchdog is the one exception: {@link #checkWatchdog()} runs on the
 * monitor thread and latches safe state directly, so a stuck actor cannot hide
 * a timeout.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class SafetyService {

    static final String OP_EMERGENCY_STOP = "emergency_stop";
    static final String OP_EMERGENCY_RESET = "emergency_reset";
    static final String OP_INTERLOCK_OVERRIDE = "interlock_override";
    static final String OP_MAINTENANCE_MODE = "maintenance_mode";
    static final String OP_MAINTENANCE_EXIT = "maintenance_exit";
    static final String OP_DIAGNOSTIC_MODE = "diagnostic_mode";
    static final String OP_DIAGNOSTIC_EXIT = "diagnostic_exit";
    static final String OP_SAFE_STATE_CLEAR = "safe_state_clear";

    static final String SLIDE_ROOM_SAFETY = "slide_room_safety";
    static final String AWNING_SAFETY = "awning_safety";
    static final String LEVELING_JACK_SAFETY = "leveling_jack_safety";

    private final PinManager pinManager;
    private final FeatureManagerPort featureManager;
    private final SecurityAuditRecorder securityAudit;
    private final RvSafetyProperties.SafetyProperties config;
    private final Clock clock;
    private final LongSupplier nanoTime;

    private final ExecutorService actor;
    private volatile Thread actorThread;

    private final Map<String, SafetyInterlock> interlocks = new LinkedHashMap<>();
    private final Map<String, Instant> activeOverrides = new LinkedHashMap<>();
    private final SafetyAuditLog auditLog;
    private final AtomicLong lastWatchdogKickNanos;

    private volatile boolean emergencyStopActive;
    private String emergencyStopReason;
    private String emergencyStopTriggeredBy;
    private Instant emergencyStopTriggeredAt;

    private volatile boolean inSafeState;
    private volatile String safeStateReason;
    private boolean safeStateActionsApplied;

    private volatile SystemOperationalMode operationalMode = SystemOperationalMode.NORMAL;
    private ModeSession modeSession;
    private volatile VehicleState vehicleState = VehicleState.parkedDefault();
    private Instant lastWatchdogKickAt;

    @Autowired
    public SafetyService(PinManager pinManager, FeatureManagerPort featureManager,
            SecurityAuditRecorder securityAudit, RvSafetyProperties properties, Clock clock) {
        this(pinManager, featureManager, securityAudit, properties, clock, System::nanoTime);
    }

    SafetyService(PinManager pinManager, FeatureManagerPort featureManager, SecurityAuditRecorder securityAudit,
            RvSafetyProperties properties, Clock clock, LongSupplier nanoTime) {
        this.pinManager = pinManager;
        this.featureManager = featureManager;
        this.securityAudit = securityAudit;
        this.config = properties.getSafety();
        this.clock = clock;
        this.nanoTime = nanoTime;
        this.auditLog = new SafetyAuditLog(config.getAuditLogCapacity());
        this.lastWatchdogKickNanos = new AtomicLong(nanoTime.getAsLong());
        this.lastWatchdogKickAt = clock.instant();
        this.actor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "safety-actor");
            t.setDaemon(true);
            actorThread = t;
            return t;
        });
        setupDefaultInterlocks();
        log.info("[Safety] Initialized with {} interlock(s) and default vehicle state {}", interlocks.size(),
                vehicleState);
    }

    private void setupDefaultInterlocks() {
        addInterlock(new SafetyInterlock(SLIDE_ROOM_SAFETY, "firefly", List.of(
                InterlockCondition.VEHICLE_NOT_MOVING.conditionName(),
                InterlockCondition.PARKING_BRAKE_ENGAGED.conditionName(),
                InterlockCondition.LEVELING_JACKS_DEPLOYED.conditionName(),
                InterlockCondition.TRANSMISSION_IN_PARK.conditionName()),
                SafeStateAction.MAINTAIN_POSITION));
        addInterlock(new SafetyInterlock(AWNING_SAFETY, "firefly", List.of(
                InterlockCondition.VEHICLE_NOT_MOVING.conditionName(),
                InterlockCondition.PARKING_BRAKE_ENGAGED.conditionName()),
                SafeStateAction.MAINTAIN_POSITION));
        addInterlock(new SafetyInterlock(LEVELING_JACK_SAFETY, "spartan_k2", List.of(
                InterlockCondition.VEHICLE_NOT_MOVING.conditionName(),
                InterlockCondition.PARKING_BRAKE_ENGAGED.conditionName(),
                InterlockCondition.TRANSMISSION_IN_PARK.conditionName(),
                InterlockCondition.ENGINE_NOT_RUNNING.conditionName()),
                SafeStateAction.MAINTAIN_POSITION));
    }

    private void addInterlock(SafetyInterlock interlock) {
        interlocks.put(interlock.getName(), interlock);
        log.info("[Safety] Added interlock '{}' for feature '{}'", interlock.getName(), interlock.getFeatureName());
    }

    @PreDestroy
    public void shutdown() {
        actor.shutdown();
        try {
            if (!actor.awaitTermination(5, TimeUnit.SECONDS)) {
                actor.shutdownNow();
            }
        } catch (InterruptedException e) {
            actor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Safety] Shut down");
    }

    // ===== Vehicle state and interlocks =====

    /**
     * Applies a telemetry update. The result gets the next version number.
     *
     * @return the new state
     */
    public VehicleState updateSystemState(UnaryOperator<VehicleState> update) {
        return onActor(() -> {
            VehicleState current = vehicleState;
            VehicleState next = update.apply(current);
            if (next == null) {
                throw new IllegalArgumentException("Vehicle state update returned null");
            }
            vehicleState = next.toBuilder().version(current.getVersion() + 1).build();
            log.debug("[Safety] Vehicle state updated: {}", vehicleState);
            return vehicleState;
        });
    }

    /**
     * Evaluates every interlock against the current vehicle state, engaging and
     * disengaging as needed.
     */
    public Map<String, InterlockCheckResult> checkSafetyInterlocks() {
        return onActor(this::doCheckSafetyInterlocks);
    }

    private Map<String, InterlockCheckResult> doCheckSafetyInterlocks() {
        Instant now = clock.instant();
        Map<String, InterlockCheckResult> results = new LinkedHashMap<>();

        for (SafetyInterlock interlock : interlocks.values()) {
            InterlockCheckResult result = interlock.checkConditions(vehicleState, now);
            results.put(interlock.getName(), result);

            if (!interlock.isOverridden() && activeOverrides.remove(interlock.getName()) != null) {
                audit("interlock_override_expired", details("interlock", interlock.getName()));
            }

            if (!result.satisfied() && !interlock.isEngaged()) {
                interlock.engage(result.reason(), now);
                audit("interlock_engaged", details(
                        "interlock", interlock.getName(),
                        "feature", interlock.getFeatureName(),
                        "reason", result.reason()));
                securityAudit.record(SecurityEventType.SAFETY_INTERLOCK_VIOLATED, SecurityEventSeverity.HIGH, null,
                        null, details(
                                "interlockName", interlock.getName(),
                                "featureName", interlock.getFeatureName(),
                                "violationReason", result.reason(),
                                "safeStateAction", interlock.getSafeStateAction().name()),
                        emergencyStopActive);
            } else if (result.satisfied() && interlock.isEngaged() && !inSafeState) {
                interlock.disengage("Conditions satisfied", now);
                audit("interlock_disengaged", details(
                        "interlock", interlock.getName(),
                        "feature", interlock.getFeatureName(),
                        "reason", "Conditions satisfied"));
            }
        }
        return results;
    }

    // ===== Emergency stop =====

    /**
     * Activates the emergency stop: position-critical features are forced to
     * safe shutdown, every interlock is engaged and safe state is entered.
     *
     * @return {@code false} if an emergency stop was already active
     */
    public boolean triggerEmergencyStop(String reason, String triggeredBy) {
        return onActor(() -> doTriggerEmergencyStop(reason, triggeredBy));
    }

    private boolean doTriggerEmergencyStop(String reason, String triggeredBy) {
        if (emergencyStopActive) {
            log.warn("[Safety] Emergency stop already active");
            return false;
        }
        Instant now = clock.instant();
        emergencyStopActive = true;
        emergencyStopReason = reason;
        emergencyStopTriggeredBy = triggeredBy;
        emergencyStopTriggeredAt = now;

        audit("emergency_stop_triggered", details(
                "reason", reason,
                "triggeredBy", triggeredBy,
                "timestamp", now.toString()));
        securityAudit.record(SecurityEventType.EMERGENCY_STOP_TRIGGERED, SecurityEventSeverity.CRITICAL, triggeredBy,
                null, details("reason", reason), true);

        String engageReason = "Emergency stop: " + reason;
        shutdownFeatures(List.of(SafetyClassification.POSITION_CRITICAL), "Emergency stop");
        for (SafetyInterlock interlock : interlocks.values()) {
            interlock.engage(engageReason, now);
        }
        doEnterSafeState(engageReason);

        log.error("[Safety] EMERGENCY STOP TRIGGERED - Reason: {}, By: {}", reason, triggeredBy);
        return true;
    }

    /**
     * Triggers the emergency stop after authorizing {@code emergency_stop}
     * against the PIN session. An unauthorized call changes nothing.
     *
     * @return {@code true} if the emergency stop is in effect after the call
     */
    public boolean emergencyStopWithPin(String sessionId, String reason, String triggeredBy) {
        AuthorizationResult authorization = pinManager.authorizeOperation(sessionId, OP_EMERGENCY_STOP,
                triggeredBy);
        if (!authorization.isAuthorized()) {
            denied("emergency_stop_auth_failed", OP_EMERGENCY_STOP, triggeredBy, authorization,
                    details("reason", reason));
            return false;
        }
        onActor(() -> doTriggerEmergencyStop(reason, triggeredBy));
        log.warn("[Safety] PIN-authorized emergency stop by {}: {}", triggeredBy, reason);
        return true;
    }

    /**
     * Clears the emergency stop. A PIN session is tried first
     * ({@code emergency_reset}), then the legacy reset code.
     *
     * <p>
     * Only the emergency flags are cleared. Safe state, interlocks and feature
     * shutdowns stay as they are until an operator clears them explicitly.
     *
     * @return {@code true} if no emergency stop is active after the call
     */
    public boolean resetEmergencyStop(String authorizationCode, String resetBy, String sessionId) {
        if (!emergencyStopActive) {
            log.info("[Safety] No emergency stop active to reset");
            return true;
        }

        boolean authorized = false;
        String authMethod = "unknown";
        if (sessionId != null && !sessionId.isBlank()) {
            authorized = pinManager.authorizeOperation(sessionId, OP_EMERGENCY_RESET, resetBy).isAuthorized();
            authMethod = "pin_session";
            log.info("[Safety] PIN authorization {} for emergency reset", authorized ? "succeeded" : "failed");
        }
        if (!authorized && authorizationCode != null && !authorizationCode.isBlank()) {
            if (matchesLegacyCode(authorizationCode)) {
                authorized = true;
                authMethod = "legacy_code";
                log.warn("[Safety] Emergency stop reset using legacy authorization code");
            } else {
                log.warn("[Safety] Invalid legacy authorization code for emergency stop reset");
            }
        }

        if (!authorized) {
            audit("emergency_stop_reset_failed", details(
                    "resetBy", resetBy,
                    "authMethod", authMethod,
                    "reason", "Authorization failed"));
            securityAudit.record(SecurityEventType.UNAUTHORIZED_ACCESS, SecurityEventSeverity.HIGH, resetBy, null,
                    details("attemptedOperation", OP_EMERGENCY_RESET, "failureReason", "authorization_failed"),
                    true);
            return false;
        }

        String method = authMethod;
        return onActor(() -> {
            if (!emergencyStopActive) {
                return true;
            }
            emergencyStopActive = false;
            emergencyStopReason = null;
            emergencyStopTriggeredBy = null;
            emergencyStopTriggeredAt = null;
            audit("emergency_stop_reset", details(
                    "resetBy", resetBy,
                    "authMethod", method,
                    "timestamp", clock.instant().toString()));
            securityAudit.record(SecurityEventType.EMERGENCY_STOP_RESET, SecurityEventSeverity.HIGH, resetBy, null,
                    details("authMethod", method, "pinSessionUsed", sessionId != null));
            log.warn("[Safety] Emergency stop reset by {} ({})", resetBy, method);
            return true;
        });
    }

    public boolean resetEmergencyStopWithPin(String sessionId, String resetBy) {
        return resetEmergencyStop("", resetBy, sessionId);
    }

    private boolean matchesLegacyCode(String code) {
        String expected = config.getLegacyResetCode();
        if (expected == null || expected.isBlank()) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                code.getBytes(StandardCharsets.UTF_8));
    }

    // ===== Interlock overrides =====

    /**
     * Installs a time-boxed override. The interlock stays engaged until the
     * next {@link #checkSafetyInterlocks()} observes the override.
     */
    public boolean overrideInterlockWithPin(String sessionId, String interlockName, String reason,
            int durationMinutes, String overriddenBy) {
        if (!interlocks.containsKey(interlockName)) {
            log.warn("[Safety] Interlock '{}' not found", interlockName);
            audit("interlock_override_rejected", details(
                    "interlockName", interlockName,
                    "overriddenBy", overriddenBy,
                    "rejectionReason", "unknown_interlock"));
            return false;
        }
        if (durationMinutes <= 0) {
            log.warn("[Safety] Rejected override of '{}' with non-positive duration", interlockName);
            audit("interlock_override_rejected", details(
                    "interlockName", interlockName,
                    "overriddenBy", overriddenBy,
                    "rejectionReason", "invalid_duration",
                    "durationMinutes", durationMinutes));
            return false;
        }

        AuthorizationResult authorization = pinManager.authorizeOperation(sessionId, OP_INTERLOCK_OVERRIDE,
                overriddenBy);
        if (!authorization.isAuthorized()) {
            denied("interlock_override_auth_failed", OP_INTERLOCK_OVERRIDE, overriddenBy, authorization,
                    details("interlockName", interlockName, "reason", reason));
            return false;
        }

        return onActor(() -> {
            Instant now = clock.instant();
            Instant expiresAt = now.plus(Duration.ofMinutes(durationMinutes));
            interlocks.get(interlockName).override(sessionId, reason, expiresAt, overriddenBy, now);
            activeOverrides.put(interlockName, expiresAt);

            audit("interlock_override_activated", details(
                    "interlockName", interlockName,
                    "overriddenBy", overriddenBy,
                    "reason", reason,
                    "durationMinutes", durationMinutes,
                    "expiresAt", expiresAt.toString()));
            securityAudit.record(SecurityEventType.SAFETY_INTERLOCK_OVERRIDDEN, SecurityEventSeverity.HIGH,
                    overriddenBy, null, details(
                            "interlockName", interlockName,
                            "reason", reason,
                            "durationMinutes", durationMinutes,
                            "expiresAt", expiresAt.toString()),
                    emergencyStopActive);
            log.warn("[Safety] PIN-authorized interlock override: {} by {} for {} minutes", interlockName,
                    overriddenBy, durationMinutes);
            return true;
        });
    }

    /**
     * @return {@code false} if the interlock is unknown or not overridden
     */
    public boolean clearInterlockOverride(String interlockName) {
        return onActor(() -> {
            SafetyInterlock interlock = interlocks.get(interlockName);
            if (interlock == null) {
                log.warn("[Safety] Interlock '{}' not found", interlockName);
                return false;
            }
            activeOverrides.remove(interlockName);
            if (!interlock.clearOverride()) {
                log.info("[Safety] Interlock '{}' is not currently overridden", interlockName);
                return false;
            }
            audit("interlock_override_cleared", details(
                    "interlockName", interlockName,
                    "clearedAt", clock.instant().toString()));
            return true;
        });
    }

    private List<String> clearAllOverrides() {
        List<String> cleared = new ArrayList<>();
        for (SafetyInterlock interlock : interlocks.values()) {
            if (interlock.clearOverride()) {
                cleared.add(interlock.getName());
            }
        }
        activeOverrides.clear();
        return cleared;
    }

    // ===== Operational modes =====

    public boolean enterMaintenanceModeWithPin(String sessionId, String reason, int durationMinutes,
            String enteredBy) {
        return enterMode(SystemOperationalMode.MAINTENANCE, OP_MAINTENANCE_MODE, sessionId, reason,
                durationMinutes, enteredBy);
    }

    public boolean exitMaintenanceModeWithPin(String sessionId, String exitedBy) {
        return exitMode(SystemOperationalMode.MAINTENANCE, OP_MAINTENANCE_EXIT, sessionId, exitedBy);
    }

    public boolean enterDiagnosticModeWithPin(String sessionId, String reason, int durationMinutes,
            String enteredBy) {
        return enterMode(SystemOperationalMode.DIAGNOSTIC, OP_DIAGNOSTIC_MODE, sessionId, reason,
                durationMinutes, enteredBy);
    }

    public boolean exitDiagnosticModeWithPin(String sessionId, String exitedBy) {
        return exitMode(SystemOperationalMode.DIAGNOSTIC, OP_DIAGNOSTIC_EXIT, sessionId, exitedBy);
    }

    private boolean enterMode(SystemOperationalMode mode, String operation, String sessionId, String reason,
            int durationMinutes, String enteredBy) {
        String modeName = modeName(mode);
        SystemOperationalMode current = operationalMode;
        if (current != SystemOperationalMode.NORMAL) {
            log.warn("[Safety] Cannot enter {} mode while in {} mode", modeName, modeName(current));
            audit(modeName + "_mode_conflict", details(
                    "enteredBy", enteredBy,
                    "currentMode", current.name()));
            return false;
        }
        if (durationMinutes <= 0) {
            log.warn("[Safety] Rejected {} mode with non-positive duration", modeName);
            audit(modeName + "_mode_rejected", details(
                    "enteredBy", enteredBy,
                    "durationMinutes", durationMinutes));
            return false;
        }

        AuthorizationResult authorization = pinManager.authorizeOperation(sessionId, operation, enteredBy);
        if (!authorization.isAuthorized()) {
            denied(modeName + "_mode_auth_failed", operation, enteredBy, authorization, details("reason", reason));
            return false;
        }

        return onActor(() -> {
            if (operationalMode != SystemOperationalMode.NORMAL) {
                log.warn("[Safety] {} mode entry lost to concurrent {} mode", modeName, modeName(operationalMode));
                audit(modeName + "_mode_conflict", details(
                        "enteredBy", enteredBy,
                        "currentMode", operationalMode.name()));
                return false;
            }
            Instant now = clock.instant();
            Instant expiresAt = now.plus(Duration.ofMinutes(durationMinutes));
            modeSession = ModeSession.builder()
                    .mode(mode)
                    .pinSessionId(sessionId)
                    .enteredBy(enteredBy)
                    .enteredAt(now)
                    .expiresAt(expiresAt)
                    .reason(reason)
                    .build();
            operationalMode = mode;

            audit(modeName + "_mode_entered", details(
                    "previousMode", SystemOperationalMode.NORMAL.name(),
                    "enteredBy", enteredBy,
                    "reason", reason,
                    "durationMinutes", durationMinutes,
                    "expiresAt", expiresAt.toString()));
            securityAudit.record(activatedEvent(mode), SecurityEventSeverity.HIGH, enteredBy, null, details(
                    "reason", reason,
                    "durationMinutes", durationMinutes,
                    "expiresAt", expiresAt.toString(),
                    "authorizationMethod", "pin_session"),
                    emergencyStopActive);
            log.warn("[Safety] {} MODE ACTIVATED by {} for {} minutes: {}", mode, enteredBy, durationMinutes,
                    reason);
            return true;
        });
    }

    private boolean exitMode(SystemOperationalMode mode, String operation, String sessionId, String exitedBy) {
        String modeName = modeName(mode);
        if (operationalMode != mode) {
            log.info("[Safety] System not in {} mode", modeName);
            return true;
        }

        AuthorizationResult authorization = pinManager.authorizeOperation(sessionId, operation, exitedBy);
        if (!authorization.isAuthorized()) {
            denied(modeName + "_mode_exit_auth_failed", operation, exitedBy, authorization, Map.of());
            return false;
        }

        return onActor(() -> {
            if (operationalMode != mode) {
                return true;
            }
            ModeSession previous = modeSession;
            long minutes = previous != null && previous.getEnteredAt() != null
                    ? Duration.between(previous.getEnteredAt(), clock.instant()).toMinutes()
                    : 0;
            revertToNormal();
            List<String> cleared = clearAllOverrides();

            audit(modeName + "_mode_exited", details(
                    "exitedBy", exitedBy,
                    "originallyEnteredBy", previous != null ? previous.getEnteredBy() : null,
                    "durationMinutes", minutes,
                    "clearedOverrides", cleared));
            securityAudit.record(deactivatedEvent(mode), SecurityEventSeverity.HIGH, exitedBy, null, details(
                    "durationMinutes", minutes,
                    "clearedOverridesCount", cleared.size(),
                    "authorizationMethod", "pin_session"),
                    emergencyStopActive);
            log.warn("[Safety] {} MODE EXITED by {} after {} minutes", mode, exitedBy, minutes);
            return true;
        });
    }

    /**
     * Reverts an expired operational mode to NORMAL and clears every override.
     * Needs no authorization.
     *
     * @return {@code true} if a mode was reverted
     */
    public boolean checkModeExpiration() {
        return onActor(this::doCheckModeExpiration);
    }

    private boolean doCheckModeExpiration() {
        if (operationalMode == SystemOperationalMode.NORMAL || modeSession == null
                || !modeSession.isExpired(clock.instant())) {
            return false;
        }
        SystemOperationalMode expired = operationalMode;
        log.warn("[Safety] Operational mode {} has expired, reverting to NORMAL mode", expired);
        revertToNormal();
        List<String> cleared = clearAllOverrides();
        audit("operational_mode_expired", details(
                "expiredMode", expired.name(),
                "clearedOverrides", cleared));
        securityAudit.record(deactivatedEvent(expired), SecurityEventSeverity.MEDIUM, null, null, details(
                "reason", "expired",
                "clearedOverridesCount", cleared.size()),
                emergencyStopActive);
        return true;
    }

    private void revertToNormal() {
        operationalMode = SystemOperationalMode.NORMAL;
        modeSession = null;
    }

    // ===== Safe state =====

    /**
     * Enters the terminal safe state: critical and position-critical features
     * are shut down and every interlock is engaged. Idempotent.
     */
    public void enterSafeState(String reason) {
        onActor(() -> {
            doEnterSafeState(reason);
            return null;
        });
    }

    private void doEnterSafeState(String reason) {
        if (!inSafeState) {
            inSafeState = true;
            safeStateReason = reason;
        }
        applySafeState(safeStateReason);
    }

    private void applySafeState(String reason) {
        if (safeStateActionsApplied) {
            return;
        }
        safeStateActionsApplied = true;
        Instant now = clock.instant();
        log.error("[Safety] === ENTERING SAFE STATE === Reason: {}", reason);

        VehicleState snapshot = vehicleState;
        audit("safe_state_entered", details(
                "reason", reason,
                "timestamp", now.toString(),
                "vehicleState", snapshot.toString()));
        securityAudit.record(SecurityEventType.SAFE_STATE_ENTERED, SecurityEventSeverity.CRITICAL, null, null,
                details("reason", reason), true);

        shutdownFeatures(List.of(SafetyClassification.CRITICAL, SafetyClassification.POSITION_CRITICAL),
                "Safe state");
        for (SafetyInterlock interlock : interlocks.values()) {
            interlock.engage("Safe state: " + reason, now);
        }
        log.error("[Safety] === SAFE STATE ESTABLISHED ===");
    }

    /**
     * Operator exit from safe state, authorized as {@code safe_state_clear}.
     * Refused while the emergency stop is active. Interlocks stay engaged until
     * the next health tick re-validates them; shut-down features are not
     * restarted.
     *
     * @return {@code true} if the service is out of safe state after the call
     */
    public boolean clearSafeStateWithPin(String sessionId, String clearedBy) {
        if (!inSafeState) {
            return true;
        }
        if (emergencyStopActive) {
            log.warn("[Safety] Safe state clear refused: emergency stop still active");
            audit("safe_state_clear_refused", details(
                    "clearedBy", clearedBy,
                    "reason", "Emergency stop active"));
            return false;
        }

        AuthorizationResult authorization = pinManager.authorizeOperation(sessionId, OP_SAFE_STATE_CLEAR,
                clearedBy);
        if (!authorization.isAuthorized()) {
            denied("safe_state_clear_auth_failed", OP_SAFE_STATE_CLEAR, clearedBy, authorization, Map.of());
            return false;
        }

        return onActor(() -> {
            if (emergencyStopActive) {
                return false;
            }
            if (!inSafeState) {
                return true;
            }
            String previousReason = safeStateReason;
            inSafeState = false;
            safeStateReason = null;
            safeStateActionsApplied = false;
            kickWatchdog();
            audit("safe_state_cleared", details(
                    "clearedBy", clearedBy,
                    "previousReason", previousReason));
            securityAudit.record(SecurityEventType.SAFE_STATE_CLEARED, SecurityEventSeverity.HIGH, clearedBy, null,
                    details("previousReason", previousReason));
            log.warn("[Safety] Safe state cleared by {}", clearedBy);
            return true;
        });
    }

    private void shutdownFeatures(List<SafetyClassification> classifications, String context) {
        List<FeatureInfo> features;
        try {
            features = featureManager.listFeatures();
        } catch (RuntimeException e) { // NOSONAR - shutdown continues with interlocks
            log.error("[Safety] {}: feature manager unavailable: {}", context, e.getMessage());
            audit("feature_shutdown_error", details("context", context, "error", String.valueOf(e.getMessage())));
            return;
        }
        for (FeatureInfo feature : features) {
            if (!classifications.contains(feature.getClassification()) || !feature.isEnabled()
                    || feature.getState() == FeatureState.SAFE_SHUTDOWN) {
                continue;
            }
            try {
                log.warn("[Safety] {}: setting {} to SAFE_SHUTDOWN", context, feature.getName());
                featureManager.forceSafeShutdown(feature.getName());
            } catch (RuntimeException e) { // NOSONAR - remaining features must still be shut down
                log.error("[Safety] {}: failed to shut down {}: {}", context, feature.getName(), e.getMessage());
                audit("feature_shutdown_error", details(
                        "context", context,
                        "feature", feature.getName(),
                        "error", String.valueOf(e.getMessage())));
            }
        }
    }

    // ===== Supervision =====

    public void kickWatchdog() {
        lastWatchdogKickNanos.set(nanoTime.getAsLong());
        lastWatchdogKickAt = clock.instant();
    }

    /**
     * Runs on the monitor thread, not the actor. Latches safe state immediately
     * on timeout and leaves the shutdown actions to the actor.
     *
     * @return {@code true} if this call detected a timeout
     */
    public boolean checkWatchdog() {
        if (inSafeState) {
            return false;
        }
        long elapsedNanos = nanoTime.getAsLong() - lastWatchdogKickNanos.get();
        if (elapsedNanos <= TimeUnit.MILLISECONDS.toNanos(config.getWatchdogTimeoutMs())) {
            return false;
        }
        String reason = "Watchdog timeout";
        log.error("[Watchdog] Safety watchdog timeout detected ({}ms > {}ms)",
                TimeUnit.NANOSECONDS.toMillis(elapsedNanos), config.getWatchdogTimeoutMs());
        inSafeState = true;
        safeStateReason = reason;
        actor.execute(() -> applySafeState(reason));
        return true;
    }

    /**
     * One health-loop iteration: kick the watchdog, check feature health,
     * re-evaluate interlocks, escalate multiple violations, expire modes. A
     * failing iteration enters safe state.
     *
     * @return {@code false} if skipped because the service is in safe state
     */
    public boolean performHealthCheck() {
        if (inSafeState) {
            return false;
        }
        return onActor(() -> {
            if (inSafeState) {
                return false;
            }
            try {
                doHealthCheck();
            } catch (RuntimeException e) { // NOSONAR - fail closed
                log.error("[Safety] Safety monitoring loop failed: {}", e.getMessage(), e);
                doEnterSafeState("Monitoring loop failure: " + e.getMessage());
            }
            return true;
        });
    }

    private void doHealthCheck() {
        kickWatchdog();

        FeatureHealthReport health = featureManager.checkSystemHealth();
        if (!health.getFailedCriticalFeatures().isEmpty()) {
            log.error("[Safety] Critical features failed: {}", health.getFailedCriticalFeatures());
            doTriggerEmergencyStop("Critical feature failure: " + String.join(", ",
                    health.getFailedCriticalFeatures()), "health_monitoring");
            return;
        }

        Map<String, InterlockCheckResult> results = doCheckSafetyInterlocks();
        List<String> violated = results.entrySet().stream()
                .filter(entry -> !entry.getValue().satisfied())
                .map(Map.Entry::getKey)
                .toList();
        if (violated.size() >= config.getMultipleViolationThreshold()) {
            log.error("[Safety] Multiple safety interlocks violated: {}", violated);
            doTriggerEmergencyStop("Multiple interlock violations: " + violated.size() + " ("
                    + String.join(", ", violated) + ")", "safety_monitoring");
            return;
        }

        doCheckModeExpiration();
    }

    // ===== Rate-limit gate =====

    /**
     * Rate-limit gate for safety operations issued through the outer API. An
     * unavailable audit service allows the operation.
     *
     * @param operationType
     *            {@code emergency}, {@code safety}, {@code control},
     *            {@code pin_auth} or {@code general}
     */
    public boolean validateSafetyOperation(String operationType, String userId, String sourceIp, boolean isAdmin,
            String entityId, Map<String, Object> details) {
        String type = operationType != null ? operationType.toLowerCase(Locale.ROOT) : "safety";
        RateLimitCategory category = switch (type) {
        case "emergency" -> RateLimitCategory.EMERGENCY;
        case "pin_auth" -> RateLimitCategory.PIN_AUTH;
        case "general" -> RateLimitCategory.GENERAL;
        default -> RateLimitCategory.SAFETY;
        };
        String identifier = sourceIp != null ? sourceIp : userId;

        RateLimitResult result = securityAudit.checkRateLimit(identifier, category, isAdmin, sourceIp);
        if (!result.isAllowed()) {
            log.warn("[Safety] Rate limit exceeded for {} operation by {}", type, userId);
            audit("safety_operation_rate_limited", details(
                    "operationType", type,
                    "userId", userId,
                    "entityId", entityId,
                    "category", category.name()));
            return false;
        }

        Map<String, Object> eventDetails = new LinkedHashMap<>();
        eventDetails.put("operationType", type);
        eventDetails.put("category", category.name());
        eventDetails.put("entityId", entityId);
        if (details != null) {
            eventDetails.putAll(details);
        }
        SecurityEventSeverity severity = category == RateLimitCategory.EMERGENCY
                ? SecurityEventSeverity.HIGH
                : SecurityEventSeverity.MEDIUM;
        securityAudit.record(SecurityEventType.SAFETY_OPERATION_AUTHORIZED, severity, userId, sourceIp,
                eventDetails, emergencyStopActive);
        return true;
    }

    // ===== Status =====

    public List<AuditLogEntry> getAuditLog(int maxEntries) {
        return auditLog.recent(maxEntries);
    }

    public SafetyStatus getSafetyStatus() {
        return onActor(() -> {
            Map<String, InterlockStatus> interlockStatus = new LinkedHashMap<>();
            List<String> engaged = new ArrayList<>();
            Map<String, InterlockOverride> overrides = new LinkedHashMap<>();
            for (SafetyInterlock interlock : interlocks.values()) {
                interlockStatus.put(interlock.getName(), interlock.toStatus());
                if (interlock.isEngaged()) {
                    engaged.add(interlock.getName());
                }
                interlock.getOverride()
                        .filter(o -> activeOverrides.containsKey(interlock.getName()))
                        .ifPresent(o -> overrides.put(interlock.getName(), o));
            }
            return SafetyStatus.builder()
                    .emergencyStopActive(emergencyStopActive)
                    .emergencyStopReason(emergencyStopReason)
                    .emergencyStopTriggeredBy(emergencyStopTriggeredBy)
                    .emergencyStopTriggeredAt(emergencyStopTriggeredAt)
                    .inSafeState(inSafeState)
                    .safeStateReason(safeStateReason)
                    .operationalMode(operationalMode)
                    .modeSession(modeSession)
                    .interlocks(interlockStatus)
                    .engagedInterlocks(engaged)
                    .activeOverrides(overrides)
                    .vehicleState(vehicleState)
                    .lastWatchdogKick(lastWatchdogKickAt)
                    .auditLogSize(auditLog.size())
                    .build();
        });
    }

    public boolean isEmergencyStopActive() {
        return emergencyStopActive;
    }

    public boolean isInSafeState() {
        return inSafeState;
    }

    public SystemOperationalMode getOperationalMode() {
        return operationalMode;
    }

    public VehicleState getVehicleState() {
        return vehicleState;
    }

    public Optional<InterlockStatus> getInterlock(String name) {
        return onActor(() -> Optional.ofNullable(interlocks.get(name)).map(SafetyInterlock::toStatus));
    }

    public Map<String, Instant> getActiveOverrides() {
        return onActor(() -> Map.copyOf(activeOverrides));
    }

    // ===== Internals =====

    private void denied(String auditEvent, String operation, String userId, AuthorizationResult authorization,
            Map<String, Object> extra) {
        log.warn("[Safety] {} authorization failed for user {}: {}", operation, userId, authorization.getReason());
        Map<String, Object> auditDetails = new LinkedHashMap<>(extra);
        auditDetails.put("userId", userId);
        auditDetails.put("authorizationStatus", authorization.getStatus().name());
        auditDetails.put("authorizationReason", authorization.getReason());
        audit(auditEvent, auditDetails);
        securityAudit.record(SecurityEventType.UNAUTHORIZED_ACCESS, SecurityEventSeverity.HIGH, userId, null,
                details(
                        "attemptedOperation", operation,
                        "failureReason", "pin_authorization_failed"),
                OP_EMERGENCY_STOP.equals(operation) || emergencyStopActive);
    }

    private void audit(String eventType, Map<String, Object> details) {
        auditLog.append(eventType, details, clock.instant());
    }

    private static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return map;
    }

    private static String modeName(SystemOperationalMode mode) {
        return mode.name().toLowerCase(Locale.ROOT);
    }

    private static SecurityEventType activatedEvent(SystemOperationalMode mode) {
        return mode == SystemOperationalMode.MAINTENANCE
                ? SecurityEventType.MAINTENANCE_MODE_ACTIVATED
                : SecurityEventType.DIAGNOSTIC_MODE_ACTIVATED;
    }

    private static SecurityEventType deactivatedEvent(SystemOperationalMode mode) {
        return mode == SystemOperationalMode.MAINTENANCE
                ? SecurityEventType.MAINTENANCE_MODE_DEACTIVATED
                : SecurityEventType.DIAGNOSTIC_MODE_DEACTIVATED;
    }

    private <T> T onActor(Callable<T> task) {
        if (Thread.currentThread() == actorThread) {
            try {
                return task.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        }
        Future<T> future = actor.submit(task);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(false);
            throw new IllegalStateException("Interrupted while waiting for safety actor", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Safety actor task failed", cause);
        }
    }
}

package me.golemcore.rvsafety.domain.service;

import me.golemcore.rvsafety.adapter.outbound.feature.InMemoryFeatureRegistry;
import me.golemcore.rvsafety.domain.model.AuditLogEntry;
import me.golemcore.rvsafety.domain.model.AuthorizationResult;
import me.golemcore.rvsafety.domain.model.FeatureState;
import me.golemcore.rvsafety.domain.model.InterlockCheckResult;
import me.golemcore.rvsafety.domain.model.PinType;
import me.golemcore.rvsafety.domain.model.RateLimitCategory;
import me.golemcore.rvsafety.domain.model.RateLimitResult;
import me.golemcore.rvsafety.domain.model.SafetyClassification;
import me.golemcore.rvsafety.domain.model.SafetyStatus;
import me.golemcore.rvsafety.domain.model.SecurityEvent;
import me.golemcore.rvsafety.domain.model.SecurityEventSeverity;
import me.golemcore.rvsafety.domain.model.SecurityEventType;
import me.golemcore.rvsafety.domain.model.SystemOperationalMode;
import me.golemcore.rvsafety.domain.model.TransmissionGear;
import me.golemcore.rvsafety.domain.model.VehicleState;
import me.golemcore.rvsafety.infrastructure.config.RvSafetyProperties;
import me.golemcore.rvsafety.port.outbound.FeatureManagerPort;
import me.golemcore.rvsafety.port.outbound.SecurityAuditPort;
import me.golemcore.rvsafety.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import static org.junit.jupiter.api.Assertions.*;

class SafetyServiceTest {

    private static final String USER = "alice";
    private static final String GOOD_SESSION = "good-session";
    private static final String BAD_SESSION = "bad-session";
    private static final String LEGACY_CODE = "SAFETY_OVERRIDE_ADMIN";

    private MutableClock clock;
    private AtomicLong nanos;
    private PinManager pinManager;
    private SecurityAuditPort auditPort;
    private RvSafetyProperties properties;
    private InMemoryFeatureRegistry features;
    private SafetyService safetyService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        nanos = new AtomicLong(1_000_000_000L);

        pinManager = mock(PinManager.class);
        when(pinManager.authorizeOperation(any(), any(), any()))
                .thenAnswer(inv -> AuthorizationResult.denied(inv.getArgument(1),
                        AuthorizationResult.SESSION_INVALID));
        when(pinManager.authorizeOperation(eq(GOOD_SESSION), anyString(), eq(USER)))
                .thenAnswer(inv -> AuthorizationResult.authorized(inv.getArgument(1), PinType.OVERRIDE, 2));

        auditPort = mock(SecurityAuditPort.class);
        when(auditPort.checkRateLimit(any(), any(), anyBoolean(), any())).thenReturn(RateLimitResult.allowed(10));

        properties = new RvSafetyProperties();
        RvSafetyProperties.FeatureProperties chassis = new RvSafetyProperties.FeatureProperties();
        chassis.setClassification(SafetyClassification.CRITICAL);
        properties.getFeatures().put("chassis_monitor", chassis);
        properties.getFeatures().put("lighting", new RvSafetyProperties.FeatureProperties());
        features = new InMemoryFeatureRegistry(properties);

        safetyService = newService(features);
    }

    @AfterEach
    void tearDown() {
        safetyService.shutdown();
    }

    private SafetyService newService(FeatureManagerPort featureManager) {
        return new SafetyService(pinManager, featureManager, new SecurityAuditRecorder(auditPort, clock),
                properties, clock, nanos::get);
    }

    private List<SecurityEvent> securityEvents() {
        ArgumentCaptor<SecurityEvent> captor = ArgumentCaptor.forClass(SecurityEvent.class);
        verify(auditPort, atLeastOnce()).logSecurityEvent(captor.capture());
        return captor.getAllValues();
    }

    private boolean hasEvent(SecurityEventType type) {
        return securityEvents().stream().anyMatch(e -> e.getEventType() == type);
    }

    private boolean hasAuditEntry(String eventType) {
        return safetyService.getAuditLog(0).stream().anyMatch(e -> eventType.equals(e.getEventType()));
    }

    private FeatureState featureState(String name) {
        return features.getFeature(name).orElseThrow().getState();
    }

    // ===== Emergency stop =====

    @Test
    void shouldShutDownPositionCriticalFeaturesOnEmergencyStop() {
        assertTrue(safetyService.triggerEmergencyStop("Operator request", USER));

        SafetyStatus status = safetyService.getSafetyStatus();
        assertTrue(status.isEmergencyStopActive());
        assertEquals("Operator request", status.getEmergencyStopReason());
        assertEquals(USER, status.getEmergencyStopTriggeredBy());
        assertEquals(clock.instant(), status.getEmergencyStopTriggeredAt());
        assertTrue(status.isInSafeState());
        assertEquals(3, status.getEngagedInterlocks().size());
        assertEquals("Emergency stop: Operator request",
                status.getInterlocks().get(SafetyService.SLIDE_ROOM_SAFETY).getEngagementReason());
        assertEquals(FeatureState.SAFE_SHUTDOWN, featureState("firefly"));
        assertEquals(FeatureState.SAFE_SHUTDOWN, featureState("spartan_k2"));
        assertEquals(FeatureState.SAFE_SHUTDOWN, featureState("chassis_monitor"));
        assertEquals(FeatureState.HEALTHY, featureState("lighting"));
        assertTrue(hasAuditEntry("emergency_stop_triggered"));
        assertTrue(hasAuditEntry("safe_state_entered"));
        assertTrue(securityEvents().stream()
                .anyMatch(e -> e.getEventType() == SecurityEventType.EMERGENCY_STOP_TRIGGERED
                        && e.getSeverity() == SecurityEventSeverity.CRITICAL && e.isEmergencyContext()));
    }

    @Test
    void shouldIgnoreSecondEmergencyStop() {
        assertTrue(safetyService.triggerEmergencyStop("first", USER));
        assertFalse(safetyService.triggerEmergencyStop("second", "bob"));

        SafetyStatus status = safetyService.getSafetyStatus();
        assertEquals("first", status.getEmergencyStopReason());
        assertEquals(1, safetyService.getAuditLog(0).stream()
                .filter(e -> "emergency_stop_triggered".equals(e.getEventType()))
                .count());
    }

    @Test
    void shouldNotStopOnUnauthorizedPinSession() {
        assertFalse(safetyService.emergencyStopWithPin(BAD_SESSION, "test", USER));

        assertFalse(safetyService.isEmergencyStopActive());
        assertFalse(safetyService.isInSafeState());
        assertTrue(hasAuditEntry("emergency_stop_auth_failed"));
        assertTrue(securityEvents().stream()
                .anyMatch(e -> e.getEventType() == SecurityEventType.UNAUTHORIZED_ACCESS && e.isEmergencyContext()));
        assertEquals(FeatureState.HEALTHY, featureState("firefly"));
    }

    @Test
    void shouldStopOnAuthorizedPinSession() {
        assertTrue(safetyService.emergencyStopWithPin(GOOD_SESSION, "Slide obstruction", USER));

        assertTrue(safetyService.isEmergencyStopActive());
        verify(pinManager).authorizeOperation(GOOD_SESSION, SafetyService.OP_EMERGENCY_STOP, USER);
    }

    @Test
    void shouldKeepSafeStateAfterEmergencyReset() {
        safetyService.triggerEmergencyStop("test", USER);

        assertTrue(safetyService.resetEmergencyStopWithPin(GOOD_SESSION, USER));

        SafetyStatus status = safetyService.getSafetyStatus();
        assertFalse(status.isEmergencyStopActive());
        assertNull(status.getEmergencyStopReason());
        assertTrue(status.isInSafeState());
        assertEquals(3, status.getEngagedInterlocks().size());
        assertEquals(FeatureState.SAFE_SHUTDOWN, featureState("firefly"));
        assertTrue(hasEvent(SecurityEventType.EMERGENCY_STOP_RESET));
        verify(pinManager).authorizeOperation(GOOD_SESSION, SafetyService.OP_EMERGENCY_RESET, USER);
    }

    @Test
    void shouldResetWithLegacyCodeWhenPinSessionFails() {
        safetyService.triggerEmergencyStop("test", USER);

        assertFalse(safetyService.resetEmergencyStop("WRONG", USER, BAD_SESSION));
        assertTrue(safetyService.isEmergencyStopActive());
        assertTrue(hasAuditEntry("emergency_stop_reset_failed"));

        assertTrue(safetyService.resetEmergencyStop(LEGACY_CODE, USER, BAD_SESSION));
        assertFalse(safetyService.isEmergencyStopActive());
        AuditLogEntry reset = safetyService.getAuditLog(1).get(0);
        assertEquals("emergency_stop_reset", reset.getEventType());
        assertEquals("legacy_code", reset.getDetails().get("authMethod"));
    }

    @Test
    void shouldRejectLegacyCodeWhenDisabled() {
        properties.getSafety().setLegacyResetCode("");
        SafetyService service = newService(features);
        try {
            service.triggerEmergencyStop("test", USER);

            assertFalse(service.resetEmergencyStop("", USER, null));
            assertFalse(service.resetEmergencyStop(LEGACY_CODE, USER, null));
            assertTrue(service.isEmergencyStopActive());
        } finally {
            service.shutdown();
        }
    }

    @Test
    void shouldTreatResetWithoutEmergencyAsNoOp() {
        assertTrue(safetyService.resetEmergencyStop("", USER, BAD_SESSION));

        verify(pinManager, never()).authorizeOperation(eq(BAD_SESSION), any(), any());
    }

    // ===== Safe state =====

    @Test
    void shouldRefuseSafeStateClearDuringEmergencyStop() {
        safetyService.triggerEmergencyStop("test", USER);

        assertFalse(safetyService.clearSafeStateWithPin(GOOD_SESSION, USER));

        assertTrue(safetyService.isInSafeState());
        assertTrue(hasAuditEntry("safe_state_clear_refused"));
        verify(pinManager, never()).authorizeOperation(GOOD_SESSION, SafetyService.OP_SAFE_STATE_CLEAR, USER);
    }

    @Test
    void shouldDisengageInterlocksOnlyOnTickAfterSafeStateClear() {
        safetyService.triggerEmergencyStop("test", USER);
        safetyService.resetEmergencyStopWithPin(GOOD_SESSION, USER);

        assertFalse(safetyService.clearSafeStateWithPin(BAD_SESSION, USER));
        assertTrue(safetyService.clearSafeStateWithPin(GOOD_SESSION, USER));

        assertFalse(safetyService.isInSafeState());
        assertEquals(3, safetyService.getSafetyStatus().getEngagedInterlocks().size());
        assertTrue(hasEvent(SecurityEventType.SAFE_STATE_CLEARED));

        assertTrue(safetyService.performHealthCheck());

        assertTrue(safetyService.getSafetyStatus().getEngagedInterlocks().isEmpty());
        assertEquals(FeatureState.SAFE_SHUTDOWN, featureState("firefly"));
    }

    @Test
    void shouldNotDisengageInterlocksWhileInSafeState() {
        safetyService.enterSafeState("Operator test");

        Map<String, InterlockCheckResult> results = safetyService.checkSafetyInterlocks();

        assertTrue(results.values().stream().allMatch(InterlockCheckResult::satisfied));
        assertEquals(3, safetyService.getSafetyStatus().getEngagedInterlocks().size());
    }

    // ===== Interlocks =====

    @Test
    void shouldEngageAndDisengageInterlockAcrossTicks() {
        safetyService.updateSystemState(state -> state.toBuilder().levelingJacksDeployed(false).build());

        safetyService.performHealthCheck();

        SafetyStatus status = safetyService.getSafetyStatus();
        assertEquals(List.of(SafetyService.SLIDE_ROOM_SAFETY), status.getEngagedInterlocks());
        assertEquals("Interlock condition not met: leveling_jacks_deployed",
                status.getInterlocks().get(SafetyService.SLIDE_ROOM_SAFETY).getEngagementReason());
        assertTrue(hasEvent(SecurityEventType.SAFETY_INTERLOCK_VIOLATED));
        assertFalse(status.isEmergencyStopActive());

        safetyService.updateSystemState(state -> state.toBuilder().levelingJacksDeployed(true).build());
        safetyService.performHealthCheck();

        assertTrue(safetyService.getSafetyStatus().getEngagedInterlocks().isEmpty());
        assertTrue(hasAuditEntry("interlock_disengaged"));
    }

    @Test
    void shouldTriggerEmergencyStopOnMultipleViolations() {
        safetyService.updateSystemState(state -> state.toBuilder()
                .vehicleSpeedMph(25.0)
                .transmissionGear(TransmissionGear.DRIVE)
                .build());

        safetyService.performHealthCheck();

        SafetyStatus status = safetyService.getSafetyStatus();
        assertTrue(status.isEmergencyStopActive());
        assertEquals("Multiple interlock violations: 3 (slide_room_safety, awning_safety, leveling_jack_safety)",
                status.getEmergencyStopReason());
        assertEquals("safety_monitoring", status.getEmergencyStopTriggeredBy());
        assertTrue(status.isInSafeState());
    }

    @Test
    void shouldBumpVehicleStateVersionOnUpdate() {
        long before = safetyService.getVehicleState().getVersion();

        VehicleState updated = safetyService.updateSystemState(state -> state.toBuilder().engineRunning(true).build());

        assertEquals(before + 1, updated.getVersion());
        assertTrue(safetyService.getVehicleState().isEngineRunning());
    }

    // ===== Overrides =====

    @Test
    void shouldHonourOverrideUntilItExpires() {
        safetyService.updateSystemState(state -> state.toBuilder().levelingJacksDeployed(false).build());
        safetyService.checkSafetyInterlocks();
        assertTrue(safetyService.getInterlock(SafetyService.SLIDE_ROOM_SAFETY).orElseThrow().isEngaged());

        assertTrue(safetyService.overrideInterlockWithPin(GOOD_SESSION, SafetyService.SLIDE_ROOM_SAFETY,
                "Jack sensor fault", 10, USER));
        assertTrue(safetyService.getInterlock(SafetyService.SLIDE_ROOM_SAFETY).orElseThrow().isEngaged());
        assertTrue(hasEvent(SecurityEventType.SAFETY_INTERLOCK_OVERRIDDEN));

        Map<String, InterlockCheckResult> results = safetyService.checkSafetyInterlocks();
        assertTrue(results.get(SafetyService.SLIDE_ROOM_SAFETY).satisfied());
        assertFalse(safetyService.getInterlock(SafetyService.SLIDE_ROOM_SAFETY).orElseThrow().isEngaged());
        assertEquals(1, safetyService.getSafetyStatus().getActiveOverrides().size());

        clock.advance(Duration.ofMinutes(10));
        safetyService.checkSafetyInterlocks();

        assertTrue(safetyService.getInterlock(SafetyService.SLIDE_ROOM_SAFETY).orElseThrow().isEngaged());
        assertTrue(safetyService.getActiveOverrides().isEmpty());
        assertTrue(hasAuditEntry("interlock_override_expired"));
    }

    @Test
    void shouldRejectInvalidOverrideBeforeAuthorization() {
        assertFalse(safetyService.overrideInterlockWithPin(GOOD_SESSION, "no_such_interlock", "x", 10, USER));
        assertFalse(safetyService.overrideInterlockWithPin(GOOD_SESSION, SafetyService.AWNING_SAFETY, "x", 0, USER));

        verify(pinManager, never()).authorizeOperation(any(), eq(SafetyService.OP_INTERLOCK_OVERRIDE), any());
        List<AuditLogEntry> rejected = safetyService.getAuditLog(0).stream()
                .filter(e -> "interlock_override_rejected".equals(e.getEventType()))
                .toList();
        assertEquals(2, rejected.size());
        assertEquals("unknown_interlock", rejected.get(0).getDetails().get("rejectionReason"));
        assertEquals("invalid_duration", rejected.get(1).getDetails().get("rejectionReason"));
    }

    @Test
    void shouldNotOverrideWithoutAuthorization() {
        assertFalse(safetyService.overrideInterlockWithPin(BAD_SESSION, SafetyService.AWNING_SAFETY, "x", 10, USER));

        assertTrue(safetyService.getActiveOverrides().isEmpty());
        assertTrue(hasAuditEntry("interlock_override_auth_failed"));
    }

    @Test
    void shouldClearOverrideExplicitly() {
        safetyService.overrideInterlockWithPin(GOOD_SESSION, SafetyService.AWNING_SAFETY, "x", 10, USER);

        assertTrue(safetyService.clearInterlockOverride(SafetyService.AWNING_SAFETY));
        assertFalse(safetyService.clearInterlockOverride(SafetyService.AWNING_SAFETY));
        assertFalse(safetyService.clearInterlockOverride("no_such_interlock"));
        assertTrue(safetyService.getActiveOverrides().isEmpty());
    }

    // ===== Operational modes =====

    @Test
    void shouldKeepOperationalModesMutuallyExclusive() {
        assertTrue(safetyService.enterMaintenanceModeWithPin(GOOD_SESSION, "Generator service", 30, USER));
        assertEquals(SystemOperationalMode.MAINTENANCE, safetyService.getOperationalMode());
        assertTrue(hasEvent(SecurityEventType.MAINTENANCE_MODE_ACTIVATED));

        assertFalse(safetyService.enterDiagnosticModeWithPin(GOOD_SESSION, "CAN trace", 30, USER));
        assertFalse(safetyService.enterMaintenanceModeWithPin(GOOD_SESSION, "again", 30, USER));
        verify(pinManager, never()).authorizeOperation(any(), eq(SafetyService.OP_DIAGNOSTIC_MODE), any());
        assertTrue(hasAuditEntry("diagnostic_mode_conflict"));
        assertTrue(hasAuditEntry("maintenance_mode_conflict"));

        assertTrue(safetyService.exitDiagnosticModeWithPin(BAD_SESSION, USER));
        assertEquals(SystemOperationalMode.MAINTENANCE, safetyService.getOperationalMode());

        assertTrue(safetyService.exitMaintenanceModeWithPin(GOOD_SESSION, USER));
        assertTrue(safetyService.enterDiagnosticModeWithPin(GOOD_SESSION, "CAN trace", 30, USER));
        assertEquals(SystemOperationalMode.DIAGNOSTIC, safetyService.getOperationalMode());
    }

    @Test
    void shouldClearOverridesOnModeExit() {
        safetyService.enterMaintenanceModeWithPin(GOOD_SESSION, "service", 30, USER);
        safetyService.overrideInterlockWithPin(GOOD_SESSION, SafetyService.AWNING_SAFETY, "x", 60, USER);

        assertFalse(safetyService.exitMaintenanceModeWithPin(BAD_SESSION, USER));
        assertEquals(1, safetyService.getActiveOverrides().size());

        assertTrue(safetyService.exitMaintenanceModeWithPin(GOOD_SESSION, USER));

        assertEquals(SystemOperationalMode.NORMAL, safetyService.getOperationalMode());
        assertTrue(safetyService.getActiveOverrides().isEmpty());
        assertNull(safetyService.getInterlock(SafetyService.AWNING_SAFETY).orElseThrow().getOverride());
        assertTrue(hasEvent(SecurityEventType.MAINTENANCE_MODE_DEACTIVATED));
    }

    @Test
    void shouldRevertExpiredModeAndClearOverrides() {
        safetyService.enterDiagnosticModeWithPin(GOOD_SESSION, "trace", 30, USER);
        safetyService.overrideInterlockWithPin(GOOD_SESSION, SafetyService.AWNING_SAFETY, "x", 60, USER);

        assertFalse(safetyService.checkModeExpiration());
        clock.advance(Duration.ofMinutes(30));
        assertTrue(safetyService.checkModeExpiration());

        SafetyStatus status = safetyService.getSafetyStatus();
        assertEquals(SystemOperationalMode.NORMAL, status.getOperationalMode());
        assertNull(status.getModeSession());
        assertTrue(status.getActiveOverrides().isEmpty());
        assertTrue(hasAuditEntry("operational_mode_expired"));
    }

    @Test
    void shouldRejectModeEntryWithoutAuthorization() {
        assertFalse(safetyService.enterMaintenanceModeWithPin(BAD_SESSION, "service", 30, USER));

        assertEquals(SystemOperationalMode.NORMAL, safetyService.getOperationalMode());
        assertTrue(hasAuditEntry("maintenance_mode_auth_failed"));
    }

    // ===== Supervision =====

    @Test
    void shouldEnterSafeStateOnWatchdogTimeout() {
        nanos.addAndGet(TimeUnit.SECONDS.toNanos(15));
        assertFalse(safetyService.checkWatchdog());

        nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(1));
        assertTrue(safetyService.checkWatchdog());

        SafetyStatus status = safetyService.getSafetyStatus();
        assertTrue(status.isInSafeState());
        assertEquals("Watchdog timeout", status.getSafeStateReason());
        assertFalse(status.isEmergencyStopActive());
        assertEquals(3, status.getEngagedInterlocks().size());
        assertEquals(FeatureState.SAFE_SHUTDOWN, featureState("firefly"));

        assertFalse(safetyService.checkWatchdog());
        assertFalse(safetyService.performHealthCheck());
    }

    @Test
    void shouldKickWatchdogOnHealthCheck() {
        nanos.addAndGet(TimeUnit.SECONDS.toNanos(10));
        safetyService.performHealthCheck();
        nanos.addAndGet(TimeUnit.SECONDS.toNanos(10));

        assertFalse(safetyService.checkWatchdog());
        assertFalse(safetyService.isInSafeState());
    }

    @Test
    void shouldTriggerEmergencyStopOnCriticalFeatureFailure() {
        features.updateState("chassis_monitor", FeatureState.FAILED);

        safetyService.performHealthCheck();

        SafetyStatus status = safetyService.getSafetyStatus();
        assertTrue(status.isEmergencyStopActive());
        assertEquals("Critical feature failure: chassis_monitor", status.getEmergencyStopReason());
        assertEquals("health_monitoring", status.getEmergencyStopTriggeredBy());
    }

    @Test
    void shouldIgnoreNonCriticalFeatureFailure() {
        features.updateState("lighting", FeatureState.FAILED);

        safetyService.performHealthCheck();

        assertFalse(safetyService.isEmergencyStopActive());
        assertFalse(safetyService.isInSafeState());
    }

    @Test
    void shouldFailClosedWhenHealthCheckThrows() {
        FeatureManagerPort brokenFeatures = mock(FeatureManagerPort.class);
        when(brokenFeatures.checkSystemHealth()).thenThrow(new IllegalStateException("bus offline"));
        SafetyService service = newService(brokenFeatures);
        try {
            assertTrue(service.performHealthCheck());

            SafetyStatus status = service.getSafetyStatus();
            assertTrue(status.isInSafeState());
            assertEquals("Monitoring loop failure: bus offline", status.getSafeStateReason());
            assertEquals(3, status.getEngagedInterlocks().size());
        } finally {
            service.shutdown();
        }
    }

    // ===== Rate-limit gate =====

    @Test
    void shouldAuditAuthorizedSafetyOperation() {
        assertTrue(safetyService.validateSafetyOperation("emergency", USER, "10.0.0.5", false, "firefly",
                Map.of("action", "retract")));

        verify(auditPort).checkRateLimit("10.0.0.5", RateLimitCategory.EMERGENCY, false, "10.0.0.5");
        assertTrue(securityEvents().stream()
                .anyMatch(e -> e.getEventType() == SecurityEventType.SAFETY_OPERATION_AUTHORIZED
                        && e.getSeverity() == SecurityEventSeverity.HIGH
                        && "retract".equals(e.getDetails().get("action"))));
    }

    @Test
    void shouldRejectRateLimitedSafetyOperation() {
        when(auditPort.checkRateLimit(any(), eq(RateLimitCategory.SAFETY), anyBoolean(), any()))
                .thenReturn(RateLimitResult.denied(Duration.ofMillis(1000)));

        assertFalse(safetyService.validateSafetyOperation("control", USER, null, false, "firefly", null));

        verify(auditPort).checkRateLimit(USER, RateLimitCategory.SAFETY, false, null);
        assertTrue(hasAuditEntry("safety_operation_rate_limited"));
    }
}

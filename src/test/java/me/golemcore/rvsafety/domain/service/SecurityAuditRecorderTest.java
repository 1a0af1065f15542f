package me.golemcore.rvsafety.domain.service;

import me.golemcore.rvsafety.domain.model.RateLimitCategory;
import me.golemcore.rvsafety.domain.model.RateLimitResult;
import me.golemcore.rvsafety.domain.model.SecurityEvent;
import me.golemcore.rvsafety.domain.model.SecurityEventSeverity;
import me.golemcore.rvsafety.domain.model.SecurityEventType;
import me.golemcore.rvsafety.port.outbound.SecurityAuditPort;
import me.golemcore.rvsafety.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import static org.junit.jupiter.api.Assertions.*;

class SecurityAuditRecorderTest {

    private MutableClock clock;
    private SecurityAuditPort auditPort;
    private SecurityAuditRecorder recorder;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        auditPort = mock(SecurityAuditPort.class);
        recorder = new SecurityAuditRecorder(auditPort, clock);
    }

    @Test
    void shouldBuildCompleteEvent() {
        recorder.record(SecurityEventType.PIN_LOCKOUT, SecurityEventSeverity.HIGH, "alice", "10.0.0.5",
                Map.of("pinType", "override"), true);

        ArgumentCaptor<SecurityEvent> captor = ArgumentCaptor.forClass(SecurityEvent.class);
        verify(auditPort).logSecurityEvent(captor.capture());
        SecurityEvent event = captor.getValue();
        assertNotNull(event.getEventId());
        assertEquals(clock.instant(), event.getTimestamp());
        assertEquals("alice", event.getUserId());
        assertEquals("10.0.0.5", event.getSourceIp());
        assertEquals("override", event.getDetails().get("pinType"));
        assertTrue(event.isEmergencyContext());
    }

    @Test
    void shouldSwallowAuditSinkFailure() {
        doThrow(new IllegalStateException("sink down")).when(auditPort).logSecurityEvent(any());

        assertDoesNotThrow(() -> recorder.record(SecurityEventType.PIN_UNLOCK, SecurityEventSeverity.MEDIUM,
                "alice", null, null));
    }

    @Test
    void shouldFailOpenOnRateLimitFailure() {
        when(auditPort.checkRateLimit(any(), any(), anyBoolean(), any()))
                .thenThrow(new IllegalStateException("limiter down"));

        RateLimitResult result = recorder.checkRateLimit("alice", RateLimitCategory.PIN_AUTH, false, null);

        assertTrue(result.isAllowed());
    }

    @Test
    void shouldPassThroughRateLimitDenial() {
        when(auditPort.checkRateLimit(any(), any(), anyBoolean(), any()))
                .thenReturn(RateLimitResult.denied(Duration.ofMillis(1000)));

        assertFalse(recorder.checkRateLimit("alice", RateLimitCategory.PIN_AUTH, false, null).isAllowed());
    }
}

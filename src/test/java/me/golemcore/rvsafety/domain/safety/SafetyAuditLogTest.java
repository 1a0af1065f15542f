package me.golemcore.rvsafety.domain.safety;

import me.golemcore.rvsafety.domain.model.AuditLogEntry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SafetyAuditLogTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void shouldDropOldestEntryWhenFull() {
        SafetyAuditLog auditLog = new SafetyAuditLog(3);

        for (int i = 0; i < 5; i++) {
            auditLog.append("event_" + i, Map.of("index", i), NOW.plusSeconds(i));
        }

        List<AuditLogEntry> entries = auditLog.recent(0);
        assertEquals(3, auditLog.size());
        assertEquals(List.of("event_2", "event_3", "event_4"),
                entries.stream().map(AuditLogEntry::getEventType).toList());
    }

    @Test
    void shouldReturnNewestEntriesOldestFirst() {
        SafetyAuditLog auditLog = new SafetyAuditLog(10);
        auditLog.append("a", null, NOW);
        auditLog.append("b", Map.of("k", "v"), NOW.plusSeconds(1));
        auditLog.append("c", Map.of(), NOW.plusSeconds(2));

        List<AuditLogEntry> recent = auditLog.recent(2);

        assertEquals(List.of("b", "c"), recent.stream().map(AuditLogEntry::getEventType).toList());
        assertEquals("v", recent.get(0).getDetails().get("k"));
        assertTrue(auditLog.recent(1).get(0).getDetails().isEmpty());
    }

    @Test
    void shouldClampCapacityToOne() {
        SafetyAuditLog auditLog = new SafetyAuditLog(0);
        auditLog.append("a", null, NOW);
        auditLog.append("b", null, NOW);

        assertEquals(1, auditLog.getCapacity());
        assertEquals("b", auditLog.recent(5).get(0).getEventType());
    }
}

package me.golemcore.rvsafety.adapter.outbound.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.rvsafety.domain.model.PinAttempt;
import me.golemcore.rvsafety.domain.model.PinAttemptReason;
import me.golemcore.rvsafety.domain.model.PinRecord;
import me.golemcore.rvsafety.domain.model.PinSession;
import me.golemcore.rvsafety.domain.model.PinStoreException;
import me.golemcore.rvsafety.domain.model.PinType;
import me.golemcore.rvsafety.infrastructure.config.AutoConfiguration;
import me.golemcore.rvsafety.testsupport.InMemoryStoragePort;
import me.golemcore.rvsafety.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class JsonPinStoreAdapterTest {

    private static final String USER = "alice";

    private MutableClock clock;
    private InMemoryStoragePort storage;
    private ObjectMapper objectMapper;
    private JsonPinStoreAdapter store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        storage = new InMemoryStoragePort();
        objectMapper = AutoConfiguration.objectMapper();
        store = new JsonPinStoreAdapter(storage, objectMapper, clock);
        store.load();
    }

    private PinRecord pin(String id, PinType pinType) {
        return PinRecord.builder()
                .id(id)
                .userId(USER)
                .pinType(pinType)
                .pinHash("hash-" + id)
                .salt("salt")
                .lockoutAfterFailures(3)
                .lockoutDurationMinutes(15)
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .build();
    }

    private PinSession session(String sessionId, String userId) {
        return PinSession.builder()
                .id("row-" + sessionId)
                .sessionId(sessionId)
                .pinType(PinType.OVERRIDE)
                .createdByUserId(userId)
                .maxDurationMinutes(15)
                .maxOperations(3)
                .createdAt(clock.instant())
                .expiresAt(clock.instant().plus(Duration.ofMinutes(15)))
                .build();
    }

    private PinAttempt attempt(PinType pinType, boolean success, Instant at) {
        return PinAttempt.builder()
                .id("attempt-" + at.toEpochMilli())
                .userId(USER)
                .pinType(pinType)
                .success(success)
                .failureReason(success ? null : PinAttemptReason.INVALID_PIN)
                .attemptedAt(at)
                .build();
    }

    @Test
    void shouldDeactivateOtherActiveRecordForSamePair() {
        store.savePin(pin("p1", PinType.OVERRIDE)).join();
        store.savePin(pin("p2", PinType.OVERRIDE)).join();
        store.savePin(pin("p3", PinType.EMERGENCY)).join();

        assertEquals("p2", store.findActivePin(USER, PinType.OVERRIDE).join().orElseThrow().getId());
        assertEquals(2, store.findAllActivePins().join().size());
        assertEquals(3, store.findPinsByUser(USER).join().size());
        assertTrue(storage.read("pins", "p1.json").contains("\"active\" : false"));
    }

    @Test
    void shouldReturnDefensiveCopies() {
        store.savePin(pin("p1", PinType.OVERRIDE)).join();

        PinRecord copy = store.findActivePin(USER, PinType.OVERRIDE).join().orElseThrow();
        copy.setUseCount(42);

        assertEquals(0, store.findActivePin(USER, PinType.OVERRIDE).join().orElseThrow().getUseCount());
    }

    @Test
    void shouldNotUpdateCacheWhenWriteFails() {
        storage.setFailWrites(true);

        CompletionException error = assertThrows(CompletionException.class,
                () -> store.savePin(pin("p1", PinType.OVERRIDE)).join());

        assertInstanceOf(PinStoreException.class, error.getCause());
        assertTrue(store.findActivePin(USER, PinType.OVERRIDE).join().isEmpty());
    }

    @Test
    void shouldFilterAttemptsByUserTypeAndTime() {
        Instant start = clock.instant();
        store.recordAttempt(attempt(PinType.OVERRIDE, false, start)).join();
        store.recordAttempt(attempt(PinType.OVERRIDE, true, start.plusSeconds(60))).join();
        store.recordAttempt(attempt(PinType.EMERGENCY, false, start.plusSeconds(120))).join();

        List<PinAttempt> override = store.findAttempts(USER, PinType.OVERRIDE, start.plusSeconds(30)).join();
        List<PinAttempt> all = store.findAttemptsSince(USER, start).join();
        List<PinAttempt> everyone = store.findAttemptsSince(null, start).join();

        assertEquals(1, override.size());
        assertTrue(override.get(0).isSuccess());
        assertEquals(3, all.size());
        assertEquals(3, everyone.size());
        assertTrue(store.findAttemptsSince("bob", start).join().isEmpty());
    }

    @Test
    void shouldTrackActiveSessionsPerUser() {
        store.saveSession(session("s1", USER)).join();
        store.saveSession(session("s2", "bob")).join();
        PinSession terminated = session("s3", USER);
        terminated.terminate("Revoked", clock.instant());
        store.saveSession(terminated).join();

        assertEquals(List.of("s1"), store.findActiveSessions(USER).join().stream()
                .map(PinSession::getSessionId).toList());
        assertEquals(2, store.findAllActiveSessions().join().size());
        assertFalse(store.findSession("s3").join().orElseThrow().isActive());
        assertTrue(store.findSession("missing").join().isEmpty());
    }

    @Test
    void shouldReloadPersistedStateOnStartup() {
        store.savePin(pin("p1", PinType.OVERRIDE)).join();
        store.saveSession(session("s1", USER)).join();
        store.recordAttempt(attempt(PinType.OVERRIDE, false, clock.instant())).join();
        store.recordAttempt(attempt(PinType.OVERRIDE, false, clock.instant().minus(Duration.ofDays(8)))).join();

        JsonPinStoreAdapter reloaded = new JsonPinStoreAdapter(storage, objectMapper, clock);
        reloaded.load();

        PinRecord pinRecord = reloaded.findActivePin(USER, PinType.OVERRIDE).join().orElseThrow();
        assertEquals("hash-p1", pinRecord.getPinHash());
        assertEquals(clock.instant(), pinRecord.getCreatedAt());
        assertTrue(reloaded.findSession("s1").join().isPresent());
        assertEquals(1, reloaded.findAttemptsSince(USER, Instant.EPOCH).join().size());
    }

    @Test
    void shouldSkipUnreadableDocumentsOnLoad() {
        storage.write("pins", "broken.json", "{not json");
        storage.write("pin-attempts", "attempts.jsonl", "garbage\n");

        JsonPinStoreAdapter reloaded = new JsonPinStoreAdapter(storage, objectMapper, clock);
        reloaded.load();

        assertTrue(reloaded.findAllActivePins().join().isEmpty());
        assertTrue(reloaded.findAttemptsSince(null, Instant.EPOCH).join().isEmpty());
    }

    @Test
    void shouldPurgeOnlySessionsTerminatedBeforeCutoff() {
        PinSession old = session("s1", USER);
        old.terminate("Expired", clock.instant());
        store.saveSession(old).join();
        clock.advance(Duration.ofHours(2));
        PinSession recent = session("s2", USER);
        recent.terminate("Revoked", clock.instant());
        store.saveSession(recent).join();
        store.saveSession(session("s3", USER)).join();

        int purged = store.purgeTerminatedSessions(clock.instant().minus(Duration.ofHours(1))).join();

        assertEquals(1, purged);
        assertTrue(store.findSession("s1").join().isEmpty());
        assertNull(storage.read("pin-sessions", "row-s1.json"));
        assertTrue(store.findSession("s2").join().isPresent());
        assertEquals(2, storage.count("pin-sessions"));
    }

    @Test
    void shouldRewriteAttemptLogWithoutExpiredLines() {
        Instant start = clock.instant();
        store.recordAttempt(attempt(PinType.OVERRIDE, false, start)).join();
        clock.advance(Duration.ofDays(8));
        store.recordAttempt(attempt(PinType.OVERRIDE, true, clock.instant())).join();
        assertEquals(2, storage.read("pin-attempts", "attempts.jsonl").split("\n").length);

        assertEquals(1, store.purgeExpiredAttempts().join());
        assertEquals(0, store.purgeExpiredAttempts().join());

        String log = storage.read("pin-attempts", "attempts.jsonl");
        assertEquals(1, log.split("\n").length);
        assertTrue(log.contains("\"success\":true"));
        assertEquals(1, store.findAttemptsSince(USER, Instant.EPOCH).join().size());
    }
}

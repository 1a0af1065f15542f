package me.golemcore.rvsafety.adapter.outbound.storage;

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
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.rvsafety.domain.model.PinAttempt;
import me.golemcore.rvsafety.domain.model.PinRecord;
import me.golemcore.rvsafety.domain.model.PinSession;
import me.golemcore.rvsafety.domain.model.PinStoreException;
import me.golemcore.rvsafety.domain.model.PinType;
import me.golemcore.rvsafety.port.outbound.PinStorePort;
import me.golemcore.rvsafety.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link PinStorePort} backed by JSON documents in the local workspace.
 *
 * <p>
 * Layout:
 * <ul>
 * <li>{@code pins/<id>.json} - one document per PIN record</li>
 * <li>{@code pin-sessions/<id>.json} - one document per session</li>
 * <li>{@code pin-attempts/attempts.jsonl} - append-only attempt log</li>
 * </ul>
 *
 * <p>
 * Everything is loaded into memory at startup and the in-memory view is only
 * updated after the corresponding write succeeded. Readers always receive
 * copies. Attempts older than {@link #ATTEMPT_RETENTION} are not loaded and are
 * dropped from memory as new attempts arrive; the purge operations remove them
 * and terminated sessions from disk.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonPinStoreAdapter implements PinStorePort {

    private static final String PINS_DIR = "pins";
    private static final String SESSIONS_DIR = "pin-sessions";
    private static final String ATTEMPTS_DIR = "pin-attempts";
    private static final String ATTEMPTS_FILE = "attempts.jsonl";
    private static final String JSON_SUFFIX = ".json";
    static final Duration ATTEMPT_RETENTION = Duration.ofDays(7);

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, PinRecord> pins = new ConcurrentHashMap<>();
    private final Object pinsLock = new Object();
    private final Map<String, PinSession> sessions = new LinkedHashMap<>();
    private final List<PinAttempt> attempts = new ArrayList<>();
    private final Object attemptLogLock = new Object();
    // Lines still in the attempt log file but no longer held in memory; guarded by attemptLogLock.
    private int discardedAttemptLines;

    @PostConstruct
    public void load() {
        loadPins();
        loadSessions();
        loadAttempts();
        log.info("[PinStore] Loaded {} PIN record(s), {} session(s), {} recent attempt(s)", pins.size(),
                sessionCount(), attemptCount());
    }

    // ===== PIN records =====

    @Override
    public CompletableFuture<Optional<PinRecord>> findActivePin(String userId, PinType pinType) {
        return CompletableFuture.completedFuture(pins.values().stream()
                .filter(PinRecord::isActive)
                .filter(p -> Objects.equals(p.getUserId(), userId) && p.getPinType() == pinType)
                .findFirst()
                .map(this::copy));
    }

    @Override
    public CompletableFuture<Void> savePin(PinRecord pinRecord) {
        PinRecord stored = copy(pinRecord);
        synchronized (pinsLock) {
            List<CompletableFuture<Void>> writes = new ArrayList<>();
            if (stored.isActive()) {
                for (PinRecord other : pins.values()) {
                    if (other.isActive() && !other.getId().equals(stored.getId())
                            && Objects.equals(other.getUserId(), stored.getUserId())
                            && other.getPinType() == stored.getPinType()) {
                        PinRecord deactivated = copy(other);
                        deactivated.setActive(false);
                        deactivated.setUpdatedAt(clock.instant());
                        writes.add(writeJson(PINS_DIR, deactivated.getId(), deactivated)
                                .thenRun(() -> pins.put(deactivated.getId(), deactivated)));
                    }
                }
            }
            writes.add(writeJson(PINS_DIR, stored.getId(), stored)
                    .thenRun(() -> pins.put(stored.getId(), stored)));
            // Joined under the lock so two upserts for the same pair cannot interleave.
            CompletableFuture<Void> all = CompletableFuture.allOf(writes.toArray(new CompletableFuture[0]));
            try {
                all.join();
            } catch (RuntimeException e) { // NOSONAR - surfaced through the returned future
                return CompletableFuture.failedFuture(storeFailure("save PIN record", e));
            }
            return CompletableFuture.completedFuture(null);
        }
    }

    @Override
    public CompletableFuture<List<PinRecord>> findPinsByUser(String userId) {
        return CompletableFuture.completedFuture(pins.values().stream()
                .filter(p -> Objects.equals(p.getUserId(), userId))
                .sorted(Comparator.comparing(PinRecord::getPinType))
                .map(this::copy)
                .toList());
    }

    @Override
    public CompletableFuture<List<PinRecord>> findAllActivePins() {
        return CompletableFuture.completedFuture(pins.values().stream()
                .filter(PinRecord::isActive)
                .map(this::copy)
                .toList());
    }

    // ===== Attempts =====

    @Override
    public CompletableFuture<Void> recordAttempt(PinAttempt attempt) {
        PinAttempt stored = attempt.toBuilder().build();
        String line;
        try {
            line = objectMapper.writeValueAsString(stored) + "\n";
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(storeFailure("serialize PIN attempt", e));
        }
        // Appends and log rewrites are serialized so a purge never drops a fresh line.
        synchronized (attemptLogLock) {
            try {
                storagePort.appendText(ATTEMPTS_DIR, ATTEMPTS_FILE, line).join();
            } catch (RuntimeException e) { // NOSONAR - surfaced through the returned future
                return CompletableFuture.failedFuture(storeFailure("record PIN attempt", e));
            }
            Instant cutoff = clock.instant().minus(ATTEMPT_RETENTION);
            synchronized (attempts) {
                attempts.add(stored);
                int before = attempts.size();
                attempts.removeIf(a -> a.getAttemptedAt() == null || a.getAttemptedAt().isBefore(cutoff));
                discardedAttemptLines += before - attempts.size();
            }
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Integer> purgeExpiredAttempts() {
        Instant cutoff = clock.instant().minus(ATTEMPT_RETENTION);
        synchronized (attemptLogLock) {
            List<PinAttempt> retained;
            int removed;
            synchronized (attempts) {
                retained = attempts.stream()
                        .filter(a -> a.getAttemptedAt() != null && !a.getAttemptedAt().isBefore(cutoff))
                        .toList();
                removed = attempts.size() - retained.size() + discardedAttemptLines;
            }
            if (removed == 0) {
                return CompletableFuture.completedFuture(0);
            }
            StringBuilder content = new StringBuilder();
            try {
                for (PinAttempt attempt : retained) {
                    content.append(objectMapper.writeValueAsString(attempt)).append('\n');
                }
            } catch (JsonProcessingException e) {
                return CompletableFuture.failedFuture(storeFailure("serialize PIN attempt", e));
            }
            try {
                storagePort.putText(ATTEMPTS_DIR, ATTEMPTS_FILE, content.toString()).join();
            } catch (RuntimeException e) { // NOSONAR - surfaced through the returned future
                return CompletableFuture.failedFuture(storeFailure("rewrite attempt log", e));
            }
            synchronized (attempts) {
                attempts.clear();
                attempts.addAll(retained);
            }
            discardedAttemptLines = 0;
            log.debug("[PinStore] Purged {} attempt line(s) older than {}", removed, cutoff);
            return CompletableFuture.completedFuture(removed);
        }
    }

    @Override
    public CompletableFuture<List<PinAttempt>> findAttempts(String userId, PinType pinType, Instant since) {
        return CompletableFuture.completedFuture(selectAttempts(userId, pinType, since));
    }

    @Override
    public CompletableFuture<List<PinAttempt>> findAttemptsSince(String userId, Instant since) {
        return CompletableFuture.completedFuture(selectAttempts(userId, null, since));
    }

    private List<PinAttempt> selectAttempts(String userId, PinType pinType, Instant since) {
        List<PinAttempt> snapshot;
        synchronized (attempts) {
            snapshot = new ArrayList<>(attempts);
        }
        return snapshot.stream()
                .filter(a -> userId == null || Objects.equals(a.getUserId(), userId))
                .filter(a -> pinType == null || a.getPinType() == pinType)
                .filter(a -> a.getAttemptedAt() != null && !a.getAttemptedAt().isBefore(since))
                .sorted(Comparator.comparing(PinAttempt::getAttemptedAt))
                .map(a -> a.toBuilder().build())
                .toList();
    }

    // ===== Sessions =====

    @Override
    public CompletableFuture<Void> saveSession(PinSession session) {
        PinSession stored = copy(session);
        return writeJson(SESSIONS_DIR, stored.getId(), stored)
                .thenRun(() -> {
                    synchronized (sessions) {
                        sessions.put(stored.getSessionId(), stored);
                    }
                });
    }

    @Override
    public CompletableFuture<Optional<PinSession>> findSession(String sessionId) {
        synchronized (sessions) {
            return CompletableFuture.completedFuture(Optional.ofNullable(sessions.get(sessionId)).map(this::copy));
        }
    }

    @Override
    public CompletableFuture<List<PinSession>> findActiveSessions(String userId) {
        return CompletableFuture.completedFuture(selectActiveSessions(userId));
    }

    @Override
    public CompletableFuture<List<PinSession>> findAllActiveSessions() {
        return CompletableFuture.completedFuture(selectActiveSessions(null));
    }

    @Override
    public CompletableFuture<Integer> purgeTerminatedSessions(Instant cutoff) {
        List<PinSession> expired;
        synchronized (sessions) {
            expired = sessions.values().stream()
                    .filter(s -> !s.isActive() && s.getTerminatedAt() != null && s.getTerminatedAt().isBefore(cutoff))
                    .map(this::copy)
                    .toList();
        }
        int removed = 0;
        for (PinSession session : expired) {
            try {
                storagePort.deleteObject(SESSIONS_DIR, session.getId() + JSON_SUFFIX).join();
            } catch (RuntimeException e) { // NOSONAR - surfaced through the returned future
                return CompletableFuture.failedFuture(storeFailure("delete session " + session.getId(), e));
            }
            synchronized (sessions) {
                sessions.remove(session.getSessionId());
            }
            removed++;
        }
        if (removed > 0) {
            log.debug("[PinStore] Purged {} terminated session(s)", removed);
        }
        return CompletableFuture.completedFuture(removed);
    }

    private List<PinSession> selectActiveSessions(String userId) {
        List<PinSession> snapshot;
        synchronized (sessions) {
            snapshot = new ArrayList<>(sessions.values());
        }
        return snapshot.stream()
                .filter(PinSession::isActive)
                .filter(s -> userId == null || Objects.equals(s.getCreatedByUserId(), userId))
                .map(this::copy)
                .toList();
    }

    // ===== Loading =====

    private void loadPins() {
        for (String file : listJsonFiles(PINS_DIR)) {
            PinRecord pinRecord = readJson(PINS_DIR, file, PinRecord.class);
            if (pinRecord != null && pinRecord.getId() != null) {
                pins.put(pinRecord.getId(), pinRecord);
            }
        }
    }

    private void loadSessions() {
        List<PinSession> loaded = new ArrayList<>();
        for (String file : listJsonFiles(SESSIONS_DIR)) {
            PinSession session = readJson(SESSIONS_DIR, file, PinSession.class);
            if (session != null && session.getSessionId() != null) {
                loaded.add(session);
            }
        }
        loaded.sort(Comparator.comparing(PinSession::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())));
        synchronized (sessions) {
            loaded.forEach(session -> sessions.put(session.getSessionId(), session));
        }
    }

    private void loadAttempts() {
        String content;
        try {
            content = storagePort.getText(ATTEMPTS_DIR, ATTEMPTS_FILE).join();
        } catch (RuntimeException e) { // NOSONAR - startup best-effort
            log.error("[PinStore] Failed to read attempt log: {}", e.getMessage());
            return;
        }
        if (content == null || content.isBlank()) {
            return;
        }
        Instant cutoff = clock.instant().minus(ATTEMPT_RETENTION);
        int skipped = 0;
        int expired = 0;
        synchronized (attempts) {
            for (String line : content.split("\n")) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    PinAttempt attempt = objectMapper.readValue(line, PinAttempt.class);
                    if (attempt.getAttemptedAt() != null && !attempt.getAttemptedAt().isBefore(cutoff)) {
                        attempts.add(attempt);
                    } else {
                        expired++;
                    }
                } catch (JsonProcessingException e) {
                    skipped++;
                }
            }
        }
        synchronized (attemptLogLock) {
            discardedAttemptLines = expired + skipped;
        }
        if (skipped > 0) {
            log.warn("[PinStore] Skipped {} unreadable attempt line(s)", skipped);
        }
    }

    private List<String> listJsonFiles(String directory) {
        try {
            return storagePort.listObjects(directory, "").join().stream()
                    .filter(name -> name.endsWith(JSON_SUFFIX))
                    .toList();
        } catch (RuntimeException e) { // NOSONAR - startup best-effort
            log.error("[PinStore] Failed to list {}: {}", directory, e.getMessage());
            return List.of();
        }
    }

    private <T> T readJson(String directory, String file, Class<T> type) {
        try {
            String json = storagePort.getText(directory, file).join();
            return json != null ? objectMapper.readValue(json, type) : null;
        } catch (JsonProcessingException | RuntimeException e) { // NOSONAR - skip unreadable documents
            log.warn("[PinStore] Skipping unreadable {}/{}: {}", directory, file, e.getMessage());
            return null;
        }
    }

    // ===== Helpers =====

    private CompletableFuture<Void> writeJson(String directory, String id, Object value) {
        String json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(storeFailure("serialize " + directory + " document", e));
        }
        return storagePort.putText(directory, id + JSON_SUFFIX, json)
                .handle((ignored, error) -> {
                    if (error != null) {
                        throw storeFailure("write " + directory + "/" + id, error);
                    }
                    return null;
                });
    }

    private static PinStoreException storeFailure(String action, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof PinStoreException pinStoreException) {
            return pinStoreException;
        }
        return new PinStoreException("Failed to " + action, cause);
    }

    private PinRecord copy(PinRecord pinRecord) {
        return pinRecord.toBuilder().build();
    }

    private PinSession copy(PinSession session) {
        return session.toBuilder().build();
    }

    private int sessionCount() {
        synchronized (sessions) {
            return sessions.size();
        }
    }

    private int attemptCount() {
        synchronized (attempts) {
            return attempts.size();
        }
    }
}

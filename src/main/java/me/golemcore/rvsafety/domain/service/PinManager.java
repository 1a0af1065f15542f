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
import me.golemcore.rvsafety.domain.model.AuthorizationResult;
import me.golemcore.rvsafety.domain.model.PinAttempt;
import me.golemcore.rvsafety.domain.model.PinAttemptReason;
import me.golemcore.rvsafety.domain.model.PinRecord;
import me.golemcore.rvsafety.domain.model.PinSession;
import me.golemcore.rvsafety.domain.model.PinSessionInfo;
import me.golemcore.rvsafety.domain.model.PinStoreException;
import me.golemcore.rvsafety.domain.model.PinSystemStatus;
import me.golemcore.rvsafety.domain.model.PinType;
import me.golemcore.rvsafety.domain.model.PinValidationException;
import me.golemcore.rvsafety.domain.model.PinValidationResult;
import me.golemcore.rvsafety.domain.model.RateLimitCategory;
import me.golemcore.rvsafety.domain.model.RateLimitResult;
import me.golemcore.rvsafety.domain.model.SecurityEventSeverity;
import me.golemcore.rvsafety.domain.model.SecurityEventType;
import me.golemcore.rvsafety.domain.model.UserPinStatus;
import me.golemcore.rvsafety.infrastructure.config.RvSafetyProperties;
import me.golemcore.rvsafety.port.outbound.PinStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * PIN credential and session lifecycle.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>Storing salted PIN hashes per (user, PIN type)</li>
 * <li>Validating PINs with a sliding-window lockout over the attempt log</li>
 * <li>Issuing usage-limited sessions with concurrent-session eviction</li>
 * <li>Authorizing individual operations against a session</li>
 * </ul>
 *
 * <p>
 * All state-changing work for one user runs under that user's lock, so lockout
 * accounting and session admission are never interleaved for the same user.
 * Any store failure turns into a denial; this class never reports success it
 * could not persist.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PinManager {

    static final String EVICTED_REASON = "Evicted: concurrent session limit";
    static final String EXPIRED_REASON = "Expired";
    static final String EXHAUSTED_REASON = "Operation limit reached";
    static final String REVOKED_REASON = "Revoked";

    private static final Duration STATUS_PERIOD = Duration.ofHours(24);
    private static final int DEFAULT_PIN_LENGTH = 4;
    private static final String UNAVAILABLE = "PIN service unavailable";

    private final PinStorePort pinStore;
    private final PinHasher pinHasher;
    private final SecurityAuditRecorder securityAudit;
    private final RvSafetyProperties properties;
    private final Clock clock;

    private static final int LOCK_STRIPES = 64;

    // Per-user serialization over a fixed set of monitors; users may share a stripe.
    private final Object[] userLocks = newStripes();

    // ===== Credentials =====

    /**
     * Sets or replaces the PIN of the given type for a user.
     *
     * @throws PinValidationException
     *             if the PIN does not meet the format policy
     * @throws PinStoreException
     *             if the record could not be persisted
     */
    public void setPin(String userId, PinType pinType, String pin, String description) {
        requireUser(userId);
        if (pinType == null) {
            throw new PinValidationException("PIN type is required");
        }
        validateFormat(pin);

        synchronized (lockFor(userId)) {
            Instant now = clock.instant();
            Optional<PinRecord> existing = await(pinStore.findActivePin(userId, pinType));
            RvSafetyProperties.PinProperties config = properties.getPin();
            String salt = pinHasher.generateSalt();

            PinRecord pinRecord = PinRecord.builder()
                    .id(existing.map(PinRecord::getId).orElseGet(() -> UUID.randomUUID().toString()))
                    .userId(userId)
                    .pinType(pinType)
                    .pinHash(pinHasher.hash(pin, salt))
                    .salt(salt)
                    .description(description != null ? description : pinType.value() + " PIN")
                    .active(true)
                    .useCount(0)
                    .lockoutAfterFailures(config.getMaxFailedAttempts())
                    .lockoutDurationMinutes(config.getLockoutDurationMinutes())
                    .createdAt(existing.map(PinRecord::getCreatedAt).orElse(now))
                    .updatedAt(now)
                    .build();
            await(pinStore.savePin(pinRecord));
            log.info("[PinManager] {} PIN {} for user {}", pinType.value(), existing.isPresent() ? "updated" : "set",
                    userId);
        }
    }

    /**
     * Generates one PIN of each type for a user that has none yet. The returned
     * plaintext PINs are meant for one-time display.
     *
     * @return generated PINs by type, or an empty map if the user already has
     *         PINs
     */
    public Map<PinType, String> initializeDefaultPins(String userId) {
        requireUser(userId);
        synchronized (lockFor(userId)) {
            if (!await(pinStore.findPinsByUser(userId)).isEmpty()) {
                log.info("[PinManager] PINs already exist for user {}", userId);
                return Map.of();
            }
            Map<PinType, String> generated = generateDistinctPins(List.of(PinType.values()));
            generated.forEach((type, pin) -> setPin(userId, type, pin, null));
            log.warn("[PinManager] Default PINs initialized for user {}", userId);
            return generated;
        }
    }

    /**
     * Replaces every configured PIN of the user with a fresh random PIN and
     * revokes all of the user's sessions.
     *
     * @return new PINs by type, empty if the user has no PINs configured
     */
    public Map<PinType, String> rotatePins(String userId) {
        requireUser(userId);
        synchronized (lockFor(userId)) {
            List<PinType> configured = await(pinStore.findPinsByUser(userId)).stream()
                    .filter(PinRecord::isActive)
                    .map(PinRecord::getPinType)
                    .distinct()
                    .toList();
            if (configured.isEmpty()) {
                return Map.of();
            }
            Map<PinType, String> rotated = generateDistinctPins(configured);
            rotated.forEach((type, pin) -> setPin(userId, type, pin, null));
            int revoked = revokeAllUserSessions(userId);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("pinTypes", configured.stream().map(PinType::value).toList());
            details.put("revokedSessions", revoked);
            securityAudit.record(SecurityEventType.PIN_ROTATION, SecurityEventSeverity.MEDIUM, userId, null,
                    details);
            log.warn("[PinManager] Rotated {} PIN(s) for user {}, revoked {} session(s)", rotated.size(), userId,
                    revoked);
            return rotated;
        }
    }

    /**
     * Clears an active lockout by appending an unlock marker to the attempt
     * log. Failures recorded before the marker no longer count.
     */
    public void unlockUser(String userId, PinType pinType) {
        requireUser(userId);
        if (pinType == null) {
            throw new PinValidationException("PIN type is required");
        }
        synchronized (lockFor(userId)) {
            await(pinStore.recordAttempt(PinAttempt.builder()
                    .id(UUID.randomUUID().toString())
                    .userId(userId)
                    .pinType(pinType)
                    .success(false)
                    .failureReason(PinAttemptReason.ADMIN_UNLOCK)
                    .attemptedAt(clock.instant())
                    .build()));
        }
        securityAudit.record(SecurityEventType.PIN_UNLOCK, SecurityEventSeverity.MEDIUM, userId, null,
                Map.of("pinType", pinType.value()));
        log.info("[PinManager] Lockout cleared for user {}, type {}", userId, pinType.value());
    }

    // ===== Validation =====

    /**
     * Validates a PIN and, on success, opens a session.
     *
     * <p>
     * Order of checks: lockout window, active record, rate limit, hash. Only
     * attempts that reach the hash comparison spend a rate-limit token, so a
     * locked-out user is always told about the lockout. Rate-limited attempts
     * are not recorded in the attempt log.
     */
    public PinValidationResult validatePin(String userId, String pin, PinType pinType, String ipAddress,
            String userAgent) {
        if (userId == null || userId.isBlank() || pinType == null) {
            return PinValidationResult.notFound();
        }
        if (pin == null || pin.isEmpty()) {
            return PinValidationResult.invalidPin();
        }

        try {
            synchronized (lockFor(userId)) {
                return validateLocked(userId, pin, pinType, ipAddress, userAgent);
            }
        } catch (PinStoreException e) {
            log.error("[PinManager] PIN validation failed for user {}: {}", userId, e.getMessage());
            return PinValidationResult.infrastructureError(UNAVAILABLE);
        }
    }

    private PinValidationResult validateLocked(String userId, String pin, PinType pinType, String ipAddress,
            String userAgent) {
        Instant now = clock.instant();
        Optional<PinRecord> pinRecord = await(pinStore.findActivePin(userId, pinType));
        int threshold = lockoutThreshold(pinRecord);
        Duration window = lockoutWindow(pinRecord);

        Optional<Instant> lockoutUntil = findLockout(userId, pinType, threshold, window, now);
        if (lockoutUntil.isPresent()) {
            recordAttempt(userId, pinType, false, PinAttemptReason.LOCKED_OUT, ipAddress, userAgent, null, now);
            securityAudit.record(SecurityEventType.PIN_VALIDATION_FAILURE, SecurityEventSeverity.MEDIUM, userId,
                    ipAddress, Map.of("pinType", pinType.value(), "reason", "locked_out"));
            log.warn("[PinManager] User {} is locked out for {} PIN until {}", userId, pinType.value(),
                    lockoutUntil.get());
            return PinValidationResult.lockedOut(lockoutUntil.get(), lockoutMessage(lockoutUntil.get(), now));
        }

        if (pinRecord.isEmpty() || pinRecord.get().isExhausted()) {
            recordAttempt(userId, pinType, false, PinAttemptReason.PIN_NOT_FOUND, ipAddress, userAgent, null, now);
            securityAudit.record(SecurityEventType.PIN_VALIDATION_FAILURE, SecurityEventSeverity.MEDIUM, userId,
                    ipAddress, Map.of("pinType", pinType.value(), "reason", "not_found"));
            log.warn("[PinManager] No active {} PIN for user {}", pinType.value(), userId);
            return PinValidationResult.notFound();
        }

        Optional<PinValidationResult> rateLimited = checkAttemptRate(userId, ipAddress);
        if (rateLimited.isPresent()) {
            return rateLimited.get();
        }

        PinRecord active = pinRecord.get();
        if (!pinHasher.matches(pin, active.getSalt(), active.getPinHash())) {
            recordAttempt(userId, pinType, false, PinAttemptReason.INVALID_PIN, ipAddress, userAgent, null, now);
            securityAudit.record(SecurityEventType.PIN_VALIDATION_FAILURE, SecurityEventSeverity.MEDIUM, userId,
                    ipAddress, Map.of("pinType", pinType.value(), "reason", "invalid_pin"));
            findLockout(userId, pinType, threshold, window, now).ifPresent(until -> {
                securityAudit.record(SecurityEventType.PIN_LOCKOUT, SecurityEventSeverity.HIGH, userId, ipAddress,
                        Map.of("pinType", pinType.value(), "lockoutUntil", until.toString()));
                log.warn("[PinManager] User {} locked out for {} PIN until {}", userId, pinType.value(), until);
            });
            log.warn("[PinManager] Invalid {} PIN for user {}", pinType.value(), userId);
            return PinValidationResult.invalidPin();
        }

        active.setUseCount(active.getUseCount() + 1);
        active.setLastUsedAt(now);
        active.setUpdatedAt(now);
        await(pinStore.savePin(active));

        PinSession session = newSession(userId, pinType, active, now);
        recordAttempt(userId, pinType, true, null, ipAddress, userAgent, session.getSessionId(), now);
        admitSession(userId, session, now);

        securityAudit.record(SecurityEventType.PIN_VALIDATION_SUCCESS, SecurityEventSeverity.LOW, userId, ipAddress,
                Map.of("pinType", pinType.value()));
        log.info("[PinManager] {} PIN validated for user {}", pinType.value(), userId);
        return PinValidationResult.success(session);
    }

    private Optional<PinValidationResult> checkAttemptRate(String userId, String ipAddress) {
        String identifier = ipAddress != null ? ipAddress : userId;
        RateLimitResult rateLimit = securityAudit.checkRateLimit(identifier, RateLimitCategory.PIN_AUTH, false,
                ipAddress);
        if (rateLimit.isAllowed()) {
            return Optional.empty();
        }
        long retrySeconds = rateLimit.getWaitTime() != null
                ? Math.max(1, (rateLimit.getWaitTime().toMillis() + 999) / 1000)
                : 60;
        log.warn("[PinManager] PIN attempt rate limited for user {}", userId);
        return Optional.of(PinValidationResult.rateLimited(
                "Too many PIN attempts, try again in " + retrySeconds + " seconds"));
    }

    private PinSession newSession(String userId, PinType pinType, PinRecord pinRecord, Instant now) {
        RvSafetyProperties.SessionPolicyProperties policy = properties.getPin().policyFor(pinType);
        return PinSession.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(pinHasher.generateSessionToken())
                .pinRecordId(pinRecord.getId())
                .pinType(pinType)
                .createdByUserId(userId)
                .maxDurationMinutes(policy.getSessionTimeoutMinutes())
                .maxOperations(policy.getMaxOperations() > 0 ? policy.getMaxOperations() : null)
                .operationCount(0)
                .active(true)
                .expiresAt(now.plus(Duration.ofMinutes(policy.getSessionTimeoutMinutes())))
                .createdAt(now)
                .lastUsedAt(now)
                .build();
    }

    /**
     * Persists a new session and evicts the oldest live ones above the
     * concurrent limit. Nothing is evicted unless the new session was stored;
     * if an eviction cannot be stored the new session is terminated again.
     */
    private void admitSession(String userId, PinSession session, Instant now) {
        List<PinSession> live = liveSessions(userId, now);
        await(pinStore.saveSession(session));

        int limit = Math.max(1, properties.getPin().getMaxConcurrentSessions());
        try {
            while (live.size() >= limit) {
                PinSession oldest = live.remove(0);
                oldest.terminate(EVICTED_REASON, now);
                await(pinStore.saveSession(oldest));
                log.info("[PinManager] Evicted oldest session for user {} due to limit", userId);
            }
        } catch (PinStoreException e) {
            session.terminate(UNAVAILABLE, now);
            try {
                await(pinStore.saveSession(session));
            } catch (PinStoreException rollbackError) {
                e.addSuppressed(rollbackError);
            }
            throw e;
        }
    }

    // ===== Sessions =====

    /**
     * Spends one operation of the session on {@code operation}.
     *
     * <p>
     * Session problems (missing, inactive, expired, wrong user, exhausted) all
     * deny with the same generic reason; the specific cause is only logged.
     */
    public AuthorizationResult authorizeOperation(String sessionId, String operation, String userId) {
        if (sessionId == null || sessionId.isBlank()) {
            return AuthorizationResult.denied(operation, AuthorizationResult.SESSION_INVALID);
        }
        try {
            Optional<PinSession> found = await(pinStore.findSession(sessionId));
            if (found.isEmpty()) {
                log.debug("[PinManager] Session not found for operation {}", operation);
                return AuthorizationResult.denied(operation, AuthorizationResult.SESSION_INVALID);
            }
            String owner = found.get().getCreatedByUserId();
            synchronized (lockFor(owner)) {
                return authorizeLocked(sessionId, operation, userId);
            }
        } catch (PinStoreException e) {
            log.error("[PinManager] Authorization of {} failed: {}", operation, e.getMessage());
            return AuthorizationResult.infrastructureError(operation, UNAVAILABLE);
        }
    }

    private AuthorizationResult authorizeLocked(String sessionId, String operation, String userId) {
        // Reloaded under the owner's lock so a concurrent eviction is observed.
        PinSession session = await(pinStore.findSession(sessionId)).orElse(null);
        Instant now = clock.instant();
        if (session == null || !session.isActive()) {
            log.debug("[PinManager] Inactive session used for operation {}", operation);
            return AuthorizationResult.denied(operation, AuthorizationResult.SESSION_INVALID);
        }
        if (session.isExpired(now)) {
            session.terminate(EXPIRED_REASON, now);
            await(pinStore.saveSession(session));
            log.info("[PinManager] Session expired before operation {}", operation);
            return AuthorizationResult.denied(operation, AuthorizationResult.SESSION_INVALID);
        }
        if (userId != null && !userId.equals(session.getCreatedByUserId())) {
            log.warn("[PinManager] Session user mismatch for operation {}: requested by {}", operation, userId);
            securityAudit.record(SecurityEventType.UNAUTHORIZED_ACCESS, SecurityEventSeverity.HIGH, userId, null,
                    Map.of("operation", String.valueOf(operation), "reason", "session_user_mismatch"));
            return AuthorizationResult.denied(operation, AuthorizationResult.SESSION_INVALID);
        }
        if (!session.hasOperationsRemaining()) {
            session.terminate(EXHAUSTED_REASON, now);
            await(pinStore.saveSession(session));
            return AuthorizationResult.denied(operation, AuthorizationResult.SESSION_INVALID);
        }

        session.setOperationCount(session.getOperationCount() + 1);
        session.setLastUsedAt(now);
        if (!session.hasOperationsRemaining()) {
            session.terminate(EXHAUSTED_REASON, now);
        }
        await(pinStore.saveSession(session));

        log.info("[PinManager] Authorized {} for user {} ({} session, {} op(s) used)", operation,
                session.getCreatedByUserId(), session.getPinType().value(), session.getOperationCount());
        return AuthorizationResult.authorized(operation, session.getPinType(), session.getRemainingOperations());
    }

    /**
     * @return {@code true} if an active session was revoked
     */
    public boolean revokeSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return false;
        }
        Optional<PinSession> found = await(pinStore.findSession(sessionId));
        if (found.isEmpty()) {
            return false;
        }
        synchronized (lockFor(found.get().getCreatedByUserId())) {
            PinSession session = await(pinStore.findSession(sessionId)).orElse(null);
            if (session == null || !session.isActive()) {
                return false;
            }
            session.terminate(REVOKED_REASON, clock.instant());
            await(pinStore.saveSession(session));
            log.info("[PinManager] Revoked session for user {}", session.getCreatedByUserId());
            return true;
        }
    }

    /**
     * @return number of sessions revoked
     */
    public int revokeAllUserSessions(String userId) {
        requireUser(userId);
        synchronized (lockFor(userId)) {
            Instant now = clock.instant();
            int revoked = 0;
            for (PinSession session : await(pinStore.findActiveSessions(userId))) {
                if (session.isActive()) {
                    session.terminate(REVOKED_REASON, now);
                    await(pinStore.saveSession(session));
                    revoked++;
                }
            }
            if (revoked > 0) {
                log.info("[PinManager] Revoked {} session(s) for user {}", revoked, userId);
            }
            return revoked;
        }
    }

    public Optional<PinSessionInfo> getSessionInfo(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        return await(pinStore.findSession(sessionId)).map(session -> PinSessionInfo.from(session, now));
    }

    /**
     * Soft-terminates every active session whose expiry has passed, then
     * deletes sessions terminated longer than
     * {@code rvsafety.pin.session-retention-hours} ago and attempts past the
     * store's retention.
     *
     * @return number of sessions terminated
     */
    public int cleanupExpiredSessions() {
        Instant now = clock.instant();
        int cleaned = 0;
        for (PinSession candidate : await(pinStore.findAllActiveSessions())) {
            if (!candidate.isExpired(now)) {
                continue;
            }
            synchronized (lockFor(candidate.getCreatedByUserId())) {
                PinSession session = await(pinStore.findSession(candidate.getSessionId())).orElse(null);
                if (session != null && session.isActive() && session.isExpired(now)) {
                    session.terminate(EXPIRED_REASON, now);
                    await(pinStore.saveSession(session));
                    cleaned++;
                }
            }
        }
        if (cleaned > 0) {
            log.debug("[PinManager] Cleaned up {} expired session(s)", cleaned);
        }

        Duration retention = Duration.ofHours(Math.max(0, properties.getPin().getSessionRetentionHours()));
        int purged = await(pinStore.purgeTerminatedSessions(now.minus(retention)));
        int purgedAttempts = await(pinStore.purgeExpiredAttempts());
        if (purged > 0 || purgedAttempts > 0) {
            log.info("[PinManager] Purged {} terminated session(s) and {} old attempt(s)", purged, purgedAttempts);
        }
        return cleaned;
    }

    // ===== Status =====

    public UserPinStatus getUserStatus(String userId) {
        requireUser(userId);
        Instant now = clock.instant();
        UserPinStatus.UserPinStatusBuilder status = UserPinStatus.builder().userId(userId);

        List<PinRecord> pins = await(pinStore.findPinsByUser(userId)).stream()
                .filter(PinRecord::isActive)
                .toList();
        Duration rotationPeriod = Duration.ofDays(properties.getPin().getRotationDays());
        for (PinRecord pin : pins) {
            status.configuredPinType(pin.getPinType());
            Instant changedAt = pin.getUpdatedAt() != null ? pin.getUpdatedAt() : pin.getCreatedAt();
            if (changedAt != null && rotationPeriod.toDays() > 0 && changedAt.plus(rotationPeriod).isBefore(now)) {
                status.rotationDueType(pin.getPinType());
            }
        }

        boolean lockedOut = false;
        for (PinType pinType : PinType.values()) {
            Optional<PinRecord> pinRecord = pins.stream().filter(p -> p.getPinType() == pinType).findFirst();
            Optional<Instant> until = findLockout(userId, pinType, lockoutThreshold(pinRecord),
                    lockoutWindow(pinRecord), now);
            if (until.isPresent()) {
                status.lockout(pinType, until.get());
                lockedOut = true;
            }
        }

        for (PinSession session : liveSessions(userId, now)) {
            status.activeSession(PinSessionInfo.from(session, now));
        }

        List<PinAttempt> attempts = await(pinStore.findAttemptsSince(userId, now.minus(STATUS_PERIOD)));
        long failed = attempts.stream().filter(a -> !a.isSuccess() && !a.isUnlockMarker()).count();
        long total = attempts.stream().filter(a -> !a.isUnlockMarker()).count();

        return status
                .attemptsLast24h((int) total)
                .failedAttemptsLast24h((int) failed)
                .canUsePins(!lockedOut)
                .build();
    }

    /**
     * Aggregate status. Sweeps expired sessions first. A store failure is
     * reported as unhealthy rather than thrown.
     */
    public PinSystemStatus getSystemStatus() {
        Instant now = clock.instant();
        try {
            int cleaned = cleanupExpiredSessions();
            int activeSessions = (int) await(pinStore.findAllActiveSessions()).stream()
                    .filter(s -> !s.isExpired(now))
                    .count();
            int configuredPins = await(pinStore.findAllActivePins()).size();
            List<PinAttempt> attempts = await(pinStore.findAttemptsSince(null, now.minus(STATUS_PERIOD)));
            long failed = attempts.stream().filter(a -> !a.isSuccess() && !a.isUnlockMarker()).count();
            long total = attempts.stream().filter(a -> !a.isUnlockMarker()).count();
            return PinSystemStatus.builder()
                    .configuredPins(configuredPins)
                    .activeSessions(activeSessions)
                    .expiredSessionsCleaned(cleaned)
                    .attemptsLast24h((int) total)
                    .failedAttemptsLast24h((int) failed)
                    .healthy(true)
                    .checkedAt(now)
                    .build();
        } catch (PinStoreException e) {
            log.error("[PinManager] PIN store unavailable: {}", e.getMessage());
            return PinSystemStatus.builder()
                    .healthy(false)
                    .error(UNAVAILABLE)
                    .checkedAt(now)
                    .build();
        }
    }

    // ===== Internals =====

    private Optional<Instant> findLockout(String userId, PinType pinType, int threshold, Duration window,
            Instant now) {
        if (threshold <= 0) {
            return Optional.empty();
        }
        List<PinAttempt> attempts = await(pinStore.findAttempts(userId, pinType, now.minus(window)));

        Instant unlockedAt = attempts.stream()
                .filter(PinAttempt::isUnlockMarker)
                .map(PinAttempt::getAttemptedAt)
                .max(Comparator.naturalOrder())
                .orElse(null);

        List<Instant> counted = attempts.stream()
                .filter(PinAttempt::isCountedFailure)
                .map(PinAttempt::getAttemptedAt)
                .filter(at -> unlockedAt == null || at.isAfter(unlockedAt))
                .toList();
        if (counted.size() < threshold) {
            return Optional.empty();
        }

        Instant newest = counted.stream().max(Comparator.naturalOrder()).orElseThrow();
        Instant until = newest.plus(window);
        return until.isAfter(now) ? Optional.of(until) : Optional.empty();
    }

    private int lockoutThreshold(Optional<PinRecord> pinRecord) {
        return pinRecord.map(PinRecord::getLockoutAfterFailures)
                .filter(value -> value > 0)
                .orElse(properties.getPin().getMaxFailedAttempts());
    }

    private Duration lockoutWindow(Optional<PinRecord> pinRecord) {
        int minutes = pinRecord.map(PinRecord::getLockoutDurationMinutes)
                .filter(value -> value > 0)
                .orElse(properties.getPin().getLockoutDurationMinutes());
        return Duration.ofMinutes(minutes);
    }

    private List<PinSession> liveSessions(String userId, Instant now) {
        List<PinSession> live = new ArrayList<>();
        for (PinSession session : await(pinStore.findActiveSessions(userId))) {
            if (!session.isActive()) {
                continue;
            }
            if (session.isExpired(now)) {
                session.terminate(EXPIRED_REASON, now);
                await(pinStore.saveSession(session));
                continue;
            }
            live.add(session);
        }
        live.sort(Comparator.comparing(PinSession::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())));
        return live;
    }

    private void recordAttempt(String userId, PinType pinType, boolean success, PinAttemptReason reason,
            String ipAddress, String userAgent, String sessionId, Instant now) {
        await(pinStore.recordAttempt(PinAttempt.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .pinType(pinType)
                .success(success)
                .failureReason(reason)
                .ipAddress(ipAddress)
                .userAgent(userAgent)
                .sessionId(sessionId)
                .attemptedAt(now)
                .build()));
    }

    private Map<PinType, String> generateDistinctPins(List<PinType> pinTypes) {
        Set<String> values = new LinkedHashSet<>();
        while (values.size() < pinTypes.size()) {
            values.add(pinHasher.generateNumericPin(DEFAULT_PIN_LENGTH));
        }
        Map<PinType, String> pins = new EnumMap<>(PinType.class);
        List<String> ordered = new ArrayList<>(values);
        for (int i = 0; i < pinTypes.size(); i++) {
            pins.put(pinTypes.get(i), ordered.get(i));
        }
        return pins;
    }

    private void validateFormat(String pin) {
        RvSafetyProperties.PinProperties config = properties.getPin();
        if (pin == null || pin.isEmpty()) {
            throw new PinValidationException("PIN is required");
        }
        if (pin.length() < config.getMinLength() || pin.length() > config.getMaxLength()) {
            throw new PinValidationException("PIN must be between " + config.getMinLength() + " and "
                    + config.getMaxLength() + " characters");
        }
        if (config.isRequireNumericOnly() && !pin.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new PinValidationException("PIN must contain digits only");
        }
    }

    private static String lockoutMessage(Instant until, Instant now) {
        long seconds = Math.max(0, Duration.between(now, until).getSeconds());
        long minutes = Math.max(1, (seconds + 59) / 60);
        return "Locked out, try again in " + minutes + (minutes == 1 ? " minute" : " minutes");
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new PinValidationException("User id is required");
        }
    }

    private Object lockFor(String userId) {
        return userLocks[Math.floorMod(userId.hashCode(), LOCK_STRIPES)];
    }

    private static Object[] newStripes() {
        Object[] stripes = new Object[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            stripes[i] = new Object();
        }
        return stripes;
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof PinStoreException pinStoreException) {
                throw pinStoreException;
            }
            throw new PinStoreException("PIN store operation failed", cause);
        } catch (CancellationException e) {
            throw new PinStoreException("PIN store operation cancelled", e);
        }
    }
}

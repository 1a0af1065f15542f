package me.golemcore.rvsafety.port.outbound;

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

import me.golemcore.rvsafety.domain.model.PinAttempt;
import me.golemcore.rvsafety.domain.model.PinRecord;
import me.golemcore.rvsafety.domain.model.PinSession;
import me.golemcore.rvsafety.domain.model.PinType;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Port for PIN persistence: credential records, sessions and the attempt log.
 *
 * <p>
 * All operations are asynchronous. A future that completes exceptionally
 * (typically with {@link me.golemcore.rvsafety.domain.model.PinStoreException})
 * means the store could not answer, which PIN validation maps to a denial.
 */
public interface PinStorePort {

    /**
     * Active record for (userId, pinType), if any.
     */
    CompletableFuture<Optional<PinRecord>> findActivePin(String userId, PinType pinType);

    /**
     * Upsert keyed by (userId, pinType). Any other active record for the same
     * pair is deactivated.
     */
    CompletableFuture<Void> savePin(PinRecord pinRecord);

    CompletableFuture<List<PinRecord>> findPinsByUser(String userId);

    CompletableFuture<List<PinRecord>> findAllActivePins();

    CompletableFuture<Void> recordAttempt(PinAttempt attempt);

    /**
     * Attempts for (userId, pinType) at or after {@code since}, oldest first.
     */
    CompletableFuture<List<PinAttempt>> findAttempts(String userId, PinType pinType, Instant since);

    /**
     * Attempts for one user across all PIN types at or after {@code since}.
     * A {@code null} user selects every user.
     */
    CompletableFuture<List<PinAttempt>> findAttemptsSince(String userId, Instant since);

    CompletableFuture<Void> saveSession(PinSession session);

    CompletableFuture<Optional<PinSession>> findSession(String sessionId);

    /**
     * Sessions of one user still flagged active, oldest first. Expiry is not
     * checked here.
     */
    CompletableFuture<List<PinSession>> findActiveSessions(String userId);

    CompletableFuture<List<PinSession>> findAllActiveSessions();

    /**
     * Deletes sessions terminated before {@code cutoff}. Active sessions are
     * never touched.
     *
     * @return number of sessions removed
     */
    CompletableFuture<Integer> purgeTerminatedSessions(Instant cutoff);

    /**
     * Drops attempts older than the store's retention period from the attempt
     * log.
     *
     * @return number of attempts removed
     */
    CompletableFuture<Integer> purgeExpiredAttempts();
}

package me.golemcore.rvsafety.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Short-lived authorization session created by a successful PIN validation.
 *
 * <p>
 * A session stops being usable when it expires, runs out of operations, is
 * revoked, or is evicted by the concurrent-session limit. Termination is soft:
 * the row is kept with {@code terminatedAt} and {@code terminationReason}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PinSession {

    private String id;
    private String sessionId;
    private String pinRecordId;
    private PinType pinType;
    private String createdByUserId;
    private int maxDurationMinutes;

    /** Operation budget, {@code null} for unlimited. */
    private Integer maxOperations;

    private int operationCount;

    @Builder.Default
    private boolean active = true;

    private Instant expiresAt;
    private Instant createdAt;
    private Instant lastUsedAt;
    private Instant terminatedAt;
    private String terminationReason;

    @JsonIgnore
    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    @JsonIgnore
    public boolean hasOperationsRemaining() {
        return maxOperations == null || operationCount < maxOperations;
    }

    /**
     * Remaining operations, or {@code null} when the session is unlimited.
     */
    @JsonIgnore
    public Integer getRemainingOperations() {
        if (maxOperations == null) {
            return null;
        }
        return Math.max(0, maxOperations - operationCount);
    }

    public void terminate(String reason, Instant now) {
        this.active = false;
        this.terminatedAt = now;
        this.terminationReason = reason;
    }
}

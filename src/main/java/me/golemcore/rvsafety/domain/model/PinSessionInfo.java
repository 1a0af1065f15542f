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

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Read-only view of a {@link PinSession} for status endpoints. Never exposes
 * the PIN record id.
 */
@Value
@Builder
public class PinSessionInfo {

    String sessionId;
    PinType pinType;
    String createdByUserId;
    Instant createdAt;
    Instant expiresAt;
    Instant lastUsedAt;
    int operationCount;
    Integer maxOperations;
    Integer remainingOperations;
    boolean active;
    boolean expired;

    public static PinSessionInfo from(PinSession session, Instant now) {
        return PinSessionInfo.builder()
                .sessionId(session.getSessionId())
                .pinType(session.getPinType())
                .createdByUserId(session.getCreatedByUserId())
                .createdAt(session.getCreatedAt())
                .expiresAt(session.getExpiresAt())
                .lastUsedAt(session.getLastUsedAt())
                .operationCount(session.getOperationCount())
                .maxOperations(session.getMaxOperations())
                .remainingOperations(session.getRemainingOperations())
                .active(session.isActive())
                .expired(session.isExpired(now))
                .build();
    }
}

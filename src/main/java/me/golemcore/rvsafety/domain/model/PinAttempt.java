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
 * Append-only record of one PIN validation attempt. The lockout window is
 * computed from these rows.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PinAttempt {

    private String id;
    private String userId;
    private PinType pinType;
    private boolean success;
    private PinAttemptReason failureReason;
    private String ipAddress;
    private String userAgent;
    private String sessionId;
    private Instant attemptedAt;

    @JsonIgnore
    public boolean isCountedFailure() {
        return !success && failureReason != null && failureReason.countsTowardLockout();
    }

    @JsonIgnore
    public boolean isUnlockMarker() {
        return failureReason == PinAttemptReason.ADMIN_UNLOCK;
    }
}

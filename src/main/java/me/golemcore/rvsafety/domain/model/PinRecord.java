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
 * Stored PIN credential for one (user, PIN type) pair. Only the salted hash is
 * persisted; the plaintext never leaves {@code PinManager.setPin}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PinRecord {

    private String id;
    private String userId;
    private PinType pinType;
    private String pinHash;
    private String salt;
    private String description;

    @Builder.Default
    private boolean active = true;

    /** Total validations allowed for this PIN, {@code null} for unlimited. */
    private Integer maxUses;

    private int useCount;
    private int lockoutAfterFailures;
    private int lockoutDurationMinutes;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastUsedAt;

    @JsonIgnore
    public boolean isExhausted() {
        return maxUses != null && maxUses > 0 && useCount >= maxUses;
    }
}

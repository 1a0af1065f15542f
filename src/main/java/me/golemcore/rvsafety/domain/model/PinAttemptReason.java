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

/**
 * Failure reason recorded with a {@link PinAttempt}. Only reasons that reflect
 * a wrong guess feed the lockout window; the others are forensic markers.
 */
public enum PinAttemptReason {

    INVALID_PIN(true),

    PIN_NOT_FOUND(true),

    /**
     * Denied because the user was already locked out. Not counted, otherwise a
     * lockout would extend itself on every retry.
     */
    LOCKED_OUT(false),

    RATE_LIMITED(false),

    /**
     * Administrative unlock marker. Counted failures before the newest marker
     * are ignored.
     */
    ADMIN_UNLOCK(false);

    private final boolean countsTowardLockout;

    PinAttemptReason(boolean countsTowardLockout) {
        this.countsTowardLockout = countsTowardLockout;
    }

    public boolean countsTowardLockout() {
        return countsTowardLockout;
    }
}

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
 * Security event kinds forwarded to the security audit port.
 */
public enum SecurityEventType {
    PIN_VALIDATION_SUCCESS,
    PIN_VALIDATION_FAILURE,
    PIN_LOCKOUT,
    PIN_ROTATION,
    PIN_UNLOCK,
    EMERGENCY_STOP_TRIGGERED,
    EMERGENCY_STOP_RESET,
    SAFETY_INTERLOCK_VIOLATED,
    SAFETY_INTERLOCK_OVERRIDDEN,
    SAFETY_OPERATION_AUTHORIZED,
    MAINTENANCE_MODE_ACTIVATED,
    MAINTENANCE_MODE_DEACTIVATED,
    DIAGNOSTIC_MODE_ACTIVATED,
    DIAGNOSTIC_MODE_DEACTIVATED,
    SAFE_STATE_ENTERED,
    SAFE_STATE_CLEARED,
    RATE_LIMIT_EXCEEDED,
    UNAUTHORIZED_ACCESS
}

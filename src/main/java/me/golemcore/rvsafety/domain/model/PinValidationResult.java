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
 * Outcome of {@code PinManager.validatePin}. Exactly one status; a session is
 * present only on {@link Status#SUCCESS}.
 *
 * <p>
 * Messages are safe to show to the operator: they never contain the PIN and
 * never distinguish a wrong PIN from a missing one beyond the status code.
 */
@Value
@Builder
public class PinValidationResult {

    Status status;
    String message;
    PinSession session;
    Instant lockoutUntil;

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public static PinValidationResult success(PinSession session) {
        return PinValidationResult.builder()
                .status(Status.SUCCESS)
                .message("PIN validated")
                .session(session)
                .build();
    }

    public static PinValidationResult invalidPin() {
        return PinValidationResult.builder()
                .status(Status.INVALID_PIN)
                .message("Invalid PIN")
                .build();
    }

    public static PinValidationResult notFound() {
        return PinValidationResult.builder()
                .status(Status.NOT_FOUND)
                .message("No active PIN configured")
                .build();
    }

    public static PinValidationResult lockedOut(Instant lockoutUntil, String message) {
        return PinValidationResult.builder()
                .status(Status.LOCKED_OUT)
                .message(message)
                .lockoutUntil(lockoutUntil)
                .build();
    }

    public static PinValidationResult rateLimited(String message) {
        return PinValidationResult.builder()
                .status(Status.RATE_LIMITED)
                .message(message)
                .build();
    }

    public static PinValidationResult infrastructureError(String message) {
        return PinValidationResult.builder()
                .status(Status.INFRASTRUCTURE_ERROR)
                .message(message)
                .build();
    }

    public enum Status {
        SUCCESS, INVALID_PIN, NOT_FOUND, LOCKED_OUT, RATE_LIMITED, INFRASTRUCTURE_ERROR
    }
}

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

/**
 * Tagged outcome of {@code PinManager.authorizeOperation}.
 *
 * <p>
 * Callers on safety paths must treat anything other than
 * {@link Status#AUTHORIZED} as a denial. {@link Status#INFRASTRUCTURE_ERROR}
 * exists so that the audit trail can tell a broken store apart from a bad
 * session.
 */
@Value
@Builder
public class AuthorizationResult {

    public static final String SESSION_INVALID = "Session invalid";

    Status status;
    String reason;
    String operation;
    PinType pinType;
    Integer remainingOperations;

    public boolean isAuthorized() {
        return status == Status.AUTHORIZED;
    }

    public static AuthorizationResult authorized(String operation, PinType pinType, Integer remainingOperations) {
        return AuthorizationResult.builder()
                .status(Status.AUTHORIZED)
                .operation(operation)
                .pinType(pinType)
                .remainingOperations(remainingOperations)
                .build();
    }

    public static AuthorizationResult denied(String operation, String reason) {
        return AuthorizationResult.builder()
                .status(Status.DENIED)
                .operation(operation)
                .reason(reason)
                .build();
    }

    public static AuthorizationResult infrastructureError(String operation, String reason) {
        return AuthorizationResult.builder()
                .status(Status.INFRASTRUCTURE_ERROR)
                .operation(operation)
                .reason(reason)
                .build();
    }

    public enum Status {
        AUTHORIZED, DENIED, INFRASTRUCTURE_ERROR
    }
}

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

import java.util.Locale;

/**
 * Kind of safety PIN. Each type carries its own session policy (lifetime and
 * operation budget) configured under {@code rvsafety.pin.*}.
 */
public enum PinType {
    EMERGENCY, OVERRIDE, MAINTENANCE;

    /**
     * Lower-case wire value, as used in attempt logs and security events.
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire value case-insensitively.
     *
     * @throws IllegalArgumentException
     *             if the value does not name a PIN type
     */
    public static PinType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("PIN type is required");
        }
        for (PinType type : values()) {
            if (type.value().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown PIN type: " + value);
    }
}

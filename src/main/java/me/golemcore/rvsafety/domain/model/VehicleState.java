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
 * Snapshot of the vehicle telemetry the interlocks are evaluated against.
 *
 * <p>
 * Immutable. Updates go through {@code SafetyService.updateSystemState}, which
 * bumps {@link #version} on every applied change.
 */
@Value
@Builder(toBuilder = true)
public class VehicleState {

    @Builder.Default
    double vehicleSpeedMph = 0.0;

    @Builder.Default
    boolean parkingBrakeEngaged = true;

    @Builder.Default
    boolean levelingJacksDeployed = true;

    @Builder.Default
    boolean engineRunning = false;

    @Builder.Default
    TransmissionGear transmissionGear = TransmissionGear.PARK;

    @Builder.Default
    boolean allSlidesRetracted = true;

    long version;

    /**
     * Parked, braked, jacks down, engine off. The state the service boots
     * with.
     */
    public static VehicleState parkedDefault() {
        return VehicleState.builder().build();
    }
}

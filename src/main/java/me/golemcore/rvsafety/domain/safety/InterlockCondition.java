package me.golemcore.rvsafety.domain.safety;

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

import me.golemcore.rvsafety.domain.model.TransmissionGear;
import me.golemcore.rvsafety.domain.model.VehicleState;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Named interlock conditions and the telemetry predicate behind each one.
 * Interlocks refer to conditions by {@link #conditionName()}; a name without a
 * constant here is never satisfied.
 */
public enum InterlockCondition {

    VEHICLE_NOT_MOVING("vehicle_not_moving",
            state -> state.getVehicleSpeedMph() < InterlockCondition.MOVING_THRESHOLD_MPH),

    PARKING_BRAKE_ENGAGED("parking_brake_engaged", VehicleState::isParkingBrakeEngaged),

    LEVELING_JACKS_DEPLOYED("leveling_jacks_deployed", VehicleState::isLevelingJacksDeployed),

    ENGINE_NOT_RUNNING("engine_not_running", state -> !state.isEngineRunning()),

    TRANSMISSION_IN_PARK("transmission_in_park",
            state -> state.getTransmissionGear() == TransmissionGear.PARK),

    SLIDE_ROOMS_RETRACTED("slide_rooms_retracted", VehicleState::isAllSlidesRetracted);

    /** Speeds below this count as stationary. */
    public static final double MOVING_THRESHOLD_MPH = 0.5;

    private final String conditionName;
    private final Predicate<VehicleState> predicate;

    InterlockCondition(String conditionName, Predicate<VehicleState> predicate) {
        this.conditionName = conditionName;
        this.predicate = predicate;
    }

    public String conditionName() {
        return conditionName;
    }

    public boolean isMet(VehicleState state) {
        return state != null && predicate.test(state);
    }

    public static Optional<InterlockCondition> fromName(String name) {
        for (InterlockCondition condition : values()) {
            if (condition.conditionName.equals(name)) {
                return Optional.of(condition);
            }
        }
        return Optional.empty();
    }
}

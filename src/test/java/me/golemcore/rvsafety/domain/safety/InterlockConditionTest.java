package me.golemcore.rvsafety.domain.safety;

import me.golemcore.rvsafety.domain.model.TransmissionGear;
import me.golemcore.rvsafety.domain.model.VehicleState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InterlockConditionTest {

    @Test
    void shouldResolveConditionsByName() {
        assertEquals(InterlockCondition.ENGINE_NOT_RUNNING,
                InterlockCondition.fromName("engine_not_running").orElseThrow());
        assertTrue(InterlockCondition.fromName("ENGINE_NOT_RUNNING").isEmpty());
        assertTrue(InterlockCondition.fromName(null).isEmpty());
    }

    @Test
    void shouldEvaluateEachConditionAgainstTelemetry() {
        VehicleState parked = VehicleState.parkedDefault();
        VehicleState underway = VehicleState.builder()
                .vehicleSpeedMph(55)
                .parkingBrakeEngaged(false)
                .levelingJacksDeployed(false)
                .engineRunning(true)
                .transmissionGear(TransmissionGear.DRIVE)
                .allSlidesRetracted(false)
                .build();

        for (InterlockCondition condition : InterlockCondition.values()) {
            assertTrue(condition.isMet(parked), condition.conditionName());
            assertFalse(condition.isMet(underway), condition.conditionName());
        }
    }

    @Test
    void shouldNotBeMetWithoutTelemetry() {
        assertFalse(InterlockCondition.PARKING_BRAKE_ENGAGED.isMet(null));
    }
}

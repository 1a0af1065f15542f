package me.golemcore.rvsafety.domain.model;

/**
 * How a feature must be treated when the system leaves normal operation.
 */
public enum SafetyClassification {

    /** Failure of this feature triggers an emergency stop. */
    CRITICAL,

    /** Holds a physical position; forced to safe shutdown on emergency stop. */
    POSITION_CRITICAL,

    OPERATIONAL,

    MAINTENANCE
}

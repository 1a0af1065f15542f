package me.golemcore.rvsafety.domain.model;

/**
 * Transmission gear as reported by the chassis.
 */
public enum TransmissionGear {
    PARK, REVERSE, NEUTRAL, DRIVE, LOW, UNKNOWN
}

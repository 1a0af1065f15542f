package me.golemcore.rvsafety.domain.model;

/**
 * System-wide operational mode. At most one non-NORMAL mode is active at a
 * time.
 */
public enum SystemOperationalMode {
    NORMAL, MAINTENANCE, DIAGNOSTIC
}

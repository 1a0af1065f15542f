package me.golemcore.rvsafety.domain.model;

public enum SecurityEventSeverity {
    LOW, MEDIUM, HIGH, CRITICAL
}

package me.golemcore.rvsafety.domain.model;

/**
 * Lifecycle state reported by the feature manager.
 */
public enum FeatureState {
    STOPPED, INITIALIZING, HEALTHY, DEGRADED, FAILED, SAFE_SHUTDOWN;

    public boolean isFailed() {
        return this == FAILED;
    }
}

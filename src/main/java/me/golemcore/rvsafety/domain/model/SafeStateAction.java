package me.golemcore.rvsafety.domain.model;

/**
 * What a feature guarded by an interlock should do while the system is in
 * safe state.
 */
public enum SafeStateAction {
    MAINTAIN_POSITION, CONTINUE_OPERATION, DISABLE, SAFE_DEFAULT
}

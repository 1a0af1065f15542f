package me.golemcore.rvsafety.domain.model;

/**
 * Result of evaluating one interlock against a {@link VehicleState}.
 * {@code failedCondition} names the first unmet condition, if any.
 */
public record InterlockCheckResult(
        boolean satisfied,
        String reason,
        String failedCondition) {

    public static InterlockCheckResult ok(String reason) {
        return new InterlockCheckResult(true, reason, null);
    }

    public static InterlockCheckResult failed(String condition, String reason) {
        return new InterlockCheckResult(false, reason, condition);
    }
}

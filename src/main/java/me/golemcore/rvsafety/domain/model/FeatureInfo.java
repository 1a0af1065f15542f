package me.golemcore.rvsafety.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Feature as seen by the safety core.
 */
@Value
@Builder(toBuilder = true)
public class FeatureInfo {

    String name;
    boolean enabled;
    SafetyClassification classification;
    FeatureState state;
}

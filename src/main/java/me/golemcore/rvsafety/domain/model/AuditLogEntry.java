package me.golemcore.rvsafety.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One entry of the safety audit trail.
 */
@Value
@Builder
public class AuditLogEntry {

    Instant timestamp;
    String eventType;

    @Singular
    Map<String, Object> details;
}

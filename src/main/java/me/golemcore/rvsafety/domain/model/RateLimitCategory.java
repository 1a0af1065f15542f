package me.golemcore.rvsafety.domain.model;

/**
 * Rate-limit bucket family. Each category has its own capacity and refill
 * period under {@code rvsafety.rate-limit.*}.
 */
public enum RateLimitCategory {
    GENERAL, SAFETY, EMERGENCY, PIN_AUTH
}

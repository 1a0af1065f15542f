package me.golemcore.rvsafety.ratelimit;

import me.golemcore.rvsafety.domain.model.RateLimitCategory;
import me.golemcore.rvsafety.domain.model.RateLimitResult;
import me.golemcore.rvsafety.infrastructure.config.RvSafetyProperties;
import me.golemcore.rvsafety.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CategoryRateLimiterTest {

    private static final String IP = "10.0.0.5";

    private MutableClock clock;
    private RvSafetyProperties properties;
    private CategoryRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        properties = new RvSafetyProperties();
        rateLimiter = new CategoryRateLimiter(properties, clock);
    }

    private int consumeUntilDenied(String identifier, RateLimitCategory category, boolean isAdmin) {
        int allowed = 0;
        while (rateLimiter.tryConsume(identifier, category, isAdmin).isAllowed()) {
            allowed++;
            if (allowed > 1000) {
                fail("limit never reached");
            }
        }
        return allowed;
    }

    @Test
    void shouldAlwaysAllowWhenDisabled() {
        properties.getRateLimit().setEnabled(false);

        for (int i = 0; i < 100; i++) {
            RateLimitResult result = rateLimiter.tryConsume(IP, RateLimitCategory.EMERGENCY, false);
            assertTrue(result.isAllowed());
            assertEquals(Long.MAX_VALUE, result.getRemainingTokens());
        }
    }

    @Test
    void shouldApplyPerCategoryCapacity() {
        assertEquals(60, consumeUntilDenied(IP, RateLimitCategory.GENERAL, false));
        assertEquals(5, consumeUntilDenied(IP, RateLimitCategory.SAFETY, false));
        assertEquals(3, consumeUntilDenied(IP, RateLimitCategory.EMERGENCY, false));
        assertEquals(3, consumeUntilDenied(IP, RateLimitCategory.PIN_AUTH, false));
    }

    @Test
    void shouldApplyAdminMultiplierInSeparateBucket() {
        assertEquals(3, consumeUntilDenied(IP, RateLimitCategory.PIN_AUTH, false));

        assertEquals(6, consumeUntilDenied(IP, RateLimitCategory.PIN_AUTH, true));
    }

    @Test
    void shouldKeepIdentifiersIndependent() {
        consumeUntilDenied(IP, RateLimitCategory.PIN_AUTH, false);

        assertTrue(rateLimiter.tryConsume("10.0.0.6", RateLimitCategory.PIN_AUTH, false).isAllowed());
    }

    @Test
    void shouldRefillEmergencyBucketHourly() {
        consumeUntilDenied(IP, RateLimitCategory.EMERGENCY, false);

        clock.advance(Duration.ofMinutes(1));
        assertFalse(rateLimiter.tryConsume(IP, RateLimitCategory.EMERGENCY, false).isAllowed());

        clock.advance(Duration.ofMinutes(19));
        assertTrue(rateLimiter.tryConsume(IP, RateLimitCategory.EMERGENCY, false).isAllowed());
    }

    @Test
    void shouldRebuildBucketWhenLimitChanges() {
        consumeUntilDenied(IP, RateLimitCategory.SAFETY, false);

        properties.getRateLimit().setSafetyOperationsPerMinute(10);

        assertEquals(10, consumeUntilDenied(IP, RateLimitCategory.SAFETY, false));
    }
}

package admit.java.engine;

import admit.core.clock.ManualClock;
import admit.core.model.RateLimitConfig;
import admit.core.model.RateLimitResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Core functional tests for AdmissionEngine.
 *
 * Focus:
 * - Basic allow/reject behavior
 * - Window expiry and retry hints
 * - Multi-key isolation
 * - Edge cases
 */
class AdmissionEngineTest {

    private static final RateLimitConfig TEN_PER_TEN_MINUTES = new RateLimitConfig(10, 600_000L);

    @Test
    void testAllow_whenWithinLimit() {
        ManualClock clock = new ManualClock(0L);
        AdmissionEngine engine = new AdmissionEngine(clock);

        for (int i = 0; i < 10; i++) {
            RateLimitResult result = engine.check("k", TEN_PER_TEN_MINUTES);
            assertTrue(result.allowed(), "request " + (i + 1) + " should be allowed");
            assertEquals(0L, result.retryAfterSeconds());
        }
    }

    @Test
    void testReject_whenExceedingLimit_thenAllowAfterWindow() {
        ManualClock clock = new ManualClock(0L);
        AdmissionEngine engine = new AdmissionEngine(clock);

        for (int i = 0; i < 10; i++) {
            engine.check("k", TEN_PER_TEN_MINUTES);
        }

        RateLimitResult rejected = engine.check("k", TEN_PER_TEN_MINUTES);
        assertFalse(rejected.allowed());
        assertEquals(600L, rejected.retryAfterSeconds());

        clock.setMillis(600_001L);
        assertTrue(engine.check("k", TEN_PER_TEN_MINUTES).allowed());
    }

    @Test
    void testWindowFullyExpired_allowsAgain() {
        ManualClock clock = new ManualClock(0L);
        AdmissionEngine engine = new AdmissionEngine(clock);
        RateLimitConfig config = new RateLimitConfig(2, 1_000L);

        assertTrue(engine.check("k", config).allowed());
        assertTrue(engine.check("k", config).allowed());
        assertFalse(engine.check("k", config).allowed());

        clock.advanceMillis(2_000L);
        assertTrue(engine.check("k", config).allowed());
    }

    @Test
    void testRetryAfter_neverExceedsWindowSeconds() {
        ManualClock clock = new ManualClock(0L);
        AdmissionEngine engine = new AdmissionEngine(clock);
        RateLimitConfig config = new RateLimitConfig(3, 2_500L);

        for (int t = 0; t < 10_000; t += 100) {
            clock.setMillis(t);
            RateLimitResult result = engine.check("k", config);
            if (result.allowed()) {
                assertEquals(0L, result.retryAfterSeconds());
            } else {
                assertTrue(result.retryAfterSeconds() >= 1);
                assertTrue(result.retryAfterSeconds() <= config.maxRetryAfterSeconds());
            }
        }
    }

    @Test
    void testLimitOne_behavesAsOnePerWindow() {
        ManualClock clock = new ManualClock(0L);
        AdmissionEngine engine = new AdmissionEngine(clock);
        RateLimitConfig config = new RateLimitConfig(1, 5_000L);

        assertTrue(engine.check("k", config).allowed());
        clock.advanceMillis(4_999L);
        assertFalse(engine.check("k", config).allowed());
        clock.advanceMillis(1L);
        assertTrue(engine.check("k", config).allowed());
    }

    @Test
    void testExplicitTime_overridesClock() {
        ManualClock clock = new ManualClock(0L);
        AdmissionEngine engine = new AdmissionEngine(clock);
        RateLimitConfig config = new RateLimitConfig(1, 1_000L);

        assertTrue(engine.check("k", config, 50_000L).allowed());
        assertFalse(engine.check("k", config, 50_500L).allowed());
        assertTrue(engine.check("k", config, 51_000L).allowed());
    }

    @Test
    void testMultipleKeys_isolated() {
        ManualClock clock = new ManualClock(0L);
        AdmissionEngine engine = new AdmissionEngine(clock);
        RateLimitConfig config = new RateLimitConfig(1, 60_000L);

        assertTrue(engine.check("evidence:user:1", config).allowed());
        assertFalse(engine.check("evidence:user:1", config).allowed());

        // Same identity, other namespace; other identity, same namespace
        assertTrue(engine.check("outreach:user:1", config).allowed());
        assertTrue(engine.check("evidence:user:2", config).allowed());

        assertEquals(3, engine.size());
    }

    @Test
    void testClockMovedBackwards_isTrustedLiterally() {
        ManualClock clock = new ManualClock(10_000L);
        AdmissionEngine engine = new AdmissionEngine(clock);
        RateLimitConfig config = new RateLimitConfig(1, 1_000L);

        assertTrue(engine.check("k", config).allowed());
        clock.setMillis(5_000L);
        // The recorded request lies in the future; it still counts.
        assertFalse(engine.check("k", config).allowed());
    }

    @Test
    void testClear_removesAllKeys() {
        ManualClock clock = new ManualClock(0L);
        AdmissionEngine engine = new AdmissionEngine(clock);
        RateLimitConfig config = new RateLimitConfig(1, 60_000L);

        engine.check("key1", config);
        engine.check("key2", config);
        assertEquals(2, engine.size());

        engine.clear();
        assertEquals(0, engine.size());
        assertTrue(engine.check("key1", config).allowed());
    }

    @Test
    void testCount_reflectsRecordedRequests() {
        ManualClock clock = new ManualClock(0L);
        AdmissionEngine engine = new AdmissionEngine(clock);
        RateLimitConfig config = new RateLimitConfig(2, 60_000L);

        assertEquals(0, engine.count("k"));
        engine.check("k", config);
        engine.check("k", config);
        engine.check("k", config);
        assertEquals(2, engine.count("k"));
    }

    @Test
    void testInvalidArguments() {
        ManualClock clock = new ManualClock(0L);

        assertThrows(IllegalArgumentException.class, () -> new AdmissionEngine(null));
        assertThrows(IllegalArgumentException.class, () -> new AdmissionEngine(clock, null));

        AdmissionEngine engine = new AdmissionEngine(clock);

        assertThrows(IllegalArgumentException.class, () -> engine.check(null, TEN_PER_TEN_MINUTES));
        assertThrows(IllegalArgumentException.class, () -> engine.check("  ", TEN_PER_TEN_MINUTES));
        assertThrows(IllegalArgumentException.class, () -> engine.check("k", null));
    }
}

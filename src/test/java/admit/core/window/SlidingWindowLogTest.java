package admit.core.window;

import admit.core.model.RateLimitConfig;
import admit.core.model.RateLimitResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SlidingWindowLogTest {

    @Test
    void withinWindow_countsExactly() {
        SlidingWindowLog log = new SlidingWindowLog();
        RateLimitConfig config = new RateLimitConfig(2, 1_000L);

        assertTrue(log.tryAcquire(config, 0L).allowed());
        assertTrue(log.tryAcquire(config, 0L).allowed());
        assertFalse(log.tryAcquire(config, 0L).allowed());

        // Advance a full window
        assertTrue(log.tryAcquire(config, 1_000L).allowed());
    }

    @Test
    void testReject_retryAfterIsCeilingOfRemainingWindow() {
        SlidingWindowLog log = new SlidingWindowLog();
        RateLimitConfig config = new RateLimitConfig(1, 10_000L);

        log.tryAcquire(config, 0L);

        // 10_000 - 1 ms left -> 10s
        RateLimitResult result = log.tryAcquire(config, 1L);
        assertFalse(result.allowed());
        assertEquals(10L, result.retryAfterSeconds());

        // 1 ms left -> still a whole second
        result = log.tryAcquire(config, 9_999L);
        assertFalse(result.allowed());
        assertEquals(1L, result.retryAfterSeconds());
    }

    @Test
    void testRetryAfter_measuredFromOldestCountedRequest() {
        SlidingWindowLog log = new SlidingWindowLog();
        RateLimitConfig config = new RateLimitConfig(2, 10_000L);

        log.tryAcquire(config, 0L);
        log.tryAcquire(config, 6_000L);

        RateLimitResult result = log.tryAcquire(config, 7_000L);
        assertFalse(result.allowed());
        assertEquals(3L, result.retryAfterSeconds());

        // Oldest falls out at exactly now - t == windowMs
        assertTrue(log.tryAcquire(config, 10_000L).allowed());
        assertEquals(2, log.size());
    }

    @Test
    void testRejected_requestsAreNotRecorded() {
        SlidingWindowLog log = new SlidingWindowLog();
        RateLimitConfig config = new RateLimitConfig(1, 1_000L);

        log.tryAcquire(config, 0L);
        for (int i = 0; i < 5; i++) {
            log.tryAcquire(config, 500L);
        }

        assertEquals(1, log.size());
        assertTrue(log.tryAcquire(config, 1_000L).allowed());
    }

    @Test
    void testPrune_emptiesExpiredLog() {
        SlidingWindowLog log = new SlidingWindowLog();
        RateLimitConfig config = new RateLimitConfig(3, 1_000L);

        log.tryAcquire(config, 0L);
        log.tryAcquire(config, 100L);
        log.prune(1_050L, 1_000L);
        assertEquals(1, log.size());

        log.prune(1_100L, 1_000L);
        assertTrue(log.isEmpty());
    }
}

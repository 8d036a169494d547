package admit.core.window;

import admit.core.model.RateLimitConfig;
import admit.core.model.RateLimitResult;

import java.util.ArrayDeque;

/**
 * Exact sliding window (log):
 * keeps the timestamp of every accepted request for one key.
 *
 * Pros: exact, a key never exceeds limit in any trailing window.
 * Cons: O(limit) memory per key, cost per request proportional to pruned entries.
 *
 * Thread-safety: NOT thread-safe. Callers hold the owning entry's lock.
 */
public final class SlidingWindowLog {

    private final ArrayDeque<Long> events = new ArrayDeque<>();

    public RateLimitResult tryAcquire(RateLimitConfig config, long nowMillis) {
        prune(nowMillis, config.windowMs());

        if (events.size() < config.limit()) {
            events.addLast(nowMillis);
            return RateLimitResult.allow();
        }

        long oldest = events.peekFirst();
        long remainingMillis = (oldest + config.windowMs()) - nowMillis;
        return RateLimitResult.reject(ceilSeconds(remainingMillis));
    }

    /**
     * Drops every timestamp t with {@code now - t >= windowMs}.
     * Insertion order is time order, so pruning only ever touches the head.
     */
    public void prune(long nowMillis, long windowMs) {
        while (!events.isEmpty() && nowMillis - events.peekFirst() >= windowMs) {
            events.removeFirst();
        }
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    private static long ceilSeconds(long millis) {
        if (millis <= 0) return 0L;
        return (millis + 999) / 1000;
    }
}

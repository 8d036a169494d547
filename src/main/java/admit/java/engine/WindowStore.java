package admit.java.engine;

import admit.core.model.RateLimitConfig;
import admit.core.model.RateLimitResult;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory map from key to its log of accepted request timestamps.
 *
 * <p>Each key has its own {@link ReentrantLock}, so prune, limit check and append happen
 * atomically per key while different keys never contend. Keys are never evicted by the
 * store itself; see {@link #sweep(long, long)} for the opt-in cleanup.
 */
public final class WindowStore {

    private final ConcurrentHashMap<String, WindowEntry> entries = new ConcurrentHashMap<>();

    /**
     * Applies one sliding-window check for a key, recording the request when admitted.
     *
     * @param key Bucket key, already namespaced
     * @param config Limit for the key's resource class
     * @param nowMillis Time of the request
     * @return the decision for this request
     */
    public RateLimitResult apply(String key, RateLimitConfig config, long nowMillis) {
        while (true) {
            WindowEntry entry = entries.computeIfAbsent(key, k -> new WindowEntry());

            ReentrantLock lock = entry.getLock();
            lock.lock();
            try {
                if (!entry.isRetired()) {
                    return entry.getLog().tryAcquire(config, nowMillis);
                }
            } finally {
                lock.unlock();
            }
            // Swept between lookup and lock; retry against the fresh entry.
        }
    }

    /**
     * Number of timestamps currently held for a key, without pruning.
     */
    public int count(String key) {
        WindowEntry entry = entries.get(key);
        if (entry == null) {
            return 0;
        }
        ReentrantLock lock = entry.getLock();
        lock.lock();
        try {
            return entry.isRetired() ? 0 : entry.getLog().size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Prunes every entry against {@code horizonMs} and unlinks entries left empty.
     *
     * <p>{@code horizonMs} must be at least the longest window used with this store,
     * otherwise timestamps that still count would be dropped.
     *
     * @return number of keys removed
     */
    public int sweep(long nowMillis, long horizonMs) {
        if (horizonMs <= 0) {
            throw new IllegalArgumentException("horizonMs must be > 0");
        }
        int removed = 0;
        for (String key : entries.keySet()) {
            WindowEntry remaining = entries.computeIfPresent(key, (k, entry) -> {
                ReentrantLock lock = entry.getLock();
                lock.lock();
                try {
                    entry.getLog().prune(nowMillis, horizonMs);
                    if (entry.getLog().isEmpty()) {
                        entry.retire();
                        return null;
                    }
                    return entry;
                } finally {
                    lock.unlock();
                }
            });
            if (remaining == null) {
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Drops every key. Test hook only: a check racing with this call may record into
     * an entry that is no longer reachable.
     */
    public void clear() {
        entries.clear();
    }
}

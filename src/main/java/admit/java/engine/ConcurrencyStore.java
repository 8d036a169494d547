package admit.java.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Caps the number of in-flight operations per key, independently of any rate limit.
 *
 * <p>Every successful {@link #acquire(String, int)} must be paired with exactly one
 * {@link #release(String)}; {@link #tryAcquireSlot(String, int)} does the pairing for
 * callers that use try-with-resources. A slot that is never released blocks its key
 * until {@link #clear()} or restart.
 *
 * <p>Thread-safety: each operation is a single atomic {@code compute} on the key.
 */
public final class ConcurrencyStore {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyStore.class);

    private final ConcurrentHashMap<String, ConcurrencyEntry> entries = new ConcurrentHashMap<>();

    /**
     * Takes a slot if fewer than {@code max} are active for the key.
     *
     * @return true if a slot was taken, false (no side effect) if the key is at capacity
     * @throws IllegalArgumentException if key is null or max < 1
     */
    public boolean acquire(String key, int max) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (max < 1) {
            throw new IllegalArgumentException("max must be >= 1, got: " + max);
        }

        boolean[] acquired = {false};
        entries.compute(key, (k, current) -> {
            int active = current == null ? 0 : current.active();
            if (active >= max) {
                return current;
            }
            acquired[0] = true;
            return new ConcurrencyEntry(active + 1, max);
        });
        return acquired[0];
    }

    /**
     * Gives back one slot. Floored at zero: releasing a key with no active slot is a no-op.
     */
    public void release(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }

        boolean[] released = {false};
        entries.computeIfPresent(key, (k, current) -> {
            released[0] = true;
            return current.active() <= 1 ? null : new ConcurrencyEntry(current.active() - 1, current.max());
        });
        if (!released[0]) {
            log.debug("Release without active slot for key {}", key);
        }
    }

    /**
     * Scoped form of {@link #acquire(String, int)}.
     *
     * @return a slot that releases on {@code close()}, or empty if the key is at capacity
     */
    public Optional<ConcurrencySlot> tryAcquireSlot(String key, int max) {
        if (!acquire(key, max)) {
            return Optional.empty();
        }
        return Optional.of(new ConcurrencySlot(this, key));
    }

    /**
     * Returns the number of active slots for a key.
     */
    public int active(String key) {
        ConcurrencyEntry entry = entries.get(key);
        return entry == null ? 0 : entry.active();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Drops every slot. Test hook only.
     */
    public void clear() {
        entries.clear();
    }
}

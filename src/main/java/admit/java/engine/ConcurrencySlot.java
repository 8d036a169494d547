package admit.java.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One acquired concurrency slot. {@link #close()} releases it exactly once.
 */
public final class ConcurrencySlot implements AutoCloseable {

    private final ConcurrencyStore store;
    private final String key;
    private final AtomicBoolean released = new AtomicBoolean(false);

    ConcurrencySlot(ConcurrencyStore store, String key) {
        this.store = store;
        this.key = key;
    }

    public String key() {
        return key;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            store.release(key);
        }
    }
}

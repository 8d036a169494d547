package admit.java.engine;

import admit.core.window.SlidingWindowLog;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry holding one key's timestamp log with its associated lock.
 *
 * Thread-safety:
 * - The lock must be held while touching the log or the retired flag
 * - A retired entry has been unlinked from the store by a sweep; writers that
 *   still hold a reference must look the key up again
 */
final class WindowEntry {

    private final SlidingWindowLog log;
    private final ReentrantLock lock;
    private boolean retired;

    WindowEntry() {
        this.log = new SlidingWindowLog();
        this.lock = new ReentrantLock(); // Non-fair for better throughput
    }

    /**
     * Returns the timestamp log.
     * MUST be called while holding the lock.
     */
    SlidingWindowLog getLog() {
        return log;
    }

    ReentrantLock getLock() {
        return lock;
    }

    boolean isRetired() {
        return retired;
    }

    void retire() {
        retired = true;
    }
}

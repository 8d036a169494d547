package admit.core.clock;

/**
 * Test clock. {@link #setMillis(long)} may move time backwards; nothing downstream defends against it.
 */
public final class ManualClock implements Clock {
    private volatile long now;

    public ManualClock(long startMillis) {
        this.now = startMillis;
    }

    @Override
    public long nowMillis() {
        return now;
    }

    public synchronized void advanceMillis(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now += delta;
    }

    public void setMillis(long value) {
        now = value;
    }
}

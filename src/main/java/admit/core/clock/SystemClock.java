package admit.core.clock;

/**
 * Real wall clock - uses System.currentTimeMillis().
 * Use this for production or concurrent tests where determinism isn't required.
 */
public final class SystemClock implements Clock {
    private static final SystemClock INSTANCE = new SystemClock();

    public static SystemClock instance() {
        return INSTANCE;
    }

    @Override
    public long nowMillis() {
        return System.currentTimeMillis();
    }
}

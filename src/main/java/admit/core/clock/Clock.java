package admit.core.clock;

/**
 * Millisecond time source. Injected everywhere time is read so tests can drive it.
 */
public interface Clock {
    long nowMillis();
}

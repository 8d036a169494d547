package admit.java.engine;

import admit.core.clock.Clock;
import admit.core.model.RateLimitConfig;
import admit.core.model.RateLimitResult;

/**
 * Thread-safe sliding-window admission engine with multi-key support.
 *
 * Features:
 * - Exact sliding-window log per key: a key never exceeds {@code limit} requests
 *   in any trailing {@code windowMs} interval
 * - Per-key locking inside {@link WindowStore}, no global bottleneck
 * - Config supplied per call, so one engine serves every resource class
 * - Clock injection enables deterministic testing
 *
 * Usage example:
 * <pre>
 * AdmissionEngine engine = new AdmissionEngine(SystemClock.instance());
 * RateLimitConfig config = new RateLimitConfig(10, 600_000L);
 *
 * RateLimitResult result = engine.check("evidence:user:42", config);
 * if (result.allowed()) {
 *     // Process request
 * } else {
 *     // Reject with Retry-After: result.retryAfterSeconds()
 * }
 * </pre>
 */
public final class AdmissionEngine {

    private final Clock clock;
    private final WindowStore store;

    /**
     * Creates an engine with its own empty store.
     *
     * @param clock Clock instance for time control (injected for testability)
     */
    public AdmissionEngine(Clock clock) {
        this(clock, new WindowStore());
    }

    /**
     * Creates an engine over an existing store.
     *
     * @param clock Clock instance for time control
     * @param store Window store owned by this engine
     * @throws IllegalArgumentException if any parameter is null
     */
    public AdmissionEngine(Clock clock, WindowStore store) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.clock = clock;
        this.store = store;
    }

    /**
     * Checks (and records) one request at the clock's current time.
     *
     * @param key The key to rate limit (e.g., "evidence:user:42")
     * @param config Limit for the key's resource class
     * @return ALLOW with retryAfterSeconds 0, or REJECT with a positive retry hint
     * @throws IllegalArgumentException if key is null/blank or config is null
     */
    public RateLimitResult check(String key, RateLimitConfig config) {
        return check(key, config, clock.nowMillis());
    }

    /**
     * Checks (and records) one request at an explicit time.
     *
     * <p>The supplied time is trusted literally; a clock moved backwards is not corrected.
     */
    public RateLimitResult check(String key, RateLimitConfig config, long nowMillis) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return store.apply(key, config, nowMillis);
    }

    /**
     * Removes keys with no timestamp younger than {@code horizonMs}, measured against the
     * engine's clock. Callers that pass their own times to {@link #check(String, RateLimitConfig, long)}
     * must use {@link #sweep(long, long)} with the same time base instead.
     *
     * @return number of keys removed
     */
    public int sweep(long horizonMs) {
        return sweep(clock.nowMillis(), horizonMs);
    }

    /**
     * Removes keys with no timestamp younger than {@code horizonMs} at an explicit time.
     *
     * @return number of keys removed
     */
    public int sweep(long nowMillis, long horizonMs) {
        return store.sweep(nowMillis, horizonMs);
    }

    /**
     * Returns the number of timestamps recorded for a key.
     */
    public int count(String key) {
        return store.count(key);
    }

    /**
     * Returns the number of currently tracked keys.
     */
    public int size() {
        return store.size();
    }

    /**
     * Clears all windows. This is primarily useful for testing.
     */
    public void clear() {
        store.clear();
    }
}

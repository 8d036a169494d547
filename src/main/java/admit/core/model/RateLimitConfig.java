package admit.core.model;

import java.time.Duration;

/**
 * Requests-per-window for one protected resource class.
 *
 * @param limit Maximum accepted requests in any trailing window (must be >= 1)
 * @param windowMs Window length in milliseconds (must be >= 1)
 */
public record RateLimitConfig(int limit, long windowMs) {

    public RateLimitConfig {
        if (limit < 1) throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
        if (windowMs < 1) throw new IllegalArgumentException("windowMs must be >= 1, got: " + windowMs);
    }

    public static RateLimitConfig of(int limit, Duration window) {
        if (window == null) throw new IllegalArgumentException("window cannot be null");
        return new RateLimitConfig(limit, window.toMillis());
    }

    /**
     * Upper bound of any retry hint this config can produce.
     */
    public long maxRetryAfterSeconds() {
        return (windowMs + 999) / 1000;
    }
}

package admit.core.model;

public record RateLimitResult(
    boolean allowed,
    long retryAfterSeconds
) {
    public RateLimitResult {
        if (allowed && retryAfterSeconds != 0L) {
            throw new IllegalArgumentException("allowed result must have retryAfterSeconds 0, got: " + retryAfterSeconds);
        }
        if (!allowed && retryAfterSeconds < 1L) {
            throw new IllegalArgumentException("rejected result must have retryAfterSeconds >= 1, got: " + retryAfterSeconds);
        }
    }

    private static final RateLimitResult ALLOW = new RateLimitResult(true, 0L);

    public static RateLimitResult allow() {
        return ALLOW;
    }

    /** A rejection always tells the caller to wait at least one second. */
    public static RateLimitResult reject(long retryAfterSeconds) {
        return new RateLimitResult(false, Math.max(1L, retryAfterSeconds));
    }
}

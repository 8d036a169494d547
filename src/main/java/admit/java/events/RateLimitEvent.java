package admit.java.events;

/**
 * Non-PII record of one denial. Identities are reduced to {@link Hashes#shortHash(String)}.
 *
 * @param endpointGroup Policy name that fired
 * @param dimension Which check denied the request
 * @param retryAfterSeconds Hint given to the caller
 * @param userIdHash Hashed user id, null for anonymous callers
 * @param ipHash Hashed client IP
 */
public record RateLimitEvent(
    String endpointGroup,
    Dimension dimension,
    long retryAfterSeconds,
    String userIdHash,
    String ipHash
) {
    public enum Dimension {
        IP,
        USER,
        CONCURRENCY
    }
}

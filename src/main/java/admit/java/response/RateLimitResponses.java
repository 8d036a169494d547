package admit.java.response;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;

/**
 * Builds the standard rejection payload shared by the HTTP and gRPC adapters.
 */
public final class RateLimitResponses {

    public static final String RATE_LIMITED = "RATE_LIMITED";
    public static final String RETRY_AFTER_HEADER = "Retry-After";
    public static final int STATUS_TOO_MANY_REQUESTS = 429;

    public static final String CONTENT_TYPE = "application/json";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private RateLimitResponses() {
        // Utility class, no instantiation
    }

    public static String message(long retryAfterSeconds) {
        return "You're doing that a bit too fast. Please wait " + retryAfterSeconds + "s and try again.";
    }

    /**
     * @throws IllegalArgumentException if retryAfterSeconds is negative
     */
    public static RejectionBody body(long retryAfterSeconds) {
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0, got: " + retryAfterSeconds);
        }
        return new RejectionBody(RATE_LIMITED, message(retryAfterSeconds), retryAfterSeconds);
    }

    public static String toJson(RejectionBody body) {
        try {
            return MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            // Three scalar fields; only reachable on a broken mapper setup.
            throw new UncheckedIOException(e);
        }
    }
}

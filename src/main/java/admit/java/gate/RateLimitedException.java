package admit.java.gate;

import admit.java.response.RateLimitResponses;
import admit.java.response.RejectionBody;

/**
 * Thrown by {@link AdmissionGate#guard} when a call is denied. Adapters turn it into a
 * 429 / RESOURCE_EXHAUSTED; it must never reach a client as a server error.
 */
public final class RateLimitedException extends RuntimeException {

    private final transient RejectionBody body;

    public RateLimitedException(long retryAfterSeconds) {
        this(RateLimitResponses.body(retryAfterSeconds));
    }

    private RateLimitedException(RejectionBody body) {
        super(body.message());
        this.body = body;
    }

    public long retryAfterSeconds() {
        return body.retryAfterSeconds();
    }

    public RejectionBody body() {
        return body;
    }
}

package admit.java.response;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Wire body of a throttled request. Clients key off {@code error}, never the message text.
 *
 * @param error Always {@link RateLimitResponses#RATE_LIMITED}
 * @param message Human-readable wait hint, embeds {@code "<N>s"}
 * @param retryAfterSeconds Seconds to wait, same value as the Retry-After header
 */
@JsonPropertyOrder({"error", "message", "retryAfterSeconds"})
public record RejectionBody(String error, String message, long retryAfterSeconds) {
}

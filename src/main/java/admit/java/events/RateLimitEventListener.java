package admit.java.events;

/**
 * Receives denials. Called on the request path, so implementations should be quick;
 * anything thrown is logged and dropped by the caller.
 */
@FunctionalInterface
public interface RateLimitEventListener {

    RateLimitEventListener NONE = event -> { };

    void onRateLimited(RateLimitEvent event);
}

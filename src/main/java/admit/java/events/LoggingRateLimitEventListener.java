package admit.java.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs denials at INFO. A denial is expected traffic, not an application error.
 */
public final class LoggingRateLimitEventListener implements RateLimitEventListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingRateLimitEventListener.class);

    @Override
    public void onRateLimited(RateLimitEvent event) {
        log.info("rate_limited group={} dimension={} retryAfterSeconds={} userIdHash={} ipHash={}",
            event.endpointGroup(),
            event.dimension(),
            event.retryAfterSeconds(),
            event.userIdHash(),
            event.ipHash());
    }
}

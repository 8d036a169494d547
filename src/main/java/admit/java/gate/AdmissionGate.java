package admit.java.gate;

import admit.core.model.RateLimitConfig;
import admit.core.model.RateLimitResult;
import admit.java.engine.AdmissionEngine;
import admit.java.engine.ConcurrencySlot;
import admit.java.engine.ConcurrencyStore;
import admit.java.events.Hashes;
import admit.java.events.LoggingRateLimitEventListener;
import admit.java.events.RateLimitEvent;
import admit.java.events.RateLimitEventListener;
import admit.java.registry.AdmissionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Single admission decision for one call: rate (per IP, per user) and concurrency.
 *
 * <p>Checks run in a fixed order and stop at the first denial:
 * <ol>
 *   <li>bypass (admin caller or test switch): admitted, nothing recorded</li>
 *   <li>per-IP window, when the policy has one</li>
 *   <li>per-user window, when the policy has one and the caller is authenticated</li>
 *   <li>concurrency slot, when the policy caps it and the caller is authenticated</li>
 * </ol>
 * A request admitted by an earlier window stays recorded there even if a later check
 * denies it.
 *
 * <p>Thread-safety: stateless apart from the injected engine and store, both of which are
 * thread-safe; one gate serves all adapters of a process.
 */
public final class AdmissionGate {

    private static final Logger log = LoggerFactory.getLogger(AdmissionGate.class);

    /** Retry hint when a user already has the maximum number of calls in flight. */
    public static final long CONCURRENCY_RETRY_AFTER_SECONDS = 30L;

    private final AdmissionEngine engine;
    private final ConcurrencyStore concurrency;
    private final AdmissionBypass bypass;
    private final RateLimitEventListener listener;

    /**
     * Creates a gate that logs denials through {@link LoggingRateLimitEventListener}.
     */
    public AdmissionGate(AdmissionEngine engine, ConcurrencyStore concurrency, AdmissionBypass bypass) {
        this(engine, concurrency, bypass, new LoggingRateLimitEventListener());
    }

    /**
     * @param engine Sliding-window engine
     * @param concurrency Concurrency slot store
     * @param bypass Admin/test bypass
     * @param listener Receives one event per denial
     * @throws IllegalArgumentException if any parameter is null
     */
    public AdmissionGate(
        AdmissionEngine engine,
        ConcurrencyStore concurrency,
        AdmissionBypass bypass,
        RateLimitEventListener listener
    ) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (concurrency == null) {
            throw new IllegalArgumentException("concurrency cannot be null");
        }
        if (bypass == null) {
            throw new IllegalArgumentException("bypass cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.engine = engine;
        this.concurrency = concurrency;
        this.bypass = bypass;
        this.listener = listener;
    }

    /**
     * Decides whether a call may proceed.
     *
     * <p>The returned admission must be closed when the call finishes (success or failure)
     * so that a held concurrency slot is released.
     *
     * @param policy Endpoint group protecting the call
     * @param caller Resolved caller
     * @return the admission, allowed or denied
     */
    public Admission tryAdmit(AdmissionPolicy policy, Caller caller) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (caller == null) {
            throw new IllegalArgumentException("caller cannot be null");
        }

        if (bypass.shouldBypass(caller)) {
            return Admission.admitted();
        }

        Optional<RateLimitConfig> ipLimit = policy.ip();
        if (ipLimit.isPresent()) {
            String key = AdmissionKeys.ip(policy.prefix(), caller.ip());
            Optional<Admission> denied = checkWindow(key, ipLimit.get(), policy, caller, RateLimitEvent.Dimension.IP);
            if (denied.isPresent()) {
                return denied.get();
            }
        }

        Optional<RateLimitConfig> userLimit = policy.user();
        if (userLimit.isPresent() && caller.isAuthenticated()) {
            String key = AdmissionKeys.user(policy.prefix(), caller.userId());
            Optional<Admission> denied = checkWindow(key, userLimit.get(), policy, caller, RateLimitEvent.Dimension.USER);
            if (denied.isPresent()) {
                return denied.get();
            }
        }

        if (policy.hasConcurrencyCap() && caller.isAuthenticated()) {
            String key = AdmissionKeys.concurrency(policy.prefix(), caller.userId());
            Optional<ConcurrencySlot> slot = concurrency.tryAcquireSlot(key, policy.maxConcurrent());
            if (slot.isEmpty()) {
                publish(policy, caller, RateLimitEvent.Dimension.CONCURRENCY, CONCURRENCY_RETRY_AFTER_SECONDS);
                return Admission.denied(CONCURRENCY_RETRY_AFTER_SECONDS);
            }
            return Admission.admitted(slot.get());
        }

        return Admission.admitted();
    }

    /**
     * Runs an operation under admission, releasing any slot on every exit path.
     *
     * @throws RateLimitedException if the call is denied; the operation is not invoked
     * @throws Exception whatever the operation throws
     */
    public <T> T guard(AdmissionPolicy policy, Caller caller, Callable<T> operation) throws Exception {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        try (Admission admission = tryAdmit(policy, caller)) {
            if (!admission.allowed()) {
                throw new RateLimitedException(admission.retryAfterSeconds());
            }
            return operation.call();
        }
    }

    private Optional<Admission> checkWindow(
        String key,
        RateLimitConfig config,
        AdmissionPolicy policy,
        Caller caller,
        RateLimitEvent.Dimension dimension
    ) {
        RateLimitResult result = engine.check(key, config);
        if (result.allowed()) {
            return Optional.empty();
        }
        publish(policy, caller, dimension, result.retryAfterSeconds());
        return Optional.of(Admission.denied(result.retryAfterSeconds()));
    }

    private void publish(AdmissionPolicy policy, Caller caller, RateLimitEvent.Dimension dimension, long retryAfterSeconds) {
        RateLimitEvent event = new RateLimitEvent(
            policy.name(),
            dimension,
            retryAfterSeconds,
            Hashes.shortHash(caller.userId()),
            Hashes.shortHash(caller.ip())
        );
        // Event reporting must never fail the request path.
        try {
            listener.onRateLimited(event);
        } catch (RuntimeException e) {
            log.warn("Rate-limit event listener failed for group {}", policy.name(), e);
        }
    }
}

package admit.java.gate;

import admit.java.engine.ConcurrencySlot;
import admit.java.response.RateLimitResponses;
import admit.java.response.RejectionBody;

/**
 * Outcome of {@link AdmissionGate#tryAdmit}. An admitted call may hold a concurrency slot;
 * closing the admission releases it. Closing is idempotent and a no-op for denials.
 */
public final class Admission implements AutoCloseable {

    private static final Admission ADMITTED_WITHOUT_SLOT = new Admission(true, 0L, null);

    private final boolean allowed;
    private final long retryAfterSeconds;
    private final ConcurrencySlot slot;

    private Admission(boolean allowed, long retryAfterSeconds, ConcurrencySlot slot) {
        this.allowed = allowed;
        this.retryAfterSeconds = retryAfterSeconds;
        this.slot = slot;
    }

    static Admission admitted() {
        return ADMITTED_WITHOUT_SLOT;
    }

    static Admission admitted(ConcurrencySlot slot) {
        return slot == null ? ADMITTED_WITHOUT_SLOT : new Admission(true, 0L, slot);
    }

    static Admission denied(long retryAfterSeconds) {
        return new Admission(false, Math.max(1L, retryAfterSeconds), null);
    }

    public boolean allowed() {
        return allowed;
    }

    public long retryAfterSeconds() {
        return retryAfterSeconds;
    }

    public boolean holdsSlot() {
        return slot != null && !slot.isReleased();
    }

    /**
     * @throws IllegalStateException if the call was admitted
     */
    public RejectionBody rejection() {
        if (allowed) {
            throw new IllegalStateException("admitted call has no rejection");
        }
        return RateLimitResponses.body(retryAfterSeconds);
    }

    @Override
    public void close() {
        if (slot != null) {
            slot.close();
        }
    }
}

package admit.java.gate;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The only place admission checks are skipped.
 *
 * <p>Administrators always bypass. The test switch bypasses every caller process-wide
 * while enabled; it starts disabled and must be turned on and off explicitly by the
 * harness that owns this instance.
 */
public final class AdmissionBypass {

    private final AtomicBoolean testBypass = new AtomicBoolean(false);

    public boolean shouldBypass(Caller caller) {
        return testBypass.get() || (caller != null && caller.isAdmin());
    }

    public void enableTestBypass() {
        testBypass.set(true);
    }

    public void disableTestBypass() {
        testBypass.set(false);
    }

    public boolean isTestBypassEnabled() {
        return testBypass.get();
    }
}

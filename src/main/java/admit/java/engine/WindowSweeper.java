package admit.java.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically removes idle keys from an {@link AdmissionEngine}.
 *
 * <p>The engine never evicts on its own; a deployment that wants bounded memory starts
 * one of these with a horizon of at least the longest configured window.
 */
public final class WindowSweeper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WindowSweeper.class);

    public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(5);

    private final AdmissionEngine engine;
    private final long horizonMs;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;

    /**
     * @param engine Engine to sweep
     * @param horizonMs Age beyond which timestamps no longer count for any resource class
     * @param interval Time between sweeps
     * @throws IllegalArgumentException if any parameter is invalid
     */
    public WindowSweeper(AdmissionEngine engine, long horizonMs, Duration interval) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (horizonMs <= 0) {
            throw new IllegalArgumentException("horizonMs must be > 0");
        }
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.engine = engine;
        this.horizonMs = horizonMs;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "admission-window-sweeper");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        long periodMillis = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::runSweep, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        log.info("Window sweeper started: every {} ms, horizon {} ms", periodMillis, horizonMs);
    }

    /**
     * Runs one sweep on the calling thread.
     *
     * @return number of keys removed
     */
    public int sweepNow() {
        int removed = engine.sweep(horizonMs);
        log.debug("Swept {} idle keys, {} remaining", removed, engine.size());
        return removed;
    }

    private void runSweep() {
        // An exception escaping a scheduled task cancels all future runs.
        try {
            sweepNow();
        } catch (RuntimeException e) {
            log.warn("Window sweep failed", e);
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}

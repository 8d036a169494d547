package admit.benchmarks.java;

import admit.core.clock.SystemClock;
import admit.core.model.RateLimitConfig;
import admit.java.engine.AdmissionEngine;
import admit.java.engine.ConcurrencyStore;
import org.openjdk.jmh.annotations.*;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmarks for AdmissionEngine and ConcurrencyStore.
 *
 * Measures throughput (ops/sec) across 4 scenarios:
 * - singleKey: All requests to same key (high contention, window stays full)
 * - multiKey: Rotating through 1000 different keys (low contention)
 * - parallel: 8 threads with high contention on single key
 * - concurrencySlot: acquire/release cycle on one key
 *
 * Run from the test classpath:
 *   java -cp target/test-classes:... org.openjdk.jmh.Main AdmissionEngine
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Thread)
public class AdmissionEngineBenchmark {

    private AdmissionEngine engine;
    private ConcurrencyStore concurrency;
    private RateLimitConfig config;

    @Setup
    public void setup() {
        engine = new AdmissionEngine(SystemClock.instance());
        concurrency = new ConcurrencyStore();
        config = new RateLimitConfig(1_000, 1_000L);
    }

    /**
     * Single key throughput (high contention on same key).
     */
    @Benchmark
    public boolean singleKey() {
        return engine.check("user:1", config).allowed();
    }

    /**
     * Multi-key throughput (rotating through 1000 keys, low contention).
     */
    @Benchmark
    public boolean multiKey() {
        String key = "user:" + ThreadLocalRandom.current().nextInt(1000);
        return engine.check(key, config).allowed();
    }

    /**
     * Parallel throughput with 8 threads on single key (high contention).
     */
    @Benchmark
    @Threads(8)
    public boolean parallel() {
        return engine.check("user:1", config).allowed();
    }

    @Benchmark
    public boolean concurrencySlot() {
        boolean acquired = concurrency.acquire("evidence:concurrency:1", 1);
        if (acquired) {
            concurrency.release("evidence:concurrency:1");
        }
        return acquired;
    }
}

package admit.java.registry;

import admit.core.model.RateLimitConfig;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only table of named limits, one per protected resource class.
 *
 * <p>Adding a resource class means registering a new entry; the engine does not change.
 * Every validation happens while building, so a bad table fails at startup rather than
 * on the first request.
 *
 * <p>Thread-safety: immutable after {@link Builder#build()}.
 */
public final class LimitRegistry {

    public static final String EVIDENCE_SCAN_PER_USER = "evidence-scan-per-user";
    public static final String OUTREACH_PER_USER = "outreach-per-user";
    public static final String KIT_PER_USER = "kit-per-user";
    public static final String JD_EXTRACT_PER_USER = "jd-extract-per-user";
    public static final String URL_FETCH_PER_USER = "url-fetch-per-user";
    public static final String URL_FETCH_PER_IP = "url-fetch-per-ip";
    public static final String AUTH_PER_IP = "auth-per-ip";

    private static final Duration TEN_MINUTES = Duration.ofMinutes(10);
    private static final Duration ONE_HOUR = Duration.ofHours(1);

    private static final LimitRegistry DEFAULTS = builder()
        .register(EVIDENCE_SCAN_PER_USER, RateLimitConfig.of(10, TEN_MINUTES))
        .register(OUTREACH_PER_USER, RateLimitConfig.of(10, TEN_MINUTES))
        .register(KIT_PER_USER, RateLimitConfig.of(10, TEN_MINUTES))
        .register(JD_EXTRACT_PER_USER, RateLimitConfig.of(10, TEN_MINUTES))
        .register(URL_FETCH_PER_USER, RateLimitConfig.of(10, ONE_HOUR))
        .register(URL_FETCH_PER_IP, RateLimitConfig.of(20, ONE_HOUR))
        .register(AUTH_PER_IP, RateLimitConfig.of(20, TEN_MINUTES))
        .build();

    private final Map<String, RateLimitConfig> limits;
    private final long maxWindowMs;

    private LimitRegistry(Map<String, RateLimitConfig> limits) {
        this.limits = Collections.unmodifiableMap(new LinkedHashMap<>(limits));
        this.maxWindowMs = limits.values().stream()
            .mapToLong(RateLimitConfig::windowMs)
            .max()
            .orElse(0L);
    }

    /**
     * The limits the product ships with.
     */
    public static LimitRegistry defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the config registered under a name.
     *
     * @throws IllegalArgumentException if nothing is registered under the name
     */
    public RateLimitConfig get(String name) {
        RateLimitConfig config = limits.get(name);
        if (config == null) {
            throw new IllegalArgumentException("Unknown resource class: " + name);
        }
        return config;
    }

    public Optional<RateLimitConfig> find(String name) {
        return Optional.ofNullable(limits.get(name));
    }

    public Set<String> names() {
        return limits.keySet();
    }

    /**
     * Longest window across all entries; a safe sweep horizon for this registry.
     */
    public long maxWindowMs() {
        return maxWindowMs;
    }

    public int size() {
        return limits.size();
    }

    public static final class Builder {

        private final Map<String, RateLimitConfig> limits = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Names become key prefixes, so they may not contain ':'.
         *
         * @throws IllegalArgumentException on a blank or ':'-bearing name, null config or duplicate name
         */
        public Builder register(String name, RateLimitConfig config) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            if (name.contains(":")) {
                throw new IllegalArgumentException("name cannot contain ':': " + name);
            }
            if (config == null) {
                throw new IllegalArgumentException("config cannot be null for " + name);
            }
            if (limits.putIfAbsent(name, config) != null) {
                throw new IllegalArgumentException("Duplicate resource class: " + name);
            }
            return this;
        }

        /**
         * Convenience for registering raw values; invalid values fail here.
         */
        public Builder register(String name, int limit, long windowMs) {
            return register(name, new RateLimitConfig(limit, windowMs));
        }

        public LimitRegistry build() {
            return new LimitRegistry(limits);
        }
    }
}

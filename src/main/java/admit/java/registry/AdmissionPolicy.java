package admit.java.registry;

import admit.core.model.RateLimitConfig;

import java.util.Optional;

/**
 * How one endpoint group is protected.
 *
 * @param name Endpoint group, reported in rate-limit events (e.g. "url_fetch")
 * @param prefix Key namespace; isolates this group's buckets from every other group's
 * @param userConfig Per-user limit, applied to authenticated callers only (nullable)
 * @param ipConfig Per-IP limit, applied to every caller (nullable)
 * @param maxConcurrent Max in-flight calls per authenticated user, 0 for no cap
 */
public record AdmissionPolicy(
    String name,
    String prefix,
    RateLimitConfig userConfig,
    RateLimitConfig ipConfig,
    int maxConcurrent
) {
    public AdmissionPolicy {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name cannot be null or blank");
        if (prefix == null || prefix.isBlank()) throw new IllegalArgumentException("prefix cannot be null or blank");
        if (prefix.contains(":")) throw new IllegalArgumentException("prefix cannot contain ':': " + prefix);
        if (maxConcurrent < 0) throw new IllegalArgumentException("maxConcurrent must be >= 0");
        if (userConfig == null && ipConfig == null && maxConcurrent == 0) {
            throw new IllegalArgumentException("policy " + name + " limits nothing");
        }
    }

    public static AdmissionPolicy perUser(String name, String prefix, RateLimitConfig userConfig, int maxConcurrent) {
        return new AdmissionPolicy(name, prefix, userConfig, null, maxConcurrent);
    }

    public static AdmissionPolicy perIp(String name, String prefix, RateLimitConfig ipConfig) {
        return new AdmissionPolicy(name, prefix, null, ipConfig, 0);
    }

    public Optional<RateLimitConfig> user() {
        return Optional.ofNullable(userConfig);
    }

    public Optional<RateLimitConfig> ip() {
        return Optional.ofNullable(ipConfig);
    }

    public boolean hasConcurrencyCap() {
        return maxConcurrent > 0;
    }
}

package admit.java.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The endpoint groups the product protects, built from a {@link LimitRegistry}.
 */
public final class AdmissionPolicies {

    public static final String EVIDENCE = "evidence";
    public static final String OUTREACH = "outreach";
    public static final String KIT = "kit";
    public static final String JD_EXTRACT = "jd_extract";
    public static final String URL_FETCH = "url_fetch";
    public static final String AUTH = "auth";

    private final Map<String, AdmissionPolicy> policies;

    private AdmissionPolicies(Map<String, AdmissionPolicy> policies) {
        this.policies = Collections.unmodifiableMap(policies);
    }

    /**
     * LLM-backed groups allow one call in flight per user; URL fetch is limited per user
     * and per IP; auth is limited per IP only.
     */
    public static AdmissionPolicies defaults(LimitRegistry registry) {
        Map<String, AdmissionPolicy> policies = new LinkedHashMap<>();
        put(policies, AdmissionPolicy.perUser(EVIDENCE, "evidence",
            registry.get(LimitRegistry.EVIDENCE_SCAN_PER_USER), 1));
        put(policies, AdmissionPolicy.perUser(OUTREACH, "outreach",
            registry.get(LimitRegistry.OUTREACH_PER_USER), 1));
        put(policies, AdmissionPolicy.perUser(KIT, "kit",
            registry.get(LimitRegistry.KIT_PER_USER), 1));
        put(policies, AdmissionPolicy.perUser(JD_EXTRACT, "jd_extract",
            registry.get(LimitRegistry.JD_EXTRACT_PER_USER), 1));
        put(policies, new AdmissionPolicy(URL_FETCH, "urlfetch",
            registry.get(LimitRegistry.URL_FETCH_PER_USER),
            registry.get(LimitRegistry.URL_FETCH_PER_IP),
            0));
        put(policies, AdmissionPolicy.perIp(AUTH, "auth",
            registry.get(LimitRegistry.AUTH_PER_IP)));
        return new AdmissionPolicies(policies);
    }

    private static void put(Map<String, AdmissionPolicy> policies, AdmissionPolicy policy) {
        policies.put(policy.name(), policy);
    }

    /**
     * @throws IllegalArgumentException if no policy has this name
     */
    public AdmissionPolicy get(String name) {
        AdmissionPolicy policy = policies.get(name);
        if (policy == null) {
            throw new IllegalArgumentException("Unknown endpoint group: " + name);
        }
        return policy;
    }

    public Map<String, AdmissionPolicy> asMap() {
        return policies;
    }
}

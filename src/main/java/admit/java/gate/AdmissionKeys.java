package admit.java.gate;

/**
 * Bucket keys: {@code <prefix>:<dimension>:<identity>}.
 * Two policies with different prefixes never share a bucket, whatever the identity.
 */
public final class AdmissionKeys {

    private AdmissionKeys() {
    }

    public static String ip(String prefix, String ip) {
        return prefix + ":ip:" + ip;
    }

    public static String user(String prefix, String userId) {
        return prefix + ":user:" + userId;
    }

    public static String concurrency(String prefix, String userId) {
        return prefix + ":concurrency:" + userId;
    }
}

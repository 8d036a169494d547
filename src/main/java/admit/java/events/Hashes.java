package admit.java.events;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class Hashes {

    private Hashes() {
    }

    /**
     * First 16 hex chars of SHA-256: enough to correlate events, not reversible.
     *
     * @return the hash, or null for a null value
     */
    public static String shortHash(String value) {
        if (value == null) {
            return null;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            // Every JDK ships SHA-256.
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

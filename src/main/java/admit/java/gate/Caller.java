package admit.java.gate;

/**
 * Who is asking, as supplied by the authentication layer and the transport.
 *
 * @param userId Authenticated user id, null for anonymous callers
 * @param role Caller role; anonymous callers are {@link Role#USER}
 * @param ip Resolved client IP, or "unknown"
 */
public record Caller(String userId, Role role, String ip) {

    public static final String UNKNOWN_IP = "unknown";

    public Caller {
        if (role == null) role = Role.USER;
        if (ip == null || ip.isBlank()) ip = UNKNOWN_IP;
        if (userId != null && userId.isBlank()) userId = null;
    }

    public static Caller anonymous(String ip) {
        return new Caller(null, Role.USER, ip);
    }

    public static Caller user(String userId, String ip) {
        return new Caller(userId, Role.USER, ip);
    }

    public static Caller admin(String userId, String ip) {
        return new Caller(userId, Role.ADMIN, ip);
    }

    public boolean isAuthenticated() {
        return userId != null;
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }
}

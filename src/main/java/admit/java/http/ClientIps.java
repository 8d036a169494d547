package admit.java.http;

import admit.java.gate.Caller;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Client IP resolution for servlet requests.
 *
 * <p>Forwarding headers are not read here. A trusted proxy layer that has already resolved
 * the client address publishes it as the {@link #CLIENT_IP_ATTRIBUTE} request attribute.
 */
public final class ClientIps {

    public static final String CLIENT_IP_ATTRIBUTE = "admit.clientIp";

    private ClientIps() {
    }

    /**
     * Resolved client IP attribute, else the socket's remote address, else "unknown".
     */
    public static String resolve(HttpServletRequest request) {
        Object resolved = request.getAttribute(CLIENT_IP_ATTRIBUTE);
        if (resolved instanceof String ip && !ip.isBlank()) {
            return ip;
        }
        String remote = request.getRemoteAddr();
        if (remote != null && !remote.isBlank()) {
            return remote;
        }
        return Caller.UNKNOWN_IP;
    }
}

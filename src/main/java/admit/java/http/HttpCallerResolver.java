package admit.java.http;

import admit.java.gate.Caller;
import admit.java.gate.Role;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Supplies the caller identity for a servlet request. Authentication itself happens
 * upstream; this only reads what it left behind.
 */
@FunctionalInterface
public interface HttpCallerResolver {

    Caller resolve(HttpServletRequest request, String clientIp);

    /**
     * Treats every request as anonymous: only per-IP limits apply.
     */
    static HttpCallerResolver anonymous() {
        return (request, clientIp) -> Caller.anonymous(clientIp);
    }

    /**
     * Reads the user id and role from request attributes set by an authentication filter.
     * A role value of "admin" (any case) maps to {@link Role#ADMIN}.
     */
    static HttpCallerResolver fromAttributes(String userIdAttribute, String roleAttribute) {
        return (request, clientIp) -> {
            Object userId = request.getAttribute(userIdAttribute);
            Object role = request.getAttribute(roleAttribute);
            Role resolvedRole = role != null && "admin".equalsIgnoreCase(role.toString()) ? Role.ADMIN : Role.USER;
            return new Caller(userId == null ? null : userId.toString(), resolvedRole, clientIp);
        };
    }
}

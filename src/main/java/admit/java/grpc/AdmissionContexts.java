package admit.java.grpc;

import admit.java.gate.Role;
import io.grpc.Context;
import io.grpc.Metadata;

/**
 * Context and metadata keys shared by the gRPC adapter and the interceptors around it.
 */
public final class AdmissionContexts {

    /** Client IP already resolved by a trusted upstream interceptor. */
    public static final Context.Key<String> CLIENT_IP = Context.key("admit-client-ip");

    /** Authenticated user id, set by the authentication interceptor. */
    public static final Context.Key<String> USER_ID = Context.key("admit-user-id");

    /** Caller role, set by the authentication interceptor. */
    public static final Context.Key<Role> ROLE = Context.key("admit-role");

    public static final Metadata.Key<String> RETRY_AFTER =
        Metadata.Key.of("retry-after", Metadata.ASCII_STRING_MARSHALLER);

    public static final Metadata.Key<String> ADMISSION_ERROR =
        Metadata.Key.of("x-admission-error", Metadata.ASCII_STRING_MARSHALLER);

    private AdmissionContexts() {
    }
}

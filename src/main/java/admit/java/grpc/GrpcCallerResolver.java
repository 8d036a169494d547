package admit.java.grpc;

import admit.java.gate.Caller;
import io.grpc.Metadata;
import io.grpc.ServerCall;

/**
 * Supplies the caller identity for an inbound gRPC call.
 */
@FunctionalInterface
public interface GrpcCallerResolver {

    Caller resolve(ServerCall<?, ?> call, Metadata headers, String clientIp);

    static GrpcCallerResolver anonymous() {
        return (call, headers, clientIp) -> Caller.anonymous(clientIp);
    }

    /**
     * Reads {@link AdmissionContexts#USER_ID} and {@link AdmissionContexts#ROLE} from the
     * current context, as left there by an authentication interceptor.
     */
    static GrpcCallerResolver fromContext() {
        return (call, headers, clientIp) -> new Caller(
            AdmissionContexts.USER_ID.get(),
            AdmissionContexts.ROLE.get(),
            clientIp
        );
    }
}

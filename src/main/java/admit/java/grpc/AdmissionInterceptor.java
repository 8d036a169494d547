package admit.java.grpc;

import admit.core.model.RateLimitConfig;
import admit.java.gate.Admission;
import admit.java.gate.AdmissionGate;
import admit.java.gate.Caller;
import admit.java.registry.AdmissionPolicy;
import admit.java.response.RejectionBody;
import io.grpc.ForwardingServerCall;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Grpc;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * gRPC server interceptor that admits or throttles calls to protected methods.
 *
 * <p>Behavior:
 * <ul>
 *   <li>Methods without a policy pass through untouched</li>
 *   <li>Denied calls are closed with {@code RESOURCE_EXHAUSTED}; the description is the
 *       rejection message and the trailers carry {@code retry-after} and
 *       {@code x-admission-error: RATE_LIMITED}. The handler is never started.</li>
 *   <li>Admitted calls keep their concurrency slot until the call is closed or cancelled</li>
 * </ul>
 *
 * <p>Client IP: {@link AdmissionContexts#CLIENT_IP} if an upstream interceptor set it,
 * else the transport's remote address, else "unknown".
 */
public final class AdmissionInterceptor implements ServerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(AdmissionInterceptor.class);

    private final AdmissionGate gate;
    private final Map<String, AdmissionPolicy> policiesByMethod;
    private final GrpcCallerResolver callerResolver;

    private AdmissionInterceptor(Builder builder) {
        this.gate = builder.gate;
        this.callerResolver = builder.callerResolver;
        this.policiesByMethod = Collections.unmodifiableMap(new HashMap<>(builder.policiesByMethod));
    }

    /**
     * @param gate Admission gate shared with the other adapters
     * @param callerResolver Supplies the caller for each call
     * @throws IllegalArgumentException if any parameter is null
     */
    public static Builder builder(AdmissionGate gate, GrpcCallerResolver callerResolver) {
        return new Builder(gate, callerResolver);
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
        ServerCall<ReqT, RespT> call,
        Metadata headers,
        ServerCallHandler<ReqT, RespT> next
    ) {
        AdmissionPolicy policy = policiesByMethod.get(call.getMethodDescriptor().getFullMethodName());
        if (policy == null) {
            return next.startCall(call, headers);
        }

        Caller caller = callerResolver.resolve(call, headers, resolveClientIp(call));
        Admission admission = gate.tryAdmit(policy, caller);

        if (!admission.allowed()) {
            reject(call, admission.rejection());
            return new ServerCall.Listener<ReqT>() { };
        }

        ServerCall<ReqT, RespT> releasingCall = new ForwardingServerCall.SimpleForwardingServerCall<>(call) {
            @Override
            public void close(Status status, Metadata trailers) {
                admission.close();
                super.close(status, trailers);
            }
        };

        ServerCall.Listener<ReqT> delegate;
        try {
            delegate = next.startCall(releasingCall, headers);
        } catch (RuntimeException e) {
            admission.close();
            throw e;
        }

        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<>(delegate) {
            @Override
            public void onCancel() {
                try {
                    super.onCancel();
                } finally {
                    admission.close();
                }
            }

            @Override
            public void onComplete() {
                try {
                    super.onComplete();
                } finally {
                    admission.close();
                }
            }
        };
    }

    private static void reject(ServerCall<?, ?> call, RejectionBody body) {
        log.debug("Throttled {}, retry after {}s",
            call.getMethodDescriptor().getFullMethodName(), body.retryAfterSeconds());
        Metadata trailers = new Metadata();
        trailers.put(AdmissionContexts.RETRY_AFTER, String.valueOf(body.retryAfterSeconds()));
        trailers.put(AdmissionContexts.ADMISSION_ERROR, body.error());
        call.close(Status.RESOURCE_EXHAUSTED.withDescription(body.message()), trailers);
    }

    /**
     * Longest window used by any protected method's policy, or 0 when nothing is protected.
     */
    public long maxWindowMs() {
        long max = 0L;
        for (AdmissionPolicy policy : policiesByMethod.values()) {
            max = Math.max(max, policy.user().map(RateLimitConfig::windowMs).orElse(0L));
            max = Math.max(max, policy.ip().map(RateLimitConfig::windowMs).orElse(0L));
        }
        return max;
    }

    static String resolveClientIp(ServerCall<?, ?> call) {
        String resolved = AdmissionContexts.CLIENT_IP.get();
        if (resolved != null && !resolved.isBlank()) {
            return resolved;
        }
        SocketAddress remote = call.getAttributes().get(Grpc.TRANSPORT_ATTR_REMOTE_ADDR);
        if (remote instanceof InetSocketAddress inet) {
            InetAddress address = inet.getAddress();
            return address != null ? address.getHostAddress() : inet.getHostString();
        }
        return Caller.UNKNOWN_IP;
    }

    public static final class Builder {

        private final AdmissionGate gate;
        private final GrpcCallerResolver callerResolver;
        private final Map<String, AdmissionPolicy> policiesByMethod = new HashMap<>();

        private Builder(AdmissionGate gate, GrpcCallerResolver callerResolver) {
            if (gate == null) {
                throw new IllegalArgumentException("gate cannot be null");
            }
            if (callerResolver == null) {
                throw new IllegalArgumentException("callerResolver cannot be null");
            }
            this.gate = gate;
            this.callerResolver = callerResolver;
        }

        public Builder protect(MethodDescriptor<?, ?> method, AdmissionPolicy policy) {
            if (method == null) {
                throw new IllegalArgumentException("method cannot be null");
            }
            return protect(method.getFullMethodName(), policy);
        }

        /**
         * @param fullMethodName e.g. "pkg.Service/Method"
         * @throws IllegalArgumentException if the method already has a policy
         */
        public Builder protect(String fullMethodName, AdmissionPolicy policy) {
            if (fullMethodName == null || fullMethodName.isBlank()) {
                throw new IllegalArgumentException("fullMethodName cannot be null or blank");
            }
            if (policy == null) {
                throw new IllegalArgumentException("policy cannot be null");
            }
            if (policiesByMethod.putIfAbsent(fullMethodName, policy) != null) {
                throw new IllegalArgumentException("Method already protected: " + fullMethodName);
            }
            return this;
        }

        public AdmissionInterceptor build() {
            return new AdmissionInterceptor(this);
        }
    }
}

package admit.java.grpc;

import admit.core.model.RateLimitConfig;
import admit.core.model.RateLimitResult;
import admit.java.engine.AdmissionEngine;
import admit.java.registry.LimitRegistry;
import admit.proto.AdmissionServiceGrpc;
import admit.proto.CheckRateLimitRequest;
import admit.proto.CheckRateLimitResponse;
import admit.proto.HealthCheckRequest;
import admit.proto.HealthCheckResponse;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * gRPC service exposing the admission engine.
 *
 * <p>This is a thin wrapper over AdmissionEngine with:
 * <ul>
 *   <li>Request validation (fail-fast with INVALID_ARGUMENT)</li>
 *   <li>Resource class lookup in the LimitRegistry</li>
 *   <li>Error handling (INTERNAL for unexpected errors)</li>
 *   <li>Protobuf conversion (RateLimitResult → CheckRateLimitResponse)</li>
 * </ul>
 *
 * <p>Keys are namespaced by resource class, so the same key under two classes uses two
 * independent buckets.
 *
 * <p>Thread-safety: AdmissionEngine handles concurrency internally.
 * This service is stateless and can handle concurrent RPCs.
 */
public final class AdmissionServiceImpl extends AdmissionServiceGrpc.AdmissionServiceImplBase {

    private static final Logger log = LoggerFactory.getLogger(AdmissionServiceImpl.class);

    private final AdmissionEngine engine;
    private final LimitRegistry registry;

    /**
     * @param engine Admission engine (must be thread-safe)
     * @param registry Resource classes callers may check against
     * @throws IllegalArgumentException if any parameter is null
     */
    public AdmissionServiceImpl(AdmissionEngine engine, LimitRegistry registry) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.engine = engine;
        this.registry = registry;
    }

    @Override
    public void checkRateLimit(
        CheckRateLimitRequest request,
        StreamObserver<CheckRateLimitResponse> responseObserver
    ) {
        try {
            // Validation: key (protobuf strings are never null, only empty)
            if (request.getKey().isBlank()) {
                responseObserver.onError(
                    Status.INVALID_ARGUMENT
                        .withDescription("key must not be empty")
                        .asRuntimeException()
                );
                return;
            }

            Optional<RateLimitConfig> config = registry.find(request.getResourceClass());
            if (config.isEmpty()) {
                responseObserver.onError(
                    Status.INVALID_ARGUMENT
                        .withDescription("unknown resource_class: " + request.getResourceClass())
                        .asRuntimeException()
                );
                return;
            }

            RateLimitResult result = engine.check(
                request.getResourceClass() + ":" + request.getKey(),
                config.get()
            );

            CheckRateLimitResponse response = CheckRateLimitResponse.newBuilder()
                .setAllowed(result.allowed())
                .setRetryAfterSeconds(result.retryAfterSeconds())
                .build();

            responseObserver.onNext(response);
            responseObserver.onCompleted();

        } catch (IllegalArgumentException e) {
            responseObserver.onError(
                Status.INVALID_ARGUMENT
                    .withDescription(e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
        } catch (Exception e) {
            log.error("checkRateLimit failed for resource class {}", request.getResourceClass(), e);
            responseObserver.onError(
                Status.INTERNAL
                    .withDescription("Internal error: " + e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
        }
    }

    @Override
    public void healthCheck(
        HealthCheckRequest request,
        StreamObserver<HealthCheckResponse> responseObserver
    ) {
        // Simple health check: if we can respond, we're serving
        HealthCheckResponse response = HealthCheckResponse.newBuilder()
            .setStatus(HealthCheckResponse.Status.SERVING)
            .build();

        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }
}

package admit.java.grpc;

import admit.core.clock.SystemClock;
import admit.java.engine.AdmissionEngine;
import admit.java.engine.WindowSweeper;
import admit.java.registry.LimitRegistry;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.ServerInterceptors;
import io.grpc.ServerServiceDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Standalone gRPC server for the admission service.
 *
 * <p>Features:
 * <ul>
 *   <li>Configurable port (default: 9090)</li>
 *   <li>Graceful shutdown with timeout</li>
 *   <li>Default limit registry, SystemClock for production</li>
 *   <li>Idle-key sweep every 5 minutes, horizon = longest window of the registry and of the
 *       interceptor's policies</li>
 *   <li>Optional protected services, wrapped with an {@link AdmissionInterceptor}</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>
 * // Run with defaults
 * java admit.java.grpc.AdmissionServer
 *
 * // Run with custom port
 * java admit.java.grpc.AdmissionServer 8080
 * </pre>
 */
public final class AdmissionServer {

    private static final Logger log = LoggerFactory.getLogger(AdmissionServer.class);

    private static final int DEFAULT_PORT = 9090;
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Server server;
    private final WindowSweeper sweeper;

    /**
     * Creates a server on the specified port with the default engine and registry.
     *
     * @param port Port to listen on
     */
    public AdmissionServer(int port) {
        this(port, new AdmissionEngine(SystemClock.instance()), LimitRegistry.defaults(), List.of(), null);
    }

    /**
     * Creates a server with a custom engine and extra services.
     *
     * @param port Port to listen on
     * @param engine Admission engine, shared with the interceptor's gate
     * @param registry Resource classes exposed by the admission service
     * @param protectedServices Services to host behind the interceptor
     * @param interceptor Interceptor for protected services (may be null when there are none)
     */
    public AdmissionServer(
        int port,
        AdmissionEngine engine,
        LimitRegistry registry,
        List<ServerServiceDefinition> protectedServices,
        AdmissionInterceptor interceptor
    ) {
        if (!protectedServices.isEmpty() && interceptor == null) {
            throw new IllegalArgumentException("interceptor required for protected services");
        }
        ServerBuilder<?> builder = ServerBuilder.forPort(port)
            .addService(new AdmissionServiceImpl(engine, registry));
        for (ServerServiceDefinition service : protectedServices) {
            builder.addService(ServerInterceptors.intercept(service, interceptor));
        }
        this.server = builder.build();
        this.sweeper = new WindowSweeper(engine, sweepHorizonMs(registry, interceptor), WindowSweeper.DEFAULT_INTERVAL);
    }

    /**
     * The engine is shared by the admission service and the interceptor's gate, so the
     * sweep must not drop timestamps that either of them still counts.
     */
    static long sweepHorizonMs(LimitRegistry registry, AdmissionInterceptor interceptor) {
        long horizon = registry.maxWindowMs();
        if (interceptor != null) {
            horizon = Math.max(horizon, interceptor.maxWindowMs());
        }
        return horizon;
    }

    /**
     * Starts the server.
     *
     * @throws IOException if server fails to start
     */
    public void start() throws IOException {
        server.start();
        sweeper.start();
        log.info("AdmissionServer started on port: {}", server.getPort());

        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down gRPC server (JVM shutdown hook)...");
            try {
                AdmissionServer.this.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Shutdown interrupted", e);
            }
        }));
    }

    /**
     * Stops the server gracefully.
     *
     * @throws InterruptedException if shutdown is interrupted
     */
    public void stop() throws InterruptedException {
        sweeper.close();
        server.shutdown().awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        log.info("AdmissionServer stopped.");
    }

    /**
     * Blocks until server is terminated.
     *
     * @throws InterruptedException if waiting is interrupted
     */
    public void blockUntilShutdown() throws InterruptedException {
        server.awaitTermination();
    }

    /**
     * Returns the port the server is listening on.
     *
     * @return port number, or -1 if not started
     */
    public int getPort() {
        return server.getPort();
    }

    /**
     * Main entry point.
     *
     * @param args Optional: port number
     * @throws IOException if server fails to start
     * @throws InterruptedException if server is interrupted
     */
    public static void main(String[] args) throws IOException, InterruptedException {
        int port = DEFAULT_PORT;

        if (args.length > 0) {
            try {
                port = Integer.parseInt(args[0]);
            } catch (NumberFormatException e) {
                log.error("Invalid port: {}", args[0]);
                System.exit(1);
            }
        }

        AdmissionServer server = new AdmissionServer(port);
        server.start();
        server.blockUntilShutdown();
    }
}

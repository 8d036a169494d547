package admit.java.grpc;

import admit.core.clock.ManualClock;
import admit.core.model.RateLimitConfig;
import admit.java.engine.AdmissionEngine;
import admit.java.engine.ConcurrencyStore;
import admit.java.gate.AdmissionBypass;
import admit.java.gate.AdmissionGate;
import admit.java.registry.AdmissionPolicy;
import admit.java.registry.LimitRegistry;
import admit.testing.proto.GatedServiceGrpc;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AdmissionServerTest {

    @Test
    void testSweepHorizon_registryOnly() {
        assertEquals(3_600_000L, AdmissionServer.sweepHorizonMs(LimitRegistry.defaults(), null));
    }

    @Test
    void testSweepHorizon_coversLongerInterceptorWindow() {
        AdmissionGate gate = new AdmissionGate(
            new AdmissionEngine(new ManualClock(0L)), new ConcurrencyStore(), new AdmissionBypass());
        AdmissionInterceptor interceptor = AdmissionInterceptor.builder(gate, GrpcCallerResolver.anonymous())
            .protect(GatedServiceGrpc.getScanEvidenceMethod(),
                AdmissionPolicy.perUser("scan", "scan", new RateLimitConfig(5, 86_400_000L), 1))
            .build();

        assertEquals(86_400_000L, AdmissionServer.sweepHorizonMs(LimitRegistry.defaults(), interceptor));
    }

    @Test
    void testSweepHorizon_keepsLongerRegistryWindow() {
        AdmissionGate gate = new AdmissionGate(
            new AdmissionEngine(new ManualClock(0L)), new ConcurrencyStore(), new AdmissionBypass());
        AdmissionInterceptor interceptor = AdmissionInterceptor.builder(gate, GrpcCallerResolver.anonymous())
            .protect(GatedServiceGrpc.getLoginMethod(),
                AdmissionPolicy.perIp("auth", "auth", new RateLimitConfig(2, 60_000L)))
            .build();

        assertEquals(3_600_000L, AdmissionServer.sweepHorizonMs(LimitRegistry.defaults(), interceptor));
    }

    @Test
    void testProtectedServicesWithoutInterceptor_fail() {
        AdmissionEngine engine = new AdmissionEngine(new ManualClock(0L));

        assertThrows(IllegalArgumentException.class, () -> new AdmissionServer(
            0, engine, LimitRegistry.defaults(),
            List.of(new GatedServiceGrpc.GatedServiceImplBase() { }.bindService()), null));
    }
}

package com.mimecast.forwarder.metrics;

import com.mimecast.forwarder.error.FailureKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ForwarderMetricsTest {

    @AfterEach
    void tearDown() {
        MetricsRegistry.register(null);
    }

    @Test
    void testNoRegistryIsNoop() {
        MetricsRegistry.register(null);

        assertDoesNotThrow(() -> {
            ForwarderMetrics.initialize();
            ForwarderMetrics.incrementForwarded(true);
            ForwarderMetrics.incrementSkipped();
            ForwarderMetrics.incrementAttemptFailed(FailureKind.DELIVERY);
            ForwarderMetrics.incrementCycle(true);
        });
        assertEquals(0.0, ForwarderMetrics.total(ForwarderMetrics.FORWARDED));
    }

    @Test
    void testInitializeRegistersZeroCounters() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MetricsRegistry.register(registry);

        ForwarderMetrics.initialize();

        assertNotNull(registry.find(ForwarderMetrics.FORWARDED).counter());
        assertNotNull(registry.find(ForwarderMetrics.DEGRADED).counter());
        assertNotNull(registry.find(ForwarderMetrics.SKIPPED).counter());
        assertEquals(0.0, ForwarderMetrics.total(ForwarderMetrics.FORWARDED));
    }

    @Test
    void testCounters() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MetricsRegistry.register(registry);

        ForwarderMetrics.incrementForwarded(false);
        ForwarderMetrics.incrementForwarded(true);
        ForwarderMetrics.incrementSkipped();
        ForwarderMetrics.incrementAttemptFailed(FailureKind.PROTOCOL);
        ForwarderMetrics.incrementAttemptFailed(FailureKind.PROTOCOL);
        ForwarderMetrics.incrementAttemptFailed(FailureKind.CONNECTION);
        ForwarderMetrics.incrementCycle(true);
        ForwarderMetrics.incrementCycle(false);

        assertEquals(2.0, ForwarderMetrics.total(ForwarderMetrics.FORWARDED));
        assertEquals(1.0, ForwarderMetrics.total(ForwarderMetrics.DEGRADED));
        assertEquals(1.0, ForwarderMetrics.total(ForwarderMetrics.SKIPPED));
        assertEquals(3.0, ForwarderMetrics.total(ForwarderMetrics.ATTEMPTS_FAILED));
        assertEquals(2.0, registry.get(ForwarderMetrics.ATTEMPTS_FAILED).tag("kind", "protocol").counter().count());
        assertEquals(1.0, registry.get(ForwarderMetrics.CYCLES).tag("outcome", "aborted").counter().count());
        assertEquals(1.0, registry.get(ForwarderMetrics.CYCLES).tag("outcome", "completed").counter().count());
    }

    @Test
    void testRegisterAndGet() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();

        MetricsRegistry.register(registry);
        assertSame(registry, MetricsRegistry.getRegistry());

        MetricsRegistry.register(null);
        assertNull(MetricsRegistry.getRegistry());
    }
}

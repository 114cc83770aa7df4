package com.mimecast.forwarder.metrics;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Global access to the metric registry.
 */
public final class MetricsRegistry {
    private static volatile MeterRegistry registry;

    /**
     * Private constructor for utility class.
     */
    private MetricsRegistry() {
    }

    /**
     * Register the metric registry.
     *
     * @param meterRegistry Registry or null to disable metrics.
     */
    public static void register(MeterRegistry meterRegistry) {
        registry = meterRegistry;
    }

    /**
     * Get the registry.
     *
     * @return MeterRegistry or null if none was registered.
     */
    public static MeterRegistry getRegistry() {
        return registry;
    }
}

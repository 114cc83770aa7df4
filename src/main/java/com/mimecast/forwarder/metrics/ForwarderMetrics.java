package com.mimecast.forwarder.metrics;

import com.mimecast.forwarder.error.FailureKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Forwarding Micrometer metrics.
 *
 * <p>Counters for forwarded, degraded and skipped messages, failed attempts by kind and cycles by outcome.
 * <br>Every method is a no-op while no registry is registered.
 */
public final class ForwarderMetrics {
    private static final Logger log = LogManager.getLogger(ForwarderMetrics.class);

    public static final String FORWARDED = "forwarder.messages.forwarded";
    public static final String DEGRADED = "forwarder.messages.degraded";
    public static final String SKIPPED = "forwarder.messages.skipped";
    public static final String ATTEMPTS_FAILED = "forwarder.attempts.failed";
    public static final String CYCLES = "forwarder.cycles";

    /**
     * Private constructor for utility class.
     */
    private ForwarderMetrics() {
    }

    /**
     * Initialize all untagged counters with zero values.
     */
    public static void initialize() {
        MeterRegistry registry = MetricsRegistry.getRegistry();
        if (registry == null) {
            log.warn("Cannot initialize forwarder metrics - registry is null");
            return;
        }

        counter(registry, FORWARDED, "Messages relayed");
        counter(registry, DEGRADED, "Messages relayed without attachments");
        counter(registry, SKIPPED, "Messages skipped after exhausting attempts");
        log.info("Forwarder metrics initialized");
    }

    /**
     * Increment the forwarded counter, and the degraded counter when the forward was degraded.
     *
     * @param degraded Forward was text only.
     */
    public static void incrementForwarded(boolean degraded) {
        increment(FORWARDED, "Messages relayed");
        if (degraded) {
            increment(DEGRADED, "Messages relayed without attachments");
        }
    }

    /**
     * Increment the skipped counter.
     */
    public static void incrementSkipped() {
        increment(SKIPPED, "Messages skipped after exhausting attempts");
    }

    /**
     * Increment the failed attempt counter.
     *
     * @param kind Failure kind.
     */
    public static void incrementAttemptFailed(FailureKind kind) {
        increment(ATTEMPTS_FAILED, "Failed forwarding attempts", "kind", kind.name().toLowerCase());
    }

    /**
     * Increment the cycle counter.
     *
     * @param completed Cycle completed, false if it aborted.
     */
    public static void incrementCycle(boolean completed) {
        increment(CYCLES, "Forwarding cycles", "outcome", completed ? "completed" : "aborted");
    }

    /**
     * Sum of a counter across all its tags.
     *
     * @param name Counter name.
     * @return Count or 0 when no registry is registered.
     */
    public static double total(String name) {
        MeterRegistry registry = MetricsRegistry.getRegistry();
        if (registry == null) {
            return 0;
        }

        return registry.find(name).counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }

    private static void increment(String name, String description, String... tags) {
        MeterRegistry registry = MetricsRegistry.getRegistry();
        if (registry == null) {
            return;
        }

        try {
            counter(registry, name, description, tags).increment();
        } catch (RuntimeException e) {
            log.warn("Failed to increment {} counter: {}", name, e.getMessage());
        }
    }

    private static Counter counter(MeterRegistry registry, String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(tags)
                .register(registry);
    }
}

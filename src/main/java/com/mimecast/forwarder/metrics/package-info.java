/**
 * Micrometer metrics.
 *
 * <p>{@link com.mimecast.forwarder.metrics.MetricsRegistry} holds the process wide registry
 * and {@link com.mimecast.forwarder.metrics.ForwarderMetrics} records forwarding outcomes on it.
 */
package com.mimecast.forwarder.metrics;

/**
 * Metrics adapters bridging {@link org.lofarimaging.realtime.application.port.MetricsPort} to OpenTelemetry or to
 * a no-op sink.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe and cache instruments per metric key.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code observe.*} namespace.</p>
 */
package org.lofarimaging.realtime.infrastructure.metrics;

/**
 * Metrics adapters bridging {@link io.lexlink.courier.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code conversation.*} namespace.</p>
 * <p><strong>Security:</strong> Only counts and latencies are exported; never message text or credentials.</p>
 */
package io.lexlink.courier.infrastructure.metrics;

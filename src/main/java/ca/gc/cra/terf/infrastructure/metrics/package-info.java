/**
 * Metrics adapters that bridge {@link ca.gc.cra.terf.application.port.MetricsPort} to OpenTelemetry
 * or discard updates.
 * <p><strong>Metrics:</strong> Publishes under the {@code build.*} and {@code aggregate.*}
 * namespaces. Only counts leave the process; image bytes and labels never do.</p>
 */
package ca.gc.cra.terf.infrastructure.metrics;

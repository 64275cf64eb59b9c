/**
 * Logging bootstrap for the terf CLIs.
 * <p><strong>Concurrency:</strong> Level changes happen once at startup; not meant for concurrent use.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.terf.logging;

/**
 * Ports the use cases depend on: metadata tables, image conversion and metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.terf.application.port;

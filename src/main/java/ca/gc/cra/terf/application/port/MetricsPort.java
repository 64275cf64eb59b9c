package ca.gc.cra.terf.application.port;

/**
 * <strong>What:</strong> Port for counting pipeline events without binding to a metrics SDK.
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter} and
 * {@code NoOpMetricsAdapter}; used by the build and aggregation pipelines.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from every
 * worker thread.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g.,
 * {@code build.rows.skipped.conversion}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name (e.g., {@code build.records.written}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param value observed value; units are defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}

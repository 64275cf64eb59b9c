package ca.gc.cra.terf.infrastructure.metrics;

import ca.gc.cra.terf.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards pipeline counters and observations to OpenTelemetry.
 *
 * <p>Instruments are created lazily, one per metric key, and shared by every worker thread. Call
 * {@link #close()} when the job ends so the last export interval is not lost.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("terf.metric.key");

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the environment-configured exporter.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.debug("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(key, this::createCounter).add(1, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    histograms.computeIfAbsent(key, this::createHistogram)
        .record(value, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  /** Flushes pending measurements and shuts the meter provider down. */
  @Override
  public void close() {
    bootstrap.forceFlush();
    bootstrap.close();
  }

  private LongCounter createCounter(String key) {
    return meter.counterBuilder(metricName(key))
        .setUnit("1")
        .setDescription("terf counter for " + key)
        .build();
  }

  private LongHistogram createHistogram(String key) {
    return meter.histogramBuilder(metricName(key))
        .ofLongs()
        .setDescription("terf observation for " + key)
        .build();
  }

  static String metricName(String key) {
    String trimmed = key.trim();
    if (trimmed.isEmpty()) {
      return "terf.metric";
    }
    StringBuilder result = new StringBuilder(trimmed.length() + 1);
    if (!Character.isLetter(trimmed.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }
}

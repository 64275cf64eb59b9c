package ca.gc.cra.terf.config;

import ca.gc.cra.terf.application.pipeline.BuildUseCase;
import ca.gc.cra.terf.application.pipeline.ExtractUseCase;
import ca.gc.cra.terf.application.pipeline.SummaryUseCase;
import ca.gc.cra.terf.application.port.MetadataTable;
import ca.gc.cra.terf.application.port.MetricsPort;
import ca.gc.cra.terf.infrastructure.csv.CsvMetadataTable;
import ca.gc.cra.terf.infrastructure.image.ImageIoConverter;
import ca.gc.cra.terf.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires terf use cases to their adapters.
 * <p><strong>Role:</strong> The only place that names concrete adapters: {@link CsvMetadataTable} for
 * metadata tables, {@link ImageIoConverter} for images and {@link OpenTelemetryMetricsAdapter} for
 * metrics.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Construct one use case per CLI run from its validated config record.</li>
 *   <li>Own the metrics adapter and flush it on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct and use on the CLI thread; the use cases it creates
 * manage their own workers.</p>
 *
 * @since 0.1.0
 * @see BuildUseCase
 * @see ExtractUseCase
 * @see SummaryUseCase
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final MetricsPort metrics;

  /**
   * Creates a composition root backed by the OpenTelemetry metrics adapter. Call after the
   * {@code otel.*} system properties have been applied.
   */
  public CompositionRoot() {
    this(new OpenTelemetryMetricsAdapter());
  }

  /**
   * Creates a composition root with an explicit metrics adapter.
   *
   * @param metricsPort metrics adapter used by constructed use cases; must not be {@code null}
   */
  public CompositionRoot(MetricsPort metricsPort) {
    this.metrics = Objects.requireNonNull(metricsPort, "metricsPort");
  }

  public BuildUseCase buildUseCase(BuildConfig config) {
    Objects.requireNonNull(config, "config");
    return new BuildUseCase(config, metadataTable(), new ImageIoConverter(config.normalizeJpeg()), metrics);
  }

  public ExtractUseCase extractUseCase(ExtractConfig config) {
    Objects.requireNonNull(config, "config");
    return new ExtractUseCase(config, metadataTable(), metrics);
  }

  public SummaryUseCase summaryUseCase(SummaryConfig config) {
    Objects.requireNonNull(config, "config");
    return new SummaryUseCase(config, metrics);
  }

  /** Flushes and releases the metrics adapter when it holds resources. */
  @Override
  public void close() {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }

  private MetadataTable metadataTable() {
    return new CsvMetadataTable();
  }
}

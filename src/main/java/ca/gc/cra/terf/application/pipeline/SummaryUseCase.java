package ca.gc.cra.terf.application.pipeline;

import ca.gc.cra.terf.application.port.MetricsPort;
import ca.gc.cra.terf.config.SummaryConfig;
import ca.gc.cra.terf.domain.dataset.DatasetStats;
import ca.gc.cra.terf.infrastructure.codec.FrameReader;
import ca.gc.cra.terf.infrastructure.codec.FrameStreams;
import ca.gc.cra.terf.infrastructure.example.ImageExamples;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts the records of a dataset by label, source, format and colorspace.
 *
 * <p>Each file is summarized on a worker thread into its own {@link DatasetStats}; the per-file
 * stats are merged on the calling thread. Image bytes are skipped while decoding. Any unreadable or
 * corrupt file fails the whole summary and no partial statistics are returned.</p>
 *
 * @since 0.1.0
 */
public final class SummaryUseCase {
  private static final Logger log = LoggerFactory.getLogger(SummaryUseCase.class);

  private final SummaryConfig config;
  private final MetricsPort metrics;

  public SummaryUseCase(SummaryConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Summarizes {@link SummaryConfig#input()}.
   *
   * @return merged statistics over every file
   * @throws IOException if a file cannot be read or holds a corrupt frame or payload
   * @throws Exception the first failure raised by any task
   */
  public DatasetStats run() throws Exception {
    DatasetStats.Builder total = DatasetStats.builder();
    FileAggregationPipeline<DatasetStats> pipeline =
        new FileAggregationPipeline<>("summary", config.threads(), metrics);
    int files = pipeline.run(config.input(), this::summarize, total::addAll);
    DatasetStats stats = total.build();
    log.info("Summarized {} record(s) from {} file(s) under {}", stats.total(), files, config.input());
    return stats;
  }

  DatasetStats summarize(Path file) throws IOException {
    DatasetStats.Builder stats = DatasetStats.builder();
    long records = 0;
    try (FrameReader reader = FrameStreams.open(file, config.compressed())) {
      Optional<byte[]> payload;
      while ((payload = reader.next()).isPresent()) {
        stats.add(ImageExamples.decodeMetadata(payload.get()));
        metrics.increment("aggregate.records.read");
        records++;
      }
    }
    if (config.verbose()) {
      log.info("Read {} record(s) from {}", records, file.getFileName());
    } else {
      log.debug("Read {} record(s) from {}", records, file.getFileName());
    }
    return stats.build();
  }
}

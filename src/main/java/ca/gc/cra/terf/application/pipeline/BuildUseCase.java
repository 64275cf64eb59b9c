package ca.gc.cra.terf.application.pipeline;

import ca.gc.cra.terf.application.port.ImageConverter;
import ca.gc.cra.terf.application.port.MetadataTable;
import ca.gc.cra.terf.application.port.MetricsPort;
import ca.gc.cra.terf.config.BuildConfig;
import ca.gc.cra.terf.domain.image.ImageRecord;
import ca.gc.cra.terf.domain.shard.RecoverableRowException;
import ca.gc.cra.terf.domain.shard.ResourceConversionException;
import ca.gc.cra.terf.domain.shard.RowDescriptor;
import ca.gc.cra.terf.domain.shard.RowParseException;
import ca.gc.cra.terf.domain.shard.Shard;
import ca.gc.cra.terf.domain.shard.ShardAccumulator;
import ca.gc.cra.terf.infrastructure.codec.FrameStreams;
import ca.gc.cra.terf.infrastructure.codec.FrameWriter;
import ca.gc.cra.terf.infrastructure.example.ImageExamples;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Shards a metadata table and the images it references into frame files named
 * {@code {name}-{id:05d}-of-{total:05d}}.
 * <p><strong>Role:</strong> Application use case behind the {@code build} command.</p>
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>First pass: count the data rows to fix the shard total.</li>
 *   <li>Second pass, one producer task: parse rows in order, group them with a
 *       {@link ShardAccumulator} and put each completed {@link Shard} on a {@link BoundedHandoff}.</li>
 *   <li>Worker tasks: take a shard, create its file, convert every row through the
 *       {@link ImageConverter} and write one Example frame per image.</li>
 * </ol>
 * <p><strong>Errors:</strong> rows that do not parse or whose image cannot be converted are logged at
 * WARN, counted and skipped. Any other failure (unreadable table, shard file that cannot be created
 * or written) cancels every task and is rethrown by {@link #run()}.</p>
 * <p><strong>Thread-safety:</strong> {@link #run()} may be called once per instance.</p>
 * <p><strong>Observability:</strong> {@code build.rows.skipped.parse},
 * {@code build.rows.skipped.conversion}, {@code build.records.written}, {@code build.shards.written}.</p>
 *
 * @since 0.1.0
 */
public final class BuildUseCase {
  private static final Logger log = LoggerFactory.getLogger(BuildUseCase.class);

  private final BuildConfig config;
  private final MetadataTable table;
  private final ImageConverter converter;
  private final MetricsPort metrics;

  private final CancellationSignal signal = new CancellationSignal();
  private final LongAdder parseSkips = new LongAdder();
  private final LongAdder conversionSkips = new LongAdder();
  private final LongAdder recordsWritten = new LongAdder();
  private final AtomicInteger shardsWritten = new AtomicInteger();

  /**
   * Creates the build use case.
   *
   * @param config validated build settings
   * @param table reader for the metadata table
   * @param converter image loader shared by all workers
   * @param metrics metrics sink
   */
  public BuildUseCase(BuildConfig config, MetadataTable table, ImageConverter converter, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.table = Objects.requireNonNull(table, "table");
    this.converter = Objects.requireNonNull(converter, "converter");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs the build to completion.
   *
   * @return counts of what was written and skipped
   * @throws IOException if the table has no data rows, cannot be read, or a shard cannot be written
   * @throws InterruptedException if the calling thread is interrupted
   * @throws Exception the first failure raised by any task
   */
  public BuildReport run() throws Exception {
    MDC.put("build.in", config.input().toString());
    try {
      long totalRows = table.countRows(config.input());
      if (totalRows == 0) {
        throw new IOException("No rows found in " + config.input());
      }
      ShardAccumulator accumulator = new ShardAccumulator(totalRows, config.perShard());
      int workers = Math.min(config.threads(), accumulator.totalShards());
      log.info("Building {} shard(s) of up to {} records from {} rows with {} worker(s) into {}",
          accumulator.totalShards(), config.perShard(), totalRows, workers, config.outputDirectory());

      BoundedHandoff<Shard> shards = new BoundedHandoff<>(workers, workers, signal);
      try (TaskGroup group = new TaskGroup("build", workers + 1, signal)) {
        group.submit(() -> produce(accumulator, shards));
        for (int i = 0; i < workers; i++) {
          group.submit(() -> consume(shards));
        }
        group.await();
      }

      BuildReport report = new BuildReport(
          shardsWritten.get(), recordsWritten.sum(), parseSkips.sum(), conversionSkips.sum());
      if (report.shardsWritten() < accumulator.totalShards()) {
        log.warn("Wrote {} of {} planned shard(s); unparseable rows left the trailing shard id(s) empty",
            report.shardsWritten(), accumulator.totalShards());
      }
      log.info("Build complete: {} shard(s), {} record(s) written, {} row(s) skipped ({} unparseable, {} unconvertible)",
          report.shardsWritten(), report.recordsWritten(), report.rowsSkipped(),
          report.rowsSkippedParse(), report.rowsSkippedConversion());
      return report;
    } finally {
      MDC.remove("build.in");
    }
  }

  private void produce(ShardAccumulator accumulator, BoundedHandoff<Shard> shards) throws Exception {
    try (MetadataTable.RowCursor cursor = table.read(config.input())) {
      while (true) {
        signal.throwIfCancelled();
        Optional<RowDescriptor> row;
        try {
          row = cursor.next();
        } catch (RowParseException ex) {
          skip(ex, "build.rows.skipped.parse", parseSkips);
          continue;
        }
        if (row.isEmpty()) {
          break;
        }
        Optional<Shard> completed = accumulator.accumulate(row.get());
        if (completed.isPresent()) {
          shards.put(completed.get());
        }
      }
    }
    Optional<Shard> last = accumulator.flush();
    if (last.isPresent()) {
      shards.put(last.get());
    }
    shards.close();
  }

  private void consume(BoundedHandoff<Shard> shards) throws Exception {
    while (true) {
      Optional<Shard> next = shards.take();
      if (next.isEmpty()) {
        return;
      }
      writeShard(next.get());
    }
  }

  private void writeShard(Shard shard) throws IOException {
    Path file = config.outputDirectory().resolve(shard.fileName(config.name()));
    long written = 0;
    try (FrameWriter writer = FrameStreams.create(file, config.compress(), config.allowOverwrite())) {
      for (RowDescriptor row : shard.rows()) {
        signal.throwIfCancelled();
        ImageRecord image;
        try {
          image = converter.convert(row);
        } catch (ResourceConversionException ex) {
          skip(ex, "build.rows.skipped.conversion", conversionSkips);
          continue;
        }
        writer.write(ImageExamples.encode(image));
        written++;
        metrics.increment("build.records.written");
      }
    }
    recordsWritten.add(written);
    shardsWritten.incrementAndGet();
    metrics.increment("build.shards.written");
    progress("Wrote shard {} ({} of {} rows converted)", file.getFileName(), written, shard.size());
  }

  private void skip(RecoverableRowException ex, String metric, LongAdder counter) {
    counter.increment();
    metrics.increment(metric);
    log.warn("Skipping row: {}", ex.getMessage());
  }

  private void progress(String message, Object... args) {
    if (config.verbose()) {
      log.info(message, args);
    } else {
      log.debug(message, args);
    }
  }
}

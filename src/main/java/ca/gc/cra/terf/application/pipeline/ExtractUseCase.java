package ca.gc.cra.terf.application.pipeline;

import ca.gc.cra.terf.application.port.MetadataTable;
import ca.gc.cra.terf.application.port.MetricsPort;
import ca.gc.cra.terf.config.ExtractConfig;
import ca.gc.cra.terf.domain.image.ImageRecord;
import ca.gc.cra.terf.infrastructure.codec.FrameReader;
import ca.gc.cra.terf.infrastructure.codec.FrameStreams;
import ca.gc.cra.terf.infrastructure.example.ImageExamples;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes every image stored in a dataset back to disk together with an
 * {@value #INFO_FILE} metadata table.
 * <p><strong>Flow:</strong> workers decode one file each, writing images to
 * {@code {out}/{image name}} as they go; the calling thread appends one table row per image. The
 * table is written to a temporary file and only renamed to {@value #INFO_FILE} once every file has
 * been extracted, so a failed run never leaves a partial table behind.</p>
 * <p><strong>Errors:</strong> the first unreadable or corrupt file cancels the job. A dataset with no
 * images is an error.</p>
 *
 * @since 0.1.0
 */
public final class ExtractUseCase {
  private static final Logger log = LoggerFactory.getLogger(ExtractUseCase.class);

  /** Name of the regenerated metadata table. */
  public static final String INFO_FILE = "info.csv";

  private final ExtractConfig config;
  private final MetadataTable table;
  private final MetricsPort metrics;
  private long extracted;

  public ExtractUseCase(ExtractConfig config, MetadataTable table, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.table = Objects.requireNonNull(table, "table");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Extracts {@link ExtractConfig#input()} into {@link ExtractConfig#outputDirectory()}.
   *
   * @return number of images extracted
   * @throws IOException if a file cannot be read or written, holds a corrupt frame, or the dataset
   *     holds no images
   * @throws Exception the first failure raised by any task
   */
  public long run() throws Exception {
    Path outputDirectory = config.outputDirectory();
    Files.createDirectories(outputDirectory);
    Path tempTable = Files.createTempFile(outputDirectory, ".info-", ".csv.tmp");
    boolean published = false;
    try {
      int files;
      try (MetadataTable.TableWriter writer = table.write(tempTable)) {
        FileAggregationPipeline<List<ImageRecord>> pipeline =
            new FileAggregationPipeline<>("extract", config.threads(), metrics);
        files = pipeline.run(config.input(), this::extractFile, images -> appendRows(writer, images));
      }
      if (extracted == 0) {
        throw new IOException("No images found in " + config.input());
      }
      Files.move(tempTable, outputDirectory.resolve(INFO_FILE), StandardCopyOption.REPLACE_EXISTING);
      published = true;
      log.info("Extracted {} image(s) from {} file(s) into {}", extracted, files, outputDirectory);
      return extracted;
    } finally {
      if (!published) {
        discard(tempTable);
      }
    }
  }

  List<ImageRecord> extractFile(Path file) throws IOException {
    List<ImageRecord> images = new ArrayList<>();
    try (FrameReader reader = FrameStreams.open(file, config.compressed())) {
      Optional<byte[]> payload;
      while ((payload = reader.next()).isPresent()) {
        ImageRecord image = ImageExamples.decode(payload.get());
        Files.write(target(image), image.encoded());
        metrics.increment("aggregate.records.read");
        images.add(image.withoutEncoding());
      }
    }
    if (config.verbose()) {
      log.info("Extracted {} image(s) from {}", images.size(), file.getFileName());
    } else {
      log.debug("Extracted {} image(s) from {}", images.size(), file.getFileName());
    }
    return images;
  }

  private Path target(ImageRecord image) throws IOException {
    Path outputDirectory = config.outputDirectory();
    Path target = outputDirectory.resolve(image.name()).normalize();
    if (!outputDirectory.equals(target.getParent())) {
      throw new IOException("Image name escapes the output directory: " + image.name());
    }
    return target;
  }

  private void appendRows(MetadataTable.TableWriter writer, List<ImageRecord> images) throws IOException {
    for (ImageRecord image : images) {
      writer.writeRow(image.toCsvRow(config.outputDirectory()));
      extracted++;
    }
  }

  private static void discard(Path tempTable) {
    try {
      Files.deleteIfExists(tempTable);
    } catch (IOException ex) {
      log.warn("Unable to remove temporary table {}", tempTable, ex);
    }
  }
}

package ca.gc.cra.terf.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.terf.application.port.MetricsPort;
import ca.gc.cra.terf.config.BuildConfig;
import ca.gc.cra.terf.config.SummaryConfig;
import ca.gc.cra.terf.domain.dataset.DatasetStats;
import ca.gc.cra.terf.infrastructure.codec.FramingException;
import ca.gc.cra.terf.infrastructure.csv.CsvMetadataTable;
import ca.gc.cra.terf.infrastructure.image.ImageIoConverter;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SummaryUseCaseTest {
  @TempDir Path tempDir;

  private Path dataset;

  @BeforeEach
  void buildDataset() throws Exception {
    Path table = DatasetFixtures.writeTable(tempDir, DatasetFixtures.writePng(tempDir, "a.png"), 2500);
    dataset = DatasetFixtures.directory(tempDir, "dataset");
    new BuildUseCase(
        new BuildConfig(table, dataset, "train", 1024, 3, false, false, false, false),
        new CsvMetadataTable(), new ImageIoConverter(false), MetricsPort.NO_OP).run();
  }

  @Test
  void countsEveryRecordOfADirectory() throws Exception {
    DatasetFixtures.RecordingMetrics metrics = new DatasetFixtures.RecordingMetrics();

    DatasetStats stats = new SummaryUseCase(new SummaryConfig(dataset, 4, false, false), metrics).run();

    assertEquals(2500, stats.total());
    assertEquals(Map.of("label-0", 834L, "label-1", 833L, "label-2", 833L), stats.labelText());
    assertEquals(Map.of(0L, 834L, 1L, 833L, 2L, 833L), stats.labelId());
    assertEquals(Map.of(100L, 834L, 101L, 833L, 102L, 833L), stats.labelRaw());
    assertEquals(Map.of(7L, 2500L), stats.source());
    assertEquals(Map.of("PNG", 2500L), stats.format());
    assertEquals(Map.of("RGB", 2500L), stats.colorspace());
    assertEquals(2500, metrics.count("aggregate.records.read"));
    assertEquals(3, metrics.count("aggregate.files.processed"));
  }

  @Test
  void resultDoesNotDependOnThreadCount() throws Exception {
    DatasetStats single = new SummaryUseCase(new SummaryConfig(dataset, 1, false, false), MetricsPort.NO_OP).run();
    DatasetStats many = new SummaryUseCase(new SummaryConfig(dataset, 8, false, false), MetricsPort.NO_OP).run();

    assertEquals(single, many);
  }

  @Test
  void perFileFoldMatchesOneConcatenatedStream() throws Exception {
    Path joined = tempDir.resolve("all.tfrecord");
    try (OutputStream out = Files.newOutputStream(joined)) {
      for (int id = 1; id <= 3; id++) {
        Files.copy(dataset.resolve(String.format("train-%05d-of-00003", id)), out);
      }
    }

    DatasetStats perFile = new SummaryUseCase(new SummaryConfig(dataset, 3, false, false), MetricsPort.NO_OP).run();
    DatasetStats concatenated = new SummaryUseCase(new SummaryConfig(joined, 3, false, false), MetricsPort.NO_OP).run();

    assertEquals(2500, concatenated.total());
    assertEquals(concatenated, perFile);
  }

  @Test
  void acceptsASingleFile() throws Exception {
    Path last = dataset.resolve("train-00003-of-00003");

    DatasetStats stats = new SummaryUseCase(new SummaryConfig(last, 2, false, false), MetricsPort.NO_OP).run();

    assertEquals(452, stats.total());
  }

  @Test
  void corruptFileFailsTheWholeSummary() throws Exception {
    Path shard = dataset.resolve("train-00002-of-00003");
    byte[] bytes = Files.readAllBytes(shard);
    bytes[12] ^= 0x01;
    Files.write(shard, bytes);

    FramingException ex = assertThrows(FramingException.class,
        () -> new SummaryUseCase(new SummaryConfig(dataset, 2, false, false), MetricsPort.NO_OP).run());
    assertEquals(FramingException.Kind.INVALID_PAYLOAD_CHECKSUM, ex.kind());
    assertEquals(0, ex.frameIndex());
  }
}

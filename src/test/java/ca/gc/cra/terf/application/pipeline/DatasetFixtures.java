package ca.gc.cra.terf.application.pipeline;

import ca.gc.cra.terf.application.port.MetricsPort;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import javax.imageio.ImageIO;

/** Builds small on-disk datasets for pipeline tests. */
final class DatasetFixtures {
  static final String HEADER = "image_path,image_id,label_id,label_text,label_raw,source\n";

  private DatasetFixtures() {}

  static Path writePng(Path dir, String name) throws IOException {
    BufferedImage image = new BufferedImage(4, 3, BufferedImage.TYPE_INT_RGB);
    image.setRGB(1, 1, Color.ORANGE.getRGB());
    Path file = dir.resolve(name);
    if (!ImageIO.write(image, "png", file.toFile())) {
      throw new IOException("no png writer");
    }
    return file;
  }

  /** Rows {@code 1..rows} all pointing at {@code image}; label cycles through three classes. */
  static Path writeTable(Path dir, Path image, int rows) throws IOException {
    StringBuilder csv = new StringBuilder(HEADER);
    for (int i = 0; i < rows; i++) {
      csv.append(row(image, i + 1, i % 3));
    }
    return Files.writeString(dir.resolve("meta.csv"), csv, StandardCharsets.UTF_8);
  }

  static String row(Path image, long id, int label) {
    return image.toAbsolutePath() + "," + id + "," + label + ",label-" + label + "," + (100 + label) + ",7\n";
  }

  static Path directory(Path parent, String name) throws IOException {
    return Files.createDirectories(parent.resolve(name));
  }

  /** Thread-safe counter sink. */
  static final class RecordingMetrics implements MetricsPort {
    private final Map<String, LongAdder> counters = new ConcurrentHashMap<>();

    @Override
    public void increment(String key) {
      counters.computeIfAbsent(key, k -> new LongAdder()).increment();
    }

    @Override
    public void observe(String key, long value) {
      counters.computeIfAbsent(key, k -> new LongAdder()).add(value);
    }

    long count(String key) {
      LongAdder adder = counters.get(key);
      return adder == null ? 0 : adder.sum();
    }
  }
}

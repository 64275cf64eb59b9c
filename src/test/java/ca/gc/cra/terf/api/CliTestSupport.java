package ca.gc.cra.terf.api;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import org.slf4j.LoggerFactory;

/** Captures one CLI's log events and stdout for a test. */
final class CliTestSupport implements AutoCloseable {
  private final Logger logger;
  private final Level originalLevel;
  private final boolean originalAdditive;
  private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
  private final StringWriter stdout = new StringWriter();

  CliTestSupport(Class<?> cli) {
    logger = (Logger) LoggerFactory.getLogger(cli);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);
    CliPrinter.setWriterForTesting(new PrintWriter(stdout, true));
  }

  String stdout() {
    return stdout.toString();
  }

  boolean logged(Level level, String fragment) {
    return appender.list.stream()
        .anyMatch(event -> event.getLevel() == level && event.getFormattedMessage().contains(fragment));
  }

  @Override
  public void close() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    logger.setLevel(originalLevel);
    CliPrinter.clearTestWriter();
  }

  /** Writes one PNG and a metadata table with {@code rows} rows pointing at it. */
  static Path writeDataset(Path dir, int rows) throws IOException {
    Path png = dir.resolve("img.png");
    ImageIO.write(new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB), "png", png.toFile());
    StringBuilder csv = new StringBuilder("image_path,image_id,label_id,label_text,label_raw,source\n");
    for (int i = 1; i <= rows; i++) {
      csv.append(png.toAbsolutePath()).append(',').append(i).append(",1,cat,10,3\n");
    }
    return Files.writeString(dir.resolve("meta.csv"), csv, StandardCharsets.UTF_8);
  }
}

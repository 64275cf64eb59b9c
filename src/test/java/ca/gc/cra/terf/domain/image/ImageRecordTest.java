package ca.gc.cra.terf.domain.image;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class ImageRecordTest {

  @Test
  void nameUsesIdThenFilenameThenFallback() {
    assertEquals("42.jpeg", record(42, "orig.jpg", "JPEG").name());
    assertEquals("orig.jpg", record(0, "orig.jpg", "JPEG").name());
    assertEquals("image.png", record(0, "", "PNG").name());
  }

  @Test
  void csvRowResolvesNameUnderBaseDir() {
    ImageRecord image = new ImageRecord(7, 10, 20, 3, 30, "bird", 2, "x.png", "png", "RGB", new byte[] {1});
    Path base = Path.of("out");

    assertEquals(
        List.of(base.resolve("7.png").toString(), "7", "3", "bird", "30", "2"),
        image.toCsvRow(base));
  }

  @Test
  void encodedBytesAreTakenOverWithoutCopying() {
    byte[] bytes = {1, 2, 3};
    ImageRecord image = record(1, "a", "png").withEncoding(bytes, "png", "RGB");

    assertSame(bytes, image.encoded());
    assertNotEquals(record(1, "a", "png"), image);
  }

  @Test
  void withoutEncodingKeepsMetadataOnly() {
    ImageRecord image = new ImageRecord(7, 10, 20, 3, 30, "bird", 2, "x.png", "PNG", "RGB", new byte[] {1, 2});

    ImageRecord metadata = image.withoutEncoding();

    assertEquals(0, metadata.encoded().length);
    assertEquals(image.toCsvRow(Path.of("out")), metadata.toCsvRow(Path.of("out")));
    assertEquals("PNG", metadata.format());
  }

  private static ImageRecord record(long id, String filename, String format) {
    return new ImageRecord(id, 1, 1, 0, 0, "", 0, filename, format, "RGB", null);
  }
}

package ca.gc.cra.terf.infrastructure.image;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.terf.domain.image.ImageRecord;
import ca.gc.cra.terf.domain.shard.ResourceConversionException;
import ca.gc.cra.terf.domain.shard.RowDescriptor;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImageIoConverterTest {
  @TempDir Path tempDir;

  @Test
  void inspectsRgbPng() throws IOException, ResourceConversionException {
    Path file = write("rgb.png", BufferedImage.TYPE_INT_RGB, 7, 5, "png");

    ImageRecord image = new ImageIoConverter(false).convert(row(file));

    assertEquals("png", image.format());
    assertEquals("RGB", image.colorspace());
    assertEquals(7, image.width());
    assertEquals(5, image.height());
    assertEquals("rgb.png", image.filename());
    assertEquals(11L, image.id());
    assertEquals("gull", image.labelText());
    assertArrayEquals(Files.readAllBytes(file), image.encoded());
  }

  @Test
  void detectsGrayAndJpeg() throws IOException, ResourceConversionException {
    ImageIoConverter converter = new ImageIoConverter(false);

    ImageRecord gray = converter.convert(row(write("gray.png", BufferedImage.TYPE_BYTE_GRAY, 4, 4, "png")));
    assertEquals("Gray", gray.colorspace());

    ImageRecord jpeg = converter.convert(row(write("photo.jpg", BufferedImage.TYPE_INT_RGB, 16, 8, "jpeg")));
    assertEquals("jpeg", jpeg.format());
    assertEquals("RGB", jpeg.colorspace());
    assertEquals(16, jpeg.width());
  }

  @Test
  void normalizesToRgbJpeg() throws IOException, ResourceConversionException {
    Path file = write("alpha.png", BufferedImage.TYPE_INT_ARGB, 6, 3, "png");

    ImageRecord image = new ImageIoConverter(true).convert(row(file));

    assertEquals("jpeg", image.format());
    assertEquals("RGB", image.colorspace());
    BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(image.encoded()));
    assertEquals(6, decoded.getWidth());
    assertEquals(3, decoded.getHeight());
    assertEquals("11.jpeg", image.name());
  }

  @Test
  void missingOrUnknownFilesAreConversionFailures() throws IOException {
    ImageIoConverter converter = new ImageIoConverter(false);
    assertThrows(ResourceConversionException.class, () -> converter.convert(row(tempDir.resolve("nope.png"))));

    Path junk = Files.write(tempDir.resolve("junk.png"), new byte[] {1, 2, 3, 4, 5});
    ResourceConversionException ex =
        assertThrows(ResourceConversionException.class, () -> converter.convert(row(junk)));
    assertTrue(ex.getMessage().contains("junk.png"));
  }

  private Path write(String name, int type, int width, int height, String format) throws IOException {
    BufferedImage image = new BufferedImage(width, height, type);
    for (int x = 0; x < width; x++) {
      for (int y = 0; y < height; y++) {
        image.setRGB(x, y, new Color(x * 30 % 256, y * 40 % 256, 90).getRGB());
      }
    }
    Path file = tempDir.resolve(name);
    assertTrue(ImageIO.write(image, format, file.toFile()));
    return file;
  }

  private static RowDescriptor row(Path file) {
    return new RowDescriptor(file.toString(), 11, 2, "gull", 20, 5);
  }
}

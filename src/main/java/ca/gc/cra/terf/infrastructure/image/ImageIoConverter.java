package ca.gc.cra.terf.infrastructure.image;

import ca.gc.cra.terf.application.port.ImageConverter;
import ca.gc.cra.terf.domain.image.Colorspace;
import ca.gc.cra.terf.domain.image.ImageRecord;
import ca.gc.cra.terf.domain.shard.ResourceConversionException;
import ca.gc.cra.terf.domain.shard.RowDescriptor;
import java.awt.Graphics2D;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.stream.ImageInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ImageConverter} backed by {@code javax.imageio}.
 *
 * <p>Detects format, dimensions and colorspace from the image header. When JPEG normalization is
 * enabled, every image is decoded, drawn onto an RGB canvas and re-encoded as JPEG.</p>
 *
 * @since 0.1.0
 */
public final class ImageIoConverter implements ImageConverter {
  private static final Logger log = LoggerFactory.getLogger(ImageIoConverter.class);

  private final boolean normalizeToJpeg;

  /**
   * Creates a converter.
   *
   * @param normalizeToJpeg re-encode every image as RGB JPEG
   */
  public ImageIoConverter(boolean normalizeToJpeg) {
    this.normalizeToJpeg = normalizeToJpeg;
    ImageIO.setUseCache(false);
  }

  @Override
  public ImageRecord convert(RowDescriptor row) throws ResourceConversionException {
    Path path;
    try {
      path = Path.of(row.imagePath());
    } catch (InvalidPathException ex) {
      throw new ResourceConversionException("invalid image path: " + row.imagePath(), ex);
    }
    byte[] raw;
    try {
      raw = Files.readAllBytes(path);
    } catch (IOException ex) {
      throw new ResourceConversionException("unable to read image " + path + ": " + ex.getMessage(), ex);
    }

    ImageRecord image = inspect(raw, row, fileName(path));
    if (normalizeToJpeg) {
      image = toJpeg(image);
    }
    return image;
  }

  /**
   * Reads format, size and colorspace of an encoded image without decoding its pixels.
   *
   * @param raw encoded image
   * @param row labels to attach
   * @param filename base name of the source file
   * @return labeled image record
   * @throws ResourceConversionException if no installed reader understands the bytes
   */
  ImageRecord inspect(byte[] raw, RowDescriptor row, String filename) throws ResourceConversionException {
    try (ImageInputStream iis = ImageIO.createImageInputStream(new ByteArrayInputStream(raw))) {
      Iterator<ImageReader> readers = iis == null ? null : ImageIO.getImageReaders(iis);
      if (readers == null || !readers.hasNext()) {
        throw new ResourceConversionException("unknown image format: " + row.imagePath());
      }
      ImageReader reader = readers.next();
      try {
        reader.setInput(iis, true, true);
        String format = reader.getFormatName().toLowerCase(Locale.ROOT);
        int width = reader.getWidth(0);
        int height = reader.getHeight(0);
        Colorspace colorspace = detectColorspace(reader);
        log.trace("Inspected {}: {} {}x{} {}", row.imagePath(), format, width, height, colorspace);
        return new ImageRecord(
            row.imageId(),
            width,
            height,
            row.labelId(),
            row.labelRaw(),
            row.labelText(),
            row.sourceId(),
            filename,
            format,
            colorspace.label(),
            raw);
      } finally {
        reader.dispose();
      }
    } catch (IOException | RuntimeException ex) {
      throw new ResourceConversionException("unable to decode image " + row.imagePath() + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Re-encodes {@code image} as an RGB JPEG.
   *
   * @param image image to convert
   * @return converted image with format {@code jpeg} and colorspace {@code RGB}
   * @throws ResourceConversionException if the image cannot be decoded or encoded
   */
  ImageRecord toJpeg(ImageRecord image) throws ResourceConversionException {
    try {
      BufferedImage source = ImageIO.read(new ByteArrayInputStream(image.encoded()));
      if (source == null) {
        throw new ResourceConversionException("no decoder for image " + image.name());
      }
      BufferedImage rgb = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
      Graphics2D g = rgb.createGraphics();
      try {
        g.drawImage(source, 0, 0, null);
      } finally {
        g.dispose();
      }
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      if (!ImageIO.write(rgb, "jpeg", out)) {
        throw new ResourceConversionException("no JPEG encoder available");
      }
      return image.withEncoding(out.toByteArray(), "jpeg", Colorspace.RGB.label());
    } catch (IOException | RuntimeException ex) {
      throw new ResourceConversionException("unable to convert " + image.name() + " to JPEG: " + ex.getMessage(), ex);
    }
  }

  static Colorspace detectColorspace(ImageReader reader) throws IOException {
    ImageTypeSpecifier type = reader.getRawImageType(0);
    if (type == null) {
      Iterator<ImageTypeSpecifier> types = reader.getImageTypes(0);
      type = types.hasNext() ? types.next() : null;
    }
    if (type == null) {
      return Colorspace.UNKNOWN;
    }
    return classify(type.getColorModel());
  }

  static Colorspace classify(ColorModel model) {
    if (model == null || model instanceof IndexColorModel) {
      return Colorspace.UNKNOWN;
    }
    return switch (model.getColorSpace().getType()) {
      case ColorSpace.TYPE_RGB, ColorSpace.TYPE_YCbCr -> Colorspace.RGB;
      case ColorSpace.TYPE_CMYK -> Colorspace.CMYK;
      case ColorSpace.TYPE_GRAY -> Colorspace.GRAY;
      default -> Colorspace.UNKNOWN;
    };
  }

  private static String fileName(Path path) {
    Path name = path.getFileName();
    return name == null ? "" : name.toString();
  }
}

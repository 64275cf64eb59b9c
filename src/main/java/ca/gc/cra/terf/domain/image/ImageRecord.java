package ca.gc.cra.terf.domain.image;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Labeled image as carried by one dataset record.
 * <p><strong>Role:</strong> Domain value produced by the image converter on build and by the
 * example codec on extract/summary.</p>
 * <p><strong>Thread-safety:</strong> Immutable once built. The record takes ownership of the
 * {@code encoded} array; callers hand over a fresh array and do not modify it afterwards.</p>
 *
 * @param id unique image id; {@code 0} when unknown
 * @param width width in pixels
 * @param height height in pixels
 * @param labelId normalized label id
 * @param labelRaw raw label id
 * @param labelText human-readable normalized label
 * @param sourceId id of the organization that produced the image
 * @param filename base file name of the original image; may be empty
 * @param format image format name such as {@code jpeg} or {@code png}
 * @param colorspace colorspace label, see {@link Colorspace}
 * @param encoded encoded image bytes
 * @since 0.1.0
 */
public record ImageRecord(
    long id,
    int width,
    int height,
    long labelId,
    long labelRaw,
    String labelText,
    long sourceId,
    String filename,
    String format,
    String colorspace,
    byte[] encoded) {

  private static final byte[] NO_IMAGE = new byte[0];

  @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Takes ownership of the encoded image array.")
  public ImageRecord {
    labelText = Objects.requireNonNullElse(labelText, "");
    filename = Objects.requireNonNullElse(filename, "");
    format = Objects.requireNonNullElse(format, "");
    colorspace = Objects.requireNonNullElse(colorspace, "");
    encoded = encoded != null ? encoded : NO_IMAGE;
  }

  /**
   * Returns the encoded image without copying.
   *
   * @return encoded bytes; callers must not modify
   */
  @Override
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Images are large and the array is owned by the record.")
  public byte[] encoded() {
    return encoded;
  }

  /**
   * File name used when the image is extracted: {@code {id}.{format}} when an id is present,
   * otherwise the original file name, otherwise {@code image.{format}}.
   *
   * @return generated base name
   */
  public String name() {
    String ext = format.toLowerCase(Locale.ROOT);
    if (id > 0) {
      return id + "." + ext;
    }
    if (!filename.isEmpty()) {
      return filename;
    }
    return "image." + ext;
  }

  /**
   * Metadata table row describing this image once written under {@code baseDir}.
   *
   * @param baseDir directory holding the extracted image
   * @return {@code image_path,image_id,label_id,label_text,label_raw,source} values
   */
  public List<String> toCsvRow(Path baseDir) {
    return List.of(
        baseDir.resolve(name()).toString(),
        Long.toString(id),
        Long.toString(labelId),
        labelText,
        Long.toString(labelRaw),
        Long.toString(sourceId));
  }

  /**
   * Copy of this record carrying a re-encoded image.
   *
   * @param newEncoded replacement bytes; ownership passes to the new record
   * @param newFormat format of {@code newEncoded}
   * @param newColorspace colorspace of {@code newEncoded}
   * @return updated record
   */
  public ImageRecord withEncoding(byte[] newEncoded, String newFormat, String newColorspace) {
    return new ImageRecord(id, width, height, labelId, labelRaw, labelText, sourceId, filename,
        newFormat, newColorspace, newEncoded);
  }

  /**
   * Copy of this record that keeps the metadata and drops the image bytes.
   *
   * @return record whose {@link #encoded()} is empty
   */
  public ImageRecord withoutEncoding() {
    return withEncoding(NO_IMAGE, format, colorspace);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ImageRecord that)) {
      return false;
    }
    return id == that.id
        && width == that.width
        && height == that.height
        && labelId == that.labelId
        && labelRaw == that.labelRaw
        && sourceId == that.sourceId
        && labelText.equals(that.labelText)
        && filename.equals(that.filename)
        && format.equals(that.format)
        && colorspace.equals(that.colorspace)
        && Arrays.equals(encoded, that.encoded);
  }

  @Override
  public int hashCode() {
    int result = Long.hashCode(id);
    result = 31 * result + Integer.hashCode(width);
    result = 31 * result + Integer.hashCode(height);
    result = 31 * result + Long.hashCode(labelId);
    result = 31 * result + Long.hashCode(labelRaw);
    result = 31 * result + labelText.hashCode();
    result = 31 * result + Long.hashCode(sourceId);
    result = 31 * result + filename.hashCode();
    result = 31 * result + format.hashCode();
    result = 31 * result + colorspace.hashCode();
    result = 31 * result + Arrays.hashCode(encoded);
    return result;
  }

  @Override
  public String toString() {
    return "ImageRecord{"
        + "id=" + id
        + ", width=" + width
        + ", height=" + height
        + ", labelId=" + labelId
        + ", labelText='" + labelText + '\''
        + ", format='" + format + '\''
        + ", colorspace='" + colorspace + '\''
        + ", encodedLength=" + encoded.length
        + '}';
  }
}

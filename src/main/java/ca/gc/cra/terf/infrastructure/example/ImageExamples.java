package ca.gc.cra.terf.infrastructure.example;

import ca.gc.cra.terf.domain.image.ImageRecord;
import com.google.protobuf.InvalidProtocolBufferException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps {@link ImageRecord}s to and from the image feature schema of dataset records.
 *
 * <pre>
 * image/height        int64   pixels
 * image/width         int64   pixels
 * image/colorspace    bytes   RGB, Gray, CMYK or Unknown
 * image/channels      int64   always 3
 * image/class/label   int64   normalized label id
 * image/class/raw     int64   raw label id
 * image/class/source  int64   source id
 * image/class/text    bytes   normalized label text
 * image/format        bytes   upper-case format name
 * image/filename      bytes   base name of the original file
 * image/id            int64   image id
 * image/encoded       bytes   encoded image
 * </pre>
 *
 * @since 0.1.0
 */
public final class ImageExamples {
  public static final String HEIGHT = "image/height";
  public static final String WIDTH = "image/width";
  public static final String COLORSPACE = "image/colorspace";
  public static final String CHANNELS = "image/channels";
  public static final String LABEL = "image/class/label";
  public static final String LABEL_RAW = "image/class/raw";
  public static final String SOURCE = "image/class/source";
  public static final String LABEL_TEXT = "image/class/text";
  public static final String FORMAT = "image/format";
  public static final String FILENAME = "image/filename";
  public static final String ID = "image/id";
  public static final String ENCODED = "image/encoded";

  private static final Set<String> ENCODED_ONLY = Set.of(ENCODED);

  private ImageExamples() {}

  /**
   * Builds the example for {@code image}.
   *
   * @param image labeled image
   * @return example carrying every image feature
   */
  public static TfExample toExample(ImageRecord image) {
    Map<String, Feature> features = new LinkedHashMap<>();
    features.put(HEIGHT, Feature.int64(image.height()));
    features.put(WIDTH, Feature.int64(image.width()));
    features.put(COLORSPACE, Feature.utf8(image.colorspace()));
    features.put(CHANNELS, Feature.int64(3));
    features.put(LABEL, Feature.int64(image.labelId()));
    features.put(LABEL_RAW, Feature.int64(image.labelRaw()));
    features.put(SOURCE, Feature.int64(image.sourceId()));
    features.put(LABEL_TEXT, Feature.utf8(image.labelText()));
    features.put(FORMAT, Feature.utf8(image.format().toUpperCase(Locale.ROOT)));
    features.put(FILENAME, Feature.utf8(image.filename()));
    features.put(ID, Feature.int64(image.id()));
    features.put(ENCODED, Feature.bytes(image.encoded()));
    return new TfExample(features);
  }

  /**
   * Reads the image fields of {@code example}. Missing features take their zero value.
   *
   * @param example decoded example
   * @return image record
   */
  public static ImageRecord fromExample(TfExample example) {
    return new ImageRecord(
        example.int64(ID),
        (int) example.int64(WIDTH),
        (int) example.int64(HEIGHT),
        example.int64(LABEL),
        example.int64(LABEL_RAW),
        example.utf8(LABEL_TEXT),
        example.int64(SOURCE),
        example.utf8(FILENAME),
        example.utf8(FORMAT),
        example.utf8(COLORSPACE),
        example.bytes(ENCODED).toByteArray());
  }

  /**
   * Encodes {@code image} as record payload bytes.
   *
   * @param image labeled image
   * @return serialized example
   */
  public static byte[] encode(ImageRecord image) {
    return TfExampleCodec.encode(toExample(image));
  }

  /**
   * Decodes a record payload including the encoded image.
   *
   * @param payload serialized example
   * @return image record
   * @throws InvalidProtocolBufferException if the payload is malformed
   */
  public static ImageRecord decode(byte[] payload) throws InvalidProtocolBufferException {
    return fromExample(TfExampleCodec.decode(payload));
  }

  /**
   * Decodes a record payload without copying the encoded image; {@link ImageRecord#encoded()} is empty.
   *
   * @param payload serialized example
   * @return image metadata
   * @throws InvalidProtocolBufferException if the payload is malformed
   */
  public static ImageRecord decodeMetadata(byte[] payload) throws InvalidProtocolBufferException {
    return fromExample(TfExampleCodec.decode(payload, ENCODED_ONLY));
  }
}

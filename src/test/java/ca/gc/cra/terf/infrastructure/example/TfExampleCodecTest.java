package ca.gc.cra.terf.infrastructure.example;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.terf.domain.image.ImageRecord;
import com.google.protobuf.ByteString;
import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.WireFormat;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TfExampleCodecTest {

  @Test
  void encodesMinimalExampleToCanonicalBytes() {
    TfExample example = new TfExample(Map.of("a", Feature.int64(1)));

    byte[] expected = {0x0A, 0x0C, 0x0A, 0x0A, 0x0A, 0x01, 'a', 0x12, 0x05, 0x1A, 0x03, 0x0A, 0x01, 0x01};
    assertArrayEquals(expected, TfExampleCodec.encode(example));
  }

  @Test
  void decodesWhatItEncodesForEveryFeatureKind() throws InvalidProtocolBufferException {
    Map<String, Feature> features = new LinkedHashMap<>();
    features.put("bytes", new Feature.BytesList(List.of(ByteString.copyFromUtf8("x"), ByteString.EMPTY)));
    features.put("floats", new Feature.FloatList(new float[] {1.5f, -2f}));
    features.put("ints", new Feature.Int64List(new long[] {-1L, 0L, Long.MAX_VALUE}));
    features.put("empty", new Feature.Int64List(new long[0]));
    TfExample example = new TfExample(features);

    TfExample decoded = TfExampleCodec.decode(TfExampleCodec.encode(example));

    assertEquals(example, decoded);
    assertEquals(-1L, decoded.int64("ints"));
    assertEquals(1.5f, decoded.floatValue("floats"));
    assertEquals("x", decoded.utf8("bytes"));
    assertEquals(0L, decoded.int64("empty"));
  }

  @Test
  void acceptsUnpackedNumericLists() throws IOException {
    ByteArrayOutputStream int64List = new ByteArrayOutputStream();
    CodedOutputStream listOut = CodedOutputStream.newInstance(int64List);
    listOut.writeInt64(1, 7L);
    listOut.writeInt64(1, 8L);
    listOut.flush();

    byte[] payload = example("n", 3, int64List.toByteArray());
    TfExample decoded = TfExampleCodec.decode(payload);

    assertEquals(new Feature.Int64List(new long[] {7L, 8L}), decoded.feature("n").orElseThrow());
  }

  @Test
  void missingOrMistypedFeaturesReadAsZero() throws InvalidProtocolBufferException {
    TfExample decoded = TfExampleCodec.decode(TfExampleCodec.encode(
        new TfExample(Map.of("text", Feature.utf8("hello")))));

    assertEquals(0L, decoded.int64("absent"));
    assertEquals(0L, decoded.int64("text"));
    assertEquals("", decoded.utf8("absent"));
    assertEquals(0L, TfExampleCodec.decode(new byte[0]).int64("anything"));
  }

  @Test
  void rejectsMalformedPayload() {
    byte[] truncated = {0x0A, 0x0C, 0x0A};
    assertThrows(InvalidProtocolBufferException.class, () -> TfExampleCodec.decode(truncated));
  }

  @Test
  void imageRecordSurvivesExampleEncoding() throws InvalidProtocolBufferException {
    ImageRecord image = new ImageRecord(
        12, 640, 480, 3, 33, "heron", 4, "heron.jpg", "jpeg", "RGB", new byte[] {1, 2, 3, 4});

    byte[] payload = ImageExamples.encode(image);
    TfExample example = TfExampleCodec.decode(payload);
    assertEquals("JPEG", example.utf8(ImageExamples.FORMAT));
    assertEquals(3L, example.int64(ImageExamples.CHANNELS));

    ImageRecord decoded = ImageExamples.decode(payload);
    assertEquals(image.withEncoding(image.encoded(), "JPEG", "RGB"), decoded);
    assertEquals("12.jpeg", decoded.name());

    ImageRecord metadata = ImageExamples.decodeMetadata(payload);
    assertEquals(0, metadata.encoded().length);
    assertEquals("heron", metadata.labelText());
    assertTrue(metadata.width() == 640 && metadata.height() == 480);
  }

  private static byte[] example(String key, int featureField, byte[] listBody) throws IOException {
    ByteArrayOutputStream feature = new ByteArrayOutputStream();
    CodedOutputStream featureOut = CodedOutputStream.newInstance(feature);
    featureOut.writeByteArray(featureField, listBody);
    featureOut.flush();

    ByteArrayOutputStream entry = new ByteArrayOutputStream();
    CodedOutputStream entryOut = CodedOutputStream.newInstance(entry);
    entryOut.writeString(1, key);
    entryOut.writeByteArray(2, feature.toByteArray());
    entryOut.flush();

    ByteArrayOutputStream features = new ByteArrayOutputStream();
    CodedOutputStream featuresOut = CodedOutputStream.newInstance(features);
    featuresOut.writeByteArray(1, entry.toByteArray());
    featuresOut.flush();

    ByteArrayOutputStream example = new ByteArrayOutputStream();
    CodedOutputStream exampleOut = CodedOutputStream.newInstance(example);
    exampleOut.writeTag(1, WireFormat.WIRETYPE_LENGTH_DELIMITED);
    exampleOut.writeByteArrayNoTag(features.toByteArray());
    exampleOut.flush();
    return example.toByteArray();
  }
}

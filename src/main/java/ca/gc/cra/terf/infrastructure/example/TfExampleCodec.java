package ca.gc.cra.terf.infrastructure.example;

import com.google.protobuf.ByteString;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.WireFormat;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Wire codec for {@code tf.train.Example} messages, written against the protobuf runtime directly.
 *
 * <p>Schema (field numbers):</p>
 * <pre>
 * Example   { Features features = 1; }
 * Features  { map&lt;string, Feature&gt; feature = 1; }   // entry: key = 1, value = 2
 * Feature   { oneof kind { BytesList bytes_list = 1; FloatList float_list = 2; Int64List int64_list = 3; } }
 * BytesList { repeated bytes value = 1; }
 * FloatList { repeated float value = 1 [packed = true]; }
 * Int64List { repeated int64 value = 1 [packed = true]; }
 * </pre>
 * <p>Numeric lists are written packed; both packed and unpacked forms are accepted on read.
 * Unknown fields are skipped. Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class TfExampleCodec {
  private static final int EXAMPLE_FEATURES = 1;
  private static final int FEATURES_ENTRY = 1;
  private static final int ENTRY_KEY = 1;
  private static final int ENTRY_VALUE = 2;
  private static final int FEATURE_BYTES_LIST = 1;
  private static final int FEATURE_FLOAT_LIST = 2;
  private static final int FEATURE_INT64_LIST = 3;
  private static final int LIST_VALUE = 1;

  private TfExampleCodec() {}

  /**
   * Serializes {@code example}.
   *
   * @param example example to encode
   * @return wire bytes
   */
  public static byte[] encode(TfExample example) {
    Objects.requireNonNull(example, "example");
    List<EncodedEntry> entries = new ArrayList<>(example.features().size());
    int featuresSize = 0;
    for (Map.Entry<String, Feature> entry : example.features().entrySet()) {
      int featureSize = featureSize(entry.getValue());
      int entrySize = CodedOutputStream.computeStringSize(ENTRY_KEY, entry.getKey())
          + delimitedSize(ENTRY_VALUE, featureSize);
      entries.add(new EncodedEntry(entry.getKey(), entry.getValue(), featureSize, entrySize));
      featuresSize += delimitedSize(FEATURES_ENTRY, entrySize);
    }

    byte[] buffer = new byte[delimitedSize(EXAMPLE_FEATURES, featuresSize)];
    CodedOutputStream out = CodedOutputStream.newInstance(buffer);
    try {
      writeDelimitedHeader(out, EXAMPLE_FEATURES, featuresSize);
      for (EncodedEntry entry : entries) {
        writeDelimitedHeader(out, FEATURES_ENTRY, entry.entrySize());
        out.writeString(ENTRY_KEY, entry.key());
        writeDelimitedHeader(out, ENTRY_VALUE, entry.featureSize());
        writeFeature(out, entry.feature());
      }
      out.checkNoSpaceLeft();
    } catch (IOException ex) {
      throw new IllegalStateException("Example size computation out of step with encoding", ex);
    }
    return buffer;
  }

  /**
   * Parses a serialized example.
   *
   * @param payload wire bytes
   * @return decoded example
   * @throws InvalidProtocolBufferException if the bytes are not a well-formed example
   */
  public static TfExample decode(byte[] payload) throws InvalidProtocolBufferException {
    return decode(payload, Set.of());
  }

  /**
   * Parses a serialized example, skipping the values of {@code skippedKeys} without copying them.
   *
   * @param payload wire bytes
   * @param skippedKeys feature keys to drop
   * @return decoded example
   * @throws InvalidProtocolBufferException if the bytes are not a well-formed example
   */
  public static TfExample decode(byte[] payload, Set<String> skippedKeys) throws InvalidProtocolBufferException {
    Objects.requireNonNull(payload, "payload");
    CodedInputStream in = CodedInputStream.newInstance(payload);
    Map<String, Feature> features = new LinkedHashMap<>();
    try {
      while (true) {
        int tag = in.readTag();
        if (tag == 0) {
          break;
        }
        if (WireFormat.getTagFieldNumber(tag) == EXAMPLE_FEATURES
            && WireFormat.getTagWireType(tag) == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
          int oldLimit = in.pushLimit(in.readRawVarint32());
          readFeatures(in, features, skippedKeys);
          in.popLimit(oldLimit);
        } else {
          in.skipField(tag);
        }
      }
    } catch (InvalidProtocolBufferException ex) {
      throw ex;
    } catch (IOException ex) {
      throw new InvalidProtocolBufferException(ex);
    }
    return new TfExample(features);
  }

  private static void readFeatures(CodedInputStream in, Map<String, Feature> target, Set<String> skippedKeys)
      throws IOException {
    while (true) {
      int tag = in.readTag();
      if (tag == 0) {
        return;
      }
      if (WireFormat.getTagFieldNumber(tag) == FEATURES_ENTRY
          && WireFormat.getTagWireType(tag) == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
        int oldLimit = in.pushLimit(in.readRawVarint32());
        readEntry(in, target, skippedKeys);
        in.popLimit(oldLimit);
      } else {
        in.skipField(tag);
      }
    }
  }

  private static void readEntry(CodedInputStream in, Map<String, Feature> target, Set<String> skippedKeys)
      throws IOException {
    String key = "";
    Feature value = null;
    while (true) {
      int tag = in.readTag();
      if (tag == 0) {
        break;
      }
      int field = WireFormat.getTagFieldNumber(tag);
      if (field == ENTRY_KEY && WireFormat.getTagWireType(tag) == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
        key = in.readStringRequireUtf8();
      } else if (field == ENTRY_VALUE
          && WireFormat.getTagWireType(tag) == WireFormat.WIRETYPE_LENGTH_DELIMITED
          && !skippedKeys.contains(key)) {
        int oldLimit = in.pushLimit(in.readRawVarint32());
        value = readFeature(in);
        in.popLimit(oldLimit);
      } else {
        in.skipField(tag);
      }
    }
    if (skippedKeys.contains(key)) {
      return;
    }
    // An entry without a value carries the default (kind-less) feature; treat it as an empty byte list.
    target.put(key, value != null ? value : new Feature.BytesList(List.of()));
  }

  private static Feature readFeature(CodedInputStream in) throws IOException {
    Feature result = new Feature.BytesList(List.of());
    while (true) {
      int tag = in.readTag();
      if (tag == 0) {
        return result;
      }
      if (WireFormat.getTagWireType(tag) != WireFormat.WIRETYPE_LENGTH_DELIMITED) {
        in.skipField(tag);
        continue;
      }
      switch (WireFormat.getTagFieldNumber(tag)) {
        case FEATURE_BYTES_LIST -> result = readNested(in, TfExampleCodec::readBytesList);
        case FEATURE_FLOAT_LIST -> result = readNested(in, TfExampleCodec::readFloatList);
        case FEATURE_INT64_LIST -> result = readNested(in, TfExampleCodec::readInt64List);
        default -> in.skipField(tag);
      }
    }
  }

  private static Feature readNested(CodedInputStream in, ListReader reader) throws IOException {
    int oldLimit = in.pushLimit(in.readRawVarint32());
    Feature feature = reader.read(in);
    in.popLimit(oldLimit);
    return feature;
  }

  private static Feature readBytesList(CodedInputStream in) throws IOException {
    List<ByteString> values = new ArrayList<>(1);
    while (true) {
      int tag = in.readTag();
      if (tag == 0) {
        return new Feature.BytesList(values);
      }
      if (tag == tag(LIST_VALUE, WireFormat.WIRETYPE_LENGTH_DELIMITED)) {
        values.add(in.readBytes());
      } else {
        in.skipField(tag);
      }
    }
  }

  private static Feature readFloatList(CodedInputStream in) throws IOException {
    FloatAccumulator values = new FloatAccumulator();
    while (true) {
      int tag = in.readTag();
      if (tag == 0) {
        return new Feature.FloatList(values.toArray());
      }
      if (tag == tag(LIST_VALUE, WireFormat.WIRETYPE_LENGTH_DELIMITED)) {
        int oldLimit = in.pushLimit(in.readRawVarint32());
        while (in.getBytesUntilLimit() > 0) {
          values.add(in.readFloat());
        }
        in.popLimit(oldLimit);
      } else if (tag == tag(LIST_VALUE, WireFormat.WIRETYPE_FIXED32)) {
        values.add(in.readFloat());
      } else {
        in.skipField(tag);
      }
    }
  }

  private static Feature readInt64List(CodedInputStream in) throws IOException {
    LongAccumulator values = new LongAccumulator();
    while (true) {
      int tag = in.readTag();
      if (tag == 0) {
        return new Feature.Int64List(values.toArray());
      }
      if (tag == tag(LIST_VALUE, WireFormat.WIRETYPE_LENGTH_DELIMITED)) {
        int oldLimit = in.pushLimit(in.readRawVarint32());
        while (in.getBytesUntilLimit() > 0) {
          values.add(in.readInt64());
        }
        in.popLimit(oldLimit);
      } else if (tag == tag(LIST_VALUE, WireFormat.WIRETYPE_VARINT)) {
        values.add(in.readInt64());
      } else {
        in.skipField(tag);
      }
    }
  }

  private static int featureSize(Feature feature) {
    if (feature instanceof Feature.BytesList list) {
      return delimitedSize(FEATURE_BYTES_LIST, bytesListSize(list));
    }
    if (feature instanceof Feature.FloatList list) {
      return delimitedSize(FEATURE_FLOAT_LIST, packedSize(list.size() * 4));
    }
    Feature.Int64List list = (Feature.Int64List) feature;
    return delimitedSize(FEATURE_INT64_LIST, packedSize(int64DataSize(list)));
  }

  private static void writeFeature(CodedOutputStream out, Feature feature) throws IOException {
    if (feature instanceof Feature.BytesList list) {
      writeDelimitedHeader(out, FEATURE_BYTES_LIST, bytesListSize(list));
      for (ByteString value : list.values()) {
        out.writeBytes(LIST_VALUE, value);
      }
    } else if (feature instanceof Feature.FloatList list) {
      int dataSize = list.size() * 4;
      writeDelimitedHeader(out, FEATURE_FLOAT_LIST, packedSize(dataSize));
      if (list.size() > 0) {
        writeDelimitedHeader(out, LIST_VALUE, dataSize);
        for (int i = 0; i < list.size(); i++) {
          out.writeFloatNoTag(list.valueAt(i));
        }
      }
    } else {
      Feature.Int64List list = (Feature.Int64List) feature;
      int dataSize = int64DataSize(list);
      writeDelimitedHeader(out, FEATURE_INT64_LIST, packedSize(dataSize));
      if (list.size() > 0) {
        writeDelimitedHeader(out, LIST_VALUE, dataSize);
        for (int i = 0; i < list.size(); i++) {
          out.writeInt64NoTag(list.valueAt(i));
        }
      }
    }
  }

  private static int bytesListSize(Feature.BytesList list) {
    int size = 0;
    for (ByteString value : list.values()) {
      size += CodedOutputStream.computeBytesSize(LIST_VALUE, value);
    }
    return size;
  }

  private static int int64DataSize(Feature.Int64List list) {
    int size = 0;
    for (int i = 0; i < list.size(); i++) {
      size += CodedOutputStream.computeInt64SizeNoTag(list.valueAt(i));
    }
    return size;
  }

  private static int packedSize(int dataSize) {
    return dataSize == 0 ? 0 : delimitedSize(LIST_VALUE, dataSize);
  }

  private static int delimitedSize(int field, int bodySize) {
    return CodedOutputStream.computeTagSize(field) + CodedOutputStream.computeUInt32SizeNoTag(bodySize) + bodySize;
  }

  private static void writeDelimitedHeader(CodedOutputStream out, int field, int bodySize) throws IOException {
    out.writeTag(field, WireFormat.WIRETYPE_LENGTH_DELIMITED);
    out.writeUInt32NoTag(bodySize);
  }

  private static int tag(int field, int wireType) {
    return (field << 3) | wireType;
  }

  @FunctionalInterface
  private interface ListReader {
    Feature read(CodedInputStream in) throws IOException;
  }

  private record EncodedEntry(String key, Feature feature, int featureSize, int entrySize) {}

  private static final class LongAccumulator {
    private long[] values = new long[1];
    private int size;

    void add(long value) {
      if (size == values.length) {
        values = Arrays.copyOf(values, size * 2);
      }
      values[size++] = value;
    }

    long[] toArray() {
      return Arrays.copyOf(values, size);
    }
  }

  private static final class FloatAccumulator {
    private float[] values = new float[1];
    private int size;

    void add(float value) {
      if (size == values.length) {
        values = Arrays.copyOf(values, size * 2);
      }
      values[size++] = value;
    }

    float[] toArray() {
      return Arrays.copyOf(values, size);
    }
  }
}

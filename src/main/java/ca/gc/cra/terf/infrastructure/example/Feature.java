package ca.gc.cra.terf.infrastructure.example;

import com.google.protobuf.ByteString;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One value of a {@code tf.train.Example} feature map: a list of byte strings, floats or int64s.
 *
 * @since 0.1.0
 */
public sealed interface Feature permits Feature.BytesList, Feature.FloatList, Feature.Int64List {

  static Feature bytes(ByteString value) {
    return new BytesList(List.of(value));
  }

  static Feature bytes(byte[] value) {
    return bytes(ByteString.copyFrom(value));
  }

  static Feature utf8(String value) {
    return bytes(ByteString.copyFromUtf8(value));
  }

  static Feature int64(long value) {
    return new Int64List(new long[] {value});
  }

  static Feature floats(float value) {
    return new FloatList(new float[] {value});
  }

  /** {@code bytes_list} feature (field 1). */
  record BytesList(List<ByteString> values) implements Feature {
    public BytesList {
      values = List.copyOf(values);
    }
  }

  /** {@code float_list} feature (field 2). */
  record FloatList(float[] values) implements Feature {
    public FloatList {
      values = Objects.requireNonNull(values, "values").clone();
    }

    @Override
    public float[] values() {
      return values.clone();
    }

    float valueAt(int index) {
      return values[index];
    }

    int size() {
      return values.length;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof FloatList that && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
      return "FloatList" + Arrays.toString(values);
    }
  }

  /** {@code int64_list} feature (field 3). */
  record Int64List(long[] values) implements Feature {
    public Int64List {
      values = Objects.requireNonNull(values, "values").clone();
    }

    @Override
    public long[] values() {
      return values.clone();
    }

    long valueAt(int index) {
      return values[index];
    }

    int size() {
      return values.length;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Int64List that && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
      return "Int64List" + Arrays.toString(values);
    }
  }
}

package ca.gc.cra.terf.infrastructure.example;

import com.google.protobuf.ByteString;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory {@code tf.train.Example}: a string-keyed map of features.
 *
 * <p>Lookups are lenient: a missing key, a feature of another kind or an empty list yields the
 * type's zero value.</p>
 *
 * @param features features in encoding order
 * @since 0.1.0
 */
public record TfExample(Map<String, Feature> features) {

  public TfExample {
    features = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(features, "features")));
  }

  public Optional<Feature> feature(String key) {
    return Optional.ofNullable(features.get(key));
  }

  /**
   * First int64 value of {@code key}.
   *
   * @param key feature key
   * @return value, or {@code 0} when absent
   */
  public long int64(String key) {
    if (features.get(key) instanceof Feature.Int64List list && list.size() > 0) {
      return list.valueAt(0);
    }
    return 0L;
  }

  /**
   * First float value of {@code key}.
   *
   * @param key feature key
   * @return value, or {@code 0} when absent
   */
  public float floatValue(String key) {
    if (features.get(key) instanceof Feature.FloatList list && list.size() > 0) {
      return list.valueAt(0);
    }
    return 0f;
  }

  /**
   * First byte string of {@code key}.
   *
   * @param key feature key
   * @return value, or {@link ByteString#EMPTY} when absent
   */
  public ByteString bytes(String key) {
    if (features.get(key) instanceof Feature.BytesList list && !list.values().isEmpty()) {
      return list.values().get(0);
    }
    return ByteString.EMPTY;
  }

  /**
   * First byte string of {@code key} decoded as UTF-8.
   *
   * @param key feature key
   * @return value, or the empty string when absent
   */
  public String utf8(String key) {
    return bytes(key).toStringUtf8();
  }
}

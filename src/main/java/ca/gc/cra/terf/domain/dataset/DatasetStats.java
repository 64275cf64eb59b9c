package ca.gc.cra.terf.domain.dataset;

import ca.gc.cra.terf.domain.image.ImageRecord;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Record counts of a dataset, in total and per label, source, format and colorspace.
 * <p><strong>Role:</strong> Per-file result of the summary pipeline, folded into one instance by the
 * aggregator.</p>
 * <p><strong>Thread-safety:</strong> Immutable. {@link Builder} is single-threaded.</p>
 *
 * <p>{@link #merge(DatasetStats)} adds counts key by key, so it is commutative and associative and
 * {@link #empty()} is its identity: files may be folded in any completion order.</p>
 *
 * @since 0.1.0
 */
public final class DatasetStats {
  private static final DatasetStats EMPTY = new Builder().build();

  private final long total;
  private final SortedMap<String, Long> labelText;
  private final SortedMap<Long, Long> labelId;
  private final SortedMap<Long, Long> labelRaw;
  private final SortedMap<Long, Long> source;
  private final SortedMap<String, Long> format;
  private final SortedMap<String, Long> colorspace;

  private DatasetStats(Builder builder) {
    this.total = builder.total;
    this.labelText = Collections.unmodifiableSortedMap(new TreeMap<>(builder.labelText));
    this.labelId = Collections.unmodifiableSortedMap(new TreeMap<>(builder.labelId));
    this.labelRaw = Collections.unmodifiableSortedMap(new TreeMap<>(builder.labelRaw));
    this.source = Collections.unmodifiableSortedMap(new TreeMap<>(builder.source));
    this.format = Collections.unmodifiableSortedMap(new TreeMap<>(builder.format));
    this.colorspace = Collections.unmodifiableSortedMap(new TreeMap<>(builder.colorspace));
  }

  public static DatasetStats empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the key-wise sum of this and {@code other}.
   *
   * @param other stats to add
   * @return combined stats
   */
  public DatasetStats merge(DatasetStats other) {
    Objects.requireNonNull(other, "other");
    return new Builder().addAll(this).addAll(other).build();
  }

  /**
   * Renders the summary report, keys in sorted order. The {@code Label} section is always
   * present; the others only when they have entries.
   *
   * @return report lines
   */
  public List<String> reportLines() {
    List<String> lines = new ArrayList<>();
    lines.add("Total: " + total);
    lines.add("Label: ");
    appendEntries(lines, labelText);
    appendSection(lines, "Source", source);
    appendSection(lines, "Label ID", labelId);
    appendSection(lines, "Label Raw", labelRaw);
    appendSection(lines, "Format", format);
    appendSection(lines, "Colorspace", colorspace);
    return lines;
  }

  public long total() {
    return total;
  }

  public SortedMap<String, Long> labelText() {
    return labelText;
  }

  public SortedMap<Long, Long> labelId() {
    return labelId;
  }

  public SortedMap<Long, Long> labelRaw() {
    return labelRaw;
  }

  public SortedMap<Long, Long> source() {
    return source;
  }

  public SortedMap<String, Long> format() {
    return format;
  }

  public SortedMap<String, Long> colorspace() {
    return colorspace;
  }

  private static void appendSection(List<String> lines, String title, Map<?, Long> counts) {
    if (counts.isEmpty()) {
      return;
    }
    lines.add(title + ": ");
    appendEntries(lines, counts);
  }

  private static void appendEntries(List<String> lines, Map<?, Long> counts) {
    for (Map.Entry<?, Long> entry : counts.entrySet()) {
      lines.add("    - " + entry.getKey() + ": " + entry.getValue());
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DatasetStats that)) {
      return false;
    }
    return total == that.total
        && labelText.equals(that.labelText)
        && labelId.equals(that.labelId)
        && labelRaw.equals(that.labelRaw)
        && source.equals(that.source)
        && format.equals(that.format)
        && colorspace.equals(that.colorspace);
  }

  @Override
  public int hashCode() {
    return Objects.hash(total, labelText, labelId, labelRaw, source, format, colorspace);
  }

  @Override
  public String toString() {
    return "DatasetStats{total=" + total + ", labels=" + labelText.size() + '}';
  }

  /** Mutable accumulator used while scanning one file. */
  public static final class Builder {
    private long total;
    private final Map<String, Long> labelText = new TreeMap<>();
    private final Map<Long, Long> labelId = new TreeMap<>();
    private final Map<Long, Long> labelRaw = new TreeMap<>();
    private final Map<Long, Long> source = new TreeMap<>();
    private final Map<String, Long> format = new TreeMap<>();
    private final Map<String, Long> colorspace = new TreeMap<>();

    private Builder() {}

    /**
     * Counts one record.
     *
     * @param image decoded record metadata
     * @return this builder
     */
    public Builder add(ImageRecord image) {
      total++;
      labelText.merge(image.labelText(), 1L, Long::sum);
      labelId.merge(image.labelId(), 1L, Long::sum);
      labelRaw.merge(image.labelRaw(), 1L, Long::sum);
      source.merge(image.sourceId(), 1L, Long::sum);
      format.merge(image.format(), 1L, Long::sum);
      colorspace.merge(image.colorspace(), 1L, Long::sum);
      return this;
    }

    /**
     * Adds every count of {@code stats}.
     *
     * @param stats counts to add
     * @return this builder
     */
    public Builder addAll(DatasetStats stats) {
      total += stats.total;
      stats.labelText.forEach((k, v) -> labelText.merge(k, v, Long::sum));
      stats.labelId.forEach((k, v) -> labelId.merge(k, v, Long::sum));
      stats.labelRaw.forEach((k, v) -> labelRaw.merge(k, v, Long::sum));
      stats.source.forEach((k, v) -> source.merge(k, v, Long::sum));
      stats.format.forEach((k, v) -> format.merge(k, v, Long::sum));
      stats.colorspace.forEach((k, v) -> colorspace.merge(k, v, Long::sum));
      return this;
    }

    public DatasetStats build() {
      return new DatasetStats(this);
    }
  }
}

package ca.gc.cra.terf.domain.shard;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Groups rows, in input order, into shards of at most {@code perShard} rows.
 *
 * <p>Shard ids start at 1 and increase by one per emitted shard; every emitted shard carries the
 * same {@code total}. Not thread-safe: owned by the single producer task of a build.</p>
 *
 * @since 0.1.0
 */
public final class ShardAccumulator {
  /** Rows per shard used when none is configured. */
  public static final int DEFAULT_PER_SHARD = 1024;

  private final int perShard;
  private final int total;
  private List<RowDescriptor> current;
  private int nextId = 1;

  /**
   * Creates an accumulator for a job of {@code totalRecords} rows.
   *
   * @param totalRecords number of rows the job will feed
   * @param perShard maximum rows per shard
   */
  public ShardAccumulator(long totalRecords, int perShard) {
    this.total = totalShards(totalRecords, perShard);
    this.perShard = perShard;
    this.current = new ArrayList<>(Math.min(perShard, 4096));
  }

  /**
   * Number of shards produced for {@code totalRecords} rows split {@code perShard} at a time.
   *
   * @param totalRecords row count; must be non-negative
   * @param perShard rows per shard; must be positive
   * @return {@code 1} when {@code perShard > totalRecords}, otherwise {@code ceil(totalRecords / perShard)}
   */
  public static int totalShards(long totalRecords, int perShard) {
    if (totalRecords < 0) {
      throw new IllegalArgumentException("totalRecords must be >= 0 (was " + totalRecords + ")");
    }
    if (perShard <= 0) {
      throw new IllegalArgumentException("perShard must be > 0 (was " + perShard + ")");
    }
    if (perShard > totalRecords) {
      return 1;
    }
    return Math.toIntExact((totalRecords + perShard - 1) / perShard);
  }

  /**
   * Appends {@code row}; returns the shard it completes, if any.
   *
   * @param row next row in input order
   * @return completed shard, or empty when the current shard still has room
   */
  public Optional<Shard> accumulate(RowDescriptor row) {
    current.add(row);
    if (current.size() < perShard) {
      return Optional.empty();
    }
    return Optional.of(emit());
  }

  /**
   * Returns the partially filled final shard, if any rows are pending.
   *
   * @return final shard or empty
   */
  public Optional<Shard> flush() {
    if (current.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(emit());
  }

  public int totalShards() {
    return total;
  }

  private Shard emit() {
    if (nextId > total) {
      throw new IllegalStateException(
          "row count exceeds the " + total + " shard(s) computed from the first pass");
    }
    Shard shard = new Shard(nextId++, total, current);
    current = new ArrayList<>(Math.min(perShard, 4096));
    return shard;
  }
}

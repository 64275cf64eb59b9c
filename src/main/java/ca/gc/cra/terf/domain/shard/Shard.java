package ca.gc.cra.terf.domain.shard;

import java.util.List;

/**
 * Contiguous run of rows destined for one output file.
 *
 * @param id 1-based shard id
 * @param total number of shards the job will produce
 * @param rows rows in input order; never empty
 * @since 0.1.0
 */
public record Shard(int id, int total, List<RowDescriptor> rows) {

  public Shard {
    if (id < 1) {
      throw new IllegalArgumentException("shard id must be >= 1 (was " + id + ")");
    }
    if (total < 1) {
      throw new IllegalArgumentException("shard total must be >= 1 (was " + total + ")");
    }
    rows = List.copyOf(rows);
    if (rows.isEmpty()) {
      throw new IllegalArgumentException("shard must contain at least one row");
    }
  }

  /**
   * Output file name for this shard.
   *
   * @param baseName dataset base name such as {@code train}
   * @return name in the form {@code train-00001-of-00003}
   */
  public String fileName(String baseName) {
    return ShardNaming.fileName(baseName, id, total);
  }

  public int size() {
    return rows.size();
  }
}

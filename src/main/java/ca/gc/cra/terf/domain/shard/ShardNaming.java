package ca.gc.cra.terf.domain.shard;

import java.util.Locale;

/**
 * Shard file naming: {@code {name}-{id:05d}-of-{total:05d}}.
 *
 * @since 0.1.0
 */
public final class ShardNaming {
  /** Base name used when none is configured. */
  public static final String DEFAULT_NAME = "train";

  private ShardNaming() {}

  public static String fileName(String baseName, int id, int total) {
    return String.format(Locale.ROOT, "%s-%05d-of-%05d", baseName, id, total);
  }
}

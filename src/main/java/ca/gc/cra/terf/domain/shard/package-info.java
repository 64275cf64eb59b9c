/**
 * Metadata rows, their grouping into numbered shards, and the per-row failures a build recovers from.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.terf.domain.shard.ShardAccumulator} is confined to
 * the producer task; {@link ca.gc.cra.terf.domain.shard.Shard} and
 * {@link ca.gc.cra.terf.domain.shard.RowDescriptor} are immutable.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.terf.domain.shard;

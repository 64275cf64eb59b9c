/**
 * Use cases behind the terf commands and the concurrency primitives they share.
 * <p><strong>Role:</strong> {@link ca.gc.cra.terf.application.pipeline.BuildUseCase} shards a metadata
 * table; {@link ca.gc.cra.terf.application.pipeline.SummaryUseCase} and
 * {@link ca.gc.cra.terf.application.pipeline.ExtractUseCase} fold over existing frame files through
 * {@link ca.gc.cra.terf.application.pipeline.FileAggregationPipeline}.</p>
 * <p><strong>Concurrency:</strong> Every job is a {@link ca.gc.cra.terf.application.pipeline.TaskGroup}
 * whose tasks communicate through bounded {@link ca.gc.cra.terf.application.pipeline.BoundedHandoff}s
 * and stop on the first failure recorded in a shared
 * {@link ca.gc.cra.terf.application.pipeline.CancellationSignal}.</p>
 * <p><strong>Metrics:</strong> {@code build.*} and {@code aggregate.*} counters through
 * {@link ca.gc.cra.terf.application.port.MetricsPort}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.terf.application.pipeline;

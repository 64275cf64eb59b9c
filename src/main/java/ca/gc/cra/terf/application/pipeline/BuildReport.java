package ca.gc.cra.terf.application.pipeline;

/**
 * Outcome of a successful build.
 *
 * @param shardsWritten shard files created
 * @param recordsWritten frames written across all shards
 * @param rowsSkippedParse metadata rows dropped because they did not parse
 * @param rowsSkippedConversion rows dropped because their image could not be converted
 * @since 0.1.0
 */
public record BuildReport(
    int shardsWritten, long recordsWritten, long rowsSkippedParse, long rowsSkippedConversion) {

  public long rowsSkipped() {
    return rowsSkippedParse + rowsSkippedConversion;
  }
}

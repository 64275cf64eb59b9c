package ca.gc.cra.terf.domain.shard;

/**
 * Checked exception thrown when a metadata row cannot be parsed into a {@link RowDescriptor}.
 *
 * @since 0.1.0
 */
public final class RowParseException extends RecoverableRowException {
  private static final long serialVersionUID = 1L;

  private final long rowNumber;

  /**
   * Creates an exception for a malformed row.
   *
   * @param rowNumber 1-based data row number (the header row is not counted)
   * @param message human-readable error
   */
  public RowParseException(long rowNumber, String message) {
    super("row " + rowNumber + ": " + message);
    this.rowNumber = rowNumber;
  }

  /**
   * Creates an exception for a malformed row with an underlying cause.
   *
   * @param rowNumber 1-based data row number
   * @param message human-readable error
   * @param cause parser failure
   */
  public RowParseException(long rowNumber, String message, Throwable cause) {
    super("row " + rowNumber + ": " + message, cause);
    this.rowNumber = rowNumber;
  }

  public long rowNumber() {
    return rowNumber;
  }
}

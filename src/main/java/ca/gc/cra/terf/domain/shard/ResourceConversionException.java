package ca.gc.cra.terf.domain.shard;

/**
 * Checked exception thrown when the image referenced by a row cannot be read or decoded.
 *
 * @since 0.1.0
 */
public final class ResourceConversionException extends RecoverableRowException {
  private static final long serialVersionUID = 1L;

  public ResourceConversionException(String message) {
    super(message);
  }

  public ResourceConversionException(String message, Throwable cause) {
    super(message, cause);
  }
}

package ca.gc.cra.terf.domain.shard;

/**
 * Failure confined to a single input row. The row is logged, counted and skipped; the job keeps
 * running.
 *
 * @since 0.1.0
 */
public abstract class RecoverableRowException extends Exception {
  private static final long serialVersionUID = 1L;

  protected RecoverableRowException(String message) {
    super(message);
  }

  protected RecoverableRowException(String message, Throwable cause) {
    super(message, cause);
  }
}

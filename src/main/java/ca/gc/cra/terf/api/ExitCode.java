package ca.gc.cra.terf.api;

/**
 * <strong>What:</strong> Process exit codes shared by the terf commands.
 * <p><strong>Role:</strong> Returned by every CLI entry point and passed to {@link System#exit(int)}
 * by {@link Main}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution, including builds that skipped bad rows. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure, including corrupt frames, while running the command. */
  IO_ERROR(3),
  /** Configuration was inconsistent with the inputs. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}

package ca.gc.cra.terf.application.pipeline;

import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Job-wide cancellation flag that remembers the failure which raised it.
 *
 * <p>Only the first {@link #cancel(Throwable)} wins; later failures are usually consequences of the
 * first one (a closed hand-off, an interrupted wait) and are ignored. Thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CancellationSignal {
  private final AtomicReference<Throwable> cause = new AtomicReference<>();

  /**
   * Cancels the job.
   *
   * @param failure reason for the cancellation
   * @return {@code true} if this call cancelled the job, {@code false} if it was already cancelled
   */
  public boolean cancel(Throwable failure) {
    return cause.compareAndSet(null, failure);
  }

  public boolean isCancelled() {
    return cause.get() != null;
  }

  /**
   * Failure that cancelled the job.
   *
   * @return first failure, or empty while the job is still running
   */
  public Optional<Throwable> cause() {
    return Optional.ofNullable(cause.get());
  }

  /**
   * Throws if the job has been cancelled.
   *
   * @throws CancellationException carrying the first failure as its cause
   */
  public void throwIfCancelled() {
    Throwable failure = cause.get();
    if (failure != null) {
      CancellationException cancelled = new CancellationException("job cancelled: " + failure);
      cancelled.initCause(failure);
      throw cancelled;
    }
  }
}

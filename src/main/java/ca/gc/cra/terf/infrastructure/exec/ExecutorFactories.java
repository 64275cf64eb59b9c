package ca.gc.cra.terf.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the executors that run pipeline tasks.
 */
public final class ExecutorFactories {
  private static final String DEFAULT_PREFIX = "terf-task";

  private ExecutorFactories() {}

  /**
   * Builds an executor with exactly {@code size} named, non-daemon threads and no task queue.
   *
   * <p>Submitting more than {@code size} concurrently running tasks is rejected; callers size the
   * pool to the number of tasks they start.</p>
   *
   * @param size number of threads to allocate
   * @param prefix thread-name prefix; {@code terf-task} when blank
   * @param handler uncaught exception handler installed on each thread; may be {@code null}
   * @return configured executor service
   */
  public static ExecutorService newTaskPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? DEFAULT_PREFIX : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(false);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }
}

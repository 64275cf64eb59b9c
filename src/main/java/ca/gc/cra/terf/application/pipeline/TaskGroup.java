package ca.gc.cra.terf.application.pipeline;

import ca.gc.cra.terf.infrastructure.exec.ExecutorFactories;
import java.lang.Thread.UncaughtExceptionHandler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a fixed set of tasks on dedicated threads; the first task to fail cancels the rest.
 *
 * <p>Every task shares one {@link CancellationSignal}. A failing task records its exception there
 * and the others notice it at their next hand-off or explicit check. {@link #await()} waits for
 * every task to finish, shuts the threads down and rethrows the first failure. Instances are single
 * use and meant to be driven by one thread.</p>
 *
 * @since 0.1.0
 */
public final class TaskGroup implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(TaskGroup.class);
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  /** Unit of work run by the group. */
  @FunctionalInterface
  public interface Task {
    void run() throws Exception;
  }

  private final String name;
  private final int capacity;
  private final CancellationSignal signal;
  private final ExecutorService executor;
  private final List<Future<?>> futures = new ArrayList<>();

  /**
   * Creates a group with room for {@code capacity} concurrently running tasks.
   *
   * @param name thread-name prefix, e.g. {@code build}
   * @param capacity number of tasks that will be submitted
   * @param signal cancellation signal shared with the tasks
   */
  public TaskGroup(String name, int capacity, CancellationSignal signal) {
    this.name = Objects.requireNonNull(name, "name");
    this.capacity = capacity;
    this.signal = Objects.requireNonNull(signal, "signal");
    UncaughtExceptionHandler crashHandler = this::handleCrash;
    this.executor = ExecutorFactories.newTaskPool(capacity, "terf-" + name, crashHandler);
  }

  /**
   * Starts {@code task} on its own thread.
   *
   * @param task work to run
   * @throws IllegalStateException if more tasks are submitted than the group was sized for
   */
  public void submit(Task task) {
    Objects.requireNonNull(task, "task");
    if (futures.size() >= capacity) {
      throw new IllegalStateException("task group " + name + " is full (" + capacity + " tasks)");
    }
    futures.add(executor.submit(() -> runGuarded(task)));
  }

  /**
   * Waits for every submitted task, then rethrows the first failure, if any.
   *
   * @throws Exception the first exception raised by any task
   * @throws InterruptedException if the waiting thread is interrupted; the tasks are cancelled
   */
  public void await() throws Exception {
    try {
      for (Future<?> future : futures) {
        future.get();
      }
    } catch (InterruptedException ex) {
      signal.cancel(ex);
      shutdown(true);
      throw ex;
    } catch (ExecutionException ex) {
      signal.cancel(ex.getCause());
    }
    shutdown(false);
    Throwable failure = signal.cause().orElse(null);
    if (failure instanceof Exception exception) {
      throw exception;
    }
    if (failure instanceof Error error) {
      throw error;
    }
    if (failure != null) {
      throw new IllegalStateException("task group " + name + " failed", failure);
    }
  }

  @Override
  public void close() {
    if (!executor.isTerminated()) {
      signal.cancel(new CancellationException("task group " + name + " closed before completion"));
      shutdown(true);
    }
  }

  private void runGuarded(Task task) {
    try {
      task.run();
    } catch (CancellationException ex) {
      if (signal.cancel(ex)) {
        log.warn("Task in group {} cancelled without a recorded cause", name, ex);
      } else {
        log.debug("Task in group {} stopped after cancellation", name);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      signal.cancel(ex);
    } catch (Exception | Error ex) {
      if (signal.cancel(ex)) {
        log.debug("Task in group {} failed first; cancelling siblings", name, ex);
      } else {
        log.debug("Task in group {} failed after cancellation: {}", name, ex.toString());
      }
    }
  }

  private void handleCrash(Thread thread, Throwable throwable) {
    log.error("Task thread {} threw an uncaught exception", thread.getName(), throwable);
    signal.cancel(throwable);
  }

  private void shutdown(boolean interruptRunning) {
    if (interruptRunning) {
      executor.shutdownNow();
    } else {
      executor.shutdown();
    }
    boolean terminated = false;
    try {
      terminated = executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      if (!terminated) {
        log.warn("Tasks in group {} still active after {} ms; forcing shutdown", name, SHUTDOWN_TIMEOUT.toMillis());
        executor.shutdownNow();
        terminated = executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
    if (!terminated) {
      log.error("Tasks in group {} failed to terminate cleanly", name);
    }
  }
}

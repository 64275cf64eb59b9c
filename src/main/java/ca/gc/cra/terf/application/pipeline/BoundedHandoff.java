package ca.gc.cra.terf.application.pipeline;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;

/**
 * Bounded, cancellable queue between the stages of a pipeline.
 *
 * <p>{@link #put(Object)} blocks while the queue is full and {@link #take()} while it is empty, but
 * both wake up every {@value #POLL_SLICE_MILLIS} ms to check the {@link CancellationSignal}, so no
 * stage stays blocked after another stage fails. End of input is announced by {@link #close()},
 * which enqueues one end marker per consumer.</p>
 *
 * @param <T> item type
 * @since 0.1.0
 */
public final class BoundedHandoff<T> {
  static final long POLL_SLICE_MILLIS = 25L;

  private final BlockingQueue<Optional<T>> queue;
  private final CancellationSignal signal;
  private final int consumers;

  /**
   * Creates a hand-off.
   *
   * @param capacity maximum number of queued items
   * @param consumers number of tasks that will call {@link #take()} until it returns empty
   * @param signal job cancellation signal
   */
  public BoundedHandoff(int capacity, int consumers, CancellationSignal signal) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    if (consumers <= 0) {
      throw new IllegalArgumentException("consumers must be positive");
    }
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.consumers = consumers;
    this.signal = Objects.requireNonNull(signal, "signal");
  }

  /**
   * Enqueues {@code item}, waiting for space.
   *
   * @param item item to hand over
   * @throws InterruptedException if the calling thread is interrupted
   * @throws CancellationException if the job is cancelled while waiting
   */
  public void put(T item) throws InterruptedException {
    offer(Optional.of(Objects.requireNonNull(item, "item")));
  }

  /**
   * Dequeues the next item, waiting for one to arrive.
   *
   * @return next item, or empty once this consumer has received its end marker
   * @throws InterruptedException if the calling thread is interrupted
   * @throws CancellationException if the job is cancelled while waiting
   */
  public Optional<T> take() throws InterruptedException {
    while (true) {
      signal.throwIfCancelled();
      Optional<T> next = queue.poll(POLL_SLICE_MILLIS, TimeUnit.MILLISECONDS);
      if (next != null) {
        return next;
      }
    }
  }

  /**
   * Signals end of input to every consumer. Call once, from the producer, after the last
   * {@link #put(Object)}.
   *
   * @throws InterruptedException if the calling thread is interrupted
   * @throws CancellationException if the job is cancelled while waiting for space
   */
  public void close() throws InterruptedException {
    for (int i = 0; i < consumers; i++) {
      offer(Optional.empty());
    }
  }

  private void offer(Optional<T> element) throws InterruptedException {
    while (true) {
      signal.throwIfCancelled();
      if (queue.offer(element, POLL_SLICE_MILLIS, TimeUnit.MILLISECONDS)) {
        return;
      }
    }
  }
}

package ca.gc.cra.terf.application.pipeline;

import ca.gc.cra.terf.application.port.MetricsPort;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans a set of input files out to worker tasks and folds their per-file results on the calling
 * thread.
 *
 * <p>A producer task lists the input (the regular files directly inside a directory, sorted by
 * name, or a single regular file) and hands the paths to {@code threads} workers. Each worker turns
 * one file into one result; results travel through a second bounded hand-off to the
 * {@link Aggregator}, which runs on the thread that called {@link #run}. The first failure anywhere,
 * including in the aggregator, cancels every task and is rethrown once all tasks have stopped.</p>
 *
 * @param <R> per-file result type
 * @since 0.1.0
 */
public final class FileAggregationPipeline<R> {
  private static final Logger log = LoggerFactory.getLogger(FileAggregationPipeline.class);

  /** Turns one input file into one result. Called concurrently from several workers. */
  @FunctionalInterface
  public interface FileWorker<R> {
    R process(Path file) throws Exception;
  }

  /** Folds results; only ever called from the thread running the pipeline. */
  @FunctionalInterface
  public interface Aggregator<R> {
    void accept(R result) throws Exception;
  }

  private final String name;
  private final int threads;
  private final MetricsPort metrics;

  /**
   * Creates a pipeline.
   *
   * @param name short job name used for thread names and logs, e.g. {@code summary}
   * @param threads number of file workers
   * @param metrics metrics sink
   */
  public FileAggregationPipeline(String name, int threads, MetricsPort metrics) {
    if (threads <= 0) {
      throw new IllegalArgumentException("threads must be positive");
    }
    this.name = Objects.requireNonNull(name, "name");
    this.threads = threads;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Processes every file of {@code input} and folds the results.
   *
   * @param input a regular file or a directory of files
   * @param worker per-file processing
   * @param aggregator result fold
   * @return number of files processed
   * @throws Exception the first failure raised by the listing, a worker or the aggregator
   */
  public int run(Path input, FileWorker<R> worker, Aggregator<R> aggregator) throws Exception {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(worker, "worker");
    Objects.requireNonNull(aggregator, "aggregator");

    CancellationSignal signal = new CancellationSignal();
    BoundedHandoff<Path> paths = new BoundedHandoff<>(threads, threads, signal);
    BoundedHandoff<R> results = new BoundedHandoff<>(threads, 1, signal);
    AtomicInteger activeWorkers = new AtomicInteger(threads);
    int folded = 0;

    try (TaskGroup group = new TaskGroup(name, threads + 1, signal)) {
      group.submit(() -> {
        for (Path file : listInputs(input)) {
          paths.put(file);
        }
        paths.close();
      });
      for (int i = 0; i < threads; i++) {
        group.submit(() -> {
          while (true) {
            Optional<Path> file = paths.take();
            if (file.isEmpty()) {
              break;
            }
            R result;
            try {
              result = worker.process(file.get());
            } catch (IOException ex) {
              log.error("{} failed on {}: {}", name, file.get(), ex.getMessage());
              throw ex;
            }
            metrics.increment("aggregate.files.processed");
            log.debug("{} processed {}", name, file.get());
            results.put(result);
          }
          if (activeWorkers.decrementAndGet() == 0) {
            results.close();
          }
        });
      }

      try {
        while (true) {
          Optional<R> result = results.take();
          if (result.isEmpty()) {
            break;
          }
          aggregator.accept(result.get());
          folded++;
        }
      } catch (CancellationException ex) {
        log.debug("{} aggregation stopped after cancellation", name);
      } catch (Exception ex) {
        signal.cancel(ex);
      }
      group.await();
    }
    return folded;
  }

  /**
   * Lists the files a job reads.
   *
   * @param input a regular file or a directory
   * @return {@code input} itself when it is a regular file, otherwise the regular files directly
   *     inside it sorted by file name
   * @throws IOException if the directory cannot be listed or {@code input} is neither a file nor a
   *     directory
   */
  public static List<Path> listInputs(Path input) throws IOException {
    if (Files.isRegularFile(input)) {
      return List.of(input);
    }
    if (!Files.isDirectory(input)) {
      throw new IOException("Input is neither a file nor a directory: " + input);
    }
    try (Stream<Path> entries = Files.list(input)) {
      return entries
          .filter(Files::isRegularFile)
          .sorted(Comparator.comparing(path -> path.getFileName().toString()))
          .collect(Collectors.toCollection(ArrayList::new));
    }
  }
}

package ca.gc.cra.terf.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

class TaskGroupTest {

  @Test
  void runsEveryTask() throws Exception {
    CancellationSignal signal = new CancellationSignal();
    AtomicInteger ran = new AtomicInteger();
    try (TaskGroup group = new TaskGroup("test", 3, signal)) {
      for (int i = 0; i < 3; i++) {
        group.submit(ran::incrementAndGet);
      }
      group.await();
    }
    assertEquals(3, ran.get());
    assertFalse(signal.isCancelled());
  }

  @Test
  @Timeout(10)
  void firstFailureCancelsSiblingsAndIsRethrown() {
    CancellationSignal signal = new CancellationSignal();
    IOException boom = new IOException("boom");
    AtomicBoolean siblingStopped = new AtomicBoolean();

    IOException thrown = assertThrows(IOException.class, () -> {
      try (TaskGroup group = new TaskGroup("test", 2, signal)) {
        group.submit(() -> {
          try {
            while (true) {
              signal.throwIfCancelled();
              Thread.sleep(5);
            }
          } finally {
            siblingStopped.set(true);
          }
        });
        group.submit(() -> {
          throw boom;
        });
        group.await();
      }
    });

    assertSame(boom, thrown);
    assertSame(boom, signal.cause().orElseThrow());
    assertTrue(siblingStopped.get());
  }

  @Test
  @Timeout(10)
  void handoffWaitersWakeOnCancellation() {
    CancellationSignal signal = new CancellationSignal();
    BoundedHandoff<String> handoff = new BoundedHandoff<>(1, 1, signal);
    IllegalStateException failure = new IllegalStateException("producer failed");

    IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> {
      try (TaskGroup group = new TaskGroup("test", 2, signal)) {
        group.submit(() -> handoff.take());
        group.submit(() -> {
          throw failure;
        });
        group.await();
      }
    });
    assertSame(failure, thrown);
  }

  @Test
  void rejectsMoreTasksThanCapacity() {
    try (TaskGroup group = new TaskGroup("test", 1, new CancellationSignal())) {
      group.submit(() -> { });
      assertThrows(IllegalStateException.class, () -> group.submit(() -> { }));
    }
  }
}

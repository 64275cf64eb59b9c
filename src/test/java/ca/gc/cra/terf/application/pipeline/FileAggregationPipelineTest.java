package ca.gc.cra.terf.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.terf.application.port.MetricsPort;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

class FileAggregationPipelineTest {
  @TempDir Path tempDir;

  @Test
  void listsRegularFilesSortedByName() throws IOException {
    Files.writeString(tempDir.resolve("b"), "");
    Files.writeString(tempDir.resolve("a"), "");
    Files.createDirectory(tempDir.resolve("nested"));

    assertEquals(List.of(tempDir.resolve("a"), tempDir.resolve("b")),
        FileAggregationPipeline.listInputs(tempDir));
    assertEquals(List.of(tempDir.resolve("a")), FileAggregationPipeline.listInputs(tempDir.resolve("a")));
    assertThrows(IOException.class, () -> FileAggregationPipeline.listInputs(tempDir.resolve("missing")));
  }

  @Test
  void foldsOneResultPerFile() throws Exception {
    for (int i = 0; i < 20; i++) {
      Files.writeString(tempDir.resolve("f" + i), "x".repeat(i));
    }
    List<Long> sizes = new ArrayList<>();

    int folded = new FileAggregationPipeline<Long>("test", 4, MetricsPort.NO_OP)
        .run(tempDir, Files::size, sizes::add);

    assertEquals(20, folded);
    assertEquals(190L, sizes.stream().mapToLong(Long::longValue).sum());
  }

  @Test
  @Timeout(10)
  void workerFailureStopsTheJob() throws Exception {
    for (int i = 0; i < 50; i++) {
      Files.writeString(tempDir.resolve("f" + i), "");
    }
    IOException broken = new IOException("unreadable");

    IOException thrown = assertThrows(IOException.class,
        () -> new FileAggregationPipeline<Path>("test", 3, MetricsPort.NO_OP).run(tempDir, file -> {
          if (file.getFileName().toString().equals("f17")) {
            throw broken;
          }
          return file;
        }, file -> { }));
    assertSame(broken, thrown);
  }

  @Test
  @Timeout(10)
  void aggregatorFailureStopsTheJob() throws Exception {
    for (int i = 0; i < 50; i++) {
      Files.writeString(tempDir.resolve("f" + i), "");
    }
    IllegalStateException full = new IllegalStateException("full");

    IllegalStateException thrown = assertThrows(IllegalStateException.class,
        () -> new FileAggregationPipeline<Path>("test", 2, MetricsPort.NO_OP).run(tempDir, file -> file, file -> {
          throw full;
        }));
    assertSame(full, thrown);
  }
}

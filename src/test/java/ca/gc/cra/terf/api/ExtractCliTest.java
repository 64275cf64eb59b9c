package ca.gc.cra.terf.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExtractCliTest {
  @TempDir Path tempDir;

  @Test
  void extractsImagesAndTable() throws IOException {
    Path table = CliTestSupport.writeDataset(tempDir, 3);
    Path shards = tempDir.resolve("shards");
    Path images = tempDir.resolve("images");
    try (CliTestSupport ignored = new CliTestSupport(BuildCli.class)) {
      assertEquals(ExitCode.SUCCESS, BuildCli.run(new String[] {"in=" + table, "out=" + shards}));
    }

    try (CliTestSupport cli = new CliTestSupport(ExtractCli.class)) {
      ExitCode code = ExtractCli.run(new String[] {"in=" + shards, "out=" + images});

      assertEquals(ExitCode.SUCCESS, code);
    }
    assertEquals(List.of("1.png", "2.png", "3.png", "info.csv"), BuildCliTest.list(images));
    List<String> info = Files.readAllLines(images.resolve("info.csv"), StandardCharsets.UTF_8);
    assertEquals("image_path,image_id,label_id,label_text,label_raw,source", info.get(0));
    assertEquals(4, info.size());
  }

  @Test
  void emptyDatasetFailsWithoutTable() throws IOException {
    Path shards = Files.createDirectory(tempDir.resolve("shards"));
    Files.write(shards.resolve("empty"), new byte[0]);
    Path images = tempDir.resolve("images");

    try (CliTestSupport cli = new CliTestSupport(ExtractCli.class)) {
      ExitCode code = ExtractCli.run(new String[] {"in=" + shards, "out=" + images});

      assertEquals(ExitCode.IO_ERROR, code);
      assertTrue(cli.logged(Level.ERROR, "No images found"));
    }
    assertFalse(Files.exists(images.resolve("info.csv")));
  }

  @Test
  void dryRunIsNotAnExtractFlag() {
    try (CliTestSupport cli = new CliTestSupport(ExtractCli.class)) {
      ExitCode code = ExtractCli.run(new String[] {"in=" + tempDir, "out=" + tempDir.resolve("o"), "--dry-run"});

      assertEquals(ExitCode.INVALID_ARGS, code);
      assertTrue(cli.stdout().contains("usage: extract"));
    }
  }
}

package ca.gc.cra.terf.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void validateOutputDirReturnsCanonicalPathWhenDirectoryExists() throws IOException {
    Path dir = Files.createDirectory(tempDir.resolve("existing"));
    assertEquals(dir.toRealPath(), Paths.validateOutputDir(dir, false, false));
  }

  @Test
  void validateOutputDirRejectsNonEmptyDirectoryWithoutAllowOverwrite() throws IOException {
    Path dir = Files.createDirectory(tempDir.resolve("nonEmpty"));
    Files.createFile(dir.resolve("train-00001-of-00001"));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () ->
        Paths.validateOutputDir(dir, true, false));
    assertTrue(ex.getMessage().contains("--allow-overwrite"));
    assertEquals(dir.toRealPath(), Paths.validateOutputDir(dir, true, true));
  }

  @Test
  void validateOutputDirCreatesWhenRequested() {
    Path validated = Paths.validateOutputDir(tempDir.resolve("a/b"), true, false);
    assertTrue(Files.isDirectory(validated));
  }

  @Test
  void validateOutputDirLeavesMissingDirectoryDuringDryRun() {
    Path dir = tempDir.resolve("future/child");
    Path validated = Paths.validateOutputDir(dir, false, false);
    assertTrue(validated.endsWith(Path.of("future", "child")));
    assertTrue(Files.notExists(dir));
  }

  @Test
  void requireReadableFileRejectsDirectoriesAndMissingFiles() throws IOException {
    Path file = Files.writeString(tempDir.resolve("meta.csv"), "image_path\n");
    assertEquals(file, Paths.requireReadableFile("in", file));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile("in", tempDir));
    assertThrows(IllegalArgumentException.class,
        () -> Paths.requireReadableFile("in", tempDir.resolve("missing.csv")));
    assertEquals(tempDir, Paths.requireReadableInput("in", tempDir));
  }

  @Test
  void parseNormalizesAndRejectsBlank() {
    assertTrue(Paths.parse("out", "a/../b").isAbsolute());
    assertTrue(Paths.parse("out", "a/../b").endsWith("b"));
    assertThrows(IllegalArgumentException.class, () -> Paths.parse("out", "  "));
  }
}

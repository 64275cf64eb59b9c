package ca.gc.cra.terf.validation;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for dataset inputs and output directories.
 * <p><strong>Role:</strong> Runs before a pipeline starts so that a bad {@code in=} or {@code out=}
 * fails fast instead of cancelling a half-finished job.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Normalize user-provided paths.</li>
 *   <li>Require the metadata table to be a regular, readable (and therefore re-readable) file.</li>
 *   <li>Guard against writing into populated output directories unless explicitly approved.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; subject to the usual filesystem races.</p>
 *
 * @since 0.1.0
 * @see Strings
 * @see Numbers
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Parses operator input into an absolute, normalized path.
   *
   * @param name parameter name used in error messages
   * @param value raw path text
   * @return absolute normalized path
   * @throws IllegalArgumentException if blank, containing control characters, or not a valid path
   */
  public static Path parse(String name, String value) {
    String raw = Strings.requireNonBlank(name, value);
    try {
      return Path.of(raw).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + raw, ex);
    }
  }

  /**
   * Requires {@code path} to be an existing, readable regular file.
   *
   * @param name parameter name used in error messages
   * @param path candidate file
   * @return {@code path}
   * @throws IllegalArgumentException if the file is missing, not regular, or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    requireExisting(name, path);
    if (!Files.isRegularFile(path)) {
      throw new IllegalArgumentException(name + " must be a regular file: " + path);
    }
    return path;
  }

  /**
   * Requires {@code path} to be an existing, readable regular file or directory.
   *
   * @param name parameter name used in error messages
   * @param path candidate file or directory
   * @return {@code path}
   * @throws IllegalArgumentException if missing, unreadable, or neither a file nor a directory
   */
  public static Path requireReadableInput(String name, Path path) {
    requireExisting(name, path);
    if (!Files.isRegularFile(path) && !Files.isDirectory(path)) {
      throw new IllegalArgumentException(name + " must be a file or directory: " + path);
    }
    return path;
  }

  /**
   * Validates an output directory, optionally creating it.
   *
   * <p>When {@code createIfMissing} is {@code false} (dry runs) a missing directory is accepted as
   * long as its nearest existing ancestor is a writable directory.</p>
   *
   * @param path candidate output directory
   * @param createIfMissing create the directory (and parents) when absent
   * @param allowReuse accept a directory that already has entries
   * @return canonical path when the directory exists, otherwise the normalized path
   * @throws IllegalArgumentException if the path is unusable or the directory is populated and reuse
   *     was not approved
   */
  public static Path validateOutputDir(Path path, boolean createIfMissing, boolean allowReuse) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    Path normalized = path.toAbsolutePath().normalize();
    try {
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        Path real = normalized.toRealPath();
        ensureDirectory(real, allowReuse);
        return real;
      }
      if (createIfMissing) {
        Files.createDirectories(normalized);
        Path real = normalized.toRealPath();
        ensureDirectory(real, true);
        return real;
      }
      Path ancestor = nearestExistingAncestor(normalized);
      if (!Files.isDirectory(ancestor) || !Files.isWritable(ancestor)) {
        throw new IllegalArgumentException("cannot create " + normalized + " under " + ancestor);
      }
      return normalized;
    } catch (IOException ex) {
      throw new IllegalArgumentException(
          "unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  private static void requireExisting(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    if (!Files.exists(path)) {
      throw new IllegalArgumentException(name + " does not exist: " + path);
    }
    if (!Files.isReadable(path)) {
      throw new IllegalArgumentException(name + " is not readable: " + path);
    }
  }

  private static void ensureDirectory(Path dir, boolean allowReuse) throws IOException {
    if (!Files.isDirectory(dir)) {
      throw new IllegalArgumentException("path is not a directory: " + dir);
    }
    if (!Files.isWritable(dir)) {
      throw new IllegalArgumentException("directory is not writable: " + dir);
    }
    if (!allowReuse) {
      try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
        if (entries.iterator().hasNext()) {
          throw new IllegalArgumentException(
              "directory " + dir + " is not empty; re-run with --allow-overwrite to reuse");
        }
      }
    }
  }

  private static Path nearestExistingAncestor(Path start) throws IOException {
    Path current = start;
    while (current != null && !Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new IllegalArgumentException("no existing ancestor for " + start);
    }
    return current.toRealPath();
  }
}

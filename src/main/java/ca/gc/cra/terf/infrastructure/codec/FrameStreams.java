package ca.gc.cra.terf.infrastructure.codec;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.InflaterInputStream;

/**
 * Opens frame writers and readers on files, optionally wrapping the whole file in zlib.
 *
 * @since 0.1.0
 */
public final class FrameStreams {
  private FrameStreams() {}

  /**
   * Creates {@code file} (failing if it exists) and returns a writer over it.
   *
   * @param file shard file to create
   * @param compress wrap the file contents in a zlib stream
   * @return frame writer owning the file handle
   * @throws IOException if the file cannot be created
   */
  public static FrameWriter create(Path file, boolean compress) throws IOException {
    return create(file, compress, false);
  }

  /**
   * Creates {@code file} and returns a writer over it.
   *
   * @param file shard file to create
   * @param compress wrap the file contents in a zlib stream
   * @param replaceExisting truncate an existing file instead of failing
   * @return frame writer owning the file handle
   * @throws IOException if the file cannot be created
   */
  public static FrameWriter create(Path file, boolean compress, boolean replaceExisting) throws IOException {
    OutputStream raw = replaceExisting
        ? Files.newOutputStream(file, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE)
        : Files.newOutputStream(file, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    return new FrameWriter(compress ? new DeflaterOutputStream(raw) : raw);
  }

  /**
   * Opens {@code file} for frame iteration.
   *
   * @param file shard file to read
   * @param compressed the file contents are a zlib stream
   * @return frame reader owning the file handle
   * @throws IOException if the file cannot be opened
   */
  public static FrameReader open(Path file, boolean compressed) throws IOException {
    InputStream raw = Files.newInputStream(file);
    return new FrameReader(compressed ? new InflaterInputStream(raw) : raw);
  }
}

package ca.gc.cra.terf.infrastructure.codec;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;
import java.util.Optional;

/**
 * Appends length-prefixed, checksummed records to a byte sink.
 *
 * <p>Each call to {@link #write(byte[])} emits one frame:
 * {@code [u64 LE length][u32 LE masked crc(length)][payload][u32 LE masked crc(payload)]}.
 * Output is buffered; the first I/O failure is latched and every later {@code write} or
 * {@code flush} fails fast with it. Not thread-safe; one writer per shard file.</p>
 *
 * @since 0.1.0
 */
public final class FrameWriter implements Closeable, Flushable {
  static final int HEADER_LEN = 12;
  static final int FOOTER_LEN = 4;
  private static final int BUFFER_SIZE = 1 << 16;

  private final OutputStream out;
  private final byte[] header = new byte[HEADER_LEN];
  private final byte[] footer = new byte[FOOTER_LEN];
  private IOException error;
  private long framesWritten;
  private boolean closed;

  /**
   * Creates a writer over {@code sink}. The writer owns the sink and closes it on {@link #close()}.
   *
   * @param sink destination stream
   */
  public FrameWriter(OutputStream sink) {
    this.out = new BufferedOutputStream(Objects.requireNonNull(sink, "sink"), BUFFER_SIZE);
  }

  /**
   * Appends one frame carrying {@code payload}.
   *
   * @param payload record bytes; may be empty
   * @throws IOException if the sink fails now or failed on an earlier call
   */
  public void write(byte[] payload) throws IOException {
    Objects.requireNonNull(payload, "payload");
    ensureUsable();
    putLongLe(header, 0, payload.length);
    putIntLe(header, 8, MaskedCrc32c.of(header, 0, 8));
    putIntLe(footer, 0, MaskedCrc32c.of(payload));
    try {
      out.write(header);
      out.write(payload);
      out.write(footer);
    } catch (IOException ex) {
      error = ex;
      throw ex;
    }
    framesWritten++;
  }

  /**
   * Pushes buffered frames to the sink.
   *
   * @throws IOException if the sink fails now or failed on an earlier call
   */
  @Override
  public void flush() throws IOException {
    ensureUsable();
    try {
      out.flush();
    } catch (IOException ex) {
      error = ex;
      throw ex;
    }
  }

  /**
   * Returns the failure latched by an earlier {@code write} or {@code flush}, if any.
   *
   * @return latched failure or empty when the writer is healthy
   */
  public Optional<IOException> error() {
    return Optional.ofNullable(error);
  }

  /**
   * Number of frames appended so far.
   *
   * @return frame count
   */
  public long framesWritten() {
    return framesWritten;
  }

  /**
   * Flushes pending frames (unless a failure is latched) and closes the sink.
   *
   * @throws IOException if flushing or closing fails
   */
  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    if (error != null) {
      out.close();
      return;
    }
    try {
      out.flush();
    } catch (IOException ex) {
      error = ex;
      throw ex;
    } finally {
      out.close();
    }
  }

  private void ensureUsable() throws IOException {
    if (error != null) {
      throw new IOException("frame writer failed earlier: " + error.getMessage(), error);
    }
    if (closed) {
      throw new IOException("frame writer is closed");
    }
  }

  static void putLongLe(byte[] buf, int offset, long value) {
    for (int i = 0; i < 8; i++) {
      buf[offset + i] = (byte) (value >>> (8 * i));
    }
  }

  static void putIntLe(byte[] buf, int offset, int value) {
    for (int i = 0; i < 4; i++) {
      buf[offset + i] = (byte) (value >>> (8 * i));
    }
  }
}

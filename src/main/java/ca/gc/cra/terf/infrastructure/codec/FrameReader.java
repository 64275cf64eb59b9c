package ca.gc.cra.terf.infrastructure.codec;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Optional;

/**
 * Iterates the frames of a TFRecord stream, verifying both checksums of every frame.
 *
 * <p>{@link #next()} returns {@link Optional#empty()} only when the stream ends exactly on a frame
 * boundary. Any other short read is reported as {@link FramingException.Kind#TRUNCATED_FRAME}.
 * Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class FrameReader implements Closeable {
  private static final long MAX_PAYLOAD = Integer.MAX_VALUE - 8;
  private static final int BUFFER_SIZE = 1 << 16;

  private final InputStream in;
  private final byte[] header = new byte[FrameWriter.HEADER_LEN];
  private final byte[] footer = new byte[FrameWriter.FOOTER_LEN];
  private long frameIndex;

  /**
   * Creates a reader over {@code source}. The reader owns the source and closes it on {@link #close()}.
   *
   * @param source stream positioned at a frame boundary
   */
  public FrameReader(InputStream source) {
    this.in = new BufferedInputStream(Objects.requireNonNull(source, "source"), BUFFER_SIZE);
  }

  /**
   * Reads the next payload.
   *
   * @return payload bytes, or empty at end of stream
   * @throws FramingException if a checksum mismatches or the stream ends inside a frame
   * @throws IOException if the source fails
   */
  public Optional<byte[]> next() throws IOException {
    int headerRead = readFully(header);
    if (headerRead == 0) {
      return Optional.empty();
    }
    if (headerRead < header.length) {
      throw new FramingException(FramingException.Kind.TRUNCATED_FRAME, frameIndex,
          "stream ended after " + headerRead + " header bytes");
    }
    long length = getLongLe(header, 0);
    int storedLengthCrc = getIntLe(header, 8);
    if (storedLengthCrc != MaskedCrc32c.of(header, 0, 8)) {
      throw new FramingException(FramingException.Kind.INVALID_HEADER_CHECKSUM, frameIndex,
          "length checksum mismatch");
    }
    if (length < 0 || length > MAX_PAYLOAD) {
      throw new FramingException(FramingException.Kind.OVERSIZED_FRAME, frameIndex,
          "declared length " + Long.toUnsignedString(length) + " exceeds supported maximum");
    }

    byte[] payload = new byte[(int) length];
    int payloadRead = readFully(payload);
    if (payloadRead < payload.length) {
      throw new FramingException(FramingException.Kind.TRUNCATED_FRAME, frameIndex,
          "stream ended after " + payloadRead + " of " + length + " payload bytes");
    }
    int footerRead = readFully(footer);
    if (footerRead < footer.length) {
      throw new FramingException(FramingException.Kind.TRUNCATED_FRAME, frameIndex,
          "stream ended inside payload checksum");
    }
    if (getIntLe(footer, 0) != MaskedCrc32c.of(payload)) {
      throw new FramingException(FramingException.Kind.INVALID_PAYLOAD_CHECKSUM, frameIndex,
          "payload checksum mismatch");
    }
    frameIndex++;
    return Optional.of(payload);
  }

  /**
   * Number of frames successfully read so far.
   *
   * @return frame count
   */
  public long framesRead() {
    return frameIndex;
  }

  @Override
  public void close() throws IOException {
    in.close();
  }

  private int readFully(byte[] target) throws IOException {
    int total = 0;
    while (total < target.length) {
      int n = in.read(target, total, target.length - total);
      if (n < 0) {
        break;
      }
      total += n;
    }
    return total;
  }

  static long getLongLe(byte[] buf, int offset) {
    long value = 0;
    for (int i = 7; i >= 0; i--) {
      value = (value << 8) | (buf[offset + i] & 0xFFL);
    }
    return value;
  }

  static int getIntLe(byte[] buf, int offset) {
    return (buf[offset] & 0xFF)
        | (buf[offset + 1] & 0xFF) << 8
        | (buf[offset + 2] & 0xFF) << 16
        | (buf[offset + 3] & 0xFF) << 24;
  }
}

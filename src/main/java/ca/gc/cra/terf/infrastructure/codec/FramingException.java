package ca.gc.cra.terf.infrastructure.codec;

import java.io.IOException;
import java.util.Objects;

/**
 * Raised when a frame cannot be decoded. Framing errors are never skipped: once a stream
 * reports one, its remaining contents are not trusted.
 *
 * @since 0.1.0
 */
public final class FramingException extends IOException {
  private static final long serialVersionUID = 1L;

  /** Kinds of framing failure. */
  public enum Kind {
    /** Stored length checksum does not match the length bytes. */
    INVALID_HEADER_CHECKSUM,
    /** Stored payload checksum does not match the payload. */
    INVALID_PAYLOAD_CHECKSUM,
    /** Stream ended inside a frame. */
    TRUNCATED_FRAME,
    /** Declared length cannot be held in memory. */
    OVERSIZED_FRAME
  }

  private final Kind kind;
  private final long frameIndex;

  /**
   * Creates a framing exception.
   *
   * @param kind failure category
   * @param frameIndex zero-based index of the frame being decoded
   * @param message detail message
   */
  public FramingException(Kind kind, long frameIndex, String message) {
    super(message + " (frame " + frameIndex + ", " + Objects.requireNonNull(kind, "kind") + ")");
    this.kind = kind;
    this.frameIndex = frameIndex;
  }

  public Kind kind() {
    return kind;
  }

  public long frameIndex() {
    return frameIndex;
  }
}

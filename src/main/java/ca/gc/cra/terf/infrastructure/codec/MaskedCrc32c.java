package ca.gc.cra.terf.infrastructure.codec;

import java.util.zip.CRC32C;

/**
 * Masked CRC32C (Castagnoli) checksums as stored in TFRecord frames.
 *
 * <p>The mask rotates the raw checksum right by 15 bits and adds a constant, all modulo 2^32, so
 * that a CRC computed over data which itself embeds CRCs stays well distributed.</p>
 *
 * @since 0.1.0
 */
public final class MaskedCrc32c {
  /** Constant added after rotation. */
  public static final int MASK_DELTA = 0xa282ead8;

  private MaskedCrc32c() {}

  /**
   * Computes the masked checksum of a byte range.
   *
   * @param data source bytes
   * @param offset first byte to include
   * @param length number of bytes to include
   * @return masked CRC32C as an unsigned 32-bit value stored in an {@code int}
   */
  public static int of(byte[] data, int offset, int length) {
    CRC32C crc = new CRC32C();
    crc.update(data, offset, length);
    return mask((int) crc.getValue());
  }

  /**
   * Computes the masked checksum of a whole array.
   *
   * @param data source bytes
   * @return masked CRC32C
   */
  public static int of(byte[] data) {
    return of(data, 0, data.length);
  }

  /**
   * Applies the TFRecord mask to a raw CRC32C value.
   *
   * @param crc raw checksum
   * @return masked checksum
   */
  public static int mask(int crc) {
    return ((crc >>> 15) | (crc << 17)) + MASK_DELTA;
  }

  /**
   * Reverses {@link #mask(int)}.
   *
   * @param masked masked checksum
   * @return raw CRC32C value
   */
  public static int unmask(int masked) {
    int rot = masked - MASK_DELTA;
    return (rot >>> 17) | (rot << 15);
  }
}

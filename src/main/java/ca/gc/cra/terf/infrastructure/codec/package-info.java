/**
 * TFRecord framing: length-prefixed records guarded by masked CRC32C checksums.
 * <p><strong>Concurrency:</strong> Writers and readers are single-threaded; each pipeline worker owns its own.</p>
 */
package ca.gc.cra.terf.infrastructure.codec;

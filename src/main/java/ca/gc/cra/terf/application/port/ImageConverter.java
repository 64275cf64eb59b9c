package ca.gc.cra.terf.application.port;

import ca.gc.cra.terf.domain.image.ImageRecord;
import ca.gc.cra.terf.domain.shard.ResourceConversionException;
import ca.gc.cra.terf.domain.shard.RowDescriptor;

/**
 * Loads the image a metadata row points at and turns it into a labeled {@link ImageRecord}.
 *
 * <p>Implementations must be safe to call from several build workers at once.</p>
 *
 * @since 0.1.0
 */
public interface ImageConverter {

  /**
   * Reads and inspects the image of {@code row}.
   *
   * @param row parsed metadata row
   * @return image with labels copied from the row
   * @throws ResourceConversionException if the image is missing, unreadable or in an unsupported format
   */
  ImageRecord convert(RowDescriptor row) throws ResourceConversionException;
}

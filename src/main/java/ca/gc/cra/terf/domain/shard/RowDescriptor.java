package ca.gc.cra.terf.domain.shard;

import java.util.Objects;

/**
 * One parsed row of the image metadata table.
 *
 * @param imagePath path of the source image as written in the table
 * @param imageId unique image id ({@code 0} when unknown)
 * @param labelId normalized label id
 * @param labelText human-readable normalized label
 * @param labelRaw raw (original) label id
 * @param sourceId id of the organization that produced the image
 * @since 0.1.0
 */
public record RowDescriptor(
    String imagePath,
    long imageId,
    long labelId,
    String labelText,
    long labelRaw,
    long sourceId) {

  public RowDescriptor {
    Objects.requireNonNull(imagePath, "imagePath");
    labelText = Objects.requireNonNullElse(labelText, "");
  }
}

package ca.gc.cra.terf.application.port;

import ca.gc.cra.terf.domain.shard.RowDescriptor;
import ca.gc.cra.terf.domain.shard.RowParseException;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes the image metadata table
 * ({@code image_path,image_id,label_id,label_text,label_raw,source}).
 *
 * @since 0.1.0
 */
public interface MetadataTable {

  /** Column names in table order. */
  List<String> HEADER = List.of("image_path", "image_id", "label_id", "label_text", "label_raw", "source");

  /**
   * Counts the data rows of {@code table}: every non-empty record after the header, whether or not
   * it parses into a {@link RowDescriptor}.
   *
   * @param table metadata file
   * @return number of data rows
   * @throws IOException if the file cannot be read, its header is invalid, or it is not valid CSV
   */
  long countRows(Path table) throws IOException;

  /**
   * Opens {@code table} for a single forward pass over its rows.
   *
   * @param table metadata file
   * @return cursor positioned after the header
   * @throws IOException if the file cannot be opened or its header is invalid
   */
  RowCursor read(Path table) throws IOException;

  /**
   * Creates {@code table} and writes the header row.
   *
   * @param table file to create; replaced if present
   * @return writer for data rows
   * @throws IOException if the file cannot be created
   */
  TableWriter write(Path table) throws IOException;

  /** Forward-only cursor over data rows. */
  interface RowCursor extends Closeable {

    /**
     * Parses the next row.
     *
     * @return next row, or empty at end of table
     * @throws RowParseException if the row is malformed; the cursor stays usable
     * @throws IOException if the file cannot be read or is not valid CSV
     */
    Optional<RowDescriptor> next() throws IOException, RowParseException;
  }

  /** Appends rows to a metadata table. */
  interface TableWriter extends Closeable {
    void writeRow(List<String> row) throws IOException;
  }
}

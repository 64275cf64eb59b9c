package ca.gc.cra.terf.infrastructure.csv;

import ca.gc.cra.terf.application.port.MetadataTable;
import ca.gc.cra.terf.domain.shard.RowDescriptor;
import ca.gc.cra.terf.domain.shard.RowParseException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * {@link MetadataTable} over comma-separated files, using Jackson's CSV dataformat.
 *
 * <p>The first column of the header must be {@code image_path}. Data rows must have exactly six
 * columns and integer id columns; anything else is a {@link RowParseException} for that row only.
 * Empty lines are ignored. Thread-safe: every cursor and writer owns its own parser or generator.</p>
 *
 * @since 0.1.0
 */
public final class CsvMetadataTable implements MetadataTable {
  private static final String BOM = "\uFEFF";

  private final CsvMapper mapper = CsvMapper.builder()
      .enable(CsvParser.Feature.WRAP_AS_ARRAY)
      .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
      .build();

  @Override
  public long countRows(Path table) throws IOException {
    long count = 0;
    try (MappingIterator<String[]> rows = open(table)) {
      while (rows.hasNextValue()) {
        rows.nextValue();
        count++;
      }
    }
    return count;
  }

  @Override
  public RowCursor read(Path table) throws IOException {
    return new CsvRowCursor(open(table));
  }

  private MappingIterator<String[]> open(Path table) throws IOException {
    BufferedReader reader = Files.newBufferedReader(table, StandardCharsets.UTF_8);
    try {
      MappingIterator<String[]> rows = mapper.readerFor(String[].class).readValues(reader);
      validateHeader(table, rows);
      return rows;
    } catch (IOException | RuntimeException ex) {
      try {
        reader.close();
      } catch (IOException closeFailure) {
        ex.addSuppressed(closeFailure);
      }
      throw ex;
    }
  }

  @Override
  public TableWriter write(Path table) throws IOException {
    BufferedWriter writer = Files.newBufferedWriter(table, StandardCharsets.UTF_8);
    SequenceWriter sequence = mapper.writerFor(String[].class).writeValues(writer);
    TableWriter tableWriter = new CsvTableWriter(sequence);
    tableWriter.writeRow(HEADER);
    return tableWriter;
  }

  /**
   * Parses one data row.
   *
   * @param rowNumber 1-based data row number used in error messages
   * @param columns raw column values
   * @return parsed row
   * @throws RowParseException if the row has the wrong shape or a non-integer id
   */
  static RowDescriptor parseRow(long rowNumber, String[] columns) throws RowParseException {
    if (columns.length != HEADER.size()) {
      throw new RowParseException(rowNumber,
          "expected " + HEADER.size() + " columns but found " + columns.length);
    }
    return new RowDescriptor(
        columns[0],
        parseId(rowNumber, HEADER.get(1), columns[1]),
        parseId(rowNumber, HEADER.get(2), columns[2]),
        columns[3],
        parseId(rowNumber, HEADER.get(4), columns[4]),
        parseId(rowNumber, HEADER.get(5), columns[5]));
  }

  private static long parseId(long rowNumber, String column, String raw) throws RowParseException {
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new RowParseException(rowNumber, column + " is not an integer: '" + raw + "'", ex);
    }
  }

  private static void validateHeader(Path table, MappingIterator<String[]> rows) throws IOException {
    if (!rows.hasNextValue()) {
      throw new IOException("Metadata table " + table + " is empty");
    }
    String[] header = rows.nextValue();
    String first = header.length == 0 ? "" : header[0];
    if (first.startsWith(BOM)) {
      first = first.substring(BOM.length());
    }
    if (!HEADER.get(0).equals(first)) {
      throw new IOException("Invalid header in " + table + ": first column must be "
          + HEADER.get(0) + " (was '" + first + "')");
    }
  }

  private static final class CsvRowCursor implements RowCursor {
    private final MappingIterator<String[]> rows;
    private long rowNumber;

    private CsvRowCursor(MappingIterator<String[]> rows) {
      this.rows = rows;
    }

    @Override
    public Optional<RowDescriptor> next() throws IOException, RowParseException {
      if (!rows.hasNextValue()) {
        return Optional.empty();
      }
      String[] columns = rows.nextValue();
      rowNumber++;
      return Optional.of(parseRow(rowNumber, columns));
    }

    @Override
    public void close() throws IOException {
      rows.close();
    }
  }

  private static final class CsvTableWriter implements TableWriter {
    private final SequenceWriter sequence;

    private CsvTableWriter(SequenceWriter sequence) {
      this.sequence = sequence;
    }

    @Override
    public void writeRow(List<String> row) throws IOException {
      sequence.write(row.toArray(String[]::new));
    }

    @Override
    public void close() throws IOException {
      sequence.close();
    }
  }
}

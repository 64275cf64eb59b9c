package ca.gc.cra.terf.infrastructure.csv;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.terf.application.port.MetadataTable;
import ca.gc.cra.terf.domain.shard.RowDescriptor;
import ca.gc.cra.terf.domain.shard.RowParseException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvMetadataTableTest {
  private static final String HEADER = "image_path,image_id,label_id,label_text,label_raw,source\n";

  @TempDir Path tempDir;

  private final CsvMetadataTable table = new CsvMetadataTable();

  @Test
  void readsRowsInOrder() throws IOException, RowParseException {
    Path csv = csv(HEADER
        + "a.jpg,1,2,cat,20,7\n"
        + "\n"
        + "\"dir/b, c.png\",2,3,\"tabby, orange\",30,8\n");

    try (MetadataTable.RowCursor cursor = table.read(csv)) {
      assertEquals(Optional.of(new RowDescriptor("a.jpg", 1, 2, "cat", 20, 7)), cursor.next());
      assertEquals(
          Optional.of(new RowDescriptor("dir/b, c.png", 2, 3, "tabby, orange", 30, 8)), cursor.next());
      assertTrue(cursor.next().isEmpty());
    }
    assertEquals(2, table.countRows(csv));
  }

  @Test
  void malformedRowsFailIndividually() throws IOException, RowParseException {
    Path csv = csv(HEADER
        + "a.jpg,1,2,cat,20,7\n"
        + "b.jpg,x,2,cat,20,7\n"
        + "c.jpg,1,2\n"
        + "d.jpg,4,2,dog,20, 9 \n");

    try (MetadataTable.RowCursor cursor = table.read(csv)) {
      assertTrue(cursor.next().isPresent());
      RowParseException badId = assertThrows(RowParseException.class, cursor::next);
      assertEquals(2, badId.rowNumber());
      assertTrue(badId.getMessage().contains("image_id"));
      RowParseException shortRow = assertThrows(RowParseException.class, cursor::next);
      assertEquals(3, shortRow.rowNumber());
      assertEquals(9L, cursor.next().orElseThrow().sourceId());
      assertTrue(cursor.next().isEmpty());
    }
    assertEquals(4, table.countRows(csv));
  }

  @Test
  void acceptsByteOrderMark() throws IOException {
    Path csv = csv("\uFEFF" + HEADER + "a.jpg,1,2,cat,20,7\n");
    assertEquals(1, table.countRows(csv));
  }

  @Test
  void rejectsBadHeaderOrEmptyFile() throws IOException {
    Path wrong = csv("path,id\na.jpg,1\n");
    IOException ex = assertThrows(IOException.class, () -> table.read(wrong));
    assertTrue(ex.getMessage().contains("image_path"));

    Path empty = csv("");
    assertThrows(IOException.class, () -> table.countRows(empty));
  }

  @Test
  void writerEmitsHeaderAndQuotesWhenNeeded() throws IOException, RowParseException {
    Path out = tempDir.resolve("info.csv");
    try (MetadataTable.TableWriter writer = table.write(out)) {
      writer.writeRow(List.of("out/1.jpeg", "1", "2", "cat, grey", "20", "7"));
    }

    List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
    assertEquals(HEADER.trim(), lines.get(0));
    assertEquals(2, lines.size());
    try (MetadataTable.RowCursor cursor = table.read(out)) {
      assertEquals("cat, grey", cursor.next().orElseThrow().labelText());
    }
  }

  private Path csv(String content) throws IOException {
    return Files.writeString(tempDir.resolve("meta.csv"), content, StandardCharsets.UTF_8);
  }
}

package ca.gc.cra.terf.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairsOnFirstEquals() {
    Map<String, String> map = CliArgsParser.toMap(
        new String[] {"in=meta.csv", "otelResourceAttributes=a=b,c=d", "perShard=10"});
    assertEquals("meta.csv", map.get("in"));
    assertEquals("a=b,c=d", map.get("otelResourceAttributes"));
    assertEquals("10", map.get("perShard"));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"in"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"in="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"a b=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"in=a\u0007"}));
  }

  @Test
  void controlCharactersAreRejectedBeforeTrimming() {
    IllegalArgumentException trailing = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"out=dir\u0007"}));
    assertTrue(trailing.getMessage().contains("control characters"));
    assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"name=\u001btrain"}));

    assertEquals("meta.csv", CliArgsParser.toMap(new String[] {"  in= meta.csv "}).get("in"));
  }

  @Test
  void cliInputSeparatesFlags() {
    CliInput input = CliInput.parse(new String[] {"in=x", "--Dry-Run", "-v", "--bogus", "out=y"});

    assertTrue(input.verbose());
    assertFalse(input.help());
    assertTrue(input.hasFlag("--dry-run"));
    assertEquals(List.of("in=x", "out=y"), List.of(input.keyValueArgs()));
    assertEquals(List.of("--bogus"), input.unknownFlags(Set.of("--dry-run")));
  }
}

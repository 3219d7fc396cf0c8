package ca.gc.cra.edgeingest.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void splitsOnFirstEqualsAndTrims() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {
        " activePath = /data/fw.log ", "line=a=b c", "", null, "outputDir=/out"});

    assertEquals("/data/fw.log", map.get("activePath"));
    assertEquals("a=b c", map.get("line"));
    assertEquals(List.of("activePath", "line", "outputDir"), List.copyOf(map.keySet()));
  }

  @Test
  void laterDuplicateWins() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"year=2023", "year=2024"});

    assertEquals("2024", map.get("year"));
  }

  @Test
  void nullArgsYieldEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"novalue"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"9key=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"line=a\0b"}));
  }
}

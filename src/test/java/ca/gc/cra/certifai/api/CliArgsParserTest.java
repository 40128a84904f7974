package ca.gc.cra.certifai.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {
        "artifact=src/p/A.java::p.A.run(int)", " notes=needs a second look ", "root=."});

    assertEquals(List.of("artifact", "notes", "root"), List.copyOf(map.keySet()));
    assertEquals("src/p/A.java::p.A.run(int)", map.get("artifact"));
    assertEquals("needs a second look", map.get("notes"));
  }

  @Test
  void splitsOnFirstEquals() {
    assertEquals("a=b", CliArgsParser.toMap(new String[] {"notes=a=b"}).get("notes"));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"key="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"notes=a\u0001b"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"root=a", "root=b"}));
  }

  @Test
  void ignoresNullAndBlankTokens() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
    assertEquals(Map.of("k", "v"), CliArgsParser.toMap(new String[] {null, " ", "k=v"}));
  }

  @Test
  void extractMovesCommandKeys() {
    Map<String, String> args = new LinkedHashMap<>(Map.of("artifact", "a::b", "root", "."));

    Map<String, String> extracted = CliArgsParser.extract(args, Set.of("artifact", "notes"));

    assertEquals(Map.of("artifact", "a::b"), extracted);
    assertEquals(Map.of("root", "."), args);
  }

  @Test
  void requireKnownNamesEveryUnknownKey() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.requireKnown(Map.of("root", ".", "zeta", "1", "alpha", "2"), Set.of("root")));

    assertEquals("unknown argument(s): alpha, zeta", ex.getMessage());
  }
}

package ca.gc.cra.lookout.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"sessionId=abc", " logRoot = /tmp/logs "});
    assertEquals("abc", map.get("sessionId"));
    assertEquals("/tmp/logs", map.get("logRoot"));
  }

  @Test
  void splitsOnFirstEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"otelResourceAttributes=env=dev,team=ops"});
    assertEquals("env=dev,team=ops", map.get("otelResourceAttributes"));
  }

  @Test
  void laterDuplicatesWin() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"pollMillis=10", "pollMillis=20"});
    assertEquals("20", map.get("pollMillis"));
  }

  @Test
  void skipsBlankAndNull() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
    assertTrue(CliArgsParser.toMap(new String[] {null, " "}).isEmpty());
  }

  @Test
  void rejectsInvalidArgs() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"out=a\u0007b"}));
  }
}

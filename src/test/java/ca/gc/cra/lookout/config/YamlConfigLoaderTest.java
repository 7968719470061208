package ca.gc.cra.lookout.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndModeSections() throws IOException {
    Path yaml = tempDir.resolve("lookout.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
          pollMillis: 50
        watch:
          includeExisting: true
          pollMillis: 25
        replay:
          pretty: false
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "watch");

    assertEquals("none", map.get("metricsExporter"));
    assertEquals("true", map.get("includeExisting"));
    assertEquals("25", map.get("pollMillis"), "mode section overrides common");
    assertFalse(map.containsKey("pretty"));
  }

  @Test
  void loadFlattensNestedMaps() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        replay:
          kafka:
            topic: session-records
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "replay");
    assertEquals("session-records", map.get("kafka.topic"));
  }

  @Test
  void sectionNamesAreCaseInsensitive() throws IOException {
    Path yaml = tempDir.resolve("case.yaml");
    Files.writeString(yaml, """
        Watch:
          sessionId: abc
        """);

    assertEquals("abc", YamlConfigLoader.load(yaml, "WATCH").get("sessionId"));
  }

  @Test
  void missingFileThrowsNoSuchFile() {
    assertThrows(NoSuchFileException.class,
        () -> YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "watch"));
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertTrue(YamlConfigLoader.load(yaml, "watch").isEmpty());
  }

  @Test
  void nullValuesBecomeBlank() throws IOException {
    Path yaml = tempDir.resolve("nulls.yaml");
    Files.writeString(yaml, """
        watch:
          directory:
        """);

    assertEquals("", YamlConfigLoader.load(yaml, "watch").get("directory"));
  }

  @Test
  void listsAreRejected() throws IOException {
    Path yaml = tempDir.resolve("lists.yaml");
    Files.writeString(yaml, """
        watch:
          directory:
            - /a
            - /b
        """);

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(yaml, "watch"));
    assertTrue(ex.getMessage().contains("directory"));
  }

  @Test
  void scalarRootIsRejected() throws IOException {
    Path yaml = tempDir.resolve("scalar.yaml");
    Files.writeString(yaml, "just a string\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "watch"));
  }

  @Test
  void malformedYamlIsReportedAsInvalidArgument() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "watch: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "watch"));
  }

  @Test
  void bundledSampleConfigLoads() throws IOException {
    Path yaml = tempDir.resolve("sample.yaml");
    try (InputStream in = getClass().getResourceAsStream("/config/lookout.yaml")) {
      Files.copy(in, yaml);
    }

    Map<String, String> watch = YamlConfigLoader.load(yaml, "watch");
    assertEquals("/tmp/lookout-projects", watch.get("logRoot"));
    assertEquals("/work/app", watch.get("workingDirectory"));
    assertEquals("5000", watch.get("dedupCapacity"));

    Map<String, String> replay = YamlConfigLoader.load(yaml, "replay");
    assertEquals("false", replay.get("pretty"));
    assertFalse(replay.containsKey("workingDirectory"));
  }
}

package ca.gc.cra.lookout.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void requireReadableFileReturnsRealPath() throws IOException {
    Path file = Files.writeString(tempDir.resolve("session.jsonl"), "{}\n");
    assertEquals(file.toRealPath(), Paths.requireReadableFile(file));
  }

  @Test
  void requireReadableFileRejectsMissingAndDirectories() {
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile(tempDir.resolve("absent")));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile(tempDir));
  }

  @Test
  void validateWritableFileCreatesParentsWhenRequested() {
    Path file = tempDir.resolve("out/nested/records.ndjson");
    Path validated = Paths.validateWritableFile(file, true);
    assertTrue(Files.isDirectory(validated.getParent()));
  }

  @Test
  void validateWritableFileRejectsDirectory() {
    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableFile(tempDir, true));
  }

  @Test
  void pathsWithControlCharactersAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> Paths.validateWritableFile(Path.of("bad\u0007name.ndjson"), false));
  }
}

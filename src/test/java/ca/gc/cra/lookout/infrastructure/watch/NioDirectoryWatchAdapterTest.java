package ca.gc.cra.lookout.infrastructure.watch;

import static ca.gc.cra.lookout.testutil.SessionLogFixtures.awaitCondition;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NioDirectoryWatchAdapterTest {
  @TempDir Path tempDir;

  @Test
  void reportsCreatedFiles() throws IOException {
    Set<Path> changed = ConcurrentHashMap.newKeySet();
    try (NioDirectoryWatchAdapter adapter = new NioDirectoryWatchAdapter()) {
      adapter.watch(tempDir, changed::add);
      adapter.watch(tempDir, changed::add);

      Path file = tempDir.resolve("session.jsonl");
      Files.writeString(file, "{}\n");

      Path expected = file.toAbsolutePath().normalize();
      assertTrue(awaitCondition(Duration.ofSeconds(15), () -> changed.contains(expected)),
          "expected a notification for " + expected);
    }
  }

  @Test
  void watchAfterCloseFails() throws IOException {
    NioDirectoryWatchAdapter adapter = new NioDirectoryWatchAdapter();
    adapter.close();
    adapter.close();

    assertThrows(IOException.class, () -> adapter.watch(tempDir, path -> { }));
  }
}

package ca.gc.cra.lookout.application.monitor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileDiscoveryTest {
  @TempDir Path tempDir;

  private final FileDiscovery discovery = new FileDiscovery("agent-");

  @Test
  void scanListsOnlyJsonlFilesOrderedByCreation() throws IOException {
    Path older = Files.writeString(tempDir.resolve("b.jsonl"), "");
    Path newer = Files.writeString(tempDir.resolve("a.jsonl"), "");
    Files.writeString(tempDir.resolve("notes.txt"), "");
    Files.createDirectories(tempDir.resolve("dir.jsonl"));
    Files.setLastModifiedTime(older, FileTime.from(Instant.now().minus(Duration.ofHours(2))));
    Files.setLastModifiedTime(newer, FileTime.from(Instant.now().minus(Duration.ofHours(1))));

    List<FileDiscovery.Candidate> candidates = discovery.scan(tempDir);

    assertEquals(2, candidates.size());
    assertEquals(older.toAbsolutePath(), candidates.get(0).path());
    assertEquals(newer.toAbsolutePath(), candidates.get(1).path());
  }

  @Test
  void scanOfMissingDirectoryIsEmpty() {
    assertTrue(discovery.scan(tempDir.resolve("absent")).isEmpty());
  }

  @Test
  void sidecarsAreClassifiedByPrefix() {
    assertTrue(discovery.isSidecar(Path.of("agent-1a2b.jsonl")));
    assertFalse(discovery.isSidecar(Path.of("0f6c.jsonl")));
    assertEquals("1a2b", discovery.subAgentId(Path.of("/x/agent-1a2b.jsonl")));
    assertEquals("0f6c", discovery.subAgentId(Path.of("/x/0f6c.jsonl")));
  }

  @Test
  void findSessionFileSearchesProjectDirectories() throws IOException {
    Path project = Files.createDirectories(tempDir.resolve("-work-app"));
    Path session = Files.writeString(project.resolve("abc.jsonl"), "");

    assertEquals(session.toAbsolutePath(), discovery.findSessionFile(tempDir, "abc").orElseThrow());
    assertTrue(discovery.findSessionFile(tempDir, "missing").isEmpty());
    assertTrue(discovery.findSessionFile(tempDir.resolve("absent"), "abc").isEmpty());
  }

  @Test
  void toleranceWindowAcceptsFilesCreatedShortlyBeforeStart() {
    Instant start = Instant.parse("2026-03-02T10:00:00Z");
    Duration tolerance = Duration.ofSeconds(2);

    assertTrue(FileDiscovery.createdSince(candidate(start.minusSeconds(2)), start, tolerance));
    assertTrue(FileDiscovery.createdSince(candidate(start.plusSeconds(5)), start, tolerance));
    assertFalse(FileDiscovery.createdSince(candidate(start.minusSeconds(3)), start, tolerance));
  }

  @Test
  void creationInstantIsEarliestOfBirthAndModification() throws IOException {
    Path file = Files.writeString(tempDir.resolve("c.jsonl"), "");
    Instant past = Instant.now().minus(Duration.ofDays(1));
    Files.setLastModifiedTime(file, FileTime.from(past));

    FileDiscovery.Candidate candidate = discovery.candidate(file).orElseThrow();

    assertFalse(candidate.createdAt().isAfter(past.plusMillis(1)));
  }

  private static FileDiscovery.Candidate candidate(Instant createdAt) {
    return new FileDiscovery.Candidate(Path.of("/x/s.jsonl"), createdAt, false);
  }
}

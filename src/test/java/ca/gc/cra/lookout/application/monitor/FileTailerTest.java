package ca.gc.cra.lookout.application.monitor;

import static ca.gc.cra.lookout.testutil.SessionLogFixtures.appendLines;
import static ca.gc.cra.lookout.testutil.SessionLogFixtures.appendRaw;
import static ca.gc.cra.lookout.testutil.SessionLogFixtures.userText;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lookout.application.events.BoundedDeduplicator;
import ca.gc.cra.lookout.application.events.RecordEventBus;
import ca.gc.cra.lookout.application.parse.RecordParser;
import ca.gc.cra.lookout.domain.events.MonitorDiagnostic;
import ca.gc.cra.lookout.domain.record.SessionRecord;
import ca.gc.cra.lookout.infrastructure.events.InMemoryRecordListener;
import ca.gc.cra.lookout.testutil.RecordingMetricsPort;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileTailerTest {
  @TempDir Path tempDir;

  private RecordingMetricsPort metrics;
  private InMemoryRecordListener sink;
  private FileTailer tailer;

  @BeforeEach
  void setUp() {
    metrics = new RecordingMetricsPort();
    sink = new InMemoryRecordListener();
    RecordEventBus bus = new RecordEventBus(new BoundedDeduplicator(1_000), metrics);
    bus.subscribe(sink);
    bus.onError(sink);
    tailer = new FileTailer(new RecordParser(), bus, metrics, 1024 * 1024);
  }

  @Test
  void emitsCompleteLinesAndKeepsPartialLineForNextRead() throws IOException {
    Path file = tempDir.resolve("s.jsonl");
    appendLines(file, userText("u-1", "s", "2026-03-02T10:00:00Z", "one"),
        userText("u-2", "s", "2026-03-02T10:00:01Z", "two"));
    String third = userText("u-3", "s", "2026-03-02T10:00:02Z", "three");
    appendRaw(file, third.substring(0, 20).getBytes(StandardCharsets.UTF_8));
    TrackedFile tracked = new TrackedFile(file, true, null, 0);

    FileTailer.ReadResult first = tailer.read(tracked, () -> true);

    assertEquals(2, first.emitted());
    assertEquals(Files.size(file), tracked.offset());
    assertEquals(20, tracked.pendingBytes());

    appendRaw(file, (third.substring(20) + "\n").getBytes(StandardCharsets.UTF_8));
    FileTailer.ReadResult second = tailer.read(tracked, () -> true);

    assertEquals(1, second.emitted());
    assertEquals(List.of("u-1", "u-2", "u-3"), sink.records().stream().map(SessionRecord::uuid).toList());
    assertEquals(0, tracked.pendingBytes());
  }

  @Test
  void readIsBoundedByMaxReadBytes() throws IOException {
    Path file = tempDir.resolve("s.jsonl");
    String line = userText("u-1", "s", "2026-03-02T10:00:00Z", "one");
    appendLines(file, line, userText("u-2", "s", "2026-03-02T10:00:01Z", "two"));
    FileTailer small = new FileTailer(new RecordParser(),
        new RecordEventBus(new BoundedDeduplicator(10), metrics), metrics, line.length() + 1);
    TrackedFile tracked = new TrackedFile(file, true, null, 0);

    FileTailer.ReadResult first = small.read(tracked, () -> true);
    FileTailer.ReadResult second = small.read(tracked, () -> true);
    FileTailer.ReadResult third = small.read(tracked, () -> true);

    assertEquals(line.length() + 1, first.bytesRead());
    assertEquals(1, first.lines());
    assertEquals(1, second.lines());
    assertEquals(FileTailer.ReadResult.EMPTY, third);
  }

  @Test
  void truncatedFileIsReadAgainFromStart() throws IOException {
    Path file = tempDir.resolve("s.jsonl");
    appendLines(file, userText("u-1", "s", "2026-03-02T10:00:00Z", "a long first line"),
        userText("u-2", "s", "2026-03-02T10:00:01Z", "second"));
    TrackedFile tracked = new TrackedFile(file, true, null, 0);
    tailer.read(tracked, () -> true);

    Files.writeString(file, userText("u-9", "s", "2026-03-02T10:05:00Z", "new") + "\n");
    FileTailer.ReadResult result = tailer.read(tracked, () -> true);

    assertEquals(1, result.emitted());
    assertEquals("u-9", sink.records().get(2).uuid());
    assertEquals(Files.size(file), tracked.offset());
    assertEquals(1, metrics.count("lookout.tail.truncated"));
  }

  @Test
  void malformedLineIsReportedAndSkipped() throws IOException {
    Path file = tempDir.resolve("s.jsonl");
    appendLines(file, "{not json", userText("u-1", "s", "2026-03-02T10:00:00Z", "ok"),
        "{\"type\":\"progress\",\"uuid\":\"p\"}", "   ");
    TrackedFile tracked = new TrackedFile(file, true, null, 0);

    FileTailer.ReadResult result = tailer.read(tracked, () -> true);

    assertEquals(1, result.emitted());
    assertEquals(1, result.parseFailures());
    assertEquals(3, result.lines());
    assertEquals(1, sink.diagnostics().size());
    assertEquals(MonitorDiagnostic.Kind.PARSE, sink.diagnostics().get(0).kind());
    assertEquals(file, sink.diagnostics().get(0).path());
    assertEquals(1, metrics.count("lookout.tail.parseFailed"));
  }

  @Test
  void sidecarRecordsAreTaggedAsSubAgent() throws IOException {
    Path file = tempDir.resolve("agent-abc.jsonl");
    appendLines(file, userText("u-1", "s", "2026-03-02T10:00:00Z", "from agent"));
    TrackedFile tracked = new TrackedFile(file, false, "abc", 0);

    tailer.read(tracked, () -> true);

    SessionRecord record = sink.records().get(0);
    assertTrue(record.subAgent());
    assertEquals("abc", record.header().agentId());
  }

  @Test
  void sidecarRecordsOfAnotherSessionAreDropped() throws IOException {
    Path file = tempDir.resolve("agent-abc.jsonl");
    appendLines(file,
        userText("u-1", "s", "2026-03-02T10:00:00Z", "mine"),
        userText("u-2", "other", "2026-03-02T10:00:01Z", "not mine"),
        "{\"type\":\"user\",\"uuid\":\"u-3\",\"timestamp\":\"2026-03-02T10:00:02Z\","
            + "\"message\":{\"role\":\"user\",\"content\":\"no session\"}}");
    TrackedFile tracked = new TrackedFile(file, false, "abc", 0);

    FileTailer.ReadResult result = tailer.read(tracked, () -> true, "s");

    assertEquals(2, result.emitted());
    assertEquals(List.of("u-1", "u-3"), sink.records().stream().map(SessionRecord::uuid).toList());
    assertEquals(1, metrics.count("lookout.tail.foreignDropped"));
    assertEquals(Files.size(file), tracked.offset());
  }

  @Test
  void primaryRecordsAreNeverFilteredBySession() throws IOException {
    Path file = tempDir.resolve("s.jsonl");
    appendLines(file, userText("u-1", "other", "2026-03-02T10:00:00Z", "kept"));
    TrackedFile tracked = new TrackedFile(file, true, null, 0);

    tailer.read(tracked, () -> true, "s");

    assertEquals(1, sink.records().size());
    assertEquals(0, metrics.count("lookout.tail.foreignDropped"));
  }

  @Test
  void linesConsumedWhileNotAcceptingAreNotEmitted() throws IOException {
    Path file = tempDir.resolve("s.jsonl");
    appendLines(file, userText("u-1", "s", "2026-03-02T10:00:00Z", "x"));
    TrackedFile tracked = new TrackedFile(file, true, null, 0);

    FileTailer.ReadResult result = tailer.read(tracked, () -> false);

    assertEquals(0, result.emitted());
    assertTrue(sink.records().isEmpty());
    assertEquals(Files.size(file), tracked.offset());
  }

  @Test
  void initialOffsetSkipsExistingContent() throws IOException {
    Path file = tempDir.resolve("s.jsonl");
    appendLines(file, userText("u-1", "s", "2026-03-02T10:00:00Z", "old"));
    TrackedFile tracked = new TrackedFile(file, true, null, Files.size(file));
    appendLines(file, userText("u-2", "s", "2026-03-02T10:00:01Z", "new"));

    tailer.read(tracked, () -> true);

    assertEquals(List.of("u-2"), sink.records().stream().map(SessionRecord::uuid).toList());
  }

  @Test
  void missingFileFailsWithoutMovingOffset() {
    TrackedFile tracked = new TrackedFile(tempDir.resolve("gone.jsonl"), true, null, 0);

    assertThrows(NoSuchFileException.class, () -> tailer.read(tracked, () -> true));
    assertEquals(0, tracked.offset());
  }
}

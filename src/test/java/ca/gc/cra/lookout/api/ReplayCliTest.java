package ca.gc.cra.lookout.api;

import static ca.gc.cra.lookout.testutil.SessionLogFixtures.FIXTURE_SESSION;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lookout.testutil.SessionLogFixtures;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ReplayCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private StringWriter buffer;
  private Path project;

  @BeforeEach
  void setUp() throws IOException {
    logger = (Logger) LoggerFactory.getLogger(ReplayCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
    project = SessionLogFixtures.copyFixtureProject(tempDir.resolve("projects"));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
      appender.stop();
      logger.setAdditive(originalAdditive);
      logger.setLevel(originalLevel);
    }
    CliPrinter.clearTestWriter();
  }

  @Test
  void replayByFilePrintsCompactReport() {
    ExitCode code = ReplayCli.run(new String[] {
        "file=" + project.resolve(FIXTURE_SESSION + ".jsonl"), "pretty=false"});

    assertEquals(ExitCode.SUCCESS, code);
    String report = buffer.toString().trim();
    assertTrue(report.startsWith("{"));
    assertFalse(report.contains("\n"), "compact report is a single line");
    assertTrue(report.contains("\"totalRecords\":10"));
    assertTrue(report.contains("\"calls\":4"));
    assertTrue(report.contains("\"agentId\":\"5d1e9c\""));
    assertFalse(report.contains("Unrelated"));
  }

  @Test
  void replayBySessionIdSearchesLogRoot() {
    ExitCode code = ReplayCli.run(new String[] {
        "sessionId=" + FIXTURE_SESSION, "logRoot=" + tempDir.resolve("projects")});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains(FIXTURE_SESSION));
  }

  @Test
  void replayWritesRecordsToOutFile() throws IOException {
    Path out = tempDir.resolve("out").resolve("records.ndjson");

    ExitCode code = ReplayCli.run(new String[] {
        "file=" + project.resolve(FIXTURE_SESSION + ".jsonl"), "out=" + out});

    assertEquals(ExitCode.SUCCESS, code);
    List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
    assertEquals(10, lines.size());
    assertTrue(lines.get(0).contains("\"schemaVersion\""));
  }

  @Test
  void unknownSessionReturnsIoError() {
    ExitCode code = ReplayCli.run(new String[] {
        "sessionId=does-not-exist", "logRoot=" + tempDir.resolve("projects")});

    assertEquals(ExitCode.IO_ERROR, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("Session log not found")));
  }

  @Test
  void missingFileReturnsConfigError() {
    ExitCode code = ReplayCli.run(new String[] {"file=" + tempDir.resolve("absent.jsonl")});

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void fileAndSessionIdTogetherAreRejected() {
    ExitCode code = ReplayCli.run(new String[] {"file=/tmp/a.jsonl", "sessionId=abc"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: replay"));
  }

  @Test
  void neitherFileNorSessionIdIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, ReplayCli.run(new String[0]));
  }
}

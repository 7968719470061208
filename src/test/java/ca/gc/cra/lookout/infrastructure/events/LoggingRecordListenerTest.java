package ca.gc.cra.lookout.infrastructure.events;

import static ca.gc.cra.lookout.testutil.SessionLogFixtures.assistantToolUse;
import static ca.gc.cra.lookout.testutil.SessionLogFixtures.toolResult;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lookout.application.parse.RecordParser;
import ca.gc.cra.lookout.testutil.RecordingMetricsPort;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingRecordListenerTest {
  private final RecordParser parser = new RecordParser();
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(LoggingRecordListener.class);
    originalLevel = logger.getLevel();
    logger.setLevel(Level.DEBUG);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setLevel(originalLevel);
  }

  @Test
  void countsPerTypeAndLogsSummary() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    LoggingRecordListener listener = new LoggingRecordListener(metrics);

    listener.onRecord(parser.parse(
        assistantToolUse("a-1", "s-1", "2026-03-02T10:00:01Z", "toolu_1", "Bash")).orElseThrow());
    listener.onRecord(parser.parse(
        toolResult("u-2", "s-1", "2026-03-02T10:00:02Z", "toolu_1", true)).orElseThrow());

    assertEquals(1, metrics.count("lookout.records.assistant"));
    assertEquals(1, metrics.count("lookout.records.user"));
    assertEquals(2, appender.list.size());
    String first = appender.list.get(0).getFormattedMessage();
    assertTrue(first.contains("type=assistant"));
    assertTrue(first.contains("tool=Bash#toolu_1"));
    assertTrue(first.contains("tokens=14"));
    assertTrue(appender.list.get(1).getFormattedMessage().contains("result=toolu_1(error)"));
  }

  @Test
  void customPrefixAndQuietAtInfo() {
    logger.setLevel(Level.INFO);
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    LoggingRecordListener listener = new LoggingRecordListener(metrics, "watch.records");

    listener.onRecord(parser.parse("{\"type\":\"summary\",\"summary\":\"Done\"}").orElseThrow());

    assertEquals(1, metrics.count("watch.records.summary"));
    assertTrue(appender.list.isEmpty());
  }
}

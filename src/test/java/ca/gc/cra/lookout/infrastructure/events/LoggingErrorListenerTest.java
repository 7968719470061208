package ca.gc.cra.lookout.infrastructure.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lookout.domain.events.MonitorDiagnostic;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingErrorListenerTest {
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(LoggingErrorListener.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
  }

  @Test
  void parseDiagnosticsOmitStackTrace() {
    new LoggingErrorListener().onError(MonitorDiagnostic.of(
        MonitorDiagnostic.Kind.PARSE, Path.of("/logs/s.jsonl"), "unexpected token", new IOException("boom")));

    ILoggingEvent event = appender.list.get(0);
    assertEquals(Level.WARN, event.getLevel());
    assertTrue(event.getFormattedMessage().contains("monitor.PARSE"));
    assertTrue(event.getFormattedMessage().contains("unexpected token"));
    assertNull(event.getThrowableProxy());
  }

  @Test
  void ioDiagnosticsKeepCause() {
    new LoggingErrorListener().onError(MonitorDiagnostic.of(
        MonitorDiagnostic.Kind.IO, Path.of("/logs/s.jsonl"), "read failed", new IOException("denied")));

    ILoggingEvent event = appender.list.get(0);
    assertNotNull(event.getThrowableProxy());
    assertEquals("denied", event.getThrowableProxy().getMessage());
  }
}

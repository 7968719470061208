package ca.gc.cra.lookout.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private Logger root;
  private Logger application;
  private Level originalRoot;
  private Level originalApplication;

  @BeforeEach
  void setUp() {
    root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    application = (Logger) LoggerFactory.getLogger(LoggingConfigurator.APPLICATION_LOGGER);
    originalRoot = root.getLevel();
    originalApplication = application.getLevel();
  }

  @AfterEach
  void tearDown() {
    root.setLevel(originalRoot);
    application.setLevel(originalApplication);
  }

  @Test
  void verboseRaisesRootAndApplicationToDebug() {
    LoggingConfigurator.configure(true);

    assertEquals(Level.DEBUG, root.getLevel());
    assertEquals(Level.DEBUG, application.getLevel());
  }

  @Test
  void defaultKeepsApplicationAtInfo() {
    LoggingConfigurator.configure(false);

    assertEquals(Level.INFO, application.getLevel());
  }
}

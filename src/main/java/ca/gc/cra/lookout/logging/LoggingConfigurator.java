package ca.gc.cra.lookout.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.function.Consumer;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts LOOKOUT log levels from CLI flags.
 * <p><strong>Why:</strong> Operators troubleshooting a session need per-read detail without editing
 * {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for the CLI bootstrap thread.</p>
 *
 * @implNote Only Logback supports dynamic levels; other SLF4J backends keep their configuration and a warning
 * is logged.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  static final String APPLICATION_LOGGER = "ca.gc.cra.lookout";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Applies the requested verbosity: DEBUG for the root and application loggers when {@code verbose},
   * otherwise INFO for the application logger.
   *
   * @param verbose {@code true} to enable debug output
   */
  public static void configure(boolean verbose) {
    if (verbose) {
      enableVerboseLogging();
      return;
    }
    withContext(context -> context.getLogger(APPLICATION_LOGGER).setLevel(Level.INFO));
  }

  /** Elevates the root and application loggers to DEBUG within the running JVM. */
  public static void enableVerboseLogging() {
    withContext(context -> {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!Level.DEBUG.equals(root.getLevel())) {
        root.setLevel(Level.DEBUG);
      }
      context.getLogger(APPLICATION_LOGGER).setLevel(Level.DEBUG);
    });
  }

  private static void withContext(Consumer<LoggerContext> action) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      action.accept(context);
      return;
    }
    log.warn("Log level change requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }
}
